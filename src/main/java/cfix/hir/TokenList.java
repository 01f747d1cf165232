package cfix.hir;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered token stream of one source unit. The list owns the source text;
 * every later stage addresses tokens by their index in this list.
 */
public class TokenList {

    private final String source;

    private final List<Token> tokens;

    public TokenList(String source) {
        this.source = source;
        this.tokens = new ArrayList<Token>();
    }

    /** Appends a token; only the tokenizer builds lists. */
    public void add(Token token) {
        tokens.add(token);
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public TokenKind getKind(int index) {
        return tokens.get(index).getKind();
    }

    public boolean is(int index, TokenKind kind) {
        return index >= 0 && index < tokens.size() &&
                tokens.get(index).getKind() == kind;
    }

    public String getSource() {
        return source;
    }

    /**
    * Returns the raw source text of the token at the given index, exactly as
    * it appears in the input.
    */
    public String getText(int index) {
        Token t = tokens.get(index);
        return source.substring(t.getOffset(), t.getEnd());
    }

    /**
    * Returns the raw source text covering tokens {@code [start, end)}.
    */
    public String getText(int start, int end) {
        if (start >= end) {
            return "";
        }
        return source.substring(tokens.get(start).getOffset(),
                tokens.get(end - 1).getEnd());
    }

    /**
    * Returns the spelling of the token after trigraph replacement and line
    * splicing, which is what names and keywords are compared against.
    */
    public String getSpelling(int index) {
        return TokenTools.spell(getText(index));
    }

    /** Checks if the token at the index is spelled as the given word. */
    public boolean matches(int index, String word) {
        if (index < 0 || index >= tokens.size()) {
            return false;
        }
        Token t = tokens.get(index);
        if (t.getLength() == word.length()) {
            return source.regionMatches(t.getOffset(), word, 0, word.length());
        }
        return t.getLength() > word.length() && getSpelling(index).equals(word);
    }

    @Override
    public String toString() {
        return getText(0, tokens.size());
    }
}
