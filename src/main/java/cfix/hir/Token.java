package cfix.hir;

/**
 * One lexical token. A token only records where it lives in the source of
 * its {@link TokenList}; the text is always recovered through the list.
 */
public final class Token {

    private final TokenKind kind;

    private final int offset;

    private final int length;

    public Token(TokenKind kind, int offset, int length) {
        this.kind = kind;
        this.offset = offset;
        this.length = length;
    }

    public TokenKind getKind() {
        return kind;
    }

    /** Character offset of the first character in the source. */
    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    /** Offset one past the last character. */
    public int getEnd() {
        return offset + length;
    }

    @Override
    public String toString() {
        return kind + "@" + offset + "+" + length;
    }
}
