package cfix.transforms;

import cfix.hir.*;

/**
 * Splits a function header into its parts and rebuilds it for the
 * error-code calling convention, where every function returns an
 * {@code int} status and delivers its former result through a trailing
 * {@code out} pointer parameter.
 */
public class SignatureRewriter {

    /** Name of the parameter that receives the former return value. */
    public static final String OUT_PARAM = "out";

    /** The parts of a function header, each kept as raw source text. */
    public static final class Signature {

        private final int start;

        private final int end;

        private final String prefix;

        private final String storage;

        private final String return_type;

        private final String name;

        private final String params;

        private final String tail;

        private final boolean knr;

        Signature(int start, int end, String prefix, String storage,
                String return_type, String name, String params, String tail,
                boolean knr) {
            this.start = start;
            this.end = end;
            this.prefix = prefix;
            this.storage = storage;
            this.return_type = return_type;
            this.name = name;
            this.params = params;
            this.tail = tail;
            this.knr = knr;
        }

        /** First token of the header. */
        public int getStartToken() {
            return start;
        }

        /** Exclusive end of the header, without trailing whitespace. */
        public int getEndToken() {
            return end;
        }

        /** Attribute lists before the declaration, with their spacing. */
        public String getPrefix() {
            return prefix;
        }

        /** Storage and function specifiers, with their spacing. */
        public String getStorage() {
            return storage;
        }

        public String getReturnType() {
            return return_type;
        }

        public String getName() {
            return name;
        }

        /** The raw text between the parameter parentheses. */
        public String getParameters() {
            return params;
        }

        /** Everything after the parameter list. */
        public String getTail() {
            return tail;
        }

        /** True for an identifier list followed by parameter declarations. */
        public boolean isKnr() {
            return knr;
        }

        public boolean returnsVoid() {
            return TokenTools.collapseWhitespace(return_type).equals("void");
        }

        /** A pointer return takes precedence over everything else. */
        public boolean returnsPointer() {
            return return_type.indexOf('*') >= 0;
        }

        public boolean returnsPlainInt() {
            String t = TokenTools.collapseWhitespace(return_type);
            return t.equals("int") || t.equals("signed") ||
                    t.equals("signed int") || t.equals("int signed");
        }

        /** Returns the transform this header needs once marked. */
        public RefactorType getRefactorType() {
            if (returnsPointer()) {
                return RefactorType.RETURN_TO_ARGUMENT;
            }
            if (returnsPlainInt()) {
                return RefactorType.NONE;
            }
            if (returnsVoid()) {
                return RefactorType.VOID_TO_INT;
            }
            return RefactorType.RETURN_TO_ARGUMENT;
        }

        @Override
        public String toString() {
            return return_type + " " + name + "(" + params + ")";
        }
    }

    private SignatureRewriter() {
    }

    /**
    * Decomposes the header in tokens {@code [start, end)}, where {@code end}
    * is usually the opening brace of the body.
    *
    * @throws UnsupportedInput if the header has no parameter list, no name,
    *       or no return type.
    */
    public static Signature decompose(TokenList tokens, int start, int end) {
        int first = TokenTools.nextSignificant(tokens, start, end);
        int stop = TokenTools.trimEnd(tokens, first, end);
        if (first >= stop) {
            throw new UnsupportedInput("empty function header");
        }
        int i = skipAttributes(tokens, first, stop);
        String prefix = tokens.getText(first, i);
        int storage_start = i;
        while (i < stop && isStorageWord(tokens.getKind(i))) {
            i = TokenTools.nextSignificant(tokens, i + 1, stop);
        }
        String storage = tokens.getText(storage_start, i);
        int type_start = i;

        int open = -1;
        for (int j = type_start; j < stop; j++) {
            if (tokens.is(j, TokenKind.LPAREN)) {
                open = j;
                break;
            }
        }
        if (open < 0) {
            throw new UnsupportedInput("no parameter list in " +
                    tokens.getText(first, stop));
        }
        int name_token = TokenTools.previousSignificant(tokens, open,
                type_start);
        if (name_token < type_start ||
                !tokens.is(name_token, TokenKind.IDENTIFIER)) {
            throw new UnsupportedInput("no function name in " +
                    tokens.getText(first, stop));
        }
        String return_type = TokenTools.trimmedText(tokens, type_start,
                name_token);
        if (return_type.isEmpty()) {
            throw new UnsupportedInput("no return type for " +
                    tokens.getSpelling(name_token));
        }
        int close = TokenTools.findMatching(tokens, open, stop);
        if (close >= stop) {
            throw new UnsupportedInput("unterminated parameter list of " +
                    tokens.getSpelling(name_token));
        }
        String params = tokens.getText(open + 1, close);
        String tail = tokens.getText(close + 1, stop);
        boolean knr = !tail.trim().isEmpty() && tail.trim().endsWith(";") &&
                isIdentifierList(tokens, open, close);
        return new Signature(first, stop, prefix, storage, return_type,
                tokens.getSpelling(name_token), params, tail, knr);
    }

    /**
    * Returns the replacement text for the header in tokens
    * {@code [start, end)}; the text replaces {@code [start, e)} where
    * {@code e} is the header end without trailing whitespace.
    *
    * @throws UnsupportedInput if the header cannot be decomposed.
    */
    public static String rewrite(TokenList tokens, int start, int end) {
        Signature sig = decompose(tokens, start, end);
        if (sig.getRefactorType() == RefactorType.NONE) {
            return tokens.getText(sig.getStartToken(), sig.getEndToken());
        }
        return rewrite(sig);
    }

    /** Rebuilds the given header with an int return. */
    public static String rewrite(Signature sig) {
        StringBuilder sb = new StringBuilder(80);
        sb.append(sig.getPrefix()).append(sig.getStorage());
        sb.append("int ").append(sig.getName()).append("(");
        switch (sig.getRefactorType()) {
        case NONE:
            throw new IllegalArgumentException("signature needs no rewrite: " +
                    sig);
        case VOID_TO_INT:
            sb.append(sig.getParameters()).append(")").append(sig.getTail());
            break;
        default:
            String t = sig.getReturnType();
            String p = sig.getParameters().trim();
            if (sig.isKnr()) {
                sb.append(sig.getParameters()).append(", ").append(OUT_PARAM);
                sb.append(")").append(sig.getTail());
                sb.append("\n").append(t).append(" *").append(OUT_PARAM);
                sb.append(";");
            } else if (p.isEmpty() || p.equals("void")) {
                sb.append(t).append(" *").append(OUT_PARAM).append(")");
                sb.append(sig.getTail());
            } else {
                sb.append(sig.getParameters()).append(", ").append(t);
                sb.append(" *").append(OUT_PARAM).append(")");
                sb.append(sig.getTail());
            }
            break;
        }
        return sb.toString();
    }

    private static boolean isStorageWord(TokenKind k) {
        switch (k) {
        case KEYWORD_STATIC:
        case KEYWORD_EXTERN:
        case KEYWORD_INLINE:
        case KEYWORD_NORETURN:
        case KEYWORD_THREAD_LOCAL:
        case KEYWORD_GNU_INLINE:
        case KEYWORD_GNU_INLINE2:
            return true;
        default:
            return false;
        }
    }

    /** Skips {@code [[...]]} lists and GNU attributes. */
    private static int skipAttributes(TokenList tokens, int i, int stop) {
        while (i < stop) {
            int open;
            if (tokens.is(i, TokenKind.LBRACKET) && tokens.is(
                    TokenTools.nextSignificant(tokens, i + 1, stop),
                    TokenKind.LBRACKET)) {
                open = i;
            } else if (tokens.matches(i, "__attribute__") ||
                    tokens.matches(i, "__declspec")) {
                open = TokenTools.nextSignificant(tokens, i + 1, stop);
                if (!tokens.is(open, TokenKind.LPAREN)) {
                    return i;
                }
            } else {
                return i;
            }
            int close = TokenTools.findMatching(tokens, open, stop);
            if (close >= stop) {
                return i;
            }
            i = TokenTools.nextSignificant(tokens, close + 1, stop);
        }
        return i;
    }

    private static boolean isIdentifierList(TokenList tokens, int open,
            int close) {
        boolean seen = false;
        for (int i = open + 1; i < close; i++) {
            TokenKind k = tokens.getKind(i);
            if (k.isTrivia() || k == TokenKind.COMMA) {
                continue;
            }
            if (k != TokenKind.IDENTIFIER) {
                return false;
            }
            seen = true;
        }
        return seen;
    }
}
