package cfix.hir;

/**
* <b>TokenTools</b> provides the token navigation helpers shared by the
* parsers, the analyses, and the rewriters. All positions are token indices;
* a "limit" is the exclusive bound of the range being examined.
*/
public final class TokenTools {

    private TokenTools() {
    }

    /**
    * Returns the character a trigraph {@code ??c} stands for, or 0 if
    * {@code ??c} is not a trigraph.
    */
    public static char trigraph(char c) {
        switch (c) {
        case '=':  return '#';
        case '(':  return '[';
        case '/':  return '\\';
        case ')':  return ']';
        case '\'': return '^';
        case '<':  return '{';
        case '!':  return '|';
        case '>':  return '}';
        case '-':  return '~';
        default:   return 0;
        }
    }

    /**
    * Applies translation phases 1 and 2 to the given raw text: trigraphs are
    * replaced first, then backslash-newline pairs are removed.
    *
    * @param raw the raw source text.
    * @return the logical spelling.
    */
    public static String spell(String raw) {
        if (raw.indexOf('?') < 0 && raw.indexOf('\\') < 0) {
            return raw;
        }
        StringBuilder phase1 = new StringBuilder(raw.length());
        int n = raw.length();
        for (int i = 0; i < n; i++) {
            char c = raw.charAt(i);
            if (c == '?' && i + 2 < n && raw.charAt(i + 1) == '?') {
                char t = trigraph(raw.charAt(i + 2));
                if (t != 0) {
                    phase1.append(t);
                    i += 2;
                    continue;
                }
            }
            phase1.append(c);
        }
        StringBuilder phase2 = new StringBuilder(phase1.length());
        n = phase1.length();
        for (int i = 0; i < n; i++) {
            char c = phase1.charAt(i);
            if (c == '\\') {
                if (i + 1 < n && phase1.charAt(i + 1) == '\n') {
                    i++;
                    continue;
                }
                if (i + 2 < n && phase1.charAt(i + 1) == '\r' &&
                        phase1.charAt(i + 2) == '\n') {
                    i += 2;
                    continue;
                }
            }
            phase2.append(c);
        }
        return phase2.toString();
    }

    /**
    * Returns the index of the first token at or after {@code from} that is
    * not whitespace or a comment, or {@code limit} if there is none.
    */
    public static int nextSignificant(TokenList tokens, int from, int limit) {
        int i = from;
        while (i < limit && tokens.getKind(i).isTrivia()) {
            i++;
        }
        return i;
    }

    /**
    * Returns the index of the last token before {@code from} and not before
    * {@code lowerBound} that is not whitespace or a comment, or
    * {@code lowerBound - 1} if there is none.
    */
    public static int previousSignificant(TokenList tokens, int from,
            int lowerBound) {
        int i = from - 1;
        while (i >= lowerBound && tokens.getKind(i).isTrivia()) {
            i--;
        }
        return (i >= lowerBound) ? i : lowerBound - 1;
    }

    /**
    * Finds the token closing the group opened at {@code open}, which must be
    * a parenthesis, bracket, or brace.
    *
    * @return the index of the matching closer, or {@code limit} if the group
    *       is not closed within the range.
    */
    public static int findMatching(TokenList tokens, int open, int limit) {
        TokenKind opener = tokens.getKind(open);
        TokenKind closer;
        if (opener == TokenKind.LPAREN) {
            closer = TokenKind.RPAREN;
        } else if (opener == TokenKind.LBRACKET) {
            closer = TokenKind.RBRACKET;
        } else if (opener == TokenKind.LBRACE) {
            closer = TokenKind.RBRACE;
        } else {
            throw new IllegalArgumentException("not a group opener: " +
                    opener);
        }
        int depth = 0;
        for (int i = open; i < limit; i++) {
            TokenKind k = tokens.getKind(i);
            if (k == opener) {
                depth++;
            } else if (k == closer) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return limit;
    }

    /**
    * Returns the end of the range after dropping trailing whitespace and
    * comments.
    */
    public static int trimEnd(TokenList tokens, int start, int end) {
        return previousSignificant(tokens, end, start) + 1;
    }

    /**
    * Returns the raw text of the significant part of {@code [start, end)}.
    */
    public static String trimmedText(TokenList tokens, int start, int end) {
        int s = nextSignificant(tokens, start, end);
        int e = trimEnd(tokens, s, end);
        return tokens.getText(s, e);
    }

    /** Collapses every whitespace run in the text to a single blank. */
    public static String collapseWhitespace(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    /**
    * Returns the index of the first {@code ;} at parenthesis depth zero at or
    * after {@code from}, or {@code limit} if a brace or the limit is reached
    * first.
    */
    public static int findStatementEnd(TokenList tokens, int from, int limit) {
        int depth = 0;
        for (int i = from; i < limit; i++) {
            TokenKind k = tokens.getKind(i);
            if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET) {
                depth++;
            } else if (k == TokenKind.RPAREN || k == TokenKind.RBRACKET) {
                if (depth > 0) {
                    depth--;
                }
            } else if (depth == 0) {
                if (k == TokenKind.SEMICOLON) {
                    return i;
                }
                if (k == TokenKind.LBRACE || k == TokenKind.RBRACE) {
                    return limit;
                }
            }
        }
        return limit;
    }

    /**
    * Returns the index of the first significant token of the statement that
    * contains {@code pos}: the token after the nearest preceding {@code ;},
    * <code>{</code>, or <code>}</code> at or after {@code lowerBound}.
    */
    public static int findStatementStart(TokenList tokens, int pos,
            int lowerBound) {
        int i = pos;
        while (i > lowerBound) {
            TokenKind k = tokens.getKind(i - 1);
            if (k == TokenKind.SEMICOLON || k == TokenKind.LBRACE ||
                    k == TokenKind.RBRACE) {
                break;
            }
            i--;
        }
        return nextSignificant(tokens, i, pos + 1);
    }

    /**
    * Checks if the token at {@code index} sits inside the parenthesized
    * condition of an {@code if} or {@code while} statement of the current
    * statement.
    */
    public static boolean isInsideCondition(TokenList tokens, int index,
            int lowerBound) {
        int depth = 0;
        for (int i = index - 1; i >= lowerBound; i--) {
            TokenKind k = tokens.getKind(i);
            if (k == TokenKind.RPAREN) {
                depth++;
            } else if (k == TokenKind.LPAREN) {
                if (depth > 0) {
                    depth--;
                } else {
                    int prev = previousSignificant(tokens, i, lowerBound);
                    if (prev >= lowerBound &&
                            (tokens.is(prev, TokenKind.KEYWORD_IF) ||
                            tokens.is(prev, TokenKind.KEYWORD_WHILE))) {
                        return true;
                    }
                }
            } else if (k == TokenKind.SEMICOLON || k == TokenKind.LBRACE ||
                    k == TokenKind.RBRACE) {
                return false;
            }
        }
        return false;
    }

    /**
    * Counts the top-level comma-separated arguments in the parenthesized
    * group {@code [open, close]}; an empty group has zero arguments.
    */
    public static int countArguments(TokenList tokens, int open, int close) {
        if (nextSignificant(tokens, open + 1, close) >= close) {
            return 0;
        }
        int count = 1;
        int depth = 0;
        for (int i = open + 1; i < close; i++) {
            TokenKind k = tokens.getKind(i);
            if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET ||
                    k == TokenKind.LBRACE) {
                depth++;
            } else if (k == TokenKind.RPAREN || k == TokenKind.RBRACKET ||
                    k == TokenKind.RBRACE) {
                depth--;
            } else if (k == TokenKind.COMMA && depth == 0) {
                count++;
            }
        }
        return count;
    }

    /**
    * Returns the trimmed text of the top-level argument at {@code index} in
    * the parenthesized group {@code [open, close]}, or null if there is none.
    */
    public static String argumentText(TokenList tokens, int open, int close,
            int index) {
        int depth = 0;
        int n = 0;
        int from = open + 1;
        for (int i = open + 1; i <= close; i++) {
            TokenKind k = (i == close) ? TokenKind.COMMA : tokens.getKind(i);
            if (k == TokenKind.LPAREN || k == TokenKind.LBRACKET ||
                    k == TokenKind.LBRACE) {
                depth++;
            } else if (k == TokenKind.RPAREN || k == TokenKind.RBRACKET ||
                    k == TokenKind.RBRACE) {
                depth--;
            } else if (k == TokenKind.COMMA && depth == 0) {
                if (n == index) {
                    if (nextSignificant(tokens, from, i) >= i) {
                        return null;
                    }
                    return trimmedText(tokens, from, i);
                }
                n++;
                from = i + 1;
            }
        }
        return null;
    }
}
