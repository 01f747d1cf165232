package cfix.transforms;

import cfix.base.grammars.DeclaratorParser;
import cfix.hir.*;

import java.util.*;

/**
 * Produces the patches that harden one function body: failure guards after
 * unchecked allocations, status propagation around calls to refactored
 * functions, and return statements adapted to the new convention.
 */
public class BodyRewriter {

    /** Status returned when an allocation fails. */
    public static final String ERROR_CODE = "ENOMEM";

    /** Name of the status variable injected into rewritten bodies. */
    public static final String STATUS_VAR = "rc";

    private static final String STATUS_CHECK =
            " if (" + STATUS_VAR + " != 0) return " + STATUS_VAR + ";";

    private final TokenList tokens;

    /** Headers of the functions whose convention changes, by name */
    private final Map<String, SignatureRewriter.Signature> refactored;

    private List<Patch> patches;

    private int body_start;

    private int end;

    private int tmp_counter;

    private boolean uses_status;

    /**
    * @param tokens the token list of the unit.
    * @param refactored the functions whose signature changes, by name.
    */
    public BodyRewriter(TokenList tokens,
            Map<String, SignatureRewriter.Signature> refactored) {
        this.tokens = tokens;
        this.refactored = refactored;
    }

    /**
    * Collects the patches for the body in tokens {@code [body_start, end)}.
    *
    * @param body_start the index of the body's opening brace.
    * @param end the exclusive end of the function.
    * @param sites the allocation sites of the function.
    * @param type the transform applied to the function's header.
    * @param return_type the original return type, used for out-parameter
    *       returns.
    * @return the patches in the order they were produced.
    */
    public List<Patch> rewrite(int body_start, int end,
            List<AllocationSite> sites, RefactorType type,
            String return_type) {
        this.patches = new ArrayList<Patch>();
        this.body_start = body_start;
        this.end = end;
        this.tmp_counter = 0;
        this.uses_status = false;
        if (!tokens.is(body_start, TokenKind.LBRACE)) {
            throw new UnsupportedInput("function without body");
        }
        for (AllocationSite site : sites) {
            if (site.getTokenIndex() > body_start) {
                addGuard(site);
            }
        }
        rewriteCalls();
        if (type == RefactorType.VOID_TO_INT) {
            rewriteVoidReturns();
        } else if (type == RefactorType.RETURN_TO_ARGUMENT) {
            rewriteValueReturns(sites, return_type);
        }
        if (uses_status) {
            // first among the insertions at this index
            patches.add(0, Patch.insert(body_start + 1,
                    "\n  int " + STATUS_VAR + " = 0;"));
        }
        return patches;
    }

    /* ---------------------------------------------------------------- */
    /* Allocation guards                                                */
    /* ---------------------------------------------------------------- */

    private void addGuard(AllocationSite site) {
        if (site.isChecked() || site.isReturnStatement() ||
                site.getVarName() == null) {
            return;
        }
        int call = site.getTokenIndex();
        int semi = TokenTools.findStatementEnd(tokens, call, end);
        if (semi >= end) {
            return;
        }
        int stmt = statementStart(call);
        if (site.getAllocator().getName().equals("realloc") &&
                rewriteSelfRealloc(site, stmt, semi)) {
            return;
        }
        String v = site.getVarName();
        String guard;
        switch (site.getAllocator().getCheck()) {
        case INT_NEGATIVE:
            guard = " if (" + v + " < 0) { return " + ERROR_CODE + "; }";
            break;
        case INT_NONZERO:
            guard = " if (" + v + " != 0) { return " + ERROR_CODE + "; }";
            break;
        default:
            guard = " if (!" + v + ") { return " + ERROR_CODE + "; }";
            break;
        }
        if (isControlledBody(stmt)) {
            patches.add(Patch.insert(stmt, "{ "));
            guard += " }";
        }
        patches.add(Patch.insert(semi + 1, guard));
    }

    /**
    * Replaces {@code p = realloc(p, n);} so that the old block is not lost
    * when the call fails.
    */
    private boolean rewriteSelfRealloc(AllocationSite site, int stmt,
            int semi) {
        int call = site.getTokenIndex();
        int assign = TokenTools.previousSignificant(tokens, call, stmt);
        if (!tokens.is(assign, TokenKind.ASSIGN)) {
            return false;
        }
        String lhs = compact(TokenTools.trimmedText(tokens, stmt, assign));
        if (!lhs.equals(site.getVarName())) {
            return false;
        }
        int open = TokenTools.nextSignificant(tokens, call + 1, semi);
        int close = TokenTools.findMatching(tokens, open, semi);
        if (close >= semi ||
                TokenTools.nextSignificant(tokens, close + 1, semi) != semi) {
            return false;
        }
        int comma = findTopLevelComma(open, close);
        if (comma < 0 || !compact(TokenTools.trimmedText(tokens, open + 1,
                comma)).equals(lhs)) {
            return false;
        }
        String v = TokenTools.trimmedText(tokens, stmt, assign);
        patches.add(new Patch(stmt, semi + 1, "{ void *_safe_tmp = " +
                tokens.getText(call, close + 1) +
                "; if (!_safe_tmp) return " + ERROR_CODE + "; " + v +
                " = _safe_tmp; }"));
        return true;
    }

    private int findTopLevelComma(int open, int close) {
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
                return i;
            }
        }
        return -1;
    }

    private static String compact(String text) {
        return TokenTools.spell(text).replaceAll("\\s+", "");
    }

    /* ---------------------------------------------------------------- */
    /* Calls to refactored functions                                    */
    /* ---------------------------------------------------------------- */

    private void rewriteCalls() {
        for (int i = body_start + 1; i < end; i++) {
            if (!tokens.is(i, TokenKind.IDENTIFIER)) {
                continue;
            }
            SignatureRewriter.Signature callee =
                    refactored.get(tokens.getSpelling(i));
            if (callee == null) {
                continue;
            }
            int open = TokenTools.nextSignificant(tokens, i + 1, end);
            if (open >= end || !tokens.is(open, TokenKind.LPAREN)) {
                continue;
            }
            int prev = TokenTools.previousSignificant(tokens, i, body_start);
            if (tokens.is(prev, TokenKind.DOT) ||
                    tokens.is(prev, TokenKind.ARROW)) {
                continue;
            }
            int close = TokenTools.findMatching(tokens, open, end);
            if (close >= end) {
                continue;
            }
            int after = TokenTools.nextSignificant(tokens, close + 1, end);
            boolean ends_statement = tokens.is(after, TokenKind.SEMICOLON);
            boolean has_value = callee.getRefactorType() ==
                    RefactorType.RETURN_TO_ARGUMENT;
            if (ends_statement && isStatementStart(prev) && !has_value) {
                boolean wrap = isControlledBody(i);
                if (wrap) {
                    patches.add(Patch.insert(i, "{ "));
                }
                patches.add(Patch.insert(i, STATUS_VAR + " = "));
                patches.add(Patch.insert(after + 1,
                        wrap ? STATUS_CHECK + " }" : STATUS_CHECK));
            } else if (!(ends_statement && has_value &&
                    tokens.is(prev, TokenKind.ASSIGN) &&
                    rewriteAssignment(prev, open, close, after))) {
                hoist(i, open, close, callee);
            }
            uses_status = true;
        }
    }

    /**
    * Checks if a call whose preceding significant token is {@code prev}
    * starts a statement.
    */
    private boolean isStatementStart(int prev) {
        if (prev < body_start) {
            return false;
        }
        TokenKind k = tokens.getKind(prev);
        if (k == TokenKind.SEMICOLON || k == TokenKind.LBRACE ||
                k == TokenKind.RBRACE || k == TokenKind.KEYWORD_ELSE ||
                k == TokenKind.KEYWORD_DO || k == TokenKind.COLON) {
            return true;
        }
        return closesControlHeader(prev);
    }

    /**
    * Checks if {@code prev} is the closing parenthesis of an {@code if},
    * {@code while}, or {@code for} header.
    */
    private boolean closesControlHeader(int prev) {
        if (!tokens.is(prev, TokenKind.RPAREN)) {
            return false;
        }
        int depth = 0;
        for (int j = prev; j > body_start; j--) {
            if (tokens.is(j, TokenKind.RPAREN)) {
                depth++;
            } else if (tokens.is(j, TokenKind.LPAREN)) {
                depth--;
                if (depth == 0) {
                    int kw = TokenTools.previousSignificant(tokens, j,
                            body_start);
                    return tokens.is(kw, TokenKind.KEYWORD_IF) ||
                            tokens.is(kw, TokenKind.KEYWORD_WHILE) ||
                            tokens.is(kw, TokenKind.KEYWORD_FOR);
                }
            }
        }
        return false;
    }

    /**
    * Returns the first token of the innermost statement holding
    * {@code pos}, stepping into the bodies of {@code if}, {@code while},
    * {@code for}, {@code else}, and {@code do} that are not braced.
    */
    private int statementStart(int pos) {
        // semicolons inside a for header do not end the statement
        int depth = 0;
        int i = pos;
        while (i > body_start) {
            TokenKind k = tokens.getKind(i - 1);
            if (k == TokenKind.LBRACE || k == TokenKind.RBRACE ||
                    (k == TokenKind.SEMICOLON && depth <= 0)) {
                break;
            }
            if (k == TokenKind.RPAREN) {
                depth++;
            } else if (k == TokenKind.LPAREN) {
                depth--;
            }
            i--;
        }
        int stmt = TokenTools.nextSignificant(tokens, i, pos + 1);
        while (stmt < pos) {
            TokenKind k = tokens.getKind(stmt);
            int inner;
            if (k == TokenKind.KEYWORD_IF || k == TokenKind.KEYWORD_WHILE ||
                    k == TokenKind.KEYWORD_FOR) {
                int open = TokenTools.nextSignificant(tokens, stmt + 1, pos);
                if (open >= pos || !tokens.is(open, TokenKind.LPAREN)) {
                    break;
                }
                int close = TokenTools.findMatching(tokens, open, pos);
                if (close >= pos) {
                    break;
                }
                inner = TokenTools.nextSignificant(tokens, close + 1, pos + 1);
            } else if (k == TokenKind.KEYWORD_ELSE ||
                    k == TokenKind.KEYWORD_DO) {
                inner = TokenTools.nextSignificant(tokens, stmt + 1, pos + 1);
            } else {
                break;
            }
            if (inner > pos) {
                break;
            }
            stmt = inner;
        }
        return stmt;
    }

    /** Checks if the statement at {@code stmt} is an unbraced control body. */
    private boolean isControlledBody(int stmt) {
        int prev = TokenTools.previousSignificant(tokens, stmt, body_start);
        if (prev < body_start) {
            return false;
        }
        return tokens.is(prev, TokenKind.KEYWORD_ELSE) ||
                tokens.is(prev, TokenKind.KEYWORD_DO) ||
                closesControlHeader(prev);
    }

    /**
    * Rewrites {@code lhs = f(args);} to {@code rc = f(args, &lhs);} and
    * {@code T v = f(args);} to {@code T v; rc = f(args, &v);}.
    */
    private boolean rewriteAssignment(int assign, int open, int close,
            int semi) {
        int stmt = statementStart(assign);
        if (stmt >= assign) {
            return false;
        }
        boolean wrap = isControlledBody(stmt);
        String declared = null;
        try {
            declared = DeclaratorParser.parse(tokens, stmt, assign)
                    .getIdentifier();
        } catch (UnsupportedInput e) {
            // the left side is an expression
            PrintTools.printlnStatus(3, "[BodyRewriter] assignment to",
                    TokenTools.trimmedText(tokens, stmt, assign) + ":",
                    e.getMessage());
        }
        String target;
        if (wrap) {
            patches.add(Patch.insert(stmt, "{ "));
        }
        if (declared != null) {
            patches.add(new Patch(assign, assign + 1, "; " + STATUS_VAR +
                    " ="));
            target = declared;
        } else {
            String lhs = TokenTools.trimmedText(tokens, stmt, assign);
            int lhs_end = TokenTools.trimEnd(tokens, stmt, assign);
            boolean simple = TokenTools.nextSignificant(tokens, stmt, lhs_end)
                    == lhs_end - 1 && tokens.is(lhs_end - 1,
                    TokenKind.IDENTIFIER);
            target = simple ? lhs : "(" + lhs + ")";
            patches.add(new Patch(stmt, assign + 1, STATUS_VAR + " ="));
        }
        patches.add(Patch.insert(close, argumentPrefix(open, close) + "&" +
                target));
        patches.add(Patch.insert(semi + 1,
                wrap ? STATUS_CHECK + " }" : STATUS_CHECK));
        return true;
    }

    /**
    * Moves the call in front of its statement, storing its result in a
    * fresh temporary that replaces the call.
    */
    private void hoist(int call, int open, int close,
            SignatureRewriter.Signature callee) {
        int stmt = statementStart(call);
        boolean wrap = isControlledBody(stmt);
        int semi = TokenTools.findStatementEnd(tokens, close + 1, end);
        if (wrap && semi >= end) {
            throw new UnsupportedInput("cannot brace the statement calling " +
                    callee.getName());
        }
        String args = tokens.getText(open + 1, close);
        StringBuilder sb = new StringBuilder(80);
        if (wrap) {
            sb.append("{ ");
        }
        String replacement;
        if (callee.getRefactorType() == RefactorType.RETURN_TO_ARGUMENT) {
            String tmp = "_tmp_cdd_" + tmp_counter++;
            sb.append(callee.getReturnType()).append(" ").append(tmp);
            sb.append("; ").append(STATUS_VAR).append(" = ");
            sb.append(callee.getName()).append("(").append(args);
            sb.append(argumentPrefix(open, close)).append("&").append(tmp);
            sb.append(");");
            replacement = tmp;
        } else {
            sb.append(STATUS_VAR).append(" = ").append(callee.getName());
            sb.append("(").append(args).append(");");
            replacement = "(void)0";
        }
        sb.append(STATUS_CHECK).append("\n  ");
        patches.add(Patch.insert(stmt, sb.toString()));
        patches.add(new Patch(call, close + 1, replacement));
        if (wrap) {
            patches.add(Patch.insert(semi + 1, " }"));
        }
    }

    private String argumentPrefix(int open, int close) {
        return (TokenTools.nextSignificant(tokens, open + 1, close) < close)
                ? ", " : "";
    }

    /* ---------------------------------------------------------------- */
    /* Returns                                                          */
    /* ---------------------------------------------------------------- */

    private void rewriteVoidReturns() {
        for (int i = body_start; i < end; i++) {
            if (!tokens.is(i, TokenKind.KEYWORD_RETURN)) {
                continue;
            }
            int next = TokenTools.nextSignificant(tokens, i + 1, end);
            if (tokens.is(next, TokenKind.SEMICOLON)) {
                patches.add(new Patch(i, next, "return 0"));
            }
        }
        int last = end - 1;
        if (!tokens.is(last, TokenKind.RBRACE) || last <= body_start) {
            return;
        }
        if (!endsWithReturn(last)) {
            patches.add(Patch.insert(last, " return 0; "));
        }
    }

    /** Checks if the statement before the closing brace is a return. */
    private boolean endsWithReturn(int close) {
        int prev = TokenTools.previousSignificant(tokens, close, body_start + 1);
        if (!tokens.is(prev, TokenKind.SEMICOLON)) {
            return false;
        }
        int stmt = TokenTools.findStatementStart(tokens, prev, body_start + 1);
        return tokens.is(stmt, TokenKind.KEYWORD_RETURN);
    }

    private void rewriteValueReturns(List<AllocationSite> sites,
            String return_type) {
        String out = SignatureRewriter.OUT_PARAM;
        for (int i = body_start; i < end; i++) {
            if (!tokens.is(i, TokenKind.KEYWORD_RETURN)) {
                continue;
            }
            int semi = TokenTools.findStatementEnd(tokens, i + 1, end);
            if (semi >= end) {
                continue;
            }
            if (TokenTools.nextSignificant(tokens, i + 1, semi) >= semi) {
                patches.add(new Patch(i, semi, "return 0"));
                continue;
            }
            boolean allocates = false;
            for (AllocationSite site : sites) {
                if (site.getTokenIndex() > i && site.getTokenIndex() < semi) {
                    allocates = true;
                    break;
                }
            }
            if (allocates) {
                String expr = TokenTools.trimmedText(tokens, i + 1, semi);
                patches.add(new Patch(i, semi + 1, "{ " + return_type +
                        " _safe_ret = " + expr + "; if (!_safe_ret) return " +
                        ERROR_CODE + "; *" + out + " = _safe_ret; return 0; }"));
            } else {
                patches.add(new Patch(i, i + 1, "{ *" + out + " ="));
                patches.add(new Patch(semi, semi + 1, "; return 0; }"));
            }
        }
    }
}
