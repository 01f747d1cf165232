package cfix.analysis;

import cfix.hir.*;

import java.util.*;

/**
 * Finds calls to registered fallible allocators and classifies each one by
 * whether its result is checked before use. The classification is textual:
 * a site counts as checked when its variable appears in an {@code if} or
 * {@code while} condition later in the same block.
 */
public class AllocationAnalysis extends AnalysisPass {

    private static final String pass_name = "[AllocationAnalysis]";

    private final AllocatorLibrary library;

    private final TokenList tokens;

    /** Sites per function definition, in source order */
    private final Map<CstNode, List<AllocationSite>> sites;

    public AllocationAnalysis(TranslationUnit unit, AllocatorLibrary library) {
        super(unit);
        this.library = library;
        this.tokens = unit.getTokens();
        this.sites = new LinkedHashMap<CstNode, List<AllocationSite>>();
    }

    @Override
    public String getPassName() {
        return pass_name;
    }

    @Override
    public void start() {
        sites.clear();
        for (CstNode function : unit.getFunctions()) {
            List<AllocationSite> found = findSites(function.getStartToken(),
                    function.getEndToken());
            sites.put(function, found);
            if (!found.isEmpty()) {
                PrintTools.printlnStatus(2, pass_name,
                        PrintTools.collectionToString(found, ", "));
            }
        }
    }

    /** Returns the sites found in the given function, empty if none. */
    public List<AllocationSite> getSites(CstNode function) {
        List<AllocationSite> ret = sites.get(function);
        if (ret == null) {
            return Collections.emptyList();
        }
        return ret;
    }

    /** Returns every site of the unit in source order. */
    public List<AllocationSite> getAllSites() {
        List<AllocationSite> ret = new ArrayList<AllocationSite>();
        for (List<AllocationSite> list : sites.values()) {
            ret.addAll(list);
        }
        return ret;
    }

    /**
    * Finds and classifies the allocation sites in tokens
    * {@code [start, end)}.
    *
    * @param start the first token of the range, usually a function start.
    * @param end the exclusive end of the range.
    * @return the sites in source order.
    */
    public List<AllocationSite> findSites(int start, int end) {
        List<AllocationSite> ret = new ArrayList<AllocationSite>();
        for (int i = start; i < end; i++) {
            if (!tokens.is(i, TokenKind.IDENTIFIER)) {
                continue;
            }
            String name = tokens.getSpelling(i);
            if (!library.contains(name)) {
                continue;
            }
            int open = TokenTools.nextSignificant(tokens, i + 1, end);
            if (open >= end || !tokens.is(open, TokenKind.LPAREN)) {
                continue;
            }
            int prev = TokenTools.previousSignificant(tokens, i, start);
            if (tokens.is(prev, TokenKind.DOT) ||
                    tokens.is(prev, TokenKind.ARROW)) {
                continue;
            }
            int close = TokenTools.findMatching(tokens, open, end);
            if (close >= end) {
                continue;
            }
            AllocatorLibrary.Entry entry = library.lookup(name,
                    TokenTools.countArguments(tokens, open, close));
            if (entry == null) {
                continue;
            }
            ret.add(classify(i, close, entry, start, end));
        }
        return ret;
    }

    private AllocationSite classify(int call, int close,
            AllocatorLibrary.Entry entry, int start, int end) {
        int stmt = TokenTools.findStatementStart(tokens, call, start);
        int assign = findAssignment(call, start);
        if (tokens.is(stmt, TokenKind.KEYWORD_RETURN) &&
                (assign < 0 || assign < stmt)) {
            return new AllocationSite(call, null, true, false, false, entry);
        }
        String var = null;
        if (assign >= 0) {
            var = assignedName(assign, start);
        }
        boolean in_condition =
                TokenTools.isInsideCondition(tokens, call, start);
        if (var == null || in_condition) {
            return new AllocationSite(call, var, false, in_condition, false,
                    entry);
        }

        // look for a later test of the variable in the same block
        boolean checked = false;
        boolean used_before_check = false;
        int semi = TokenTools.findStatementEnd(tokens, close + 1, end);
        if (semi < end) {
            String member = lastComponent(var);
            int block_end = findBlockEnd(semi + 1, end);
            for (int j = semi + 1; j < block_end; j++) {
                if (!tokens.is(j, TokenKind.IDENTIFIER) ||
                        !tokens.matches(j, member)) {
                    continue;
                }
                if (isReassignment(j, start, end)) {
                    break;
                }
                if (TokenTools.isInsideCondition(tokens, j, start)) {
                    checked = true;
                    break;
                }
                if (entry.getCheck() == AllocatorLibrary.Check.PTR_NULL &&
                        isDereference(j, start, end)) {
                    used_before_check = true;
                    break;
                }
            }
        }
        return new AllocationSite(call, var, false, checked,
                used_before_check, entry);
    }

    /**
    * Returns the index of the {@code =} the statement assigns the call to,
    * or -1 when the scan reaches a statement boundary first.
    */
    private int findAssignment(int call, int start) {
        for (int j = call - 1; j >= start; j--) {
            TokenKind k = tokens.getKind(j);
            if (k == TokenKind.SEMICOLON || k == TokenKind.LBRACE ||
                    k == TokenKind.RBRACE) {
                return -1;
            }
            if (k == TokenKind.ASSIGN) {
                return j;
            }
        }
        return -1;
    }

    /**
    * Returns the assigned variable: the identifier before {@code =},
    * together with any member-access chain leading to it.
    */
    private String assignedName(int assign, int start) {
        int last = TokenTools.previousSignificant(tokens, assign, start);
        if (!tokens.is(last, TokenKind.IDENTIFIER)) {
            return null;
        }
        int first = last;
        while (true) {
            int op = TokenTools.previousSignificant(tokens, first, start);
            if (!tokens.is(op, TokenKind.ARROW) && !tokens.is(op, TokenKind.DOT)) {
                break;
            }
            int base = TokenTools.previousSignificant(tokens, op, start);
            if (!tokens.is(base, TokenKind.IDENTIFIER)) {
                break;
            }
            first = base;
        }
        if (first == last) {
            return tokens.getSpelling(last);
        }
        return TokenTools.collapseWhitespace(TokenTools.spell(
                tokens.getText(first, last + 1))).replace(" ", "");
    }

    private static String lastComponent(String var) {
        int cut = Math.max(var.lastIndexOf("->") + 1, var.lastIndexOf('.'));
        return (cut > 0) ? var.substring(cut + 1) : var;
    }

    /** Returns the closing brace of the block enclosing {@code from}. */
    private int findBlockEnd(int from, int end) {
        int depth = 0;
        for (int j = from; j < end; j++) {
            if (tokens.is(j, TokenKind.LBRACE)) {
                depth++;
            } else if (tokens.is(j, TokenKind.RBRACE)) {
                if (depth == 0) {
                    return j;
                }
                depth--;
            }
        }
        return end;
    }

    /**
    * A plain {@code v = ...} overwrites the result before any check;
    * {@code *v = ...} is a dereference instead.
    */
    private boolean isReassignment(int j, int start, int end) {
        int next = TokenTools.nextSignificant(tokens, j + 1, end);
        if (next >= end || !tokens.is(next, TokenKind.ASSIGN)) {
            return false;
        }
        int prev = TokenTools.previousSignificant(tokens, j, start);
        return !tokens.is(prev, TokenKind.STAR);
    }

    /** Checks for {@code *v}, {@code v->}, and {@code v[}. */
    private boolean isDereference(int j, int start, int end) {
        int next = TokenTools.nextSignificant(tokens, j + 1, end);
        if (tokens.is(next, TokenKind.ARROW) ||
                tokens.is(next, TokenKind.LBRACKET)) {
            return true;
        }
        int prev = TokenTools.previousSignificant(tokens, j, start);
        if (!tokens.is(prev, TokenKind.STAR)) {
            return false;
        }
        // a star after an operand is a multiplication
        int before = TokenTools.previousSignificant(tokens, prev, start);
        if (before < start) {
            return true;
        }
        TokenKind k = tokens.getKind(before);
        return !(k == TokenKind.IDENTIFIER || k == TokenKind.RPAREN ||
                k == TokenKind.RBRACKET || k == TokenKind.NUMBER_LITERAL ||
                k == TokenKind.CHAR_LITERAL || k == TokenKind.STRING_LITERAL);
    }
}
