package cfix.analysis;

import cfix.hir.*;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates allocation statistics over many units without rewriting
 * anything.
 */
public class AllocationAudit {

    private int files_scanned;

    private int checked;

    private int unchecked;

    private int returning;

    private final List<String> violations;

    public AllocationAudit() {
        violations = new ArrayList<String>();
    }

    /** Adds the sites the analysis found in the given unit. */
    public void add(TranslationUnit unit, AllocationAnalysis analysis) {
        files_scanned++;
        TokenList tokens = unit.getTokens();
        for (AllocationSite site : analysis.getAllSites()) {
            if (site.isReturnStatement()) {
                returning++;
            }
            if (site.isChecked()) {
                checked++;
                continue;
            }
            unchecked++;
            int offset = tokens.get(site.getTokenIndex()).getOffset();
            StringBuilder sb = new StringBuilder(80);
            sb.append(unit.getInputFilename()).append(":");
            sb.append(position(tokens.getSource(), offset)).append(": ");
            sb.append("unchecked ").append(site.getAllocator().getName());
            if (site.getVarName() != null) {
                sb.append(" result ").append(site.getVarName());
            } else if (site.getAllocator().getStyle() ==
                    AllocatorLibrary.Style.ARG_PTR) {
                String target = resultArgument(tokens, site);
                if (target != null) {
                    sb.append(" into ").append(target);
                }
            }
            if (site.isUsedBeforeCheck()) {
                sb.append(" used before check");
            }
            violations.add(sb.toString());
        }
    }

    private static String resultArgument(TokenList tokens,
            AllocationSite site) {
        int open = TokenTools.nextSignificant(tokens, site.getTokenIndex() + 1,
                tokens.size());
        int close = TokenTools.findMatching(tokens, open, tokens.size());
        if (close >= tokens.size()) {
            return null;
        }
        return TokenTools.argumentText(tokens, open, close,
                site.getAllocator().getResultArgument());
    }

    /** Returns "line:column", both counted from 1. */
    static String position(String source, int offset) {
        int line = 1;
        int line_start = 0;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                line_start = i + 1;
            }
        }
        return line + ":" + (offset - line_start + 1);
    }

    public int getFilesScanned() {
        return files_scanned;
    }

    public int getCheckedAllocations() {
        return checked;
    }

    public int getUncheckedAllocations() {
        return unchecked;
    }

    /** Number of return statements handing out a fresh allocation. */
    public int getFunctionsReturningAllocations() {
        return returning;
    }

    public List<String> getViolations() {
        return violations;
    }

    public void print(PrintStream p) {
        for (String v : violations) {
            p.println(v);
        }
        p.println("files scanned:               " + files_scanned);
        p.println("checked allocations:         " + checked);
        p.println("unchecked allocations:       " + unchecked);
        p.println("functions returning allocs:  " + returning);
        p.flush();
    }
}
