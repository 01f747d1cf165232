package cfix.transforms;

import cfix.hir.*;

import java.util.*;

/**
 * Rebuilds source text from a token list and a set of token-range patches.
 * Tokens outside every patch are copied byte for byte.
 */
public class TextPatcher {

    private static final Comparator<Patch> by_start = new Comparator<Patch>() {
        public int compare(Patch p1, Patch p2) {
            return Integer.compare(p1.getStartToken(), p2.getStartToken());
        }
    };

    private TextPatcher() {
    }

    /**
    * Applies the patches to the token list. Patches are applied in
    * ascending start order, keeping the given order among equal starts.
    * When two patches overlap, the one applied first wins and the other is
    * dropped. Patches starting at or beyond the last token are appended.
    *
    * @param tokens the original tokens.
    * @param patches the patches to apply; the list is not modified.
    * @return the rewritten text.
    */
    public static String apply(TokenList tokens, List<Patch> patches) {
        List<Patch> sorted = new ArrayList<Patch>(patches);
        Collections.sort(sorted, by_start);
        int n = tokens.size();
        StringBuilder sb = new StringBuilder(tokens.getSource().length() +
                64 * sorted.size());
        int cursor = 0;
        int next = 0;
        while (true) {
            while (next < sorted.size() &&
                    sorted.get(next).getStartToken() <= cursor) {
                Patch p = sorted.get(next++);
                if (p.getStartToken() < cursor) {
                    PrintTools.printlnStatus(3, "[TextPatcher] dropping", p);
                    continue;
                }
                sb.append(p.getText());
                if (p.getEndToken() > cursor) {
                    cursor = Math.min(p.getEndToken(), n);
                }
            }
            if (cursor >= n) {
                break;
            }
            sb.append(tokens.getText(cursor));
            cursor++;
        }
        while (next < sorted.size()) {
            sb.append(sorted.get(next++).getText());
        }
        return sb.toString();
    }
}
