package cfix.hir;

/**
 * A flat CST record naming the semantic class of the token range
 * {@code [startToken, endToken)}. Nesting between nodes is implicit and
 * recovered by range containment.
 */
public final class CstNode {

    private final CstNodeKind kind;

    private final int start;

    private final int end;

    public CstNode(CstNodeKind kind, int start, int end) {
        if (end <= start) {
            throw new IllegalArgumentException("empty node range [" + start +
                    ", " + end + ")");
        }
        this.kind = kind;
        this.start = start;
        this.end = end;
    }

    public CstNodeKind getKind() {
        return kind;
    }

    public int getStartToken() {
        return start;
    }

    /** Exclusive end index. */
    public int getEndToken() {
        return end;
    }

    /** Checks if the other node lies within this node's range. */
    public boolean contains(CstNode other) {
        return other != this && start <= other.start && other.end <= end;
    }

    /** Returns the raw source text covered by this node. */
    public String getText(TokenList tokens) {
        return tokens.getText(start, end);
    }

    @Override
    public String toString() {
        return kind + "[" + start + ", " + end + ")";
    }
}
