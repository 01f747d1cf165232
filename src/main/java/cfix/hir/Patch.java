package cfix.hir;

/**
 * A request to replace the tokens {@code [startToken, endToken)} with literal
 * text. Empty text deletes the range; {@code startToken == endToken} inserts
 * the text before {@code startToken}.
 */
public final class Patch {

    private final int start;

    private final int end;

    private final String text;

    public Patch(int start, int end, String text) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("bad patch range [" + start +
                    ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.text = (text == null) ? "" : text;
    }

    /** Creates a pure insertion before the given token. */
    public static Patch insert(int at, String text) {
        return new Patch(at, at, text);
    }

    public int getStartToken() {
        return start;
    }

    public int getEndToken() {
        return end;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ") -> \"" + text + "\"";
    }
}
