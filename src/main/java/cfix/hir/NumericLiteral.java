package cfix.hir;

/** Common base of the typed values of numeric literals. */
public abstract class NumericLiteral {

    private final String text;

    protected NumericLiteral(String text) {
        this.text = text;
    }

    /** Returns the literal text the value was parsed from. */
    public String getText() {
        return text;
    }

    public abstract boolean isFloating();

    @Override
    public String toString() {
        return text;
    }
}
