package cfix.hir;

/** Represents the value of a floating literal. */
public class FloatLiteral extends NumericLiteral {

    /** Decimal floating-point width selected by a df/dd/dl suffix. */
    public enum DecimalWidth {
        NONE, DFP_32, DFP_64, DFP_128
    }

    private final double value;

    private final boolean isFloat;

    private final boolean isLongDouble;

    private final DecimalWidth decimal;

    public FloatLiteral(String text, double value, boolean isFloat,
            boolean isLongDouble, DecimalWidth decimal) {
        super(text);
        this.value = value;
        this.isFloat = isFloat;
        this.isLongDouble = isLongDouble;
        this.decimal = decimal;
    }

    public boolean isFloating() {
        return true;
    }

    public double getValue() {
        return value;
    }

    /** True for an {@code f} suffix. */
    public boolean isFloat() {
        return isFloat;
    }

    /** True for an {@code l} suffix. */
    public boolean isLongDouble() {
        return isLongDouble;
    }

    public DecimalWidth getDecimalWidth() {
        return decimal;
    }
}
