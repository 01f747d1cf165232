package cfix.hir;

import java.math.BigInteger;

/** Represents the value of an integer literal. */
public class IntegerLiteral extends NumericLiteral {

    /** The value as an unsigned 64-bit quantity. */
    private final long value;

    private final int base;

    private final boolean unsigned;

    private final boolean isLong;

    private final boolean isLongLong;

    public IntegerLiteral(String text, long value, int base, boolean unsigned,
            boolean isLong, boolean isLongLong) {
        super(text);
        this.value = value;
        this.base = base;
        this.unsigned = unsigned;
        this.isLong = isLong;
        this.isLongLong = isLongLong;
    }

    public boolean isFloating() {
        return false;
    }

    /**
    * Returns the raw 64 bits of the value; values above
    * {@link Long#MAX_VALUE} come back negative, see
    * {@link #getUnsignedValue()}.
    */
    public long getValue() {
        return value;
    }

    /** Returns the value without sign interpretation. */
    public BigInteger getUnsignedValue() {
        return new BigInteger(Long.toUnsignedString(value));
    }

    /** Returns 2, 8, 10, or 16. */
    public int getBase() {
        return base;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public boolean isLong() {
        return isLong;
    }

    public boolean isLongLong() {
        return isLongLong;
    }
}
