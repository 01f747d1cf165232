package cfix.hir;

/**
 * Thrown when a numeric literal cannot be converted to a value.
 */
public class NumericLiteralException extends UnsupportedInput {

    private static final long serialVersionUID = 1;

    /** Failure classes. */
    public enum Kind {
        /** Empty text, bad digits, or an unknown or repeated suffix. */
        INVALID_FORMAT,
        /** The value does not fit the target representation. */
        RANGE
    }

    private final Kind kind;

    public NumericLiteralException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRangeError() {
        return kind == Kind.RANGE;
    }
}
