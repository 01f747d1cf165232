package cfix.transforms;

/** How a marked function's calling convention changes. */
public enum RefactorType {
    /** The header stays as it is; only the body is hardened. */
    NONE,
    /** {@code void f(...)} becomes {@code int f(...)}. */
    VOID_TO_INT,
    /** {@code T f(...)} becomes {@code int f(..., T *out)}. */
    RETURN_TO_ARGUMENT
}
