package cfix.hir;

/**
 * One link of a resolved declarator chain. The chain is read outermost
 * first: for {@code int *x[3]} it is array, then pointer, then base. Every
 * chain ends in exactly one {@link BaseType}.
 */
public abstract class DeclType {

    /** Kinds of chain links. */
    public enum Kind {
        POINTER, ARRAY, FUNCTION, BASE
    }

    private DeclType inner;

    protected DeclType() {
        inner = null;
    }

    public abstract Kind getKind();

    /** Returns the next link inward, or null for the base. */
    public DeclType getInner() {
        return inner;
    }

    /** Links the next link inward; used while building a chain. */
    public void setInner(DeclType inner) {
        if (this instanceof BaseType && inner != null) {
            throw new IllegalStateException("base type must end the chain");
        }
        this.inner = inner;
    }

    /** Returns the base type terminating this chain. */
    public BaseType getBase() {
        DeclType t = this;
        while (t.inner != null) {
            t = t.inner;
        }
        return (BaseType)t;
    }

    /** Returns the number of links including the base. */
    public int depth() {
        int n = 0;
        for (DeclType t = this; t != null; t = t.inner) {
            n++;
        }
        return n;
    }

    /** Describes this link alone. */
    protected abstract String describe();

    /**
    * Returns the chain in a readable, outermost-first form such as
    * {@code pointer(const) -> array[3] -> int}.
    */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        for (DeclType t = this; t != null; t = t.inner) {
            if (t != this) {
                sb.append(" -> ");
            }
            sb.append(t.describe());
        }
        return sb.toString();
    }
}
