package cfix.hir;

/**
 * The result of parsing one declaration: the declared name, if any, and its
 * type chain.
 */
public final class DeclInfo {

    private final String identifier;

    private final DeclType type;

    public DeclInfo(String identifier, DeclType type) {
        if (type == null) {
            throw new IllegalArgumentException("declaration without a type");
        }
        this.identifier = identifier;
        this.type = type;
    }

    /** Returns the declared name, or null for an abstract declarator. */
    public String getIdentifier() {
        return identifier;
    }

    public boolean isAbstract() {
        return identifier == null;
    }

    /** Returns the outermost link of the type chain. */
    public DeclType getType() {
        return type;
    }

    @Override
    public String toString() {
        return ((identifier == null) ? "<abstract>" : identifier) + ": " + type;
    }
}
