package cfix.hir;

/** The innermost link: the declaration's base specifier text. */
public class BaseType extends DeclType {

    private final String specifier;

    public BaseType(String specifier) {
        this.specifier = specifier;
    }

    public Kind getKind() {
        return Kind.BASE;
    }

    public String getSpecifier() {
        return specifier;
    }

    protected String describe() {
        return specifier;
    }
}
