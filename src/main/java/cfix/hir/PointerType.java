package cfix.hir;

/** A pointer link, with the qualifiers written after its star. */
public class PointerType extends DeclType {

    private final String qualifiers;

    /**
    * @param qualifiers the qualifier text exactly as written, or null for an
    *       unqualified pointer.
    */
    public PointerType(String qualifiers) {
        this.qualifiers = qualifiers;
    }

    public Kind getKind() {
        return Kind.POINTER;
    }

    public String getQualifiers() {
        return qualifiers;
    }

    protected String describe() {
        return (qualifiers == null) ? "pointer" : "pointer(" + qualifiers + ")";
    }
}
