package cfix.hir;

/** An array link. */
public class ArrayType extends DeclType {

    private final String size;

    /** @param size the size expression text, or null for {@code []}. */
    public ArrayType(String size) {
        this.size = size;
    }

    public Kind getKind() {
        return Kind.ARRAY;
    }

    public String getSize() {
        return size;
    }

    protected String describe() {
        return "array[" + ((size == null) ? "" : size) + "]";
    }
}
