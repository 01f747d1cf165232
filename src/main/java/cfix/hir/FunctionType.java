package cfix.hir;

/** A function link carrying its parameter list text. */
public class FunctionType extends DeclType {

    private final String parameters;

    public FunctionType(String parameters) {
        this.parameters = parameters;
    }

    public Kind getKind() {
        return Kind.FUNCTION;
    }

    /** Returns the parameter text; empty for {@code ()}. */
    public String getParameters() {
        return parameters;
    }

    protected String describe() {
        return "function(" + parameters + ")";
    }
}
