package cfix.hir;

/**
 * One call to a registered fallible allocator, classified by how its result
 * is checked.
 */
public final class AllocationSite {

    private final int tokenIndex;

    private final String varName;

    private final boolean returnStatement;

    private final boolean checked;

    private final boolean usedBeforeCheck;

    private final AllocatorLibrary.Entry allocator;

    public AllocationSite(int tokenIndex, String varName,
            boolean returnStatement, boolean checked, boolean usedBeforeCheck,
            AllocatorLibrary.Entry allocator) {
        this.tokenIndex = tokenIndex;
        this.varName = varName;
        this.returnStatement = returnStatement;
        this.checked = checked && !usedBeforeCheck && !returnStatement;
        this.usedBeforeCheck = usedBeforeCheck;
        this.allocator = allocator;
    }

    /** Index of the call's name token. */
    public int getTokenIndex() {
        return tokenIndex;
    }

    /** Returns the variable receiving the result, or null. */
    public String getVarName() {
        return varName;
    }

    public boolean isReturnStatement() {
        return returnStatement;
    }

    public boolean isChecked() {
        return checked;
    }

    /** True if the result is dereferenced before any check. */
    public boolean isUsedBeforeCheck() {
        return usedBeforeCheck;
    }

    public AllocatorLibrary.Entry getAllocator() {
        return allocator;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(48);
        sb.append(allocator.getName()).append("@").append(tokenIndex);
        if (varName != null) {
            sb.append(" -> ").append(varName);
        }
        if (returnStatement) {
            sb.append(" (return)");
        }
        sb.append(checked ? " checked" : " unchecked");
        if (usedBeforeCheck) {
            sb.append(", used before check");
        }
        return sb.toString();
    }
}
