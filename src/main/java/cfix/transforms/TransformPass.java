package cfix.transforms;

import cfix.hir.*;

/**
* Base class of all transformation passes. For consistent rewriting, the
* token stream of the unit is checked at the end of every transformation
* pass.
*/
public abstract class TransformPass {

    /** The associated unit */
    protected TranslationUnit unit;

    /** Constructs a transform pass with the given unit */
    protected TransformPass(TranslationUnit unit) {
        this.unit = unit;
    }

    /** Returns the name of the transform pass */
    public abstract String getPassName();

    /**
    * Invokes the specified transform pass.
    * @param pass the transform pass that is to be run.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.println(pass.getPassName() + " begin", 1);
        pass.start();
        PrintTools.println(pass.getPassName() + " end in " +
                String.format("%.2f seconds", Tools.getTime(timer)), 1);
        if (!pass.unit.checkConsistency()) {
            throw new InternalError("Inconsistent tokens after " +
                                    pass.getPassName());
        }
    }

    /** Starts a transform pass */
    public abstract void start();

}
