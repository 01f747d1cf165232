package cfix.transforms;

import cfix.analysis.AllocationAnalysis;
import cfix.analysis.AnalysisPass;
import cfix.analysis.CallGraph;
import cfix.hir.*;

import java.util.*;

/**
 * Converts every function that can fail to allocate, and every transitive
 * caller of one, to the error-code calling convention. The unit's output
 * text is set only when at least one function is marked; a function whose
 * header or body cannot be handled is left exactly as it was.
 */
public class ErrorCodeRefactoring extends TransformPass {

    private static final String pass_name = "[ErrorCodeRefactoring]";

    private final AllocatorLibrary library;

    private final String entry_name;

    private AllocationAnalysis analysis;

    private CallGraph callgraph;

    /**
    * @param unit the unit to rewrite.
    * @param library the allocators whose results must be checked.
    * @param entry_name the program entry point, whose header never changes.
    */
    public ErrorCodeRefactoring(TranslationUnit unit, AllocatorLibrary library,
            String entry_name) {
        super(unit);
        this.library = library;
        this.entry_name = entry_name;
    }

    @Override
    public String getPassName() {
        return pass_name;
    }

    @Override
    public void start() {
        analysis = new AllocationAnalysis(unit, library);
        AnalysisPass.run(analysis);
        callgraph = new CallGraph(unit, analysis, entry_name);
        callgraph.propagate();

        List<CallGraph.Node> marked = callgraph.getMarkedNodes();
        if (marked.isEmpty()) {
            PrintTools.printlnStatus(1, pass_name, "nothing to do in",
                    unit.getInputFilename());
            return;
        }

        TokenList tokens = unit.getTokens();
        Map<String, SignatureRewriter.Signature> refactored =
                new LinkedHashMap<String, SignatureRewriter.Signature>();
        for (CallGraph.Node node : marked) {
            if (getRefactorType(node) != RefactorType.NONE &&
                    tokens.is(node.getBodyStart(), TokenKind.LBRACE)) {
                refactored.put(node.getName(), node.getSignature());
            }
        }

        BodyRewriter body = new BodyRewriter(tokens, refactored);
        List<Patch> patches = new ArrayList<Patch>();
        for (CallGraph.Node node : marked) {
            try {
                patches.addAll(rewriteFunction(node, body));
            } catch (UnsupportedInput e) {
                PrintTools.printlnStatus(1, pass_name, "leaving",
                        describe(node), "unchanged:", e.getMessage());
            }
        }
        unit.setOutputText(TextPatcher.apply(tokens, patches));
    }

    private List<Patch> rewriteFunction(CallGraph.Node node,
            BodyRewriter body) {
        SignatureRewriter.Signature sig = node.getSignature();
        if (sig == null) {
            throw new UnsupportedInput("unreadable function header");
        }
        RefactorType type = getRefactorType(node);
        List<Patch> ret = new ArrayList<Patch>();
        if (type != RefactorType.NONE) {
            ret.add(new Patch(sig.getStartToken(), sig.getEndToken(),
                    SignatureRewriter.rewrite(sig)));
        }
        ret.addAll(body.rewrite(node.getBodyStart(), node.getEndToken(),
                analysis.getSites(node.getFunction()), type,
                sig.getReturnType()));
        PrintTools.printlnStatus(1, pass_name, "rewriting", describe(node),
                "(" + type + ")");
        return ret;
    }

    /** Returns the transform of a marked function. */
    public static RefactorType getRefactorType(CallGraph.Node node) {
        if (node.isEntryPoint() || node.getSignature() == null) {
            return RefactorType.NONE;
        }
        return node.getSignature().getRefactorType();
    }

    private String describe(CallGraph.Node node) {
        String name = node.getName().isEmpty() ? "<unnamed>" : node.getName();
        return unit.getInputFilename() + ":" + name;
    }

    /** Returns the analysis of the last run, or null before the first run. */
    public AllocationAnalysis getAnalysis() {
        return analysis;
    }

    /** Returns the call graph of the last run, or null before the first run. */
    public CallGraph getCallGraph() {
        return callgraph;
    }
}
