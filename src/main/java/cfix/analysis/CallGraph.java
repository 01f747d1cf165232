package cfix.analysis;

import cfix.hir.*;
import cfix.transforms.SignatureRewriter;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.*;

/**
 * A reverse call graph over the function definitions of one unit. Only
 * callee-to-caller edges are kept since the graph exists to push the
 * "needs an error-code return" mark from a function up to everything that
 * calls it.
 */
public class CallGraph {

    public class Node {

        private final CstNode function;

        private final String name;

        private final int start;

        private final int body_start;

        private final int end;

        private final SignatureRewriter.Signature signature;

        private final boolean entry_point;

        private boolean contains_allocations;

        private boolean marked;

        private final ArrayList<Node> callers;

        public Node(CstNode function, int body_start,
                SignatureRewriter.Signature signature) {
            this.function = function;
            this.start = function.getStartToken();
            this.end = function.getEndToken();
            this.body_start = body_start;
            this.signature = signature;
            this.name = (signature == null) ? "" : signature.getName();
            this.entry_point = name.equals(entry_name);
            contains_allocations = false;
            marked = false;
            callers = new ArrayList<Node>(1);
        }

        public void addCaller(Node caller) {
            if (caller != this && !callers.contains(caller)) {
                callers.add(caller);
            }
        }

        public List<Node> getCallers() {
            return callers;
        }

        public String getName() {
            return name;
        }

        /** Returns the CST node of the definition. */
        public CstNode getFunction() {
            return function;
        }

        public int getStartToken() {
            return start;
        }

        /** Index of the body's opening brace. */
        public int getBodyStart() {
            return body_start;
        }

        public int getEndToken() {
            return end;
        }

        /** Returns the decomposed header, or null if it could not be read. */
        public SignatureRewriter.Signature getSignature() {
            return signature;
        }

        public String getReturnType() {
            return (signature == null) ? "" : signature.getReturnType();
        }

        public boolean returnsPointer() {
            return signature != null && signature.returnsPointer();
        }

        public boolean returnsVoid() {
            return signature != null && !signature.returnsPointer() &&
                    signature.returnsVoid();
        }

        public boolean isEntryPoint() {
            return entry_point;
        }

        public boolean containsAllocations() {
            return contains_allocations;
        }

        public boolean isMarked() {
            return marked;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final TokenList tokens;

    private final String entry_name;

    private final ArrayList<Node> nodes;

    /**
    * Creates the call graph of a unit.
    *
    * @param unit the unit whose function definitions become nodes.
    * @param analysis the allocation sites of the unit.
    * @param entry_name the name of the program entry point, which is marked
    *       like any caller but never changes its convention.
    */
    public CallGraph(TranslationUnit unit, AllocationAnalysis analysis,
            String entry_name) {
        this.tokens = unit.getTokens();
        this.entry_name = entry_name;
        this.nodes = new ArrayList<Node>();
        for (CstNode function : unit.getFunctions()) {
            int body = findBody(function);
            SignatureRewriter.Signature sig = null;
            try {
                sig = SignatureRewriter.decompose(tokens,
                        function.getStartToken(), body);
            } catch (UnsupportedInput e) {
                PrintTools.printlnStatus(1, "[CallGraph] skipping function at",
                        "token", function.getStartToken() + ":", e.getMessage());
            }
            Node node = new Node(function, body, sig);
            for (AllocationSite site : analysis.getSites(function)) {
                if (site.getTokenIndex() >= body) {
                    node.contains_allocations = true;
                    break;
                }
            }
            nodes.add(node);
        }
        addEdges();
    }

    private int findBody(CstNode function) {
        for (int i = function.getStartToken(); i < function.getEndToken(); i++) {
            if (tokens.is(i, TokenKind.LBRACE)) {
                return i;
            }
        }
        return function.getEndToken();
    }

    /** Adds an edge for every {@code name(} in a body naming another node. */
    private void addEdges() {
        Map<String, List<Node>> by_name = new HashMap<String, List<Node>>();
        for (Node node : nodes) {
            if (node.name.isEmpty()) {
                continue;
            }
            List<Node> list = by_name.get(node.name);
            if (list == null) {
                list = new ArrayList<Node>(1);
                by_name.put(node.name, list);
            }
            list.add(node);
        }
        for (Node caller : nodes) {
            for (int t = caller.body_start; t < caller.end; t++) {
                if (!tokens.is(t, TokenKind.IDENTIFIER)) {
                    continue;
                }
                int next = TokenTools.nextSignificant(tokens, t + 1, caller.end);
                if (!tokens.is(next, TokenKind.LPAREN) || next >= caller.end) {
                    continue;
                }
                List<Node> callees = by_name.get(tokens.getSpelling(t));
                if (callees == null) {
                    continue;
                }
                for (Node callee : callees) {
                    callee.addCaller(caller);
                }
            }
        }
    }

    /**
    * Marks every function that allocates and returns void or a pointer,
    * then every transitive caller of a marked function. The walk does not
    * continue past the entry point.
    */
    public void propagate() {
        Deque<Node> work = new ArrayDeque<Node>();
        for (Node node : nodes) {
            if (node.contains_allocations &&
                    (node.returnsVoid() || node.returnsPointer()) &&
                    !node.marked) {
                node.marked = true;
                work.push(node);
            }
        }
        while (!work.isEmpty()) {
            Node node = work.pop();
            if (node.entry_point) {
                continue;
            }
            for (Node caller : node.callers) {
                if (!caller.marked) {
                    caller.marked = true;
                    work.push(caller);
                }
            }
        }
    }

    public List<Node> getNodes() {
        return nodes;
    }

    /** Returns the first node with the given name, or null. */
    public Node getNode(String name) {
        for (Node node : nodes) {
            if (node.name.equals(name)) {
                return node;
            }
        }
        return null;
    }

    public boolean isMarked(String name) {
        Node node = getNode(name);
        return node != null && node.marked;
    }

    public List<Node> getMarkedNodes() {
        List<Node> ret = new ArrayList<Node>();
        for (Node node : nodes) {
            if (node.marked) {
                ret.add(node);
            }
        }
        return ret;
    }

    /**
    * Prints the graph to a stream in
    * <a href="https://graphviz.org/">graphviz</a> format, with edges from
    * caller to callee and marked functions filled.
    *
    * @param stream The stream on which to print the graph.
    */
    public void print(OutputStream stream) {
        PrintStream p = new PrintStream(stream);
        p.println("digraph {\norientation=landscape;\nsize=\"11,8\";\n");
        for (Node node : nodes) {
            if (node.name.isEmpty()) {
                continue;
            }
            p.print("\"" + node.name + "\"");
            if (node.marked) {
                p.print(" [style=filled, fillcolor=lightpink]");
            }
            p.print(";\n");
        }
        for (Node callee : nodes) {
            for (Node caller : callee.callers) {
                p.print("\"" + caller.name + "\" -> \"" + callee.name + "\";\n");
            }
        }
        p.print("}\n");
        p.flush();
    }
}
