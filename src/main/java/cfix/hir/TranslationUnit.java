package cfix.hir;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One source file: its immutable token stream, its CST nodes, and the
 * rewritten text once a transform pass has produced one.
 */
public final class TranslationUnit {

    /** Name of the file this unit was read from */
    private final String input_filename;

    private final TokenList tokens;

    private final List<CstNode> nodes;

    /** Rewritten text, or null while the unit is unchanged */
    private String output_text;

    public TranslationUnit(String input_filename, TokenList tokens,
            List<CstNode> nodes) {
        this.input_filename = input_filename;
        this.tokens = tokens;
        this.nodes = Collections.unmodifiableList(
                new ArrayList<CstNode>(nodes));
        this.output_text = null;
    }

    public String getInputFilename() {
        return input_filename;
    }

    /** Returns the base name used for the output file. */
    public String getOutputFilename() {
        return new File(input_filename).getName();
    }

    public TokenList getTokens() {
        return tokens;
    }

    public List<CstNode> getNodes() {
        return nodes;
    }

    /** Returns the function definition nodes in source order. */
    public List<CstNode> getFunctions() {
        List<CstNode> ret = new ArrayList<CstNode>();
        for (CstNode node : nodes) {
            if (node.getKind() == CstNodeKind.FUNCTION) {
                ret.add(node);
            }
        }
        return ret;
    }

    public String getSource() {
        return tokens.getSource();
    }

    public boolean isModified() {
        return output_text != null && !output_text.equals(getSource());
    }

    /** Returns the rewritten text, or the original text if unchanged. */
    public String getOutputText() {
        return (output_text == null) ? getSource() : output_text;
    }

    public void setOutputText(String text) {
        output_text = text;
    }

    /**
    * Checks that the tokens tile the source without gaps or overlaps, which
    * is what lets untouched ranges be reproduced byte for byte.
    */
    public boolean checkConsistency() {
        int offset = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.getOffset() != offset || t.getLength() <= 0) {
                return false;
            }
            offset = t.getEnd();
        }
        if (offset != getSource().length()) {
            return false;
        }
        int last_end = 0;
        for (CstNode node : nodes) {
            if (node.getEndToken() > tokens.size()) {
                return false;
            }
            last_end = Math.max(last_end, node.getEndToken());
        }
        return last_end <= tokens.size();
    }

    /**
    * Writes the output text into the given directory, creating it if needed.
    *
    * @param outDir the output directory.
    * @throws IOException if the file cannot be written.
    */
    public void print(File outDir) throws IOException {
        if (!outDir.isDirectory() && !outDir.mkdirs()) {
            throw new IOException("cannot create directory " + outDir);
        }
        writeTo(new File(outDir, getOutputFilename()));
    }

    /**
    * Writes the output text to the given file, byte for byte as it was read.
    */
    private void writeTo(File file) throws IOException {
        Writer w = new OutputStreamWriter(new FileOutputStream(file),
                StandardCharsets.ISO_8859_1);
        try {
            w.write(getOutputText());
        } finally {
            w.close();
        }
    }

    /** Overwrites the input file with the output text. */
    public void printInPlace() throws IOException {
        writeTo(new File(input_filename));
    }

    @Override
    public String toString() {
        return getOutputText();
    }
}
