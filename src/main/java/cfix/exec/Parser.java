package cfix.exec;

import cfix.base.grammars.CTokenizer;
import cfix.base.grammars.CstParser;
import cfix.hir.CstNode;
import cfix.hir.PrintTools;
import cfix.hir.TokenList;
import cfix.hir.Tools;
import cfix.hir.TranslationUnit;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reads a source file and builds its {@link TranslationUnit}: the token list
 * and the flat CST. Nothing is preprocessed; macro lines stay in the token
 * stream as single tokens.
 */
public class Parser
{
  public Parser()
  {
  }

  /**
   * Parse this translation unit.
   * The file is read as ISO-8859-1 so that every byte maps to one character
   * and survives the round trip unchanged.
   *
   * @param input_filename Name of file to parse
   * @throws IOException if there is a problem accessing the file.
   * @return Parsed TranslationUnit
   */
  public TranslationUnit parse(String input_filename) throws IOException
  {
    return parse(input_filename, readFile(new File(input_filename)));
  }

  /**
   * Parse the given text as if it were read from the named file.
   *
   * @param input_filename Name recorded in the unit
   * @param text the source text
   * @return Parsed TranslationUnit
   */
  public TranslationUnit parse(String input_filename, String text)
  {
    double timer = Tools.getTime();
    TokenList tokens = CTokenizer.tokenize(text);
    List<CstNode> nodes = CstParser.parse(tokens);
    PrintTools.printlnStatus(2, "Parsed", input_filename + ":",
        tokens.size(), "tokens,", nodes.size(), "nodes in",
        String.format("%.2f", Tools.getTime(timer)), "seconds");
    return new TranslationUnit(input_filename, tokens, nodes);
  }

  static String readFile(File file) throws IOException
  {
    Reader in = new InputStreamReader(new FileInputStream(file),
        StandardCharsets.ISO_8859_1);
    StringBuilder sb = new StringBuilder((int)Math.min(file.length(), 1 << 24));
    try {
      char[] buf = new char[8192];
      int n;
      while ((n = in.read(buf)) > 0)
        sb.append(buf, 0, n);
    } finally {
      in.close();
    }
    return sb.toString();
  }
}
