package cfix.base.grammars;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import cfix.hir.CstNode;
import cfix.hir.CstNodeKind;
import cfix.hir.TokenKind;
import cfix.hir.TokenList;
import cfix.hir.TokenTools;

/**
 * Groups a token list into a flat sequence of semantic blocks: function
 * definitions, aggregate definitions, comments, macro lines, and single
 * leftover tokens. Whitespace never starts a node. The builder never fails;
 * malformed input degrades to one-token nodes.
 */
public class CstParser
{
  private final TokenList tokens;

  private final int n;

  private final List<CstNode> nodes;

  private CstParser(TokenList tokens)
  {
    this.tokens = tokens;
    this.n = tokens.size();
    this.nodes = new ArrayList<CstNode>();
  }

  /**
   * Builds the node list of a token list.
   *
   * @param tokens the tokens of one unit.
   * @return the top-level nodes in source order, each followed directly by
   *     the aggregates nested inside it.
   */
  public static List<CstNode> parse(TokenList tokens)
  {
    CstParser p = new CstParser(tokens);
    p.run();
    return p.nodes;
  }

  private void run()
  {
    int i = 0;
    while (i < n) {
      TokenKind k = tokens.getKind(i);
      if (k == TokenKind.WHITESPACE) {
        i++;
        continue;
      }
      if (isDeclarationStart(i)) {
        int end = matchFunction(i);
        if (end > i) {
          nodes.add(new CstNode(CstNodeKind.FUNCTION, i, end));
          i = end;
          continue;
        }
      }
      if (k.isAggregateKeyword() && !followsParen(i, 0)) {
        int brace = findAggregateBody(i, n);
        if (brace >= 0) {
          i = emitAggregate(i, brace, n, true);
          continue;
        }
      }
      nodes.add(new CstNode(singleTokenKind(k), i, i + 1));
      i++;
    }
  }

  /* ---------------------------------------------------------------------- */
  /* Aggregates                                                             */
  /* ---------------------------------------------------------------------- */

  /**
   * Emits the aggregate starting at {@code keyword} whose body opens at
   * {@code brace}, then its nested aggregates, and returns the index after
   * everything consumed.
   */
  private int emitAggregate(int keyword, int brace, int limit,
      boolean top_level)
  {
    int close = TokenTools.findMatching(tokens, brace, limit);
    int end = (close >= limit) ? limit : close + 1;
    int inline_var = -1;
    int inline_end = -1;
    int after = TokenTools.nextSignificant(tokens, end, limit);
    if (tokens.is(after, TokenKind.SEMICOLON) && after < limit) {
      end = after + 1;
    } else if (top_level && tokens.is(after, TokenKind.IDENTIFIER)) {
      int semi = TokenTools.nextSignificant(tokens, after + 1, limit);
      if (semi < limit && tokens.is(semi, TokenKind.SEMICOLON)) {
        inline_var = after;
        inline_end = semi + 1;
      }
    }
    nodes.add(new CstNode(CstNodeKind.forAggregate(tokens.getKind(keyword)),
        keyword, end));
    scanNested(brace + 1, Math.min(close, limit));
    if (inline_var >= 0) {
      nodes.add(new CstNode(CstNodeKind.OTHER, inline_var, inline_end));
      return inline_end;
    }
    return end;
  }

  /**
   * Emits every aggregate with a body inside {@code [from, to)}, at any
   * depth, in source order. Each frame holds the next index to examine and
   * the end of its range; a nested body is pushed on top of the remainder
   * of its parent so that children come right after their parent.
   */
  private void scanNested(int from, int to)
  {
    Deque<int[]> work = new ArrayDeque<int[]>();
    work.push(new int[] {from, to});
    while (!work.isEmpty()) {
      int[] frame = work.pop();
      int i = frame[0];
      int limit = frame[1];
      while (i < limit) {
        if (tokens.getKind(i).isAggregateKeyword() && !followsParen(i, from)) {
          int brace = findAggregateBody(i, limit);
          if (brace >= 0) {
            int close = TokenTools.findMatching(tokens, brace, limit);
            int end = (close >= limit) ? limit : close + 1;
            int after = TokenTools.nextSignificant(tokens, end, limit);
            if (after < limit && tokens.is(after, TokenKind.SEMICOLON))
              end = after + 1;
            nodes.add(new CstNode(
                CstNodeKind.forAggregate(tokens.getKind(i)), i, end));
            work.push(new int[] {end, limit});
            work.push(new int[] {brace + 1, Math.min(close, limit)});
            break;
          }
        }
        i++;
      }
    }
  }

  /**
   * Returns the index of the opening brace of the aggregate body after the
   * keyword at {@code keyword}, or -1 if the keyword has no body.
   */
  private int findAggregateBody(int keyword, int limit)
  {
    int j = skipAttributes(TokenTools.nextSignificant(tokens, keyword + 1,
        limit), limit);
    if (j < limit && tokens.is(j, TokenKind.IDENTIFIER))
      j = skipAttributes(TokenTools.nextSignificant(tokens, j + 1, limit),
          limit);
    if (j < limit && tokens.is(j, TokenKind.LBRACE))
      return j;
    return -1;
  }

  private boolean followsParen(int index, int lower_bound)
  {
    int prev = TokenTools.previousSignificant(tokens, index, lower_bound);
    return prev >= lower_bound && tokens.is(prev, TokenKind.LPAREN);
  }

  /* ---------------------------------------------------------------------- */
  /* Function definitions                                                   */
  /* ---------------------------------------------------------------------- */

  private boolean isDeclarationStart(int i)
  {
    TokenKind k = tokens.getKind(i);
    if (k == TokenKind.LBRACKET)
      return tokens.is(TokenTools.nextSignificant(tokens, i + 1, n),
          TokenKind.LBRACKET);
    return isTypeish(k);
  }

  private static boolean isTypeish(TokenKind k)
  {
    return k == TokenKind.IDENTIFIER || k.isTypeSpecifier() ||
        k.isStorageSpecifier() || k.isQualifier();
  }

  private boolean isAttributeName(int i)
  {
    return tokens.matches(i, "__attribute__") || tokens.matches(i, "__declspec")
        || tokens.matches(i, "__attribute");
  }

  /**
   * Skips GNU attributes and {@code [[...]]} attribute lists starting at the
   * significant token {@code j}.
   */
  private int skipAttributes(int j, int limit)
  {
    while (j < limit) {
      if (isAttributeName(j)) {
        int open = TokenTools.nextSignificant(tokens, j + 1, limit);
        if (open >= limit || !tokens.is(open, TokenKind.LPAREN))
          return j;
        int close = TokenTools.findMatching(tokens, open, limit);
        if (close >= limit)
          return limit;
        j = TokenTools.nextSignificant(tokens, close + 1, limit);
      } else if (tokens.is(j, TokenKind.LBRACKET) && tokens.is(
          TokenTools.nextSignificant(tokens, j + 1, limit), TokenKind.LBRACKET)) {
        int close = TokenTools.findMatching(tokens, j, limit);
        if (close >= limit)
          return limit;
        j = TokenTools.nextSignificant(tokens, close + 1, limit);
      } else {
        return j;
      }
    }
    return j;
  }

  /**
   * Returns the exclusive end of the function definition starting at
   * {@code start}, or -1 if the tokens there do not form one.
   */
  private int matchFunction(int start)
  {
    // declaration head up to the parameter list
    int j = start;
    int open = -1;
    while (j < n) {
      TokenKind k = tokens.getKind(j);
      if (k.isTrivia()) {
        j++;
        continue;
      }
      if (isAttributeName(j) || (k == TokenKind.LBRACKET && tokens.is(
          TokenTools.nextSignificant(tokens, j + 1, n), TokenKind.LBRACKET))) {
        int next = skipAttributes(j, n);
        if (next >= n)
          return -1;
        if (next > j) {
          j = next;
          continue;
        }
      }
      if (k == TokenKind.LPAREN) {
        open = j;
        break;
      }
      if (isHeadBreaker(k))
        return -1;
      j++;
    }
    if (open < 0)
      return -1;
    int prev = TokenTools.previousSignificant(tokens, open, start);
    if (prev < start || !(isTypeish(tokens.getKind(prev)) ||
        tokens.is(prev, TokenKind.STAR)))
      return -1;

    int close = TokenTools.findMatching(tokens, open, n);
    if (close >= n)
      return -1;
    int param_close = close;
    int param_open = open;
    int k2 = TokenTools.nextSignificant(tokens, close + 1, n);
    while (k2 < n && (tokens.is(k2, TokenKind.LPAREN) ||
        tokens.is(k2, TokenKind.LBRACKET) || isAttributeName(k2))) {
      if (isAttributeName(k2)) {
        int next = skipAttributes(k2, n);
        if (next == k2)
          return -1;
        k2 = next;
        continue;
      }
      close = TokenTools.findMatching(tokens, k2, n);
      if (close >= n)
        return -1;
      k2 = TokenTools.nextSignificant(tokens, close + 1, n);
    }
    if (k2 >= n)
      return -1;
    if (!tokens.is(k2, TokenKind.LBRACE)) {
      if (!isIdentifierList(param_open, param_close))
        return -1;
      k2 = matchKnrDeclarations(k2);
      if (k2 < 0)
        return -1;
    }
    int body_close = TokenTools.findMatching(tokens, k2, n);
    return (body_close >= n) ? n : body_close + 1;
  }

  private static boolean isHeadBreaker(TokenKind k)
  {
    switch (k) {
      case SEMICOLON:
      case LBRACE:
      case RBRACE:
      case ASSIGN:
      case PLUS:
      case MINUS:
      case SLASH:
      case PERCENT:
      case RPAREN:
      case NUMBER_LITERAL:
      case STRING_LITERAL:
      case CHAR_LITERAL:
      case MACRO:
      case OTHER:
      case KEYWORD_RETURN:
      case KEYWORD_IF:
      case KEYWORD_WHILE:
      case KEYWORD_FOR:
      case KEYWORD_SWITCH:
      case KEYWORD_DO:
      case KEYWORD_SIZEOF:
      case KEYWORD_TYPEDEF:
        return true;
      default:
        return false;
    }
  }

  /** Checks that {@code (open, close)} holds only identifiers and commas. */
  private boolean isIdentifierList(int open, int close)
  {
    boolean seen = false;
    for (int i = open + 1; i < close; i++) {
      TokenKind k = tokens.getKind(i);
      if (k.isTrivia() || k == TokenKind.COMMA)
        continue;
      if (k != TokenKind.IDENTIFIER)
        return false;
      seen = true;
    }
    return seen;
  }

  /**
   * Matches old-style parameter declarations starting at {@code from} and
   * returns the index of the body's opening brace, or -1.
   */
  private int matchKnrDeclarations(int from)
  {
    int last = -1;
    for (int i = from; i < n; i++) {
      TokenKind k = tokens.getKind(i);
      if (k.isTrivia())
        continue;
      if (k == TokenKind.LBRACE)
        return tokens.is(last, TokenKind.SEMICOLON) ? i : -1;
      if (k.isAggregateKeyword() || k == TokenKind.RBRACE ||
          k == TokenKind.ASSIGN || k == TokenKind.MACRO)
        return -1;
      last = i;
    }
    return -1;
  }

  private static CstNodeKind singleTokenKind(TokenKind k)
  {
    if (k.isAggregateKeyword())
      return CstNodeKind.forAggregate(k);
    switch (k) {
      case COMMENT:
        return CstNodeKind.COMMENT;
      case MACRO:
        return CstNodeKind.MACRO;
      case OTHER:
        return CstNodeKind.UNKNOWN;
      default:
        return CstNodeKind.OTHER;
    }
  }
}
