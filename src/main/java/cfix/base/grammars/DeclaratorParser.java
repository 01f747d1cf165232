package cfix.base.grammars;

import java.util.ArrayList;
import java.util.List;

import cfix.hir.ArrayType;
import cfix.hir.BaseType;
import cfix.hir.DeclInfo;
import cfix.hir.DeclType;
import cfix.hir.FunctionType;
import cfix.hir.PointerType;
import cfix.hir.TokenKind;
import cfix.hir.TokenList;
import cfix.hir.TokenTools;
import cfix.hir.UnsupportedInput;

/**
 * Parses one declaration into its identifier and a canonical type chain.
 * The declarator is read with the right-left rule: starting at the
 * identifier, array and function suffixes on the right bind first, pointer
 * stars on the left next, and a grouping parenthesis pair is unwrapped when
 * both sides are exhausted.
 */
public class DeclaratorParser
{
  private final TokenList tokens;

  private final int end;

  private DeclaratorParser(TokenList tokens, int end)
  {
    this.tokens = tokens;
    this.end = end;
  }

  /**
   * Parses the declaration covering tokens {@code [start, end)}.
   *
   * @param tokens the token list.
   * @param start the first token of the declaration.
   * @param end the exclusive end of the declaration.
   * @return the declared identifier, or null for an abstract declarator,
   *     and the type chain, outermost first.
   * @throws UnsupportedInput if the range is empty, has no base type, or
   *     leaves unmatched tokens left of the identifier.
   */
  public static DeclInfo parse(TokenList tokens, int start, int end)
  {
    return new DeclaratorParser(tokens, end).parse(start);
  }

  private DeclInfo parse(int start)
  {
    int s = TokenTools.nextSignificant(tokens, start, end);
    if (s >= end)
      throw new UnsupportedInput("empty declaration");
    int base_end = scanBase(s);
    if (base_end == s)
      throw new UnsupportedInput("no base type in " +
          TokenTools.trimmedText(tokens, s, end));

    // find the identifier, or the hole where it would be
    String identifier = null;
    int left;
    int right;
    int p = base_end;
    while (true) {
      p = TokenTools.nextSignificant(tokens, p, end);
      if (p >= end) {
        left = right = end;
        break;
      }
      TokenKind k = tokens.getKind(p);
      if (k == TokenKind.STAR || k.isQualifier()) {
        p++;
      } else if (k == TokenKind.LPAREN && isGrouping(p)) {
        p++;
      } else if (k == TokenKind.IDENTIFIER) {
        identifier = tokens.getSpelling(p);
        left = p;
        right = p + 1;
        break;
      } else {
        left = right = p;
        break;
      }
    }

    List<DeclType> chain = new ArrayList<DeclType>();
    boolean moved = true;
    while (moved) {
      moved = false;
      // suffixes bind tighter than the prefix stars
      while (true) {
        int r = TokenTools.nextSignificant(tokens, right, end);
        if (r >= end)
          break;
        if (!tokens.is(r, TokenKind.LBRACKET) && !tokens.is(r, TokenKind.LPAREN))
          break;
        int close = TokenTools.findMatching(tokens, r, end);
        if (close >= end)
          break;
        String inside = TokenTools.trimmedText(tokens, r + 1, close);
        if (tokens.is(r, TokenKind.LBRACKET))
          chain.add(new ArrayType(inside.isEmpty() ? null : inside));
        else
          chain.add(new FunctionType(inside));
        right = close + 1;
        moved = true;
      }
      while (true) {
        int q = TokenTools.previousSignificant(tokens, left, base_end);
        int first = -1;
        int last = -1;
        while (q >= base_end && tokens.getKind(q).isQualifier()) {
          if (last < 0)
            last = q;
          first = q;
          q = TokenTools.previousSignificant(tokens, q, base_end);
        }
        if (q < base_end || !tokens.is(q, TokenKind.STAR))
          break;
        chain.add(new PointerType((last < 0) ? null :
            tokens.getText(first, last + 1)));
        left = q;
        moved = true;
      }
      int l = TokenTools.previousSignificant(tokens, left, base_end);
      int r = TokenTools.nextSignificant(tokens, right, end);
      if (l >= base_end && tokens.is(l, TokenKind.LPAREN) && r < end &&
          tokens.is(r, TokenKind.RPAREN)) {
        left = l;
        right = r + 1;
        moved = true;
      }
    }
    if (TokenTools.previousSignificant(tokens, left, base_end) >= base_end)
      throw new UnsupportedInput("unbalanced declarator " +
          TokenTools.trimmedText(tokens, s, end));

    DeclType type = new BaseType(TokenTools.trimmedText(tokens, s, base_end));
    for (int i = chain.size() - 1; i >= 0; i--) {
      DeclType outer = chain.get(i);
      outer.setInner(type);
      type = outer;
    }
    return new DeclInfo(identifier, type);
  }

  /** A parenthesis opens a nested declarator when a star or paren follows. */
  private boolean isGrouping(int open)
  {
    int q = TokenTools.nextSignificant(tokens, open + 1, end);
    return q < end && (tokens.is(q, TokenKind.STAR) ||
        tokens.is(q, TokenKind.LPAREN));
  }

  /**
   * Scans the declaration specifiers starting at {@code s} and returns the
   * exclusive end of the last unit.
   */
  private int scanBase(int s)
  {
    boolean saw_type = false;
    int base_end = s;
    int i = s;
    while (true) {
      i = TokenTools.nextSignificant(tokens, i, end);
      if (i >= end)
        break;
      TokenKind k = tokens.getKind(i);
      int unit_end;
      if (k == TokenKind.KEYWORD_ATOMIC && nextIs(i, TokenKind.LPAREN)) {
        unit_end = groupEnd(TokenTools.nextSignificant(tokens, i + 1, end));
        saw_type = true;
      } else if (k.isStorageSpecifier() || k.isQualifier()) {
        unit_end = i + 1;
      } else if (k.isAggregateKeyword()) {
        int j = TokenTools.nextSignificant(tokens, i + 1, end);
        unit_end = i + 1;
        if (tokens.is(j, TokenKind.IDENTIFIER) && j < end) {
          unit_end = j + 1;
          j = TokenTools.nextSignificant(tokens, j + 1, end);
        }
        if (j < end && tokens.is(j, TokenKind.LBRACE))
          unit_end = groupEnd(j);
        saw_type = true;
      } else if (k == TokenKind.KEYWORD_TYPEOF ||
          k == TokenKind.KEYWORD_TYPEOF_UNQUAL ||
          k == TokenKind.KEYWORD_GNU_TYPEOF) {
        if (!nextIs(i, TokenKind.LPAREN))
          throw new UnsupportedInput("typeof without operand");
        unit_end = groupEnd(TokenTools.nextSignificant(tokens, i + 1, end));
        saw_type = true;
      } else if (k.isTypeSpecifier()) {
        unit_end = i + 1;
        saw_type = true;
      } else if ((k == TokenKind.KEYWORD_ALIGNAS ||
          k == TokenKind.KEYWORD_ALIGNAS_C23 || isAttributeName(i)) &&
          nextIs(i, TokenKind.LPAREN)) {
        unit_end = groupEnd(TokenTools.nextSignificant(tokens, i + 1, end));
      } else if (k == TokenKind.LBRACKET && nextIs(i, TokenKind.LBRACKET)) {
        unit_end = groupEnd(i);
      } else if (k == TokenKind.IDENTIFIER && !saw_type) {
        unit_end = i + 1;
        saw_type = true;
      } else {
        break;
      }
      base_end = unit_end;
      i = unit_end;
    }
    return base_end;
  }

  private boolean nextIs(int i, TokenKind kind)
  {
    int j = TokenTools.nextSignificant(tokens, i + 1, end);
    return j < end && tokens.is(j, kind);
  }

  private boolean isAttributeName(int i)
  {
    return tokens.matches(i, "__attribute__") ||
        tokens.matches(i, "__attribute") || tokens.matches(i, "__declspec");
  }

  /** Returns the index after the group opened at {@code open}. */
  private int groupEnd(int open)
  {
    int close = TokenTools.findMatching(tokens, open, end);
    if (close >= end)
      throw new UnsupportedInput("unbalanced " + tokens.getText(open));
    return close + 1;
  }
}
