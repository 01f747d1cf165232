package cfix.base.grammars;

import cfix.hir.Token;
import cfix.hir.TokenKind;
import cfix.hir.TokenList;
import cfix.hir.TokenTools;
import cfix.hir.UnsupportedInput;

/**
 * Lossless C tokenizer. Every character of the input ends up in exactly one
 * token, whitespace and comments included, so that untouched ranges can be
 * reproduced verbatim after rewriting.
 * <p>
 * Token boundaries are computed on the logical character stream: trigraphs
 * are replaced first (translation phase 1) and backslash-newline pairs are
 * skipped next (phase 2). The tokens themselves still cover the raw
 * characters. Malformed input never stops the scan; unterminated literals
 * and comments run to the end of the input and unknown characters become
 * {@link TokenKind#OTHER} tokens.
 */
public class CTokenizer
{
  private final String src;

  private final int n;

  private final TokenList out;

  /** Only blanks have been seen since the last newline. */
  private boolean line_start;

  private CTokenizer(String source)
  {
    src = source;
    n = source.length();
    out = new TokenList(source);
    line_start = true;
  }

  /**
   * Tokenizes the given source text.
   *
   * @param source the complete text of one source unit.
   * @return the token list covering every character of the input.
   * @throws UnsupportedInput if the source is null.
   */
  public static TokenList tokenize(String source)
  {
    if (source == null)
      throw new UnsupportedInput("no source text");
    CTokenizer t = new CTokenizer(source);
    t.run();
    return t.out;
  }

  private void run()
  {
    int pos = 0;
    while (pos < n) {
      int c = peek(pos);
      if (c < 0) {
        // only line splices remain
        emit(TokenKind.WHITESPACE, pos, n);
        break;
      }
      if (isSpace(c)) {
        int end = pos;
        while (end < n && isSpace(peek(end)))
          end = next(end);
        pos = emit(TokenKind.WHITESPACE, pos, end);
      } else if (c == '/' && peek(next(pos)) == '/') {
        pos = emit(TokenKind.COMMENT, pos, scanLineComment(pos));
      } else if (c == '/' && peek(next(pos)) == '*') {
        pos = emit(TokenKind.COMMENT, pos, scanBlockComment(pos));
      } else if (line_start && (c == '#' ||
                 (c == '%' && peek(next(pos)) == ':'))) {
        pos = emit(TokenKind.MACRO, pos, scanMacroLine(pos));
      } else if (isIdentifierStart(c) || isUniversalName(pos)) {
        pos = scanIdentifier(pos);
      } else if (isDigit(c) || (c == '.' && isDigit(peek(next(pos))))) {
        pos = emit(TokenKind.NUMBER_LITERAL, pos, scanNumber(pos));
      } else if (c == '"') {
        pos = emit(TokenKind.STRING_LITERAL, pos, scanQuoted(pos, '"'));
      } else if (c == '\'') {
        pos = emit(TokenKind.CHAR_LITERAL, pos, scanQuoted(pos, '\''));
      } else {
        pos = scanPunctuator(pos, c);
      }
    }
  }

  /* ---------------------------------------------------------------------- */
  /* Logical character stream                                               */
  /* ---------------------------------------------------------------------- */

  private boolean isTrigraphAt(int pos)
  {
    return pos + 2 < n && src.charAt(pos) == '?' && src.charAt(pos + 1) == '?'
        && TokenTools.trigraph(src.charAt(pos + 2)) != 0;
  }

  /** Skips any backslash-newline pairs starting at pos. */
  private int skipSplices(int pos)
  {
    while (pos < n) {
      int width;
      if (src.charAt(pos) == '\\')
        width = 1;
      else if (isTrigraphAt(pos) && src.charAt(pos + 2) == '/')
        width = 3;
      else
        break;
      int q = pos + width;
      if (q < n && src.charAt(q) == '\n')
        pos = q + 1;
      else if (q + 1 < n && src.charAt(q) == '\r' && src.charAt(q + 1) == '\n')
        pos = q + 2;
      else
        break;
    }
    return pos;
  }

  /** Returns the logical character at pos, or -1 at the end of input. */
  private int peek(int pos)
  {
    pos = skipSplices(pos);
    if (pos >= n)
      return -1;
    if (isTrigraphAt(pos))
      return TokenTools.trigraph(src.charAt(pos + 2));
    return src.charAt(pos);
  }

  /** Returns the raw position following the logical character at pos. */
  private int next(int pos)
  {
    pos = skipSplices(pos);
    if (pos >= n)
      return n;
    return pos + (isTrigraphAt(pos) ? 3 : 1);
  }

  private int advance(int pos, int count)
  {
    for (int i = 0; i < count; i++)
      pos = next(pos);
    return pos;
  }

  /* ---------------------------------------------------------------------- */
  /* Scanners                                                               */
  /* ---------------------------------------------------------------------- */

  private int emit(TokenKind kind, int start, int end)
  {
    out.add(new Token(kind, start, end - start));
    if (kind == TokenKind.WHITESPACE || kind == TokenKind.COMMENT) {
      if (TokenTools.spell(src.substring(start, end)).indexOf('\n') >= 0)
        line_start = true;
    } else if (kind == TokenKind.MACRO) {
      line_start = true;
    } else {
      line_start = false;
    }
    return end;
  }

  private int scanLineComment(int pos)
  {
    int end = advance(pos, 2);
    int c;
    while ((c = peek(end)) >= 0 && c != '\n' && !isCrlf(end))
      end = next(end);
    return end;
  }

  private boolean isCrlf(int pos)
  {
    pos = skipSplices(pos);
    return pos + 1 < n && src.charAt(pos) == '\r' && src.charAt(pos + 1) == '\n';
  }

  private int scanBlockComment(int pos)
  {
    int end = advance(pos, 2);
    while (true) {
      int c = peek(end);
      if (c < 0)
        return n;
      if (c == '*' && peek(next(end)) == '/')
        return advance(end, 2);
      end = next(end);
    }
  }

  /** A directive runs to the end of its logical line. */
  private int scanMacroLine(int pos)
  {
    int end = pos;
    while (true) {
      int c = peek(end);
      if (c < 0)
        return n;
      if (c == '\n' || isCrlf(end))
        return skipSplices(end);
      if (c == '/' && peek(next(end)) == '*')
        end = scanBlockComment(end);
      else
        end = next(end);
    }
  }

  private int scanIdentifier(int pos)
  {
    int end = pos;
    while (true) {
      int c = peek(end);
      if (c >= 0 && isIdentifierPart(c))
        end = next(end);
      else if (c == '\\' && isUniversalName(end))
        end = advance(end, 2);
      else
        break;
    }
    String word = TokenTools.spell(src.substring(pos, end));
    int q = peek(end);
    if ((q == '"' || q == '\'') && (word.equals("L") || word.equals("u") ||
        word.equals("U") || word.equals("u8"))) {
      TokenKind kind = (q == '"') ? TokenKind.STRING_LITERAL
                                  : TokenKind.CHAR_LITERAL;
      return emit(kind, pos, scanQuoted(end, (char)q));
    }
    TokenKind keyword = TokenKind.lookupKeyword(word);
    return emit((keyword != null) ? keyword : TokenKind.IDENTIFIER, pos, end);
  }

  /** Checks for a {@code \}{@code u} or {@code \U} universal character name. */
  private boolean isUniversalName(int pos)
  {
    if (peek(pos) != '\\')
      return false;
    int p1 = next(pos);
    int u = peek(p1);
    return (u == 'u' || u == 'U') && isHexDigit(peek(next(p1)));
  }

  private int scanNumber(int pos)
  {
    int prev = peek(pos);
    int end = next(pos);
    while (true) {
      int c = peek(end);
      if (c < 0)
        break;
      if (isIdentifierPart(c) || c == '.') {
        // identifier characters cover digits, letters, and '_'
      } else if ((c == '+' || c == '-') && (prev == 'e' || prev == 'E' ||
                 prev == 'p' || prev == 'P')) {
        // exponent sign
      } else if (c == '\'' && isAlnum(peek(next(end)))) {
        // digit separator
      } else {
        break;
      }
      prev = c;
      end = next(end);
    }
    return end;
  }

  /** Scans a literal whose opening quote is at pos. */
  private int scanQuoted(int pos, char quote)
  {
    int end = next(pos);
    while (true) {
      int c = peek(end);
      if (c < 0)
        return n;
      end = next(end);
      if (c == '\\') {
        if (peek(end) < 0)
          return n;
        end = next(end);
      } else if (c == quote) {
        return end;
      }
    }
  }

  private int scanPunctuator(int pos, int c)
  {
    int c1 = peek(next(pos));
    TokenKind kind;
    int len = 1;
    switch (c) {
      case '{': kind = TokenKind.LBRACE; break;
      case '}': kind = TokenKind.RBRACE; break;
      case '[': kind = TokenKind.LBRACKET; break;
      case ']': kind = TokenKind.RBRACKET; break;
      case '(': kind = TokenKind.LPAREN; break;
      case ')': kind = TokenKind.RPAREN; break;
      case ';': kind = TokenKind.SEMICOLON; break;
      case ',': kind = TokenKind.COMMA; break;
      case '~': kind = TokenKind.TILDE; break;
      case '?': kind = TokenKind.QUESTION; break;
      case ':':
        if (c1 == '>') { kind = TokenKind.RBRACKET; len = 2; }
        else kind = TokenKind.COLON;
        break;
      case '/':
        if (c1 == '=') { kind = TokenKind.DIV_ASSIGN; len = 2; }
        else kind = TokenKind.SLASH;
        break;
      case '=':
        if (c1 == '=') { kind = TokenKind.EQ; len = 2; }
        else kind = TokenKind.ASSIGN;
        break;
      case '!':
        if (c1 == '=') { kind = TokenKind.NE; len = 2; }
        else kind = TokenKind.NOT;
        break;
      case '+':
        if (c1 == '+') { kind = TokenKind.INCREMENT; len = 2; }
        else if (c1 == '=') { kind = TokenKind.PLUS_ASSIGN; len = 2; }
        else kind = TokenKind.PLUS;
        break;
      case '-':
        if (c1 == '-') { kind = TokenKind.DECREMENT; len = 2; }
        else if (c1 == '>') { kind = TokenKind.ARROW; len = 2; }
        else if (c1 == '=') { kind = TokenKind.MINUS_ASSIGN; len = 2; }
        else kind = TokenKind.MINUS;
        break;
      case '*':
        if (c1 == '=') { kind = TokenKind.MUL_ASSIGN; len = 2; }
        else kind = TokenKind.STAR;
        break;
      case '%':
        if (c1 == '=') { kind = TokenKind.MOD_ASSIGN; len = 2; }
        else if (c1 == '>') { kind = TokenKind.RBRACE; len = 2; }
        else if (c1 == ':') {
          int p2 = advance(pos, 2);
          if (peek(p2) == '%' && peek(next(p2)) == ':') {
            kind = TokenKind.HASH_HASH;
            len = 4;
          } else {
            kind = TokenKind.HASH;
            len = 2;
          }
        }
        else kind = TokenKind.PERCENT;
        break;
      case '<':
        if (c1 == '<') {
          if (peek(advance(pos, 2)) == '=') { kind = TokenKind.LSHIFT_ASSIGN; len = 3; }
          else { kind = TokenKind.LSHIFT; len = 2; }
        }
        else if (c1 == '=') { kind = TokenKind.LE; len = 2; }
        else if (c1 == '%') { kind = TokenKind.LBRACE; len = 2; }
        else if (c1 == ':') { kind = TokenKind.LBRACKET; len = 2; }
        else kind = TokenKind.LT;
        break;
      case '>':
        if (c1 == '>') {
          if (peek(advance(pos, 2)) == '=') { kind = TokenKind.RSHIFT_ASSIGN; len = 3; }
          else { kind = TokenKind.RSHIFT; len = 2; }
        }
        else if (c1 == '=') { kind = TokenKind.GE; len = 2; }
        else kind = TokenKind.GT;
        break;
      case '&':
        if (c1 == '&') { kind = TokenKind.LOGICAL_AND; len = 2; }
        else if (c1 == '=') { kind = TokenKind.AND_ASSIGN; len = 2; }
        else kind = TokenKind.AMPERSAND;
        break;
      case '|':
        if (c1 == '|') { kind = TokenKind.LOGICAL_OR; len = 2; }
        else if (c1 == '=') { kind = TokenKind.OR_ASSIGN; len = 2; }
        else kind = TokenKind.PIPE;
        break;
      case '^':
        if (c1 == '=') { kind = TokenKind.XOR_ASSIGN; len = 2; }
        else kind = TokenKind.CARET;
        break;
      case '.':
        if (c1 == '.' && peek(advance(pos, 2)) == '.') {
          kind = TokenKind.ELLIPSIS;
          len = 3;
        }
        else kind = TokenKind.DOT;
        break;
      case '#':
        if (c1 == '#') { kind = TokenKind.HASH_HASH; len = 2; }
        else kind = TokenKind.HASH;
        break;
      default:
        kind = TokenKind.OTHER;
        break;
    }
    return emit(kind, pos, advance(pos, len));
  }

  /* ---------------------------------------------------------------------- */
  /* Character classes                                                      */
  /* ---------------------------------------------------------------------- */

  private static boolean isSpace(int c)
  {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' ||
        c == 0x0b;
  }

  private static boolean isDigit(int c)
  {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(int c)
  {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isAlnum(int c)
  {
    return isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isIdentifierStart(int c)
  {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' ||
        c == '$' || c >= 0x80;
  }

  private static boolean isIdentifierPart(int c)
  {
    return isIdentifierStart(c) || isDigit(c);
  }
}
