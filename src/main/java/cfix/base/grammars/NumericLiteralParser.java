package cfix.base.grammars;

import java.util.Locale;
import java.util.regex.Pattern;

import cfix.hir.FloatLiteral;
import cfix.hir.IntegerLiteral;
import cfix.hir.NumericLiteral;
import cfix.hir.NumericLiteralException;

/**
 * Converts the spelling of a C numeric constant into an {@link IntegerLiteral}
 * or a {@link FloatLiteral}. Integer values are kept as unsigned 64-bit
 * quantities; C23 digit separators are ignored.
 */
public class NumericLiteralParser
{
  private static final Pattern decimal_float =
      Pattern.compile("([0-9]+\\.[0-9]*|\\.[0-9]+|[0-9]+)(e[+-]?[0-9]+)?");

  private static final Pattern hex_float = Pattern.compile(
      "0x([0-9a-f]+\\.[0-9a-f]*|\\.[0-9a-f]+|[0-9a-f]+)p[+-]?[0-9]+");

  private NumericLiteralParser()
  {
  }

  /**
   * Parses a numeric literal.
   *
   * @param text the literal as spelled in the source.
   * @return the parsed literal.
   * @throws NumericLiteralException if the text is not a valid literal
   *     ({@code INVALID_FORMAT}) or its value does not fit ({@code RANGE}).
   */
  public static NumericLiteral parse(String text)
  {
    if (text == null || text.isEmpty())
      throw invalid(text, "empty literal");
    String s = (text.indexOf('\'') >= 0) ? text.replace("'", "") : text;
    if (s.isEmpty())
      throw invalid(text, "empty literal");
    String lower = s.toLowerCase(Locale.ROOT);

    int base = 10;
    if (lower.startsWith("0x"))
      base = 16;
    else if (lower.startsWith("0b"))
      base = 2;

    if (isFloating(lower, base)) {
      if (base == 2)
        throw invalid(text, "binary floating constant");
      return parseFloat(text, lower, base);
    }
    return parseInteger(text, lower, base);
  }

  private static boolean isFloating(String lower, int base)
  {
    if (lower.indexOf('.') >= 0)
      return true;
    if (base == 16)
      return lower.indexOf('p') >= 0;
    if (base == 10)
      return lower.indexOf('e') >= 0;
    return false;
  }

  private static FloatLiteral parseFloat(String text, String lower, int base)
  {
    String body = lower;
    boolean is_float = false;
    boolean is_long_double = false;
    FloatLiteral.DecimalWidth width = FloatLiteral.DecimalWidth.NONE;
    if (base == 10 && lower.endsWith("df")) {
      width = FloatLiteral.DecimalWidth.DFP_32;
      body = lower.substring(0, lower.length() - 2);
    } else if (base == 10 && lower.endsWith("dd")) {
      width = FloatLiteral.DecimalWidth.DFP_64;
      body = lower.substring(0, lower.length() - 2);
    } else if (base == 10 && lower.endsWith("dl")) {
      width = FloatLiteral.DecimalWidth.DFP_128;
      body = lower.substring(0, lower.length() - 2);
    } else if (lower.endsWith("f")) {
      // a trailing f of a hex float is a suffix because the exponent is
      // decimal
      is_float = true;
      body = lower.substring(0, lower.length() - 1);
    } else if (lower.endsWith("l")) {
      is_long_double = true;
      body = lower.substring(0, lower.length() - 1);
    }

    Pattern shape = (base == 16) ? hex_float : decimal_float;
    if (!shape.matcher(body).matches())
      throw invalid(text, "malformed floating constant");

    double value;
    try {
      value = Double.parseDouble(body);
    } catch (NumberFormatException e) {
      throw invalid(text, e.getMessage());
    }
    if (Double.isInfinite(value))
      throw new NumericLiteralException(NumericLiteralException.Kind.RANGE,
          "floating constant out of range: " + text);
    return new FloatLiteral(text, value, is_float, is_long_double, width);
  }

  private static IntegerLiteral parseInteger(String text, String lower,
      int base)
  {
    int suffix_start = lower.length();
    while (suffix_start > 0) {
      char c = lower.charAt(suffix_start - 1);
      if (c != 'u' && c != 'l')
        break;
      suffix_start--;
    }
    String suffix = lower.substring(suffix_start);
    boolean unsigned = false;
    int longs = 0;
    if (suffix.equals("u")) {
      unsigned = true;
    } else if (suffix.equals("l")) {
      longs = 1;
    } else if (suffix.equals("ll")) {
      longs = 2;
    } else if (suffix.equals("ul") || suffix.equals("lu")) {
      unsigned = true;
      longs = 1;
    } else if (suffix.equals("ull") || suffix.equals("llu")) {
      unsigned = true;
      longs = 2;
    } else if (!suffix.isEmpty()) {
      throw invalid(text, "bad integer suffix " + suffix);
    }
    // mixed-case ll is not a suffix
    if (longs == 2) {
      String raw = text.replace("'", "");
      int at = raw.toLowerCase(Locale.ROOT).indexOf("ll", suffix_start);
      if (at >= 0 && raw.charAt(at) != raw.charAt(at + 1))
        throw invalid(text, "bad integer suffix " + suffix);
    }

    String digits = lower.substring(0, suffix_start);
    if (base == 16 || base == 2) {
      digits = digits.substring(2);
    } else if (digits.length() > 1 && digits.charAt(0) == '0') {
      base = 8;
      digits = digits.substring(1);
    }
    if (digits.isEmpty())
      throw invalid(text, "no digits");

    long value = 0;
    long limit = Long.divideUnsigned(-1L, base);
    for (int i = 0; i < digits.length(); i++) {
      int d = Character.digit(digits.charAt(i), base);
      if (d < 0)
        throw invalid(text, "digit '" + digits.charAt(i) +
            "' not allowed in base " + base);
      if (Long.compareUnsigned(value, limit) > 0)
        throw new NumericLiteralException(NumericLiteralException.Kind.RANGE,
            "integer constant out of range: " + text);
      long scaled = value * base;
      long next = scaled + d;
      if (Long.compareUnsigned(next, scaled) < 0)
        throw new NumericLiteralException(NumericLiteralException.Kind.RANGE,
            "integer constant out of range: " + text);
      value = next;
    }
    return new IntegerLiteral(text, value, base, unsigned, longs == 1,
        longs == 2);
  }

  private static NumericLiteralException invalid(String text, String why)
  {
    return new NumericLiteralException(
        NumericLiteralException.Kind.INVALID_FORMAT,
        "invalid numeric constant " + text + ": " + why);
  }
}
