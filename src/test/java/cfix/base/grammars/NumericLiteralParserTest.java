package cfix.base.grammars;

import cfix.hir.FloatLiteral;
import cfix.hir.IntegerLiteral;
import cfix.hir.NumericLiteral;
import cfix.hir.NumericLiteralException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NumericLiteralParserTest {

    private static NumericLiteralException.Kind failure(String text) {
        NumericLiteralException e = assertThrows(NumericLiteralException.class,
                () -> NumericLiteralParser.parse(text));
        return e.getKind();
    }

    @Test
    void hexFloat() {
        NumericLiteral lit = NumericLiteralParser.parse("0x1.8p1");
        assertTrue(lit.isFloating());
        assertEquals(3.0, ((FloatLiteral)lit).getValue());
    }

    @Test
    void decimalFloatSuffixes() {
        FloatLiteral f = (FloatLiteral)NumericLiteralParser.parse("2.5f");
        assertEquals(2.5, f.getValue());
        assertTrue(f.isFloat());
        FloatLiteral l = (FloatLiteral)NumericLiteralParser.parse("1e2L");
        assertEquals(100.0, l.getValue());
        assertTrue(l.isLongDouble());
        FloatLiteral d = (FloatLiteral)NumericLiteralParser.parse("1.0dd");
        assertEquals(FloatLiteral.DecimalWidth.DFP_64, d.getDecimalWidth());
    }

    @Test
    void integerBases() {
        assertEquals(31, ((IntegerLiteral)NumericLiteralParser.parse("0x1F")).getValue());
        assertEquals(8, ((IntegerLiteral)NumericLiteralParser.parse("010")).getValue());
        assertEquals(5, ((IntegerLiteral)NumericLiteralParser.parse("0b101")).getValue());
        assertEquals(0, ((IntegerLiteral)NumericLiteralParser.parse("0")).getValue());
        assertEquals(1000000, ((IntegerLiteral)NumericLiteralParser.parse("1'000'000")).getValue());
    }

    @Test
    void integerSuffixes() {
        IntegerLiteral lit = (IntegerLiteral)NumericLiteralParser.parse("42ULL");
        assertTrue(lit.isUnsigned());
        assertTrue(lit.isLongLong());
        assertFalse(lit.isLong());
        IntegerLiteral lu = (IntegerLiteral)NumericLiteralParser.parse("7lu");
        assertTrue(lu.isUnsigned());
        assertTrue(lu.isLong());
    }

    @Test
    void largestUnsignedValue() {
        IntegerLiteral lit = (IntegerLiteral)NumericLiteralParser.parse(
                "18446744073709551615u");
        assertEquals(-1L, lit.getValue());
        assertEquals("18446744073709551615", lit.getUnsignedValue().toString());
    }

    @Test
    void rangeErrors() {
        assertEquals(NumericLiteralException.Kind.RANGE,
                failure("18446744073709551616"));
        assertEquals(NumericLiteralException.Kind.RANGE, failure("1e999"));
        NumericLiteralException e = assertThrows(NumericLiteralException.class,
                () -> NumericLiteralParser.parse("0x1p99999"));
        assertTrue(e.isRangeError());
    }

    @Test
    void formatErrors() {
        assertEquals(NumericLiteralException.Kind.INVALID_FORMAT, failure("09"));
        assertEquals(NumericLiteralException.Kind.INVALID_FORMAT, failure("1lL"));
        assertEquals(NumericLiteralException.Kind.INVALID_FORMAT, failure("12uu"));
        assertEquals(NumericLiteralException.Kind.INVALID_FORMAT, failure("0x"));
        assertEquals(NumericLiteralException.Kind.INVALID_FORMAT, failure("0b1.0"));
        assertEquals(NumericLiteralException.Kind.INVALID_FORMAT, failure(""));
    }
}
