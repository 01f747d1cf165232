package cfix.hir;

import cfix.base.grammars.CTokenizer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TokenToolsTest {

    @Test
    void spellRemovesSplicesAndTrigraphs() {
        assertEquals("malloc", TokenTools.spell("mal\\\nloc"));
        assertEquals("a[1]", TokenTools.spell("a??(1??)"));
        assertEquals("plain", TokenTools.spell("plain"));
    }

    @Test
    void significantNeighbours() {
        TokenList tokens = CTokenizer.tokenize("a /* c */ b");
        assertEquals(4, TokenTools.nextSignificant(tokens, 1, tokens.size()));
        assertEquals(0, TokenTools.previousSignificant(tokens, 4, 0));
        assertEquals(-1, TokenTools.previousSignificant(tokens, 0, 0));
        assertEquals(tokens.size(), TokenTools.nextSignificant(tokens, 5,
                tokens.size()));
    }

    @Test
    void matchingAndArguments() {
        TokenList tokens = CTokenizer.tokenize("f(a, g(b, c), d[1, 2])");
        int close = TokenTools.findMatching(tokens, 1, tokens.size());
        assertEquals(tokens.size() - 1, close);
        assertEquals(3, TokenTools.countArguments(tokens, 1, close));
        TokenList empty = CTokenizer.tokenize("f( )");
        assertEquals(0, TokenTools.countArguments(empty, 1, 3));
    }

    @Test
    void argumentTextByIndex() {
        TokenList tokens = CTokenizer.tokenize("f(&s, g(b, c) , \"%d\")");
        int close = TokenTools.findMatching(tokens, 1, tokens.size());
        assertEquals("&s", TokenTools.argumentText(tokens, 1, close, 0));
        assertEquals("g(b, c)", TokenTools.argumentText(tokens, 1, close, 1));
        assertEquals("\"%d\"", TokenTools.argumentText(tokens, 1, close, 2));
        assertNull(TokenTools.argumentText(tokens, 1, close, 3));
        assertNull(TokenTools.argumentText(tokens, 1, close, -1));
        TokenList empty = CTokenizer.tokenize("f( )");
        assertNull(TokenTools.argumentText(empty, 1, 3, 0));
    }

    @Test
    void statementBoundaries() {
        TokenList tokens = CTokenizer.tokenize("{ x = f(1; 2); y = 3; }");
        // tokens: { _ x _ = _ f ( 1 ; _ 2 ) ; _ y ...
        assertEquals(13, TokenTools.findStatementEnd(tokens, 2, tokens.size()));
        assertEquals(15, TokenTools.findStatementStart(tokens, 19, 0));
        assertEquals(2, TokenTools.findStatementStart(tokens, 6, 0));
    }

    @Test
    void conditionDetection() {
        TokenList tokens = CTokenizer.tokenize("if (p == 0) q = p;");
        assertTrue(TokenTools.isInsideCondition(tokens, 3, 0));
        int last_p = tokens.size() - 2;
        assertTrue(tokens.matches(last_p, "p"));
        assertFalse(TokenTools.isInsideCondition(tokens, last_p, 0));
    }

    @Test
    void trimmedText() {
        TokenList tokens = CTokenizer.tokenize("  char * \n");
        assertEquals("char *", TokenTools.trimmedText(tokens, 0, tokens.size()));
        assertEquals("a b", TokenTools.collapseWhitespace("a \n\t b"));
    }
}
