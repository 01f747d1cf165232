package cfix.base.grammars;

import cfix.hir.CstNode;
import cfix.hir.CstNodeKind;
import cfix.hir.TokenList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CstParserTest {

    private static List<CstNode> parse(TokenList tokens) {
        return CstParser.parse(tokens);
    }

    @Test
    void structWithInlineVariable() {
        TokenList tokens = CTokenizer.tokenize("struct S { int x; } s;");
        List<CstNode> nodes = parse(tokens);
        assertEquals(2, nodes.size());
        assertEquals(CstNodeKind.STRUCT, nodes.get(0).getKind());
        assertEquals("struct S { int x; }", nodes.get(0).getText(tokens));
        assertEquals(CstNodeKind.OTHER, nodes.get(1).getKind());
        assertEquals("s;", nodes.get(1).getText(tokens));
    }

    @Test
    void aggregateAbsorbsSemicolon() {
        TokenList tokens = CTokenizer.tokenize("enum color { RED, GREEN };\n");
        List<CstNode> nodes = parse(tokens);
        assertEquals(1, nodes.size());
        assertEquals(CstNodeKind.ENUM, nodes.get(0).getKind());
        assertEquals("enum color { RED, GREEN };", nodes.get(0).getText(tokens));
    }

    @Test
    void nestedAggregatesFollowTheirParent() {
        TokenList tokens = CTokenizer.tokenize(
                "struct outer { union u { int a; float b; } v; struct { int c; } w; };");
        List<CstNode> nodes = parse(tokens);
        assertEquals(3, nodes.size());
        assertEquals(CstNodeKind.STRUCT, nodes.get(0).getKind());
        assertEquals(CstNodeKind.UNION, nodes.get(1).getKind());
        assertEquals("union u { int a; float b; }", nodes.get(1).getText(tokens));
        assertEquals(CstNodeKind.STRUCT, nodes.get(2).getKind());
        assertEquals("struct { int c; }", nodes.get(2).getText(tokens));
        assertTrue(nodes.get(0).contains(nodes.get(1)));
    }

    @Test
    void functionDefinitions() {
        String src = "static char *dup(const char *s) { return 0; }\n" +
                "main() { return 1; }\n";
        TokenList tokens = CTokenizer.tokenize(src);
        List<CstNode> nodes = parse(tokens);
        assertEquals(2, nodes.size());
        assertEquals(CstNodeKind.FUNCTION, nodes.get(0).getKind());
        assertEquals("static char *dup(const char *s) { return 0; }",
                nodes.get(0).getText(tokens));
        assertEquals(CstNodeKind.FUNCTION, nodes.get(1).getKind());
        assertEquals("main() { return 1; }", nodes.get(1).getText(tokens));
    }

    @Test
    void functionReturningStructPointer() {
        TokenList tokens = CTokenizer.tokenize("struct S *make(void) { return 0; }");
        List<CstNode> nodes = parse(tokens);
        assertEquals(1, nodes.size());
        assertEquals(CstNodeKind.FUNCTION, nodes.get(0).getKind());
    }

    @Test
    void knrDefinition() {
        TokenList tokens = CTokenizer.tokenize("int add(a, b) int a; int b; { return a + b; }");
        List<CstNode> nodes = parse(tokens);
        assertEquals(1, nodes.size());
        assertEquals(CstNodeKind.FUNCTION, nodes.get(0).getKind());
    }

    @Test
    void prototypeIsNotADefinition() {
        TokenList tokens = CTokenizer.tokenize("int f(int);");
        for (CstNode node : parse(tokens)) {
            assertNotEquals(CstNodeKind.FUNCTION, node.getKind());
            assertEquals(1, node.getEndToken() - node.getStartToken());
        }
    }

    @Test
    void commentsAndMacrosAreOwnNodes() {
        TokenList tokens = CTokenizer.tokenize("/* c */\n#include <x.h>\n@");
        List<CstNode> nodes = parse(tokens);
        assertEquals(3, nodes.size());
        assertEquals(CstNodeKind.COMMENT, nodes.get(0).getKind());
        assertEquals(CstNodeKind.MACRO, nodes.get(1).getKind());
        assertEquals(CstNodeKind.UNKNOWN, nodes.get(2).getKind());
    }

    @Test
    void unterminatedBodyRunsToTheEnd() {
        TokenList tokens = CTokenizer.tokenize("void f() { if (x) {");
        List<CstNode> nodes = parse(tokens);
        assertEquals(1, nodes.size());
        assertEquals(tokens.size(), nodes.get(0).getEndToken());
    }
}
