package cfix.base.grammars;

import cfix.hir.ArrayType;
import cfix.hir.DeclInfo;
import cfix.hir.DeclType;
import cfix.hir.PointerType;
import cfix.hir.TokenList;
import cfix.hir.UnsupportedInput;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DeclaratorParserTest {

    private static DeclInfo parse(String text) {
        TokenList tokens = CTokenizer.tokenize(text);
        return DeclaratorParser.parse(tokens, 0, tokens.size());
    }

    @Test
    void arrayOfPointers() {
        DeclInfo info = parse("int *x[3]");
        assertEquals("x", info.getIdentifier());
        assertEquals("array[3] -> pointer -> int", info.getType().toString());
        assertEquals(3, info.getType().depth());
        assertEquals("3", ((ArrayType)info.getType()).getSize());
        assertEquals(DeclType.Kind.POINTER, info.getType().getInner().getKind());
    }

    @Test
    void pointerToFunction() {
        DeclInfo info = parse("int (*fp)(int, char *)");
        assertEquals("fp", info.getIdentifier());
        assertEquals("pointer -> function(int, char *) -> int",
                info.getType().toString());
    }

    @Test
    void qualifiedPointer() {
        DeclInfo info = parse("const char *const p");
        DeclType type = info.getType();
        assertEquals(DeclType.Kind.POINTER, type.getKind());
        assertEquals("const", ((PointerType)type).getQualifiers());
        assertEquals("const char", type.getBase().getSpecifier());
    }

    @Test
    void abstractDeclarator() {
        DeclInfo info = parse("char *");
        assertTrue(info.isAbstract());
        assertNull(info.getIdentifier());
        assertEquals("pointer -> char", info.getType().toString());
    }

    @Test
    void typedefNameAndStorage() {
        DeclInfo info = parse("static size_t n");
        assertEquals("n", info.getIdentifier());
        assertEquals("static size_t", info.getType().toString());
    }

    @Test
    void aggregateSpecifier() {
        DeclInfo info = parse("struct node { int v; } *head");
        assertEquals("head", info.getIdentifier());
        assertEquals(DeclType.Kind.POINTER, info.getType().getKind());
        assertEquals("struct node { int v; }",
                info.getType().getBase().getSpecifier());
    }

    @Test
    void arrayOfUnknownSize() {
        DeclInfo info = parse("char buf[]");
        assertEquals("array[] -> char", info.getType().toString());
    }

    @Test
    void malformedDeclarations() {
        assertThrows(UnsupportedInput.class, () -> parse(""));
        assertThrows(UnsupportedInput.class, () -> parse("int (*x"));
        assertThrows(UnsupportedInput.class, () -> parse("typeof x"));
        assertThrows(UnsupportedInput.class, () -> parse("= 1"));
    }
}
