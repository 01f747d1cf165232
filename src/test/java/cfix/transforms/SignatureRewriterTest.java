package cfix.transforms;

import cfix.base.grammars.CTokenizer;
import cfix.hir.TokenKind;
import cfix.hir.TokenList;
import cfix.hir.UnsupportedInput;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SignatureRewriterTest {

    /** Rewrites a header given without its body. */
    private static String rewrite(String header) {
        TokenList tokens = CTokenizer.tokenize(header);
        return SignatureRewriter.rewrite(tokens, 0, tokens.size());
    }

    private static SignatureRewriter.Signature decompose(String header) {
        TokenList tokens = CTokenizer.tokenize(header);
        return SignatureRewriter.decompose(tokens, 0, tokens.size());
    }

    @Test
    void pointerReturnMovesToArgument() {
        assertEquals("int f(char * *out)", rewrite("char *f()"));
        assertEquals("int f(void * *out)", rewrite("void *f(void)"));
    }

    @Test
    void valueReturnMovesToArgument() {
        assertEquals("int f(int x, double *out)", rewrite("double f(int x)"));
    }

    @Test
    void voidBecomesInt() {
        assertEquals("static int reset(struct s *x)",
                rewrite("static void reset(struct s *x)"));
    }

    @Test
    void plainIntIsKept() {
        assertEquals("int count(void)", rewrite("int count(void)"));
        assertEquals(RefactorType.NONE,
                decompose("int count(void)").getRefactorType());
    }

    @Test
    void attributesAndStorageArePreserved() {
        assertEquals("[[nodiscard]] static int mk(void * *out)",
                rewrite("[[nodiscard]] static void *mk(void)"));
    }

    @Test
    void oldStyleDefinition() {
        TokenList tokens = CTokenizer.tokenize("char *knr(n) int n; { return 0; }");
        int body = 0;
        while (!tokens.is(body, TokenKind.LBRACE)) {
            body++;
        }
        SignatureRewriter.Signature sig =
                SignatureRewriter.decompose(tokens, 0, body);
        assertTrue(sig.isKnr());
        assertEquals("knr", sig.getName());
        assertEquals("int knr(n, out) int n;\nchar * *out;",
                SignatureRewriter.rewrite(sig));
    }

    @Test
    void decomposition() {
        SignatureRewriter.Signature sig =
                decompose("extern const char * lookup(int key, int flags)");
        assertEquals("extern ", sig.getStorage());
        assertEquals("const char *", sig.getReturnType());
        assertEquals("lookup", sig.getName());
        assertEquals("int key, int flags", sig.getParameters());
        assertTrue(sig.returnsPointer());
        assertEquals(RefactorType.RETURN_TO_ARGUMENT, sig.getRefactorType());
        assertEquals(RefactorType.VOID_TO_INT,
                decompose("void g(void)").getRefactorType());
    }

    @Test
    void unreadableHeaders() {
        assertThrows(UnsupportedInput.class, () -> decompose("int (*fp)(void)"));
        assertThrows(UnsupportedInput.class, () -> decompose("foo()"));
        assertThrows(UnsupportedInput.class, () -> decompose("int x"));
        assertThrows(UnsupportedInput.class, () -> decompose("   "));
    }

    @Test
    void noRewriteForNone() {
        SignatureRewriter.Signature sig = decompose("int count(void)");
        assertThrows(IllegalArgumentException.class,
                () -> SignatureRewriter.rewrite(sig));
    }
}
