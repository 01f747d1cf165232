package cfix.transforms;

import cfix.exec.Parser;
import cfix.hir.AllocatorLibrary;
import cfix.hir.TranslationUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ErrorCodeRefactoringTest {

    private static TranslationUnit run(String src, String entry) {
        TranslationUnit unit = new Parser().parse("test.c", src);
        TransformPass.run(new ErrorCodeRefactoring(unit,
                AllocatorLibrary.getDefault(), entry));
        return unit;
    }

    private static String refactor(String src) {
        return run(src, "main").getOutputText();
    }

    @Test
    void callChainUpToMain() {
        String src = "void A(){ malloc(1); } void B(){ A(); } " +
                "int main(){ B(); return 0; }";
        assertEquals("int A(){ malloc(1);  return 0; } " +
                "int B(){\n  int rc = 0; rc = A(); if (rc != 0) return rc;  return 0; } " +
                "int main(){\n  int rc = 0; rc = B(); if (rc != 0) return rc; return 0; }",
                refactor(src));
    }

    @Test
    void guardAfterUncheckedAllocation() {
        assertEquals("int f() { char *p = malloc(1); if (!p) { return ENOMEM; } " +
                "*p = 5;  return 0; }",
                refactor("void f() { char *p = malloc(1); *p = 5; }"));
    }

    @Test
    void guardsFollowTheFailureTest() {
        assertEquals("int f(int v) { char *s; int n = asprintf(&s, \"%d\", v); " +
                "if (n < 0) { return ENOMEM; } puts(s);  return 0; }",
                refactor("void f(int v) { char *s; int n = asprintf(&s, \"%d\", v); puts(s); }"));
        assertEquals("int mk() { int r = _mkdir(\"d\"); if (r != 0) { return ENOMEM; }  return 0; }",
                refactor("void mk() { int r = _mkdir(\"d\"); }"));
    }

    @Test
    void guardStaysInsideUnbracedBody() {
        assertEquals("int f(int c){ char *p; if (c) { p = malloc(1); " +
                "if (!p) { return ENOMEM; } } puts(\"x\");  return 0; }",
                refactor("void f(int c){ char *p; if (c) p = malloc(1); puts(\"x\"); }"));
        assertEquals("int g(int n){ char *q = 0; for (int i = 0; i < n; i++) " +
                "{ q = strdup(\"s\"); if (!q) { return ENOMEM; } } puts(q);  return 0; }",
                refactor("void g(int n){ char *q = 0; for (int i = 0; i < n; i++) " +
                        "q = strdup(\"s\"); puts(q); }"));
    }

    @Test
    void statusCheckStaysInsideUnbracedBody() {
        assertEquals("int A(){ malloc(1);  return 0; } " +
                "int B(int c){\n  int rc = 0; if (c) { rc = A(); " +
                "if (rc != 0) return rc; }  return 0; }",
                refactor("void A(){ malloc(1); } void B(int c){ if (c) A(); }"));
    }

    @Test
    void reassignedAllocationStillGetsGuard() {
        assertEquals("int f(){ char *p = malloc(1); if (!p) { return ENOMEM; } " +
                "p = 0; if (p) {}  return 0; }",
                refactor("void f(){ char *p = malloc(1); p = 0; if (p) {} }"));
    }

    @Test
    void checkedAllocationGetsNoGuard() {
        assertEquals("int f() { char *p = malloc(1); if (p) { *p = 1; }  return 0; }",
                refactor("void f() { char *p = malloc(1); if (p) { *p = 1; } }"));
    }

    @Test
    void voidReturnsReturnZero() {
        assertEquals("int v(int c) { char *p = malloc(1); if (!p) { return ENOMEM; } " +
                "if (c) return 0; free(p);  return 0; }",
                refactor("void v(int c) { char *p = malloc(1); if (c) return; free(p); }"));
        assertEquals("int w() { malloc(1); return 0; }",
                refactor("void w() { malloc(1); return; }"));
    }

    @Test
    void pointerResultMovesToOutParameter() {
        String src = "char *dup(const char *s) { char *d = strdup(s); return d; }\n" +
                "int main() { char *x = dup(\"a\"); return x == 0; }\n";
        assertEquals("int dup(const char *s, char * *out) { char *d = strdup(s); " +
                "if (!d) { return ENOMEM; } { *out = d; return 0; } }\n" +
                "int main() {\n  int rc = 0; char *x ; rc = dup(\"a\", &x); " +
                "if (rc != 0) return rc; return x == 0; }\n",
                refactor(src));
    }

    @Test
    void returnedAllocationIsChecked() {
        String src = "char *mk(){ return malloc(1); } int len(){ return strlen(mk()); }";
        assertEquals("int mk(char * *out){ { char * _safe_ret = malloc(1); " +
                "if (!_safe_ret) return ENOMEM; *out = _safe_ret; return 0; } } " +
                "int len(){\n  int rc = 0; char * _tmp_cdd_0; rc = mk(&_tmp_cdd_0); " +
                "if (rc != 0) return rc;\n  return strlen(_tmp_cdd_0); }",
                refactor(src));
    }

    @Test
    void assignmentToExistingVariable() {
        String src = "char *mk(){ return malloc(1); } " +
                "void use(char **slot){ *slot = mk(); }";
        String out = refactor(src);
        assertTrue(out.contains("int use(char **slot){\n  int rc = 0; " +
                "rc = mk(&(*slot)); if (rc != 0) return rc;  return 0; }"), out);
    }

    @Test
    void selfReallocKeepsOldBlock() {
        String src = "void grow(char **b) { char *p = *b; p = realloc(p, 10); *b = p; }";
        assertEquals("int grow(char **b) { char *p = *b; { void *_safe_tmp = " +
                "realloc(p, 10); if (!_safe_tmp) return ENOMEM; p = _safe_tmp; } " +
                "*b = p;  return 0; }",
                refactor(src));
    }

    @Test
    void intFunctionsKeepTheirHeader() {
        String src = "int c(){ char *p = malloc(1); return 0; }\n" +
                "int main(){ return c(); }\n";
        TranslationUnit unit = run(src, "main");
        assertFalse(unit.isModified());
        assertEquals(src, unit.getOutputText());
    }

    @Test
    void secondRunChangesNothing() {
        String src = "void A(){ char *p = malloc(1); *p = 0; } void B(){ A(); } " +
                "char *C(){ B(); return strdup(\"x\"); } " +
                "int main(){ char *s = C(); B(); return s == 0; }";
        String once = refactor(src);
        assertNotEquals(src, once);
        TranslationUnit again = run(once, "main");
        assertFalse(again.isModified());
        assertEquals(once, again.getOutputText());
    }

    @Test
    void entryPointHeaderNeverChanges() {
        TranslationUnit unit = run("void A(){ malloc(1); } void start(){ A(); }",
                "start");
        String out = unit.getOutputText();
        assertTrue(out.startsWith("int A()"), out);
        assertTrue(out.contains("void start(){"), out);
        assertTrue(out.contains("rc = A();"), out);
    }

    @Test
    void untouchedCodeIsCopiedVerbatim() {
        String src = "/* header */\n#include <stdlib.h>\n" +
                "struct s { int  x; };\n" +
                "void f() { char *p = malloc(1); }\n" +
                "static int keep(int a)\t{ return a ; }\n";
        String out = refactor(src);
        assertTrue(out.startsWith("/* header */\n#include <stdlib.h>\n" +
                "struct s { int  x; };\n"), out);
        assertTrue(out.endsWith("static int keep(int a)\t{ return a ; }\n"), out);
    }

    @Test
    void accessorsExposeTheLastRun() {
        TranslationUnit unit = new Parser().parse("t.c",
                "void A(){ malloc(1); }");
        ErrorCodeRefactoring pass = new ErrorCodeRefactoring(unit,
                AllocatorLibrary.getDefault(), "main");
        assertNull(pass.getCallGraph());
        TransformPass.run(pass);
        assertEquals(1, pass.getAnalysis().getAllSites().size());
        assertTrue(pass.getCallGraph().isMarked("A"));
        assertEquals(RefactorType.VOID_TO_INT,
                ErrorCodeRefactoring.getRefactorType(pass.getCallGraph().getNode("A")));
    }
}
