package cfix.analysis;

import cfix.exec.Parser;
import cfix.hir.AllocatorLibrary;
import cfix.hir.TranslationUnit;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

final class AllocationAuditTest {

    private static void add(AllocationAudit audit, String name, String src) {
        TranslationUnit unit = new Parser().parse(name, src);
        AllocationAnalysis analysis = new AllocationAnalysis(unit,
                AllocatorLibrary.getDefault());
        AnalysisPass.run(analysis);
        audit.add(unit, analysis);
    }

    @Test
    void countsAcrossFiles() {
        AllocationAudit audit = new AllocationAudit();
        add(audit, "a.c", "void f() {\n  char *p = malloc(1);\n  *p = 5;\n}\n");
        add(audit, "b.c", "void g() { char *q = malloc(1); if (q) { } }\n" +
                "char *h() { return malloc(2); }\n");
        assertEquals(2, audit.getFilesScanned());
        assertEquals(1, audit.getCheckedAllocations());
        assertEquals(2, audit.getUncheckedAllocations());
        assertEquals(1, audit.getFunctionsReturningAllocations());
        assertEquals(2, audit.getViolations().size());
        assertEquals("a.c:2:13: unchecked malloc result p used before check",
                audit.getViolations().get(0));
        assertEquals("b.c:2:20: unchecked malloc", audit.getViolations().get(1));
    }

    @Test
    void namesOutputArgumentWithoutAssignedStatus() {
        AllocationAudit audit = new AllocationAudit();
        add(audit, "d.c", "void f(int v) { char *s; asprintf(&s, \"%d\", v); }");
        assertEquals(1, audit.getViolations().size());
        assertEquals("d.c:1:26: unchecked asprintf into &s",
                audit.getViolations().get(0));
    }

    @Test
    void positionCountsFromOne() {
        assertEquals("1:1", AllocationAudit.position("abc", 0));
        assertEquals("2:3", AllocationAudit.position("ab\ncd", 5));
    }

    @Test
    void printsSummary() {
        AllocationAudit audit = new AllocationAudit();
        add(audit, "c.c", "int main() { return 0; }");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        audit.print(new PrintStream(out));
        String text = out.toString();
        assertTrue(text.contains("files scanned:               1"));
        assertTrue(text.contains("unchecked allocations:       0"));
    }
}
