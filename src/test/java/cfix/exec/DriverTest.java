package cfix.exec;

import cfix.hir.Tools;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class DriverTest {

    private static final String ALLOCATING =
            "void f() { char *p = malloc(1); *p = 5; }\n";

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        Tools.exitThrowsException(true);
    }

    @AfterEach
    void tearDown() {
        Tools.exitThrowsException(false);
        Driver.registerOptions();
    }

    private Path write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, text.getBytes(StandardCharsets.ISO_8859_1));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.ISO_8859_1);
    }

    @Test
    void writesRewrittenFilesToOutdir() throws IOException {
        Path src = write("a.c", ALLOCATING);
        Path out = dir.resolve("out");
        int status = new Driver().run(new String[] {
                "-outdir=" + out, src.toString()});
        assertEquals(0, status);
        assertEquals("int f() { char *p = malloc(1); if (!p) { return ENOMEM; } " +
                "*p = 5;  return 0; }\n", read(out.resolve("a.c")));
        assertEquals(ALLOCATING, read(src));
    }

    @Test
    void unchangedFilesAreCopied() throws IOException {
        String text = "int main(void) { return 0; }\n";
        Path src = write("b.c", text);
        Path out = dir.resolve("out");
        assertEquals(0, new Driver().run(new String[] {
                "-outdir=" + out, src.toString()}));
        assertEquals(text, read(out.resolve("b.c")));
    }

    @Test
    void rewritesInPlace() throws IOException {
        Path src = write("c.c", ALLOCATING);
        assertEquals(0, new Driver().run(new String[] {"-in-place", src.toString()}));
        assertTrue(read(src).startsWith("int f()"));
    }

    @Test
    void expandsDirectoriesToSourceFiles() throws IOException {
        write("tree/x.c", "int x;\n");
        write("tree/x.h", "int y;\n");
        write("tree/sub/z.c", "int z;\n");
        Driver driver = new Driver();
        driver.parseCommandLine(new String[] {dir.resolve("tree").toString()});
        assertEquals(2, driver.filenames.size());
        assertTrue(driver.filenames.get(0).endsWith("z.c"));
        assertTrue(driver.filenames.get(1).endsWith("x.c"));
    }

    @Test
    void expandsWildcards() throws IOException {
        write("w/one.c", "int a;\n");
        write("w/two.c", "int b;\n");
        write("w/three.h", "int c;\n");
        Driver driver = new Driver();
        driver.parseCommandLine(new String[] {dir.resolve("w").resolve("*.c").toString()});
        assertEquals(2, driver.filenames.size());
    }

    @Test
    void optionsAreParsed() throws IOException {
        Path src = write("d.c", "int d;\n");
        Driver driver = new Driver();
        driver.parseCommandLine(new String[] {"-verbosity=0", "-entry-point=start",
                "-audit", "-bogus", src.toString()});
        assertEquals("start", Driver.getOptionValue("entry-point"));
        assertEquals("1", Driver.getOptionValue("audit"));
        assertNull(Driver.getOptionValue("bogus"));
        assertEquals("cfix_output", Driver.getOptionValue("outdir"));
    }

    @Test
    void optionsFileLines() {
        Driver driver = new Driver();
        driver.parseOption("entry-point=boot");
        driver.parseOption("  callgraph ");
        driver.parseOption("");
        assertEquals("boot", Driver.getOptionValue("entry-point"));
        assertNull(Driver.getOptionValue("callgraph"));
    }

    @Test
    void noInputFilesExits() {
        Driver driver = new Driver();
        assertThrows(RuntimeException.class,
                () -> driver.parseCommandLine(new String[] {"-audit"}));
    }

    @Test
    void missingFileFailsTheRun() throws IOException {
        Path good = write("e.c", "int e;\n");
        Path out = dir.resolve("out");
        int status = new Driver().run(new String[] {"-outdir=" + out,
                dir.resolve("missing.c").toString(), good.toString()});
        assertEquals(1, status);
        assertTrue(Files.exists(out.resolve("e.c")));
    }

    @Test
    void malformedAllocatorsFailTheRun() throws IOException {
        Path src = write("f.c", "int f;\n");
        assertEquals(1, new Driver().run(new String[] {
                "-allocators=broken", src.toString()}));
    }

    @Test
    void extraAllocators() throws IOException {
        Path src = write("g.c", "void g() { item *it = pool_get(1); it->n = 0; }\n");
        Path out = dir.resolve("out");
        assertEquals(0, new Driver().run(new String[] {
                "-allocators=pool_get:RETURN_PTR:PTR_NULL:1",
                "-outdir=" + out, src.toString()}));
        assertTrue(read(out.resolve("g.c")).contains("if (!it) { return ENOMEM; }"));
    }

    @Test
    void auditPrintsSummaryAndWritesNothing() throws IOException {
        Path src = write("h.c", ALLOCATING);
        Path out = dir.resolve("out");
        PrintStream saved = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer));
        int status;
        try {
            status = new Driver().run(new String[] {"-audit",
                    "-outdir=" + out, src.toString()});
        } finally {
            System.setOut(saved);
        }
        assertEquals(0, status);
        String report = buffer.toString();
        assertTrue(report.contains("h.c:1:22: unchecked malloc result p used before check"),
                report);
        assertTrue(report.contains("unchecked allocations:       1"), report);
        assertFalse(Files.exists(out));
        assertEquals(ALLOCATING, read(src));
    }

    @Test
    void callgraphIsPrinted() throws IOException {
        Path src = write("i.c", "void A(){ malloc(1); } int main(){ A(); return 0; }\n");
        PrintStream saved = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer));
        try {
            new Driver().run(new String[] {"-callgraph",
                    "-outdir=" + dir.resolve("out"), src.toString()});
        } finally {
            System.setOut(saved);
        }
        assertTrue(buffer.toString().contains("\"main\" -> \"A\";"));
    }
}
