package cfix.hir;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

final class AllocatorLibraryTest {

    @Test
    void defaultEntries() {
        AllocatorLibrary lib = AllocatorLibrary.getDefault();
        assertTrue(lib.contains("malloc"));
        assertTrue(lib.contains("strdup"));
        assertFalse(lib.contains("free"));
        AllocatorLibrary.Entry calloc = lib.lookup("calloc", 2);
        assertNotNull(calloc);
        assertEquals(AllocatorLibrary.Style.RETURN_PTR, calloc.getStyle());
        assertEquals(AllocatorLibrary.Check.PTR_NULL, calloc.getCheck());
        assertEquals(-1, calloc.getResultArgument());
    }

    @Test
    void arityMustMatch() {
        AllocatorLibrary lib = AllocatorLibrary.getDefault();
        assertNull(lib.lookup("malloc", 2));
        assertNull(lib.lookup("calloc", 1));
        assertNotNull(lib.lookup("asprintf", 2));
        assertNotNull(lib.lookup("asprintf", 5));
        assertNull(lib.lookup("asprintf", 1));
        assertEquals(0, lib.lookup("asprintf", 3).getResultArgument());
    }

    @Test
    void extendReturnsNewLibrary() {
        AllocatorLibrary base = AllocatorLibrary.getDefault();
        AllocatorLibrary.Entry pool = AllocatorLibrary.parseEntry(
                "pool_get:return_ptr:ptr_null:1");
        AllocatorLibrary extended = base.extend(Collections.singletonList(pool));
        assertTrue(extended.contains("pool_get"));
        assertTrue(extended.contains("malloc"));
        assertFalse(base.contains("pool_get"));
        assertEquals(base.getEntries().size() + 1, extended.getEntries().size());
    }

    @Test
    void extendReplacesByName() {
        AllocatorLibrary.Entry two = AllocatorLibrary.parseEntry(
                "malloc:RETURN_PTR:PTR_NULL:2");
        AllocatorLibrary lib = AllocatorLibrary.getDefault().extend(
                Collections.singletonList(two));
        assertNull(lib.lookup("malloc", 1));
        assertNotNull(lib.lookup("malloc", 2));
    }

    @Test
    void parseEntryForms() {
        AllocatorLibrary.Entry e = AllocatorLibrary.parseEntry(
                " xasprintf : ARG_PTR : INT_NEGATIVE : 2+ ");
        assertEquals("xasprintf", e.getName());
        assertTrue(e.isVariadic());
        assertEquals(2, e.getArity());
        assertEquals(0, e.getResultArgument());
        assertEquals("xasprintf:ARG_PTR:INT_NEGATIVE:2+", e.toString());
    }

    @Test
    void malformedEntries() {
        assertThrows(UnsupportedInput.class,
                () -> AllocatorLibrary.parseEntry("malloc:RETURN_PTR:1"));
        assertThrows(UnsupportedInput.class,
                () -> AllocatorLibrary.parseEntry("malloc:HEAP:PTR_NULL:1"));
        assertThrows(UnsupportedInput.class,
                () -> AllocatorLibrary.parseEntry("malloc:RETURN_PTR:PTR_NULL:x"));
    }

    @Test
    void entriesAreImmutable() {
        assertThrows(UnsupportedOperationException.class,
                () -> AllocatorLibrary.getDefault().getEntries().clear());
    }
}
