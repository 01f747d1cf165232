package cfix.hir;

import java.util.*;

/**
* Repository of fallible resource-acquisition functions. Every entry names a
* call that may fail, the slot through which its result is delivered, how the
* failure is recognized, and how many arguments the call takes. A call whose
* argument count does not match the entry is not treated as the registered
* function.
* <p>
* Libraries are immutable. The default library is constructed once;
* {@link #extend(Collection)} creates a new library with additional entries,
* so new allocators can be registered without touching the analysis.
*/
public class AllocatorLibrary {

    /** Where the acquired resource is delivered. */
    public enum Style {
        RETURN_PTR,     // the return value is the resource or status.
        ARG_PTR         // the resource is stored through an argument.
    }

    /** How a failed call is recognized. */
    public enum Check {
        PTR_NULL,       // failure returns a null pointer.
        INT_NEGATIVE,   // failure returns a negative integer.
        INT_NONZERO     // failure returns a non-zero integer.
    }

    /** One registered allocator. */
    public static final class Entry {

        private final String name;

        private final Style style;

        private final Check check;

        private final int arity;

        private final boolean variadic;

        private final int result_argument;

        /**
        * @param name the function name.
        * @param style the result delivery style.
        * @param check the failure test.
        * @param arity the argument count, or the minimum count if variadic.
        * @param variadic true if more than {@code arity} arguments may follow.
        * @param result_argument the index of the argument receiving the
        *       resource for {@link Style#ARG_PTR}, otherwise -1.
        */
        public Entry(String name, Style style, Check check, int arity,
                boolean variadic, int result_argument) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("allocator without name");
            }
            this.name = name;
            this.style = style;
            this.check = check;
            this.arity = arity;
            this.variadic = variadic;
            this.result_argument = result_argument;
        }

        public String getName() {
            return name;
        }

        public Style getStyle() {
            return style;
        }

        public Check getCheck() {
            return check;
        }

        public int getArity() {
            return arity;
        }

        public boolean isVariadic() {
            return variadic;
        }

        public int getResultArgument() {
            return result_argument;
        }

        /** Checks if a call with the given argument count matches. */
        public boolean accepts(int argument_count) {
            return variadic ? argument_count >= arity
                            : argument_count == arity;
        }

        @Override
        public String toString() {
            return name + ":" + style + ":" + check + ":" + arity +
                    (variadic ? "+" : "");
        }
    }

    /** Only a single default object is constructed. */
    private static final AllocatorLibrary std = new AllocatorLibrary();

    private final Map<String, Entry> catalog;

    /** Constructs the default repository. */
    private AllocatorLibrary() {
        Map<String, Entry> entries = new LinkedHashMap<String, Entry>();
        addEntries(entries);
        catalog = Collections.unmodifiableMap(entries);
    }

    private AllocatorLibrary(Map<String, Entry> entries) {
        catalog = Collections.unmodifiableMap(
                new LinkedHashMap<String, Entry>(entries));
    }

    /** Returns the built-in library. */
    public static AllocatorLibrary getDefault() {
        return std;
    }

    /**
    * Adds each built-in entry: the C heap allocators, the POSIX and
    * Microsoft string duplicators, the GNU formatted-allocation functions,
    * and {@code _mkdir}, whose non-zero status signals failure.
    */
    private static void addEntries(Map<String, Entry> entries) {
        // stdlib.h
        add(entries, "malloc", Style.RETURN_PTR, Check.PTR_NULL, 1);
        add(entries, "calloc", Style.RETURN_PTR, Check.PTR_NULL, 2);
        add(entries, "realloc", Style.RETURN_PTR, Check.PTR_NULL, 2);
        // string.h
        add(entries, "strdup", Style.RETURN_PTR, Check.PTR_NULL, 1);
        add(entries, "_strdup", Style.RETURN_PTR, Check.PTR_NULL, 1);
        add(entries, "strndup", Style.RETURN_PTR, Check.PTR_NULL, 2);
        // stdio.h (GNU)
        entries.put("asprintf", new Entry("asprintf", Style.ARG_PTR,
                Check.INT_NEGATIVE, 2, true, 0));
        entries.put("vasprintf", new Entry("vasprintf", Style.ARG_PTR,
                Check.INT_NEGATIVE, 3, false, 0));
        // direct.h
        add(entries, "_mkdir", Style.RETURN_PTR, Check.INT_NONZERO, 1);
    }

    private static void add(Map<String, Entry> entries, String name,
            Style style, Check check, int arity) {
        entries.put(name, new Entry(name, style, check, arity, false, -1));
    }

    /**
    * Returns a new library holding this library's entries plus the given
    * ones; a new entry replaces an existing one of the same name.
    */
    public AllocatorLibrary extend(Collection<Entry> additions) {
        Map<String, Entry> entries = new LinkedHashMap<String, Entry>(catalog);
        for (Entry e : additions) {
            entries.put(e.getName(), e);
        }
        return new AllocatorLibrary(entries);
    }

    /** Checks if the name is registered regardless of arity. */
    public boolean contains(String name) {
        return catalog.containsKey(name);
    }

    /**
    * Returns the entry for a call with the given name and argument count,
    * or null if no entry matches.
    */
    public Entry lookup(String name, int argument_count) {
        Entry e = catalog.get(name);
        if (e == null || !e.accepts(argument_count)) {
            return null;
        }
        return e;
    }

    /** Returns the entries in registration order. */
    public Collection<Entry> getEntries() {
        return catalog.values();
    }

    /**
    * Parses an entry description of the form
    * {@code name:STYLE:CHECK:arity}, where {@code arity} may end in
    * {@code +} for variadic functions. Style and check names are case
    * insensitive; argument-style entries deliver through argument 0.
    *
    * @throws UnsupportedInput if the description is malformed.
    */
    public static Entry parseEntry(String description) {
        String[] parts = description.trim().split(":");
        if (parts.length != 4) {
            throw new UnsupportedInput("malformed allocator entry " +
                    description);
        }
        try {
            Style style = Style.valueOf(parts[1].trim().toUpperCase());
            Check check = Check.valueOf(parts[2].trim().toUpperCase());
            String a = parts[3].trim();
            boolean variadic = a.endsWith("+");
            if (variadic) {
                a = a.substring(0, a.length() - 1);
            }
            int arity = Integer.parseInt(a);
            return new Entry(parts[0].trim(), style, check, arity, variadic,
                    (style == Style.ARG_PTR) ? 0 : -1);
        } catch (IllegalArgumentException e) {
            throw new UnsupportedInput("malformed allocator entry " +
                    description + ": " + e.getMessage());
        }
    }
}
