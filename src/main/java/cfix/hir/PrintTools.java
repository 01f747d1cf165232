package cfix.hir;

import cfix.exec.Driver;

import java.util.Collection;
import java.util.Iterator;

/**
* <b>PrintTools</b> provides verbosity-gated status printing and small
* formatting helpers for collections.
*/
public final class PrintTools {

    // Short name for the system property
    public static final String line_sep = System.getProperty("line.separator");

    private PrintTools() {
    }

    /**
    * Returns the global verbosity taken from the command-line option; 0 when
    * the option is unset or malformed.
    */
    public static int getVerbosity() {
        String value = Driver.getOptionValue("verbosity");
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
    * Prints the specified items to {@link System#err} with separating
    * white spaces if verbosity is greater than {@code min_verbosity}.
    * The string is composed only if the verbosity level is met.
    * @param min_verbosity the minium verbosity.
    * @param items the list of items to be printed.
    */
    public static void printlnStatus(int min_verbosity, Object... items) {
        if (min_verbosity <= getVerbosity()) {
            if (items.length > 0) {
                StringBuilder sb = new StringBuilder(80);
                sb.append(items[0]);
                for (int i = 1; i < items.length; i++) {
                    sb.append(" ").append(items[i]);
                }
                System.err.println(sb.toString());
            }
        }
    }

    /**
    * Prints a string to System.out if the
    * verbosity level is greater than min_verbosity.
    *
    * @param message The message to be printed.
    * @param min_verbosity An integer to compare with the value
    *   set by the -verbosity command-line flag.
    */
    public static void println(String message, int min_verbosity) {
        if (getVerbosity() >= min_verbosity) {
            System.out.println(message);
        }
    }

    /**
    * Converts a collection of objects to a string with the given separator.
    *
    * @param coll the collection to be converted.
    * @param separator the separating string.
    * @return the converted string.
    */
    public static String collectionToString(Collection<?> coll,
            String separator) {
        if (coll == null || coll.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(80);
        Iterator<?> iter = coll.iterator();
        sb.append(iter.next());
        while (iter.hasNext()) {
            sb.append(separator).append(iter.next());
        }
        return sb.toString();
    }
}
