package cfix.hir;

/**
* General tools that are not specific to C source handling: timing and the
* process exit hook.
*/
public final class Tools {

    private Tools() {
    }

    /**
    * Returns the current system time in seconds.
    *
    * @return the current time in seconds
    */
    public static double getTime() {
        return (System.currentTimeMillis() / 1000.0);
    }

    /**
    * Returns the elapsed time in seconds since the given reference time.
    *
    * @param since the reference time
    * @return the elapsed time in seconds
    */
    public static double getTime(double since) {
        return (System.currentTimeMillis() / 1000.0 - since);
    }

    /** Flag for selecting how exit() is handled. */
    private static boolean exit_throws_exception = false;

    /**
    * Makes {@link #exit(int)} throw instead of terminating the virtual
    * machine, which embedding code and tests rely on.
    *
    * @param flag true to throw.
    */
    public static void exitThrowsException(boolean flag) {
        exit_throws_exception = flag;
    }

    /**
    * Invokes exit operation.
    * Depending on the flag set by {@link #exitThrowsException(boolean)}, this
    * method either calls {@link System#exit(int)} or throws a
    * {@link RuntimeException}.
    *
    * @param status the exit status.
    */
    public static void exit(int status) {
        if (exit_throws_exception) {
            throw new RuntimeException("Exiting with status " + status);
        } else {
            System.exit(status);
        }
    }
}
