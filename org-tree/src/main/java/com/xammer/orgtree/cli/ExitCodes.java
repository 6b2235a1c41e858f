package com.xammer.orgtree.cli;

public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int SESSION_ERROR = 2;
    public static final int PROVIDER_ERROR = 3;
    /** Invalid command line, as sysexits EX_USAGE. */
    public static final int USAGE = 64;

    private ExitCodes() {
    }
}
