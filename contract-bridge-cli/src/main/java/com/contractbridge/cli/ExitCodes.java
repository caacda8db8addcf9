package com.contractbridge.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int OK = 0;

    /** A sync failed, drift was found or breaking errors were found. */
    public static final int FAILURE = 1;

    /** The configuration is missing, unreadable or invalid. */
    public static final int CONFIG_ERROR = 2;

    private ExitCodes() {
        // Constants
    }
}
