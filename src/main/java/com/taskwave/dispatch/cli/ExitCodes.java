package com.taskwave.dispatch.cli;

/**
 * Process exit codes, distinct per failure kind so scripts can branch on them.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int NO_TASKS = 1;
    public static final int SOURCE_ERROR = 1;
    public static final int CONFIGURATION_ERROR = 2;
    public static final int CYCLE_DETECTED = 3;

    private ExitCodes() {}
}
