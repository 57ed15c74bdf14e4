package io.qzark.core;

/**
 * Outcome of one command run.
 *
 * exitCode     : process exit status, or -1 when the process never started or was cut short
 * stdout       : captured standard output
 * stderr       : captured standard error
 * errorMessage : null on success, otherwise the failure description used for notifications
 */
public record ExecutionResult(
        int exitCode,
        String stdout,
        String stderr,
        String errorMessage
) {

    public static final String UNKNOWN_ERROR = "Unknown error";

    public static ExecutionResult success(String stdout, String stderr) {
        return new ExecutionResult(0, stdout, stderr, null);
    }

    /**
     * Classifies a finished process. Exit status 0 is a success; any other status is a failure
     * described by trimmed stderr, then trimmed stdout, then {@link #UNKNOWN_ERROR}.
     */
    public static ExecutionResult fromExit(int exitCode, String stdout, String stderr) {
        if (exitCode == 0) {
            return success(stdout, stderr);
        }
        return new ExecutionResult(exitCode, stdout, stderr, describe(stdout, stderr));
    }

    /**
     * A run that produced no exit status (spawn failure, timeout, interruption).
     */
    public static ExecutionResult failure(String errorMessage) {
        return new ExecutionResult(-1, "", "", errorMessage);
    }

    public boolean succeeded() {
        return errorMessage == null;
    }

    public boolean failed() {
        return errorMessage != null;
    }

    private static String describe(String stdout, String stderr) {
        String err = stderr == null ? "" : stderr.strip();
        if (!err.isEmpty()) {
            return err;
        }
        String out = stdout == null ? "" : stdout.strip();
        if (!out.isEmpty()) {
            return out;
        }
        return UNKNOWN_ERROR;
    }
}
