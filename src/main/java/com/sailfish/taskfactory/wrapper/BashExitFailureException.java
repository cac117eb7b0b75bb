package com.sailfish.taskfactory.wrapper;

/**
 * A shell task's command exited with a non-zero status.
 */
public class BashExitFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String taskName;
    private final int exitCode;

    public BashExitFailureException(String taskName, int exitCode) {
        super("Bash task " + taskName + " failed with exit code " + exitCode);
        this.taskName = taskName;
        this.exitCode = exitCode;
    }

    public String getTaskName() {
        return taskName;
    }

    public int getExitCode() {
        return exitCode;
    }
}
