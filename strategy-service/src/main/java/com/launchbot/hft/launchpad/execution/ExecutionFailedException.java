package com.launchbot.hft.launchpad.execution;

/**
 * A tranche could not be filled. Halts the remaining tranches of the execution.
 */
public class ExecutionFailedException extends Exception {

    public ExecutionFailedException(String message) {
        super(message);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
