package com.launchbot.hft.launchpad.execution;

/**
 * Network-class submission failure (timeout at the RPC, dropped connection, rate limit). Safe to retry.
 */
public class TransientSubmissionException extends RuntimeException {

    public TransientSubmissionException(String message) {
        super(message);
    }

    public TransientSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
