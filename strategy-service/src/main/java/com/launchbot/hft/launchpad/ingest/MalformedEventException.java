package com.launchbot.hft.launchpad.ingest;

/**
 * A feed payload that cannot be turned into a market event.
 */
public class MalformedEventException extends Exception {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
