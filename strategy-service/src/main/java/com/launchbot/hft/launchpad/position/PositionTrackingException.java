package com.launchbot.hft.launchpad.position;

/**
 * The tracker lost consistency with what was executed. Never swallowed.
 */
public class PositionTrackingException extends RuntimeException {

    public PositionTrackingException(String message) {
        super(message);
    }
}
