package com.launchbot.hft.launchpad.scoring;

/**
 * Factor input could not be obtained or was unusable. Recoverable: the factor degrades to neutral.
 */
public class DataQualityException extends Exception {

    public DataQualityException(String message) {
        super(message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(message, cause);
    }
}
