package com.launchbot.hft.launchpad.wallet;

public enum ExecutionOutcome {
    SUCCESS,
    FAILURE,
    /**
     * Submission went through but the venue or a monitor flagged the wallet (e.g. front-run, rejected as spam).
     */
    FLAGGED
}
