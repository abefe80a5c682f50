package com.launchbot.hft.launchpad.execution;

/**
 * Receives the outcome of every gateway call, retries included.
 */
@FunctionalInterface
public interface ApiOutcomeListener {

    void onOutcome(boolean success);
}
