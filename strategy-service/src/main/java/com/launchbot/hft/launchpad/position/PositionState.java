package com.launchbot.hft.launchpad.position;

public enum PositionState {
    /**
     * Entry order approved and submitted, no confirmed fill yet.
     */
    PENDING,
    OPEN,
    PARTIALLY_EXITED,
    /**
     * Terminal.
     */
    CLOSED;

    public boolean isLive() {
        return this != CLOSED;
    }
}
