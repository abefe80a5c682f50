package com.launchbot.hft.launchpad.execution;

public enum ExecutionMode {
    DIRECT,
    /**
     * Size exceeds the allowed share of visible depth; sent as several tranches.
     */
    SPLIT,
    /**
     * Private route and randomized submission delay.
     */
    PROTECTED
}
