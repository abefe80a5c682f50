package com.launchbot.hft.launchpad.execution;

public enum ExecutionStatus {
    FILLED,
    PARTIAL,
    FAILED,
    CANCELLED
}
