package com.launchbot.hft.launchpad.risk;

public enum RejectReason {
    CIRCUIT_BREAKER("circuit_breaker"),
    DAILY_LOSS_LIMIT("daily_loss_limit"),
    STRATEGY_PAUSED("strategy_paused"),
    MAX_OPEN_POSITIONS("max_open_positions"),
    CONCENTRATION("concentration"),
    CORRELATION("correlation"),
    SIZE_TOO_SMALL("size_too_small"),
    NO_ACTION("no_action");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
