package com.launchbot.hft.launchpad.execution;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> {
        if (!d.isZero() && !d.isNegative()) {
            Thread.sleep(d.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
