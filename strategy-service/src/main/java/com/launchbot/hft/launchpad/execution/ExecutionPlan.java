package com.launchbot.hft.launchpad.execution;

import java.math.BigDecimal;
import java.util.List;

/**
 * How an approved order will be sent.
 *
 * @param tranches per-submission amounts in the order's unit, summing to the total
 */
public record ExecutionPlan(
        ExecutionMode mode,
        List<BigDecimal> tranches,
        int slippageBps,
        BigDecimal priorityFee,
        boolean privateRoute
) {

    public ExecutionPlan {
        tranches = List.copyOf(tranches);
    }
}
