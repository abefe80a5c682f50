package com.launchbot.hft.launchpad.execution;

import java.math.BigDecimal;

/**
 * Gateway answer for one submission.
 *
 * @param filledAmount filled quantity in the request's unit (base units for BUY, tokens for SELL)
 * @param avgPrice base units per token
 * @param fees network and priority fees paid, base units
 */
public record SubmissionResult(
        String clientOrderId,
        boolean filled,
        BigDecimal filledAmount,
        BigDecimal avgPrice,
        BigDecimal fees,
        String txSignature,
        String error
) {

    public static SubmissionResult filled(String clientOrderId, BigDecimal amount, BigDecimal avgPrice,
                                          BigDecimal fees, String txSignature) {
        return new SubmissionResult(clientOrderId, true, amount, avgPrice, fees, txSignature, null);
    }

    public static SubmissionResult rejected(String clientOrderId, String error) {
        return new SubmissionResult(clientOrderId, false, BigDecimal.ZERO, null, BigDecimal.ZERO, null, error);
    }
}
