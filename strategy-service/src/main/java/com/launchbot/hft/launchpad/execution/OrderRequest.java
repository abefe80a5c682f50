package com.launchbot.hft.launchpad.execution;

import com.launchbot.hft.domain.OrderSide;

import java.math.BigDecimal;

/**
 * One submission to the broadcast collaborator.
 *
 * @param amount base units to spend for BUY, token quantity for SELL
 * @param referencePrice price the order was planned at, used for the slippage bound
 * @param privateRoute send through the private relay instead of the public mempool
 */
public record OrderRequest(
        String clientOrderId,
        String signalId,
        String mintId,
        String walletId,
        OrderSide side,
        BigDecimal amount,
        BigDecimal referencePrice,
        int slippageBps,
        BigDecimal priorityFee,
        boolean privateRoute,
        int trancheIndex,
        int trancheCount
) {
}
