package com.launchbot.hft.launchpad.execution;

import com.launchbot.hft.domain.OrderSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Fills every order immediately at the last observed price, worsened by a fixed slippage.
 * Used in PAPER mode; nothing leaves the process.
 */
@Slf4j
public class PaperExecutionGateway implements ExecutionGateway {

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

    private final PriceSource prices;
    private final int slippageBps;

    public PaperExecutionGateway(PriceSource prices, int slippageBps) {
        this.prices = prices;
        this.slippageBps = slippageBps;
    }

    @Override
    public CompletableFuture<SubmissionResult> submit(OrderRequest request) {
        Optional<BigDecimal> last = prices.lastPrice(request.mintId());
        BigDecimal mid = last.orElse(request.referencePrice());
        if (mid == null || mid.signum() <= 0) {
            return CompletableFuture.completedFuture(
                    SubmissionResult.rejected(request.clientOrderId(), "no_price"));
        }
        if (request.amount() == null || request.amount().signum() <= 0) {
            return CompletableFuture.completedFuture(
                    SubmissionResult.rejected(request.clientOrderId(), "amount_invalid"));
        }

        int applied = Math.min(slippageBps, request.slippageBps());
        BigDecimal factor = BigDecimal.valueOf(applied).divide(BPS, 8, RoundingMode.HALF_UP);
        BigDecimal fillPrice = request.side() == OrderSide.BUY
                ? mid.multiply(BigDecimal.ONE.add(factor))
                : mid.multiply(BigDecimal.ONE.subtract(factor));

        String signature = "paper-" + UUID.randomUUID();
        log.info("PAPER fill {} {} mint={} wallet={} amount={} price={} tranche={}/{} private={}",
                request.side(), request.clientOrderId(), request.mintId(), request.walletId(), request.amount(),
                fillPrice, request.trancheIndex(), request.trancheCount(), request.privateRoute());
        return CompletableFuture.completedFuture(SubmissionResult.filled(
                request.clientOrderId(),
                request.amount(),
                fillPrice.stripTrailingZeros(),
                request.priorityFee() == null ? BigDecimal.ZERO : request.priorityFee(),
                signature
        ));
    }
}
