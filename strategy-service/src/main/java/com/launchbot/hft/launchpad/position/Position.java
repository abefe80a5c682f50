package com.launchbot.hft.launchpad.position;

import com.launchbot.hft.domain.ExitReason;
import com.launchbot.hft.domain.StrategyTag;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * A position in one mint held by one wallet. Sizes are cost basis in base units.
 *
 * Immutable snapshot; the {@link PositionTracker} replaces it on every transition.
 */
public record Position(
        String id,
        String mintId,
        String walletId,
        String creator,
        StrategyTag strategyTag,
        BigDecimal entryPrice,
        BigDecimal sizeBaseUnits,
        BigDecimal remainingSizeBaseUnits,
        PositionState state,
        BigDecimal stopLossPrice,
        List<BigDecimal> takeProfitLevels,
        int nextTakeProfitTier,
        BigDecimal trailingStopPrice,
        BigDecimal entryFees,
        BigDecimal realizedPnl,
        ExitReason pendingExit,
        Instant createdAt,
        Instant openedAt,
        Instant closedAt
) {

    /**
     * Decimal places of token quantities, matching the execution engine's sell sizing.
     */
    public static final int TOKEN_SCALE = 12;

    public Position {
        takeProfitLevels = takeProfitLevels == null ? List.of() : List.copyOf(takeProfitLevels);
        if (entryFees == null) entryFees = BigDecimal.ZERO;
        if (realizedPnl == null) realizedPnl = BigDecimal.ZERO;
    }

    static Position pending(String id, String mintId, String walletId, String creator, StrategyTag tag,
                            BigDecimal requestedSize, Instant now) {
        return new Position(id, mintId, walletId, creator, tag, null, requestedSize, requestedSize,
                PositionState.PENDING, null, List.of(), 0, null, null, null, null, now, null, null);
    }

    Position opened(BigDecimal filledSize, BigDecimal price, BigDecimal fees, ExitPolicy policy, Instant now) {
        BigDecimal stop = price.multiply(BigDecimal.valueOf(1.0 - policy.stopLossPct()));
        List<BigDecimal> levels = policy.takeProfitTiers().stream()
                .map(t -> price.multiply(BigDecimal.valueOf(t.multiple())))
                .toList();
        return new Position(id, mintId, walletId, creator, strategyTag, price, filledSize, filledSize,
                PositionState.OPEN, stop, levels, 0, null, fees, BigDecimal.ZERO, null, createdAt, now, null);
    }

    Position withPendingExit(ExitReason reason) {
        return new Position(id, mintId, walletId, creator, strategyTag, entryPrice, sizeBaseUnits,
                remainingSizeBaseUnits, state, stopLossPrice, takeProfitLevels, nextTakeProfitTier,
                trailingStopPrice, entryFees, realizedPnl, reason, createdAt, openedAt, closedAt);
    }

    Position withTrailingStop(BigDecimal newStop) {
        return new Position(id, mintId, walletId, creator, strategyTag, entryPrice, sizeBaseUnits,
                remainingSizeBaseUnits, state, newStop, takeProfitLevels, nextTakeProfitTier,
                newStop, entryFees, realizedPnl, pendingExit, createdAt, openedAt, closedAt);
    }

    Position reduced(BigDecimal newRemaining, BigDecimal newRealized, int nextTier, boolean close, Instant now) {
        return new Position(id, mintId, walletId, creator, strategyTag, entryPrice, sizeBaseUnits,
                close ? BigDecimal.ZERO : newRemaining,
                close ? PositionState.CLOSED : PositionState.PARTIALLY_EXITED,
                stopLossPrice, takeProfitLevels, nextTier, trailingStopPrice, entryFees, newRealized,
                null, createdAt, openedAt, close ? now : null);
    }

    Position abandoned(Instant now) {
        return new Position(id, mintId, walletId, creator, strategyTag, entryPrice, sizeBaseUnits,
                BigDecimal.ZERO, PositionState.CLOSED, stopLossPrice, takeProfitLevels, nextTakeProfitTier,
                trailingStopPrice, entryFees, realizedPnl, null, createdAt, openedAt, now);
    }

    public boolean isLive() {
        return state.isLive();
    }

    public boolean isMonitorable() {
        return state == PositionState.OPEN || state == PositionState.PARTIALLY_EXITED;
    }

    /**
     * Token quantity still held, derived from cost basis and entry price.
     */
    public BigDecimal remainingTokens() {
        if (entryPrice == null || entryPrice.signum() <= 0) return BigDecimal.ZERO;
        return remainingSizeBaseUnits.divide(entryPrice, TOKEN_SCALE, RoundingMode.DOWN);
    }

    public BigDecimal unrealizedPnl(BigDecimal markPrice) {
        if (entryPrice == null || markPrice == null || entryPrice.signum() <= 0) return BigDecimal.ZERO;
        return remainingTokens().multiply(markPrice).subtract(remainingSizeBaseUnits);
    }
}
