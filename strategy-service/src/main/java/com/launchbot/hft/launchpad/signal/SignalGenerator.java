package com.launchbot.hft.launchpad.signal;

import com.launchbot.hft.domain.ExitReason;
import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.ProtectionLevel;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.SignalAction;
import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.launchpad.position.Position;
import com.launchbot.hft.launchpad.scoring.Score;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns scores into buy/avoid signals and position exits into sell signals.
 *
 * Keeps the last decision per (mint, strategy) so that re-evaluating the same mint only emits when the
 * decision flips. A hysteresis band around the threshold keeps price noise from flapping the decision.
 * Decision memory is held until the mint is forgotten, so callers drop mints they stop tracking.
 */
@Slf4j
public class SignalGenerator {

    private static final int SIZE_SCALE = 9;

    private final Clock clock;
    private final Map<String, Map<StrategyTag, SignalAction>> lastDecision = new ConcurrentHashMap<>();

    public SignalGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Evaluate a score against the strategy's decision boundary.
     *
     * @return a BUY or AVOID signal on the first evaluation of a mint and on every later decision change;
     *         empty when the decision is unchanged
     */
    public Optional<Signal> evaluate(Score score, MarketSnapshot snapshot, SignalPolicy policy) {
        Map<StrategyTag, SignalAction> decisions =
                lastDecision.computeIfAbsent(score.mintId(), k -> new ConcurrentHashMap<>());
        double value = score.compositeValue();
        SignalAction previous = decisions.get(policy.tag());

        double boundary = policy.scoreThreshold();
        if (previous == SignalAction.BUY) {
            boundary -= policy.hysteresisBand();
        } else if (previous == SignalAction.AVOID) {
            boundary += policy.hysteresisBand();
        }
        SignalAction action = value >= boundary ? SignalAction.BUY : SignalAction.AVOID;

        if (action == previous) {
            log.debug("decision unchanged mint={} strategy={} action={} score={}",
                    score.mintId(), policy.tag(), action, value);
            return Optional.empty();
        }
        decisions.put(policy.tag(), action);

        BigDecimal size = action == SignalAction.BUY ? targetSize(value, policy) : BigDecimal.ZERO;
        Signal signal = Signal.entry(
                UUID.randomUUID().toString(),
                score.mintId(),
                action,
                size,
                value,
                protectionFor(snapshot, policy.baseProtection()),
                policy.tag(),
                snapshot != null ? snapshot.price() : null,
                clock.instant()
        );
        log.info("signal {} mint={} strategy={} action={} size={} score={} protection={}",
                signal.id(), signal.mintId(), policy.tag(), action, size, value, signal.protectionLevel());
        return Optional.of(signal);
    }

    /**
     * Build the sell signal for a position exit.
     *
     * @param sizeBaseUnits cost basis to liquidate
     */
    public Signal exitSignal(Position position, BigDecimal sizeBaseUnits, ExitReason reason, MarketSnapshot snapshot) {
        Signal signal = new Signal(
                UUID.randomUUID().toString(),
                position.mintId(),
                SignalAction.SELL,
                sizeBaseUnits,
                10.0,
                protectionFor(snapshot, ProtectionLevel.STANDARD),
                position.strategyTag(),
                clock.instant(),
                position.id(),
                position.walletId(),
                position.entryPrice(),
                reason
        );
        log.info("exit signal {} position={} mint={} reason={} size={}",
                signal.id(), position.id(), position.mintId(), reason, sizeBaseUnits);
        return signal;
    }

    /**
     * Drop decision memory for a mint (after migration or when it is no longer tracked).
     */
    public void forget(String mintId) {
        lastDecision.remove(mintId);
    }

    /**
     * Drop one strategy's decision for a mint, so its next evaluation emits again.
     */
    public void forget(String mintId, StrategyTag tag) {
        lastDecision.computeIfPresent(mintId, (k, decisions) -> {
            decisions.remove(tag);
            return decisions.isEmpty() ? null : decisions;
        });
    }

    public int trackedMints() {
        return lastDecision.size();
    }

    BigDecimal targetSize(double score, SignalPolicy policy) {
        double excess = Math.max(0.0, score - policy.scoreThreshold());
        BigDecimal size = policy.baseSize().add(policy.sizePerPoint().multiply(BigDecimal.valueOf(excess)));
        return size.min(policy.maxSize()).setScale(SIZE_SCALE, RoundingMode.DOWN).stripTrailingZeros();
    }

    private static ProtectionLevel protectionFor(MarketSnapshot snapshot, ProtectionLevel base) {
        if (snapshot != null && snapshot.frontRunRiskElevated()) {
            return ProtectionLevel.HIGH;
        }
        return base;
    }
}
