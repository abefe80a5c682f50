package com.launchbot.hft.launchpad.pipeline;

import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.OrderSide;
import com.launchbot.hft.domain.TradeEvent;
import com.launchbot.hft.domain.WhaleSentiment;
import com.launchbot.hft.launchpad.execution.PriceSource;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest market view per mint, folded from the trade tape.
 *
 * <p>Whale sentiment compares whale buy and sell volume inside the tape window. Depth and curve progress
 * carry over from the previous trade when a print does not include them.
 */
@Slf4j
public class MarketSnapshotBook implements PriceSource {

    private final BigDecimal whaleTradeThreshold;
    private final Duration tapeWindow;
    private final FrontRunRiskIntel frontRunIntel;
    private final Clock clock;

    private final Map<String, Tape> tapes = new ConcurrentHashMap<>();

    public MarketSnapshotBook(BigDecimal whaleTradeThreshold, Duration tapeWindow, FrontRunRiskIntel frontRunIntel,
                              Clock clock) {
        this.whaleTradeThreshold = whaleTradeThreshold;
        this.tapeWindow = tapeWindow;
        this.frontRunIntel = frontRunIntel;
        this.clock = clock;
    }

    /**
     * Fold a trade into its mint's tape and return the new snapshot.
     */
    public MarketSnapshot onTrade(TradeEvent trade) {
        Tape tape = tapes.computeIfAbsent(trade.mintId(), k -> new Tape());
        synchronized (tape) {
            Instant at = trade.timestamp() != null ? trade.timestamp() : clock.instant();
            tape.trades.addLast(trade);
            tape.prune(at.minus(tapeWindow));

            BigDecimal price = trade.price() != null && trade.price().signum() > 0
                    ? trade.price()
                    : tape.last == null ? null : tape.last.price();
            List<BigDecimal> depth = !trade.depthAtLevels().isEmpty()
                    ? trade.depthAtLevels()
                    : tape.last == null ? List.of() : tape.last.depthAtLevels();
            Double progress = trade.bondingCurveProgress() != null
                    ? trade.bondingCurveProgress()
                    : tape.last == null ? null : tape.last.bondingCurveProgress();

            List<TradeEvent> recent = List.copyOf(tape.trades);
            MarketSnapshot snapshot = new MarketSnapshot(
                    trade.mintId(),
                    price,
                    depth,
                    progress,
                    sentiment(recent),
                    frontRunIntel.isElevated(trade.mintId(), recent),
                    at
            );
            tape.last = snapshot;
            tape.touchedAt = clock.instant();
            return snapshot;
        }
    }

    public Optional<MarketSnapshot> latest(String mintId) {
        Tape tape = tapes.get(mintId);
        if (tape == null) {
            return Optional.empty();
        }
        synchronized (tape) {
            return Optional.ofNullable(tape.last);
        }
    }

    @Override
    public Optional<BigDecimal> lastPrice(String mintId) {
        return latest(mintId).map(MarketSnapshot::price);
    }

    public void remove(String mintId) {
        tapes.remove(mintId);
    }

    /**
     * Drop tapes that saw no trade for {@code idle}, except for the given mints.
     *
     * @return number of tapes dropped
     */
    public int evictIdle(Duration idle, Set<String> keep) {
        Instant cutoff = clock.instant().minus(idle);
        int before = tapes.size();
        tapes.entrySet().removeIf(e -> !keep.contains(e.getKey()) && e.getValue().touchedAt.isBefore(cutoff));
        int evicted = before - tapes.size();
        if (evicted > 0) {
            log.debug("evicted {} idle market tapes", evicted);
        }
        return evicted;
    }

    public int size() {
        return tapes.size();
    }

    private WhaleSentiment sentiment(List<TradeEvent> trades) {
        BigDecimal buys = BigDecimal.ZERO;
        BigDecimal sells = BigDecimal.ZERO;
        for (TradeEvent t : trades) {
            if (t.baseAmount() == null || t.baseAmount().compareTo(whaleTradeThreshold) < 0) {
                continue;
            }
            if (t.side() == OrderSide.BUY) {
                buys = buys.add(t.baseAmount());
            } else {
                sells = sells.add(t.baseAmount());
            }
        }
        int cmp = buys.compareTo(sells);
        if (cmp > 0) return WhaleSentiment.BULLISH;
        if (cmp < 0) return WhaleSentiment.BEARISH;
        return WhaleSentiment.NEUTRAL;
    }

    private static final class Tape {
        private final Deque<TradeEvent> trades = new ArrayDeque<>();
        private MarketSnapshot last;
        private Instant touchedAt = Instant.EPOCH;

        void prune(Instant cutoff) {
            while (!trades.isEmpty()) {
                Instant ts = trades.peekFirst().timestamp();
                if (ts != null && !ts.isBefore(cutoff)) {
                    break;
                }
                trades.removeFirst();
            }
        }
    }
}
