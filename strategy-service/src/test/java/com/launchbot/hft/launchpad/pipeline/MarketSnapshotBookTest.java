package com.launchbot.hft.launchpad.pipeline;

import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.OrderSide;
import com.launchbot.hft.domain.TradeEvent;
import com.launchbot.hft.domain.WhaleSentiment;
import com.launchbot.hft.launchpad.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MarketSnapshotBookTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private MutableClock clock;
    private MarketSnapshotBook book;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        book = new MarketSnapshotBook(BigDecimal.ONE, Duration.ofSeconds(60), new TradeBurstFrontRunIntel(), clock);
    }

    @Test
    void shouldCarryDepthAndProgressForward() {
        book.onTrade(trade("alice", OrderSide.BUY, "0.1", "0.0001", 0.20, List.of(new BigDecimal("3")), NOW));

        MarketSnapshot next = book.onTrade(trade("bob", OrderSide.BUY, "0.1", "0.00011", null, null,
                NOW.plusSeconds(5)));

        assertThat(next.price()).isEqualByComparingTo("0.00011");
        assertThat(next.bondingCurveProgress()).isEqualTo(0.20);
        assertThat(next.visibleDepth()).isEqualByComparingTo("3");
        assertThat(book.lastPrice("mint-1")).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("0.00011"));
        assertThat(book.lastPrice("unknown")).isEmpty();
    }

    @Test
    void shouldDeriveWhaleSentimentInsideWindow() {
        MarketSnapshot small = book.onTrade(trade("alice", OrderSide.SELL, "0.5", "0.0001", 0.1, null, NOW));
        assertThat(small.whaleSentiment()).isEqualTo(WhaleSentiment.NEUTRAL);

        MarketSnapshot bullish = book.onTrade(trade("whale", OrderSide.BUY, "2", "0.0001", 0.1, null,
                NOW.plusSeconds(10)));
        assertThat(bullish.whaleSentiment()).isEqualTo(WhaleSentiment.BULLISH);

        MarketSnapshot bearish = book.onTrade(trade("whale", OrderSide.SELL, "3", "0.0001", 0.1, null,
                NOW.plusSeconds(20)));
        assertThat(bearish.whaleSentiment()).isEqualTo(WhaleSentiment.BEARISH);

        // both whale prints have left the 60s window
        MarketSnapshot later = book.onTrade(trade("bob", OrderSide.BUY, "0.1", "0.0001", 0.1, null,
                NOW.plusSeconds(90)));
        assertThat(later.whaleSentiment()).isEqualTo(WhaleSentiment.NEUTRAL);
    }

    @Test
    void shouldFlagBuyBurstsFromSeveralTraders() {
        MarketSnapshot last = null;
        String[] traders = {"a", "b", "c", "a", "b"};
        for (int i = 0; i < traders.length; i++) {
            last = book.onTrade(trade(traders[i], OrderSide.BUY, "0.1", "0.0001", 0.1, null,
                    NOW.plusMillis(300L * i)));
        }

        assertThat(last.frontRunRiskElevated()).isTrue();
    }

    @Test
    void shouldNotFlagSingleTraderFlow() {
        MarketSnapshot last = null;
        for (int i = 0; i < 6; i++) {
            last = book.onTrade(trade("a", OrderSide.BUY, "0.1", "0.0001", 0.1, null, NOW.plusMillis(100L * i)));
        }

        assertThat(last.frontRunRiskElevated()).isFalse();
    }

    @Test
    void shouldEvictIdleTapesExceptKeptMints() {
        book.onTrade(trade("alice", OrderSide.BUY, "0.1", "0.0001", 0.1, null, NOW));
        book.onTrade(new TradeEvent("mint-2", "bob", OrderSide.BUY, new BigDecimal("0.1"), new BigDecimal("0.0001"),
                0.1, null, NOW, "sig-x"));

        clock.advance(Duration.ofMinutes(10));

        assertThat(book.evictIdle(Duration.ofMinutes(5), Set.of("mint-2"))).isEqualTo(1);
        assertThat(book.latest("mint-1")).isEmpty();
        assertThat(book.latest("mint-2")).isPresent();
    }

    private static TradeEvent trade(String trader, OrderSide side, String amount, String price, Double progress,
                                    List<BigDecimal> depth, Instant at) {
        return new TradeEvent("mint-1", trader, side, new BigDecimal(amount), new BigDecimal(price), progress, depth,
                at, "sig-" + trader + "-" + at.toEpochMilli());
    }
}
