package com.launchbot.hft.config;

import com.launchbot.hft.domain.ProtectionLevel;
import com.launchbot.hft.domain.WalletRole;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="hft")
public record HftProperties(
    TradingMode mode,
    @Valid Pipeline pipeline,
    @Valid Risk risk,
    @Valid Wallets wallets,
    @Valid Execution execution,
    @Valid Market market,
    @Valid Strategies strategies,
    @Valid Alerts alerts,
    @Valid Ingest ingest
) {

  public HftProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (pipeline == null) {
      pipeline = new Pipeline(null, null, null, null, null, null, null);
    }
    if (risk == null) {
      risk = new Risk(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
    if (wallets == null) {
      wallets = new Wallets(null, null, null, null, null, null, null, null, null, null);
    }
    if (execution == null) {
      execution = new Execution(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
    if (market == null) {
      market = new Market(null, null);
    }
    if (strategies == null) {
      strategies = new Strategies(null, null);
    }
    if (alerts == null) {
      alerts = new Alerts(null, null);
    }
    if (ingest == null) {
      ingest = new Ingest(null, null);
    }
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  public enum BondingCurvePreference {
    /**
     * Earlier on the curve scores higher (sniping right after launch).
     */
    EARLY,
    /**
     * Closer to graduation scores higher (momentum towards migration).
     */
    LATE
  }

  public record Pipeline(
      @NotNull @Min(1) Integer workerThreads,
      @NotNull @Min(1) Integer workerQueueCapacity,
      /**
       * Max events buffered per mint while that mint's lane is busy.
       */
      @NotNull @Min(1) Integer laneCapacity,
      @NotNull @Min(1) Integer eventQueueCapacity,
      /**
       * Number of {@code (mintId, eventType, timestamp)} keys remembered for at-least-once de-duplication.
       */
      @NotNull @Min(1) Integer dedupCapacity,
      @NotNull @Min(1) Integer executionThreads,
      @NotNull @Min(50) Long housekeepingMillis
  ) {
    public Pipeline {
      if (workerThreads == null) {
        workerThreads = 4;
      }
      if (workerQueueCapacity == null) {
        workerQueueCapacity = 256;
      }
      if (laneCapacity == null) {
        laneCapacity = 64;
      }
      if (eventQueueCapacity == null) {
        eventQueueCapacity = 10_000;
      }
      if (dedupCapacity == null) {
        dedupCapacity = 100_000;
      }
      if (executionThreads == null) {
        executionThreads = 4;
      }
      if (housekeepingMillis == null) {
        housekeepingMillis = 1_000L;
      }
    }
  }

  public record Risk(
      /**
       * Starting portfolio equity in base units. Drawdown and concentration are measured against it.
       */
      @NotNull @PositiveOrZero BigDecimal portfolioValue,
      @NotNull @PositiveOrZero BigDecimal maxDailyLoss,
      @NotNull @Min(1) Integer maxOpenPositions,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double maxPerMintFraction,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double maxCorrelatedFraction,
      @NotNull @PositiveOrZero BigDecimal maxPositionSize,
      @NotNull @PositiveOrZero BigDecimal minTradeSize,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double maxDrawdownPct,
      /**
       * Floor for the drawdown sizing multiplier (sizes never shrink below this fraction of the cap).
       */
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double minDrawdownScale,
      @NotNull @Min(1) Integer consecutiveLossLimit,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double apiErrorRateThreshold,
      @NotNull @Min(1) Integer apiErrorWindow,
      @NotNull @Min(1) Integer apiErrorMinSamples,
      @NotNull @Min(0) Long reservationTimeoutMillis,
      String dailyResetZone,
      @NotNull @Min(0) Integer dailyResetHour
  ) {
    public Risk {
      if (portfolioValue == null) {
        portfolioValue = BigDecimal.TEN;
      }
      if (maxDailyLoss == null) {
        maxDailyLoss = BigDecimal.ONE;
      }
      if (maxOpenPositions == null) {
        maxOpenPositions = 10;
      }
      if (maxPerMintFraction == null) {
        maxPerMintFraction = 0.10;
      }
      if (maxCorrelatedFraction == null) {
        maxCorrelatedFraction = 0.50;
      }
      if (maxPositionSize == null) {
        maxPositionSize = new BigDecimal("0.25");
      }
      if (minTradeSize == null) {
        minTradeSize = new BigDecimal("0.001");
      }
      if (maxDrawdownPct == null) {
        maxDrawdownPct = 0.25;
      }
      if (minDrawdownScale == null) {
        minDrawdownScale = 0.25;
      }
      if (consecutiveLossLimit == null) {
        consecutiveLossLimit = 5;
      }
      if (apiErrorRateThreshold == null) {
        apiErrorRateThreshold = 0.5;
      }
      if (apiErrorWindow == null) {
        apiErrorWindow = 20;
      }
      if (apiErrorMinSamples == null) {
        apiErrorMinSamples = 10;
      }
      if (reservationTimeoutMillis == null) {
        reservationTimeoutMillis = 30_000L;
      }
      if (dailyResetZone == null || dailyResetZone.isBlank()) {
        dailyResetZone = "UTC";
      }
      if (dailyResetHour == null) {
        dailyResetHour = 0;
      }
    }
  }

  public record Wallets(
      @NotNull @PositiveOrZero BigDecimal feeBuffer,
      Map<WalletRole, Integer> dailyTxCap,
      @NotNull @Min(0) Long longtermMinSpacingSeconds,
      /**
       * Wallets below this reputation are only used when no better-reputed wallet is eligible.
       */
      @NotNull @PositiveOrZero @DecimalMax("10.0") Double minReputation,
      @NotNull @Min(1) Long reputationHalfLifeMinutes,
      @NotNull @PositiveOrZero Double reputationSuccessNudge,
      @NotNull @PositiveOrZero Double reputationFailureNudge,
      @NotNull @Min(1) Integer maxConsecutiveFailures,
      @NotNull @Min(0) Long failureCooldownSeconds,
      List<Account> accounts
  ) {
    public Wallets {
      if (feeBuffer == null) {
        feeBuffer = new BigDecimal("0.01");
      }
      Map<WalletRole, Integer> caps = new EnumMap<>(WalletRole.class);
      caps.put(WalletRole.SNIPING, 200);
      caps.put(WalletRole.LONGTERM, 20);
      caps.put(WalletRole.UTILITY, 50);
      caps.put(WalletRole.RESERVE, 50);
      if (dailyTxCap != null) {
        dailyTxCap.forEach((role, cap) -> {
          if (role != null && cap != null) {
            caps.put(role, cap);
          }
        });
      }
      dailyTxCap = Map.copyOf(caps);
      if (longtermMinSpacingSeconds == null) {
        longtermMinSpacingSeconds = 600L;
      }
      if (minReputation == null) {
        minReputation = 3.0;
      }
      if (reputationHalfLifeMinutes == null) {
        reputationHalfLifeMinutes = 24 * 60L;
      }
      if (reputationSuccessNudge == null) {
        reputationSuccessNudge = 0.1;
      }
      if (reputationFailureNudge == null) {
        reputationFailureNudge = 0.5;
      }
      if (maxConsecutiveFailures == null) {
        maxConsecutiveFailures = 3;
      }
      if (failureCooldownSeconds == null) {
        failureCooldownSeconds = 300L;
      }
      accounts = accounts == null ? List.of() : accounts.stream().filter(Objects::nonNull).toList();
    }
  }

  public record Account(
      String id,
      WalletRole role,
      BigDecimal balance
  ) {
    public Account {
      if (balance == null) {
        balance = BigDecimal.ZERO;
      }
    }
  }

  public record Execution(
      /**
       * Hard ceiling for slippage tolerance on any order, in basis points.
       */
      @NotNull @Min(0) Integer maxSlippageBps,
      @NotNull @Min(0) Integer standardSlippageBps,
      @NotNull @Min(0) Integer highProtectionSlippageBps,
      @NotNull @PositiveOrZero BigDecimal nonePriorityFee,
      @NotNull @PositiveOrZero BigDecimal standardPriorityFee,
      @NotNull @PositiveOrZero BigDecimal highPriorityFee,
      /**
       * A single tranche may consume at most this fraction of visible depth.
       */
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double maxDepthFraction,
      @NotNull @Min(1) Integer maxTranches,
      @NotNull @Min(0) Long interTrancheDelayMillis,
      @NotNull @Min(0) Long protectedJitterMillis,
      @NotNull @Min(0) Integer maxRetries,
      @NotNull @Min(0) Long retryBackoffMillis,
      @NotNull @Min(1) Long submitTimeoutMillis,
      /**
       * Slippage applied by the paper gateway to simulated fills, in basis points.
       */
      @NotNull @Min(0) Integer paperSlippageBps
  ) {
    public Execution {
      if (maxSlippageBps == null) {
        maxSlippageBps = 500;
      }
      if (standardSlippageBps == null) {
        standardSlippageBps = 300;
      }
      if (highProtectionSlippageBps == null) {
        highProtectionSlippageBps = 150;
      }
      if (nonePriorityFee == null) {
        nonePriorityFee = BigDecimal.ZERO;
      }
      if (standardPriorityFee == null) {
        standardPriorityFee = new BigDecimal("0.0001");
      }
      if (highPriorityFee == null) {
        highPriorityFee = new BigDecimal("0.0005");
      }
      if (maxDepthFraction == null) {
        maxDepthFraction = 0.20;
      }
      if (maxTranches == null) {
        maxTranches = 5;
      }
      if (interTrancheDelayMillis == null) {
        interTrancheDelayMillis = 250L;
      }
      if (protectedJitterMillis == null) {
        protectedJitterMillis = 1_500L;
      }
      if (maxRetries == null) {
        maxRetries = 2;
      }
      if (retryBackoffMillis == null) {
        retryBackoffMillis = 200L;
      }
      if (submitTimeoutMillis == null) {
        submitTimeoutMillis = 10_000L;
      }
      if (paperSlippageBps == null) {
        paperSlippageBps = 50;
      }
    }
  }

  public record Market(
      /**
       * Trades at or above this base-unit size count as whale flow for sentiment.
       */
      @NotNull @PositiveOrZero BigDecimal whaleTradeThreshold,
      @NotNull @Min(1) Long whaleWindowSeconds
  ) {
    public Market {
      if (whaleTradeThreshold == null) {
        whaleTradeThreshold = BigDecimal.ONE;
      }
      if (whaleWindowSeconds == null) {
        whaleWindowSeconds = 300L;
      }
    }
  }

  public record Strategies(@Valid Strategy snipe, @Valid Strategy longterm) {
    public Strategies {
      if (snipe == null) {
        snipe = new Strategy(null, WalletRole.SNIPING, null, null, null, null, null, null, null, null, null, null,
            new Weights(0.35, 0.25, 0.20, 0.20),
            new Exit(0.10, List.of(new TakeProfit(1.25, 0.5), new TakeProfit(1.5, 0.6)), 0.10, 60L, 0.5));
      }
      if (longterm == null) {
        longterm = new Strategy(null, WalletRole.LONGTERM, null, 7.5, null,
            new BigDecimal("0.05"), new BigDecimal("0.05"), new BigDecimal("0.25"),
            null, BondingCurvePreference.LATE, null, null,
            new Weights(0.30, 0.20, 0.20, 0.30),
            new Exit(0.15, List.of(new TakeProfit(1.5, 0.3), new TakeProfit(2.0, 0.4), new TakeProfit(3.0, 0.5)),
                0.15, 7 * 24 * 60L, 0.0));
      }
    }
  }

  public record Strategy(
      @NotNull Boolean enabled,
      @NotNull WalletRole walletRole,
      /**
       * Role tried when no wallet of {@code walletRole} is eligible. {@code null} disables fallback.
       */
      WalletRole fallbackRole,
      @NotNull @PositiveOrZero @DecimalMax("10.0") Double scoreThreshold,
      @NotNull @PositiveOrZero Double hysteresisBand,
      @NotNull @PositiveOrZero BigDecimal baseSize,
      @NotNull @PositiveOrZero BigDecimal sizePerPoint,
      @NotNull @PositiveOrZero BigDecimal maxSize,
      @NotNull ProtectionLevel baseProtection,
      @NotNull BondingCurvePreference bondingCurvePreference,
      /**
       * Initial liquidity (base units) that scores a full 10 on the liquidity factor.
       */
      @NotNull @PositiveOrZero BigDecimal targetLiquidity,
      /**
       * Whale sentiment shifts the community factor by up to this many points.
       */
      @NotNull @PositiveOrZero Double whaleSentimentImpact,
      @Valid Weights weights,
      @Valid Exit exit
  ) {
    public Strategy {
      if (enabled == null) {
        enabled = true;
      }
      if (walletRole == null) {
        walletRole = WalletRole.SNIPING;
      }
      if (scoreThreshold == null) {
        scoreThreshold = 7.0;
      }
      if (hysteresisBand == null) {
        hysteresisBand = 0.25;
      }
      if (baseSize == null) {
        baseSize = new BigDecimal("0.02");
      }
      if (sizePerPoint == null) {
        sizePerPoint = new BigDecimal("0.02");
      }
      if (maxSize == null) {
        maxSize = new BigDecimal("0.10");
      }
      if (baseProtection == null) {
        baseProtection = ProtectionLevel.STANDARD;
      }
      if (bondingCurvePreference == null) {
        bondingCurvePreference = BondingCurvePreference.EARLY;
      }
      if (targetLiquidity == null) {
        targetLiquidity = new BigDecimal("5");
      }
      if (whaleSentimentImpact == null) {
        whaleSentimentImpact = 1.0;
      }
      if (weights == null) {
        weights = new Weights(0.25, 0.25, 0.25, 0.25);
      }
      if (exit == null) {
        exit = new Exit(null, null, null, null, null);
      }
    }
  }

  /**
   * Factor weights; validated to sum to 1.0 when the strategy is wired, not here.
   */
  public record Weights(
      @PositiveOrZero Double creatorHistory,
      @PositiveOrZero Double liquiditySetup,
      @PositiveOrZero Double communitySignals,
      @PositiveOrZero Double bondingCurveProgress
  ) {
  }

  public record Exit(
      @PositiveOrZero @DecimalMax("1.0") Double stopLossPct,
      List<TakeProfit> takeProfit,
      @PositiveOrZero @DecimalMax("1.0") Double trailingStopPct,
      @Min(1) Long maxHoldMinutes,
      @PositiveOrZero @DecimalMax("1.0") Double migrationExitFraction
  ) {
    public Exit {
      if (stopLossPct == null) {
        stopLossPct = 0.10;
      }
      takeProfit = takeProfit == null
          ? List.of(new TakeProfit(1.25, 0.5), new TakeProfit(1.5, 0.6))
          : takeProfit.stream().filter(Objects::nonNull).toList();
      if (trailingStopPct == null) {
        trailingStopPct = 0.10;
      }
      if (maxHoldMinutes == null) {
        maxHoldMinutes = 60L;
      }
      if (migrationExitFraction == null) {
        migrationExitFraction = 0.0;
      }
    }
  }

  public record TakeProfit(Double multiple, Double fraction) {
  }

  public record Alerts(
      @NotNull Boolean kafkaEnabled,
      String topic
  ) {
    public Alerts {
      if (kafkaEnabled == null) {
        kafkaEnabled = false;
      }
      if (topic == null || topic.isBlank()) {
        topic = "launchbot.alerts";
      }
    }
  }

  public record Ingest(
      @NotNull Boolean kafkaEnabled,
      String topic
  ) {
    public Ingest {
      if (kafkaEnabled == null) {
        kafkaEnabled = false;
      }
      if (topic == null || topic.isBlank()) {
        topic = "launchbot.market-events";
      }
    }
  }
}
