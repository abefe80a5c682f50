package com.launchbot.hft.strategy.web;

import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.events.AlertEvent;
import com.launchbot.hft.launchpad.alert.LoggingAlertPublisher;
import com.launchbot.hft.launchpad.pipeline.MarketEventQueue;
import com.launchbot.hft.launchpad.pipeline.TradingPipeline;
import com.launchbot.hft.launchpad.position.Position;
import com.launchbot.hft.launchpad.position.PositionTracker;
import com.launchbot.hft.launchpad.risk.RiskManager;
import com.launchbot.hft.launchpad.strategy.StrategyRegistry;
import com.launchbot.hft.launchpad.wallet.WalletManager;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
@Slf4j
public class StrategyStatusController {

  private final @NonNull HftProperties properties;
  private final @NonNull Environment environment;
  private final @NonNull StrategyRegistry strategies;
  private final @NonNull RiskManager riskManager;
  private final @NonNull PositionTracker positionTracker;
  private final @NonNull WalletManager walletManager;
  private final @NonNull TradingPipeline pipeline;
  private final @NonNull MarketEventQueue eventQueue;
  private final @NonNull LoggingAlertPublisher alerts;
  private final @NonNull Clock clock;

  @GetMapping("/status")
  public ResponseEntity<StrategyStatusResponse> status() {
    List<StrategyStatus> strategyStatus = strategies.all().stream()
        .map(s -> new StrategyStatus(s.tag().name(), s.enabled(), riskManager.isPaused(s.tag()),
            s.walletRole().name()))
        .toList();
    return ResponseEntity.ok(new StrategyStatusResponse(
        properties.mode().name(),
        environment.getActiveProfiles(),
        properties.ingest().kafkaEnabled(),
        eventQueue.size(),
        pipeline.trackedLaunches().size(),
        positionTracker.openPositions().size(),
        riskManager.isCircuitBreakerTripped(),
        strategyStatus
    ));
  }

  @GetMapping("/positions")
  public ResponseEntity<List<Position>> positions() {
    return ResponseEntity.ok(positionTracker.openPositions());
  }

  @GetMapping("/wallets")
  public ResponseEntity<List<WalletStatus>> wallets() {
    Instant now = clock.instant();
    return ResponseEntity.ok(walletManager.wallets().stream()
        .map(w -> new WalletStatus(w.id(), w.role().name(), w.balance(), walletManager.reputation(w, now),
            w.dailyTxCount(), w.inCooldown(now)))
        .toList());
  }

  @GetMapping("/alerts")
  public ResponseEntity<List<AlertEvent>> alerts() {
    return ResponseEntity.ok(alerts.recent());
  }

  public record StrategyStatusResponse(
      String mode,
      String[] activeProfiles,
      boolean kafkaIngestEnabled,
      int queuedEvents,
      int trackedLaunches,
      int livePositions,
      boolean circuitBreakerTripped,
      List<StrategyStatus> strategies
  ) {
  }

  public record StrategyStatus(
      String tag,
      boolean enabled,
      boolean paused,
      String walletRole
  ) {
  }

  public record WalletStatus(
      String id,
      String role,
      BigDecimal balance,
      double reputation,
      int dailyTxCount,
      boolean coolingDown
  ) {
  }
}
