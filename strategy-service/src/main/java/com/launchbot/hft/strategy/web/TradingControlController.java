package com.launchbot.hft.strategy.web;

import com.launchbot.hft.domain.StrategyTag;
import com.launchbot.hft.launchpad.pipeline.TradingPipeline;
import com.launchbot.hft.launchpad.position.PerformanceSummary;
import com.launchbot.hft.launchpad.position.PositionTracker;
import com.launchbot.hft.launchpad.risk.PortfolioRiskState;
import com.launchbot.hft.launchpad.risk.RiskManager;
import com.launchbot.hft.launchpad.scoring.Score;
import com.launchbot.hft.launchpad.strategy.StrategyRegistry;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Operator controls and read-outs: circuit-breaker reset, per-strategy pause, ranked opportunities and
 * realized performance.
 */
@RestController
@RequestMapping("/api/control")
@RequiredArgsConstructor
@Slf4j
public class TradingControlController {

  private final @NonNull RiskManager riskManager;
  private final @NonNull StrategyRegistry strategies;
  private final @NonNull PositionTracker positionTracker;
  private final @NonNull TradingPipeline pipeline;

  private static final int MAX_LIMIT = 200;

  @GetMapping("/risk")
  public ResponseEntity<PortfolioRiskState> risk() {
    return ResponseEntity.ok(riskManager.snapshot());
  }

  @PostMapping("/circuit-breaker/reset")
  public ResponseEntity<ControlResponse> resetCircuitBreaker() {
    boolean changed = riskManager.manualResetCircuitBreaker();
    log.info("circuit breaker reset requested (changed={})", changed);
    return ResponseEntity.ok(new ControlResponse("circuit-breaker", changed, riskManager.isCircuitBreakerTripped()));
  }

  @PostMapping("/strategies/{tag}/pause")
  public ResponseEntity<ControlResponse> pause(@PathVariable("tag") String tag) {
    StrategyTag strategy = parse(tag);
    if (strategy == null) {
      return ResponseEntity.notFound().build();
    }
    boolean changed = riskManager.pauseStrategy(strategy);
    return ResponseEntity.ok(new ControlResponse(strategy.name(), changed, true));
  }

  @PostMapping("/strategies/{tag}/resume")
  public ResponseEntity<ControlResponse> resume(@PathVariable("tag") String tag) {
    StrategyTag strategy = parse(tag);
    if (strategy == null) {
      return ResponseEntity.notFound().build();
    }
    boolean changed = riskManager.resumeStrategy(strategy);
    return ResponseEntity.ok(new ControlResponse(strategy.name(), changed, false));
  }

  @GetMapping("/opportunities")
  public ResponseEntity<List<Score>> opportunities(@RequestParam(name = "limit", defaultValue = "20") int limit) {
    return ResponseEntity.ok(pipeline.opportunities().top(clamp(limit)));
  }

  @GetMapping("/opportunities/recent")
  public ResponseEntity<List<Score>> recentlyAnalyzed(@RequestParam(name = "limit", defaultValue = "20") int limit) {
    return ResponseEntity.ok(pipeline.opportunities().recent(clamp(limit)));
  }

  @GetMapping("/summary")
  public ResponseEntity<TradingSummary> summary() {
    PortfolioRiskState risk = riskManager.snapshot();
    return ResponseEntity.ok(new TradingSummary(
        positionTracker.performance(),
        risk.dailyRealizedPnl(),
        risk.equity(),
        risk.drawdownFromPeak(),
        risk.consecutiveLossCount(),
        pipeline.opportunities().size()
    ));
  }

  private static int clamp(int limit) {
    return Math.max(0, Math.min(limit, MAX_LIMIT));
  }

  private StrategyTag parse(String tag) {
    try {
      StrategyTag parsed = StrategyTag.valueOf(tag.trim().toUpperCase(Locale.ROOT));
      return strategies.get(parsed).isPresent() ? parsed : null;
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  public record TradingSummary(
      PerformanceSummary performance,
      BigDecimal dailyRealizedPnl,
      BigDecimal equity,
      double drawdownFromPeak,
      int consecutiveLosses,
      int scoredLaunches
  ) {
  }

  public record ControlResponse(
      String target,
      boolean changed,
      boolean active
  ) {
  }
}
