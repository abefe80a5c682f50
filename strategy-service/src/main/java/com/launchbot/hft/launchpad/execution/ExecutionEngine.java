package com.launchbot.hft.launchpad.execution;

import com.launchbot.hft.domain.MarketSnapshot;
import com.launchbot.hft.domain.OrderSide;
import com.launchbot.hft.domain.ProtectionLevel;
import com.launchbot.hft.domain.Signal;
import com.launchbot.hft.domain.SignalAction;
import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.launchpad.risk.RiskDecision;
import com.launchbot.hft.launchpad.wallet.ExecutionOutcome;
import com.launchbot.hft.launchpad.wallet.WalletManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns an approved signal into gateway submissions.
 *
 * <p>Submissions for one wallet are serialized by a per-wallet lock; different wallets run concurrently.
 * A failed tranche halts the remaining ones and the partial fill is reported.
 */
@Slf4j
public class ExecutionEngine {

    private static final int TOKEN_SCALE = 12;

    private final ExecutionGateway gateway;
    private final ExecutionSettings settings;
    private final WalletManager walletManager;
    private final ApiOutcomeListener apiOutcomes;
    private final Random random;
    private final Sleeper sleeper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<String, ReentrantLock> walletLocks = new ConcurrentHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    private final Counter retriesCounter;
    private final Counter submissionsCounter;
    private final Counter submissionFailuresCounter;

    public ExecutionEngine(
            ExecutionGateway gateway,
            ExecutionSettings settings,
            WalletManager walletManager,
            ApiOutcomeListener apiOutcomes,
            Random random,
            Sleeper sleeper,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.gateway = gateway;
        this.settings = settings;
        this.walletManager = walletManager;
        this.apiOutcomes = apiOutcomes;
        this.random = random;
        this.sleeper = sleeper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.retriesCounter = Counter.builder("launchbot.execution.retries")
                .description("Gateway submissions retried after a transient failure")
                .register(meterRegistry);
        this.submissionsCounter = Counter.builder("launchbot.execution.submissions")
                .description("Tranches submitted to the gateway")
                .register(meterRegistry);
        this.submissionFailuresCounter = Counter.builder("launchbot.execution.submission.failures")
                .description("Tranches that ended without a fill")
                .register(meterRegistry);
    }

    /**
     * Execute an approved decision with the given wallet. Blocks until every tranche settled or the execution
     * halted.
     *
     * @param snapshot latest market view for depth, may be {@code null}
     */
    public ExecutionResult execute(Signal signal, RiskDecision decision, Wallet wallet, MarketSnapshot snapshot) {
        if (!decision.approved()) {
            throw new IllegalArgumentException("Signal " + signal.id() + " was not approved: " + decision.reason());
        }
        OrderSide side = signal.action() == SignalAction.SELL ? OrderSide.SELL : OrderSide.BUY;
        BigDecimal referencePrice = signal.referencePrice() != null
                ? signal.referencePrice()
                : snapshot != null ? snapshot.price() : null;
        BigDecimal amount = orderAmount(side, decision.adjustedSize(), referencePrice);
        if (amount.signum() <= 0) {
            return finish(signal, wallet, side, ExecutionMode.DIRECT, ExecutionStatus.FAILED, new Fills(), 0,
                    "nothing to execute");
        }

        ExecutionPlan plan = plan(decision, amount, decision.adjustedSize(), snapshot);
        log.info("executing {} {} mint={} wallet={} mode={} tranches={} amount={} slippageBps={}",
                side, signal.id(), signal.mintId(), wallet.id(), plan.mode(), plan.tranches().size(), amount,
                plan.slippageBps());

        ReentrantLock lock = walletLocks.computeIfAbsent(wallet.id(), id -> new ReentrantLock());
        lock.lock();
        try {
            return runTranches(signal, wallet, side, referencePrice, plan);
        } finally {
            lock.unlock();
            cancelled.remove(signal.id());
        }
    }

    /**
     * Stop tranches of the signal that have not been submitted yet.
     */
    public void cancel(String signalId) {
        cancelled.add(signalId);
        log.info("cancel requested for {}", signalId);
    }

    ExecutionPlan plan(RiskDecision decision, BigDecimal amount, BigDecimal sizeBaseUnits, MarketSnapshot snapshot) {
        ProtectionLevel protection = decision.protectionLevel() == null
                ? ProtectionLevel.STANDARD
                : decision.protectionLevel();
        int tranches = 1;
        BigDecimal depth = snapshot == null ? BigDecimal.ZERO : snapshot.visibleDepth();
        if (depth.signum() > 0) {
            BigDecimal perTranche = depth.multiply(BigDecimal.valueOf(settings.maxDepthFraction()));
            if (sizeBaseUnits.compareTo(perTranche) > 0) {
                int needed = sizeBaseUnits.divide(perTranche, 0, RoundingMode.CEILING).intValueExact();
                tranches = Math.min(settings.maxTranches(), needed);
            }
        }
        boolean isProtected = protection == ProtectionLevel.HIGH;
        ExecutionMode mode = isProtected
                ? ExecutionMode.PROTECTED
                : tranches > 1 ? ExecutionMode.SPLIT : ExecutionMode.DIRECT;
        return new ExecutionPlan(mode, split(amount, tranches), settings.slippageBpsFor(protection),
                settings.priorityFeeFor(protection), isProtected);
    }

    private ExecutionResult runTranches(Signal signal, Wallet wallet, OrderSide side, BigDecimal referencePrice,
                                        ExecutionPlan plan) {
        Fills fills = new Fills();
        int count = plan.tranches().size();
        String error = null;
        boolean wasCancelled = false;

        for (int i = 0; i < count; i++) {
            if (cancelled.contains(signal.id())) {
                wasCancelled = true;
                log.info("execution {} cancelled before tranche {}/{}", signal.id(), i + 1, count);
                break;
            }
            try {
                if (i > 0) {
                    sleeper.sleep(settings.interTrancheDelay());
                }
                if (plan.privateRoute()) {
                    sleeper.sleep(jitter());
                }
                if (cancelled.contains(signal.id())) {
                    wasCancelled = true;
                    break;
                }
                BigDecimal trancheAmount = plan.tranches().get(i);
                checkBalance(wallet.id(), side, trancheAmount, plan.priorityFee());
                OrderRequest request = new OrderRequest(
                        signal.id() + "-" + (i + 1) + "-" + UUID.randomUUID().toString().substring(0, 8),
                        signal.id(),
                        signal.mintId(),
                        wallet.id(),
                        side,
                        trancheAmount,
                        referencePrice,
                        plan.slippageBps(),
                        plan.priorityFee(),
                        plan.privateRoute(),
                        i + 1,
                        count
                );
                SubmissionResult result = submitWithRetry(request);
                fills.add(side, result);
                walletManager.recordExecution(wallet.id(), ExecutionOutcome.SUCCESS);
                walletManager.applyFill(wallet.id(), balanceDelta(side, result));
            } catch (ExecutionFailedException e) {
                error = e.getMessage();
                submissionFailuresCounter.increment();
                walletManager.recordExecution(wallet.id(), ExecutionOutcome.FAILURE);
                log.warn("execution {} tranche {}/{} failed, halting: {}", signal.id(), i + 1, count, error);
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = "interrupted";
                log.warn("execution {} interrupted at tranche {}/{}", signal.id(), i + 1, count);
                break;
            }
        }

        ExecutionStatus status;
        if (fills.tranches == count) {
            status = ExecutionStatus.FILLED;
        } else if (fills.tranches > 0) {
            status = ExecutionStatus.PARTIAL;
        } else if (wasCancelled) {
            status = ExecutionStatus.CANCELLED;
        } else {
            status = ExecutionStatus.FAILED;
        }
        if (wasCancelled && error == null) {
            error = "cancelled";
        }
        return finish(signal, wallet, side, plan.mode(), status, fills, count, error);
    }

    private SubmissionResult submitWithRetry(OrderRequest request) throws ExecutionFailedException, InterruptedException {
        int attempts = settings.maxRetries() + 1;
        for (int attempt = 1; ; attempt++) {
            submissionsCounter.increment();
            CompletableFuture<SubmissionResult> future = gateway.submit(request);
            try {
                SubmissionResult result = future.get(settings.submitTimeout().toMillis(), TimeUnit.MILLISECONDS);
                apiOutcomes.onOutcome(true);
                if (result == null || !result.filled() || result.filledAmount() == null
                        || result.filledAmount().signum() <= 0) {
                    throw new ExecutionFailedException("order " + request.clientOrderId() + " not filled: "
                            + (result == null ? "no result" : result.error()));
                }
                if (result.avgPrice() == null || result.avgPrice().signum() <= 0) {
                    throw new ExecutionFailedException("order " + request.clientOrderId() + " filled without a price");
                }
                return result;
            } catch (TimeoutException e) {
                future.cancel(true);
                apiOutcomes.onOutcome(false);
                throw new ExecutionFailedException("order " + request.clientOrderId() + " timed out after "
                        + settings.submitTimeout().toMillis() + "ms", e);
            } catch (CancellationException e) {
                throw new ExecutionFailedException("order " + request.clientOrderId() + " cancelled", e);
            } catch (ExecutionException e) {
                apiOutcomes.onOutcome(false);
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof TransientSubmissionException && attempt < attempts) {
                    retriesCounter.increment();
                    log.warn("order {} transient failure (attempt {}/{}): {}",
                            request.clientOrderId(), attempt, attempts, cause.getMessage());
                    sleeper.sleep(settings.retryBackoff().multipliedBy(attempt));
                    continue;
                }
                throw new ExecutionFailedException("order " + request.clientOrderId() + " failed after "
                        + attempt + " attempt(s): " + cause.getMessage(), cause);
            }
        }
    }

    private void checkBalance(String walletId, OrderSide side, BigDecimal amount, BigDecimal priorityFee)
            throws ExecutionFailedException {
        Wallet current = walletManager.refreshBalance(walletId);
        BigDecimal required = side == OrderSide.BUY ? amount.add(priorityFee) : priorityFee;
        if (current.balance().compareTo(required) < 0) {
            throw new ExecutionFailedException("wallet " + walletId + " balance " + current.balance().toPlainString()
                    + " below required " + required.toPlainString());
        }
    }

    private ExecutionResult finish(Signal signal, Wallet wallet, OrderSide side, ExecutionMode mode,
                                   ExecutionStatus status, Fills fills, int planned, String error) {
        Counter.builder("launchbot.execution.results")
                .description("Executions by mode and final status")
                .tag("mode", mode.name())
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
        ExecutionResult result = new ExecutionResult(
                signal.id(),
                wallet.id(),
                side,
                mode,
                status,
                fills.tokens,
                fills.base,
                fills.avgPrice(),
                fills.fees,
                planned,
                fills.tranches,
                error,
                clock.instant()
        );
        if (status == ExecutionStatus.FILLED) {
            log.info("execution {} FILLED tokens={} base={} avgPrice={} fees={}",
                    signal.id(), fills.tokens, fills.base, result.avgPrice(), fills.fees);
        } else {
            log.warn("execution {} {} filled {}/{} tranches tokens={} error={}",
                    signal.id(), status, fills.tranches, planned, fills.tokens, error);
        }
        return result;
    }

    private Duration jitter() {
        long max = settings.protectedJitter().toMillis();
        if (max <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis((long) (random.nextDouble() * max));
    }

    private static BigDecimal orderAmount(OrderSide side, BigDecimal sizeBaseUnits, BigDecimal referencePrice) {
        if (sizeBaseUnits == null) {
            return BigDecimal.ZERO;
        }
        if (side == OrderSide.BUY) {
            return sizeBaseUnits;
        }
        if (referencePrice == null || referencePrice.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return sizeBaseUnits.divide(referencePrice, TOKEN_SCALE, RoundingMode.DOWN);
    }

    private static List<BigDecimal> split(BigDecimal amount, int tranches) {
        if (tranches <= 1) {
            return List.of(amount);
        }
        BigDecimal each = amount.divide(BigDecimal.valueOf(tranches), TOKEN_SCALE, RoundingMode.DOWN);
        List<BigDecimal> parts = new ArrayList<>(tranches);
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < tranches - 1; i++) {
            parts.add(each);
            allocated = allocated.add(each);
        }
        parts.add(amount.subtract(allocated));
        return parts;
    }

    private static BigDecimal balanceDelta(OrderSide side, SubmissionResult result) {
        BigDecimal fees = result.fees() == null ? BigDecimal.ZERO : result.fees();
        if (side == OrderSide.BUY) {
            return result.filledAmount().add(fees).negate();
        }
        return result.filledAmount().multiply(result.avgPrice()).subtract(fees);
    }

    private static final class Fills {
        private BigDecimal tokens = BigDecimal.ZERO;
        private BigDecimal base = BigDecimal.ZERO;
        private BigDecimal fees = BigDecimal.ZERO;
        private int tranches;

        void add(OrderSide side, SubmissionResult r) {
            BigDecimal price = r.avgPrice();
            if (side == OrderSide.BUY) {
                base = base.add(r.filledAmount());
                tokens = tokens.add(r.filledAmount().divide(price, TOKEN_SCALE, RoundingMode.DOWN));
            } else {
                tokens = tokens.add(r.filledAmount());
                base = base.add(r.filledAmount().multiply(price));
            }
            if (r.fees() != null) {
                fees = fees.add(r.fees());
            }
            tranches++;
        }

        BigDecimal avgPrice() {
            if (tokens.signum() <= 0) {
                return null;
            }
            return base.divide(tokens, TOKEN_SCALE, RoundingMode.HALF_EVEN).stripTrailingZeros();
        }
    }
}
