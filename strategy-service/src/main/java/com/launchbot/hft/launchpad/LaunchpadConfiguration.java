package com.launchbot.hft.launchpad;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchbot.hft.config.ConfigurationException;
import com.launchbot.hft.config.HftProperties;
import com.launchbot.hft.domain.Wallet;
import com.launchbot.hft.launchpad.alert.AlertPublisher;
import com.launchbot.hft.launchpad.alert.KafkaAlertPublisher;
import com.launchbot.hft.launchpad.alert.LoggingAlertPublisher;
import com.launchbot.hft.launchpad.execution.ExecutionEngine;
import com.launchbot.hft.launchpad.execution.ExecutionGateway;
import com.launchbot.hft.launchpad.execution.ExecutionSettings;
import com.launchbot.hft.launchpad.execution.PaperExecutionGateway;
import com.launchbot.hft.launchpad.execution.Sleeper;
import com.launchbot.hft.launchpad.ingest.KafkaMarketEventListener;
import com.launchbot.hft.launchpad.ingest.MarketEventCodec;
import com.launchbot.hft.launchpad.pipeline.EventDeduplicator;
import com.launchbot.hft.launchpad.pipeline.MarketEventQueue;
import com.launchbot.hft.launchpad.pipeline.MarketSnapshotBook;
import com.launchbot.hft.launchpad.pipeline.MintLaneDispatcher;
import com.launchbot.hft.launchpad.pipeline.TradeBurstFrontRunIntel;
import com.launchbot.hft.launchpad.pipeline.TradingPipeline;
import com.launchbot.hft.launchpad.position.PositionTracker;
import com.launchbot.hft.launchpad.risk.RiskLimits;
import com.launchbot.hft.launchpad.risk.RiskManager;
import com.launchbot.hft.launchpad.scoring.CreatorHistoryBook;
import com.launchbot.hft.launchpad.scoring.ScoringEngine;
import com.launchbot.hft.launchpad.signal.SignalGenerator;
import com.launchbot.hft.launchpad.strategy.LongTermStrategy;
import com.launchbot.hft.launchpad.strategy.SnipeStrategy;
import com.launchbot.hft.launchpad.strategy.StrategyRegistry;
import com.launchbot.hft.launchpad.wallet.InMemoryWalletStore;
import com.launchbot.hft.launchpad.wallet.JdbcWalletStore;
import com.launchbot.hft.launchpad.wallet.WalletManager;
import com.launchbot.hft.launchpad.wallet.WalletPolicy;
import com.launchbot.hft.launchpad.wallet.WalletStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the launchpad trading pipeline.
 *
 * Wires up:
 * - scoring, signal generation and the two strategies
 * - risk manager, wallet manager and position tracker
 * - execution engine over the paper gateway (PAPER mode)
 * - event inbox, mint lanes and the pipeline itself
 * - Kafka ingest and alert fan-out when enabled
 * - scheduled housekeeping
 */
@Slf4j
@Configuration
@EnableScheduling
public class LaunchpadConfiguration {

    @Bean
    public Clock launchpadClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CreatorHistoryBook creatorHistoryBook() {
        return new CreatorHistoryBook();
    }

    @Bean
    public ScoringEngine scoringEngine(CreatorHistoryBook creatorHistory, Clock clock) {
        return new ScoringEngine(creatorHistory, clock);
    }

    @Bean
    public SignalGenerator signalGenerator(Clock clock) {
        return new SignalGenerator(clock);
    }

    @Bean
    public StrategyRegistry strategyRegistry(HftProperties properties, ScoringEngine scoringEngine,
                                             SignalGenerator signalGenerator) {
        HftProperties.Strategies cfg = properties.strategies();
        return new StrategyRegistry(List.of(
                new SnipeStrategy(cfg.snipe(), scoringEngine, signalGenerator),
                new LongTermStrategy(cfg.longterm(), scoringEngine, signalGenerator)
        ));
    }

    @Bean
    public PositionTracker positionTracker(StrategyRegistry registry, Clock clock) {
        return new PositionTracker(registry.exitPolicies(), clock);
    }

    @Bean
    public LoggingAlertPublisher loggingAlertPublisher() {
        return new LoggingAlertPublisher();
    }

    @Bean
    @Primary
    public AlertPublisher alertPublisher(
            HftProperties properties,
            LoggingAlertPublisher local,
            ObjectProvider<KafkaTemplate<String, String>> kafkaTemplate,
            ObjectMapper objectMapper
    ) {
        HftProperties.Alerts alerts = properties.alerts();
        if (!alerts.kafkaEnabled()) {
            return local;
        }
        KafkaTemplate<String, String> template = kafkaTemplate.getIfAvailable();
        if (template == null) {
            throw new ConfigurationException("hft.alerts.kafka-enabled=true but no KafkaTemplate is configured");
        }
        log.info("Alerts published to Kafka topic {}", alerts.topic());
        return new KafkaAlertPublisher(template, objectMapper, alerts.topic(), local);
    }

    @Bean
    public RiskManager riskManager(HftProperties properties, AlertPublisher alerts, Clock clock) {
        RiskLimits limits = RiskLimits.from(properties.risk());
        log.info("Risk limits loaded: portfolio={}, maxDailyLoss={}, maxOpen={}, lossStreak={}",
                limits.portfolioValue(), limits.maxDailyLoss(), limits.maxOpenPositions(),
                limits.consecutiveLossLimit());
        return new RiskManager(limits, alerts, clock);
    }

    @Bean
    @Profile("!jdbc")
    public WalletStore inMemoryWalletStore(HftProperties properties, Clock clock) {
        return new InMemoryWalletStore(configuredWallets(properties, clock));
    }

    @Bean
    @Profile("jdbc")
    public WalletStore jdbcWalletStore(JdbcTemplate jdbcTemplate, HftProperties properties, Clock clock) {
        JdbcWalletStore store = new JdbcWalletStore(jdbcTemplate);
        for (Wallet wallet : configuredWallets(properties, clock)) {
            if (store.findById(wallet.id()).isEmpty()) {
                store.save(wallet);
                log.info("Registered wallet {} ({}) in the wallet table", wallet.id(), wallet.role());
            }
        }
        return store;
    }

    @Bean
    public WalletManager walletManager(WalletStore store, HftProperties properties, AlertPublisher alerts,
                                       Clock clock) {
        WalletPolicy policy = WalletPolicy.from(properties.wallets(), properties.risk());
        return new WalletManager(store, policy, alerts, clock);
    }

    @Bean
    public MarketSnapshotBook marketSnapshotBook(HftProperties properties, Clock clock) {
        HftProperties.Market market = properties.market();
        return new MarketSnapshotBook(
                market.whaleTradeThreshold(),
                Duration.ofSeconds(market.whaleWindowSeconds()),
                new TradeBurstFrontRunIntel(),
                clock
        );
    }

    @Bean
    public ExecutionGateway executionGateway(HftProperties properties, MarketSnapshotBook snapshotBook) {
        if (properties.mode() != HftProperties.TradingMode.PAPER) {
            throw new ConfigurationException("hft.mode=" + properties.mode()
                    + " needs a broadcasting ExecutionGateway; only PAPER is wired in this service");
        }
        log.info("PAPER mode: orders fill locally with {}bps slippage", properties.execution().paperSlippageBps());
        return new PaperExecutionGateway(snapshotBook, properties.execution().paperSlippageBps());
    }

    @Bean
    public ExecutionEngine executionEngine(
            ExecutionGateway gateway,
            HftProperties properties,
            WalletManager walletManager,
            RiskManager riskManager,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        return new ExecutionEngine(
                gateway,
                ExecutionSettings.from(properties.execution()),
                walletManager,
                riskManager::recordApiOutcome,
                new Random(),
                Sleeper.THREAD,
                clock,
                meterRegistry
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor launchpadWorkers(HftProperties properties) {
        HftProperties.Pipeline pipeline = properties.pipeline();
        return boundedPool("launchbot-lane", pipeline.workerThreads(), pipeline.workerQueueCapacity());
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor launchpadExecutionPool(HftProperties properties) {
        HftProperties.Pipeline pipeline = properties.pipeline();
        return boundedPool("launchbot-exec", pipeline.executionThreads(), pipeline.workerQueueCapacity());
    }

    @Bean
    public MintLaneDispatcher mintLaneDispatcher(
            @Qualifier("launchpadWorkers") ThreadPoolExecutor workers,
            HftProperties properties,
            MeterRegistry meterRegistry
    ) {
        HftProperties.Pipeline pipeline = properties.pipeline();
        return new MintLaneDispatcher(workers, pipeline.workerThreads(), pipeline.laneCapacity(), meterRegistry);
    }

    @Bean
    public TradingPipeline tradingPipeline(
            StrategyRegistry strategies,
            SignalGenerator signalGenerator,
            RiskManager riskManager,
            WalletManager walletManager,
            ExecutionEngine executionEngine,
            PositionTracker positionTracker,
            MarketSnapshotBook snapshotBook,
            CreatorHistoryBook creatorHistory,
            AlertPublisher alerts,
            MintLaneDispatcher lanes,
            @Qualifier("launchpadExecutionPool") ThreadPoolExecutor executionPool,
            HftProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        return new TradingPipeline(
                strategies,
                signalGenerator,
                riskManager,
                walletManager,
                executionEngine,
                positionTracker,
                snapshotBook,
                creatorHistory,
                alerts,
                new EventDeduplicator(properties.pipeline().dedupCapacity()),
                lanes,
                executionPool,
                clock,
                meterRegistry
        );
    }

    @Bean(destroyMethod = "close")
    public MarketEventQueue marketEventQueue(HftProperties properties, MeterRegistry meterRegistry) {
        return new MarketEventQueue(properties.pipeline().eventQueueCapacity(), meterRegistry);
    }

    @Bean
    public ApplicationRunner eventLoopStarter(MarketEventQueue queue, TradingPipeline pipeline) {
        return args -> queue.start(pipeline::onEvent);
    }

    @Bean
    public MarketEventCodec marketEventCodec(ObjectMapper objectMapper) {
        return new MarketEventCodec(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hft.ingest", name = "kafka-enabled", havingValue = "true")
    public KafkaMarketEventListener kafkaMarketEventListener(
            MarketEventCodec codec,
            MarketEventQueue queue,
            MeterRegistry meterRegistry
    ) {
        log.info("Kafka market-event ingest enabled");
        return new KafkaMarketEventListener(codec, queue, meterRegistry);
    }

    @Bean
    public PipelineHousekeeper pipelineHousekeeper(TradingPipeline pipeline) {
        return new PipelineHousekeeper(pipeline);
    }

    /**
     * Reservation expiry, daily rollovers, timeout exits and memory trimming.
     */
    @Slf4j
    public static class PipelineHousekeeper {
        private final TradingPipeline pipeline;

        public PipelineHousekeeper(TradingPipeline pipeline) {
            this.pipeline = pipeline;
        }

        @Scheduled(fixedDelayString = "${hft.pipeline.housekeeping-millis:1000}")
        public void run() {
            try {
                pipeline.housekeeping();
            } catch (Exception e) {
                log.warn("Error during pipeline housekeeping: {}", e.getMessage(), e);
            }
        }
    }

    private static List<Wallet> configuredWallets(HftProperties properties, Clock clock) {
        List<Wallet> wallets = new ArrayList<>();
        for (HftProperties.Account account : properties.wallets().accounts()) {
            if (account.id() == null || account.id().isBlank() || account.role() == null) {
                throw new ConfigurationException("hft.wallets.accounts entries need an id and a role: " + account);
            }
            wallets.add(Wallet.fresh(account.id(), account.role(), account.balance(), clock.instant()));
        }
        if (wallets.isEmpty()) {
            log.warn("No wallets configured under hft.wallets.accounts; every entry will be deferred");
        }
        return wallets;
    }

    private static ThreadPoolExecutor boundedPool(String name, int threads, int queueCapacity) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(
                threads,
                threads,
                60,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
