package com.dexsentinel.app;

import com.dexsentinel.core.alert.AlertChannel;
import com.dexsentinel.core.alert.AlertSystem;
import com.dexsentinel.core.alert.LoggingAlertChannel;
import com.dexsentinel.core.config.RulesConfig;
import com.dexsentinel.core.config.RulesLoader;
import com.dexsentinel.core.dashboard.DashboardAggregator;
import com.dexsentinel.core.rules.AnomalyRule;
import com.dexsentinel.core.rules.RuleEngine;
import com.dexsentinel.core.rules.RuleFactory;
import com.dexsentinel.core.rules.TypeVocabulary;
import com.dexsentinel.core.store.InMemoryRecordStore;
import com.dexsentinel.core.store.RecordStore;
import com.dexsentinel.core.stream.StreamProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Dex Sentinel pipeline.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   Record store (seeded from SEED_RECORDS_PATH)
 *     → StreamProcessor (rule engine, bounded event log, store poller)
 *     → AlertSystem (log + JSON-lines file channels)
 *     → DashboardAggregator
 *     → HTTP server
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link AppConfig}. The processor starts STOPPED; {@code POST /stream/start}
 * starts it.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineApplication {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineApplication.class);

    private final StreamProcessor processor;
    private final PipelineHttpServer httpServer;

    private PipelineApplication(StreamProcessor processor, PipelineHttpServer httpServer) {
        this.processor = processor;
        this.httpServer = httpServer;
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        AppConfig config = AppConfig.fromEnvironment();
        LOG.info("Starting Dex Sentinel with config: {}", config);

        // 2. Wire and start
        PipelineApplication app = create(config, new InMemoryRecordStore(), Clock.systemUTC());
        app.start(config.getHttpPort());

        // 3. Block until the JVM is asked to shut down
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            stopped.countDown();
        }, "pipeline-shutdown"));
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for testability)
    // ---------------------------------------------------------------

    /**
     * Build every component from the configuration.
     *
     * @throws IllegalStateException if the rules configuration is invalid
     * @throws IOException           if the seed records cannot be read
     */
    static PipelineApplication create(AppConfig config, RecordStore store, Clock clock) throws IOException {
        // Rules
        RulesConfig rulesConfig = loadRules(config);
        TypeVocabulary vocabulary = TypeVocabulary.fromConfig(rulesConfig.getKnownTypes());
        List<AnomalyRule> rules = rulesConfig.getRules().isEmpty()
                ? RuleFactory.defaults(vocabulary)
                : RuleFactory.createAll(rulesConfig.getRules(), vocabulary);
        RuleEngine engine = new RuleEngine(rules, vocabulary);

        // Catalog
        String seedPath = config.getSeedRecordsPath();
        if (!seedPath.isBlank()) {
            new SeedRecordReader(clock).load(Path.of(seedPath), store);
        }

        // Alerts
        Path alertsDir = Path.of(config.getAlertsDir());
        List<AlertChannel> channels = List.of(new LoggingAlertChannel(), new JsonlFileAlertChannel(alertsDir));
        AlertSystem alertSystem = new AlertSystem(config.alertSettings(), channels, clock);

        // Processing
        StreamProcessor processor = new StreamProcessor(engine, alertSystem, store,
                config.processorSettings(), clock);
        DashboardAggregator dashboard = new DashboardAggregator(store, engine, processor::status,
                alertSystem, clock);

        PipelineHttpServer httpServer = new PipelineHttpServer(processor, alertSystem, dashboard,
                new AlertExporter(alertSystem, alertsDir, clock));
        return new PipelineApplication(processor, httpServer);
    }

    void start(int port) throws IOException {
        httpServer.start(port);
        LOG.info("Dex Sentinel ready on port {}", httpServer.port());
    }

    void stop() {
        httpServer.stop();
        processor.close();
        LOG.info("Dex Sentinel stopped");
    }

    PipelineHttpServer httpServer() {
        return httpServer;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RulesConfig loadRules(AppConfig config) {
        String rulesPath = config.getRulesConfigPath();
        if (rulesPath != null && !rulesPath.isBlank()) {
            return RulesLoader.fromFile(rulesPath);
        }
        return RulesLoader.load();
    }
}
