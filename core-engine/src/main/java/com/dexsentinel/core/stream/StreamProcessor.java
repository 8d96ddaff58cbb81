package com.dexsentinel.core.stream;

import com.dexsentinel.core.alert.AlertSystem;
import com.dexsentinel.core.model.AnomalyFinding;
import com.dexsentinel.core.model.CreatureRecord;
import com.dexsentinel.core.model.OperationResult;
import com.dexsentinel.core.model.ProcessorStatus;
import com.dexsentinel.core.model.Reason;
import com.dexsentinel.core.model.RecordValidationException;
import com.dexsentinel.core.model.StreamEvent;
import com.dexsentinel.core.rules.AnomalyRule;
import com.dexsentinel.core.rules.RuleEngine;
import com.dexsentinel.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs records through the rule engine, keeps a bounded log of the resulting
 * events and forwards findings to the alert system.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * A processor starts STOPPED. {@link #start()} switches it to RUNNING and
 * {@link #stop()} back to STOPPED; both are idempotent. Counters are lifetime
 * totals of the instance and survive restarts; only the start time and the
 * last-processed timestamp reflect the current run. Records offered while
 * stopped are rejected, not buffered.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All status fields and the event log are guarded by one read/write lock.
 * {@link #ingest(CreatureRecord)} evaluates the record, appends the event and
 * updates the counters in a single write-locked step, then releases the lock
 * before calling the {@link AlertSystem}. The two components never hold each
 * other's locks. A {@link #stop()} takes effect for every ingest that has not
 * yet passed the running check.
 * </p>
 *
 * <h3>Polling</h3>
 * <p>
 * When {@link ProcessorSettings#isPollingEnabled()}, a single worker thread
 * calls {@link #pollOnce()} at a fixed delay while the processor is running,
 * picking up recently updated store records.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamProcessor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamProcessor.class);

    private final RuleEngine engine;
    private final AlertSystem alertSystem;
    private final RecordStore store;
    private final ProcessorSettings settings;
    private final Clock clock;
    private final AnomalySimulator simulator = new AnomalySimulator();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private final BoundedLog<StreamEvent> events;
    private final Map<Integer, Instant> recentlyPolled = new HashMap<>();
    private boolean running;
    private long processedCount;
    private long anomaliesDetected;
    private long alertsSent;
    private long processingErrors;
    private Instant lastProcessed;
    private Instant startTime;
    private ScheduledFuture<?> pollTask;

    private final ScheduledExecutorService worker;

    public StreamProcessor(RuleEngine engine, AlertSystem alertSystem, RecordStore store,
            ProcessorSettings settings, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.alertSystem = Objects.requireNonNull(alertSystem, "alertSystem must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.events = new BoundedLog<>(settings.getEventLogCapacity());
        this.worker = settings.isPollingEnabled()
                ? Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "stream-processor");
                    t.setDaemon(true);
                    return t;
                })
                : null;
    }

    public StreamProcessor(RuleEngine engine, AlertSystem alertSystem, RecordStore store) {
        this(engine, alertSystem, store, ProcessorSettings.defaults(), Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Switch to RUNNING and schedule the store poller when polling is enabled.
     *
     * @return success, or {@link Reason#ALREADY_RUNNING}
     * @throws IllegalStateException if the processor has been closed
     */
    public OperationResult<Void> start() {
        lock.writeLock().lock();
        try {
            if (running) {
                LOG.warn("Stream processor is already running");
                return OperationResult.failure(Reason.ALREADY_RUNNING, "Stream processor is already running");
            }
            if (worker != null) {
                long delayMs = settings.getPollInterval().toMillis();
                try {
                    pollTask = worker.scheduleWithFixedDelay(this::pollSafely, 0, delayMs, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    throw new IllegalStateException("Stream processor is closed", e);
                }
            }
            running = true;
            startTime = clock.instant();
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Stream processor started");
        return OperationResult.ok("Stream processor started");
    }

    public OperationResult<Void> stop() {
        lock.writeLock().lock();
        try {
            if (!running) {
                return OperationResult.noop(Reason.ALREADY_STOPPED, "Stream processor is not running");
            }
            running = false;
            startTime = null;
            if (pollTask != null) {
                // let an in-flight batch finish; later ingests see running == false
                pollTask.cancel(false);
                pollTask = null;
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Stream processor stopped");
        return OperationResult.ok("Stream processor stopped");
    }

    public boolean isRunning() {
        lock.readLock().lock();
        try {
            return running;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stop the processor and release the worker thread.
     */
    @Override
    public void close() {
        stop();
        if (worker != null) {
            worker.shutdown();
            try {
                if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Stream processor worker did not terminate within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ---------------------------------------------------------------
    // Ingestion
    // ---------------------------------------------------------------

    /**
     * Process one record.
     *
     * @param record the record to evaluate
     * @return the emitted event; {@link Reason#NOT_RUNNING} if the processor is
     *         stopped, {@link Reason#INVALID_RECORD} if the record cannot be
     *         evaluated (counted as a processing error)
     */
    public OperationResult<StreamEvent> ingest(CreatureRecord record) {
        StreamEvent event;

        lock.writeLock().lock();
        try {
            if (!running) {
                return OperationResult.failure(Reason.NOT_RUNNING, "Stream processor is not running");
            }

            List<AnomalyFinding> findings;
            try {
                findings = engine.evaluate(record);
            } catch (RecordValidationException e) {
                processingErrors++;
                LOG.warn("Rejected record: {}", e.getMessage());
                return OperationResult.failure(Reason.INVALID_RECORD, e.getMessage());
            }

            Instant now = clock.instant();
            event = new StreamEvent(now, record.getId(), record.getName(), findings);
            processedCount++;
            anomaliesDetected += findings.size();
            if (events.append(event)) {
                LOG.debug("Event log full ({}), oldest event evicted", events.capacity());
            }
            lastProcessed = now;
            recentlyPolled.put(record.getId(), now);
        } finally {
            lock.writeLock().unlock();
        }

        if (event.getAnomaliesCount() > 0) {
            LOG.warn("Anomalies detected in {}: {} total", event.getRecordName(), event.getAnomaliesCount());
            int sent = forwardToAlerts(event);
            if (sent > 0) {
                lock.writeLock().lock();
                try {
                    alertsSent += sent;
                } finally {
                    lock.writeLock().unlock();
                }
            }
        }
        return OperationResult.ok(event, "Processed " + event.getRecordName());
    }

    /**
     * Ingest store records updated within the lookback window that have not
     * been processed within the dedup window.
     *
     * @return number of records processed in this pass
     * @throws com.dexsentinel.core.store.StoreUnavailableException if the store
     *                                                              cannot be
     *                                                              scanned
     */
    public int pollOnce() {
        if (!isRunning()) {
            return 0;
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.getLookback());

        List<CreatureRecord> candidates = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Instant dedupCutoff = now.minus(settings.getDedupWindow());
            recentlyPolled.values().removeIf(at -> at.isBefore(dedupCutoff));
        } finally {
            lock.writeLock().unlock();
        }

        for (CreatureRecord record : store.scan()) {
            if (record.getUpdatedAt() == null || record.getUpdatedAt().isBefore(cutoff)) {
                continue;
            }
            if (record.getId() != null && wasPolledRecently(record.getId())) {
                continue;
            }
            candidates.add(record);
        }
        if (candidates.isEmpty()) {
            LOG.debug("No new records to process");
            return 0;
        }

        LOG.info("Processing {} record(s) from the store", candidates.size());
        int processed = 0;
        for (CreatureRecord record : candidates) {
            OperationResult<StreamEvent> result = ingest(record);
            if (result.getReason() == Reason.NOT_RUNNING) {
                break;
            }
            if (result.isSuccess()) {
                processed++;
            }
        }
        return processed;
    }

    /**
     * Synthesize a record violating {@code ruleId} and process it like any
     * other record.
     *
     * <p>
     * The record named {@code recordName} is taken from the store; a clean
     * baseline record with that name is synthesized when the store has none.
     * </p>
     *
     * @return the emitted event, or a failure ({@link Reason#UNKNOWN_RULE},
     *         {@link Reason#INVALID_RECORD}, {@link Reason#NOT_RUNNING})
     */
    public OperationResult<StreamEvent> simulate(String recordName, String ruleId) {
        if (recordName == null || recordName.isBlank()) {
            return OperationResult.failure(Reason.INVALID_RECORD, "Record name must not be blank");
        }
        Optional<AnomalyRule> rule = engine.rule(ruleId);
        if (rule.isEmpty()) {
            return OperationResult.failure(Reason.UNKNOWN_RULE, "Unknown rule: '" + ruleId + "'");
        }

        CreatureRecord base = store.findByName(recordName)
                .orElseGet(() -> simulator.baseline(recordName, clock.instant()));
        Optional<CreatureRecord> violating = simulator.inject(rule.get().getType(), base);
        if (violating.isEmpty()) {
            return OperationResult.failure(Reason.UNKNOWN_RULE,
                    "Rule type '" + rule.get().getType() + "' cannot be simulated");
        }

        LOG.info("Simulating {} on {}", ruleId, recordName);
        return ingest(violating.get());
    }

    /**
     * Enable or disable a registered rule.
     */
    public OperationResult<Void> updateRule(String ruleId, boolean enabled) {
        if (!engine.setEnabled(ruleId, enabled)) {
            return OperationResult.failure(Reason.UNKNOWN_RULE, "Unknown rule: '" + ruleId + "'");
        }
        return OperationResult.ok("Rule " + ruleId + (enabled ? " enabled" : " disabled"));
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public ProcessorStatus status() {
        lock.readLock().lock();
        try {
            return new ProcessorStatus(running, processedCount, anomaliesDetected, alertsSent,
                    processingErrors, events.dropped(), lastProcessed, startTime,
                    events.size(), events.capacity());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return up to {@code limit} most recent events, newest first
     */
    public List<StreamEvent> events(int limit) {
        lock.readLock().lock();
        try {
            return events.newestFirst(limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AnomalyRule> rules() {
        return engine.rules();
    }

    public ProcessorSettings settings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private int forwardToAlerts(StreamEvent event) {
        int sent = 0;
        for (AnomalyFinding finding : event.getFindings()) {
            if (alertSystem.record(event, finding).isSuccess()) {
                sent++;
            }
        }
        return sent;
    }

    private boolean wasPolledRecently(Integer id) {
        lock.readLock().lock();
        try {
            return recentlyPolled.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            LOG.error("Stream batch failed - retrying on next tick", e);
        }
    }
}
