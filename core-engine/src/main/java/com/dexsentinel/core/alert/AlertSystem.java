package com.dexsentinel.core.alert;

import com.dexsentinel.core.model.Alert;
import com.dexsentinel.core.model.AlertLevel;
import com.dexsentinel.core.model.AlertMetrics;
import com.dexsentinel.core.model.AnomalyFinding;
import com.dexsentinel.core.model.OperationResult;
import com.dexsentinel.core.model.Reason;
import com.dexsentinel.core.model.Severity;
import com.dexsentinel.core.model.StreamEvent;
import com.dexsentinel.core.stream.BoundedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Turns findings into leveled alerts, keeps a bounded history of them and
 * hands them to the configured delivery channels.
 *
 * <h3>Level mapping</h3>
 * <p>
 * Findings are mapped through a fixed table: LOW → INFO, MEDIUM → WARNING,
 * HIGH → CRITICAL. Manual and test alerts carry their level explicitly.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * History and counters are guarded by a single read/write lock: an alert is
 * built completely before it is appended under the write lock, so readers
 * either see it in full or not at all, and {@link #metrics()} is always
 * consistent with {@link #history(int)}. Channel delivery runs after the lock
 * is released. The alert system never calls back into the stream processor.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertSystem {

    private static final Logger LOG = LoggerFactory.getLogger(AlertSystem.class);

    private static final Map<Severity, AlertLevel> SEVERITY_TO_LEVEL;

    static {
        EnumMap<Severity, AlertLevel> table = new EnumMap<>(Severity.class);
        table.put(Severity.LOW, AlertLevel.INFO);
        table.put(Severity.MEDIUM, AlertLevel.WARNING);
        table.put(Severity.HIGH, AlertLevel.CRITICAL);
        SEVERITY_TO_LEVEL = Collections.unmodifiableMap(table);
    }

    private static final DateTimeFormatter TEST_TIME = DateTimeFormatter.ofPattern("HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private static final Duration RATE_WINDOW = Duration.ofMinutes(1);

    private final AlertSettings settings;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private final BoundedLog<Alert> history;
    private long nextId = 1;
    private long suppressedAlerts;
    private long rateLimitedAlerts;

    private final Map<String, AlertChannel> channels;
    private final Map<String, Boolean> channelEnabled = new ConcurrentHashMap<>();

    public AlertSystem(AlertSettings settings, List<AlertChannel> channels, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.history = new BoundedLog<>(settings.getHistoryCapacity());

        Map<String, AlertChannel> byName = new LinkedHashMap<>();
        for (AlertChannel channel : Objects.requireNonNull(channels, "channels must not be null")) {
            if (byName.putIfAbsent(channel.name(), channel) != null) {
                throw new IllegalArgumentException("Duplicate alert channel: " + channel.name());
            }
            channelEnabled.put(channel.name(), Boolean.TRUE);
        }
        this.channels = Collections.unmodifiableMap(byName);
    }

    /**
     * Alert system with default settings, logging to the application log.
     */
    public AlertSystem() {
        this(AlertSettings.defaults(), List.of(new LoggingAlertChannel()), Clock.systemUTC());
    }

    /**
     * @return the alert level a finding of the given severity is raised at
     */
    public static AlertLevel levelFor(Severity severity) {
        return SEVERITY_TO_LEVEL.get(severity);
    }

    // ---------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------

    /**
     * Raise the alert for one finding of a processed record.
     *
     * @param event   the event the finding belongs to
     * @param finding the finding
     * @return the recorded alert, or a failure if it was suppressed or rate
     *         limited
     */
    public OperationResult<Alert> record(StreamEvent event, AnomalyFinding finding) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(finding, "finding must not be null");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("record_id", event.getRecordId());
        details.put("record_name", event.getRecordName());
        details.put("rule", finding.getRuleId());
        details.put("severity", finding.getSeverity().name().toLowerCase(Locale.ROOT));
        details.putAll(finding.getDetails());

        return append(levelFor(finding.getSeverity()),
                "Anomaly " + finding.getRuleId() + " in " + event.getRecordName(),
                "Record #" + event.getRecordId() + " (" + event.getRecordName() + "): "
                        + finding.getDescription(),
                details);
    }

    /**
     * Raise a manual alert at an explicit level.
     */
    public OperationResult<Alert> send(AlertLevel level, String title, String message,
            Map<String, Object> details) {
        Objects.requireNonNull(level, "level must not be null");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        return append(level, title, message, details);
    }

    /**
     * Raise a test alert.
     *
     * @param level level name, case-insensitive
     * @return the recorded alert, or {@link Reason#INVALID_LEVEL} for an
     *         unknown level
     */
    public OperationResult<Alert> test(String level) {
        return AlertLevel.find(level)
                .map(parsed -> test(parsed))
                .orElseGet(() -> OperationResult.failure(Reason.INVALID_LEVEL,
                        "Unknown alert level: '" + level + "'. Supported: info, warning, critical"));
    }

    public OperationResult<Alert> test(AlertLevel level) {
        Instant now = clock.instant();
        String time = TEST_TIME.format(now);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("test", true);
        details.put("level", level.name().toLowerCase(Locale.ROOT));
        return append(level, "Test alert - " + time, "Test alert sent at " + time, details);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return up to {@code limit} most recent alerts, newest first
     */
    public List<Alert> history(int limit) {
        lock.readLock().lock();
        try {
            return history.newestFirst(limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return up to {@code limit} most recent alerts of the given level,
     *         newest first
     */
    public List<Alert> history(int limit, AlertLevel level) {
        Objects.requireNonNull(level, "level must not be null");
        lock.readLock().lock();
        try {
            return history.newestFirst(limit, alert -> alert.getLevel() == level);
        } finally {
            lock.readLock().unlock();
        }
    }

    public AlertMetrics metrics() {
        lock.readLock().lock();
        try {
            Map<AlertLevel, Integer> byLevel = new EnumMap<>(AlertLevel.class);
            for (Alert alert : history.snapshot()) {
                byLevel.merge(alert.getLevel(), 1, Integer::sum);
            }
            Alert newest = history.newest();
            return new AlertMetrics(history.size(),
                    newest != null ? newest.getTimestamp() : null,
                    byLevel,
                    suppressedAlerts,
                    rateLimitedAlerts,
                    history.dropped(),
                    history.capacity(),
                    enabledChannels());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Empty the history and reset the metrics. The stream processor's
     * lifetime {@code alertsSent} counter is not affected.
     *
     * @return number of alerts removed
     */
    public int clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = history.clear();
            suppressedAlerts = 0;
            rateLimitedAlerts = 0;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info("Alert history cleared: {} alert(s) removed", removed);
        return removed;
    }

    // ---------------------------------------------------------------
    // Channels
    // ---------------------------------------------------------------

    public OperationResult<Void> setChannelEnabled(String name, boolean enabled) {
        if (name == null || !channels.containsKey(name)) {
            return OperationResult.failure(Reason.UNKNOWN_CHANNEL,
                    "Unknown alert channel: '" + name + "'. Available: " + channels.keySet());
        }
        channelEnabled.put(name, enabled);
        LOG.info("Alert channel [{}] {}", name, enabled ? "enabled" : "disabled");
        return OperationResult.ok("Channel " + name + (enabled ? " enabled" : " disabled"));
    }

    public List<String> enabledChannels() {
        List<String> names = new ArrayList<>();
        for (String name : channels.keySet()) {
            if (channelEnabled.getOrDefault(name, Boolean.FALSE)) {
                names.add(name);
            }
        }
        return names;
    }

    public AlertSettings settings() {
        return settings;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private OperationResult<Alert> append(AlertLevel level, String title, String message,
            Map<String, Object> details) {
        Alert alert;

        lock.writeLock().lock();
        try {
            // read under the lock so history stays in timestamp order
            Instant now = clock.instant();
            if (settings.isDuplicateSuppressionEnabled() && isDuplicate(level, title, now)) {
                suppressedAlerts++;
                LOG.debug("Alert suppressed as duplicate: {}", title);
                return OperationResult.failure(Reason.SUPPRESSED, "Duplicate alert suppressed: " + title);
            }
            if (settings.isRateLimitEnabled() && isRateLimited(now)) {
                rateLimitedAlerts++;
                LOG.debug("Alert rate limited: {}", title);
                return OperationResult.failure(Reason.RATE_LIMITED,
                        "Alert rate limit of " + settings.getMaxAlertsPerMinute() + "/min reached");
            }

            alert = Alert.builder()
                    .id(nextId++)
                    .timestamp(now)
                    .level(level)
                    .title(title)
                    .message(message)
                    .details(details)
                    .build();
            if (history.append(alert)) {
                LOG.debug("Alert history full ({}), oldest alert evicted", history.capacity());
            }
        } finally {
            lock.writeLock().unlock();
        }

        deliver(alert);
        return OperationResult.ok(alert, "Alert recorded");
    }

    private boolean isDuplicate(AlertLevel level, String title, Instant now) {
        Instant cutoff = now.minus(settings.getDuplicateWindow());
        for (Alert recent : history.newestFirst(history.size())) {
            if (recent.getTimestamp().isBefore(cutoff)) {
                break;
            }
            if (recent.getLevel() == level && recent.getTitle().equals(title)) {
                return true;
            }
        }
        return false;
    }

    private boolean isRateLimited(Instant now) {
        Instant cutoff = now.minus(RATE_WINDOW);
        int recent = 0;
        for (Alert alert : history.newestFirst(history.size())) {
            if (alert.getTimestamp().isBefore(cutoff)) {
                break;
            }
            recent++;
        }
        return recent >= settings.getMaxAlertsPerMinute();
    }

    private void deliver(Alert alert) {
        for (AlertChannel channel : channels.values()) {
            if (!channelEnabled.getOrDefault(channel.name(), Boolean.FALSE)) {
                continue;
            }
            try {
                channel.deliver(alert);
            } catch (Exception e) {
                LOG.error("Alert channel [{}] failed to deliver alert {} - continuing with next channel",
                        channel.name(), alert.getId(), e);
            }
        }
    }
}
