package com.dexsentinel.core.alert;

import com.dexsentinel.core.model.Alert;
import com.dexsentinel.core.model.AlertLevel;
import com.dexsentinel.core.model.AlertMetrics;
import com.dexsentinel.core.model.AnomalyFinding;
import com.dexsentinel.core.model.ManualClock;
import com.dexsentinel.core.model.OperationResult;
import com.dexsentinel.core.model.Reason;
import com.dexsentinel.core.model.SampleRecords;
import com.dexsentinel.core.model.Severity;
import com.dexsentinel.core.model.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AlertSystem}.
 */
@ExtendWith(MockitoExtension.class)
class AlertSystemTest {

    @Mock
    private AlertChannel channel;

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(SampleRecords.NOW);
    }

    @Test
    @DisplayName("Should map severities through the fixed level table")
    void shouldMapSeverities() {
        assertThat(AlertSystem.levelFor(Severity.LOW)).isEqualTo(AlertLevel.INFO);
        assertThat(AlertSystem.levelFor(Severity.MEDIUM)).isEqualTo(AlertLevel.WARNING);
        assertThat(AlertSystem.levelFor(Severity.HIGH)).isEqualTo(AlertLevel.CRITICAL);
    }

    @Test
    @DisplayName("Should record a high finding as a critical alert")
    void shouldRecordFinding() {
        AlertSystem alerts = newSystem(AlertSettings.defaults());

        OperationResult<Alert> result = alerts.record(event(), finding(Severity.HIGH));

        assertThat(result.isSuccess()).isTrue();
        Alert alert = result.getValue().orElseThrow();
        assertThat(alert.getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(alert.getTitle()).isEqualTo("Anomaly negative_stats in pikachu");
        assertThat(alert.getMessage()).isEqualTo("Record #25 (pikachu): Negative stats detected: hp=-10");
        assertThat(alert.getDetails())
                .containsEntry("record_id", 25)
                .containsEntry("rule", "negative_stats")
                .containsEntry("severity", "high")
                .containsEntry("violations", List.of("hp=-10"));
        assertThat(alerts.history(1)).containsExactly(alert);
    }

    @Test
    @DisplayName("Should keep metrics consistent with the history")
    void shouldTrackMetrics() {
        AlertSystem alerts = newSystem(AlertSettings.defaults());

        alerts.record(event(), finding(Severity.HIGH));
        clock.advance(Duration.ofSeconds(1));
        alerts.record(event(), finding(Severity.LOW));
        alerts.test("warning");

        AlertMetrics metrics = alerts.metrics();
        assertThat(metrics.getTotalAlerts()).isEqualTo(3);
        assertThat(metrics.getLastAlert()).isEqualTo(clock.instant());
        assertThat(metrics.getAlertsByLevel())
                .containsEntry(AlertLevel.INFO, 1)
                .containsEntry(AlertLevel.WARNING, 1)
                .containsEntry(AlertLevel.CRITICAL, 1);
        assertThat(metrics.getEnabledChannels()).containsExactly("mock");
    }

    @Test
    @DisplayName("Should never retain more than capacity, newest first")
    void shouldBoundHistory() {
        AlertSystem alerts = newSystem(AlertSettings.builder().historyCapacity(3).build());

        for (int i = 0; i < 5; i++) {
            alerts.send(AlertLevel.INFO, "alert " + i, "message", null);
        }

        assertThat(alerts.history(10)).extracting(Alert::getTitle)
                .containsExactly("alert 4", "alert 3", "alert 2");
        assertThat(alerts.metrics().getTotalAlerts()).isEqualTo(3);
        assertThat(alerts.metrics().getDroppedAlerts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should filter history by level")
    void shouldFilterByLevel() {
        AlertSystem alerts = newSystem(AlertSettings.defaults());
        alerts.send(AlertLevel.INFO, "info", null, null);
        alerts.send(AlertLevel.CRITICAL, "critical 1", null, null);
        alerts.send(AlertLevel.CRITICAL, "critical 2", null, null);

        assertThat(alerts.history(10, AlertLevel.CRITICAL)).extracting(Alert::getTitle)
                .containsExactly("critical 2", "critical 1");
    }

    @Test
    @DisplayName("Should reset history and metrics on clear")
    void shouldClear() {
        AlertSystem alerts = newSystem(AlertSettings.defaults());
        alerts.record(event(), finding(Severity.HIGH));
        alerts.record(event(), finding(Severity.MEDIUM));

        assertThat(alerts.clear()).isEqualTo(2);

        AlertMetrics metrics = alerts.metrics();
        assertThat(alerts.history(10)).isEmpty();
        assertThat(metrics.getTotalAlerts()).isZero();
        assertThat(metrics.getLastAlert()).isNull();
        assertThat(metrics.getAlertsByLevel()).containsEntry(AlertLevel.CRITICAL, 0);
    }

    @Test
    @DisplayName("Should raise test alerts at the requested level and reject unknown levels")
    void shouldRaiseTestAlerts() {
        AlertSystem alerts = newSystem(AlertSettings.defaults());

        OperationResult<Alert> ok = alerts.test("CRITICAL");
        OperationResult<Alert> bad = alerts.test("panic");

        assertThat(ok.getValue().orElseThrow().getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(ok.getValue().orElseThrow().getTitle()).isEqualTo("Test alert - 12:00:00");
        assertThat(bad.isSuccess()).isFalse();
        assertThat(bad.getReason()).isEqualTo(Reason.INVALID_LEVEL);
        assertThat(alerts.metrics().getTotalAlerts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should suppress duplicates within the window when enabled")
    void shouldSuppressDuplicates() {
        AlertSystem alerts = newSystem(AlertSettings.builder()
                .duplicateWindow(Duration.ofMinutes(5))
                .build());

        assertThat(alerts.record(event(), finding(Severity.HIGH)).isSuccess()).isTrue();
        OperationResult<Alert> duplicate = alerts.record(event(), finding(Severity.HIGH));
        clock.advance(Duration.ofMinutes(6));
        OperationResult<Alert> later = alerts.record(event(), finding(Severity.HIGH));

        assertThat(duplicate.getReason()).isEqualTo(Reason.SUPPRESSED);
        assertThat(later.isSuccess()).isTrue();
        assertThat(alerts.metrics().getSuppressedAlerts()).isEqualTo(1);
        assertThat(alerts.metrics().getTotalAlerts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should record identical findings separately by default")
    void shouldNotSuppressByDefault() {
        AlertSystem alerts = newSystem(AlertSettings.defaults());

        alerts.record(event(), finding(Severity.HIGH));
        alerts.record(event(), finding(Severity.HIGH));

        assertThat(alerts.metrics().getTotalAlerts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should rate limit alerts per minute when enabled")
    void shouldRateLimit() {
        AlertSystem alerts = newSystem(AlertSettings.builder().maxAlertsPerMinute(2).build());

        alerts.send(AlertLevel.INFO, "a", null, null);
        alerts.send(AlertLevel.INFO, "b", null, null);
        OperationResult<Alert> third = alerts.send(AlertLevel.INFO, "c", null, null);
        clock.advance(Duration.ofSeconds(61));
        OperationResult<Alert> fourth = alerts.send(AlertLevel.INFO, "d", null, null);

        assertThat(third.getReason()).isEqualTo(Reason.RATE_LIMITED);
        assertThat(fourth.isSuccess()).isTrue();
        assertThat(alerts.metrics().getRateLimitedAlerts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the alert when a channel fails")
    void shouldSurviveChannelFailure() throws IOException {
        doThrow(new IOException("disk full")).when(channel).deliver(any());
        AlertSystem alerts = newSystem(AlertSettings.defaults());

        OperationResult<Alert> result = alerts.send(AlertLevel.WARNING, "t", "m", Map.of());

        assertThat(result.isSuccess()).isTrue();
        assertThat(alerts.history(1)).hasSize(1);
        verify(channel, times(1)).deliver(any());
    }

    @Test
    @DisplayName("Should skip disabled channels and reject unknown channel names")
    void shouldToggleChannels() throws IOException {
        AlertSystem alerts = newSystem(AlertSettings.defaults());

        assertThat(alerts.setChannelEnabled("mock", false).isSuccess()).isTrue();
        alerts.send(AlertLevel.INFO, "t", null, null);

        verify(channel, never()).deliver(any());
        assertThat(alerts.enabledChannels()).isEmpty();
        assertThat(alerts.setChannelEnabled("pager", true).getReason()).isEqualTo(Reason.UNKNOWN_CHANNEL);
    }

    @Test
    @DisplayName("Should never expose a partially appended alert to concurrent readers")
    void shouldStayConsistentUnderConcurrency() throws Exception {
        AlertSystem alerts = new AlertSystem(AlertSettings.builder().historyCapacity(50).build(),
                List.of(), clock);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<String> inconsistencies = new ArrayList<>();

        for (int w = 0; w < 2; w++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    alerts.send(AlertLevel.WARNING, "load", "m", null);
                }
                return null;
            });
        }
        pool.submit(() -> {
            start.await();
            for (int i = 0; i < 500; i++) {
                AlertMetrics metrics = alerts.metrics();
                int byLevel = metrics.getAlertsByLevel().values().stream().mapToInt(Integer::intValue).sum();
                if (byLevel != metrics.getTotalAlerts()) {
                    synchronized (inconsistencies) {
                        inconsistencies.add(byLevel + " != " + metrics.getTotalAlerts());
                    }
                }
                for (Alert alert : alerts.history(50)) {
                    if (alert.getTitle() == null || alert.getLevel() == null) {
                        synchronized (inconsistencies) {
                            inconsistencies.add("torn alert " + alert);
                        }
                    }
                }
            }
            return null;
        });

        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(inconsistencies).isEmpty();
        assertThat(alerts.metrics().getTotalAlerts()).isEqualTo(50);
        assertThat(alerts.metrics().getDroppedAlerts()).isEqualTo(950);
    }

    @Test
    @DisplayName("Should keep history in timestamp order when alerts are appended concurrently")
    void shouldKeepHistoryOrderedUnderConcurrency() throws Exception {
        TickingClock ticking = new TickingClock(SampleRecords.NOW);
        AlertSystem alerts = new AlertSystem(AlertSettings.builder().historyCapacity(2000).build(),
                List.of(), ticking);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);

        for (int w = 0; w < 4; w++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 250; i++) {
                    alerts.send(AlertLevel.INFO, "tick", "m", null);
                }
                return null;
            });
        }

        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        List<Alert> history = alerts.history(1000);
        assertThat(history).hasSize(1000);
        assertThat(history).extracting(Alert::getTimestamp)
                .isSortedAccordingTo(Comparator.reverseOrder());
        assertThat(alerts.metrics().getLastAlert()).isEqualTo(history.get(0).getTimestamp());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Clock that moves one millisecond per read and yields after each read.
     */
    private static final class TickingClock extends Clock {

        private final Instant start;
        private final AtomicLong ticks = new AtomicLong();

        TickingClock(Instant start) {
            this.start = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant now = start.plusMillis(ticks.incrementAndGet());
            Thread.yield();
            return now;
        }
    }

    private AlertSystem newSystem(AlertSettings settings) {
        when(channel.name()).thenReturn("mock");
        return new AlertSystem(settings, List.of(channel), clock);
    }

    private static StreamEvent event() {
        return new StreamEvent(SampleRecords.NOW, 25, "pikachu", List.of(finding(Severity.HIGH)));
    }

    private static AnomalyFinding finding(Severity severity) {
        return new AnomalyFinding("negative_stats", severity, "Negative stats detected: hp=-10",
                Map.of("violations", List.of("hp=-10")));
    }
}
