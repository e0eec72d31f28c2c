package net.cadence.core.maintenance;

import net.cadence.core.model.JobExecution;
import net.cadence.core.model.ScheduledJob;
import net.cadence.core.support.DirectTxRunner;
import net.cadence.core.support.InMemoryJobStore;
import net.cadence.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionMaintenanceServiceTest {
    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");

    InMemoryJobStore store;
    ExecutionMaintenanceService maintenance;
    long jobId;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryJobStore();
        maintenance = new ExecutionMaintenanceService(store, new DirectTxRunner(), new MutableClock(NOW));
        ScheduledJob job = store.upsertJobDefinition("cleanup", "h", 5, "d", NOW.minus(Duration.ofDays(90)));
        jobId = job.id();
    }

    @Test
    void abandonedPendingExecutionIsClosedAsTimeout() throws Exception {
        JobExecution stale = store.insertExecution(jobId, NOW.minus(Duration.ofHours(1)));
        JobExecution fresh = store.insertExecution(jobId + 1, NOW.minus(Duration.ofSeconds(10)));

        var report = maintenance.runOnce(Duration.ofMinutes(6), null);

        assertThat(report.recoveredPending).isEqualTo(1);
        JobExecution closed = store.findExecution(stale.id()).orElseThrow();
        assertThat(closed.status()).isEqualTo(JobExecution.Status.TIMEOUT);
        assertThat(closed.errorMessage()).isEqualTo(ExecutionMaintenanceService.ABANDONED_MESSAGE);
        assertThat(closed.completedAt()).isEqualTo(NOW);
        assertThat(closed.durationMs()).isEqualTo(Duration.ofHours(1).toMillis());
        assertThat(store.findExecution(fresh.id()).orElseThrow().pending()).isTrue();
        assertThat(store.countPendingExecutions(jobId)).isZero();
    }

    @Test
    void finishedExecutionsOlderThanRetentionArePurged() throws Exception {
        Instant old = NOW.minus(Duration.ofDays(40));
        Instant recent = NOW.minus(Duration.ofDays(2));
        store.putExecution(new JobExecution(null, jobId, old, old.plusSeconds(1), 1000L,
                JobExecution.Status.SUCCESS, null, old));
        store.putExecution(new JobExecution(null, jobId, old, old.plusSeconds(1), 1000L,
                JobExecution.Status.FAILED, "x", old));
        store.putExecution(new JobExecution(null, jobId, recent, recent.plusSeconds(1), 1000L,
                JobExecution.Status.SUCCESS, null, recent));
        store.insertExecution(jobId, old);

        var report = maintenance.runOnce(null, Duration.ofDays(30));

        assertThat(report.purgedFinished).isEqualTo(2);
        assertThat(report.recoveredPending).isZero();
        // 오래된 PENDING 은 종료 상태가 아니므로 purge 대상 아님
        assertThat(store.executionsOf(jobId)).hasSize(2);
        assertThat(report.timestamp).isEqualTo(NOW);
    }

    @Test
    void nonPositiveDurationsSkipTheirStep() throws Exception {
        store.insertExecution(jobId, NOW.minus(Duration.ofDays(1)));

        var report = maintenance.runOnce(Duration.ZERO, Duration.ofDays(-1));

        assertThat(report.recoveredPending).isZero();
        assertThat(report.purgedFinished).isZero();
        assertThat(store.countPendingExecutions(jobId)).isEqualTo(1);
    }
}
