package net.cadence.integration.spring.sched;

import net.cadence.adapter.jdbc.repo.JdbcJobExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcScheduledJobRepository;
import net.cadence.core.maintenance.ExecutionMaintenanceService;
import net.cadence.core.maintenance.ExecutionMaintenanceService.MaintenanceReport;
import net.cadence.core.model.JobExecution;
import net.cadence.core.service.SchedulerOptions;
import net.cadence.core.spi.Clock;
import net.cadence.integration.spring.TestDatabase;
import net.cadence.integration.spring.tx.SpringTxRunner;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MaintenanceSchedulerTest {

    @Test
    void closesAbandonedPendingRuns_andPurgesOldOnes() throws Exception {
        DataSource ds = TestDatabase.newH2();
        SpringTxRunner tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
        JdbcScheduledJobRepository jobs = new JdbcScheduledJobRepository();
        JdbcJobExecutionRepository executions = new JdbcJobExecutionRepository();
        Clock clock = Clock.system();
        Instant now = clock.now();

        long jobId = tx.required(() -> jobs.upsertJobDefinition("nightly", "h", 60, null, now)).id();
        long abandoned = tx.required(() -> executions.insertExecution(jobId, now.minus(Duration.ofHours(1)))).id();
        Instant longAgo = now.minus(Duration.ofDays(45));
        long old = tx.required(() -> executions.insertExecution(jobId, longAgo)).id();
        tx.required(() -> executions.completeExecution(old, JobExecution.Status.SUCCESS, longAgo, 10, null));

        MaintenanceScheduler scheduler = new MaintenanceScheduler(new ExecutionMaintenanceService(executions, tx, clock));
        scheduler.setStaleAfter(Duration.ofMinutes(10));
        scheduler.setRetention(Duration.ofDays(30));
        MaintenanceReport report = scheduler.runOnce();

        assertThat(report.recoveredPending).isEqualTo(1);
        assertThat(report.purgedFinished).isEqualTo(1);
        JobExecution row = tx.required(() -> executions.findExecution(abandoned)).orElseThrow();
        assertThat(row.status()).isEqualTo(JobExecution.Status.TIMEOUT);
        assertThat(row.errorMessage()).isEqualTo(ExecutionMaintenanceService.ABANDONED_MESSAGE);
        assertThat(tx.required(() -> executions.findExecution(old))).isEmpty();
    }

    @Test
    void defaultsFollowSchedulerOptions() {
        MaintenanceScheduler scheduler = new MaintenanceScheduler(null);

        assertThat(scheduler.getStaleAfter()).isEqualTo(SchedulerOptions.defaults().staleExecutionThreshold());
        assertThat(scheduler.getRetention()).isEqualTo(Duration.ofDays(30));
    }
}
