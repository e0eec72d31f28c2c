package net.cadence.adapter.jdbc;

import net.cadence.adapter.jdbc.repo.JdbcJobExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcScheduledJobRepository;
import net.cadence.core.model.JobExecution;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 한 잡에 대한 동시 선점: 잡 행 락으로 PENDING 은 정확히 1건.
 */
class ConcurrentClaimAcceptanceTest extends TestSupport {

    JdbcScheduledJobRepository jobs;
    JdbcJobExecutionRepository executions;

    @BeforeAll
    void initAll() {
        jobs = new JdbcScheduledJobRepository();
        executions = new JdbcJobExecutionRepository();
    }

    @Test
    void concurrentClaims_onlyOneWins() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long jobId = tx.required(() -> jobs.upsertJobDefinition("contended", "h", 1, null, now)).id();

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<JobExecution>>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return tx.requiresNew(() -> executions.claimExecution(jobId, now));
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Optional<JobExecution>> f : futures) if (f.get().isPresent()) wins++;
        es.shutdown();

        assertEquals(1, wins, "exactly one claim should succeed");
        int pending = tx.required(() -> executions.countPendingExecutions(jobId));
        assertEquals(1, pending);
    }

    @Test
    void concurrentClaims_onDifferentJobs_doNotBlockEachOther() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        int threads = 4;
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String name = "job-" + i;
            ids.add(tx.required(() -> jobs.upsertJobDefinition(name, "h", 1, null, now)).id());
        }

        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<JobExecution>>> futures = new ArrayList<>();
        for (long id : ids) {
            futures.add(es.submit(() -> {
                start.await();
                return tx.requiresNew(() -> executions.claimExecution(id, now));
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Optional<JobExecution>> f : futures) if (f.get().isPresent()) wins++;
        es.shutdown();

        assertEquals(threads, wins);
    }
}
