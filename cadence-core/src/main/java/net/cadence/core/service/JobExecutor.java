package net.cadence.core.service;

import net.cadence.core.model.JobExecution;
import net.cadence.core.model.ScheduledJob;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobExecutionRepository;
import net.cadence.core.spi.ScheduledJobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 잡 1회 실행: PENDING 선점 → 타임아웃 내 핸들러 실행 → 다음 실행 시각 전진 → 결과 기록.
 * 예외를 던지지 않음. 실패는 실행 행 또는 로그에 남김.
 */
public final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    public static final String TIMEOUT_MESSAGE = "job execution timeout";
    public static final String HANDLER_NOT_FOUND = "handler not found: ";

    private final ScheduledJobRepository jobs;
    private final JobExecutionRepository executions;
    private final JobRegistry registry;
    private final TxRunner tx;
    private final Clock clock;
    private final ExecutorService handlerPool;
    private final Duration timeout;

    public JobExecutor(ScheduledJobRepository jobs,
                       JobExecutionRepository executions,
                       JobRegistry registry,
                       TxRunner tx,
                       Clock clock,
                       ExecutorService handlerPool,
                       Duration timeout) {
        this.jobs = jobs;
        this.executions = executions;
        this.registry = registry;
        this.tx = tx;
        this.clock = clock;
        this.handlerPool = handlerPool;
        this.timeout = timeout;
    }

    /**
     * @return 완료된 실행. 실행이 생성되지 않았으면 empty
     *         (이미 PENDING 존재, 더 이상 due 아님, 또는 insert 실패로 잡이 due 상태 유지)
     */
    public Optional<JobExecution> execute(ScheduledJob job) {
        Instant startedAt = clock.now();
        JobExecution execution;
        try {
            Optional<JobExecution> claimed = tx.requiresNew(() -> executions.claimExecution(job.id(), startedAt));
            if (claimed.isEmpty()) {
                log.info("Skipping job {} - not due anymore or an execution is already pending", job.name());
                return Optional.empty();
            }
            execution = claimed.get();
        } catch (Exception e) {
            log.warn("Could not create execution record for job {}, will retry on next pass", job.name(), e);
            return Optional.empty();
        }

        log.info("Starting job {} (id={}, execution={})", job.name(), job.id(), execution.id());
        Outcome outcome = runHandler(job, execution);
        Instant completedAt = clock.now();
        long durationMs = Duration.between(execution.startedAt(), completedAt).toMillis();

        // PENDING 해제 전에 커서를 먼저 전진시켜야 다음 패스가 같은 주기에 재선점하지 못함
        advanceSchedule(job, completedAt);
        record(job, execution, outcome, completedAt, durationMs);

        return Optional.of(new JobExecution(execution.id(), job.id(), execution.startedAt(), completedAt,
                durationMs, outcome.status(), outcome.errorMessage(), execution.createdAt()));
    }

    private Outcome runHandler(ScheduledJob job, JobExecution execution) {
        Optional<JobHandler> handler = registry.lookup(job.jobHandler());
        if (handler.isEmpty()) {
            String msg = HANDLER_NOT_FOUND + job.jobHandler();
            log.warn("Error executing job {}: {}", job.name(), msg);
            return Outcome.failed(msg);
        }

        JobContext ctx = new JobContext(job.name(), execution.id(), execution.startedAt(),
                execution.startedAt().plus(timeout));
        JobHandler body = handler.get();
        Future<Void> result;
        try {
            result = handlerPool.submit(() -> {
                body.run(ctx);
                return null;
            });
        } catch (RejectedExecutionException e) {
            log.warn("Job {} not started, handler pool is shut down", job.name());
            return Outcome.failed("handler pool rejected execution");
        }

        try {
            result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Job {} completed successfully", job.name());
            return Outcome.SUCCESS;
        } catch (ExecutionException e) {
            String msg = messageOf(e.getCause());
            log.warn("Job {} failed: {}", job.name(), msg);
            return Outcome.failed(msg);
        } catch (TimeoutException e) {
            // 핸들러는 계속 돌고 컨텍스트만 취소 표시
            ctx.cancel();
            log.warn("Job {} timed out after {}, handler may still be running", job.name(), timeout);
            return new Outcome(JobExecution.Status.TIMEOUT, TIMEOUT_MESSAGE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancel();
            log.warn("Interrupted while waiting for job {}", job.name());
            return Outcome.failed("interrupted while waiting for handler");
        }
    }

    private void record(ScheduledJob job, JobExecution execution, Outcome outcome,
                        Instant completedAt, long durationMs) {
        try {
            boolean done = tx.requiresNew(() -> executions.completeExecution(execution.id(), outcome.status(),
                    completedAt, durationMs, outcome.errorMessage()));
            if (!done) {
                log.warn("Execution {} of job {} was no longer pending, outcome {} dropped",
                        execution.id(), job.name(), outcome.status());
            }
        } catch (Exception e) {
            log.error("Error marking execution {} of job {} as {}", execution.id(), job.name(), outcome.status(), e);
        }
    }

    private void advanceSchedule(ScheduledJob job, Instant lastRunAt) {
        Instant next = job.nextRunAfter(lastRunAt);
        try {
            tx.requiresNew(() -> {
                jobs.updateJobSchedule(job.id(), lastRunAt, next);
                return null;
            });
        } catch (Exception e) {
            log.error("Error updating next run time for job {}", job.name(), e);
        }
    }

    static String messageOf(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    private record Outcome(JobExecution.Status status, String errorMessage) {
        static final Outcome SUCCESS = new Outcome(JobExecution.Status.SUCCESS, null);

        static Outcome failed(String message) {
            return new Outcome(JobExecution.Status.FAILED, message);
        }
    }
}
