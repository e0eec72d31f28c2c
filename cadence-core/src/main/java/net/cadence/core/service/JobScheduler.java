package net.cadence.core.service;

import net.cadence.core.model.InvalidJobConfigException;
import net.cadence.core.model.JobConfig;
import net.cadence.core.model.JobExecution;
import net.cadence.core.model.ScheduledJob;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobExecutionRepository;
import net.cadence.core.spi.ScheduledJobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * due 잡을 주기적으로 조회해 각각 실행 스레드에서 돌림.
 *
 * <p>Lifecycle: STOPPED -> RUNNING ({@link #start()}) -> STOPPING -> STOPPED ({@link #stop()}).
 * 정지 후 재시작 가능. 인스턴스마다 레지스트리와 스레드풀을 따로 가짐.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    public enum State { STOPPED, RUNNING, STOPPING }

    private final ScheduledJobRepository jobs;
    private final JobExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerOptions options;
    private final JobRegistry registry = new JobRegistry();

    private volatile State state = State.STOPPED;
    private ScheduledExecutorService dispatcher;
    private ExecutorService executionPool;
    private ExecutorService handlerPool;
    private volatile JobExecutor executor;

    public JobScheduler(ScheduledJobRepository jobs,
                        JobExecutionRepository executions,
                        TxRunner tx,
                        Clock clock,
                        SchedulerOptions options) {
        this.jobs = jobs;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
        this.options = options == null ? SchedulerOptions.defaults() : options;
    }

    /**
     * 잡 행을 먼저 쓰고 그다음 메모리에 핸들러 바인딩. 저장 전 실패면 둘 다 그대로,
     * 같은 설정 재등록은 no-op.
     */
    public ScheduledJob registerJobWithSchedule(String handlerId, JobHandler handler, JobConfig config) throws Exception {
        if (handlerId == null || handlerId.isBlank()) {
            throw new IllegalArgumentException("handler id cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("job handler cannot be null");
        }
        if (config == null) {
            throw new InvalidJobConfigException("job config cannot be null");
        }
        config.validate();

        ScheduledJob job = tx.required(() -> jobs.upsertJobDefinition(
                config.name(), handlerId, config.intervalMinutes(), config.description(), clock.now()));

        registry.register(handlerId, handler);
        log.info("Registered scheduled job: {} (handler={}, every {} min)",
                config.name(), handlerId, config.intervalMinutes());
        return job;
    }

    public synchronized void start() {
        if (state != State.STOPPED) {
            log.warn("Scheduler start ignored, state is {}", state);
            return;
        }
        dispatcher = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("cadence-dispatch"));
        executionPool = Executors.newCachedThreadPool(new DaemonThreadFactory("cadence-exec"));
        handlerPool = Executors.newCachedThreadPool(new DaemonThreadFactory("cadence-handler"));
        executor = new JobExecutor(jobs, executions, registry, tx, clock, handlerPool, options.executionTimeout());
        state = State.RUNNING;

        // 첫 패스는 즉시: 재시작 전부터 밀린 잡이 한 틱을 기다리지 않도록
        dispatcher.scheduleAtFixedRate(this::tick, 0, options.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler started (poll={}, timeout={})", options.pollInterval(), options.executionTimeout());
    }

    /**
     * 신규 디스패치 중단 후 진행 중 실행을 종료 유예만큼 대기.
     * 실행 중 핸들러는 인터럽트하지 않음. 실행 중이 아니면 no-op.
     */
    public synchronized void stop() {
        if (state != State.RUNNING) {
            return;
        }
        log.info("Stopping scheduler...");
        state = State.STOPPING;
        long deadline = System.nanoTime() + options.shutdownGrace().toNanos();
        boolean drained = false;
        try {
            dispatcher.shutdown();
            dispatcher.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS);
            executionPool.shutdown();
            drained = executionPool.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            handlerPool.shutdown();
            state = State.STOPPED;
        }
        if (drained) {
            log.info("Scheduler stopped gracefully");
        } else {
            log.warn("Scheduler stopped with timeout ({}), some executions may still be running",
                    options.shutdownGrace());
        }
    }

    public State state() {
        return state;
    }

    public SchedulerOptions options() {
        return options;
    }

    public JobRegistry registry() {
        return registry;
    }

    /**
     * 디스패치 1회. PENDING 실행이 있거나 선점 시점에 더 이상 due 가 아닌 잡은 건너뜀.
     *
     * @return 시작시킨 실행 수
     */
    public int dispatchOnce() throws Exception {
        if (state != State.RUNNING) return 0;

        List<ScheduledJob> due = tx.requiresNew(() -> jobs.findDueJobs(clock.now()));
        int launched = 0;
        for (ScheduledJob job : due) {
            int pending;
            try {
                pending = tx.requiresNew(() -> executions.countPendingExecutions(job.id()));
            } catch (Exception e) {
                log.warn("Error checking pending executions for job {}", job.name(), e);
                continue;
            }
            if (pending > 0) {
                log.info("Skipping job {} - already running", job.name());
                continue;
            }
            JobExecutor current = executor;
            try {
                executionPool.execute(() -> current.execute(job));
                launched++;
            } catch (RejectedExecutionException e) {
                log.debug("Job {} not launched, scheduler is stopping", job.name());
                break;
            }
        }
        return launched;
    }

    private void tick() {
        try {
            dispatchOnce();
        } catch (Exception e) {
            // 이번 패스 포기, 다음 틱에서 재시도
            log.warn("Dispatch pass failed", e);
        } catch (Throwable t) {
            log.error("Unexpected error in dispatch pass", t);
        }
    }

    public void setJobEnabled(String name, boolean enabled) throws Exception {
        tx.required(() -> {
            ScheduledJob job = jobs.findByName(name)
                    .orElseThrow(() -> new IllegalArgumentException("unknown job: " + name));
            jobs.setEnabled(job.id(), enabled);
            return null;
        });
        log.info("Job {} {}", name, enabled ? "enabled" : "disabled");
    }

    /** 최신 순 */
    public List<JobExecution> executionHistory(String name, int limit) throws Exception {
        return tx.required(() -> {
            ScheduledJob job = jobs.findByName(name)
                    .orElseThrow(() -> new IllegalArgumentException("unknown job: " + name));
            return executions.findByJob(job.id(), limit);
        });
    }

    private static long remaining(long deadlineNanos) {
        return Math.max(0, deadlineNanos - System.nanoTime());
    }
}
