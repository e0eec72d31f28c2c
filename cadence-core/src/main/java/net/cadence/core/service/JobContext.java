package net.cadence.core.service;

import java.time.Instant;

public final class JobContext {
    private final String jobName;
    private final long executionId;
    private final Instant startedAt;
    private final Instant deadline;
    private volatile boolean cancelled;

    public JobContext(String jobName, long executionId, Instant startedAt, Instant deadline) {
        this.jobName = jobName;
        this.executionId = executionId;
        this.startedAt = startedAt;
        this.deadline = deadline;
    }

    public String jobName() { return jobName; }
    public long executionId() { return executionId; }
    public Instant startedAt() { return startedAt; }
    public Instant deadline() { return deadline; }

    /** 실행이 TIMEOUT 으로 기록되면 true */
    public boolean isCancelled() { return cancelled; }

    void cancel() { cancelled = true; }
}
