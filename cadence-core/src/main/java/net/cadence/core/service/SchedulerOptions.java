package net.cadence.core.service;

import java.time.Duration;

/**
 * @param pollInterval     디스패치 패스 간격
 * @param executionTimeout TIMEOUT 기록 전까지 핸들러를 기다리는 시간
 * @param shutdownGrace    {@link JobScheduler#stop()} 이 진행 중 실행을 기다리는 시간
 */
public record SchedulerOptions(Duration pollInterval, Duration executionTimeout, Duration shutdownGrace) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    // 미설정/0 이하 → 기본값
    public SchedulerOptions {
        pollInterval = positiveOr(pollInterval, DEFAULT_POLL_INTERVAL);
        executionTimeout = positiveOr(executionTimeout, DEFAULT_EXECUTION_TIMEOUT);
        shutdownGrace = positiveOr(shutdownGrace, DEFAULT_SHUTDOWN_GRACE);
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(null, null, null);
    }

    public static SchedulerOptions ofPollInterval(Duration pollInterval) {
        return new SchedulerOptions(pollInterval, null, null);
    }

    public SchedulerOptions withExecutionTimeout(Duration executionTimeout) {
        return new SchedulerOptions(pollInterval, executionTimeout, shutdownGrace);
    }

    public SchedulerOptions withShutdownGrace(Duration shutdownGrace) {
        return new SchedulerOptions(pollInterval, executionTimeout, shutdownGrace);
    }

    /** 살아있는 실행이 PENDING 으로 남는 최대 시간 */
    public Duration staleExecutionThreshold() {
        return executionTimeout.plus(shutdownGrace);
    }

    private static Duration positiveOr(Duration d, Duration fallback) {
        return d == null || d.isZero() || d.isNegative() ? fallback : d;
    }
}
