package net.cadence.core.model;

import java.time.Instant;

public record JobExecution(
        Long id,
        Long scheduledJobId,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        Status status,
        String errorMessage,
        Instant createdAt
) {
    public enum Status {
        PENDING, SUCCESS, FAILED, TIMEOUT, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }

        public String code() { return name(); }

        public boolean terminal() {
            return this == SUCCESS || this == FAILED || this == TIMEOUT;
        }
    }

    public static JobExecution pending(long scheduledJobId, Instant startedAt) {
        return new JobExecution(null, scheduledJobId, startedAt, null, null, Status.PENDING, null, startedAt);
    }

    public boolean pending() {
        return status == Status.PENDING;
    }
}
