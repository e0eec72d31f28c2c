package net.cadence.core.model;

import java.time.Duration;
import java.time.Instant;

public record ScheduledJob(
        Long id,
        String name,
        String description,
        String jobHandler,      // JobRegistry 키
        boolean enabled,
        int intervalMinutes,
        Instant lastRunAt,
        Instant nextRunAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static ScheduledJob ofNew(String name, String description, String jobHandler,
                                     int intervalMinutes, Instant now) {
        return new ScheduledJob(null, name, description, jobHandler, true, intervalMinutes,
                null, now, now, now);
    }

    /** enabled 이고 nextRunAt 이 null 이거나 now 이전(같음 포함) */
    public boolean isDue(Instant now) {
        return enabled && (nextRunAt == null || !nextRunAt.isAfter(now));
    }

    public Duration interval() {
        return Duration.ofMinutes(intervalMinutes);
    }

    public Instant nextRunAfter(Instant lastRun) {
        return lastRun.plus(interval());
    }
}
