package net.cadence.core.spi;

import net.cadence.core.model.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduledJobRepository {
    /** ENABLED 이고 (NEXT_RUN_AT IS NULL OR NEXT_RUN_AT <= now), 오래된 순 */
    List<ScheduledJob> findDueJobs(Instant now) throws Exception;

    Optional<ScheduledJob> findById(long id) throws Exception;
    Optional<ScheduledJob> findByName(String name) throws Exception;

    /**
     * 멱등 upsert: NAME 기준. 없으면 생성(enabled, NEXT_RUN_AT = now),
     * 있으면 handler/interval/description 중 달라진 컬럼만 갱신.
     */
    ScheduledJob upsertJobDefinition(String name,
                                     String handlerId,
                                     int intervalMinutes,
                                     String description,
                                     Instant now) throws Exception;

    void updateJobSchedule(long jobId, Instant lastRunAt, Instant nextRunAt) throws Exception;

    void setEnabled(long jobId, boolean enabled) throws Exception;
}
