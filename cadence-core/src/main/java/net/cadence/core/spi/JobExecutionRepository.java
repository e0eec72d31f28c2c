package net.cadence.core.spi;

import net.cadence.core.model.JobExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobExecutionRepository {
    int countPendingExecutions(long jobId) throws Exception;

    /** PENDING 행 단순 insert */
    JobExecution insertExecution(long jobId, Instant startedAt) throws Exception;

    /**
     * 잡 행을 잠근 뒤 재확인하고 PENDING 행을 insert.
     * 잡이 비활성, NEXT_RUN_AT > startedAt(아직 due 아님), 또는 PENDING 실행이 이미 있으면 empty.
     */
    Optional<JobExecution> claimExecution(long jobId, Instant startedAt) throws Exception;

    /** PENDING → 종료 상태. 이미 PENDING 이 아니면 false */
    boolean completeExecution(long executionId,
                              JobExecution.Status status,
                              Instant completedAt,
                              long durationMs,
                              String errorMessage) throws Exception;

    Optional<JobExecution> findExecution(long executionId) throws Exception;

    /** 최신 순 */
    List<JobExecution> findByJob(long jobId, int limit) throws Exception;

    // Maintenance용
    /** threshold 이전에 시작된 PENDING 을 TIMEOUT(+message)으로 종료 */
    int recoverStalePending(Instant startedBefore, Instant completedAt, String message) throws Exception;

    /** threshold 이전에 완료된 종료 행 삭제 */
    int purgeFinishedBefore(Instant threshold) throws Exception;
}
