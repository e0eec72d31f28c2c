package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.JobExecution;
import net.cadence.core.spi.JobExecutionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcJobExecutionRepository implements JobExecutionRepository {

    @Override
    public int countPendingExecutions(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT COUNT(*)
                  FROM TB_JOB_EXECUTION
                 WHERE SCHEDULED_JOB_ID = ?
                   AND STATUS = 'PENDING'
            """)) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Override
    public JobExecution insertExecution(long jobId, Instant startedAt) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_JOB_EXECUTION (SCHEDULED_JOB_ID, STARTED_AT, STATUS, CREATED_AT)
                VALUES (?, ?, 'PENDING', ?)
            """, new String[]{"ID"})) {
            ps.setLong(1, jobId);
            ps.setTimestamp(2, JdbcUtil.ts(startedAt));
            ps.setTimestamp(3, JdbcUtil.ts(startedAt));
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("no generated key for execution of job " + jobId);
                JobExecution p = JobExecution.pending(jobId, startedAt);
                return new JobExecution(k.getLong(1), p.scheduledJobId(), p.startedAt(), null, null,
                        p.status(), null, p.createdAt());
            }
        }
    }

    /**
     * 잡 행 FOR UPDATE 락이 커밋까지 같은 잡의 선점을 직렬화함.
     * 락 안에서 ENABLED/NEXT_RUN_AT 를 다시 읽으므로 오래된 스냅샷으로는 선점 불가.
     */
    @Override
    public Optional<JobExecution> claimExecution(long jobId, Instant startedAt) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT ENABLED, NEXT_RUN_AT
                  FROM TB_SCHEDULED_JOB
                 WHERE ID = ?
                   FOR UPDATE
            """)) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) throw new IllegalStateException("TB_SCHEDULED_JOB not found for ID=" + jobId);
                if (!JdbcUtil.isY(rs.getString("ENABLED"))) return Optional.empty();
                Instant nextRunAt = JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN_AT"));
                if (nextRunAt != null && nextRunAt.isAfter(startedAt)) return Optional.empty();
            }
        }
        if (countPendingExecutions(jobId) > 0) return Optional.empty();
        return Optional.of(insertExecution(jobId, startedAt));
    }

    @Override
    public boolean completeExecution(long executionId, JobExecution.Status status, Instant completedAt,
                                     long durationMs, String errorMessage) throws Exception {
        if (!status.terminal()) throw new IllegalArgumentException("not a terminal status: " + status);
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB_EXECUTION
                   SET STATUS        = ?,
                       COMPLETED_AT  = ?,
                       DURATION_MS   = ?,
                       ERROR_MESSAGE = ?
                 WHERE ID = ?
                   AND STATUS = 'PENDING'
            """)) {
            ps.setString(1, status.code());
            ps.setTimestamp(2, JdbcUtil.ts(completedAt));
            ps.setLong(3, durationMs);
            ps.setString(4, JdbcUtil.clip(errorMessage));
            ps.setLong(5, executionId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public Optional<JobExecution> findExecution(long executionId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_JOB_EXECUTION WHERE ID = ?")) {
            ps.setLong(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJobExecution(rs));
            }
        }
    }

    @Override
    public List<JobExecution> findByJob(long jobId, int limit) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_JOB_EXECUTION
                 WHERE SCHEDULED_JOB_ID = ?
                 ORDER BY STARTED_AT DESC, ID DESC
            """)) {
            ps.setLong(1, jobId);
            ps.setMaxRows(Math.max(limit, 0));
            try (ResultSet rs = ps.executeQuery()) {
                List<JobExecution> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toJobExecution(rs));
                return out;
            }
        }
    }

    @Override
    public int recoverStalePending(Instant startedBefore, Instant completedAt, String message) throws Exception {
        List<long[]> stale = new ArrayList<>();
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT ID, STARTED_AT
                  FROM TB_JOB_EXECUTION
                 WHERE STATUS = 'PENDING'
                   AND STARTED_AT < ?
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(startedBefore));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Instant started = rs.getTimestamp("STARTED_AT").toInstant();
                    stale.add(new long[]{rs.getLong("ID"), Duration.between(started, completedAt).toMillis()});
                }
            }
        }
        int recovered = 0;
        for (long[] row : stale) {
            if (completeExecution(row[0], JobExecution.Status.TIMEOUT, completedAt, row[1], message)) recovered++;
        }
        return recovered;
    }

    @Override
    public int purgeFinishedBefore(Instant threshold) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                DELETE FROM TB_JOB_EXECUTION
                 WHERE STATUS IN ('SUCCESS', 'FAILED', 'TIMEOUT')
                   AND COMPLETED_AT IS NOT NULL
                   AND COMPLETED_AT < ?
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }
}
