package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.adapter.jdbc.mapper.RowMappers;
import net.cadence.core.model.ScheduledJob;
import net.cadence.core.spi.ScheduledJobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class JdbcScheduledJobRepository implements ScheduledJobRepository {

    @Override
    public List<ScheduledJob> findDueJobs(Instant now) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                  FROM TB_SCHEDULED_JOB
                 WHERE ENABLED = 'Y'
                   AND (NEXT_RUN_AT IS NULL OR NEXT_RUN_AT <= ?)
                 ORDER BY NEXT_RUN_AT ASC NULLS FIRST, ID ASC
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            try (ResultSet rs = ps.executeQuery()) {
                List<ScheduledJob> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toScheduledJob(rs));
                return out;
            }
        }
    }

    @Override
    public Optional<ScheduledJob> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_SCHEDULED_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toScheduledJob(rs));
            }
        }
    }

    @Override
    public Optional<ScheduledJob> findByName(String name) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_SCHEDULED_JOB WHERE NAME = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toScheduledJob(rs));
            }
        }
    }

    @Override
    public ScheduledJob upsertJobDefinition(String name, String handlerId, int intervalMinutes,
                                            String description, Instant now) throws Exception {
        Optional<ScheduledJob> existing = findByName(name);
        if (existing.isEmpty()) {
            long id = insert(name, handlerId, intervalMinutes, description, now);
            return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load job: " + name));
        }

        // 바뀐 컬럼만 갱신. 동일 재등록이면 아무것도 쓰지 않음
        ScheduledJob job = existing.get();
        List<String> sets = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        if (!Objects.equals(job.jobHandler(), handlerId)) {
            sets.add("JOB_HANDLER = ?");
            args.add(handlerId);
        }
        if (job.intervalMinutes() != intervalMinutes) {
            sets.add("INTERVAL_MINUTES = ?");
            args.add(intervalMinutes);
        }
        if (!Objects.equals(job.description(), description)) {
            sets.add("DESCRIPTION = ?");
            args.add(description);
        }
        if (sets.isEmpty()) return job;

        sets.add("UPDATED_AT = ?");
        args.add(JdbcUtil.ts(now));
        String sql = "UPDATE TB_SCHEDULED_JOB SET " + String.join(", ", sets) + " WHERE ID = ?";
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
            int i = 1;
            for (Object arg : args) ps.setObject(i++, arg);
            ps.setLong(i, job.id());
            ps.executeUpdate();
        }
        return findById(job.id()).orElseThrow(() -> new IllegalStateException("update failed to load job: " + name));
    }

    private long insert(String name, String handlerId, int intervalMinutes, String description, Instant now)
            throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_SCHEDULED_JOB
                       (NAME, DESCRIPTION, JOB_HANDLER, ENABLED, INTERVAL_MINUTES, NEXT_RUN_AT, CREATED_AT, UPDATED_AT)
                VALUES (?,    ?,           ?,           'Y',     ?,                ?,           ?,          ?)
            """, new String[]{"ID"})) {
            ps.setString(1, name);
            ps.setString(2, description);
            ps.setString(3, handlerId);
            ps.setInt(4, intervalMinutes);
            ps.setTimestamp(5, JdbcUtil.ts(now));   // 신규 잡은 즉시 due
            ps.setTimestamp(6, JdbcUtil.ts(now));
            ps.setTimestamp(7, JdbcUtil.ts(now));
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new IllegalStateException("no generated key for job: " + name);
                return k.getLong(1);
            }
        }
    }

    @Override
    public void updateJobSchedule(long jobId, Instant lastRunAt, Instant nextRunAt) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULED_JOB
                   SET LAST_RUN_AT = ?,
                       NEXT_RUN_AT = ?,
                       UPDATED_AT  = CURRENT_TIMESTAMP
                 WHERE ID = ?
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(lastRunAt));
            ps.setTimestamp(2, JdbcUtil.ts(nextRunAt));
            ps.setLong(3, jobId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_SCHEDULED_JOB not found for ID=" + jobId);
            }
        }
    }

    @Override
    public void setEnabled(long jobId, boolean enabled) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULED_JOB
                   SET ENABLED    = ?,
                       UPDATED_AT = CURRENT_TIMESTAMP
                 WHERE ID = ?
            """)) {
            ps.setString(1, JdbcUtil.yn(enabled));
            ps.setLong(2, jobId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_SCHEDULED_JOB not found for ID=" + jobId);
            }
        }
    }
}
