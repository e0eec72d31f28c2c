package net.cadence.adapter.jdbc.mapper;

import net.cadence.adapter.jdbc.JdbcUtil;
import net.cadence.core.model.JobExecution;
import net.cadence.core.model.ScheduledJob;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- ScheduledJob ---
    public static ScheduledJob toScheduledJob(ResultSet rs) throws SQLException {
        return new ScheduledJob(
                rs.getLong("ID"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                rs.getString("JOB_HANDLER"),
                JdbcUtil.isY(rs.getString("ENABLED")),
                rs.getInt("INTERVAL_MINUTES"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN_AT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- JobExecution ---
    public static JobExecution toJobExecution(ResultSet rs) throws SQLException {
        Long durationMs = rs.getLong("DURATION_MS");
        if (rs.wasNull()) durationMs = null;
        return new JobExecution(
                rs.getLong("ID"),
                rs.getLong("SCHEDULED_JOB_ID"),
                rs.getTimestamp("STARTED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                durationMs,
                JobExecution.Status.from(rs.getString("STATUS")),
                rs.getString("ERROR_MESSAGE"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }
}
