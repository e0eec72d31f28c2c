package net.cadence.adapter.jdbc.repo;

import net.cadence.adapter.jdbc.TestSupport;
import net.cadence.adapter.jdbc.TxContext;
import net.cadence.core.model.ScheduledJob;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcScheduledJobRepositoryTest extends TestSupport {

    JdbcScheduledJobRepository jobs;
    Instant now;

    @BeforeAll
    void initAll() {
        jobs = new JdbcScheduledJobRepository();
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @Test
    void upsert_createsEnabledJob_dueImmediately() throws Exception {
        ScheduledJob job = tx.required(() -> jobs.upsertJobDefinition("cleanup", "h1", 15, "purge temp files", now));

        assertThat(job.id()).isNotNull();
        assertThat(job.name()).isEqualTo("cleanup");
        assertThat(job.jobHandler()).isEqualTo("h1");
        assertThat(job.description()).isEqualTo("purge temp files");
        assertThat(job.intervalMinutes()).isEqualTo(15);
        assertTrue(job.enabled());
        assertThat(job.lastRunAt()).isNull();
        assertThat(job.nextRunAt()).isEqualTo(now);
        assertThat(job.createdAt()).isEqualTo(now);
    }

    @Test
    void upsert_sameDefinition_changesNothing() throws Exception {
        ScheduledJob first = tx.required(() -> jobs.upsertJobDefinition("cleanup", "h1", 15, null, now));
        ScheduledJob again = tx.required(() -> jobs.upsertJobDefinition("cleanup", "h1", 15, null,
                now.plus(Duration.ofMinutes(3))));

        assertEquals(first, again);
    }

    @Test
    void upsert_changedDefinition_updatesInPlace_keepsSchedule() throws Exception {
        ScheduledJob first = tx.required(() -> jobs.upsertJobDefinition("cleanup", "h1", 15, null, now));
        Instant later = now.plus(Duration.ofMinutes(3));
        Instant nextRun = now.plus(Duration.ofMinutes(30));
        tx.required(() -> {
            jobs.updateJobSchedule(first.id(), now, nextRun);
            return null;
        });

        ScheduledJob updated = tx.required(() -> jobs.upsertJobDefinition("cleanup", "h2", 5, "rebound", later));

        assertThat(updated.id()).isEqualTo(first.id());
        assertThat(updated.jobHandler()).isEqualTo("h2");
        assertThat(updated.intervalMinutes()).isEqualTo(5);
        assertThat(updated.description()).isEqualTo("rebound");
        assertThat(updated.nextRunAt()).isEqualTo(nextRun);
        assertThat(updated.updatedAt()).isEqualTo(later);
        assertThat(countJobs()).isEqualTo(1);
    }

    @Test
    void findDueJobs_filtersDisabledAndFuture_ordersByNextRun() throws Exception {
        long a = tx.required(() -> jobs.upsertJobDefinition("a", "h", 1, null, now)).id();
        long b = tx.required(() -> jobs.upsertJobDefinition("b", "h", 1, null, now)).id();
        long c = tx.required(() -> jobs.upsertJobDefinition("c", "h", 1, null, now)).id();
        long d = tx.required(() -> jobs.upsertJobDefinition("d", "h", 1, null, now)).id();
        tx.required(() -> {
            jobs.updateJobSchedule(a, now, now.minusSeconds(10));
            jobs.updateJobSchedule(b, now, now.minusSeconds(60));
            jobs.updateJobSchedule(c, now, now.plusSeconds(60));
            jobs.setEnabled(d, false);
            return null;
        });

        List<ScheduledJob> due = tx.required(() -> jobs.findDueJobs(now));

        assertThat(due).extracting(ScheduledJob::name).containsExactly("b", "a");
    }

    @Test
    void findDueJobs_includesNextRunAtEqualToNow() throws Exception {
        tx.required(() -> jobs.upsertJobDefinition("edge", "h", 1, null, now));

        assertThat(tx.required(() -> jobs.findDueJobs(now))).hasSize(1);
        assertThat(tx.required(() -> jobs.findDueJobs(now.minusMillis(1)))).isEmpty();
    }

    @Test
    void setEnabled_roundTrips() throws Exception {
        long id = tx.required(() -> jobs.upsertJobDefinition("toggle", "h", 1, null, now)).id();

        tx.required(() -> {
            jobs.setEnabled(id, false);
            return null;
        });
        assertThat(tx.required(() -> jobs.findById(id)).orElseThrow().enabled()).isFalse();

        tx.required(() -> {
            jobs.setEnabled(id, true);
            return null;
        });
        assertThat(tx.required(() -> jobs.findById(id)).orElseThrow().enabled()).isTrue();
    }

    @Test
    void findByName_isExact() throws Exception {
        tx.required(() -> jobs.upsertJobDefinition("Cleanup", "h", 1, null, now));

        assertThat(tx.required(() -> jobs.findByName("Cleanup"))).isPresent();
        assertThat(tx.required(() -> jobs.findByName("cleanup"))).isEmpty();
    }

    @Test
    void updateJobSchedule_unknownJob_fails() {
        assertThatThrownBy(() -> tx.required(() -> {
            jobs.updateJobSchedule(424242L, now, now);
            return null;
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("424242");
    }

    private int countJobs() throws Exception {
        return tx.required(() -> {
            try (var rs = TxContext.require().createStatement()
                    .executeQuery("SELECT COUNT(*) FROM TB_SCHEDULED_JOB")) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }
}
