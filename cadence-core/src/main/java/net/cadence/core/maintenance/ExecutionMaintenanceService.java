package net.cadence.core.maintenance;

import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobExecutionRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

public final class ExecutionMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(ExecutionMaintenanceService.class);

    public static final String ABANDONED_MESSAGE = "abandoned: scheduler stopped before completion";

    private final JobExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;

    public ExecutionMaintenanceService(JobExecutionRepository executions, TxRunner tx, Clock clock) {
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 실행 테이블 주기 점검.
     * - staleAfter 보다 오래된 PENDING 은 실행 중 죽은 프로세스의 잔재 → TIMEOUT 으로 종료
     *   (남아 있으면 해당 잡이 디스패치에서 계속 제외됨)
     * - now - retention 이전에 완료된 종료 행 삭제
     * null/0/음수 기간이면 해당 단계 생략.
     */
    public MaintenanceReport runOnce(Duration staleAfter, Duration retention) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        if (positive(staleAfter)) {
            Instant threshold = now.minus(staleAfter);
            r.recoveredPending = tx.required(() ->
                    executions.recoverStalePending(threshold, now, ABANDONED_MESSAGE));
        }

        if (positive(retention)) {
            Instant threshold = now.minus(retention);
            r.purgedFinished = tx.required(() -> executions.purgeFinishedBefore(threshold));
        }

        r.timestamp = now;
        if (r.recoveredPending > 0) {
            log.warn("Recovered {} abandoned pending executions", r.recoveredPending);
        }
        log.debug("Maintenance done: {}", r);
        return r;
    }

    private static boolean positive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int recoveredPending;
        public int purgedFinished;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", recoveredPending=" + recoveredPending +
                    ", purgedFinished=" + purgedFinished +
                    '}';
        }
    }
}
