package net.cadence.integration.spring.sched;

import net.cadence.core.maintenance.ExecutionMaintenanceService;
import net.cadence.core.maintenance.ExecutionMaintenanceService.MaintenanceReport;
import net.cadence.core.service.SchedulerOptions;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class MaintenanceScheduler {
    private final ExecutionMaintenanceService maintenance;

    // 기본값: 실행 타임아웃 + 종료 유예
    private Duration staleAfter = SchedulerOptions.defaults().staleExecutionThreshold();
    private Duration retention = Duration.ofDays(30);

    public MaintenanceScheduler(ExecutionMaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${cadence.maintenance.delay-ms:600000}")
    public void maintenance() throws Exception {
        runOnce();
    }

    public MaintenanceReport runOnce() throws Exception {
        return maintenance.runOnce(staleAfter, retention);
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }
}
