package net.cadence.integration.spring.sched;

import net.cadence.core.service.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * 컨텍스트 refresh 후 {@link JobScheduler} 시작, 컨텍스트 종료 시 진행 중 실행을 기다리며 정지.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private boolean autoStartup = true;

    public SchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.state() == JobScheduler.State.RUNNING;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }
}
