package net.cadence.core.service;

/**
 * 스케줄러가 실행하는 작업 단위. 정상 반환 시 SUCCESS, 예외 시 예외 메시지와 함께 FAILED.
 *
 * <p>타임아웃을 넘긴 핸들러는 인터럽트하지 않음. 실행은 TIMEOUT 으로 기록되고
 * {@link JobContext#isCancelled()} 가 true 가 됨. 오래 걸리는 핸들러는 이를 확인하고 조기 반환할 것.
 */
@FunctionalInterface
public interface JobHandler {
    void run(JobContext ctx) throws Exception;

    static JobHandler of(Runnable body) {
        return ctx -> body.run();
    }
}
