package net.cadence.core.model;

/**
 * 주기 잡 등록 정보.
 *
 * @param name            유일한 잡 이름(스케줄의 영속 식별자)
 * @param description     설명
 * @param intervalMinutes 실행 간격(분), 양수
 */
public record JobConfig(String name, String description, int intervalMinutes) {

    public static JobConfig of(String name, String description, int intervalMinutes) {
        return new JobConfig(name, description, intervalMinutes);
    }

    /** 순수 검증. 저장소/레지스트리는 건드리지 않음 */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidJobConfigException("job name cannot be empty");
        }
        if (intervalMinutes <= 0) {
            throw new InvalidJobConfigException("interval minutes must be positive, got " + intervalMinutes);
        }
    }
}
