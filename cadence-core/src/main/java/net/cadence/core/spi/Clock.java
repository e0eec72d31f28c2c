package net.cadence.core.spi;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@FunctionalInterface
public interface Clock {
    Instant now();

    /** 밀리초 단위로 자른 현재 시각(duration 기록 정밀도) */
    static Clock system() {
        return () -> Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
