package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class Worker {
    public static final double DEFAULT_HOURLY_RATE = 25.0;

    String workerId;
    String name;
    @Singular
    Set<StageType> capabilities;
    @Builder.Default
    double hourlyRate = DEFAULT_HOURLY_RATE;
    /** 1.0 = 標準。1.25 なら所要時間が 20% 短くなる */
    @Builder.Default
    double efficiencyFactor = 1.0;

    public boolean canPerform(StageType stage) {
        return capabilities.contains(stage);
    }
}
