package io.github.riemr.wave.optimization.score;

import lombok.Builder;
import lombok.Value;

/**
 * 目的関数の重み。既定値はコストより期限遵守を優先する。
 * 未割当タスクの罰則は、完全な計画の目的関数値が部分計画を上回らない大きさにしておく。
 */
@Value
@Builder(toBuilder = true)
public class ObjectiveWeights {
    @Builder.Default
    double makespan = 1.0;
    @Builder.Default
    double tardiness = 10.0;
    @Builder.Default
    double cost = 0.1;
    @Builder.Default
    double idle = 0.05;
    /** 未割当タスク 1 件あたりの罰則 */
    @Builder.Default
    double unassigned = 100_000.0;

    public static ObjectiveWeights defaults() {
        return ObjectiveWeights.builder().build();
    }

    public double weigh(double makespanMinutes, double tardinessMinutes, double costAmount, double idleMinutes) {
        return makespan * makespanMinutes
                + tardiness * tardinessMinutes
                + cost * costAmount
                + idle * idleMinutes;
    }

    public double penalize(int unassignedTasks) {
        return unassigned * unassignedTasks;
    }
}
