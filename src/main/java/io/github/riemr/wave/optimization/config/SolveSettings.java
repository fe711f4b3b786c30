package io.github.riemr.wave.optimization.config;

import io.github.riemr.wave.optimization.score.ObjectiveWeights;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 1 回の最適化ランの設定。既定値は application.properties から {@link WaveOptimizerConfig} が組み立てる。
 */
@Value
@Builder(toBuilder = true)
public class SolveSettings {
    /** 壁時計での上限。超過時は最良の暫定解を返す */
    @Builder.Default
    Duration spentLimit = Duration.ofSeconds(10);
    /** 改善フェーズの反復上限（0 = 無制限） */
    @Builder.Default
    long iterationLimit = 0;
    /** 未改善のまま続ける反復数（0 = 無制限） */
    @Builder.Default
    long unimprovedIterationLimit = 2_000;
    /** 1 ランあたりの受注数上限 */
    @Builder.Default
    int batchSizeLimit = 500;
    /** 決定点ごとに保持する候補数（バックトラック時の分岐数） */
    @Builder.Default
    int candidateLimit = 3;
    /** 計画ホライズン（分）。0 は無制限 */
    @Builder.Default
    long horizonMinutes = 0;
    @Builder.Default
    long randomSeed = 42L;
    @Builder.Default
    ObjectiveWeights weights = ObjectiveWeights.defaults();

    public static SolveSettings defaults() {
        return SolveSettings.builder().build();
    }

    public boolean hasHorizon() {
        return horizonMinutes > 0;
    }
}
