package io.github.riemr.wave.application.dto;

import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.optimization.score.PlanComparison;
import io.github.riemr.wave.optimization.score.ScoreBreakdown;
import io.github.riemr.wave.optimization.search.TerminationReason;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import java.util.List;
import java.util.Optional;

/**
 * 最適化ランの結果。時間切れでも計画を持つ（status で区別する）。
 */
@Value
@Builder
public class OptimizationResult {

    public enum RunStatus {
        /** 全受注を割当済みで、探索が自ら終了した */
        FEASIBLE,
        /** 全受注を割当済みだが、時間切れまたはキャンセルで打ち切った */
        TIME_BOUNDED,
        /** 割当できなかった受注がある */
        INCOMPLETE
    }

    String waveId;
    Plan plan;
    ScoreBreakdown breakdown;
    HardSoftLongScore score;
    RunStatus status;
    TerminationReason terminationReason;
    double optimalityGap;
    long iterations;
    long decisions;
    long backtracks;
    long elapsedMillis;
    @Singular
    List<ScorePoint> scorePoints;
    ScoreBreakdown baselineBreakdown;
    PlanComparison comparison;
    /** 割当判断の説明（作業者の得手不得手・遅延・ボトルネック） */
    @Singular
    List<String> explanations;

    public boolean isExact() {
        return status == RunStatus.FEASIBLE;
    }

    public boolean isComplete() {
        return status != RunStatus.INCOMPLETE;
    }

    public Optional<PlanComparison> comparison() {
        return Optional.ofNullable(comparison);
    }
}
