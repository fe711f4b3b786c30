package io.github.riemr.wave.optimization.search;

import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.optimization.score.ScoreBreakdown;
import io.github.riemr.wave.optimization.solution.Assignment;
import lombok.Builder;
import lombok.Value;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

@Value
@Builder
public class SearchResult {
    Assignment assignment;
    Plan plan;
    ScoreBreakdown breakdown;
    HardSoftLongScore score;
    SearchState state;
    TerminationReason reason;
    /** 評価した近傍の数（初期構築は含まない） */
    long iterations;
    long decisions;
    long backtracks;
    long elapsedMillis;
    /** 下界との相対差 [0, 1]。不完全な割当では 1 */
    double optimalityGap;

    public boolean isComplete() {
        return state == SearchState.COMPLETE_FEASIBLE;
    }
}
