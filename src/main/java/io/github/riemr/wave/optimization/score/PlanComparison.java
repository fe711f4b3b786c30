package io.github.riemr.wave.optimization.score;

import lombok.Value;

/**
 * 最適化計画とベースライン計画の数値比較。改善率は正が改善（ベースラインより小さい）。
 * 2 つの計画の間にアルゴリズム上の依存はない。
 */
@Value
public class PlanComparison {
    ScoreBreakdown optimized;
    ScoreBreakdown baseline;

    double totalTimeImprovementPercent;
    double makespanImprovementPercent;
    double tardinessImprovementPercent;
    double costImprovementPercent;
    double waitingTimeImprovementPercent;
    double objectiveImprovementPercent;
    /** ベースラインより遅延受注が何件減ったか */
    int tardyOrdersAvoided;

    public static PlanComparison compare(ScoreBreakdown optimized, ScoreBreakdown baseline) {
        return new PlanComparison(
                optimized,
                baseline,
                improvement(baseline.getTotalTime(), optimized.getTotalTime()),
                improvement(baseline.getMakespan(), optimized.getMakespan()),
                improvement(baseline.getTotalTardiness(), optimized.getTotalTardiness()),
                improvement(baseline.getCost(), optimized.getCost()),
                improvement(baseline.getTotalWaitingTime(), optimized.getTotalWaitingTime()),
                improvement(baseline.getObjective(), optimized.getObjective()),
                baseline.getTardyOrderCount() - optimized.getTardyOrderCount());
    }

    static double improvement(double baselineValue, double optimizedValue) {
        if (baselineValue == 0) {
            return 0;
        }
        return (baselineValue - optimizedValue) / baselineValue * 100.0;
    }

    public boolean isImprovement() {
        return totalTimeImprovementPercent > 0;
    }
}
