package io.github.riemr.wave.optimization.score;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;

import java.util.EnumMap;
import java.util.Map;

/**
 * 最適性ギャップ算出用の目的関数下界。
 * makespan はクリティカルパスとステージ別の資源負荷の大きい方、遅延はクリティカルパス基準、
 * コストは各タスクの最安組合せ、アイドルは 0 とする。
 */
public final class LowerBound {

    private LowerBound() {
    }

    public static double of(WaveProblem problem, ObjectiveWeights weights) {
        long makespan = 0;
        long tardiness = 0;
        for (int i = 0; i < problem.getOrderCount(); i++) {
            long path = problem.criticalPath(i);
            makespan = Math.max(makespan, path);
            tardiness += Math.max(0, path - problem.tasksOf(i).get(0).getDeadlineMinute());
        }

        Map<StageType, Long> stageLoad = new EnumMap<>(StageType.class);
        double cost = 0;
        for (StageTask task : problem.getTasks()) {
            stageLoad.merge(task.getStage(), task.minDuration(), Long::sum);
            double cheapest = Double.MAX_VALUE;
            for (Worker w : task.getEligibleWorkers()) {
                double rate = w.getHourlyRate() + task.getEligibleEquipment().stream()
                        .mapToDouble(Equipment::getHourlyCost).min().orElse(0);
                cheapest = Math.min(cheapest, task.durationFor(w) / 60.0 * rate);
            }
            cost += cheapest == Double.MAX_VALUE ? 0 : cheapest;
        }
        for (Map.Entry<StageType, Long> e : stageLoad.entrySet()) {
            StageTask sample = problem.task(0, e.getKey());
            int servers = sample.getEligibleWorkers().size();
            if (sample.requiresEquipment()) {
                servers = Math.min(servers, sample.getEligibleEquipment().size());
            }
            if (servers > 0) {
                makespan = Math.max(makespan, (e.getValue() + servers - 1) / servers);
            }
        }
        return weights.weigh(makespan, tardiness, cost, 0);
    }

    /** (incumbent - 下界) / incumbent を [0, 1] に丸めた値 */
    public static double gap(double incumbentObjective, double lowerBound) {
        if (incumbentObjective <= 0) {
            return 0;
        }
        double gap = (incumbentObjective - lowerBound) / incumbentObjective;
        return Math.max(0, Math.min(1, gap));
    }
}
