package io.github.riemr.wave.optimization.score;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * 計画（最適化結果・ベースラインのどちらでも）の目的関数を評価する。
 * <pre>
 *   objective = w1 * makespan + w2 * Σ遅延 + w3 * Σコスト + w4 * Σ資源アイドル + w5 * 未割当タスク数
 * </pre>
 * 未割当の罰則により、時間切れで途中までしか組めなかった計画が完全な計画より良く見えることはない。
 * コストは作業者時給と設備時間単価から算出する。プールにない ID は既定単価で扱う。
 */
@Component
public class PlanScorer {

    /** soft スコアは目的関数値をこの倍率で整数化する */
    public static final long SOFT_SCALE = 1_000L;

    public ScoreBreakdown score(Plan plan, ResourcePool pool, ObjectiveWeights weights) {
        Map<String, Double> workerRates = new HashMap<>();
        for (Worker w : pool.getWorkers()) {
            workerRates.put(w.getWorkerId(), w.getHourlyRate());
        }
        Map<String, Double> equipmentRates = new HashMap<>();
        for (Equipment e : pool.getEquipment()) {
            equipmentRates.put(e.getEquipmentId(), e.getHourlyCost());
        }

        double cost = 0;
        Map<StageType, Long> durations = new EnumMap<>(StageType.class);
        Map<StageType, Long> waiting = new EnumMap<>(StageType.class);
        Map<StageType, Integer> counts = new EnumMap<>(StageType.class);
        for (StageType stage : StageType.values()) {
            durations.put(stage, 0L);
            waiting.put(stage, 0L);
            counts.put(stage, 0);
        }

        List<StageAssignment> all = plan.assignments().toList();
        for (StageAssignment a : all) {
            double hours = a.getDurationMinutes() / 60.0;
            cost += hours * workerRates.getOrDefault(a.getWorkerId(), Worker.DEFAULT_HOURLY_RATE);
            if (a.hasEquipment()) {
                cost += hours * equipmentRates.getOrDefault(a.getEquipmentId(), 0.0);
            }
            durations.merge(a.getStage(), a.getDurationMinutes(), Long::sum);
            waiting.merge(a.getStage(), a.getWaitingMinutes(), Long::sum);
            counts.merge(a.getStage(), 1, Integer::sum);
        }

        Map<StageType, Double> meanWaiting = new EnumMap<>(StageType.class);
        StageType bottleneck = null;
        double worst = 0;
        for (StageType stage : StageType.values()) {
            int n = counts.get(stage);
            double mean = n == 0 ? 0 : (double) waiting.get(stage) / n;
            meanWaiting.put(stage, mean);
            // 同値なら上流のステージを優先
            if (mean > worst) {
                worst = mean;
                bottleneck = stage;
            }
        }

        long makespan = plan.getMakespan();
        List<ResourceUsage> workerUsage = usage(all, StageAssignment::getWorkerId, workerRates.keySet(),
                ResourceUsage.Kind.WORKER, makespan);
        List<ResourceUsage> equipmentUsage = usage(all, StageAssignment::getEquipmentId, equipmentRates.keySet(),
                ResourceUsage.Kind.EQUIPMENT, makespan);
        long idle = Stream.concat(workerUsage.stream(), equipmentUsage.stream())
                .mapToLong(ResourceUsage::getIdleMinutes)
                .sum();
        long tardiness = plan.getOrders().stream().mapToLong(OrderPlan::getTardiness).sum();
        int unassigned = plan.getOrders().stream().mapToInt(o -> StageType.COUNT - o.getStages().size()).sum();

        return ScoreBreakdown.builder()
                .makespan(makespan)
                .totalTardiness(tardiness)
                .cost(cost)
                .idleResourceTime(idle)
                .unassignedTaskCount(unassigned)
                .objective(weights.weigh(makespan, tardiness, cost, idle) + weights.penalize(unassigned))
                .orderCount(plan.getOrders().size())
                .tardyOrderCount((int) plan.getOrders().stream().filter(OrderPlan::isTardy).count())
                .totalProcessingTime(plan.getOrders().stream().mapToLong(OrderPlan::getTotalProcessingTime).sum())
                .totalWaitingTime(plan.getOrders().stream().mapToLong(OrderPlan::getTotalWaitingTime).sum())
                .totalTime(plan.getOrders().stream().mapToLong(OrderPlan::getTotalTime).sum())
                .stageDurations(Collections.unmodifiableMap(durations))
                .stageWaitingTimes(Collections.unmodifiableMap(waiting))
                .stageMeanWaitingTimes(Collections.unmodifiableMap(meanWaiting))
                .bottleneckStage(bottleneck)
                .workerUsage(workerUsage)
                .equipmentUsage(equipmentUsage)
                .build();
    }

    /**
     * hard = -(未割当タスク数), soft = -(目的関数値 * {@value #SOFT_SCALE})。大きいほど良い。
     */
    public HardSoftLongScore toScore(ScoreBreakdown breakdown, int unassignedTasks) {
        return HardSoftLongScore.of(-unassignedTasks, -Math.round(breakdown.getObjective() * SOFT_SCALE));
    }

    /**
     * 資源ごとのスケジュールと稼働状況。プールにあって割当のない資源も 0% として含め、ID 順に並べる。
     * idle は最初の開始から最後の終了までの空きで、重なりのある計画（ベースライン等）でも和集合で数える。
     */
    private List<ResourceUsage> usage(List<StageAssignment> assignments, Function<StageAssignment, String> resourceOf,
                                      Set<String> poolIds, ResourceUsage.Kind kind, long makespan) {
        Map<String, List<StageAssignment>> byResource = new TreeMap<>();
        poolIds.forEach(id -> byResource.put(id, new ArrayList<>()));
        for (StageAssignment a : assignments) {
            String id = resourceOf.apply(a);
            if (id != null) {
                byResource.computeIfAbsent(id, k -> new ArrayList<>()).add(a);
            }
        }
        List<ResourceUsage> usage = new ArrayList<>(byResource.size());
        byResource.forEach((id, list) -> usage.add(ResourceUsage.of(id, kind, list, makespan)));
        return Collections.unmodifiableList(usage);
    }
}
