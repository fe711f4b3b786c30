package io.github.riemr.wave.optimization.search;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.constraint.ConstraintEngine;
import io.github.riemr.wave.optimization.constraint.ResourceTimeline;
import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import io.github.riemr.wave.optimization.score.ObjectiveWeights;
import io.github.riemr.wave.optimization.solution.Binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * タスク 1 件の候補（作業者 × 設備 × 最早開始）を、目的関数の増分見積りで順位付けする。
 * 同値は 開始時刻 → 作業者 ID → 設備 ID の順で決める。
 */
class CandidateRanker {

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingDouble(Candidate::marginal)
            .thenComparingLong(c -> c.binding().getStart())
            .thenComparing(c -> c.binding().getWorkerId())
            .thenComparing(c -> c.binding().getEquipmentId(), Comparator.nullsFirst(Comparator.naturalOrder()));

    private final WaveProblem problem;
    private final ObjectiveWeights weights;

    CandidateRanker(WaveProblem problem, ObjectiveWeights weights) {
        this.problem = problem;
        this.weights = weights;
    }

    /**
     * 制約エンジンの可否判定を通過した候補を、増分の小さい順に最大 limit 件返す。
     *
     * @param projectedMakespan 現在の部分割当から見積もった makespan
     */
    List<Binding> rank(ConstraintEngine engine, StageTask task, long projectedMakespan, int limit) {
        List<Equipment> equipmentChoices = task.requiresEquipment()
                ? task.getEligibleEquipment()
                : Collections.singletonList(null);

        long previousTardiness = projectedTardinessBefore(engine, task);
        List<Candidate> candidates = new ArrayList<>();
        for (Worker worker : task.getEligibleWorkers()) {
            for (Equipment equipment : equipmentChoices) {
                Optional<Binding> binding = engine.earliestBinding(task, worker, equipment);
                if (binding.isEmpty() || engine.check(binding.get()).isPresent()) {
                    continue;
                }
                Binding b = binding.get();
                candidates.add(new Candidate(b, marginal(engine, b, projectedMakespan, previousTardiness)));
            }
        }
        candidates.sort(ORDER);
        return candidates.stream().limit(Math.max(1, limit)).map(Candidate::binding).toList();
    }

    /** 束縛後に見積もられる受注の完了時刻（後続ステージは最短所要時間で計算） */
    long projectedEnd(Binding binding) {
        return binding.getEnd() + problem.remainingMinDuration(binding.getTask());
    }

    private double marginal(ConstraintEngine engine, Binding b, long projectedMakespan, long previousTardiness) {
        StageTask task = b.getTask();
        long end = projectedEnd(b);
        long makespanDelta = Math.max(0, end - projectedMakespan);
        long tardinessDelta = Math.max(0, end - task.getDeadlineMinute()) - previousTardiness;

        double hours = b.getDuration() / 60.0;
        double cost = hours * b.getWorker().getHourlyRate();
        long idle = b.getWaiting();
        idle += engine.workerTimeline(b.getWorkerId()).idleDelta(b.getStart(), b.getEnd());
        if (b.getEquipment() != null) {
            cost += hours * b.getEquipment().getHourlyCost();
            ResourceTimeline line = engine.equipmentTimeline(b.getEquipmentId());
            idle += line.idleDelta(b.getStart(), b.getEnd());
        }
        return weights.weigh(makespanDelta, tardinessDelta, cost, idle);
    }

    private long projectedTardinessBefore(ConstraintEngine engine, StageTask task) {
        StageTask previous = problem.predecessor(task);
        long end = previous == null
                ? problem.criticalPath(task.getOrderIndex())
                : engine.binding(previous).map(this::projectedEnd).orElseThrow();
        return Math.max(0, end - task.getDeadlineMinute());
    }

    private record Candidate(Binding binding, double marginal) {
    }
}
