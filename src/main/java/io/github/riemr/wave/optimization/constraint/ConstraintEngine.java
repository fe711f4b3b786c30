package io.github.riemr.wave.optimization.constraint;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.exception.InfeasibleException;
import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import io.github.riemr.wave.optimization.solution.Assignment;
import io.github.riemr.wave.optimization.solution.Binding;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 1 回の探索が所有する制約ネットワーク。
 * <ul>
 *   <li>先行制約: 同一受注の前ステージ終了後にのみ開始できる</li>
 *   <li>選言制約: 作業者・設備ごとに区間が重ならない</li>
 *   <li>ドメイン制約: 能力を持つ作業者、ステージに一致する設備のみ</li>
 *   <li>ホライズン（任意）</li>
 * </ul>
 * 出荷期限はここでは扱わない（目的関数の遅延項）。スレッドセーフではない。
 */
public class ConstraintEngine {

    private final WaveProblem problem;
    private final long horizonMinutes;
    private final Map<String, ResourceTimeline> workerTimelines = new HashMap<>();
    private final Map<String, ResourceTimeline> equipmentTimelines = new HashMap<>();
    private final Binding[] bindings;

    public ConstraintEngine(WaveProblem problem, long horizonMinutes) {
        this.problem = problem;
        this.horizonMinutes = horizonMinutes;
        this.bindings = new Binding[problem.getTaskCount()];
        for (StageTask task : problem.getTasks()) {
            if (task.getEligibleWorkers().isEmpty()) {
                throw new InfeasibleException(task.getStage(), ConstraintType.WORKER_CAPABILITY,
                        "order " + task.getOrderId() + " has no eligible worker");
            }
            if (task.requiresEquipment() && task.getEligibleEquipment().isEmpty()) {
                throw new InfeasibleException(task.getStage(), ConstraintType.EQUIPMENT_REQUIRED,
                        "order " + task.getOrderId() + " has no eligible equipment");
            }
            task.getEligibleWorkers().forEach(w ->
                    workerTimelines.computeIfAbsent(w.getWorkerId(), ResourceTimeline::new));
            task.getEligibleEquipment().forEach(e ->
                    equipmentTimelines.computeIfAbsent(e.getEquipmentId(), ResourceTimeline::new));
        }
    }

    public WaveProblem getProblem() {
        return problem;
    }

    public boolean isAssigned(StageTask task) {
        return bindings[task.getIndex()] != null;
    }

    public Optional<Binding> binding(StageTask task) {
        return Optional.ofNullable(bindings[task.getIndex()]);
    }

    /**
     * 先行ステージの終了時刻。PICK はプラン開始（0）。
     *
     * @throws IllegalStateException 先行ステージが未割当の場合
     */
    public long readyTime(StageTask task) {
        StageTask previous = problem.predecessor(task);
        if (previous == null) {
            return 0;
        }
        Binding prev = bindings[previous.getIndex()];
        if (prev == null) {
            throw new IllegalStateException("predecessor of " + task + " is not assigned");
        }
        return prev.getEnd();
    }

    /**
     * 作業者・設備の組で最も早く開始できる束縛を求める。ホライズンを超える場合は空。
     */
    public Optional<Binding> earliestBinding(StageTask task, Worker worker, Equipment equipment) {
        long ready = readyTime(task);
        long duration = task.durationFor(worker);
        ResourceTimeline workerLine = workerTimelines.get(worker.getWorkerId());
        ResourceTimeline equipmentLine = equipment == null ? null : equipmentTimelines.get(equipment.getEquipmentId());

        long start = ready;
        while (true) {
            long next = workerLine.earliestFit(start, duration);
            if (equipmentLine != null) {
                next = equipmentLine.earliestFit(next, duration);
            }
            if (next == start) {
                break;
            }
            start = next;
        }
        if (horizonMinutes > 0 && start + duration > horizonMinutes) {
            return Optional.empty();
        }
        return Optional.of(new Binding(task, worker, equipment, start, duration, start - ready));
    }

    /**
     * 束縛が現在の部分割当に対して違反する最初の制約を返す。違反なしなら空。
     */
    public Optional<ConstraintType> check(Binding binding) {
        StageTask task = binding.getTask();
        Worker worker = binding.getWorker();
        Equipment equipment = binding.getEquipment();

        if (worker == null || !task.getEligibleWorkers().contains(worker)) {
            return Optional.of(ConstraintType.WORKER_CAPABILITY);
        }
        if (task.requiresEquipment() && equipment == null) {
            return Optional.of(ConstraintType.EQUIPMENT_REQUIRED);
        }
        if (equipment != null && !task.getEligibleEquipment().contains(equipment)) {
            return Optional.of(ConstraintType.EQUIPMENT_TYPE);
        }
        StageTask previous = problem.predecessor(task);
        if (previous != null) {
            Binding prev = bindings[previous.getIndex()];
            if (prev == null || binding.getStart() < prev.getEnd()) {
                return Optional.of(ConstraintType.PRECEDENCE);
            }
        }
        if (binding.getStart() < 0) {
            return Optional.of(ConstraintType.PRECEDENCE);
        }
        if (!workerTimelines.get(worker.getWorkerId()).isFree(binding.getStart(), binding.getEnd())) {
            return Optional.of(ConstraintType.WORKER_OVERLAP);
        }
        if (equipment != null
                && !equipmentTimelines.get(equipment.getEquipmentId()).isFree(binding.getStart(), binding.getEnd())) {
            return Optional.of(ConstraintType.EQUIPMENT_OVERLAP);
        }
        if (horizonMinutes > 0 && binding.getEnd() > horizonMinutes) {
            return Optional.of(ConstraintType.HORIZON);
        }
        return Optional.empty();
    }

    public void commit(Binding binding) {
        StageTask task = binding.getTask();
        if (bindings[task.getIndex()] != null) {
            throw new IllegalStateException(task + " is already assigned");
        }
        Optional<ConstraintType> violation = check(binding);
        if (violation.isPresent()) {
            throw new IllegalStateException("binding for " + task + " violates " + violation.get());
        }
        workerTimelines.get(binding.getWorkerId()).occupy(binding.getStart(), binding.getEnd());
        if (binding.getEquipment() != null) {
            equipmentTimelines.get(binding.getEquipmentId()).occupy(binding.getStart(), binding.getEnd());
        }
        bindings[task.getIndex()] = binding;
    }

    public void retract(Binding binding) {
        StageTask task = binding.getTask();
        if (bindings[task.getIndex()] != binding) {
            throw new IllegalStateException(task + " is not bound to the given binding");
        }
        StageTask next = task.getStage().isLast() ? null
                : problem.task(task.getOrderIndex(), task.getStage().next());
        if (next != null && bindings[next.getIndex()] != null) {
            throw new IllegalStateException("successor of " + task + " must be retracted first");
        }
        workerTimelines.get(binding.getWorkerId()).release(binding.getStart(), binding.getEnd());
        if (binding.getEquipment() != null) {
            equipmentTimelines.get(binding.getEquipmentId()).release(binding.getStart(), binding.getEnd());
        }
        bindings[task.getIndex()] = null;
    }

    public ResourceTimeline workerTimeline(String workerId) {
        return workerTimelines.get(workerId);
    }

    public ResourceTimeline equipmentTimeline(String equipmentId) {
        return equipmentTimelines.get(equipmentId);
    }

    public Assignment snapshot() {
        return new Assignment(problem, bindings);
    }
}
