package io.github.riemr.wave.optimization.problem;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.config.SolveSettings;
import io.github.riemr.wave.optimization.constraint.ConstraintType;
import io.github.riemr.wave.optimization.exception.InfeasibleException;
import io.github.riemr.wave.optimization.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 受注バッチと資源プールから {@link WaveProblem} を組み立てる。
 * <ul>
 *   <li>入力レコードを検証し、不正があれば探索前に {@link InvalidInputException}</li>
 *   <li>担当可能な作業者・設備がないステージは {@link InfeasibleException}</li>
 *   <li>受注を 優先度 → 期限 → ID の順に並べ、ステージごとの基準所要時間を算出</li>
 * </ul>
 * 状態を持たないため、並行するランから共有してよい。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProblemBuilder {

    public static final Comparator<Order> DECISION_ORDER = Comparator
            .comparing(Order::getPriority)
            .thenComparing(Order::getShippingDeadline)
            .thenComparing(Order::getOrderId);

    private final StageDurationRules durationRules;

    public WaveProblem build(List<Order> orders, ResourcePool pool, LocalDateTime planStart, SolveSettings settings) {
        if (planStart == null) {
            throw new InvalidInputException("planStart is required");
        }
        validateOrders(orders, settings);
        validatePool(pool);

        Map<StageType, List<Worker>> workersByStage = new EnumMap<>(StageType.class);
        Map<StageType, List<Equipment>> equipmentByStage = new EnumMap<>(StageType.class);
        for (StageType stage : StageType.values()) {
            List<Worker> workers = pool.workersFor(stage);
            if (workers.isEmpty()) {
                throw new InfeasibleException(stage, ConstraintType.WORKER_CAPABILITY,
                        "no worker in the pool is capable of " + stage);
            }
            workersByStage.put(stage, workers);

            List<Equipment> equipment = pool.equipmentFor(stage);
            if (stage.requiresEquipment() && equipment.isEmpty()) {
                throw new InfeasibleException(stage, ConstraintType.EQUIPMENT_REQUIRED,
                        "no " + stage.requiredEquipmentType().orElseThrow() + " in the pool");
            }
            equipmentByStage.put(stage, equipment);
        }

        List<Order> sorted = orders.stream().sorted(DECISION_ORDER).toList();
        List<StageTask> tasks = new ArrayList<>(sorted.size() * StageType.COUNT);
        for (int i = 0; i < sorted.size(); i++) {
            Order order = sorted.get(i);
            long deadlineMinute = Duration.between(planStart, order.getShippingDeadline()).toMinutes();
            for (StageType stage : StageType.values()) {
                tasks.add(new StageTask(i, order, stage,
                        durationRules.baseDuration(order, stage),
                        deadlineMinute,
                        workersByStage.get(stage),
                        equipmentByStage.get(stage)));
            }
        }

        log.debug("Built wave problem: {} orders, {} tasks, {} workers, {} equipment",
                sorted.size(), tasks.size(), pool.getWorkers().size(), pool.getEquipment().size());
        return new WaveProblem(planStart, sorted, pool, tasks);
    }

    private void validateOrders(List<Order> orders, SolveSettings settings) {
        if (orders == null || orders.isEmpty()) {
            throw new InvalidInputException("at least one order is required");
        }
        List<String> errors = new ArrayList<>();
        if (settings.getBatchSizeLimit() > 0 && orders.size() > settings.getBatchSizeLimit()) {
            errors.add("batch has " + orders.size() + " orders, limit is " + settings.getBatchSizeLimit());
        }
        Set<String> seen = new HashSet<>();
        for (Order o : orders) {
            if (o == null) {
                errors.add("order record is null");
                continue;
            }
            String id = o.getOrderId();
            if (id == null || id.isBlank()) {
                errors.add("order id is missing");
                continue;
            }
            if (!seen.add(id)) {
                errors.add("duplicate order id " + id);
            }
            if (o.getPriority() == null) {
                errors.add("order " + id + " has no priority");
            } else if (o.getPriority() < 1 || o.getPriority() > 5) {
                errors.add("order " + id + " priority must be 1..5 but was " + o.getPriority());
            }
            if (o.getShippingDeadline() == null) {
                errors.add("order " + id + " has no shipping deadline");
            }
            if (o.getItemCount() < 0) {
                errors.add("order " + id + " has negative item count");
            }
            if (o.getTotalWeight() < 0) {
                errors.add("order " + id + " has negative weight");
            }
            if (o.getPickTimeMinutes() < 0 || o.getPackTimeMinutes() < 0) {
                errors.add("order " + id + " has negative time estimate");
            }
            if (o.getWalkingTimeMinutes() < 0) {
                errors.add("order " + id + " has negative walking time");
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidInputException(errors);
        }
    }

    private void validatePool(ResourcePool pool) {
        if (pool == null) {
            throw new InvalidInputException("resource pool is required");
        }
        List<String> errors = new ArrayList<>();
        Set<String> workerIds = new HashSet<>();
        for (Worker w : pool.getWorkers()) {
            if (w.getWorkerId() == null || w.getWorkerId().isBlank()) {
                errors.add("worker id is missing");
                continue;
            }
            if (!workerIds.add(w.getWorkerId())) {
                errors.add("duplicate worker id " + w.getWorkerId());
            }
            if (w.getEfficiencyFactor() <= 0) {
                errors.add("worker " + w.getWorkerId() + " efficiency factor must be positive");
            }
            if (w.getHourlyRate() < 0) {
                errors.add("worker " + w.getWorkerId() + " has negative hourly rate");
            }
        }
        Set<String> equipmentIds = new HashSet<>();
        for (Equipment e : pool.getEquipment()) {
            if (e.getEquipmentId() == null || e.getEquipmentId().isBlank()) {
                errors.add("equipment id is missing");
                continue;
            }
            if (!equipmentIds.add(e.getEquipmentId())) {
                errors.add("duplicate equipment id " + e.getEquipmentId());
            }
            if (e.getType() == null) {
                errors.add("equipment " + e.getEquipmentId() + " has no type");
            }
            if (e.getHourlyCost() < 0) {
                errors.add("equipment " + e.getEquipmentId() + " has negative hourly cost");
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidInputException(errors);
        }
    }
}
