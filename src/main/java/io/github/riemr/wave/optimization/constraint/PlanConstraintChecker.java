package io.github.riemr.wave.optimization.constraint;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 完成した {@link Plan} をハード制約に照らして検査する。
 * 最適化結果の自己検査と、外部から渡されたベースライン計画の診断に使う。
 */
@Component
public class PlanConstraintChecker {

    public List<String> findViolations(Plan plan, ResourcePool pool) {
        List<String> violations = new ArrayList<>();
        for (OrderPlan order : plan.getOrders()) {
            checkPrecedence(order, violations);
            for (StageAssignment a : order.getStages()) {
                checkDomains(a, pool, violations);
            }
        }
        checkOverlaps(plan, StageAssignment::getWorkerId, ConstraintType.WORKER_OVERLAP, violations);
        checkOverlaps(plan, StageAssignment::getEquipmentId, ConstraintType.EQUIPMENT_OVERLAP, violations);
        return violations;
    }

    public boolean isFeasible(Plan plan, ResourcePool pool) {
        return findViolations(plan, pool).isEmpty();
    }

    private void checkPrecedence(OrderPlan order, List<String> violations) {
        long previousEnd = 0;
        int expected = 0;
        for (StageAssignment a : order.getStages()) {
            if (a.getStage().ordinal() != expected) {
                violations.add(ConstraintType.PRECEDENCE + ": order " + order.getOrderId()
                        + " has " + a.getStage() + " out of sequence");
            }
            if (a.getWaitingMinutes() < 0 || a.getStartMinute() != previousEnd + a.getWaitingMinutes()) {
                violations.add(ConstraintType.PRECEDENCE + ": order " + order.getOrderId() + " " + a.getStage()
                        + " starts at " + a.getStartMinute() + " but previous stage ends at " + previousEnd
                        + " with waiting " + a.getWaitingMinutes());
            }
            previousEnd = a.getEndMinute();
            expected++;
        }
    }

    private void checkDomains(StageAssignment a, ResourcePool pool, List<String> violations) {
        Optional<Worker> worker = a.getWorkerId() == null ? Optional.empty() : pool.findWorker(a.getWorkerId());
        if (worker.isEmpty() || !worker.get().canPerform(a.getStage())) {
            violations.add(ConstraintType.WORKER_CAPABILITY + ": worker " + a.getWorkerId()
                    + " cannot perform " + a.getStage() + " of order " + a.getOrderId());
        }
        StageType stage = a.getStage();
        if (!a.hasEquipment()) {
            if (stage.requiresEquipment()) {
                violations.add(ConstraintType.EQUIPMENT_REQUIRED + ": " + stage + " of order " + a.getOrderId()
                        + " has no equipment");
            }
            return;
        }
        Optional<Equipment> equipment = pool.findEquipment(a.getEquipmentId());
        if (equipment.isEmpty() || !equipment.get().serves(stage)) {
            violations.add(ConstraintType.EQUIPMENT_TYPE + ": equipment " + a.getEquipmentId()
                    + " does not serve " + stage + " of order " + a.getOrderId());
        }
    }

    private void checkOverlaps(Plan plan, Function<StageAssignment, String> resourceOf,
                               ConstraintType type, List<String> violations) {
        Map<String, List<StageAssignment>> byResource = new HashMap<>();
        plan.assignments()
                .filter(a -> resourceOf.apply(a) != null)
                .forEach(a -> byResource.computeIfAbsent(resourceOf.apply(a), k -> new ArrayList<>()).add(a));
        byResource.keySet().stream().sorted().forEach(resourceId -> {
            List<StageAssignment> list = byResource.get(resourceId);
            list.sort(Comparator.comparingLong(StageAssignment::getStartMinute));
            // 終了が最も遅い区間と比較する（入れ子の区間も検出するため）
            StageAssignment furthest = list.get(0);
            for (int i = 1; i < list.size(); i++) {
                StageAssignment cur = list.get(i);
                if (cur.getStartMinute() < furthest.getEndMinute()) {
                    violations.add(type + ": " + resourceId + " runs " + furthest.getOrderId() + "/" + furthest.getStage()
                            + " and " + cur.getOrderId() + "/" + cur.getStage() + " at the same time");
                }
                if (cur.getEndMinute() > furthest.getEndMinute()) {
                    furthest = cur;
                }
            }
        });
    }
}
