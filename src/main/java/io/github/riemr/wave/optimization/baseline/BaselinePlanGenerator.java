package io.github.riemr.wave.optimization.baseline;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.problem.ProblemBuilder;
import io.github.riemr.wave.optimization.problem.StageDurationRules;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 従来型 WMS を模した比較用の計画を作る。資源競合は考慮せず、受注ごとに
 * 水増しした所要時間と固定の待ち時間を積み上げ、作業者・設備は受注順のラウンドロビンで割り当てる。
 * 歩行時間は水増しせず、そのままピッキングに加える。
 * 状態を持たず、最適化側とは何も共有しない。
 */
@Component
@RequiredArgsConstructor
public class BaselinePlanGenerator {

    static final double PICK_ESTIMATE_INFLATION = 1.3;
    static final double PACK_ESTIMATE_INFLATION = 1.4;
    static final int QUEUE_THRESHOLD = 10;
    static final double QUEUE_FACTOR_PER_ORDER = 0.1;
    static final double PRIORITY_WAIT_DISCOUNT = 0.7;
    static final int MAX_WAIT_MINUTES = 60;

    private final StageDurationRules rules;

    public Plan generate(List<Order> orders, ResourcePool pool, LocalDateTime planStart) {
        List<Order> sorted = orders.stream().sorted(ProblemBuilder.DECISION_ORDER).toList();
        Plan.PlanBuilder plan = Plan.builder().planStart(planStart);

        for (int index = 0; index < sorted.size(); index++) {
            Order order = sorted.get(index);
            Order inflated = order.toBuilder()
                    .pickTimeMinutes(order.getPickTimeMinutes() * PICK_ESTIMATE_INFLATION)
                    .packTimeMinutes(order.getPackTimeMinutes() * PACK_ESTIMATE_INFLATION)
                    .build();
            OrderPlan.OrderPlanBuilder orderPlan = OrderPlan.builder()
                    .orderId(order.getOrderId())
                    .priority(order.getPriority())
                    .shippingDeadline(order.getShippingDeadline())
                    .deadlineMinute(Duration.between(planStart, order.getShippingDeadline()).toMinutes());

            long previousEnd = 0;
            for (StageType stage : StageType.values()) {
                long waiting = waitingMinutes(stage, order, sorted.size());
                long start = previousEnd + waiting;
                int duration = rules.baseDuration(inflated, stage);
                orderPlan.stage(StageAssignment.builder()
                        .orderId(order.getOrderId())
                        .stage(stage)
                        .startMinute(start)
                        .durationMinutes(duration)
                        .waitingMinutes(waiting)
                        .workerId(roundRobinWorker(pool.workersFor(stage), index))
                        .equipmentId(stage.requiresEquipment()
                                ? roundRobinEquipment(pool.equipmentFor(stage), index)
                                : null)
                        .build());
                previousEnd = start + duration;
            }
            plan.order(orderPlan.build());
        }
        return plan.build();
    }

    /**
     * ステージ前の待ち時間。キュー長が閾値を超えると 1 件ごとに 10% 増え、
     * 優先受注は 30% 短く、上限 {@value #MAX_WAIT_MINUTES} 分。
     */
    static long waitingMinutes(StageType stage, Order order, int queueLength) {
        double minutes = switch (stage) {
            case PICK -> 10;
            case CONSOLIDATE -> 15;
            case PACK -> 8;
            case LABEL -> 6;
            case STAGE -> 12;
            default -> 5;
        };
        if (queueLength > QUEUE_THRESHOLD) {
            minutes = Math.ceil(minutes * (1.0 + (queueLength - QUEUE_THRESHOLD) * QUEUE_FACTOR_PER_ORDER));
        }
        if (order.isHighPriority()) {
            minutes = Math.ceil(minutes * PRIORITY_WAIT_DISCOUNT);
        }
        return (long) Math.min(minutes, MAX_WAIT_MINUTES);
    }

    private static String roundRobinWorker(List<Worker> capable, int index) {
        return capable.isEmpty() ? null : capable.get(index % capable.size()).getWorkerId();
    }

    private static String roundRobinEquipment(List<Equipment> units, int index) {
        return units.isEmpty() ? null : units.get(index % units.size()).getEquipmentId();
    }
}
