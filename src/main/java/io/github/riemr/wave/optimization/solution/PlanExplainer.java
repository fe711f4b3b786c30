package io.github.riemr.wave.optimization.solution;

import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.score.ScoreBreakdown;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 計画の割当判断を人が読める文にする。割当そのものは変えない。
 */
@Component
public class PlanExplainer {

    static final double FAST_WORKER_FACTOR = 1.2;
    static final double SLOW_WORKER_FACTOR = 0.8;
    static final String NOTHING_TO_EXPLAIN = "Optimization completed with standard resource allocation.";

    public List<String> explain(Plan plan, ScoreBreakdown breakdown, ResourcePool pool) {
        List<String> lines = new ArrayList<>();
        for (OrderPlan order : plan.getOrders()) {
            for (StageAssignment a : order.getStages()) {
                Optional<Worker> worker = pool.findWorker(a.getWorkerId());
                if (worker.isEmpty()) {
                    continue;
                }
                double efficiency = worker.get().getEfficiencyFactor();
                if (efficiency > FAST_WORKER_FACTOR) {
                    lines.add(String.format("Assigned %s to %s for order %s because they are %d%% more efficient at this task",
                            worker.get().getName(), a.getStage(), order.getOrderId(),
                            Math.round((efficiency - 1) * 100)));
                } else if (efficiency < SLOW_WORKER_FACTOR) {
                    lines.add(String.format("Assigned %s to %s for order %s due to skill requirements; "
                                    + "consider training for efficiency improvement",
                            worker.get().getName(), a.getStage(), order.getOrderId()));
                }
            }
        }

        for (OrderPlan order : plan.getOrders()) {
            if (!order.isComplete()) {
                lines.add(String.format("Order %s could not be fully scheduled: %d of %d stages planned",
                        order.getOrderId(), order.getStages().size(), StageType.COUNT));
            } else if (order.isTardy()) {
                lines.add(String.format("Order %s ships at %s, %d minutes after its deadline",
                        order.getOrderId(), plan.toDateTime(order.getTotalTime()), order.getTardiness()));
            } else {
                order.stage(StageType.SHIP).ifPresent(ship -> lines.add(String.format(
                        "Order %s scheduled to ship at %s to optimize resource utilization",
                        order.getOrderId(), plan.toDateTime(ship.getStartMinute()))));
            }
        }

        breakdown.bottleneck().ifPresent(stage -> lines.add(String.format(
                "%s is the bottleneck stage with %.1f minutes mean waiting time",
                stage, breakdown.getStageMeanWaitingTimes().get(stage))));

        return lines.isEmpty() ? List.of(NOTHING_TO_EXPLAIN) : List.copyOf(lines);
    }
}
