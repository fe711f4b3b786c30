package io.github.riemr.wave.optimization.solution;

import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 束縛から {@link Plan} を組み立てる。再探索はせず算術のみで導出するため、
 * 同じ {@link Assignment} からは常に同じ Plan が得られる。
 */
@Component
public class SolutionExtractor {

    public Plan extract(Assignment assignment) {
        WaveProblem problem = assignment.getProblem();
        Plan.PlanBuilder plan = Plan.builder().planStart(problem.getPlanStart());

        for (int i = 0; i < problem.getOrderCount(); i++) {
            Order order = problem.getOrders().get(i);
            OrderPlan.OrderPlanBuilder orderPlan = OrderPlan.builder()
                    .orderId(order.getOrderId())
                    .priority(order.getPriority())
                    .shippingDeadline(order.getShippingDeadline())
                    .deadlineMinute(problem.tasksOf(i).get(0).getDeadlineMinute());

            long previousEnd = 0;
            for (StageTask task : problem.tasksOf(i)) {
                Optional<Binding> bound = assignment.binding(task);
                if (bound.isEmpty()) {
                    // 先行関係上、以降のステージも未割当
                    break;
                }
                Binding b = bound.get();
                orderPlan.stage(StageAssignment.builder()
                        .orderId(order.getOrderId())
                        .stage(task.getStage())
                        .startMinute(b.getStart())
                        .durationMinutes(b.getDuration())
                        .waitingMinutes(b.getStart() - previousEnd)
                        .workerId(b.getWorkerId())
                        .equipmentId(b.getEquipmentId())
                        .build());
                previousEnd = b.getEnd();
            }
            plan.order(orderPlan.build());
        }
        return plan.build();
    }
}
