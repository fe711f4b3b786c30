package io.github.riemr.wave.optimization.constraint;

import io.github.riemr.wave.WaveFixtures;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanConstraintCheckerTest {

    private final PlanConstraintChecker checker = new PlanConstraintChecker();
    private final ResourcePool pool = WaveFixtures.generalistPool(2, 2);

    /** 各ステージ 5 分、待ちなしで連続する受注計画 */
    private static OrderPlan sequential(String orderId, long start, String worker, int unit) {
        OrderPlan.OrderPlanBuilder plan = OrderPlan.builder().orderId(orderId).priority(3).deadlineMinute(120);
        long cursor = start;
        for (StageType stage : StageType.values()) {
            plan.stage(StageAssignment.builder()
                    .orderId(orderId)
                    .stage(stage)
                    .startMinute(cursor)
                    .durationMinutes(5)
                    .waitingMinutes(stage.isFirst() ? start : 0)
                    .workerId(worker)
                    .equipmentId(equipmentFor(stage, unit))
                    .build());
            cursor += 5;
        }
        return plan.build();
    }

    private static String equipmentFor(StageType stage, int unit) {
        switch (stage) {
            case PICK:
                return "CART-" + unit;
            case PACK:
                return "PS-" + unit;
            case SHIP:
                return "DD-" + unit;
            default:
                return null;
        }
    }

    private static Plan planOf(OrderPlan... orders) {
        return Plan.builder().planStart(WaveFixtures.PLAN_START).orders(List.of(orders)).build();
    }

    @Test
    void validPlan_hasNoViolations() {
        Plan plan = planOf(sequential("A", 0, "W1", 1), sequential("B", 0, "W2", 2));

        assertThat(checker.findViolations(plan, pool)).isEmpty();
        assertThat(checker.isFeasible(plan, pool)).isTrue();
    }

    @Test
    void sharedWorkerAtSameTime_isReported() {
        Plan plan = planOf(sequential("A", 0, "W1", 1), sequential("B", 0, "W1", 2));

        assertThat(checker.findViolations(plan, pool))
                .isNotEmpty()
                .allMatch(v -> v.startsWith("WORKER_OVERLAP"));
    }

    @Test
    void nestedIntervalOnSameEquipment_isReported() {
        OrderPlan a = sequential("A", 0, "W1", 1);
        OrderPlan b = sequential("B", 30, "W2", 2);
        // C の長いピッキング区間に D と E が入れ子で重なる
        OrderPlan c = singlePick("C", 60, 40, "W1");
        OrderPlan d = singlePick("D", 70, 5, "W2");
        OrderPlan e = singlePick("E", 80, 5, "W2");

        List<String> violations = checker.findViolations(planOf(a, b, c, d, e), pool);

        assertThat(violations).containsExactly(
                "EQUIPMENT_OVERLAP: CART-1 runs C/PICK and D/PICK at the same time",
                "EQUIPMENT_OVERLAP: CART-1 runs C/PICK and E/PICK at the same time");
    }

    private static OrderPlan singlePick(String orderId, long start, long duration, String worker) {
        return OrderPlan.builder().orderId(orderId).priority(3).deadlineMinute(120)
                .stage(StageAssignment.builder().orderId(orderId).stage(StageType.PICK)
                        .startMinute(start).durationMinutes(duration).waitingMinutes(start)
                        .workerId(worker).equipmentId("CART-1").build())
                .build();
    }

    @Test
    void wrongOrMissingEquipment_isReported() {
        OrderPlan a = sequential("A", 0, "W1", 1);
        OrderPlan broken = OrderPlan.builder().orderId("B").priority(3).deadlineMinute(120)
                .stage(StageAssignment.builder().orderId("B").stage(StageType.PICK)
                        .startMinute(0).durationMinutes(5).waitingMinutes(0).workerId("W2").equipmentId("PS-2").build())
                .stage(StageAssignment.builder().orderId("B").stage(StageType.CONSOLIDATE)
                        .startMinute(5).durationMinutes(5).waitingMinutes(0).workerId("W2").build())
                .stage(StageAssignment.builder().orderId("B").stage(StageType.PACK)
                        .startMinute(10).durationMinutes(5).waitingMinutes(0).workerId("W2").build())
                .build();

        assertThat(checker.findViolations(planOf(a, broken), pool)).containsExactly(
                "EQUIPMENT_TYPE: equipment PS-2 does not serve PICK of order B",
                "EQUIPMENT_REQUIRED: PACK of order B has no equipment");
    }

    @Test
    void inconsistentWaitingAndUnknownWorker_areReported() {
        OrderPlan plan = OrderPlan.builder().orderId("A").priority(3).deadlineMinute(120)
                .stage(StageAssignment.builder().orderId("A").stage(StageType.PICK)
                        .startMinute(0).durationMinutes(5).waitingMinutes(0).workerId("W1").equipmentId("CART-1").build())
                .stage(StageAssignment.builder().orderId("A").stage(StageType.CONSOLIDATE)
                        .startMinute(3).durationMinutes(5).waitingMinutes(0).workerId("NOBODY").build())
                .build();

        List<String> violations = checker.findViolations(planOf(plan), pool);

        assertThat(violations).hasSize(2);
        assertThat(violations.get(0)).startsWith("PRECEDENCE: order A CONSOLIDATE starts at 3");
        assertThat(violations.get(1)).startsWith("WORKER_CAPABILITY: worker NOBODY");
    }
}
