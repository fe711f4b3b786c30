package io.github.riemr.wave.optimization.score;

import io.github.riemr.wave.WaveFixtures;
import io.github.riemr.wave.domain.model.EquipmentType;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import org.junit.jupiter.api.Test;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PlanScorerTest {

    private final PlanScorer scorer = new PlanScorer();

    private final ResourcePool pool = ResourcePool.builder()
            .worker(WaveFixtures.generalist("W1").toBuilder().hourlyRate(30).build())
            .worker(WaveFixtures.generalist("W2").toBuilder().hourlyRate(20).build())
            .equipmentUnit(WaveFixtures.equipment("CART-1", EquipmentType.PICK_CART).toBuilder().hourlyCost(6).build())
            .equipmentUnit(WaveFixtures.equipment("CART-2", EquipmentType.PICK_CART).toBuilder().hourlyCost(6).build())
            .equipmentUnit(WaveFixtures.equipment("PS-1", EquipmentType.PACKING_STATION))
            .equipmentUnit(WaveFixtures.equipment("DD-1", EquipmentType.DOCK_DOOR))
            .build();

    private static StageAssignment stage(String orderId, StageType stage, long start, long duration, long waiting,
                                         String worker, String equipment) {
        return StageAssignment.builder()
                .orderId(orderId)
                .stage(stage)
                .startMinute(start)
                .durationMinutes(duration)
                .waitingMinutes(waiting)
                .workerId(worker)
                .equipmentId(equipment)
                .build();
    }

    /**
     * A: 5 分待ってから W1 が 5 分ずつ連続処理（35 分完了、期限 30）。
     * B: W2 が PICK の後 10 分空けて CONSOLIDATE まで（未完了）。
     */
    private Plan sample() {
        OrderPlan a = OrderPlan.builder().orderId("A").priority(1).deadlineMinute(30)
                .stage(stage("A", StageType.PICK, 5, 5, 5, "W1", "CART-1"))
                .stage(stage("A", StageType.CONSOLIDATE, 10, 5, 0, "W1", null))
                .stage(stage("A", StageType.PACK, 15, 5, 0, "W1", "PS-1"))
                .stage(stage("A", StageType.LABEL, 20, 5, 0, "W1", null))
                .stage(stage("A", StageType.STAGE, 25, 5, 0, "W1", null))
                .stage(stage("A", StageType.SHIP, 30, 5, 0, "W1", "DD-1"))
                .build();
        OrderPlan b = OrderPlan.builder().orderId("B").priority(3).deadlineMinute(20)
                .stage(stage("B", StageType.PICK, 0, 10, 0, "W2", "CART-2"))
                .stage(stage("B", StageType.CONSOLIDATE, 20, 20, 10, "W2", null))
                .build();
        return Plan.builder().planStart(WaveFixtures.PLAN_START).order(a).order(b).build();
    }

    @Test
    void score_computesObjectiveComponents() {
        ScoreBreakdown breakdown = scorer.score(sample(), pool, ObjectiveWeights.defaults());

        assertThat(breakdown.getMakespan()).isEqualTo(40);
        // 未完了の B は期限超過でも遅延に数えない
        assertThat(breakdown.getTotalTardiness()).isEqualTo(5);
        assertThat(breakdown.getTardyOrderCount()).isEqualTo(1);
        // W1 30 分 * 30 + W2 30 分 * 20 + カート 15 分 * 6
        assertThat(breakdown.getCost()).isCloseTo(26.5, within(1e-9));
        // W2 の 10..20 の空き
        assertThat(breakdown.getIdleResourceTime()).isEqualTo(10);
        // B の PACK 以降 4 タスクが未割当
        assertThat(breakdown.getUnassignedTaskCount()).isEqualTo(4);
        assertThat(breakdown.getObjective()).isCloseTo(40 + 50 + 2.65 + 0.5 + 4 * 100_000.0, within(1e-6));
    }

    @Test
    void score_partialPlanIsWorseThanSlowComplete() {
        OrderPlan partial = OrderPlan.builder().orderId("A").priority(3).deadlineMinute(0)
                .stage(stage("A", StageType.PICK, 0, 5, 0, "W1", "CART-1"))
                .build();
        OrderPlan.OrderPlanBuilder slow = OrderPlan.builder().orderId("A").priority(3).deadlineMinute(0);
        long start = 0;
        for (StageType stageType : StageType.values()) {
            slow.stage(stage("A", stageType, start, 500, 0, "W1", null));
            start += 500;
        }

        ScoreBreakdown partialBreakdown = scorer.score(
                Plan.builder().planStart(WaveFixtures.PLAN_START).order(partial).build(), pool, ObjectiveWeights.defaults());
        ScoreBreakdown completeBreakdown = scorer.score(
                Plan.builder().planStart(WaveFixtures.PLAN_START).order(slow.build()).build(), pool, ObjectiveWeights.defaults());

        assertThat(completeBreakdown.getUnassignedTaskCount()).isZero();
        assertThat(partialBreakdown.getObjective()).isGreaterThan(completeBreakdown.getObjective());
    }

    @Test
    void score_summarisesTimesPerOrderAndStage() {
        ScoreBreakdown breakdown = scorer.score(sample(), pool, ObjectiveWeights.defaults());

        assertThat(breakdown.getOrderCount()).isEqualTo(2);
        assertThat(breakdown.getTotalProcessingTime()).isEqualTo(60);
        assertThat(breakdown.getTotalWaitingTime()).isEqualTo(15);
        assertThat(breakdown.getTotalTime()).isEqualTo(75);
        assertThat(breakdown.getAverageTotalTime()).isEqualTo(37.5);
        assertThat(breakdown.getStageDurations()).containsEntry(StageType.PICK, 15L).containsEntry(StageType.SHIP, 5L);
        assertThat(breakdown.getStageMeanWaitingTimes())
                .containsEntry(StageType.PICK, 2.5)
                .containsEntry(StageType.CONSOLIDATE, 5.0)
                .containsEntry(StageType.SHIP, 0.0);
        assertThat(breakdown.bottleneck()).contains(StageType.CONSOLIDATE);
    }

    @Test
    void score_summarisesScheduleAndUtilizationPerResource() {
        ScoreBreakdown breakdown = scorer.score(sample(), pool, ObjectiveWeights.defaults());

        assertThat(breakdown.getWorkerUsage()).extracting(ResourceUsage::getResourceId).containsExactly("W1", "W2");
        assertThat(breakdown.getEquipmentUsage()).extracting(ResourceUsage::getResourceId)
                .containsExactly("CART-1", "CART-2", "DD-1", "PS-1");

        ResourceUsage w2 = breakdown.usageOf("W2").orElseThrow();
        assertThat(w2.getKind()).isEqualTo(ResourceUsage.Kind.WORKER);
        assertThat(w2.getAssignments()).extracting(StageAssignment::getStage)
                .containsExactly(StageType.PICK, StageType.CONSOLIDATE);
        assertThat(w2.getBusyMinutes()).isEqualTo(30);
        assertThat(w2.getSpanMinutes()).isEqualTo(40);
        assertThat(w2.getIdleMinutes()).isEqualTo(10);
        // 30 / makespan 40
        assertThat(w2.getUtilizationPercent()).isCloseTo(75.0, within(1e-9));

        ResourceUsage cart = breakdown.usageOf("CART-1").orElseThrow();
        assertThat(cart.getFirstStartMinute()).isEqualTo(5);
        assertThat(cart.getLastEndMinute()).isEqualTo(10);
        assertThat(cart.getUtilizationPercent()).isCloseTo(12.5, within(1e-9));
        assertThat(breakdown.getAverageWorkerUtilization()).isCloseTo(75.0, within(1e-9));
    }

    @Test
    void score_countsUnusedPoolResourcesAndOverlapsOnce() {
        ResourcePool withSpare = pool.toBuilder().worker(WaveFixtures.generalist("W3")).build();
        OrderPlan a = OrderPlan.builder().orderId("A").priority(3).deadlineMinute(120)
                .stage(stage("A", StageType.PICK, 0, 10, 0, "W1", "CART-1"))
                .build();
        OrderPlan b = OrderPlan.builder().orderId("B").priority(3).deadlineMinute(120)
                .stage(stage("B", StageType.PICK, 5, 10, 5, "W1", "CART-2"))
                .build();

        ScoreBreakdown breakdown = scorer.score(
                Plan.builder().planStart(WaveFixtures.PLAN_START).order(a).order(b).build(), withSpare,
                ObjectiveWeights.defaults());

        ResourceUsage w1 = breakdown.usageOf("W1").orElseThrow();
        assertThat(w1.getBusyMinutes()).isEqualTo(15);
        assertThat(w1.getIdleMinutes()).isZero();
        ResourceUsage w3 = breakdown.usageOf("W3").orElseThrow();
        assertThat(w3.isUsed()).isFalse();
        assertThat(w3.getUtilizationPercent()).isZero();
        assertThat(breakdown.usageOf("PS-1").orElseThrow().getBusyMinutes()).isZero();
    }

    @Test
    void toScore_scalesObjectiveIntoSoftAndCountsUnassignedAsHard() {
        ScoreBreakdown breakdown = ScoreBreakdown.builder().objective(93.15).build();

        HardSoftLongScore score = scorer.toScore(breakdown, 4);

        assertThat(score.hardScore()).isEqualTo(-4);
        assertThat(score.softScore()).isEqualTo(-93_150);
        assertThat(scorer.toScore(breakdown, 0).compareTo(score)).isPositive();
    }

    @Test
    void score_unknownWorkerIsChargedAtDefaultRate() {
        OrderPlan a = OrderPlan.builder().orderId("A").priority(3).deadlineMinute(120)
                .stage(stage("A", StageType.PICK, 0, 60, 0, "TEMP-9", "CART-X"))
                .build();
        Plan plan = Plan.builder().planStart(WaveFixtures.PLAN_START).order(a).build();

        ScoreBreakdown breakdown = scorer.score(plan, pool, ObjectiveWeights.defaults());

        assertThat(breakdown.getCost()).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void score_bottleneckTiePrefersUpstreamStageAndIsEmptyWithoutWaiting() {
        OrderPlan tied = OrderPlan.builder().orderId("A").priority(3).deadlineMinute(120)
                .stage(stage("A", StageType.PICK, 5, 5, 5, "W1", "CART-1"))
                .stage(stage("A", StageType.CONSOLIDATE, 10, 5, 0, "W1", null))
                .stage(stage("A", StageType.PACK, 20, 5, 5, "W1", "PS-1"))
                .build();
        OrderPlan noWait = OrderPlan.builder().orderId("B").priority(3).deadlineMinute(120)
                .stage(stage("B", StageType.PICK, 0, 5, 0, "W2", "CART-2"))
                .build();

        ScoreBreakdown withTie = scorer.score(
                Plan.builder().planStart(WaveFixtures.PLAN_START).order(tied).build(), pool, ObjectiveWeights.defaults());
        ScoreBreakdown withoutWait = scorer.score(
                Plan.builder().planStart(WaveFixtures.PLAN_START).order(noWait).build(), pool, ObjectiveWeights.defaults());

        assertThat(withTie.bottleneck()).contains(StageType.PICK);
        assertThat(withoutWait.bottleneck()).isEmpty();
    }

    @Test
    void score_emptyPlanIsZero() {
        Plan plan = Plan.builder().planStart(WaveFixtures.PLAN_START).build();

        ScoreBreakdown breakdown = scorer.score(plan, pool, ObjectiveWeights.defaults());

        assertThat(breakdown.getObjective()).isZero();
        assertThat(breakdown.getAverageTotalTime()).isZero();
        assertThat(breakdown.bottleneck()).isEmpty();
    }

    @Test
    void weights_changeObjectiveOnly() {
        ObjectiveWeights makespanOnly = ObjectiveWeights.builder().tardiness(0).cost(0).idle(0).unassigned(0).build();

        ScoreBreakdown breakdown = scorer.score(sample(), pool, makespanOnly);

        assertThat(breakdown.getObjective()).isEqualTo(40.0);
        assertThat(breakdown.getTotalTardiness()).isEqualTo(5);
    }
}
