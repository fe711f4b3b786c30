package io.github.riemr.wave.optimization.solution;

import io.github.riemr.wave.WaveFixtures;
import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageAssignment;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.config.SolveSettings;
import io.github.riemr.wave.optimization.problem.ProblemBuilder;
import io.github.riemr.wave.optimization.problem.StageDurationRules;
import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolutionExtractorTest {

    private final SolutionExtractor extractor = new SolutionExtractor();
    private WaveProblem problem;
    private Worker worker;

    @BeforeEach
    void setUp() {
        ResourcePool pool = WaveFixtures.generalistPool(1, 1);
        problem = new ProblemBuilder(StageDurationRules.defaults()).build(
                List.of(WaveFixtures.order("B", 3, 120), WaveFixtures.order("A", 1, 60)),
                pool, WaveFixtures.PLAN_START, SolveSettings.defaults());
        worker = pool.getWorkers().get(0);
    }

    /** 受注 orderIndex のステージを waits の待ちを挟んで順に束縛する */
    private long bindSequence(Binding[] slots, int orderIndex, long cursor, long... waits) {
        for (int s = 0; s < waits.length; s++) {
            StageTask task = problem.task(orderIndex, StageType.values()[s]);
            Equipment equipment = task.getEligibleEquipment().isEmpty() ? null : task.getEligibleEquipment().get(0);
            long start = cursor + waits[s];
            long duration = task.durationFor(worker);
            slots[task.getIndex()] = new Binding(task, worker, equipment, start, duration, waits[s]);
            cursor = start + duration;
        }
        return cursor;
    }

    @Test
    void extract_derivesWaitingFromPreviousStageEnd() {
        Binding[] slots = new Binding[problem.getTaskCount()];
        long end = bindSequence(slots, 0, 0, 3, 0, 4, 0, 1, 2);

        Plan plan = extractor.extract(new Assignment(problem, slots));

        OrderPlan a = plan.getOrders().get(0);
        assertThat(a.getOrderId()).isEqualTo("A");
        assertThat(a.isComplete()).isTrue();
        assertThat(a.getStages()).extracting(StageAssignment::getWaitingMinutes).containsExactly(3L, 0L, 4L, 0L, 1L, 2L);
        assertThat(a.getTotalWaitingTime()).isEqualTo(10);
        assertThat(a.getTotalTime()).isEqualTo(end);
        assertThat(a.getTotalTime()).isEqualTo(a.getTotalProcessingTime() + a.getTotalWaitingTime());
        assertThat(a.stage(StageType.PICK).orElseThrow().getEquipmentId()).isEqualTo("CART-1");
        assertThat(a.stage(StageType.LABEL).orElseThrow().getEquipmentId()).isNull();
        assertThat(a.getDeadlineMinute()).isEqualTo(60);
        assertThat(plan.toDateTime(a.getTotalTime())).isEqualTo(WaveFixtures.PLAN_START.plusMinutes(end));
    }

    @Test
    void extract_partialAssignment_keepsPrefixAndReportsUnscheduledOrders() {
        Binding[] slots = new Binding[problem.getTaskCount()];
        long end = bindSequence(slots, 0, 0, 0, 0, 0, 0, 0, 0);
        bindSequence(slots, 1, end, 5, 0);

        Plan plan = extractor.extract(new Assignment(problem, slots));

        OrderPlan b = plan.getOrders().get(1);
        assertThat(b.getStages()).extracting(StageAssignment::getStage)
                .containsExactly(StageType.PICK, StageType.CONSOLIDATE);
        // B の PICK 待ちはプラン開始から数える
        assertThat(b.getStages().get(0).getWaitingMinutes()).isEqualTo(end + 5);
        assertThat(b.isComplete()).isFalse();
        assertThat(b.getTardiness()).isZero();
        assertThat(plan.isComplete()).isFalse();
        assertThat(plan.getUnscheduledOrderIds()).containsExactly("B");
    }

    @Test
    void extract_isIdempotent() {
        Binding[] slots = new Binding[problem.getTaskCount()];
        bindSequence(slots, 0, 0, 1, 1, 1, 1, 1, 1);
        Assignment assignment = new Assignment(problem, slots);

        assertThat(extractor.extract(assignment)).isEqualTo(extractor.extract(assignment));
    }

    @Test
    void extract_emptyAssignment_listsEveryOrderWithoutStages() {
        Plan plan = extractor.extract(Assignment.empty(problem));

        assertThat(plan.getOrders()).extracting(OrderPlan::getOrderId).containsExactly("A", "B");
        assertThat(plan.assignments()).isEmpty();
        assertThat(plan.getMakespan()).isZero();
        assertThat(plan.getUnscheduledOrderIds()).containsExactly("A", "B");
    }

    @Test
    void assignment_rejectsWrongSlotCount() {
        assertThatThrownBy(() -> new Assignment(problem, new Binding[3]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected 12 slots");
    }
}
