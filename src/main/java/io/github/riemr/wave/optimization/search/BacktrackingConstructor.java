package io.github.riemr.wave.optimization.search;

import io.github.riemr.wave.optimization.config.SolveSettings;
import io.github.riemr.wave.optimization.constraint.ConstraintEngine;
import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import io.github.riemr.wave.optimization.solution.Assignment;
import io.github.riemr.wave.optimization.solution.Binding;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 受注の並び順に従い、1 受注ずつ PICK から SHIP まで束縛を決める構築探索。
 * 決定点ごとに上位 candidateLimit 件の候補を保持し、候補が尽きたら同じ受注の 1 つ前の決定点へ戻る。
 * 受注がホライズン内に収まらない場合やバックトラック上限に達した場合は、その受注で最も深く進んだ
 * 途中までの割当を残して次の受注へ進む。予算切れ・キャンセルではその時点の部分割当を返す。
 */
@Slf4j
class BacktrackingConstructor {

    /** タスク 1 件あたりに許すバックトラック回数 */
    private static final int BACKTRACKS_PER_TASK = 20;

    private final WaveProblem problem;
    private final SolveSettings settings;
    private final CandidateRanker ranker;

    BacktrackingConstructor(WaveProblem problem, SolveSettings settings) {
        this.problem = problem;
        this.settings = settings;
        this.ranker = new CandidateRanker(problem, settings.getWeights());
    }

    /**
     * @param sequence 受注インデックスの並び（problem の受注数と同じ長さ）
     */
    ConstructionResult construct(int[] sequence, SearchBudget budget) {
        ConstraintEngine engine = new ConstraintEngine(problem, settings.hasHorizon() ? settings.getHorizonMinutes() : 0);
        long projectedMakespan = 0;
        long backtracks = 0;
        int skipped = 0;

        for (int orderIndex : sequence) {
            OrderOutcome outcome = placeOrder(engine, orderIndex, projectedMakespan, budget);
            backtracks += outcome.backtracks();
            if (outcome.interruption() != null) {
                return new ConstructionResult(engine.snapshot(), outcome.interruption(), backtracks);
            }
            if (!outcome.complete()) {
                skipped++;
            }
            projectedMakespan = outcome.projectedMakespan();
        }
        if (skipped > 0) {
            log.debug("Construction left {} of {} orders incomplete after {} backtracks",
                    skipped, sequence.length, backtracks);
        }
        return new ConstructionResult(engine.snapshot(), null, backtracks);
    }

    /**
     * 1 受注分のステージを順に束縛する。戻りはこの受注の中だけで行い、既に置いた受注には触れない。
     */
    private OrderOutcome placeOrder(ConstraintEngine engine, int orderIndex, long makespanBefore, SearchBudget budget) {
        List<StageTask> tasks = problem.tasksOf(orderIndex);
        DecisionPoint[] stack = new DecisionPoint[tasks.size()];
        long backtrackLimit = (long) BACKTRACKS_PER_TASK * tasks.size();

        int depth = 0;
        long backtracks = 0;
        long projectedMakespan = makespanBefore;
        List<Binding> deepest = List.of();

        while (depth < tasks.size()) {
            if (budget.isExhausted()) {
                return new OrderOutcome(false, budget.exhaustionReason(), backtracks, projectedMakespan);
            }
            budget.recordDecision();

            DecisionPoint dp = stack[depth];
            if (dp == null) {
                dp = new DecisionPoint(ranker.rank(engine, tasks.get(depth), projectedMakespan,
                        settings.getCandidateLimit()), projectedMakespan);
                stack[depth] = dp;
            } else {
                // 戻ってきた決定点: 現在の束縛を外して次の候補へ
                engine.retract(dp.committed);
                dp.committed = null;
                projectedMakespan = dp.makespanBefore;
            }

            if (dp.next < dp.candidates.size()) {
                Binding binding = dp.candidates.get(dp.next++);
                engine.commit(binding);
                dp.committed = binding;
                projectedMakespan = Math.max(projectedMakespan, ranker.projectedEnd(binding));
                depth++;
                if (depth > deepest.size()) {
                    deepest = committedPrefix(stack, depth);
                }
                continue;
            }

            stack[depth] = null;
            if (depth == 0 || ++backtracks > backtrackLimit) {
                log.debug("Order {} kept {}/{} stages after {} backtracks",
                        problem.getOrders().get(orderIndex).getOrderId(), deepest.size(), tasks.size(), backtracks);
                return new OrderOutcome(false, null, backtracks,
                        restoreDeepest(engine, stack, depth, deepest, makespanBefore));
            }
            depth--;
        }
        return new OrderOutcome(true, null, backtracks, projectedMakespan);
    }

    /**
     * この受注の束縛をすべて外し、最も深く進んだ時点の束縛を置き直す。
     * 他の受注の束縛は当時と同じなので、置き直した束縛も制約を満たす。
     */
    private long restoreDeepest(ConstraintEngine engine, DecisionPoint[] stack, int depth, List<Binding> deepest,
                                long makespanBefore) {
        for (int d = depth - 1; d >= 0; d--) {
            engine.retract(stack[d].committed);
        }
        long projectedMakespan = makespanBefore;
        for (Binding binding : deepest) {
            engine.commit(binding);
            projectedMakespan = Math.max(projectedMakespan, ranker.projectedEnd(binding));
        }
        return projectedMakespan;
    }

    private static List<Binding> committedPrefix(DecisionPoint[] stack, int depth) {
        List<Binding> prefix = new ArrayList<>(depth);
        for (int d = 0; d < depth; d++) {
            prefix.add(stack[d].committed);
        }
        return prefix;
    }

    private static final class DecisionPoint {
        final List<Binding> candidates;
        final long makespanBefore;
        int next;
        Binding committed;

        DecisionPoint(List<Binding> candidates, long makespanBefore) {
            this.candidates = candidates;
            this.makespanBefore = makespanBefore;
        }
    }

    private record OrderOutcome(boolean complete, TerminationReason interruption, long backtracks,
                                long projectedMakespan) {
    }

    /**
     * @param interruption 予算切れ・キャンセルで中断した場合の理由。最後まで走った場合は null
     */
    record ConstructionResult(Assignment assignment, TerminationReason interruption, long backtracks) {

        boolean isInterrupted() {
            return interruption != null;
        }
    }
}
