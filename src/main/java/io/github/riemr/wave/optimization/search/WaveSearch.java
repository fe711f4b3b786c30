package io.github.riemr.wave.optimization.search;

import io.github.riemr.wave.application.dto.ScorePoint;
import io.github.riemr.wave.domain.model.OrderPlan;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.optimization.config.SolveSettings;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import io.github.riemr.wave.optimization.score.LowerBound;
import io.github.riemr.wave.optimization.score.PlanScorer;
import io.github.riemr.wave.optimization.score.ScoreBreakdown;
import io.github.riemr.wave.optimization.solution.Assignment;
import io.github.riemr.wave.optimization.solution.SolutionExtractor;
import lombok.extern.slf4j.Slf4j;
import org.optaplanner.core.api.score.buildin.hardsoftlong.HardSoftLongScore;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 1 ラン分の anytime 探索。
 * <ol>
 *   <li>決定順（優先度 → 期限 → ID）でバックトラック付き構築</li>
 *   <li>受注順の近傍（遅延受注の前倒し・交換・挿入）を再構築し、スコアが厳密に良い場合のみ採用</li>
 * </ol>
 * 予算切れ・キャンセル時も暫定解を返す。インスタンスは 1 回だけ {@link #run()} できる。
 */
@Slf4j
public class WaveSearch {

    private final WaveProblem problem;
    private final SolveSettings settings;
    private final SolutionExtractor extractor;
    private final PlanScorer scorer;
    private final CancellationToken token;
    private final ProgressListener listener;

    private volatile SearchState state = SearchState.UNASSIGNED;

    public WaveSearch(WaveProblem problem, SolveSettings settings, SolutionExtractor extractor, PlanScorer scorer,
                      CancellationToken token, ProgressListener listener) {
        this.problem = problem;
        this.settings = settings;
        this.extractor = extractor;
        this.scorer = scorer;
        this.token = token;
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    /** 探索中の状態。別スレッドから参照してよい */
    public SearchState getState() {
        return state;
    }

    public SearchResult run() {
        SearchBudget budget = new SearchBudget(settings.getSpentLimit(), token);
        BacktrackingConstructor constructor = new BacktrackingConstructor(problem, settings);
        double lowerBound = LowerBound.of(problem, settings.getWeights());
        int n = problem.getOrderCount();

        int[] sequence = new int[n];
        for (int i = 0; i < n; i++) {
            sequence[i] = i;
        }

        state = SearchState.PARTIALLY_ASSIGNED;
        BacktrackingConstructor.ConstructionResult initial = constructor.construct(sequence, budget);
        long backtracks = initial.backtracks();
        Incumbent best = evaluate(initial.assignment());
        notifyImprovement(best, 0, budget);
        if (initial.isInterrupted()) {
            log.info("Initial construction interrupted by {} after {} decisions",
                    initial.interruption(), budget.getDecisions());
            return finish(best, initial.interruption(), 0, backtracks, budget, lowerBound);
        }

        Random random = new Random(settings.getRandomSeed());
        long iterations = 0;
        long unimproved = 0;
        TerminationReason reason;
        while (true) {
            if (best.assignment.isComplete() && LowerBound.gap(best.breakdown.getObjective(), lowerBound) <= 0) {
                reason = TerminationReason.OPTIMAL;
                break;
            }
            if (n < 2) {
                reason = TerminationReason.CONVERGED;
                break;
            }
            if (settings.getIterationLimit() > 0 && iterations >= settings.getIterationLimit()) {
                reason = TerminationReason.ITERATION_LIMIT;
                break;
            }
            if (settings.getUnimprovedIterationLimit() > 0 && unimproved >= settings.getUnimprovedIterationLimit()) {
                reason = TerminationReason.CONVERGED;
                break;
            }
            if (budget.isExhausted()) {
                reason = budget.exhaustionReason();
                break;
            }

            int[] candidate = neighbour(sequence, best.plan, random);
            BacktrackingConstructor.ConstructionResult rebuilt = constructor.construct(candidate, budget);
            backtracks += rebuilt.backtracks();
            if (rebuilt.isInterrupted()) {
                // 途中まで組んだ割当は捨て、暫定解を保持する
                reason = rebuilt.interruption();
                break;
            }
            iterations++;
            Incumbent evaluated = evaluate(rebuilt.assignment());
            if (evaluated.score.compareTo(best.score) > 0) {
                best = evaluated;
                sequence = candidate;
                unimproved = 0;
                notifyImprovement(best, iterations, budget);
            } else {
                unimproved++;
            }
        }
        return finish(best, reason, iterations, backtracks, budget, lowerBound);
    }

    private SearchResult finish(Incumbent best, TerminationReason reason, long iterations, long backtracks,
                                SearchBudget budget, double lowerBound) {
        boolean complete = best.assignment.isComplete();
        state = complete ? SearchState.COMPLETE_FEASIBLE : SearchState.COMPLETE_WITHIN_BOUND;
        double gap = complete ? LowerBound.gap(best.breakdown.getObjective(), lowerBound) : 1.0;
        log.info("Search finished: reason={}, state={}, score={}, iterations={}, decisions={}, gap={}",
                reason, state, best.score, iterations, budget.getDecisions(), String.format("%.3f", gap));
        if (!complete && reason.isTimeBounded()) {
            log.warn("Search stopped by {} without a complete plan: {} of {} tasks unassigned",
                    reason, best.assignment.getUnassignedCount(), problem.getTaskCount());
        }
        return SearchResult.builder()
                .assignment(best.assignment)
                .plan(best.plan)
                .breakdown(best.breakdown)
                .score(best.score)
                .state(state)
                .reason(reason)
                .iterations(iterations)
                .decisions(budget.getDecisions())
                .backtracks(backtracks)
                .elapsedMillis(budget.elapsedMillis())
                .optimalityGap(gap)
                .build();
    }

    private Incumbent evaluate(Assignment assignment) {
        Plan plan = extractor.extract(assignment);
        ScoreBreakdown breakdown = scorer.score(plan, problem.getResourcePool(), settings.getWeights());
        HardSoftLongScore score = scorer.toScore(breakdown, assignment.getUnassignedCount());
        return new Incumbent(assignment, plan, breakdown, score);
    }

    private void notifyImprovement(Incumbent best, long iteration, SearchBudget budget) {
        log.debug("New incumbent at iteration {}: {}", iteration, best.score);
        listener.onImprovement(new ScorePoint(budget.elapsedMillis(), iteration,
                best.score.hardScore(), best.score.softScore(), best.breakdown.getObjective()));
    }

    /**
     * 受注順の近傍。3 割は遅延（または未完了）受注を前に移し、残りは交換か挿入。
     */
    int[] neighbour(int[] sequence, Plan plan, Random random) {
        int n = sequence.length;
        int[] next = sequence.clone();
        int roll = random.nextInt(10);
        if (roll < 3) {
            List<Integer> late = new ArrayList<>();
            for (int pos = 1; pos < n; pos++) {
                OrderPlan order = plan.getOrders().get(sequence[pos]);
                if (order.isTardy() || !order.isComplete()) {
                    late.add(pos);
                }
            }
            if (!late.isEmpty()) {
                int from = late.get(random.nextInt(late.size()));
                move(next, from, random.nextInt(from));
                return next;
            }
        }
        int i = random.nextInt(n);
        int j = random.nextInt(n - 1);
        if (j >= i) {
            j++;
        }
        if (roll < 7) {
            int tmp = next[i];
            next[i] = next[j];
            next[j] = tmp;
        } else {
            move(next, i, j);
        }
        return next;
    }

    private static void move(int[] sequence, int from, int to) {
        int value = sequence[from];
        if (from > to) {
            System.arraycopy(sequence, to, sequence, to + 1, from - to);
        } else {
            System.arraycopy(sequence, from + 1, sequence, from, to - from);
        }
        sequence[to] = value;
    }

    private record Incumbent(Assignment assignment, Plan plan, ScoreBreakdown breakdown, HardSoftLongScore score) {
    }
}
