package io.github.riemr.wave.optimization.service;

import io.github.riemr.wave.application.dto.OptimizationRequest;
import io.github.riemr.wave.application.dto.OptimizationResult;
import io.github.riemr.wave.application.dto.RunError;
import io.github.riemr.wave.application.dto.RunTicket;
import io.github.riemr.wave.application.dto.ScorePoint;
import io.github.riemr.wave.application.dto.SolveStatusDto;
import io.github.riemr.wave.application.repository.BaselinePlanSource;
import io.github.riemr.wave.application.repository.WaveBatchRepository;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.WaveBatch;
import io.github.riemr.wave.optimization.config.SolveSettings;
import io.github.riemr.wave.optimization.constraint.PlanConstraintChecker;
import io.github.riemr.wave.optimization.exception.InvalidInputException;
import io.github.riemr.wave.optimization.exception.WaveOptimizationException;
import io.github.riemr.wave.optimization.problem.ProblemBuilder;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import io.github.riemr.wave.optimization.score.PlanComparison;
import io.github.riemr.wave.optimization.score.PlanScorer;
import io.github.riemr.wave.optimization.score.ScoreBreakdown;
import io.github.riemr.wave.optimization.search.CancellationToken;
import io.github.riemr.wave.optimization.search.ProgressListener;
import io.github.riemr.wave.optimization.search.SearchResult;
import io.github.riemr.wave.optimization.search.WaveSearch;
import io.github.riemr.wave.optimization.solution.PlanExplainer;
import io.github.riemr.wave.optimization.solution.SolutionExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * ウェーブ最適化ランを制御するサービス。
 * <ul>
 *   <li>同期実行（{@link #optimize}）とウェーブ ID 指定の実行（{@link #optimizeWave}）</li>
 *   <li>チケットをキーにした非同期実行、進捗照会、キャンセル、スコア推移</li>
 *   <li>ベースライン計画があれば数値比較を付与</li>
 * </ul>
 * ランごとに問題・制約エンジン・暫定解を持ち、ラン間で可変状態を共有しない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WaveOptimizationService {

    /* === Collaborators === */
    private final ProblemBuilder problemBuilder;
    private final SolutionExtractor solutionExtractor;
    private final PlanScorer planScorer;
    private final PlanConstraintChecker constraintChecker;
    private final PlanExplainer planExplainer;
    private final WaveBatchRepository waveBatchRepository;
    private final BaselinePlanSource baselinePlanSource;
    private final SolveSettings defaultSolveSettings;
    private final ExecutorService waveRunExecutor;
    private final Clock clock;

    /* === Runtime State === */
    private final Map<String, RunState> runs = new ConcurrentHashMap<>();

    /** 終了したランの状態・結果を照会できる期間。過ぎたものは次の投入時に捨てる */
    @Value("${wave.optimizer.run-retention:PT1H}")
    private Duration runRetention = Duration.ofHours(1);

    /* ===================================================================== */
    /* Synchronous API                                                       */
    /* ===================================================================== */

    /**
     * 最適化を呼び出しスレッドで実行する。時間切れでも例外にはならず、暫定解を返す。
     *
     * @throws InvalidInputException 受注・資源レコードが不正な場合
     * @throws io.github.riemr.wave.optimization.exception.InfeasibleException 能力を持つ資源がないステージがある場合
     */
    public OptimizationResult optimize(OptimizationRequest request) {
        return execute(request, null, CancellationToken.none(), ProgressListener.NONE, null);
    }

    /**
     * 進捗通知とキャンセルを伴う同期実行。
     */
    public OptimizationResult optimize(OptimizationRequest request, CancellationToken token, ProgressListener listener) {
        return execute(request, null, token, listener, null);
    }

    /**
     * 保存済みウェーブを読み込んで最適化する。ベースライン供給元があれば比較も行う。
     *
     * @param settingsOverride null ならアプリケーション既定値
     */
    public OptimizationResult optimizeWave(String waveId, SolveSettings settingsOverride) {
        WaveBatch batch = loadBatch(waveId);
        return execute(toRequest(batch, settingsOverride), batch,
                CancellationToken.none(), ProgressListener.NONE, null);
    }

    /* ===================================================================== */
    /* Asynchronous API                                                      */
    /* ===================================================================== */

    /**
     * 最適化を非同期で開始する。入力エラーもチケットの状態として報告する。
     *
     * @return 進捗照会・キャンセルに使うチケット
     */
    public RunTicket startOptimization(OptimizationRequest request) {
        return submit(request, null);
    }

    /**
     * 保存済みウェーブの最適化を非同期で開始する。
     *
     * @throws InvalidInputException ウェーブが存在しない場合
     */
    public RunTicket startWaveOptimization(String waveId, SolveSettings settingsOverride) {
        WaveBatch batch = loadBatch(waveId);
        return submit(toRequest(batch, settingsOverride), batch);
    }

    private RunTicket submit(OptimizationRequest request, WaveBatch batch) {
        evictExpiredRuns();
        String ticketId = UUID.randomUUID().toString();
        SolveSettings settings = resolveSettings(request.getSettings());
        RunState state = new RunState(ticketId, request.getWaveId(), clock.instant(), settings.getSpentLimit());
        runs.put(ticketId, state);
        try {
            waveRunExecutor.submit(() -> runAsync(state, request, batch));
        } catch (RejectedExecutionException e) {
            runs.remove(ticketId);
            throw e;
        }
        log.info("Optimization queued: ticket={}, wave={}", ticketId, request.getWaveId());
        return new RunTicket(ticketId, request.getWaveId(), state.startedAt);
    }

    public SolveStatusDto getStatus(String ticketId) {
        RunState state = runs.get(ticketId);
        if (state == null) {
            return new SolveStatusDto("UNKNOWN", 0, 0, "NOT_STARTED");
        }
        RunState.Status status = state.status;
        long start = state.startedAt.toEpochMilli();
        long finish = state.spentLimit == null ? 0 : state.startedAt.plus(state.spentLimit).toEpochMilli();
        String phase = state.search == null ? RunState.Status.QUEUED.name() : state.search.getState().name();
        if (status == RunState.Status.FAILED) {
            if (state.error != null) {
                return SolveStatusDto.failed(state.finishedAt.toEpochMilli(), phase, state.error);
            }
            return new SolveStatusDto(status.name(), 100, state.finishedAt.toEpochMilli(), state.failureMessage);
        }
        int pct;
        if (status == RunState.Status.COMPLETED || status == RunState.Status.CANCELLED) {
            pct = 100;
        } else if (finish <= start) {
            pct = 0;
        } else {
            pct = (int) Math.min(99, Math.max(0,
                    Math.round((clock.millis() - start) * 100.0 / (finish - start))));
        }
        return new SolveStatusDto(status.name(), pct, finish, phase);
    }

    /** 完了したランの結果。実行中・失敗・不明なチケットでは空 */
    public Optional<OptimizationResult> getResult(String ticketId) {
        RunState state = runs.get(ticketId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.result);
    }

    /**
     * キャンセルを要求する。探索は次の決定点で止まり、その時点の暫定解が結果になる。
     *
     * @return 実行中（または待機中）のランにキャンセルを通知できた場合 true
     */
    public boolean cancel(String ticketId) {
        RunState state = runs.get(ticketId);
        if (state == null || state.isFinished()) {
            return false;
        }
        state.token.cancel();
        log.info("Cancellation requested: ticket={}", ticketId);
        return true;
    }

    /** 開発者向け: 暫定解が改善した時点のスコア推移（時系列順） */
    public List<ScorePoint> getScoreSeries(String ticketId) {
        RunState state = runs.get(ticketId);
        if (state == null) {
            log.debug("SCORE SERIES: ticketId {} not found", ticketId);
            return List.of();
        }
        return List.copyOf(state.scorePoints);
    }

    /**
     * 保持期間を過ぎた終了済みランを捨てる。実行中・待機中のランは残す。
     *
     * @return 捨てたラン数
     */
    public int evictExpiredRuns() {
        Instant now = clock.instant();
        int before = runs.size();
        runs.values().removeIf(state -> state.isFinished() && !state.finishedAt.plus(runRetention).isAfter(now));
        int evicted = before - runs.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished runs older than {}", evicted, runRetention);
        }
        return evicted;
    }

    void setRunRetention(Duration runRetention) {
        this.runRetention = runRetention;
    }

    /* ===================================================================== */
    /* Internals                                                             */
    /* ===================================================================== */

    private void runAsync(RunState state, OptimizationRequest request, WaveBatch batch) {
        state.status = RunState.Status.SOLVING_ACTIVE;
        RunState.Status outcome;
        try {
            state.result = execute(request, batch, state.token, state::record, search -> state.search = search);
            outcome = state.token.isCancelled() ? RunState.Status.CANCELLED : RunState.Status.COMPLETED;
        } catch (WaveOptimizationException e) {
            log.warn("Optimization rejected: ticket={}, {}", state.ticketId, e.getMessage());
            state.error = RunError.from(e);
            outcome = RunState.Status.FAILED;
        } catch (RuntimeException e) {
            Throwable rootCause = getRootCause(e);
            log.error("Optimization failed: ticket={}, rootCause={}: {}", state.ticketId,
                    rootCause.getClass().getSimpleName(), rootCause.getMessage(), e);
            state.failureMessage = rootCause.getClass().getSimpleName() + ": " + rootCause.getMessage();
            outcome = RunState.Status.FAILED;
        }
        // 終了時刻を先に確定させてから状態を公開する
        state.finishedAt = clock.instant();
        state.status = outcome;
    }

    /**
     * @param batch 保存済みウェーブから実行する場合の元データ。ベースラインの取得に使う
     */
    private OptimizationResult execute(OptimizationRequest request, WaveBatch batch, CancellationToken token,
                                       ProgressListener listener, Consumer<WaveSearch> onStart) {
        SolveSettings settings = resolveSettings(request.getSettings());
        WaveProblem problem = problemBuilder.build(
                request.getOrders(), request.getResourcePool(), request.getPlanStart(), settings);
        log.info("Optimizing wave {}: {} orders, {} workers, {} equipment, spentLimit={}",
                request.getWaveId(), problem.getOrderCount(), problem.getResourcePool().getWorkers().size(),
                problem.getResourcePool().getEquipment().size(), settings.getSpentLimit());

        List<ScorePoint> points = new ArrayList<>();
        ProgressListener recording = point -> {
            points.add(point);
            listener.onImprovement(point);
        };
        WaveSearch search = new WaveSearch(problem, settings, solutionExtractor, planScorer, token, recording);
        if (onStart != null) {
            onStart.accept(search);
        }
        SearchResult searchResult = search.run();

        // 自己検査: 探索は制約エンジン経由でしか束縛しないので、違反は実装の不具合
        List<String> violations = constraintChecker.findViolations(searchResult.getPlan(), problem.getResourcePool());
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Optimized plan violates hard constraints: " + violations);
        }

        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder()
                .waveId(request.getWaveId())
                .plan(searchResult.getPlan())
                .breakdown(searchResult.getBreakdown())
                .score(searchResult.getScore())
                .status(statusOf(searchResult))
                .terminationReason(searchResult.getReason())
                .optimalityGap(searchResult.getOptimalityGap())
                .iterations(searchResult.getIterations())
                .decisions(searchResult.getDecisions())
                .backtracks(searchResult.getBacktracks())
                .elapsedMillis(searchResult.getElapsedMillis())
                .scorePoints(points)
                .explanations(planExplainer.explain(searchResult.getPlan(), searchResult.getBreakdown(),
                        problem.getResourcePool()));

        Plan baseline = request.getBaselinePlan();
        if (baseline == null && batch != null) {
            // 入力検証を通った後にだけ取得する
            baseline = baselinePlanSource.findBaseline(batch, request.getPlanStart()).orElse(null);
        }
        if (baseline != null) {
            ScoreBreakdown baselineBreakdown = planScorer.score(baseline, problem.getResourcePool(), settings.getWeights());
            PlanComparison comparison = PlanComparison.compare(searchResult.getBreakdown(), baselineBreakdown);
            log.info("Wave {} vs baseline: totalTime {}%, tardiness {}%, objective {}%", request.getWaveId(),
                    String.format("%.1f", comparison.getTotalTimeImprovementPercent()),
                    String.format("%.1f", comparison.getTardinessImprovementPercent()),
                    String.format("%.1f", comparison.getObjectiveImprovementPercent()));
            if (log.isDebugEnabled()) {
                constraintChecker.findViolations(baseline, problem.getResourcePool())
                        .forEach(v -> log.debug("Baseline plan: {}", v));
            }
            result.baselineBreakdown(baselineBreakdown).comparison(comparison);
        }
        return result.build();
    }

    private WaveBatch loadBatch(String waveId) {
        return waveBatchRepository.findById(waveId)
                .orElseThrow(() -> new InvalidInputException("wave " + waveId + " not found"));
    }

    private OptimizationRequest toRequest(WaveBatch batch, SolveSettings settingsOverride) {
        LocalDateTime planStart = batch.getReleaseTime() != null ? batch.getReleaseTime() : LocalDateTime.now(clock);
        return OptimizationRequest.builder()
                .waveId(batch.getWaveId())
                .orders(batch.getOrders())
                .resourcePool(batch.getResourcePool())
                .planStart(planStart)
                .settings(settingsOverride)
                .build();
    }

    private SolveSettings resolveSettings(SolveSettings requested) {
        return requested != null ? requested : defaultSolveSettings;
    }

    private static OptimizationResult.RunStatus statusOf(SearchResult result) {
        if (!result.isComplete()) {
            return OptimizationResult.RunStatus.INCOMPLETE;
        }
        return result.getReason().isTimeBounded()
                ? OptimizationResult.RunStatus.TIME_BOUNDED
                : OptimizationResult.RunStatus.FEASIBLE;
    }

    private static Throwable getRootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}
