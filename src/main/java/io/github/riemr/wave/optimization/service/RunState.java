package io.github.riemr.wave.optimization.service;

import io.github.riemr.wave.application.dto.OptimizationResult;
import io.github.riemr.wave.application.dto.RunError;
import io.github.riemr.wave.application.dto.ScorePoint;
import io.github.riemr.wave.optimization.search.CancellationToken;
import io.github.riemr.wave.optimization.search.WaveSearch;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 非同期ラン 1 件の実行時状態。探索スレッドが書き、照会スレッドが読む。
 */
final class RunState {

    enum Status {
        QUEUED,
        SOLVING_ACTIVE,
        COMPLETED,
        CANCELLED,
        FAILED
    }

    /** スコア推移の保持上限 */
    static final int MAX_SCORE_POINTS = 1000;

    final String ticketId;
    final String waveId;
    final Instant startedAt;
    final Duration spentLimit;
    final CancellationToken token = new CancellationToken();
    final List<ScorePoint> scorePoints = new CopyOnWriteArrayList<>();

    volatile Status status = Status.QUEUED;
    volatile WaveSearch search;
    volatile OptimizationResult result;
    volatile RunError error;
    volatile String failureMessage;
    volatile Instant finishedAt;

    RunState(String ticketId, String waveId, Instant startedAt, Duration spentLimit) {
        this.ticketId = ticketId;
        this.waveId = waveId;
        this.startedAt = startedAt;
        this.spentLimit = spentLimit;
    }

    void record(ScorePoint point) {
        scorePoints.add(point);
        if (scorePoints.size() > MAX_SCORE_POINTS) {
            scorePoints.subList(0, scorePoints.size() - MAX_SCORE_POINTS).clear();
        }
    }

    boolean isFinished() {
        return finishedAt != null;
    }
}
