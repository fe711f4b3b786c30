package io.github.riemr.wave.application.repository;

import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.WaveBatch;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 比較用のベースライン計画の供給元。最適化は結果の比較にのみ使う。
 */
public interface BaselinePlanSource {
    Optional<Plan> findBaseline(WaveBatch batch, LocalDateTime planStart);
}
