package io.github.riemr.wave.application.dto;

import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.optimization.config.SolveSettings;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 1 回の最適化ランの入力。
 */
@Value
@Builder(toBuilder = true)
public class OptimizationRequest {
    /** ログ・チケット用の識別子。任意 */
    String waveId;
    @Singular
    List<Order> orders;
    ResourcePool resourcePool;
    LocalDateTime planStart;
    /** null ならアプリケーション既定値 */
    SolveSettings settings;
    /** 比較用のベースライン計画。任意 */
    Plan baselinePlan;
}
