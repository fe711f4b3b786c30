package io.github.riemr.wave.application.dto;

import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.optimization.constraint.ConstraintType;
import io.github.riemr.wave.optimization.exception.InfeasibleException;
import io.github.riemr.wave.optimization.exception.InvalidInputException;
import io.github.riemr.wave.optimization.exception.WaveOptimizationException;

import java.util.List;

/**
 * 失敗したランの構造化エラー。入力の修正が必要な失敗と構成の不足を区別する。
 * 時間切れは失敗ではないのでここには現れない。
 *
 * @param stage      INFEASIBLE の場合に満たせなかったステージ
 * @param constraint INFEASIBLE の場合に満たせなかった制約
 * @param violations INVALID_INPUT の場合の個々の指摘
 */
public record RunError(
    WaveOptimizationException.ErrorType type,
    String message,
    StageType stage,
    ConstraintType constraint,
    List<String> violations
) {
    public static RunError from(WaveOptimizationException e) {
        if (e instanceof InfeasibleException infeasible) {
            return new RunError(e.getErrorType(), e.getMessage(),
                    infeasible.getStage(), infeasible.getConstraint(), List.of());
        }
        if (e instanceof InvalidInputException invalid) {
            return new RunError(e.getErrorType(), e.getMessage(), null, null, invalid.getViolations());
        }
        return new RunError(e.getErrorType(), e.getMessage(), null, null, List.of());
    }
}
