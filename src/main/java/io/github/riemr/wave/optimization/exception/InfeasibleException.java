package io.github.riemr.wave.optimization.exception;

import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.optimization.constraint.ConstraintType;

/**
 * ハード制約（能力・設備種別）を満たす割当が構造上存在しない場合に送出する。
 */
public class InfeasibleException extends WaveOptimizationException {

    private final StageType stage;
    private final ConstraintType constraint;

    public InfeasibleException(StageType stage, ConstraintType constraint, String detail) {
        super("Infeasible " + constraint + " for stage " + stage + ": " + detail);
        this.stage = stage;
        this.constraint = constraint;
    }

    public StageType getStage() {
        return stage;
    }

    public ConstraintType getConstraint() {
        return constraint;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INFEASIBLE;
    }
}
