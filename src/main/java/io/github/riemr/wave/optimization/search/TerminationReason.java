package io.github.riemr.wave.optimization.search;

public enum TerminationReason {
    /** 未改善反復の上限に達した */
    CONVERGED,
    /** 下界に一致した */
    OPTIMAL,
    ITERATION_LIMIT,
    TIME_LIMIT,
    CANCELLED;

    /** 探索自身の収束ではなく外部の打ち切りで終わったか */
    public boolean isTimeBounded() {
        return this == TIME_LIMIT || this == CANCELLED;
    }
}
