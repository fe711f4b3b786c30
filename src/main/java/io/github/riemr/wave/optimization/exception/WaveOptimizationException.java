package io.github.riemr.wave.optimization.exception;

/**
 * 最適化の入力・構成に起因するエラーの基底。時間切れはエラーとして扱わない。
 */
public abstract class WaveOptimizationException extends RuntimeException {

    protected WaveOptimizationException(String message) {
        super(message);
    }

    public abstract ErrorType getErrorType();

    public enum ErrorType {
        /** 入力レコードの欠落・不正。入力を修正すること */
        INVALID_INPUT,
        /** 必要な作業者/設備の能力が存在しない。構成を修正すること */
        INFEASIBLE
    }
}
