package io.github.riemr.wave.application.dto;

/**
 * 非同期ランの進捗。error は失敗したランでのみ設定される。
 */
public record SolveStatusDto(
    String status,
    int progress,
    long expectedFinishMillis,
    String phase,
    RunError error
) {
    public SolveStatusDto(String status, int progress, long expectedFinishMillis, String phase) {
        this(status, progress, expectedFinishMillis, phase, null);
    }

    // 失敗したランのステータス
    public static SolveStatusDto failed(long finishedMillis, String phase, RunError error) {
        return new SolveStatusDto("FAILED", 100, finishedMillis, phase, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
