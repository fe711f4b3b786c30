package io.github.riemr.wave.optimization.search;

import java.time.Duration;

/**
 * 壁時計・キャンセルによる打ち切り判定。決定点ごとに {@link #isExhausted()} を呼ぶ。
 */
public class SearchBudget {

    private final long startNanos;
    private final long limitNanos;
    private final CancellationToken token;
    private long decisions;

    public SearchBudget(Duration spentLimit, CancellationToken token) {
        this.startNanos = System.nanoTime();
        // null は無制限、0 以下は即時打ち切り
        this.limitNanos = spentLimit == null ? Long.MAX_VALUE : Math.max(0, spentLimit.toNanos());
        this.token = token;
    }

    public boolean isExhausted() {
        return token.isCancelled() || System.nanoTime() - startNanos >= limitNanos;
    }

    /** 打ち切り理由。まだ打ち切られていなければ null */
    public TerminationReason exhaustionReason() {
        if (token.isCancelled()) {
            return TerminationReason.CANCELLED;
        }
        if (System.nanoTime() - startNanos >= limitNanos) {
            return TerminationReason.TIME_LIMIT;
        }
        return null;
    }

    public void recordDecision() {
        decisions++;
    }

    public long getDecisions() {
        return decisions;
    }

    public long elapsedMillis() {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
