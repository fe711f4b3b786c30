package io.github.riemr.wave.optimization.search;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 外部からのキャンセル要求。探索は決定点ごとに確認する。
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
