package io.github.riemr.wave.optimization.search;

import io.github.riemr.wave.application.dto.ScorePoint;

/**
 * 暫定解が改善するたびに呼ばれる。結果には影響しない。
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = point -> { };

    void onImprovement(ScorePoint point);
}
