package io.github.riemr.wave.optimization.solution;

import io.github.riemr.wave.optimization.problem.StageTask;
import io.github.riemr.wave.optimization.problem.WaveProblem;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * 探索が生成した束縛のスナップショット（不変）。未割当タスクは空。
 */
public final class Assignment {

    @Getter
    private final WaveProblem problem;
    private final Binding[] bindings;
    @Getter
    private final int assignedCount;

    public Assignment(WaveProblem problem, Binding[] bindings) {
        if (bindings.length != problem.getTaskCount()) {
            throw new IllegalArgumentException("expected " + problem.getTaskCount() + " slots but got " + bindings.length);
        }
        this.problem = problem;
        this.bindings = bindings.clone();
        this.assignedCount = (int) Arrays.stream(bindings).filter(Objects::nonNull).count();
    }

    public static Assignment empty(WaveProblem problem) {
        return new Assignment(problem, new Binding[problem.getTaskCount()]);
    }

    public Optional<Binding> binding(StageTask task) {
        return Optional.ofNullable(bindings[task.getIndex()]);
    }

    public int getUnassignedCount() {
        return bindings.length - assignedCount;
    }

    public boolean isComplete() {
        return assignedCount == bindings.length;
    }

    public boolean isEmpty() {
        return assignedCount == 0;
    }
}
