package io.github.riemr.wave.optimization.exception;

import java.util.List;

public class InvalidInputException extends WaveOptimizationException {

    private final List<String> violations;

    public InvalidInputException(List<String> violations) {
        super("Invalid optimization input: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidInputException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.INVALID_INPUT;
    }
}
