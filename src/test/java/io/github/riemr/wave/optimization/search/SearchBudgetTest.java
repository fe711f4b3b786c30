package io.github.riemr.wave.optimization.search;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SearchBudgetTest {

    @Test
    void nullLimit_isNeverExhaustedUntilCancelled() {
        CancellationToken token = new CancellationToken();
        SearchBudget budget = new SearchBudget(null, token);

        assertThat(budget.isExhausted()).isFalse();
        assertThat(budget.exhaustionReason()).isNull();

        token.cancel();

        assertThat(budget.isExhausted()).isTrue();
        assertThat(budget.exhaustionReason()).isEqualTo(TerminationReason.CANCELLED);
    }

    @Test
    void zeroOrNegativeLimit_isExhaustedImmediately() {
        assertThat(new SearchBudget(Duration.ZERO, CancellationToken.none()).exhaustionReason())
                .isEqualTo(TerminationReason.TIME_LIMIT);
        assertThat(new SearchBudget(Duration.ofSeconds(-1), CancellationToken.none()).isExhausted()).isTrue();
    }

    @Test
    void cancellation_takesPrecedenceOverTimeLimit() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThat(new SearchBudget(Duration.ZERO, token).exhaustionReason()).isEqualTo(TerminationReason.CANCELLED);
    }

    @Test
    void recordDecision_counts() {
        SearchBudget budget = new SearchBudget(Duration.ofMinutes(1), CancellationToken.none());
        budget.recordDecision();
        budget.recordDecision();

        assertThat(budget.getDecisions()).isEqualTo(2);
        assertThat(TerminationReason.CONVERGED.isTimeBounded()).isFalse();
    }
}
