package io.github.riemr.wave.infrastructure.repository;

import io.github.riemr.wave.application.repository.BaselinePlanSource;
import io.github.riemr.wave.domain.model.Plan;
import io.github.riemr.wave.domain.model.WaveBatch;
import io.github.riemr.wave.optimization.baseline.BaselinePlanGenerator;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 保存済みのベースラインを持たない環境向けに、従来型ヒューリスティックで都度生成する。
 */
@Component
public class HeuristicBaselinePlanSource implements BaselinePlanSource {

    private final BaselinePlanGenerator generator;

    public HeuristicBaselinePlanSource(BaselinePlanGenerator generator) {
        this.generator = generator;
    }

    @Override
    public Optional<Plan> findBaseline(WaveBatch batch, LocalDateTime planStart) {
        if (batch.getOrders().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(generator.generate(batch.getOrders(), batch.getResourcePool(), planStart));
    }
}
