package io.github.riemr.wave;

import io.github.riemr.wave.application.dto.OptimizationResult;
import io.github.riemr.wave.application.repository.WaveBatchRepository;
import io.github.riemr.wave.domain.model.WaveBatch;
import io.github.riemr.wave.optimization.config.SolveSettings;
import io.github.riemr.wave.optimization.service.WaveOptimizationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "wave.optimizer.spent-limit=5s",
        "wave.optimizer.iteration-limit=20"
})
class WaveOptimizerApplicationTests {

    @Autowired
    WaveOptimizationService service;

    @Autowired
    WaveBatchRepository repository;

    @Autowired
    SolveSettings defaultSolveSettings;

    @AfterEach
    void cleanup() {
        repository.delete("W-IT");
    }

    @Test
    void contextLoads_withConfiguredDefaults() {
        assertThat(defaultSolveSettings.getSpentLimit()).isEqualTo(Duration.ofSeconds(5));
        assertThat(defaultSolveSettings.getIterationLimit()).isEqualTo(20);
        assertThat(defaultSolveSettings.getWeights().getTardiness()).isEqualTo(10.0);
    }

    @Test
    void optimizeWave_comparesAgainstGeneratedBaseline() {
        repository.save(WaveBatch.builder()
                .waveId("W-IT")
                .releaseTime(WaveFixtures.PLAN_START)
                .orders(WaveFixtures.orders(6, 3, 180))
                .resourcePool(WaveFixtures.generalistPool(3, 2))
                .build());

        OptimizationResult result = service.optimizeWave("W-IT", null);

        assertThat(repository.listWaveIds()).contains("W-IT");
        assertThat(result.isComplete()).isTrue();
        assertThat(result.comparison()).isPresent();
        assertThat(result.getBaselineBreakdown().getOrderCount()).isEqualTo(6);
    }
}
