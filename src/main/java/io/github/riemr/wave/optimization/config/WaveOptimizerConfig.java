package io.github.riemr.wave.optimization.config;

import io.github.riemr.wave.optimization.problem.StageDurationRules;
import io.github.riemr.wave.optimization.score.ObjectiveWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class WaveOptimizerConfig {

    // ラン単位の既定上限（リクエストで上書き可）
    @Value("${wave.optimizer.spent-limit:PT10S}")
    private String spentLimit;
    @Value("${wave.optimizer.iteration-limit:0}")
    private long iterationLimit;
    @Value("${wave.optimizer.unimproved-iteration-limit:2000}")
    private long unimprovedIterationLimit;
    @Value("${wave.optimizer.batch-size-limit:500}")
    private int batchSizeLimit;
    @Value("${wave.optimizer.candidate-limit:3}")
    private int candidateLimit;
    @Value("${wave.optimizer.horizon-minutes:0}")
    private long horizonMinutes;
    @Value("${wave.optimizer.random-seed:42}")
    private long randomSeed;

    // 目的関数の重み（既定は期限遵守を重視）
    @Value("${wave.optimizer.weights.makespan:1.0}")
    private double makespanWeight;
    @Value("${wave.optimizer.weights.tardiness:10.0}")
    private double tardinessWeight;
    @Value("${wave.optimizer.weights.cost:0.1}")
    private double costWeight;
    @Value("${wave.optimizer.weights.idle:0.05}")
    private double idleWeight;
    @Value("${wave.optimizer.weights.unassigned:100000}")
    private double unassignedWeight;

    // 標準作業時間（分）
    @Value("${wave.optimizer.standard-times.pick-per-item:2.0}")
    private double pickMinutesPerItem;
    @Value("${wave.optimizer.standard-times.consolidate-per-item:0.5}")
    private double consolidateMinutesPerItem;
    @Value("${wave.optimizer.standard-times.pack-per-item:1.5}")
    private double packMinutesPerItem;
    @Value("${wave.optimizer.standard-times.label-per-order:5.0}")
    private double labelMinutesPerOrder;
    @Value("${wave.optimizer.standard-times.stage-per-order:10.0}")
    private double stageMinutesPerOrder;
    @Value("${wave.optimizer.standard-times.ship-per-order:8.0}")
    private double shipMinutesPerOrder;

    // 並列ラン数
    @Value("${wave.optimizer.run-threads:2}")
    private int runThreads;

    @Bean
    public SolveSettings defaultSolveSettings() {
        SolveSettings settings = SolveSettings.builder()
                .spentLimit(parseDurationTolerant(spentLimit, Duration.ofSeconds(10)))
                .iterationLimit(iterationLimit)
                .unimprovedIterationLimit(unimprovedIterationLimit)
                .batchSizeLimit(batchSizeLimit)
                .candidateLimit(candidateLimit)
                .horizonMinutes(horizonMinutes)
                .randomSeed(randomSeed)
                .weights(ObjectiveWeights.builder()
                        .makespan(makespanWeight)
                        .tardiness(tardinessWeight)
                        .cost(costWeight)
                        .idle(idleWeight)
                        .unassigned(unassignedWeight)
                        .build())
                .build();
        log.info("Default solve settings: {}", settings);
        return settings;
    }

    @Bean
    public StageDurationRules stageDurationRules() {
        return StageDurationRules.builder()
                .pickMinutesPerItem(pickMinutesPerItem)
                .consolidateMinutesPerItem(consolidateMinutesPerItem)
                .packMinutesPerItem(packMinutesPerItem)
                .labelMinutesPerOrder(labelMinutesPerOrder)
                .stageMinutesPerOrder(stageMinutesPerOrder)
                .shipMinutesPerOrder(shipMinutesPerOrder)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService waveRunExecutor() {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "wave-run-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, runThreads), factory);
    }

    /**
     * ISO-8601（PT10S）に加え、10s / 500ms / 2m / 1h / 秒数のみ の表記を受け付ける。
     * 解釈できない値は既定値に戻す。
     */
    static Duration parseDurationTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        try {
            if (s.startsWith("P")) {
                if (s.matches("^PT\\d+$")) s = s + "S"; // よくある書き間違い
                return Duration.parse(s);
            }
            String ls = s.toLowerCase();
            if (ls.endsWith("ms")) return Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2)));
            if (ls.endsWith("s")) return Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("m")) return Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("h")) return Duration.ofHours(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.matches("^\\d+$")) return Duration.ofSeconds(Long.parseLong(ls));
        } catch (RuntimeException e) {
            log.warn("Invalid duration '{}', falling back to {}: {}", raw, def, e.getMessage());
            return def;
        }
        log.warn("Unrecognized duration '{}', falling back to {}", raw, def);
        return def;
    }
}
