package io.github.riemr.wave.optimization.score;

import io.github.riemr.wave.domain.model.StageType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 計画 1 件の目的関数内訳と要約。
 */
@Value
@Builder
public class ScoreBreakdown {
    long makespan;
    long totalTardiness;
    /** 人件費 + 設備費 */
    double cost;
    long idleResourceTime;
    /** 計画に現れないタスク数（受注ごとの欠けたステージ数の合計） */
    int unassignedTaskCount;
    /** 重み付き和 + 未割当罰則 */
    double objective;

    int orderCount;
    int tardyOrderCount;
    long totalProcessingTime;
    long totalWaitingTime;
    /** 受注ごとの完了時刻の合計 */
    long totalTime;

    Map<StageType, Long> stageDurations;
    Map<StageType, Long> stageWaitingTimes;
    Map<StageType, Double> stageMeanWaitingTimes;
    /** 平均待ち時間が最大のステージ。待ちが全くなければ null */
    StageType bottleneckStage;

    /** 作業者ごとのスケジュールと稼働率（ID 順） */
    List<ResourceUsage> workerUsage;
    /** 設備ごとのスケジュールと稼働率（ID 順） */
    List<ResourceUsage> equipmentUsage;

    public Optional<StageType> bottleneck() {
        return Optional.ofNullable(bottleneckStage);
    }

    public Optional<ResourceUsage> usageOf(String resourceId) {
        return Stream.concat(stream(workerUsage), stream(equipmentUsage))
                .filter(u -> u.getResourceId().equals(resourceId))
                .findFirst();
    }

    /** 割当のある資源の平均稼働率 (%) */
    public double getAverageWorkerUtilization() {
        return stream(workerUsage).filter(ResourceUsage::isUsed)
                .mapToDouble(ResourceUsage::getUtilizationPercent)
                .average()
                .orElse(0);
    }

    private static Stream<ResourceUsage> stream(List<ResourceUsage> usage) {
        return usage == null ? Stream.empty() : usage.stream();
    }

    public double getAverageTotalTime() {
        return orderCount == 0 ? 0 : (double) totalTime / orderCount;
    }
}
