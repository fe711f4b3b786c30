package io.github.riemr.wave.optimization.problem;

import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.StageType;
import lombok.Builder;
import lombok.Value;

/**
 * ステージ別の基準所要時間（分）。最適化側が達成可能とみなす最良値で、
 * ベースライン計画の水増し時間とは独立している。
 */
@Value
@Builder(toBuilder = true)
public class StageDurationRules {
    @Builder.Default
    double pickMinutesPerItem = 2.0;
    @Builder.Default
    double consolidateMinutesPerItem = 0.5;
    @Builder.Default
    int consolidateItemThreshold = 5;
    @Builder.Default
    double consolidateExtraMinutesPerItem = 0.2;
    @Builder.Default
    double packMinutesPerItem = 1.5;
    @Builder.Default
    double labelMinutesPerOrder = 5.0;
    @Builder.Default
    int labelItemThreshold = 3;
    @Builder.Default
    double labelExtraMinutesPerItem = 0.5;
    @Builder.Default
    double stageMinutesPerOrder = 10.0;
    @Builder.Default
    double stageHeavyExtraMinutes = 5.0;
    @Builder.Default
    double shipMinutesPerOrder = 8.0;

    // 重量・優先度による補正
    @Builder.Default
    double heavyPickWeightLbs = 20.0;
    @Builder.Default
    double heavyPickFactor = 1.2;
    @Builder.Default
    double heavyPackWeightLbs = 15.0;
    @Builder.Default
    double heavyPackFactor = 1.15;
    @Builder.Default
    double heavyStageWeightLbs = 25.0;
    @Builder.Default
    double expressPickFactor = 0.9;
    @Builder.Default
    double expressShipFactor = 0.8;

    public static StageDurationRules defaults() {
        return StageDurationRules.builder().build();
    }

    /**
     * 受注属性から基準所要時間を求める。切り上げ、最小 1 分。
     */
    public int baseDuration(Order order, StageType stage) {
        double minutes;
        switch (stage) {
            case PICK:
                minutes = order.getPickTimeMinutes() > 0
                        ? order.getPickTimeMinutes()
                        : order.getItemCount() * pickMinutesPerItem;
                // 歩行時間は補正の前に足す
                minutes += order.getWalkingTimeMinutes();
                if (order.getTotalWeight() > heavyPickWeightLbs) {
                    minutes *= heavyPickFactor;
                }
                if (order.isHighPriority()) {
                    minutes *= expressPickFactor;
                }
                break;
            case CONSOLIDATE:
                minutes = order.getItemCount() * consolidateMinutesPerItem;
                if (order.getItemCount() > consolidateItemThreshold) {
                    minutes += (order.getItemCount() - consolidateItemThreshold) * consolidateExtraMinutesPerItem;
                }
                break;
            case PACK:
                minutes = order.getPackTimeMinutes() > 0
                        ? order.getPackTimeMinutes()
                        : order.getItemCount() * packMinutesPerItem;
                if (order.getTotalWeight() > heavyPackWeightLbs) {
                    minutes *= heavyPackFactor;
                }
                break;
            case LABEL:
                minutes = labelMinutesPerOrder;
                if (order.getItemCount() > labelItemThreshold) {
                    minutes += (order.getItemCount() - labelItemThreshold) * labelExtraMinutesPerItem;
                }
                break;
            case STAGE:
                minutes = stageMinutesPerOrder;
                if (order.getTotalWeight() > heavyStageWeightLbs) {
                    minutes += stageHeavyExtraMinutes;
                }
                break;
            case SHIP:
                minutes = shipMinutesPerOrder;
                if (order.isHighPriority()) {
                    minutes *= expressShipFactor;
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown stage: " + stage);
        }
        return ceilMinutes(minutes);
    }

    static int ceilMinutes(double minutes) {
        // 浮動小数の誤差で 1 分繰り上がらないように丸める
        int rounded = (int) Math.ceil(minutes - 1e-9);
        return Math.max(1, rounded);
    }
}
