package io.github.riemr.wave.optimization.problem;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 受注 × ステージの 1 インスタンス。開始時刻・作業者・設備が決定変数になる。
 */
@Getter
@ToString(of = {"index", "order", "stage", "baseDuration"})
public class StageTask {

    /** 問題内の通し番号（orderIndex * 6 + stage.ordinal） */
    private final int index;
    /** 優先度順に並べた受注列での位置 */
    private final int orderIndex;
    private final Order order;
    private final StageType stage;
    private final int baseDuration;
    private final long deadlineMinute;
    /** 能力を持つ作業者のみ（ID 昇順） */
    private final List<Worker> eligibleWorkers;
    /** ステージ種別に一致する設備のみ（ID 昇順）。設備不要ステージは空 */
    private final List<Equipment> eligibleEquipment;

    StageTask(int orderIndex, Order order, StageType stage, int baseDuration, long deadlineMinute,
              List<Worker> eligibleWorkers, List<Equipment> eligibleEquipment) {
        this.index = orderIndex * StageType.COUNT + stage.ordinal();
        this.orderIndex = orderIndex;
        this.order = order;
        this.stage = stage;
        this.baseDuration = baseDuration;
        this.deadlineMinute = deadlineMinute;
        this.eligibleWorkers = List.copyOf(eligibleWorkers);
        this.eligibleEquipment = List.copyOf(eligibleEquipment);
    }

    public String getOrderId() {
        return order.getOrderId();
    }

    public boolean requiresEquipment() {
        return stage.requiresEquipment();
    }

    /** 作業者の効率係数を反映した所要時間（切り上げ、最小 1 分） */
    public long durationFor(Worker worker) {
        return StageDurationRules.ceilMinutes(baseDuration / worker.getEfficiencyFactor());
    }

    /** 最も効率の良い作業者で処理した場合の所要時間 */
    public long minDuration() {
        return eligibleWorkers.stream().mapToLong(this::durationFor).min().orElse(baseDuration);
    }
}
