package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * 受注 1 件の 1 ステージ分の実行計画。時刻はプラン開始からの経過分。
 */
@Value
@Builder
public class StageAssignment {
    String orderId;
    StageType stage;
    long startMinute;
    long durationMinutes;
    /** 直前ステージ終了（PICK はプラン開始）から本ステージ開始までの待ち時間 */
    long waitingMinutes;
    String workerId;
    /** 設備不要ステージでは null */
    String equipmentId;

    public long getEndMinute() {
        return startMinute + durationMinutes;
    }

    public boolean hasEquipment() {
        return equipmentId != null;
    }

    public boolean overlaps(StageAssignment other) {
        return startMinute < other.getEndMinute() && other.startMinute < getEndMinute();
    }
}
