package io.github.riemr.wave.optimization.solution;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.problem.StageTask;
import lombok.Value;

/**
 * 1 タスクへの決定変数の束縛（開始時刻・作業者・設備）。
 */
@Value
public class Binding {
    StageTask task;
    Worker worker;
    /** 設備不要ステージでは null */
    Equipment equipment;
    long start;
    long duration;
    /** 直前ステージ終了から開始までの待ち */
    long waiting;

    public long getEnd() {
        return start + duration;
    }

    public String getWorkerId() {
        return worker.getWorkerId();
    }

    public String getEquipmentId() {
        return equipment == null ? null : equipment.getEquipmentId();
    }
}
