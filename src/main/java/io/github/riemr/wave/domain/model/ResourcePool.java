package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 1 回のソルブで使用する作業者・設備のスナップショット。
 */
@Value
@Builder(toBuilder = true)
public class ResourcePool {
    @Singular
    List<Worker> workers;
    @Singular("equipmentUnit")
    List<Equipment> equipment;

    /** ステージを担当できる作業者（ID 昇順） */
    public List<Worker> workersFor(StageType stage) {
        return workers.stream()
                .filter(w -> w.canPerform(stage))
                .sorted(Comparator.comparing(Worker::getWorkerId))
                .toList();
    }

    /** ステージに対応する設備（ID 昇順）。設備不要ステージは空 */
    public List<Equipment> equipmentFor(StageType stage) {
        return equipment.stream()
                .filter(e -> e.serves(stage))
                .sorted(Comparator.comparing(Equipment::getEquipmentId))
                .toList();
    }

    public Optional<Worker> findWorker(String workerId) {
        return workers.stream().filter(w -> w.getWorkerId().equals(workerId)).findFirst();
    }

    public Optional<Equipment> findEquipment(String equipmentId) {
        return equipment.stream().filter(e -> e.getEquipmentId().equals(equipmentId)).findFirst();
    }
}
