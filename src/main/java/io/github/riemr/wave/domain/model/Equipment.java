package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Equipment {
    String equipmentId;
    String name;
    EquipmentType type;
    @Builder.Default
    double hourlyCost = 0.0;

    /** 設備が必要なステージで、かつ種別が一致する場合のみ true */
    public boolean serves(StageType stage) {
        return type != null && stage.requiredEquipmentType().map(type::equals).orElse(false);
    }
}
