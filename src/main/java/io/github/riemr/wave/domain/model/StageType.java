package io.github.riemr.wave.domain.model;

import java.util.Optional;

/**
 * 出荷処理の 6 ステージ。宣言順がそのまま先行関係（ハード制約）になる。
 */
public enum StageType {
    PICK(true),
    CONSOLIDATE(false),
    PACK(true),
    LABEL(false),
    STAGE(false),
    SHIP(true);

    public static final int COUNT = values().length;

    private final boolean requiresEquipment;

    StageType(boolean requiresEquipment) {
        this.requiresEquipment = requiresEquipment;
    }

    public boolean requiresEquipment() {
        return requiresEquipment;
    }

    /** 設備が必要なステージのみ種別を返す */
    public Optional<EquipmentType> requiredEquipmentType() {
        switch (this) {
            case PICK:
                return Optional.of(EquipmentType.PICK_CART);
            case PACK:
                return Optional.of(EquipmentType.PACKING_STATION);
            case SHIP:
                return Optional.of(EquipmentType.DOCK_DOOR);
            default:
                return Optional.empty();
        }
    }

    public boolean isFirst() {
        return this == PICK;
    }

    public boolean isLast() {
        return this == SHIP;
    }

    public StageType previous() {
        if (isFirst()) {
            throw new IllegalStateException("PICK has no previous stage");
        }
        return values()[ordinal() - 1];
    }

    public StageType next() {
        if (isLast()) {
            throw new IllegalStateException("SHIP has no next stage");
        }
        return values()[ordinal() + 1];
    }
}
