package io.github.riemr.wave.domain.model;

/**
 * 設備種別。各種別はちょうど 1 つのステージにのみ使用される。
 */
public enum EquipmentType {
    PICK_CART,
    CONVEYOR,
    PACKING_STATION,
    LABEL_PRINTER,
    DOCK_DOOR;

    public StageType servedStage() {
        switch (this) {
            case PICK_CART:
                return StageType.PICK;
            case CONVEYOR:
                return StageType.CONSOLIDATE;
            case PACKING_STATION:
                return StageType.PACK;
            case LABEL_PRINTER:
                return StageType.LABEL;
            case DOCK_DOOR:
                return StageType.SHIP;
            default:
                throw new IllegalStateException("Unknown equipment type: " + this);
        }
    }
}
