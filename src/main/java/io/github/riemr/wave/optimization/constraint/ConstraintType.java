package io.github.riemr.wave.optimization.constraint;

public enum ConstraintType {
    /** 同一受注の前ステージ終了前に開始してはならない */
    PRECEDENCE,
    WORKER_OVERLAP,
    EQUIPMENT_OVERLAP,
    /** 作業者がステージの能力を持たない */
    WORKER_CAPABILITY,
    /** 設備必須ステージに設備がない */
    EQUIPMENT_REQUIRED,
    /** 設備種別がステージと一致しない、または設備不要ステージに設備がある */
    EQUIPMENT_TYPE,
    /** 計画ホライズンを超える */
    HORIZON
}
