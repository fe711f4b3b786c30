package io.github.riemr.wave.optimization.search;

public enum SearchState {
    UNASSIGNED,
    PARTIALLY_ASSIGNED,
    /** 全タスクがハード制約を満たして割当済み */
    COMPLETE_FEASIBLE,
    /** 予算内に完全な割当が得られなかった。最良の部分解を返す */
    COMPLETE_WITHIN_BOUND
}
