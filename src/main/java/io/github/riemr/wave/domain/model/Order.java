package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 最適化対象の受注。ソルブ中は読み取り専用。
 */
@Value
@Builder(toBuilder = true)
public class Order {
    String orderId;
    /** 1 = 最優先 … 5 = 最低 */
    Integer priority;
    LocalDateTime shippingDeadline;
    int itemCount;
    /** lbs */
    double totalWeight;
    /** 既存のピッキング時間見積り（分）。0 は不明 */
    double pickTimeMinutes;
    /** 既存の梱包時間見積り（分）。0 は不明 */
    double packTimeMinutes;
    /** ロケーション間の歩行時間の合計（分）。ピッキング時間に加算する */
    double walkingTimeMinutes;

    public boolean isHighPriority() {
        return priority != null && priority <= 2;
    }
}
