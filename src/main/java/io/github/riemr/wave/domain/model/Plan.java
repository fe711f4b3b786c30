package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Stream;

/**
 * ウェーブ全体の実行計画。最適化結果・ベースラインの両方で同じ構造を使う。
 */
@Value
@Builder
public class Plan {
    LocalDateTime planStart;
    @Singular
    List<OrderPlan> orders;

    public boolean isComplete() {
        return orders.stream().allMatch(OrderPlan::isComplete);
    }

    public List<String> getUnscheduledOrderIds() {
        return orders.stream().filter(o -> !o.isComplete()).map(OrderPlan::getOrderId).toList();
    }

    public Stream<StageAssignment> assignments() {
        return orders.stream().flatMap(o -> o.getStages().stream());
    }

    public long getMakespan() {
        return assignments().mapToLong(StageAssignment::getEndMinute).max().orElse(0);
    }

    public LocalDateTime toDateTime(long minuteOffset) {
        return planStart.plusMinutes(minuteOffset);
    }
}
