package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Value
@Builder
public class OrderPlan {
    String orderId;
    int priority;
    LocalDateTime shippingDeadline;
    /** 出荷期限（プラン開始からの分）。既に過ぎていれば負 */
    long deadlineMinute;
    /** ステージ順。部分解では途中までしか含まれない */
    @Singular
    List<StageAssignment> stages;

    public boolean isComplete() {
        return stages.size() == StageType.COUNT;
    }

    public Optional<StageAssignment> stage(StageType type) {
        return stages.stream().filter(s -> s.getStage() == type).findFirst();
    }

    public long getTotalProcessingTime() {
        return stages.stream().mapToLong(StageAssignment::getDurationMinutes).sum();
    }

    public long getTotalWaitingTime() {
        return stages.stream().mapToLong(StageAssignment::getWaitingMinutes).sum();
    }

    /** 完了時刻（= 処理時間 + 待ち時間の合計） */
    public long getTotalTime() {
        return stages.isEmpty() ? 0 : stages.get(stages.size() - 1).getEndMinute();
    }

    /** SHIP まで計画済みの場合のみ遅延分を返す */
    public long getTardiness() {
        if (!isComplete()) {
            return 0;
        }
        return Math.max(0, getTotalTime() - deadlineMinute);
    }

    public boolean isTardy() {
        return getTardiness() > 0;
    }
}
