package io.github.riemr.wave.optimization.score;

import io.github.riemr.wave.domain.model.StageAssignment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;

/**
 * 作業者または設備 1 台分のスケジュールと稼働状況。計画の割当から算術的に求める。
 * 重なりのある計画（ベースライン）でも占有時間は和集合で数える。
 */
@Value
@Builder
public class ResourceUsage {

    public enum Kind {
        WORKER,
        EQUIPMENT
    }

    String resourceId;
    Kind kind;
    /** 開始時刻順 */
    @Singular
    List<StageAssignment> assignments;
    long busyMinutes;
    /** 最初の開始。割当がなければ 0 */
    long firstStartMinute;
    /** 最後の終了。割当がなければ 0 */
    long lastEndMinute;
    /** 計画全体（0 から makespan まで）に対する占有率 (%) */
    double utilizationPercent;

    public long getSpanMinutes() {
        return lastEndMinute - firstStartMinute;
    }

    /** 最初の開始から最後の終了までのうち、占有されていない時間 */
    public long getIdleMinutes() {
        return getSpanMinutes() - busyMinutes;
    }

    public boolean isUsed() {
        return !assignments.isEmpty();
    }

    static ResourceUsage of(String resourceId, Kind kind, List<StageAssignment> assignments, long makespan) {
        List<StageAssignment> sorted = assignments.stream()
                .sorted(Comparator.comparingLong(StageAssignment::getStartMinute)
                        .thenComparingLong(StageAssignment::getEndMinute))
                .toList();
        long busy = 0;
        long first = 0;
        long last = 0;
        if (!sorted.isEmpty()) {
            first = sorted.get(0).getStartMinute();
            long cursor = first;
            for (StageAssignment a : sorted) {
                long from = Math.max(cursor, a.getStartMinute());
                if (a.getEndMinute() > from) {
                    busy += a.getEndMinute() - from;
                }
                cursor = Math.max(cursor, a.getEndMinute());
            }
            last = cursor;
        }
        return ResourceUsage.builder()
                .resourceId(resourceId)
                .kind(kind)
                .assignments(sorted)
                .busyMinutes(busy)
                .firstStartMinute(first)
                .lastEndMinute(last)
                .utilizationPercent(makespan == 0 ? 0 : busy * 100.0 / makespan)
                .build();
    }
}
