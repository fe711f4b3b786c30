package io.github.riemr.wave.optimization.constraint;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 作業者または設備 1 台分の占有区間 [start, end)。区間同士は重ならない。
 * 空き時間の探索と、次に空く時刻のインデックスを兼ねる。
 */
public class ResourceTimeline {

    private final String resourceId;
    private final NavigableMap<Long, Long> intervals = new TreeMap<>();
    private long busyMinutes;

    public ResourceTimeline(String resourceId) {
        this.resourceId = resourceId;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    /** [start, end) が既存区間と重ならなければ true */
    public boolean isFree(long start, long end) {
        Map.Entry<Long, Long> before = intervals.lowerEntry(end);
        return before == null || before.getValue() <= start;
    }

    /** from 以降で duration 分連続して空いている最も早い開始時刻 */
    public long earliestFit(long from, long duration) {
        long candidate = from;
        Map.Entry<Long, Long> floor = intervals.floorEntry(from);
        Long cursor = floor == null ? intervals.ceilingKey(from) : floor.getKey();
        while (cursor != null) {
            long end = intervals.get(cursor);
            if (end > candidate) {
                if (cursor >= candidate + duration) {
                    return candidate;
                }
                candidate = end;
            }
            cursor = intervals.higherKey(cursor);
        }
        return candidate;
    }

    public void occupy(long start, long end) {
        if (end <= start) {
            throw new IllegalArgumentException("empty interval [" + start + ", " + end + ") on " + resourceId);
        }
        if (!isFree(start, end)) {
            throw new IllegalStateException("interval [" + start + ", " + end + ") overlaps on " + resourceId);
        }
        intervals.put(start, end);
        busyMinutes += end - start;
    }

    public void release(long start, long end) {
        Long stored = intervals.get(start);
        if (stored == null || stored != end) {
            throw new IllegalStateException("interval [" + start + ", " + end + ") is not held by " + resourceId);
        }
        intervals.remove(start);
        busyMinutes -= end - start;
    }

    /** 最後の区間の終了時刻。未使用なら 0 */
    public long nextFreeTime() {
        return intervals.isEmpty() ? 0 : intervals.lastEntry().getValue();
    }

    public long getBusyMinutes() {
        return busyMinutes;
    }

    /** 最初の開始から最後の終了までのうち、占有されていない時間 */
    public long idleMinutes() {
        if (intervals.isEmpty()) {
            return 0;
        }
        return intervals.lastEntry().getValue() - intervals.firstKey() - busyMinutes;
    }

    /**
     * 区間 [start, end) を追加した場合の idle 時間の増減。
     * 空き区間の内側に収まる場合は負になる。
     */
    public long idleDelta(long start, long end) {
        if (intervals.isEmpty()) {
            return 0;
        }
        long first = intervals.firstKey();
        long last = intervals.lastEntry().getValue();
        if (start >= last) {
            return start - last;
        }
        if (end <= first) {
            return first - end;
        }
        return -(end - start);
    }
}
