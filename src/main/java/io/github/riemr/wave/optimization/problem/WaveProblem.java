package io.github.riemr.wave.optimization.problem;

import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageType;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 1 回のソルブに対する問題インスタンス。構築後は不変で、複数の探索から共有してよい。
 */
@Getter
public class WaveProblem {

    private final LocalDateTime planStart;
    /** 優先度 → 期限 → 受注 ID の昇順 */
    private final List<Order> orders;
    private final ResourcePool resourcePool;
    /** 受注順 × ステージ順 */
    private final List<StageTask> tasks;

    WaveProblem(LocalDateTime planStart, List<Order> orders, ResourcePool resourcePool, List<StageTask> tasks) {
        this.planStart = planStart;
        this.orders = List.copyOf(orders);
        this.resourcePool = resourcePool;
        this.tasks = List.copyOf(tasks);
    }

    public int getOrderCount() {
        return orders.size();
    }

    public int getTaskCount() {
        return tasks.size();
    }

    public StageTask task(int orderIndex, StageType stage) {
        return tasks.get(orderIndex * StageType.COUNT + stage.ordinal());
    }

    public List<StageTask> tasksOf(int orderIndex) {
        int from = orderIndex * StageType.COUNT;
        return tasks.subList(from, from + StageType.COUNT);
    }

    /** 同一受注の直前ステージ。PICK なら null */
    public StageTask predecessor(StageTask task) {
        return task.getStage().isFirst() ? null : task(task.getOrderIndex(), task.getStage().previous());
    }

    /** 後続ステージの最短所要時間合計（この task 自身は含まない） */
    public long remainingMinDuration(StageTask task) {
        long sum = 0;
        for (StageTask t : tasksOf(task.getOrderIndex())) {
            if (t.getStage().ordinal() > task.getStage().ordinal()) {
                sum += t.minDuration();
            }
        }
        return sum;
    }

    /** 受注のクリティカルパス長（全ステージ最短所要時間の合計） */
    public long criticalPath(int orderIndex) {
        return tasksOf(orderIndex).stream().mapToLong(StageTask::minDuration).sum();
    }
}
