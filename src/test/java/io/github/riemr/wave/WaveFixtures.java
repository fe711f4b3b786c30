package io.github.riemr.wave;

import io.github.riemr.wave.domain.model.Equipment;
import io.github.riemr.wave.domain.model.EquipmentType;
import io.github.riemr.wave.domain.model.Order;
import io.github.riemr.wave.domain.model.ResourcePool;
import io.github.riemr.wave.domain.model.StageType;
import io.github.riemr.wave.domain.model.Worker;
import io.github.riemr.wave.optimization.config.SolveSettings;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * テスト用の受注・資源プールを組み立てる。
 */
public final class WaveFixtures {

    public static final LocalDateTime PLAN_START = LocalDateTime.of(2025, 6, 2, 8, 0);

    private WaveFixtures() {
    }

    /** 4 品目 10 lbs の受注。標準時間では PICK 8 / CONSOLIDATE 2 / PACK 6 / LABEL 6 / STAGE 10 / SHIP 8 分 */
    public static Order order(String id, int priority, int deadlineMinutes) {
        return order(id, priority, deadlineMinutes, 4, 10.0);
    }

    public static Order order(String id, int priority, int deadlineMinutes, int items, double weight) {
        return Order.builder()
                .orderId(id)
                .priority(priority)
                .shippingDeadline(PLAN_START.plusMinutes(deadlineMinutes))
                .itemCount(items)
                .totalWeight(weight)
                .build();
    }

    public static List<Order> orders(int count, int priority, int deadlineMinutes) {
        List<Order> orders = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            orders.add(order(String.format("O%03d", i), priority, deadlineMinutes));
        }
        return orders;
    }

    public static Worker generalist(String id) {
        return worker(id, EnumSet.allOf(StageType.class));
    }

    public static Worker worker(String id, Set<StageType> capabilities) {
        return Worker.builder()
                .workerId(id)
                .name("Worker " + id)
                .capabilities(capabilities)
                .build();
    }

    public static Equipment equipment(String id, EquipmentType type) {
        return Equipment.builder()
                .equipmentId(id)
                .name(type + " " + id)
                .type(type)
                .build();
    }

    /**
     * 全ステージを担当できる作業者と、設備が必要な 3 ステージ分の設備を各 units 台。
     */
    public static ResourcePool generalistPool(int workers, int units) {
        ResourcePool.ResourcePoolBuilder pool = ResourcePool.builder();
        for (int i = 1; i <= workers; i++) {
            pool.worker(generalist("W" + i));
        }
        addEquipment(pool, units, units, units);
        return pool.build();
    }

    public static void addEquipment(ResourcePool.ResourcePoolBuilder pool, int carts, int stations, int doors) {
        for (int i = 1; i <= carts; i++) {
            pool.equipmentUnit(equipment("CART-" + i, EquipmentType.PICK_CART));
        }
        for (int i = 1; i <= stations; i++) {
            pool.equipmentUnit(equipment("PS-" + i, EquipmentType.PACKING_STATION));
        }
        for (int i = 1; i <= doors; i++) {
            pool.equipmentUnit(equipment("DD-" + i, EquipmentType.DOCK_DOOR));
        }
    }

    /** 時間制限に掛からない反復回数制限付きの設定（結果が再現可能） */
    public static SolveSettings iterationBounded(long iterations) {
        return SolveSettings.builder()
                .spentLimit(Duration.ofMinutes(5))
                .iterationLimit(iterations)
                .build();
    }
}
