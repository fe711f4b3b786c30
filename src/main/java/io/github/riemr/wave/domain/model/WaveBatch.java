package io.github.riemr.wave.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 同時にリリースされる受注のまとまり（ウェーブ）と、その時点の資源プール。
 */
@Value
@Builder
public class WaveBatch {
    String waveId;
    /** ウェーブのリリース時刻。計画の起点になる。未設定なら実行時刻 */
    LocalDateTime releaseTime;
    @Singular
    List<Order> orders;
    ResourcePool resourcePool;
}
