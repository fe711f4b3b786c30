package io.github.riemr.wave.application.dto;

import java.time.Instant;

/**
 * 非同期ランの制御チケット。状態照会・結果取得・キャンセルに使う。
 */
public record RunTicket(String ticketId, String waveId, Instant startedAt) {
}
