package io.github.samzhu.gpuledger.dto;

import java.util.Map;

import io.github.samzhu.gpuledger.document.CumulativeSnapshot;

/**
 * 每日結算結果。
 *
 * @param daily 本次批次的日用量
 * @param cumulative 合併後的各維度累計快照
 */
public record RollupResult(
    DailyUsage daily,
    Map<UsageScope, CumulativeSnapshot> cumulative
) {
    public RollupResult {
        cumulative = Map.copyOf(cumulative);
    }
}
