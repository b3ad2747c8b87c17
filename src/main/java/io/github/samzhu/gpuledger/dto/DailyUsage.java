package io.github.samzhu.gpuledger.dto;

import io.github.samzhu.gpuledger.document.AggregateMap;

/**
 * 單次批次 (一天的帳務檔) 的聚合結果。
 *
 * @param users 用戶維度
 * @param groups 群組維度
 * @param partitions 分區維度 (僅保留池相關分區)
 * @param exclusions 排除統計
 */
public record DailyUsage(
    AggregateMap users,
    AggregateMap groups,
    AggregateMap partitions,
    ExclusionReport exclusions
) {
    /**
     * @param scope 聚合維度
     * @return 對應維度的聚合表
     */
    public AggregateMap scope(UsageScope scope) {
        return switch (scope) {
            case USER -> users;
            case GROUP -> groups;
            case PARTITION -> partitions;
        };
    }
}
