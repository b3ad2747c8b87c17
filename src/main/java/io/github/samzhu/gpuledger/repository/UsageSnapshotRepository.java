package io.github.samzhu.gpuledger.repository;

import io.github.samzhu.gpuledger.document.AggregateMap;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot;
import io.github.samzhu.gpuledger.dto.UsageScope;

/**
 * 日用量與累計快照的存取介面。
 *
 * <p>每個維度各有兩份資料：
 * <ul>
 *   <li>日用量 - 最近一次批次的結果，每次批次覆寫</li>
 *   <li>累計快照 - 所有批次的總和，含穩定的 index</li>
 * </ul>
 *
 * <p>寫入必須是原子性的替換，讀取端 (指標服務) 不可讀到寫到一半的內容。
 * 同一份快照只允許單一寫入者，並行批次需由外部排程器序列化。
 *
 * @see FileUsageSnapshotRepository
 */
public interface UsageSnapshotRepository {

    /**
     * @return 最近一次的日用量，不存在時為空表
     */
    AggregateMap findDaily(UsageScope scope);

    void saveDaily(UsageScope scope, AggregateMap usage);

    /**
     * @return 累計快照，不存在時為空快照 (首次執行)
     */
    CumulativeSnapshot findCumulative(UsageScope scope);

    void saveCumulative(UsageScope scope, CumulativeSnapshot snapshot);
}
