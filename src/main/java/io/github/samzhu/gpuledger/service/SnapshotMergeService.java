package io.github.samzhu.gpuledger.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gpuledger.document.AggregateMap;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot.Entry;
import io.github.samzhu.gpuledger.dto.DailyUsage;
import io.github.samzhu.gpuledger.dto.UsageScope;
import io.github.samzhu.gpuledger.dto.UsageTriple;

/**
 * 累計快照合併服務。
 *
 * <p>將新的日用量併入既有的累計快照，各維度獨立處理：
 * <ul>
 *   <li>key 集合 = 舊快照 ∪ 新用量</li>
 *   <li>用量 = 舊值 (無則為 0) + 新值 (無則為 0)</li>
 *   <li>舊快照的實體保留原 index，依 index 順序輸出</li>
 *   <li>新實體依新用量的迭代順序，從舊快照最大 index + 1 開始配發</li>
 * </ul>
 *
 * <p>因此 {@code merge(merge(S, A), B)} 與 {@code merge(S, A ∪ B)} 的用量相同 (浮點誤差內)、
 * index 也相同，且 {@code merge(S, 空)} 等於 S。
 */
@Service
public class SnapshotMergeService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotMergeService.class);

    /**
     * 合併單一維度。
     *
     * @param previous 既有累計快照
     * @param fresh 新的用量
     * @return 合併後的新快照
     */
    public CumulativeSnapshot merge(CumulativeSnapshot previous, AggregateMap fresh) {
        List<Entry> merged = new ArrayList<>(previous.size() + fresh.size());

        for (Entry entry : previous.entries()) {
            UsageTriple usage = fresh.contains(entry.name())
                ? entry.usage().plus(fresh.get(entry.name()))
                : entry.usage();
            merged.add(new Entry(entry.name(), entry.index(), usage));
        }

        int nextIndex = previous.nextIndex();
        int added = 0;
        for (Map.Entry<String, UsageTriple> entry : fresh.asMap().entrySet()) {
            if (previous.find(entry.getKey()).isEmpty()) {
                merged.add(new Entry(entry.getKey(), nextIndex++, entry.getValue()));
                added++;
            }
        }

        log.debug("Merged snapshot: {} existing entities, {} new entities", previous.size(), added);
        return new CumulativeSnapshot(merged);
    }

    /**
     * 合併所有維度。
     *
     * @param previous 各維度的既有累計快照，缺少的維度視為空快照
     * @param daily 本次批次的日用量
     * @return 各維度合併後的快照
     */
    public Map<UsageScope, CumulativeSnapshot> mergeAll(Map<UsageScope, CumulativeSnapshot> previous, DailyUsage daily) {
        Map<UsageScope, CumulativeSnapshot> result = new EnumMap<>(UsageScope.class);
        for (UsageScope scope : UsageScope.values()) {
            CumulativeSnapshot base = previous.getOrDefault(scope, CumulativeSnapshot.empty());
            CumulativeSnapshot merged = merge(base, daily.scope(scope));
            log.info("Cumulative {} snapshot: {} -> {} entities", scope, base.size(), merged.size());
            result.put(scope, merged);
        }
        return result;
    }
}
