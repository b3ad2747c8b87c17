package io.github.samzhu.gpuledger.document;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.github.samzhu.gpuledger.dto.UsageTriple;

/**
 * 單一維度 (用戶 / 群組 / 分區) 的用量聚合表。
 *
 * <p>key 為實體名稱，value 為 {@link UsageTriple}。合併規則：
 * <ul>
 *   <li>key 不存在 → 新增</li>
 *   <li>key 已存在 → 逐欄相加</li>
 * </ul>
 *
 * <p>總量與合併順序無關 (僅浮點加法順序可能造成極小差異)。
 * 迭代順序為 key 首次出現的順序，用於決定新實體的 index 編號。
 *
 * <p>非執行緒安全，每次批次執行各自擁有。
 */
public final class AggregateMap {

    private final Map<String, UsageTriple> entries = new LinkedHashMap<>();

    /**
     * 合併單一 key 的用量。
     *
     * @param key 實體名稱
     * @param usage 要加入的用量
     */
    public void merge(String key, UsageTriple usage) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(usage, "usage");
        entries.merge(key, usage, UsageTriple::plus);
    }

    /**
     * 將另一個聚合表的所有 key 合併進來。
     *
     * @param other 另一個聚合表
     * @return this，方便串接
     */
    public AggregateMap mergeAll(AggregateMap other) {
        other.entries.forEach(this::merge);
        return this;
    }

    /**
     * 建立兩個聚合表合併後的新表，不修改輸入。
     */
    public static AggregateMap combine(AggregateMap first, AggregateMap second) {
        return new AggregateMap().mergeAll(first).mergeAll(second);
    }

    /**
     * @return 指定 key 的用量，不存在時為 {@link UsageTriple#ZERO}
     */
    public UsageTriple get(String key) {
        return entries.getOrDefault(key, UsageTriple.ZERO);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, UsageTriple> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 依加權 GPU hours 由大到小排序，相同時依名稱排序。
     *
     * @return 排序後的項目
     */
    public List<Map.Entry<String, UsageTriple>> sortedByWeightedHoursDesc() {
        return entries.entrySet().stream()
            .sorted(Comparator
                .comparingDouble((Map.Entry<String, UsageTriple> e) -> e.getValue().weightedGpuHours())
                .reversed()
                .thenComparing(Map.Entry::getKey))
            .map(e -> Map.entry(e.getKey(), e.getValue()))
            .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AggregateMap other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "AggregateMap" + entries;
    }
}
