package io.github.samzhu.gpuledger.document;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import io.github.samzhu.gpuledger.dto.UsageTriple;

/**
 * 單一維度的累計用量快照。
 *
 * <p>記錄所有已處理批次的用量總和，並為每個實體保留穩定的 index：
 * <ul>
 *   <li>index 在實體首次出現時配發，從 1 開始遞增</li>
 *   <li>同一快照生命週期內，index 不會改配給其他實體</li>
 *   <li>指標輸出以 {@code (name_id, index)} 作為 label，index 穩定才能跨 scrape 對齊</li>
 * </ul>
 *
 * <p>此物件不可變，合併由 {@link io.github.samzhu.gpuledger.service.SnapshotMergeService} 產生新快照。
 *
 * @see io.github.samzhu.gpuledger.repository.UsageSnapshotRepository
 */
public final class CumulativeSnapshot {

    private static final CumulativeSnapshot EMPTY = new CumulativeSnapshot(List.of());

    private final Map<String, Entry> entries;

    /**
     * @param entries 快照項目，名稱與 index 皆不可重複
     * @throws IllegalArgumentException 若名稱或 index 重複，或 index 小於 1
     */
    public CumulativeSnapshot(Collection<Entry> entries) {
        Set<Integer> indices = new HashSet<>();
        Map<String, Entry> byName = new LinkedHashMap<>();
        entries.stream()
            .sorted(Comparator.comparingInt(Entry::index))
            .forEach(entry -> {
                if (entry.index() < 1) {
                    throw new IllegalArgumentException("Index must be positive: " + entry);
                }
                if (!indices.add(entry.index())) {
                    throw new IllegalArgumentException("Duplicate index " + entry.index() + " for " + entry.name());
                }
                if (byName.putIfAbsent(entry.name(), entry) != null) {
                    throw new IllegalArgumentException("Duplicate entity name: " + entry.name());
                }
            });
        this.entries = byName;
    }

    public static CumulativeSnapshot empty() {
        return EMPTY;
    }

    /**
     * @return 依 index 由小到大排列的項目
     */
    public List<Entry> entries() {
        return List.copyOf(entries.values());
    }

    public Optional<Entry> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public OptionalInt indexOf(String name) {
        Entry entry = entries.get(name);
        return entry == null ? OptionalInt.empty() : OptionalInt.of(entry.index());
    }

    /**
     * @return 下一個可配發的 index (目前最大值 + 1)
     */
    public int nextIndex() {
        return entries.values().stream().mapToInt(Entry::index).max().orElse(0) + 1;
    }

    /**
     * @return 依 index 順序轉成聚合表
     */
    public AggregateMap usage() {
        AggregateMap map = new AggregateMap();
        entries.values().forEach(entry -> map.merge(entry.name(), entry.usage()));
        return map;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CumulativeSnapshot other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "CumulativeSnapshot" + entries.values();
    }

    /**
     * 快照項目。
     *
     * @param name 實體名稱 (用戶 / 群組 / 分區)
     * @param index 穩定的 index，從 1 開始
     * @param usage 累計用量
     */
    public record Entry(
        String name,
        int index,
        UsageTriple usage
    ) {
        /**
         * @return 指標 label 使用的 index 文字，例如 {@code A3}
         */
        public String indexLabel() {
            return "A" + index;
        }
    }
}
