package io.github.samzhu.gpuledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.samzhu.gpuledger.document.AggregateMap;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot.Entry;
import io.github.samzhu.gpuledger.dto.DailyUsage;
import io.github.samzhu.gpuledger.dto.ExclusionReport;
import io.github.samzhu.gpuledger.dto.UsageScope;
import io.github.samzhu.gpuledger.dto.UsageTriple;

class SnapshotMergeServiceTest {

    private final SnapshotMergeService mergeService = new SnapshotMergeService();

    @Test
    void shouldAddUsageAndKeepExistingIndices() {
        // Given
        CumulativeSnapshot previous = new CumulativeSnapshot(List.of(
            new Entry("alice", 1, new UsageTriple(1.0, 2.0, 418.2)),
            new Entry("bob", 2, new UsageTriple(1.0, 1.0, 546.9))));
        AggregateMap fresh = map(
            "carol", new UsageTriple(0.5, 1.0, 546.9),
            "alice", new UsageTriple(1.0, 2.0, 418.2));

        // When
        CumulativeSnapshot merged = mergeService.merge(previous, fresh);

        // Then
        assertThat(merged.entries()).extracting(Entry::name, Entry::index)
            .containsExactly(
                tuple("alice", 1),
                tuple("bob", 2),
                tuple("carol", 3));
        assertThat(merged.find("alice")).hasValueSatisfying(entry ->
            assertThat(entry.usage()).isEqualTo(new UsageTriple(2.0, 4.0, 836.4)));
        assertThat(merged.find("bob")).hasValueSatisfying(entry ->
            assertThat(entry.usage()).isEqualTo(new UsageTriple(1.0, 1.0, 546.9)));
    }

    @Test
    void shouldAssignNewIndicesInFreshOrder() {
        CumulativeSnapshot merged = mergeService.merge(CumulativeSnapshot.empty(), map(
            "zed", new UsageTriple(1.0, 1.0, 1.0),
            "amy", new UsageTriple(1.0, 1.0, 1.0)));

        assertThat(merged.indexOf("zed")).hasValue(1);
        assertThat(merged.indexOf("amy")).hasValue(2);
    }

    @Test
    void shouldReturnSameSnapshotWhenMergingEmpty() {
        CumulativeSnapshot previous = new CumulativeSnapshot(List.of(
            new Entry("alice", 4, new UsageTriple(1.0, 2.0, 418.2))));

        assertThat(mergeService.merge(previous, new AggregateMap())).isEqualTo(previous);
    }

    @Test
    void shouldGiveSameResultWhenMergingDaysSeparatelyOrCombined() {
        // Given
        CumulativeSnapshot base = new CumulativeSnapshot(List.of(
            new Entry("alice", 1, new UsageTriple(0.1, 0.2, 41.82))));
        AggregateMap dayA = map(
            "bob", new UsageTriple(0.3, 0.6, 125.46),
            "alice", new UsageTriple(0.7, 0.7, 382.83));
        AggregateMap dayB = map(
            "carol", new UsageTriple(0.1, 0.1, 54.69),
            "bob", new UsageTriple(0.2, 0.4, 218.76));

        // When
        CumulativeSnapshot sequential = mergeService.merge(mergeService.merge(base, dayA), dayB);
        CumulativeSnapshot combined = mergeService.merge(base, AggregateMap.combine(dayA, dayB));

        // Then
        assertThat(sequential.size()).isEqualTo(combined.size());
        for (Entry expected : combined.entries()) {
            Entry actual = sequential.find(expected.name()).orElseThrow();
            assertThat(actual.index()).isEqualTo(expected.index());
            assertThat(actual.usage().elapsedHours()).isCloseTo(expected.usage().elapsedHours(), within(1e-9));
            assertThat(actual.usage().gpuHours()).isCloseTo(expected.usage().gpuHours(), within(1e-9));
            assertThat(actual.usage().weightedGpuHours()).isCloseTo(expected.usage().weightedGpuHours(), within(1e-9));
        }
    }

    @Test
    void shouldMergeEveryScope() {
        AggregateMap users = map("alice", new UsageTriple(1.0, 1.0, 1.0), "bob", new UsageTriple(1.0, 1.0, 1.0));
        AggregateMap groups = map("lab", new UsageTriple(2.0, 2.0, 2.0), "other", UsageTriple.ZERO);
        DailyUsage daily = new DailyUsage(users, groups, new AggregateMap(), new ExclusionReport.Tally().toReport());

        Map<UsageScope, CumulativeSnapshot> merged = mergeService.mergeAll(Map.of(), daily);

        assertThat(merged).containsOnlyKeys(UsageScope.values());
        assertThat(merged.get(UsageScope.USER).size()).isEqualTo(2);
        assertThat(merged.get(UsageScope.GROUP).size()).isEqualTo(2);
        assertThat(merged.get(UsageScope.PARTITION).isEmpty()).isTrue();
    }

    private static AggregateMap map(String firstKey, UsageTriple first, String secondKey, UsageTriple second) {
        AggregateMap map = new AggregateMap();
        map.merge(firstKey, first);
        map.merge(secondKey, second);
        return map;
    }
}
