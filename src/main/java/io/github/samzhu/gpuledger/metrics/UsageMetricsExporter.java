package io.github.samzhu.gpuledger.metrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.github.samzhu.gpuledger.document.AggregateMap;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot.Entry;
import io.github.samzhu.gpuledger.dto.UsageScope;
import io.github.samzhu.gpuledger.dto.UsageTriple;
import io.github.samzhu.gpuledger.repository.UsageSnapshotRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;

/**
 * 將快照檔內容以 Prometheus gauge 形式對外提供。
 *
 * <p>每個維度 ({@code part} / {@code group} / {@code user}) 各有四個 gauge：
 * <ul>
 *   <li>{@code day_gpu_<scope>_hours} - 日 GPU hours</li>
 *   <li>{@code day_gpu_tres_<scope>_hours} - 日加權 GPU hours</li>
 *   <li>{@code tot_gpu_<scope>_hours} - 累計 GPU hours</li>
 *   <li>{@code tot_gpu_tres_<scope>_hours} - 累計加權 GPU hours</li>
 * </ul>
 *
 * <p>標籤為 {@code name_id} (實體名稱) 與 {@code index} ({@code A<n>})。
 * 日用量使用同一實體在累計快照中的 index，重新整理後標籤保持不變。
 *
 * <p>只在 {@code gpuledger.exporter.enabled=true} 時啟用，
 * 以固定間隔 (預設 160 秒) 從檔案重新讀取，讀取失敗時保留上一次的數值。
 */
@Component
@ConditionalOnProperty(prefix = "gpuledger.exporter", name = "enabled", havingValue = "true")
public class UsageMetricsExporter {

    private static final Logger log = LoggerFactory.getLogger(UsageMetricsExporter.class);

    static final String NAME_TAG = "name_id";
    static final String INDEX_TAG = "index";

    private final UsageSnapshotRepository snapshotRepository;
    private final Map<UsageScope, ScopeGauges> gauges = new EnumMap<>(UsageScope.class);

    public UsageMetricsExporter(UsageSnapshotRepository snapshotRepository, MeterRegistry meterRegistry) {
        this.snapshotRepository = snapshotRepository;
        for (UsageScope scope : UsageScope.values()) {
            gauges.put(scope, new ScopeGauges(scope, meterRegistry));
        }
        log.info("UsageMetricsExporter initialized with {} gauge families", gauges.size() * 4);
    }

    /**
     * 重新讀取所有快照檔並更新 gauge。
     */
    @Scheduled(fixedDelayString = "${gpuledger.exporter.refresh-interval:PT160S}")
    public synchronized void refresh() {
        long startTime = System.currentTimeMillis();
        for (UsageScope scope : UsageScope.values()) {
            try {
                CumulativeSnapshot cumulative = snapshotRepository.findCumulative(scope);
                AggregateMap daily = snapshotRepository.findDaily(scope);
                gauges.get(scope).update(daily, cumulative);
            } catch (RuntimeException e) {
                log.error("Failed to refresh {} metrics, keeping previous values: {}", scope, e.getMessage(), e);
            }
        }
        log.debug("Metrics refreshed in {}ms", System.currentTimeMillis() - startTime);
    }

    /**
     * 單一維度的四個 gauge。
     */
    private static final class ScopeGauges {

        private final UsageScope scope;
        private final MultiGauge dayGpuHours;
        private final MultiGauge dayWeightedHours;
        private final MultiGauge totalGpuHours;
        private final MultiGauge totalWeightedHours;

        ScopeGauges(UsageScope scope, MeterRegistry registry) {
            this.scope = scope;
            String suffix = scope.metricSuffix();
            this.dayGpuHours = gauge(registry, "day_gpu_" + suffix + "_hours",
                "GPU hours per " + scope.fileStem() + " in the latest daily batch");
            this.dayWeightedHours = gauge(registry, "day_gpu_tres_" + suffix + "_hours",
                "Weighted GPU hours per " + scope.fileStem() + " in the latest daily batch");
            this.totalGpuHours = gauge(registry, "tot_gpu_" + suffix + "_hours",
                "Cumulative GPU hours per " + scope.fileStem());
            this.totalWeightedHours = gauge(registry, "tot_gpu_tres_" + suffix + "_hours",
                "Cumulative weighted GPU hours per " + scope.fileStem());
        }

        private static MultiGauge gauge(MeterRegistry registry, String name, String description) {
            return MultiGauge.builder(name)
                .description(description)
                .register(registry);
        }

        void update(AggregateMap daily, CumulativeSnapshot cumulative) {
            List<MultiGauge.Row<?>> totalGpu = new ArrayList<>(cumulative.size());
            List<MultiGauge.Row<?>> totalWeighted = new ArrayList<>(cumulative.size());
            for (Entry entry : cumulative.entries()) {
                Tags tags = tags(entry.name(), entry.indexLabel());
                totalGpu.add(MultiGauge.Row.of(tags, entry.usage().gpuHours()));
                totalWeighted.add(MultiGauge.Row.of(tags, entry.usage().weightedGpuHours()));
            }

            // 尚未出現在累計快照中的實體接在最大 index 之後
            int nextIndex = cumulative.nextIndex();
            List<MultiGauge.Row<?>> dayGpu = new ArrayList<>(daily.size());
            List<MultiGauge.Row<?>> dayWeighted = new ArrayList<>(daily.size());
            for (Map.Entry<String, UsageTriple> entry : daily.sortedByWeightedHoursDesc()) {
                OptionalInt index = cumulative.indexOf(entry.getKey());
                int value = index.isPresent() ? index.getAsInt() : nextIndex++;
                Tags tags = tags(entry.getKey(), "A" + value);
                dayGpu.add(MultiGauge.Row.of(tags, entry.getValue().gpuHours()));
                dayWeighted.add(MultiGauge.Row.of(tags, entry.getValue().weightedGpuHours()));
            }

            totalGpuHours.register(totalGpu, true);
            totalWeightedHours.register(totalWeighted, true);
            dayGpuHours.register(dayGpu, true);
            dayWeightedHours.register(dayWeighted, true);
            log.debug("Updated {} gauges: daily={}, cumulative={}", scope, daily.size(), cumulative.size());
        }

        private static Tags tags(String name, String index) {
            return Tags.of(NAME_TAG, name, INDEX_TAG, index);
        }
    }
}
