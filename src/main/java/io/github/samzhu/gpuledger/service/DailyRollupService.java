package io.github.samzhu.gpuledger.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gpuledger.document.CumulativeSnapshot;
import io.github.samzhu.gpuledger.dto.DailyUsage;
import io.github.samzhu.gpuledger.dto.RollupResult;
import io.github.samzhu.gpuledger.dto.UsageScope;
import io.github.samzhu.gpuledger.repository.UsageSnapshotRepository;

/**
 * 每日結算服務，負責處理一份帳務檔並更新所有快照。
 *
 * <p>處理流程：
 * <ol>
 *   <li>呼叫 {@link UsageAggregationService} 聚合帳務檔</li>
 *   <li>讀取三個維度的累計快照 (不存在時為空)</li>
 *   <li>呼叫 {@link SnapshotMergeService} 合併並寫回累計快照</li>
 *   <li>覆寫三個維度的日用量檔</li>
 * </ol>
 *
 * <p>任何步驟失敗都會往外拋出，由程式以非零狀態結束。
 * 快照讀取失敗時不會寫入任何檔案；寫入途中失敗時重跑同一份帳務檔會重複累加，
 * 需由排程端確認結束狀態。
 *
 * @see UsageAggregationService
 * @see SnapshotMergeService
 */
@Service
public class DailyRollupService {

    private static final Logger log = LoggerFactory.getLogger(DailyRollupService.class);

    private final UsageAggregationService aggregationService;
    private final SnapshotMergeService mergeService;
    private final UsageSnapshotRepository snapshotRepository;

    public DailyRollupService(
            UsageAggregationService aggregationService,
            SnapshotMergeService mergeService,
            UsageSnapshotRepository snapshotRepository) {
        this.aggregationService = aggregationService;
        this.mergeService = mergeService;
        this.snapshotRepository = snapshotRepository;
    }

    /**
     * 執行一次每日結算。
     *
     * @param inputPath sacct 帳務檔路徑
     * @return 本次日用量與合併後的累計快照
     * @throws UncheckedIOException 讀取帳務檔失敗時
     */
    public RollupResult run(Path inputPath) {
        log.info("Starting daily rollup: input={}", inputPath);
        long startTime = System.currentTimeMillis();

        DailyUsage daily;
        try (BufferedReader reader = Files.newBufferedReader(inputPath, StandardCharsets.UTF_8)) {
            daily = aggregationService.aggregate(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read accounting file " + inputPath, e);
        }

        // 全部讀取成功後才開始寫入
        Map<UsageScope, CumulativeSnapshot> previous = new EnumMap<>(UsageScope.class);
        for (UsageScope scope : UsageScope.values()) {
            previous.put(scope, snapshotRepository.findCumulative(scope));
        }

        // 累計快照先寫，日用量的實體在指標服務讀取時都已有 index
        Map<UsageScope, CumulativeSnapshot> merged = mergeService.mergeAll(previous, daily);
        merged.forEach(snapshotRepository::saveCumulative);
        for (UsageScope scope : UsageScope.values()) {
            snapshotRepository.saveDaily(scope, daily.scope(scope));
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Daily rollup completed: {} jobs accepted, {} excluded in {}ms",
            daily.exclusions().accepted(), daily.exclusions().excludedJobs(), duration);
        return new RollupResult(daily, merged);
    }
}
