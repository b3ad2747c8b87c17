package io.github.samzhu.gpuledger.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties;
import io.github.samzhu.gpuledger.document.AggregateMap;
import io.github.samzhu.gpuledger.dto.DailyUsage;
import io.github.samzhu.gpuledger.dto.ExclusionReport;
import io.github.samzhu.gpuledger.dto.JobRecord;
import io.github.samzhu.gpuledger.dto.ResourceSpec;
import io.github.samzhu.gpuledger.dto.UsageTriple;
import io.github.samzhu.gpuledger.exception.MalformedElapsedTimeException;
import io.github.samzhu.gpuledger.exception.ResourceSpecParseException;
import io.github.samzhu.gpuledger.util.ElapsedTimeParser;
import io.github.samzhu.gpuledger.util.ResourceSpecParser;

/**
 * 帳務紀錄聚合服務。
 *
 * <p>單執行緒、單次掃描整個帳務檔，將每個可計費作業的用量合併到三個維度：
 * <ul>
 *   <li>用戶 - key 為 user id</li>
 *   <li>群組 - key 為 group id (可依 {@code gpuledger.scopes.group-name-contains} 過濾)</li>
 *   <li>分區 - key 為重新歸類後的分區，只保留保留池相關分區</li>
 * </ul>
 *
 * <p>處理流程 (每行)：
 * <ol>
 *   <li>{@link AccountingRecordParser} 過濾並解析欄位</li>
 *   <li>{@link ResourceSpecParser} 解析 AllocTRES，取得 GPU 數量</li>
 *   <li>{@link ElapsedTimeParser} 轉換執行時間 (格式錯誤時中止)</li>
 *   <li>{@link UsageCalculationService} 依 GPU 型號權重計算用量</li>
 *   <li>{@link PartitionReclassifier} 決定分區維度的 key</li>
 * </ol>
 *
 * <p>聚合表為每次呼叫各自擁有的區域狀態，不在呼叫之間共用。
 */
@Service
public class UsageAggregationService {

    private static final Logger log = LoggerFactory.getLogger(UsageAggregationService.class);

    private final AccountingRecordParser recordParser;
    private final UsageCalculationService calculationService;
    private final ReservedPoolService reservedPoolService;
    private final String groupNameContains;

    public UsageAggregationService(
            AccountingRecordParser recordParser,
            UsageCalculationService calculationService,
            ReservedPoolService reservedPoolService,
            GpuLedgerProperties properties) {
        this.recordParser = recordParser;
        this.calculationService = calculationService;
        this.reservedPoolService = reservedPoolService;
        this.groupNameContains = properties.scopes().groupNameContains();
    }

    /**
     * 聚合整個帳務檔。
     *
     * @param reader 帳務檔內容
     * @return 三個維度的日用量與排除統計
     * @throws IOException 讀取失敗時
     * @throws MalformedElapsedTimeException 執行時間格式錯誤時 (含行號)
     */
    public DailyUsage aggregate(BufferedReader reader) throws IOException {
        long startTime = System.currentTimeMillis();
        PartitionReclassifier reclassifier = reservedPoolService.loadReclassifier();

        AggregateMap users = new AggregateMap();
        AggregateMap groups = new AggregateMap();
        AggregateMap partitions = new AggregateMap();
        ExclusionReport.Tally tally = new ExclusionReport.Tally();

        long lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (!recordParser.qualifies(line)) {
                tally.notQualifying();
                continue;
            }
            Optional<JobRecord> parsed = recordParser.parse(line);
            if (parsed.isEmpty()) {
                tally.malformedLine();
                continue;
            }

            JobRecord job = parsed.get();
            Optional<UsageTriple> usage;
            try {
                usage = evaluate(job, tally);
            } catch (MalformedElapsedTimeException e) {
                log.error("Aborting aggregation at line {}: {}", lineNumber, e.getMessage());
                throw new MalformedElapsedTimeException(lineNumber, e);
            } catch (ResourceSpecParseException e) {
                log.debug("Excluding job at line {}: {}", lineNumber, e.getMessage());
                tally.malformedResourceSpec();
                continue;
            }
            if (usage.isEmpty()) {
                continue;
            }

            UsageTriple triple = usage.get();
            tally.accepted();
            users.merge(job.userId(), triple);
            if (groupNameContains.isEmpty() || job.groupId().contains(groupNameContains)) {
                groups.merge(job.groupId(), triple);
            }

            if (PartitionReclassifier.looksLikeNodeList(job.nodeName())) {
                tally.ambiguousNodeList();
            }
            String partition = reclassifier.reclassify(job.nodeName(), job.partitionId());
            if (reclassifier.isRetained(partition)) {
                partitions.merge(partition, triple);
            }
        }

        DailyUsage daily = new DailyUsage(users, groups, partitions, tally.toReport());
        long duration = System.currentTimeMillis() - startTime;
        log.info("Aggregation completed: {} lines, {} jobs accepted, users={}, groups={}, partitions={} in {}ms",
            lineNumber, daily.exclusions().accepted(), users.size(), groups.size(), partitions.size(), duration);
        logExclusions(daily.exclusions());
        return daily;
    }

    /**
     * 計算單一作業的用量，並記錄排除原因。
     *
     * <p>執行時間只在有 GPU 數量時才解析。
     */
    private Optional<UsageTriple> evaluate(JobRecord job, ExclusionReport.Tally tally) {
        ResourceSpec spec = ResourceSpecParser.parse(job.resourceSpec());
        int gpuCount = spec.gpuCount();
        if (gpuCount <= 0) {
            tally.noGpuCount();
            return Optional.empty();
        }

        double hours = ElapsedTimeParser.toHours(job.elapsedWall());
        Optional<UsageTriple> usage = calculationService.calculate(hours, spec);
        if (usage.isEmpty()) {
            String gpuClass = spec.gpuClasses().isEmpty() ? null : String.join("+", spec.gpuClasses());
            tally.unknownGpuClass(gpuClass, hours * gpuCount);
            log.debug("Excluding job of user {} with unweighted GPU class: {}", job.userId(), job.resourceSpec());
        }
        return usage;
    }

    private void logExclusions(ExclusionReport report) {
        log.info("Exclusions: notQualifying={}, malformedLines={}, malformedResourceSpecs={}, noGpuCount={}, "
                + "unknownGpuClass={}, ambiguousNodeLists={}",
            report.notQualifying(), report.malformedLines(), report.malformedResourceSpecs(),
            report.noGpuCount(), report.unknownGpuClass(), report.ambiguousNodeLists());
        if (report.unknownGpuClass() > 0) {
            log.warn("{} GPU jobs excluded from all aggregates because their GPU class has no weight: jobs={}, gpuHours={}",
                report.unknownGpuClass(), report.unknownClassJobs(), report.unknownClassGpuHours());
        }
    }
}
