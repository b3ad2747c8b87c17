package io.github.samzhu.gpuledger.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;

/**
 * GPU Ledger 的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@code gpuWeights} - 各 GPU 型號的計費權重，用於加權 GPU hours 計算</li>
 *   <li>{@link InputConfig} - 帳務紀錄的過濾條件</li>
 *   <li>{@link ReservedPoolConfig} - 保留節點池 (reserved pool) 的分區重新歸類設定</li>
 *   <li>{@link ScopeConfig} - 各聚合維度的額外過濾</li>
 *   <li>{@link SnapshotConfig} - 日用量與累計快照檔案的存放位置</li>
 *   <li>{@link ExporterConfig} - Prometheus 指標服務設定</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * gpuledger:
 *   gpu-weights:
 *     a100: 209.1
 *     h100: 546.9
 *   reserved-pool:
 *     partition-marker: kempner
 *     non-reserved-label: non-kempner
 *     node-command: "sinfo -p kempner_requeue -N 1 | grep kempner | awk '{print $1}'"
 *   snapshot:
 *     directory: /tmp/sacct_tmp_files
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@Validated
@ConfigurationProperties(prefix = "gpuledger")
public record GpuLedgerProperties(
    @NotEmpty Map<String, Double> gpuWeights,
    InputConfig input,
    ReservedPoolConfig reservedPool,
    ScopeConfig scopes,
    SnapshotConfig snapshot,
    ExporterConfig exporter
) {
    public GpuLedgerProperties {
        if (input == null) {
            input = InputConfig.defaults();
        }
        if (reservedPool == null) {
            reservedPool = ReservedPoolConfig.defaults();
        }
        if (scopes == null) {
            scopes = ScopeConfig.defaults();
        }
        if (snapshot == null) {
            snapshot = SnapshotConfig.defaults();
        }
        if (exporter == null) {
            exporter = ExporterConfig.defaults();
        }
    }

    /**
     * 帳務紀錄過濾設定。
     *
     * <p>只有同時符合以下條件的行才會被解析：
     * <ul>
     *   <li>包含 {@code gpuMarker} 字串 (有 GPU 資源)</li>
     *   <li>不包含任何 {@code excludedStates} (作業已結束)</li>
     * </ul>
     *
     * @param gpuMarker GPU 資源標記，預設 {@code gpu}
     * @param excludedStates 未結束的作業狀態，預設 RUNNING、PENDING
     */
    public record InputConfig(
        String gpuMarker,
        List<String> excludedStates
    ) {
        public InputConfig {
            if (gpuMarker == null || gpuMarker.isBlank()) {
                gpuMarker = "gpu";
            }
            if (excludedStates == null) {
                excludedStates = List.of("RUNNING", "PENDING");
            }
        }

        public static InputConfig defaults() {
            return new InputConfig("gpu", List.of("RUNNING", "PENDING"));
        }
    }

    /**
     * 保留節點池設定。
     *
     * <p>保留池的節點可能同時被其他分區共用。執行在保留池節點上、但分區名稱
     * 不屬於保留池的作業，會被歸類到 {@code nonReservedLabel}。
     *
     * <p>節點清單來源優先順序：
     * <ol>
     *   <li>{@code staticNodes} 不為空時直接使用</li>
     *   <li>否則執行 {@code nodeCommand}，每行輸出一個節點名稱</li>
     *   <li>兩者皆未設定時，保留池為空</li>
     * </ol>
     *
     * @param partitionMarker 分區名稱包含此字串即視為保留池分區，預設 {@code kempner}
     * @param nonReservedLabel 非保留池作業的歸類名稱，預設 {@code non-kempner}
     * @param nodeCommand 列出保留池節點的 shell 指令
     * @param staticNodes 固定的保留池節點清單
     * @param commandTimeout 指令逾時，預設 30 秒
     */
    public record ReservedPoolConfig(
        String partitionMarker,
        String nonReservedLabel,
        String nodeCommand,
        List<String> staticNodes,
        Duration commandTimeout
    ) {
        public ReservedPoolConfig {
            if (partitionMarker == null || partitionMarker.isBlank()) {
                partitionMarker = "kempner";
            }
            if (nonReservedLabel == null || nonReservedLabel.isBlank()) {
                nonReservedLabel = "non-" + partitionMarker;
            }
            if (staticNodes == null) {
                staticNodes = List.of();
            }
            if (commandTimeout == null || commandTimeout.isZero() || commandTimeout.isNegative()) {
                commandTimeout = Duration.ofSeconds(30);
            }
        }

        public static ReservedPoolConfig defaults() {
            return new ReservedPoolConfig("kempner", "non-kempner", null, List.of(), Duration.ofSeconds(30));
        }
    }

    /**
     * 聚合維度設定。
     *
     * @param groupNameContains 群組名稱需包含此字串才納入群組統計，空白表示全部納入
     */
    public record ScopeConfig(
        String groupNameContains
    ) {
        public ScopeConfig {
            if (groupNameContains == null) {
                groupNameContains = "";
            }
        }

        public static ScopeConfig defaults() {
            return new ScopeConfig("");
        }
    }

    /**
     * 快照檔案設定。
     *
     * @param directory 日用量與累計快照的存放目錄，預設 {@code /tmp/sacct_tmp_files}
     */
    public record SnapshotConfig(
        Path directory
    ) {
        public SnapshotConfig {
            if (directory == null) {
                directory = Path.of("/tmp/sacct_tmp_files");
            }
        }

        public static SnapshotConfig defaults() {
            return new SnapshotConfig(Path.of("/tmp/sacct_tmp_files"));
        }
    }

    /**
     * Prometheus 指標服務設定。
     *
     * @param enabled 是否啟用指標服務 (exporter profile 會開啟)
     * @param refreshInterval 重新讀取快照檔案的間隔，預設 160 秒
     */
    public record ExporterConfig(
        boolean enabled,
        Duration refreshInterval
    ) {
        public ExporterConfig {
            if (refreshInterval == null || refreshInterval.isZero() || refreshInterval.isNegative()) {
                refreshInterval = Duration.ofSeconds(160);
            }
        }

        public static ExporterConfig defaults() {
            return new ExporterConfig(false, Duration.ofSeconds(160));
        }
    }
}
