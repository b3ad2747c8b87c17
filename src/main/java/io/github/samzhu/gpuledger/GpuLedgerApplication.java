package io.github.samzhu.gpuledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * GPU Ledger - Slurm GPU 用量統計與加權計費服務。
 *
 * <p>此程式處理 Slurm {@code sacct} 匯出的帳務紀錄，負責：
 * <ul>
 *   <li>解析已結束作業的帳務紀錄 (以 {@code |} 分隔)</li>
 *   <li>依 GPU 型號權重計算 GPU hours 與加權 GPU hours</li>
 *   <li>按用戶 / 群組 / 分區聚合每日用量</li>
 *   <li>將每日用量併入累計快照 (穩定的 index 編號)</li>
 *   <li>以 Prometheus gauge 形式對外提供日用量與累計用量</li>
 * </ul>
 *
 * <p>執行模式：
 * <pre>
 * 每日批次 (cron):  java -jar gpu-ledger.jar /tmp/sacct_tmp_files/sacct_day.txt
 *                     ↓
 *                   user/group/partition_dictionary.csv      (日用量)
 *                   user/group/partition_dictionary_sum.csv  (累計用量)
 *
 * 指標服務:         java -jar gpu-ledger.jar --spring.profiles.active=exporter
 *                     ↓
 *                   /actuator/prometheus (port 10003)
 * </pre>
 */
@SpringBootApplication
public class GpuLedgerApplication {

    private static final Logger log = LoggerFactory.getLogger(GpuLedgerApplication.class);

    public static void main(String[] args) {
        log.info("Starting GPU Ledger - Slurm GPU usage accounting");
        ConfigurableApplicationContext context = SpringApplication.run(GpuLedgerApplication.class, args);

        // 批次模式執行完畢即結束；exporter 模式則持續提供指標
        boolean exporterEnabled = context.getEnvironment()
            .getProperty("gpuledger.exporter.enabled", Boolean.class, false);
        if (!exporterEnabled) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
