package io.github.samzhu.gpuledger.runner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import io.github.samzhu.gpuledger.metrics.UsageMetricsExporter;
import io.github.samzhu.gpuledger.service.DailyRollupService;

/**
 * 命令列進入點，將唯一的位置參數視為 sacct 帳務檔路徑並執行每日結算。
 *
 * <p>用法：
 * <pre>
 * java -jar gpu-ledger.jar &lt;sacct-file&gt;
 * java -jar gpu-ledger.jar --spring.profiles.active=exporter [&lt;sacct-file&gt;]
 * </pre>
 *
 * <p>啟用 exporter 時可以不帶參數，只提供指標；帶參數時結算完成後立即刷新指標。
 */
@Component
public class AccountingJobRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AccountingJobRunner.class);

    static final String USAGE = "Usage: gpu-ledger <sacct-file>  (or --spring.profiles.active=exporter to serve metrics only)";

    private final DailyRollupService rollupService;
    private final ObjectProvider<UsageMetricsExporter> exporterProvider;

    public AccountingJobRunner(DailyRollupService rollupService, ObjectProvider<UsageMetricsExporter> exporterProvider) {
        this.rollupService = rollupService;
        this.exporterProvider = exporterProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        UsageMetricsExporter exporter = exporterProvider.getIfAvailable();

        if (positional.isEmpty()) {
            if (exporter != null) {
                log.info("No accounting file given, serving metrics only");
                return;
            }
            throw new IllegalArgumentException(USAGE);
        }
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Expected exactly one accounting file but got " + positional + ". " + USAGE);
        }

        Path input = Path.of(positional.get(0));
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Accounting file not found: " + input);
        }

        rollupService.run(input);

        if (exporter != null) {
            exporter.refresh();
        }
    }
}
