package io.github.samzhu.gpuledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 排程配置，只在指標服務模式啟用。
 *
 * <p>批次模式不啟用排程，避免排程執行緒讓 JVM 在結算完成後無法結束。
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "gpuledger.exporter", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
