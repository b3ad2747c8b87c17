package io.github.samzhu.gpuledger.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties.ReservedPoolConfig;
import io.github.samzhu.gpuledger.service.CommandReservedNodeProvider;
import io.github.samzhu.gpuledger.service.ReservedNodeProvider;
import io.github.samzhu.gpuledger.service.StaticReservedNodeProvider;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link GpuLedgerProperties} 的型別安全配置綁定，並建立：
 * <ul>
 *   <li>{@link GpuWeightTable} - 不可變的 GPU 型號權重表</li>
 *   <li>{@link ReservedNodeProvider} - 保留池節點清單來源</li>
 * </ul>
 *
 * @see GpuLedgerProperties
 */
@Configuration
@EnableConfigurationProperties(GpuLedgerProperties.class)
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public GpuWeightTable gpuWeightTable(GpuLedgerProperties properties) {
        GpuWeightTable table = new GpuWeightTable(properties.gpuWeights());
        log.info("GPU weight table initialized: {}", table);
        return table;
    }

    /**
     * 建立保留池節點來源。
     *
     * <p>優先使用固定清單，其次使用 shell 指令；兩者皆未設定時保留池為空。
     */
    @Bean
    public ReservedNodeProvider reservedNodeProvider(GpuLedgerProperties properties) {
        ReservedPoolConfig pool = properties.reservedPool();
        if (!pool.staticNodes().isEmpty()) {
            log.info("Using static reserved node list: {} nodes", pool.staticNodes().size());
            return new StaticReservedNodeProvider(pool.staticNodes());
        }
        if (pool.nodeCommand() != null && !pool.nodeCommand().isBlank()) {
            log.info("Using reserved node command: {}", pool.nodeCommand());
            return new CommandReservedNodeProvider(pool.nodeCommand(), pool.commandTimeout());
        }
        log.info("No reserved node source configured, reserved pool is empty");
        return new StaticReservedNodeProvider(List.of());
    }
}
