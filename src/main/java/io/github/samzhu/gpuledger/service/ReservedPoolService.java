package io.github.samzhu.gpuledger.service;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties;
import io.github.samzhu.gpuledger.config.GpuLedgerProperties.ReservedPoolConfig;
import io.github.samzhu.gpuledger.exception.NodeLookupException;

/**
 * 保留池服務，負責在每次批次開始時建立 {@link PartitionReclassifier}。
 *
 * <p>節點清單查詢失敗或回傳空清單時不中止批次：
 * <ul>
 *   <li>以 WARN 記錄失敗原因 (空清單也以 WARN 記錄)</li>
 *   <li>保留池視為空集合，所有作業維持原分區名稱</li>
 * </ul>
 */
@Service
public class ReservedPoolService {

    private static final Logger log = LoggerFactory.getLogger(ReservedPoolService.class);

    private final ReservedNodeProvider nodeProvider;
    private final ReservedPoolConfig pool;

    public ReservedPoolService(ReservedNodeProvider nodeProvider, GpuLedgerProperties properties) {
        this.nodeProvider = nodeProvider;
        this.pool = properties.reservedPool();
    }

    /**
     * 查詢保留池節點並建立歸類規則。
     *
     * @return 本次批次使用的歸類規則
     */
    public PartitionReclassifier loadReclassifier() {
        Set<String> nodes;
        try {
            nodes = nodeProvider.fetchReservedNodes();
            if (nodes.isEmpty()) {
                log.warn("Reserved node source returned no nodes for partition marker '{}'; "
                    + "jobs will keep their reported partition", pool.partitionMarker());
            } else {
                log.info("Loaded {} reserved pool nodes for partition marker '{}'", nodes.size(), pool.partitionMarker());
            }
        } catch (NodeLookupException e) {
            log.warn("Reserved node lookup failed, treating reserved pool as empty; "
                + "jobs will keep their reported partition: {}", e.getMessage(), e);
            nodes = Set.of();
        }
        return new PartitionReclassifier(nodes, pool.partitionMarker(), pool.nonReservedLabel());
    }
}
