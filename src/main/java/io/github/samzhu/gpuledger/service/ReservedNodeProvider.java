package io.github.samzhu.gpuledger.service;

import java.util.Set;

import io.github.samzhu.gpuledger.exception.NodeLookupException;

/**
 * 保留池節點清單來源。
 *
 * <p>實作：
 * <ul>
 *   <li>{@link CommandReservedNodeProvider} - 執行 {@code sinfo} 等 shell 指令</li>
 *   <li>{@link StaticReservedNodeProvider} - 組態中的固定清單</li>
 * </ul>
 *
 * @see ReservedPoolService
 */
@FunctionalInterface
public interface ReservedNodeProvider {

    /**
     * 取得保留池的節點名稱。
     *
     * @return 節點名稱集合
     * @throws NodeLookupException 若無法取得節點清單
     */
    Set<String> fetchReservedNodes();
}
