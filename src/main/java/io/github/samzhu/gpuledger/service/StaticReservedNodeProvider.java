package io.github.samzhu.gpuledger.service;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 使用固定節點清單的保留池來源 ({@code gpuledger.reserved-pool.static-nodes})。
 */
public class StaticReservedNodeProvider implements ReservedNodeProvider {

    private final Set<String> nodes;

    public StaticReservedNodeProvider(Collection<String> nodes) {
        this.nodes = nodes.stream()
            .map(String::trim)
            .filter(node -> !node.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Set<String> fetchReservedNodes() {
        return nodes;
    }
}
