package io.github.samzhu.gpuledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties;
import io.github.samzhu.gpuledger.exception.NodeLookupException;

@ExtendWith(OutputCaptureExtension.class)
class ReservedPoolServiceTest {

    private ReservedNodeProvider nodeProvider;
    private ReservedPoolService reservedPoolService;

    @BeforeEach
    void setUp() {
        nodeProvider = mock(ReservedNodeProvider.class);
        GpuLedgerProperties properties = new GpuLedgerProperties(Map.of("h100", 546.9), null, null, null, null, null);
        reservedPoolService = new ReservedPoolService(nodeProvider, properties);
    }

    @Test
    void shouldBuildReclassifierFromProvider() {
        when(nodeProvider.fetchReservedNodes()).thenReturn(Set.of("node1"));

        PartitionReclassifier reclassifier = reservedPoolService.loadReclassifier();

        assertThat(reclassifier.reservedNodeCount()).isEqualTo(1);
        assertThat(reclassifier.reclassify("node1", "gpu")).isEqualTo("non-kempner");
    }

    @Test
    void shouldWarnWhenProviderReturnsNoNodes(CapturedOutput output) {
        when(nodeProvider.fetchReservedNodes()).thenReturn(Set.of());

        PartitionReclassifier reclassifier = reservedPoolService.loadReclassifier();

        assertThat(reclassifier.reservedNodeCount()).isZero();
        assertThat(output).contains("WARN").contains("Reserved node source returned no nodes");
    }

    @Test
    void shouldDegradeToEmptyPoolWhenLookupFails(CapturedOutput output) {
        // Given
        when(nodeProvider.fetchReservedNodes()).thenThrow(new NodeLookupException("sinfo: command not found"));

        // When
        PartitionReclassifier reclassifier = reservedPoolService.loadReclassifier();

        // Then
        assertThat(reclassifier.reservedNodeCount()).isZero();
        assertThat(reclassifier.reclassify("node1", "gpu")).isEqualTo("gpu");
        assertThat(output).contains("Reserved node lookup failed");
    }
}
