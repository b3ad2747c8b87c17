package io.github.samzhu.gpuledger.dto;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ExclusionReportTest {

    @Test
    void shouldGroupUnknownClassesWithHours() {
        // Given
        ExclusionReport.Tally tally = new ExclusionReport.Tally();

        // When
        tally.unknownGpuClass("v100", 2.0);
        tally.unknownGpuClass("v100", 3.0);
        tally.unknownGpuClass(null, 1.0);
        tally.noGpuCount();
        tally.accepted();
        ExclusionReport report = tally.toReport();

        // Then
        assertThat(report.unknownGpuClass()).isEqualTo(3);
        assertThat(report.unknownClassJobs())
            .containsEntry("v100", 2L)
            .containsEntry(ExclusionReport.NO_CLASS, 1L);
        assertThat(report.unknownClassGpuHours()).containsEntry("v100", 5.0);
        assertThat(report.excludedJobs()).isEqualTo(4);
        assertThat(report.accepted()).isEqualTo(1);
    }
}
