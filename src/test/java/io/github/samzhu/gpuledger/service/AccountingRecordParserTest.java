package io.github.samzhu.gpuledger.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties;
import io.github.samzhu.gpuledger.dto.JobRecord;

class AccountingRecordParserTest {

    private AccountingRecordParser parser;

    @BeforeEach
    void setUp() {
        GpuLedgerProperties properties = new GpuLedgerProperties(
            Map.of("h100", 546.9), null, null, null, null, null);
        parser = new AccountingRecordParser(properties);
    }

    @Test
    void shouldParseCompletedGpuJob() {
        // Given
        String line = "123|COMPLETED|alice|kempner_lab,other|kempner_h100,gpu|1-02:03:04|"
            + "billing=8,cpu=8,gres/gpu:h100=2,gres/gpu=2,mem=64G,node=1|holygpu8a11101";

        // When
        var record = parser.parse(line);

        // Then
        assertThat(record).contains(new JobRecord(
            "alice", "kempner_lab", "kempner_h100", "1-02:03:04",
            "billing=8,cpu=8,gres/gpu:h100=2,gres/gpu=2,mem=64G,node=1", "holygpu8a11101"));
    }

    @Test
    void shouldSkipUnfinishedJobs() {
        String running = "123|RUNNING|alice|lab|gpu|00:10:00|gres/gpu=1|node1";
        String pending = "124|PENDING|alice|lab|gpu|00:00:00|gres/gpu=1|None assigned";

        assertThat(parser.qualifies(running)).isFalse();
        assertThat(parser.qualifies(pending)).isFalse();
        assertThat(parser.parse(running)).isEmpty();
    }

    @Test
    void shouldSkipLinesWithoutGpuMarker() {
        assertThat(parser.parse("123|COMPLETED|alice|lab|shared|00:10:00|cpu=4,mem=8G|node1")).isEmpty();
    }

    @Test
    void shouldSkipLinesWithTooFewFields() {
        assertThat(parser.parse("123|COMPLETED|alice|lab|gpu|00:10:00|gres/gpu=1")).isEmpty();
    }

    @Test
    void shouldSkipLinesWithEmptyIdentifiers() {
        assertThat(parser.parse("123|COMPLETED||lab|gpu|00:10:00|gres/gpu=1|node1")).isEmpty();
    }

    @Test
    void shouldIgnoreTrailingWhitespaceAndExtraFields() {
        var record = parser.parse("123|COMPLETED|bob|lab|gpu|00:10:00|gres/gpu=1|node1|extra  \n");

        assertThat(record).hasValueSatisfying(job -> {
            assertThat(job.userId()).isEqualTo("bob");
            assertThat(job.nodeName()).isEqualTo("node1");
        });
    }
}
