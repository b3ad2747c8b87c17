package io.github.samzhu.gpuledger.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import io.github.samzhu.gpuledger.dto.UsageTriple;
import io.github.samzhu.gpuledger.exception.SnapshotFormatException;
import io.github.samzhu.gpuledger.repository.SnapshotLineCodec.SnapshotLine;

class SnapshotLineCodecTest {

    private static final Path FILE = Path.of("user_dictionary_sum.csv");

    @Test
    void shouldEncodeWithOneDecimal() {
        String line = SnapshotLineCodec.encode("alice", new UsageTriple(6.25, 12.46, 2613.84), 4);

        assertThat(line).isEqualTo("name=alice , gpu_hours=12.5 , gpu_tres_hours=2613.8 , total_hours=6.3 , index=4");
    }

    @Test
    void shouldDecodeCurrentFormat() {
        SnapshotLine line = SnapshotLineCodec.decode(FILE,
            "name=alice , gpu_hours=12.5 , gpu_tres_hours=2613.8 , total_hours=6.3 , index=4");

        assertThat(line.name()).isEqualTo("alice");
        assertThat(line.usage()).isEqualTo(new UsageTriple(6.3, 12.5, 2613.8));
        assertThat(line.index()).isEqualTo(4);
    }

    @Test
    void shouldDecodeLegacyFormat() {
        SnapshotLine line = SnapshotLineCodec.decode(FILE, "name= alice , gpu_hours= 12.5, gpu_tres_hours= 2613.8");

        assertThat(line.name()).isEqualTo("alice");
        assertThat(line.usage()).isEqualTo(new UsageTriple(0.0, 12.5, 2613.8));
        assertThat(line.index()).isNull();
    }

    @Test
    void shouldRejectMissingRequiredField() {
        assertThatThrownBy(() -> SnapshotLineCodec.decode(FILE, "name=alice , gpu_hours=12.5"))
            .isInstanceOf(SnapshotFormatException.class)
            .hasMessageContaining("missing gpu_tres_hours");
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> SnapshotLineCodec.decode(FILE, "name=alice , gpu_hours=abc , gpu_tres_hours=1.0"))
            .isInstanceOf(SnapshotFormatException.class)
            .hasMessageContaining("gpu_hours is not a number");
        assertThatThrownBy(() -> SnapshotLineCodec.decode(FILE, "name=alice , gpu_hours=-1 , gpu_tres_hours=1.0"))
            .isInstanceOf(SnapshotFormatException.class);
        assertThatThrownBy(() -> SnapshotLineCodec.decode(FILE, "name=alice , gpu_hours=1 , gpu_tres_hours=1.0 , index=0"))
            .isInstanceOf(SnapshotFormatException.class)
            .hasMessageContaining("index must be positive");
        assertThatThrownBy(() -> SnapshotLineCodec.decode(FILE, "alice 1.0 2.0"))
            .isInstanceOf(SnapshotFormatException.class);
    }
}
