package io.github.samzhu.gpuledger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.gpuledger.util.ResourceSpecParser;

class GpuWeightTableTest {

    private GpuWeightTable table;

    @BeforeEach
    void setUp() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("a100", 209.1);
        weights.put("h100", 546.9);
        table = new GpuWeightTable(weights);
    }

    @Test
    void shouldMatchExactClass() {
        assertThat(table.lookup("h100")).hasValue(546.9);
        assertThat(table.lookup("A100")).hasValue(209.1);
    }

    @Test
    void shouldMatchClassContainingKnownName() {
        assertThat(table.lookup("nvidia_h100_80gb_hbm3")).hasValue(546.9);
        assertThat(table.lookup("nvidia_a100-sxm4-80gb")).hasValue(209.1);
    }

    @Test
    void shouldReturnEmptyForUnknownClass() {
        assertThat(table.lookup("v100")).isEmpty();
        assertThat(table.lookup("")).isEmpty();
        assertThat(table.lookup(null)).isEmpty();
    }

    @Test
    void shouldUseLastMatchingClassInSpec() {
        var spec = ResourceSpecParser.parse("gres/gpu:a100=1,gres/gpu:v100=1,gres/gpu:h100=1,gres/gpu=3");

        assertThat(table.weightOf(spec)).isEqualTo(546.9);
    }

    @Test
    void shouldReturnZeroWeightWithoutKnownClass() {
        assertThat(table.weightOf(ResourceSpecParser.parse("gres/gpu=2"))).isZero();
        assertThat(table.weightOf(ResourceSpecParser.parse("gres/gpu:v100=2,gres/gpu=2"))).isZero();
    }

    @Test
    void shouldRejectNonPositiveWeight() {
        assertThatThrownBy(() -> new GpuWeightTable(Map.of("a100", 0.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("a100");
        assertThatThrownBy(() -> new GpuWeightTable(Map.of("h100", -1.0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNormalizeClassNames() {
        GpuWeightTable mixedCase = new GpuWeightTable(Map.of(" H100 ", 546.9));

        assertThat(mixedCase.classes()).containsExactly("h100");
    }
}
