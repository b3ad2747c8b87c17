package io.github.samzhu.gpuledger.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UsageTripleTest {

    @Test
    void shouldAddComponentWise() {
        UsageTriple sum = new UsageTriple(1.0, 2.0, 400.0).plus(new UsageTriple(0.5, 1.0, 200.0));

        assertThat(sum).isEqualTo(new UsageTriple(1.5, 3.0, 600.0));
    }

    @Test
    void shouldTreatZeroAsIdentity() {
        UsageTriple usage = new UsageTriple(1.0, 2.0, 418.2);

        assertThat(usage.plus(UsageTriple.ZERO)).isEqualTo(usage);
    }

    @Test
    void shouldRejectNegativeOrNaN() {
        assertThatThrownBy(() -> new UsageTriple(-1.0, 0.0, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("elapsedHours");
        assertThatThrownBy(() -> new UsageTriple(0.0, Double.NaN, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gpuHours");
    }
}
