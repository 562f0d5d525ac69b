package com.fastbatch.core.sizing;

import com.fastbatch.exception.BatchConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdaptiveBatchSizerTest {

    @Test
    void takesEverything_whenAvailableAtOrBelowMin() {
        assertThat(AdaptiveBatchSizer.chooseBatchSize(3, 5, 100, 20)).isEqualTo(3);
        assertThat(AdaptiveBatchSizer.chooseBatchSize(5, 5, 100, 20)).isEqualTo(5);
        assertThat(AdaptiveBatchSizer.chooseBatchSize(0, 5, 100, 20)).isZero();
    }

    @Test
    void takesOptimal_whenAvailableAtOrAboveMax() {
        assertThat(AdaptiveBatchSizer.chooseBatchSize(200, 5, 100, 20)).isEqualTo(20);
        assertThat(AdaptiveBatchSizer.chooseBatchSize(100, 5, 100, 20)).isEqualTo(20);
    }

    @Test
    void takesSmallerOfAvailableAndOptimal_inBetween() {
        assertThat(AdaptiveBatchSizer.chooseBatchSize(50, 5, 100, 20)).isEqualTo(20);
        assertThat(AdaptiveBatchSizer.chooseBatchSize(12, 5, 100, 20)).isEqualTo(12);
    }

    @Test
    void instanceUsesConfiguredBounds() {
        // given
        AdaptiveBatchSizer sizer = new AdaptiveBatchSizer(5, 100, 20);

        // when & then
        assertThat(sizer.next(3)).isEqualTo(3);
        assertThat(sizer.next(200)).isEqualTo(20);
        assertThat(sizer.next(50)).isEqualTo(20);
    }

    @Test
    void rejectsInvalidBounds() {
        assertThatThrownBy(() -> new AdaptiveBatchSizer(10, 5, 20))
                .isInstanceOf(BatchConfigurationException.class)
                .hasMessageContaining("invalid sizer bounds");
        assertThatThrownBy(() -> new AdaptiveBatchSizer(0, 5, 20))
                .isInstanceOf(BatchConfigurationException.class);
    }
}
