package com.rechargeengine.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventMagnitude#classify(double)}.
 */
class EventMagnitudeTest {

    @Test
    @DisplayName("Should classify by recharge depth with inclusive lower bounds")
    void shouldClassify() {
        assertThat(EventMagnitude.classify(0.05)).isEqualTo(EventMagnitude.SMALL);
        assertThat(EventMagnitude.classify(0.1)).isEqualTo(EventMagnitude.MEDIUM);
        assertThat(EventMagnitude.classify(0.49)).isEqualTo(EventMagnitude.MEDIUM);
        assertThat(EventMagnitude.classify(0.5)).isEqualTo(EventMagnitude.LARGE);
    }
}
