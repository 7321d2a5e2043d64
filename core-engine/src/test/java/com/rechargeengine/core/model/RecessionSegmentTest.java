package com.rechargeengine.core.model;

import com.rechargeengine.core.SyntheticSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RecessionSegment}.
 */
class RecessionSegmentTest {

    @Test
    @DisplayName("Should count calendar days inclusively")
    void shouldCountDaysInclusively() {
        RecessionSegment segment = new RecessionSegment(
                SyntheticSeries.dailyReadings(SyntheticSeries.START, SyntheticSeries.linear(10.0, -0.01, 10)), 0.5);

        assertThat(segment.getLengthDays()).isEqualTo(10);
        assertThat(segment.getReadingCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should derive net change and rate per elapsed day")
    void shouldDeriveRate() {
        RecessionSegment segment = new RecessionSegment(
                SyntheticSeries.dailyReadings(SyntheticSeries.START, SyntheticSeries.linear(10.0, -0.05, 11)), 0.5);

        assertThat(segment.getNetChange()).isCloseTo(-0.5, within(1e-9));
        assertThat(segment.getRecessionRate()).isCloseTo(-0.05, within(1e-9));
        assertThat(segment.elapsedDays()).startsWith(0.0, 1.0, 2.0);
    }

    @Test
    @DisplayName("Should take the season of the start date")
    void shouldUseStartSeason() {
        LocalDateTime lateNovember = LocalDateTime.of(2020, 11, 25, 0, 0);
        RecessionSegment segment = SyntheticSeries.exponentialSegment(lateNovember, 10.0, 0.01, 20);

        assertThat(segment.getSeason()).isEqualTo(Season.FALL);
    }

    @Test
    @DisplayName("Should require at least two readings")
    void shouldRequireTwoReadings() {
        assertThatThrownBy(() -> new RecessionSegment(
                SyntheticSeries.dailyReadings(SyntheticSeries.START, 10.0), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
