package com.rechargeengine.core.model;

import com.rechargeengine.core.exception.EmptySeriesException;
import com.rechargeengine.core.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TimeSeries}.
 */
class TimeSeriesTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2021, 3, 1, 0, 0);

    @Test
    @DisplayName("Should reject an empty reading list")
    void shouldRejectEmptySeries() {
        assertThatThrownBy(() -> new TimeSeries(List.of()))
                .isInstanceOf(EmptySeriesException.class);
    }

    @Test
    @DisplayName("Should reject out-of-order timestamps")
    void shouldRejectUnorderedTimestamps() {
        List<Reading> readings = List.of(new Reading(T0.plusDays(1), 5.0), new Reading(T0, 5.1));

        assertThatThrownBy(() -> new TimeSeries(readings))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    @DisplayName("Should reject duplicate timestamps")
    void shouldRejectDuplicateTimestamps() {
        List<Reading> readings = List.of(new Reading(T0, 5.0), new Reading(T0, 5.1));

        assertThatThrownBy(() -> new TimeSeries(readings))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should report span in fractional days")
    void shouldReportSpan() {
        TimeSeries series = new TimeSeries(List.of(new Reading(T0, 5.0), new Reading(T0.plusHours(36), 4.9)));

        assertThat(series.spanDays()).isCloseTo(1.5, within(1e-12));
        assertThat(series.levels()).containsExactly(5.0, 4.9);
        assertThat(series.first().getTimestamp()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Should not be affected by later changes to the source list")
    void shouldCopyReadings() {
        List<Reading> source = new ArrayList<>(List.of(new Reading(T0, 5.0)));
        TimeSeries series = new TimeSeries(source);
        source.add(new Reading(T0.plusDays(1), 4.0));

        assertThat(series.size()).isEqualTo(1);
    }
}
