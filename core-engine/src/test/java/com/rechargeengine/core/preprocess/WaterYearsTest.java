package com.rechargeengine.core.preprocess;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WaterYears}.
 */
class WaterYearsTest {

    private static final MonthDay OCTOBER_FIRST = MonthDay.of(10, 1);

    @Test
    @DisplayName("Should assign the start date to the water year it begins")
    void shouldAssignStartDateToNewYear() {
        assertThat(WaterYears.of(LocalDateTime.of(2020, 10, 1, 0, 0), OCTOBER_FIRST)).isEqualTo(2021);
        assertThat(WaterYears.of(LocalDateTime.of(2020, 9, 30, 23, 59), OCTOBER_FIRST)).isEqualTo(2020);
    }

    @Test
    @DisplayName("Should name the water year by the calendar year it ends in")
    void shouldNameByEndYear() {
        assertThat(WaterYears.of(LocalDateTime.of(2021, 3, 15, 12, 0), OCTOBER_FIRST)).isEqualTo(2021);
        assertThat(WaterYears.of(LocalDateTime.of(2021, 12, 31, 0, 0), OCTOBER_FIRST)).isEqualTo(2022);
    }

    @Test
    @DisplayName("Should equal the calendar year for a January 1 start")
    void shouldMatchCalendarYear() {
        MonthDay january = MonthDay.of(1, 1);

        assertThat(WaterYears.of(LocalDateTime.of(2021, 1, 1, 0, 0), january)).isEqualTo(2021);
        assertThat(WaterYears.of(LocalDateTime.of(2021, 12, 31, 0, 0), january)).isEqualTo(2021);
    }

    @Test
    @DisplayName("Should find the first day of a water year")
    void shouldFindFirstDay() {
        assertThat(WaterYears.firstDay(2021, OCTOBER_FIRST)).isEqualTo(LocalDate.of(2020, 10, 1));
        assertThat(WaterYears.firstDay(2021, MonthDay.of(1, 1))).isEqualTo(LocalDate.of(2021, 1, 1));
    }
}
