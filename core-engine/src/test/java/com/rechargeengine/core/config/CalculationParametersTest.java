package com.rechargeengine.core.config;

import com.rechargeengine.core.exception.ValidationException;
import com.rechargeengine.core.model.CurveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CalculationParameters}.
 */
class CalculationParametersTest {

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        assertThatCode(() -> new CalculationParameters().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should collect all errors before throwing")
    void shouldCollectErrors() {
        CalculationParameters parameters = new CalculationParameters();
        parameters.setSpecificYield(0.0);
        parameters.setThreshold(-1.0);
        parameters.setWaterYearStartMonth(2);
        parameters.setWaterYearStartDay(30);
        parameters.setSeasonalBaseCurveType(CurveType.MULTI_SEGMENT);

        assertThatThrownBy(parameters::validate)
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getErrors()).hasSize(4));
    }

    @Test
    @DisplayName("Should reject unordered or malformed breakpoints")
    void shouldValidateBreakpoints() {
        CalculationParameters unordered = new CalculationParameters();
        unordered.setPartitionBreakpoints(List.of("2021-01-01", "2020-01-01"));
        CalculationParameters malformed = new CalculationParameters();
        malformed.setPartitionBreakpoints(List.of("01/02/2020"));

        assertThatThrownBy(unordered::validate).hasMessageContaining("strictly increasing");
        assertThatThrownBy(malformed::validate).hasMessageContaining("ISO date");
    }

    @Test
    @DisplayName("Should make copies independent of the original")
    void shouldCopyDeeply() {
        CalculationParameters original = new CalculationParameters();
        original.setPartitionBreakpoints(List.of("2020-06-01"));
        CalculationParameters copy = original.copy();

        original.setThreshold(0.5);
        original.getQualityWeights().setMagnitude(0.9);
        original.setPartitionBreakpoints(List.of());

        assertThat(copy.getThreshold()).isEqualTo(0.1);
        assertThat(copy.getQualityWeights().getMagnitude()).isEqualTo(0.4);
        assertThat(copy.getPartitionBreakpoints()).containsExactly("2020-06-01");
    }
}
