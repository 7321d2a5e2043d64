package com.rechargeengine.core.config;

import com.rechargeengine.core.exception.ValidationException;
import com.rechargeengine.core.model.CrossValidationMethod;
import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.RechargeMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ParametersLoader}.
 */
class ParametersLoaderTest {

    @Test
    @DisplayName("Should load test parameters from classpath")
    void shouldLoadFromClasspath() {
        CalculationParameters parameters = ParametersLoader.fromClasspath("test-parameters.yml");

        assertThat(parameters.getMethod()).isEqualTo(RechargeMethod.ERC);
        assertThat(parameters.getSpecificYield()).isEqualTo(0.15);
        assertThat(parameters.getMinRecessionLength()).isEqualTo(14);
        assertThat(parameters.getCurveType()).isEqualTo(CurveType.MULTI_SEGMENT);
        assertThat(parameters.getSeasonalBaseCurveType()).isEqualTo(CurveType.POWER);
        assertThat(parameters.getCrossValidationMethod()).isEqualTo(CrossValidationMethod.TEMPORAL_SPLIT);
        assertThat(parameters.getCrossValidationSeed()).isEqualTo(42L);
        assertThat(parameters.breakpointDates())
                .containsExactly(LocalDate.of(2019, 10, 1), LocalDate.of(2020, 10, 1));
        assertThat(parameters.getResampleRule()).isEqualTo(ResampleRule.DAILY);
        assertThat(parameters.getAggregationMethod()).isEqualTo(AggregationMethod.MEDIAN);
        assertThat(parameters.isParallel()).isTrue();
        assertThat(parameters.getQualityWeights().getMagnitude()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should keep defaults for keys the file omits")
    void shouldKeepDefaults() {
        CalculationParameters parameters = ParametersLoader.fromClasspath("test-parameters.yml");

        assertThat(parameters.getFluctuationTolerance()).isEqualTo(0.01);
        assertThat(parameters.getWaterYearStartMonth()).isEqualTo(10);
        assertThat(parameters.getFoldCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should load the bundled default parameters")
    void shouldLoadDefaultResource() {
        CalculationParameters parameters = ParametersLoader.fromClasspath(ParametersLoader.DEFAULT_RESOURCE);

        assertThat(parameters).isEqualTo(new CalculationParameters());
        assertThat(parameters.getMinTimeBetweenEvents()).isEqualTo(1.0);
        assertThat(parameters.getMaxRiseRate()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty parameter file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(ParametersLoader.fromFile(file.toString())).isEqualTo(new CalculationParameters());
    }

    @Test
    @DisplayName("Should report every invalid parameter")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> ParametersLoader.fromClasspath("invalid-parameters.yml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("specificYield")
                .hasMessageContaining("polynomialDegree");
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> ParametersLoader.fromClasspath("unknown-key-parameters.yml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("specificYeild");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("recharge.yml");
        Files.writeString(file, "method: RISE\nantecedentPeriod: 14\n");

        CalculationParameters parameters = ParametersLoader.fromFile(file.toString());

        assertThat(parameters.getMethod()).isEqualTo(RechargeMethod.RISE);
        assertThat(parameters.getAntecedentPeriod()).isEqualTo(14);
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "method: RISE\nmethod: MRC\n");

        assertThatThrownBy(() -> ParametersLoader.fromFile(file.toString()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ParametersLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ParametersLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
