package com.rechargeengine.core.engine;

import com.rechargeengine.core.aggregation.Aggregation;
import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.model.CalculationResult;
import com.rechargeengine.core.model.CrossValidationResult;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.QualityReport;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RechargeMethod;
import com.rechargeengine.core.model.RecessionSegment;

import java.util.List;
import java.util.Objects;

/**
 * Assembles the immutable {@link CalculationResult} and its
 * {@link QualityReport}.
 *
 * <h3>Overall score</h3>
 * <ul>
 * <li>RISE: no curve, no overall score.</li>
 * <li>MRC: curve R², clamped to [0, 1].</li>
 * <li>ERC: equal-weight mean of clamped curve R², clamped mean
 * cross-validation R² and average event quality. Without events the event
 * term is left out and the remaining weights are renormalized.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ResultAssembler {

    private static final double CURVE_WEIGHT = 1.0 / 3.0;
    private static final double CROSS_VALIDATION_WEIGHT = 1.0 / 3.0;
    private static final double EVENT_WEIGHT = 1.0 / 3.0;

    public CalculationResult assemble(CalculationParameters parameters, List<RecessionSegment> segments,
            MasterCurve curve, CrossValidationResult crossValidation, List<RechargeEvent> events,
            Aggregation aggregation, List<String> warnings) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(aggregation, "aggregation must not be null");

        return CalculationResult.builder()
                .method(parameters.getMethod())
                .parameters(parameters)
                .segments(segments)
                .masterCurve(curve)
                .crossValidation(crossValidation)
                .events(events)
                .yearlySummaries(aggregation.getYearlySummaries())
                .seasonalSummaries(aggregation.getSeasonalSummaries())
                .seasonalParameterVariability(aggregation.getParameterVariability())
                .totalRecharge(aggregation.getTotalRecharge())
                .annualRate(aggregation.getAnnualRate())
                .quality(qualityReport(parameters.getMethod(), curve, crossValidation, events))
                .warnings(warnings)
                .build();
    }

    QualityReport qualityReport(RechargeMethod method, MasterCurve curve, CrossValidationResult crossValidation,
            List<RechargeEvent> events) {
        Double curveRSquared = curve != null ? curve.getRSquared() : null;
        if (method != RechargeMethod.ERC) {
            Double overall = method == RechargeMethod.MRC && curveRSquared != null ? clamp(curveRSquared) : null;
            return new QualityReport(curveRSquared, null, null, false, overall);
        }

        Double meanCv = crossValidation != null ? crossValidation.getMeanRSquared() : null;
        Double averageQuality = averageQuality(events);
        boolean degraded = crossValidation != null && crossValidation.isDegraded();
        Double overall = null;
        if (curveRSquared != null && meanCv != null) {
            double weighted = CURVE_WEIGHT * clamp(curveRSquared) + CROSS_VALIDATION_WEIGHT * clamp(meanCv);
            double weights = CURVE_WEIGHT + CROSS_VALIDATION_WEIGHT;
            if (averageQuality != null) {
                weighted += EVENT_WEIGHT * clamp(averageQuality);
                weights += EVENT_WEIGHT;
            }
            overall = clamp(weighted / weights);
        }
        return new QualityReport(curveRSquared, meanCv, averageQuality, degraded, overall);
    }

    private static Double averageQuality(List<RechargeEvent> events) {
        if (events == null || events.isEmpty()) {
            return null;
        }
        double sum = 0.0;
        int count = 0;
        for (RechargeEvent event : events) {
            if (event.getQualityScore() != null) {
                sum += event.getQualityScore();
                count++;
            }
        }
        return count > 0 ? sum / count : null;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
