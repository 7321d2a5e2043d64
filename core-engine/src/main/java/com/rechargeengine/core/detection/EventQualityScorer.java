package com.rechargeengine.core.detection;

import com.rechargeengine.core.config.QualityWeights;
import com.rechargeengine.core.model.CrossValidationResult;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.Season;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores the credibility of extended-recession-curve events.
 *
 * <h3>Components</h3>
 * <ul>
 * <li><b>Magnitude</b>: {@code min(1, deviation / (5 * threshold))}; 1 when
 * the threshold is zero.</li>
 * <li><b>Cross-validation agreement</b>: one minus the mean absolute gap
 * between the baselines of the fold curves and the full-data baseline,
 * relative to the deviation, clamped to [0, 1]. Without fold curves the
 * component is neutral (0.5).</li>
 * <li><b>Seasonal plausibility</b>: {@code (n_season + 1) / (n_max + 1)}
 * where {@code n_season} counts earlier events in the event's season and
 * {@code n_max} is the largest count of any season so far.</li>
 * </ul>
 *
 * <p>
 * The score is the weighted mean of the components under
 * {@link QualityWeights}; an event with a score of at least
 * {@value #VALIDATION_THRESHOLD} is marked validated.
 * </p>
 *
 * @since 1.0.0
 */
public class EventQualityScorer {

    private static final Logger LOG = LoggerFactory.getLogger(EventQualityScorer.class);

    public static final double VALIDATION_THRESHOLD = 0.5;

    private static final double NEUTRAL_SCORE = 0.5;
    private static final double FULL_MAGNITUDE_MULTIPLE = 5.0;

    private final QualityWeights weights;
    private final double threshold;

    public EventQualityScorer(QualityWeights weights, double threshold) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
        this.threshold = threshold;
    }

    /**
     * Score every event.
     *
     * @param events          chronological events
     * @param segments        recession segments the events were detected from
     * @param crossValidation cross-validation outcome, or {@code null}
     * @return copies of the events carrying score and validation flag
     */
    public List<RechargeEvent> score(List<RechargeEvent> events, List<RecessionSegment> segments,
            CrossValidationResult crossValidation) {
        List<MasterCurve> foldCurves = crossValidation != null ? crossValidation.getFoldCurves() : List.of();
        Map<Season, Integer> seasonCounts = new EnumMap<>(Season.class);
        int maxSeasonCount = 0;

        List<RechargeEvent> scored = new ArrayList<>(events.size());
        int validated = 0;
        for (RechargeEvent event : events) {
            double magnitude = magnitudeScore(event.getDeviation());
            double agreement = agreementScore(event, segments, foldCurves);
            int seasonCount = seasonCounts.getOrDefault(event.getSeason(), 0);
            double seasonal = (seasonCount + 1.0) / (maxSeasonCount + 1.0);

            double score = (weights.getMagnitude() * magnitude
                    + weights.getCrossValidation() * agreement
                    + weights.getSeasonal() * seasonal) / weights.total();
            score = clamp(score);
            boolean isValid = score >= VALIDATION_THRESHOLD;
            if (isValid) {
                validated++;
            }
            scored.add(event.withQuality(score, isValid));

            seasonCounts.put(event.getSeason(), seasonCount + 1);
            maxSeasonCount = Math.max(maxSeasonCount, seasonCount + 1);
        }
        LOG.info("Scored {} event(s); {} validated", scored.size(), validated);
        return scored;
    }

    double magnitudeScore(double deviation) {
        if (threshold <= 0.0) {
            return 1.0;
        }
        return Math.min(1.0, deviation / (FULL_MAGNITUDE_MULTIPLE * threshold));
    }

    private static double agreementScore(RechargeEvent event, List<RecessionSegment> segments,
            List<MasterCurve> foldCurves) {
        if (foldCurves.isEmpty() || !(event.getDeviation() > 0.0)) {
            return NEUTRAL_SCORE;
        }
        RecessionSegment governing = AnchoredBaseline.governingSegment(segments, event.getEventDate());
        if (governing == null) {
            return NEUTRAL_SCORE;
        }
        double totalGap = 0.0;
        for (MasterCurve fold : foldCurves) {
            double foldBaseline = AnchoredBaseline.baseline(fold, governing, event.getEventDate());
            totalGap += Math.abs(foldBaseline - event.getBaselineLevel());
        }
        return clamp(1.0 - (totalGap / foldCurves.size()) / event.getDeviation());
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
