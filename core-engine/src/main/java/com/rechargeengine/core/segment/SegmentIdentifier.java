package com.rechargeengine.core.segment;

import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the stretches of a series that describe natural drainage.
 *
 * <h3>Recession mode</h3>
 * <p>
 * A reading is <em>blocked</em> while a reading at or before it, no more than
 * {@code postPrecipitationLag} days earlier, recorded precipitation above
 * {@code precipitationTolerance}. Starting from an unblocked reading, a
 * candidate grows while the next reading is unblocked and no higher than the
 * current level plus {@code fluctuationTolerance}; equal levels continue the
 * candidate. A candidate is kept when it spans at least
 * {@code minRecessionLength} days, declines overall and scores at least
 * {@code minSegmentQuality}.
 * </p>
 *
 * <h3>Antecedent mode</h3>
 * <p>
 * Used by the rise method: instead of committing to segments, every reading
 * gets a baseline extrapolated from the trailing {@code antecedentPeriod}
 * days (see {@link #antecedentBaselines(TimeSeries, CalculationParameters)}).
 * </p>
 *
 * <p>
 * A series too short for any segment yields an empty list, never an error.
 * </p>
 *
 * @since 1.0.0
 */
public class SegmentIdentifier {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentIdentifier.class);

    /**
     * Identify recession segments in chronological order.
     *
     * @param series     preprocessed series
     * @param parameters calculation parameters
     * @return unmodifiable, possibly empty list of segments
     */
    public List<RecessionSegment> identify(TimeSeries series, CalculationParameters parameters) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");

        List<Reading> readings = series.getReadings();
        boolean[] blocked = blockedByPrecipitation(readings, parameters.getPrecipitationTolerance(),
                parameters.getPostPrecipitationLag());
        double tolerance = parameters.getFluctuationTolerance();

        List<RecessionSegment> segments = new ArrayList<>();
        int candidates = 0;
        int i = 0;
        while (i < readings.size()) {
            if (blocked[i]) {
                i++;
                continue;
            }
            int end = i;
            while (end + 1 < readings.size()
                    && !blocked[end + 1]
                    && readings.get(end + 1).getWaterLevel() <= readings.get(end).getWaterLevel() + tolerance) {
                end++;
            }
            if (end > i) {
                candidates++;
                accept(readings.subList(i, end + 1), parameters).ifPresent(segments::add);
            }
            i = end + 1;
        }

        LOG.info("Identified {} recession segment(s) from {} candidate(s) in {} reading(s)",
                segments.size(), candidates, readings.size());
        return Collections.unmodifiableList(segments);
    }

    /**
     * Antecedent-recession baseline per reading, for the rise method.
     *
     * @param series     preprocessed series
     * @param parameters calculation parameters
     * @return one baseline per reading; {@link Double#NaN} where no prior reading
     *         exists
     */
    public double[] antecedentBaselines(TimeSeries series, CalculationParameters parameters) {
        Objects.requireNonNull(series, "series must not be null");
        double[] baselines = AntecedentBaseline.compute(series, parameters.getAntecedentPeriod());
        LOG.debug("Computed antecedent baselines over a {}-day window", parameters.getAntecedentPeriod());
        return baselines;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<RecessionSegment> accept(List<Reading> candidate, CalculationParameters parameters) {
        RecessionSegment segment = new RecessionSegment(candidate, 0.0);
        if (segment.getLengthDays() < parameters.getMinRecessionLength()) {
            LOG.debug("Rejected candidate at {}: {} day(s) is shorter than {}", segment.getStartTimestamp(),
                    segment.getLengthDays(), parameters.getMinRecessionLength());
            return Optional.empty();
        }
        if (!(segment.getNetChange() < 0.0)) {
            LOG.debug("Rejected candidate at {}: no net decline", segment.getStartTimestamp());
            return Optional.empty();
        }
        double quality = SegmentQuality.score(segment);
        if (quality < parameters.getMinSegmentQuality()) {
            LOG.debug("Rejected candidate at {}: quality {} below {}", segment.getStartTimestamp(), quality,
                    parameters.getMinSegmentQuality());
            return Optional.empty();
        }
        return Optional.of(segment.withQualityScore(quality));
    }

    static boolean[] blockedByPrecipitation(List<Reading> readings, double tolerance, int lagDays) {
        boolean[] blocked = new boolean[readings.size()];
        LocalDateTime lastSignificant = null;
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            Double precipitation = reading.getPrecipitation();
            if (precipitation != null && precipitation > tolerance) {
                lastSignificant = reading.getTimestamp();
            }
            blocked[i] = lastSignificant != null
                    && TimeSeries.daysBetween(lastSignificant, reading.getTimestamp()) <= lagDays;
        }
        return blocked;
    }
}
