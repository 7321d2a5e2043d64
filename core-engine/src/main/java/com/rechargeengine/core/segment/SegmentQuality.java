package com.rechargeengine.core.segment;

import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Scores how well a recession segment represents undisturbed drainage.
 *
 * <p>
 * {@code score = 0.4 * duration + 0.4 * consistency + 0.2 * rate}, each term
 * in [0, 1]:
 * </p>
 * <ul>
 * <li><b>duration</b>: length in days over {@value #FULL_DURATION_DAYS},
 * capped at 1.</li>
 * <li><b>consistency</b>: one minus the coefficient of variation of the
 * absolute daily level changes, floored at 0. Segments with no measurable
 * change get 0.5.</li>
 * <li><b>rate</b>: 1 for a decline between 0.001 and 0.1 ft/day; slower
 * declines scale down linearly, faster ones as {@code 0.1 / rate} with a
 * floor of 0.1.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SegmentQuality {

    static final double FULL_DURATION_DAYS = 30.0;
    static final double MIN_TYPICAL_RATE = 0.001;
    static final double MAX_TYPICAL_RATE = 0.1;

    private static final double DURATION_WEIGHT = 0.4;
    private static final double CONSISTENCY_WEIGHT = 0.4;
    private static final double RATE_WEIGHT = 0.2;

    private SegmentQuality() {
        // utility class
    }

    public static double score(RecessionSegment segment) {
        double duration = Math.min(segment.getLengthDays() / FULL_DURATION_DAYS, 1.0);
        double consistency = consistency(segment.getReadings());
        double rate = rateScore(Math.abs(segment.getRecessionRate()));
        return DURATION_WEIGHT * duration + CONSISTENCY_WEIGHT * consistency + RATE_WEIGHT * rate;
    }

    static double consistency(List<Reading> readings) {
        DescriptiveStatistics changes = new DescriptiveStatistics();
        for (int i = 1; i < readings.size(); i++) {
            double days = TimeSeries.daysBetween(readings.get(i - 1).getTimestamp(), readings.get(i).getTimestamp());
            if (days > 0) {
                double change = readings.get(i).getWaterLevel() - readings.get(i - 1).getWaterLevel();
                changes.addValue(Math.abs(change) / days);
            }
        }
        double mean = changes.getMean();
        if (changes.getN() == 0 || !(mean > 0.0)) {
            return 0.5;
        }
        double cv = changes.getN() > 1 ? changes.getStandardDeviation() / mean : 0.0;
        return 1.0 - Math.min(cv, 1.0);
    }

    static double rateScore(double rate) {
        if (rate < MIN_TYPICAL_RATE) {
            return rate / MIN_TYPICAL_RATE;
        }
        if (rate <= MAX_TYPICAL_RATE) {
            return 1.0;
        }
        return Math.max(0.1, MAX_TYPICAL_RATE / rate);
    }
}
