package com.rechargeengine.core.segment;

import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.TimeSeries;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Per-reading baseline for the rise method: where the water level would be
 * had the antecedent recession continued.
 *
 * <p>
 * The baseline of reading {@code i} is taken from the readings in the window
 * {@code [t_i - antecedentPeriod, t_i)}. A least-squares line through them is
 * extrapolated to {@code t_i} when its slope is negative; a flat or rising
 * window has no recession to extend, so the last prior level is used. One
 * prior reading is its own baseline. With no prior reading the baseline is
 * {@link Double#NaN}.
 * </p>
 *
 * @since 1.0.0
 */
final class AntecedentBaseline {

    private AntecedentBaseline() {
        // utility class
    }

    static double[] compute(TimeSeries series, int antecedentPeriodDays) {
        List<Reading> readings = series.getReadings();
        double[] baselines = new double[readings.size()];
        int windowStart = 0;
        for (int i = 0; i < readings.size(); i++) {
            LocalDateTime current = readings.get(i).getTimestamp();
            LocalDateTime earliest = current.minusDays(antecedentPeriodDays);
            while (windowStart < i && readings.get(windowStart).getTimestamp().isBefore(earliest)) {
                windowStart++;
            }
            baselines[i] = baseline(readings, windowStart, i);
        }
        return baselines;
    }

    private static double baseline(List<Reading> readings, int from, int to) {
        int count = to - from;
        if (count == 0) {
            return Double.NaN;
        }
        Reading lastPrior = readings.get(to - 1);
        if (count == 1) {
            return lastPrior.getWaterLevel();
        }
        LocalDateTime origin = readings.get(from).getTimestamp();
        SimpleRegression regression = new SimpleRegression();
        for (int k = from; k < to; k++) {
            Reading r = readings.get(k);
            regression.addData(TimeSeries.daysBetween(origin, r.getTimestamp()), r.getWaterLevel());
        }
        double slope = regression.getSlope();
        if (Double.isNaN(slope) || slope >= 0.0) {
            return lastPrior.getWaterLevel();
        }
        return regression.predict(TimeSeries.daysBetween(origin, readings.get(to).getTimestamp()));
    }
}
