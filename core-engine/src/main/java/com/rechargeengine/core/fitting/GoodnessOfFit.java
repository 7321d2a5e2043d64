package com.rechargeengine.core.fitting;

import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RecessionSegment;

import java.util.List;

/**
 * Coefficient of determination in level space.
 *
 * @since 1.0.0
 */
public final class GoodnessOfFit {

    private GoodnessOfFit() {
        // utility class
    }

    /**
     * {@code R² = 1 - SSres / SStot}. When the observations have no variance
     * the fit is perfect (1) if every residual is zero and worthless (0)
     * otherwise. Held-out data can produce negative values.
     *
     * @param observed  observed levels
     * @param predicted predicted levels, same length
     * @return R²
     */
    public static double rSquared(double[] observed, double[] predicted) {
        if (observed.length != predicted.length) {
            throw new IllegalArgumentException("observed and predicted differ in length: "
                    + observed.length + " vs " + predicted.length);
        }
        if (observed.length == 0) {
            return 0.0;
        }
        double mean = 0.0;
        for (double value : observed) {
            mean += value;
        }
        mean /= observed.length;

        double ssTot = 0.0;
        double ssRes = 0.0;
        for (int i = 0; i < observed.length; i++) {
            ssTot += (observed[i] - mean) * (observed[i] - mean);
            ssRes += (observed[i] - predicted[i]) * (observed[i] - predicted[i]);
        }
        if (ssTot == 0.0) {
            return ssRes == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - ssRes / ssTot;
    }

    /**
     * R² of a master curve over every reading of the given segments, each
     * evaluated at its days since segment start with the curve that governs
     * that segment.
     *
     * @param curve    fitted curve
     * @param segments segments to score
     * @return R²
     */
    public static double rSquared(MasterCurve curve, List<RecessionSegment> segments) {
        PooledPoints points = PooledPoints.of(segments);
        double[] predicted = new double[points.size()];
        int offset = 0;
        for (RecessionSegment segment : segments) {
            MasterCurve governing = curve.curveFor(segment.getStartTimestamp());
            double[] t = segment.elapsedDays();
            for (double ti : t) {
                predicted[offset++] = governing.evaluate(ti);
            }
        }
        return rSquared(points.levels(), predicted);
    }
}
