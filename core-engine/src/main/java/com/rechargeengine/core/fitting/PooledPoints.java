package com.rechargeengine.core.fitting;

import com.rechargeengine.core.model.RecessionSegment;

import java.util.List;

/**
 * All readings of a group of segments as (days since segment start, level)
 * pairs, in segment order.
 */
final class PooledPoints {

    private final double[] elapsedDays;
    private final double[] levels;

    private PooledPoints(double[] elapsedDays, double[] levels) {
        this.elapsedDays = elapsedDays;
        this.levels = levels;
    }

    static PooledPoints of(List<RecessionSegment> segments) {
        int total = segments.stream().mapToInt(RecessionSegment::getReadingCount).sum();
        double[] t = new double[total];
        double[] levels = new double[total];
        int offset = 0;
        for (RecessionSegment segment : segments) {
            double[] segmentT = segment.elapsedDays();
            double[] segmentLevels = segment.levels();
            System.arraycopy(segmentT, 0, t, offset, segmentT.length);
            System.arraycopy(segmentLevels, 0, levels, offset, segmentLevels.length);
            offset += segmentT.length;
        }
        return new PooledPoints(t, levels);
    }

    int size() {
        return levels.length;
    }

    double[] elapsedDays() {
        return elapsedDays;
    }

    double[] levels() {
        return levels;
    }

    boolean allLevelsPositive() {
        for (double level : levels) {
            if (!(level > 0.0)) {
                return false;
            }
        }
        return true;
    }
}
