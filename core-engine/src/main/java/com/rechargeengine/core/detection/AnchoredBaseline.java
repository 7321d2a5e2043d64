package com.rechargeengine.core.detection;

import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.TimeSeries;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Expected water level under continued recession.
 *
 * <p>
 * The governing segment of a timestamp is the latest recession segment that
 * started strictly before it. The master curve (or, for a multi-segment
 * curve, the partition of that segment) is re-anchored to the level observed
 * at the segment start and evaluated {@code t} days later:
 * {@code anchor * f(t') / f(r)} for multiplicative families and
 * {@code anchor + f(t') - f(r)} for polynomials, where {@code r} is the
 * family's {@link com.rechargeengine.core.model.CurveType#anchorReferenceDays()
 * anchor reference} and {@code t' = max(t, r)}. The reference is 0 for every
 * family except the power law, whose onset value is the epsilon singularity;
 * it is anchored one day in and held at the anchor level until then.
 * </p>
 */
final class AnchoredBaseline {

    private AnchoredBaseline() {
        // utility class
    }

    /**
     * @param segments  chronological segments
     * @param timestamp reading timestamp
     * @return governing segment, or {@code null} before the first segment start
     */
    static RecessionSegment governingSegment(List<RecessionSegment> segments, LocalDateTime timestamp) {
        RecessionSegment governing = null;
        for (RecessionSegment segment : segments) {
            if (!segment.getStartTimestamp().isBefore(timestamp)) {
                break;
            }
            governing = segment;
        }
        return governing;
    }

    static double baseline(MasterCurve curve, RecessionSegment governing, LocalDateTime timestamp) {
        MasterCurve applicable = curve.curveFor(governing.getStartTimestamp());
        double t = TimeSeries.daysBetween(governing.getStartTimestamp(), timestamp);
        double anchor = governing.getStartLevel();
        double reference = applicable.evaluationType().anchorReferenceDays();
        double atReference = applicable.evaluate(reference);
        double atT = applicable.evaluate(Math.max(t, reference));
        if (applicable.evaluationType().isMultiplicative() && atReference != 0.0 && Double.isFinite(atReference)) {
            return anchor * atT / atReference;
        }
        return anchor + atT - atReference;
    }
}
