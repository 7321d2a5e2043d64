package com.rechargeengine.core.exception;

/**
 * Raised when too few recession segments are available for a meaningful
 * curve fit.
 *
 * <p>
 * Fatal for the current run only: callers are expected to relax the
 * segment tolerances (minimum recession length, fluctuation tolerance) and
 * retry.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientSegmentsException extends RechargeException {

    private static final long serialVersionUID = 1L;

    private final int segmentCount;
    private final int requiredCount;

    public InsufficientSegmentsException(int segmentCount, int requiredCount) {
        super("Found " + segmentCount + " recession segment(s) but curve fitting requires at least "
                + requiredCount + "; relax minRecessionLength or fluctuationTolerance and retry");
        this.segmentCount = segmentCount;
        this.requiredCount = requiredCount;
    }

    public int getSegmentCount() {
        return segmentCount;
    }

    public int getRequiredCount() {
        return requiredCount;
    }
}
