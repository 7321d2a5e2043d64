package com.rechargeengine.core.detection;

import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects readings that stand above the recession predicted by a master
 * curve.
 *
 * <p>
 * The baseline of a reading comes from its governing recession segment (the
 * latest one that started strictly before it) with the curve re-anchored to
 * the level observed at that segment's start. Readings before the first
 * segment have no baseline and are never events.
 * </p>
 *
 * @since 1.0.0
 */
public class CurveDeviationDetector implements RechargeEventDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CurveDeviationDetector.class);

    private final String methodName;
    private final MasterCurve curve;
    private final List<RecessionSegment> segments;
    private final double threshold;
    private final double specificYield;

    /**
     * @param parameters calculation parameters
     * @param curve      fitted master curve
     * @param segments   chronological recession segments
     */
    public CurveDeviationDetector(CalculationParameters parameters, MasterCurve curve,
            List<RecessionSegment> segments) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        this.methodName = parameters.getMethod().name();
        this.curve = Objects.requireNonNull(curve, "curve must not be null");
        this.segments = List.copyOf(Objects.requireNonNull(segments, "segments must not be null"));
        this.threshold = parameters.getThreshold();
        this.specificYield = parameters.getSpecificYield();
    }

    @Override
    public Optional<RechargeEvent> evaluate(TimeSeries series, int index) {
        Reading reading = series.get(index);
        RecessionSegment governing = AnchoredBaseline.governingSegment(segments, reading.getTimestamp());
        if (governing == null) {
            return Optional.empty();
        }
        double baseline = AnchoredBaseline.baseline(curve, governing, reading.getTimestamp());
        double deviation = reading.getWaterLevel() - baseline;
        if (!(deviation > threshold)) {
            return Optional.empty();
        }

        LOG.debug("Deviation event at {}: observed={} baseline={} deviation={} (segment from {})",
                reading.getTimestamp(), reading.getWaterLevel(), baseline, deviation, governing.getStartTimestamp());
        return Optional.of(RechargeEvent.builder()
                .eventDate(reading.getTimestamp())
                .waterYear(reading.getWaterYear())
                .observedLevel(reading.getWaterLevel())
                .baselineLevel(baseline)
                .deviation(deviation)
                .rechargeInches(RechargeConversion.rechargeInches(deviation, specificYield))
                .build());
    }

    @Override
    public String getMethodName() {
        return methodName;
    }
}
