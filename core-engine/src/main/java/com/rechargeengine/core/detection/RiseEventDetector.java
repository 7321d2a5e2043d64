package com.rechargeengine.core.detection;

import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RechargeMethod;
import com.rechargeengine.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Water-table rise detector.
 *
 * <p>
 * A reading is an event when it stands more than {@code threshold} above its
 * antecedent-recession baseline. A level change faster than
 * {@code maxRiseRate} ft/day since the previous reading is treated as a
 * sensor spike, and a rise
 * within {@code minTimeBetweenEvents} days of the previous accepted event is
 * folded into it. Both checks need the last accepted event, so an instance
 * serves one pass over one series.
 * </p>
 *
 * @since 1.0.0
 */
public class RiseEventDetector implements RechargeEventDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RiseEventDetector.class);

    private final double[] baselines;
    private final double threshold;
    private final double specificYield;
    private final double maxRiseRate;
    private final double minTimeBetweenEvents;

    private LocalDateTime lastEvent;

    /**
     * @param parameters calculation parameters
     * @param baselines  antecedent baseline per reading ({@code NaN} when none)
     */
    public RiseEventDetector(CalculationParameters parameters, double[] baselines) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        this.baselines = Objects.requireNonNull(baselines, "baselines must not be null").clone();
        this.threshold = parameters.getThreshold();
        this.specificYield = parameters.getSpecificYield();
        this.maxRiseRate = parameters.getMaxRiseRate();
        this.minTimeBetweenEvents = parameters.getMinTimeBetweenEvents();
    }

    @Override
    public Optional<RechargeEvent> evaluate(TimeSeries series, int index) {
        double baseline = baselines[index];
        if (Double.isNaN(baseline)) {
            return Optional.empty();
        }
        Reading reading = series.get(index);
        double rise = reading.getWaterLevel() - baseline;
        if (!(rise > threshold)) {
            return Optional.empty();
        }

        if (index > 0) {
            Reading previous = series.get(index - 1);
            double elapsed = TimeSeries.daysBetween(previous.getTimestamp(), reading.getTimestamp());
            double rate = (reading.getWaterLevel() - previous.getWaterLevel()) / elapsed;
            if (elapsed > 0 && rate > maxRiseRate) {
                LOG.debug("Skipping spike at {}: level rose {} ft/day since {}, limit is {} ft/day",
                        reading.getTimestamp(), rate, previous.getTimestamp(), maxRiseRate);
                return Optional.empty();
            }
        }
        if (lastEvent != null && TimeSeries.daysBetween(lastEvent, reading.getTimestamp()) < minTimeBetweenEvents) {
            LOG.debug("Skipping rise at {}: within {} day(s) of the event at {}",
                    reading.getTimestamp(), minTimeBetweenEvents, lastEvent);
            return Optional.empty();
        }

        lastEvent = reading.getTimestamp();
        LOG.debug("Rise event at {}: observed={} baseline={} rise={}", reading.getTimestamp(),
                reading.getWaterLevel(), baseline, rise);
        return Optional.of(RechargeEvent.builder()
                .eventDate(reading.getTimestamp())
                .waterYear(reading.getWaterYear())
                .observedLevel(reading.getWaterLevel())
                .baselineLevel(baseline)
                .deviation(rise)
                .rechargeInches(RechargeConversion.rechargeInches(rise, specificYield))
                .build());
    }

    @Override
    public String getMethodName() {
        return RechargeMethod.RISE.name();
    }
}
