package com.rechargeengine.core.detection;

import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.TimeSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contract for recharge event detectors.
 *
 * <p>
 * Implementations may be <strong>stateful</strong>: a detector instance
 * belongs to one calculation and expects {@link #evaluate(TimeSeries, int)}
 * to be called with increasing indices of the same series.
 * </p>
 */
public interface RechargeEventDetector {

    /**
     * Decide whether the reading at {@code index} is a recharge event.
     *
     * @param series preprocessed series
     * @param index  reading index
     * @return the event, or empty when the reading has no baseline or stays
     *         within the threshold
     */
    Optional<RechargeEvent> evaluate(TimeSeries series, int index);

    /**
     * @return name of the method this detector implements
     */
    String getMethodName();

    /**
     * Evaluate every reading in order.
     *
     * @param series preprocessed series
     * @return detected events, chronological
     */
    default List<RechargeEvent> detectAll(TimeSeries series) {
        List<RechargeEvent> events = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            evaluate(series, i).ifPresent(events::add);
        }
        return events;
    }
}
