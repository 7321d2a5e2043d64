package com.rechargeengine.core.config;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Resampling interval applied before segment identification.
 *
 * @since 1.0.0
 */
public enum ResampleRule {

    /** Keep the readings as recorded. */
    NONE {
        @Override
        public LocalDateTime bucketOf(LocalDateTime timestamp) {
            return timestamp;
        }
    },

    HOURLY {
        @Override
        public LocalDateTime bucketOf(LocalDateTime timestamp) {
            return timestamp.truncatedTo(ChronoUnit.HOURS);
        }
    },

    DAILY {
        @Override
        public LocalDateTime bucketOf(LocalDateTime timestamp) {
            return timestamp.truncatedTo(ChronoUnit.DAYS);
        }
    };

    /**
     * Floor a timestamp to the start of its bucket, which also labels the
     * bucket.
     *
     * @param timestamp reading timestamp
     * @return bucket label
     */
    public abstract LocalDateTime bucketOf(LocalDateTime timestamp);
}
