/**
 * Cleaning, resampling, smoothing and water-year labelling of raw series.
 */
package com.rechargeengine.core.preprocess;
