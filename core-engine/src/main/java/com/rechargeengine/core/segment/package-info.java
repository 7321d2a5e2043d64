/**
 * Recession segment identification and antecedent baselines.
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.segment;
