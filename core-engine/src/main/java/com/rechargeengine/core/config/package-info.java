/**
 * Calculation parameters and their YAML loader.
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.config;
