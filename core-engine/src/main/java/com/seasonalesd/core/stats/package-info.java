/**
 * Robust order statistics (median, MAD, percentiles).
 */
package com.seasonalesd.core.stats;
