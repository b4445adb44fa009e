/**
 * Breakout (change-point) detection contract used by the segmented trend
 * estimator. No detector ships with the engine; callers inject one or
 * register it under {@code META-INF/services}.
 */
package com.seasonalesd.core.breakout;
