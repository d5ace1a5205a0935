package io.dataquest.bls;

/**
 * Mean and population standard deviation (divisor N) of the estimates inside {@code [windowStart, windowEnd]}.
 * Both are null when no estimate falls in the window.
 */
public record PopulationStats(int windowStart, int windowEnd, int count, Double mean, Double stddev) {}
