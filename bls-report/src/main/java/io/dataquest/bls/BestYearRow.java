package io.dataquest.bls;

/**
 * The year in which a series' summed values were highest.
 */
public record BestYearRow(String seriesId, int year, double totalValue) {}
