package io.dataquest.bls;

public record JoinedReportRow(String seriesId, Integer year, String period, Double value, Double population) {}
