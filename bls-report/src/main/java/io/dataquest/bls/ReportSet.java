package io.dataquest.bls;

import java.util.List;

/**
 * The three results of one run, plus the series/period slice the joined report was cut from.
 */
public record ReportSet(
        PopulationStats populationStats,
        List<BestYearRow> bestYears,
        List<JoinedReportRow> joined,
        String seriesId,
        String period
) {
    public ReportSet {
        bestYears = List.copyOf(bestYears);
        joined = List.copyOf(joined);
    }
}
