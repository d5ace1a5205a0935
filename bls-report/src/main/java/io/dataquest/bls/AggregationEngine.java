package io.dataquest.bls;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Pure computations over canonical rows. None of them throws on nulls or empty input; each has its own
 * null policy:
 * <ul>
 *   <li>window statistics skip rows with a null year or population;</li>
 *   <li>best-year sums treat a null value as 0 and drop rows with a null series id or year;</li>
 *   <li>the join keeps a time-series row with a null year but never matches it to a population row.</li>
 * </ul>
 */
public class AggregationEngine {
    public static final int DEFAULT_WINDOW_START = 2013;
    public static final int DEFAULT_WINDOW_END = 2018;
    public static final String DEFAULT_SERIES_ID = "PRS30006032";
    public static final String DEFAULT_PERIOD = "Q01";

    private final int windowStart;
    private final int windowEnd;
    private final String seriesId;
    private final String period;

    public AggregationEngine() {
        this(DEFAULT_WINDOW_START, DEFAULT_WINDOW_END, DEFAULT_SERIES_ID, DEFAULT_PERIOD);
    }

    public AggregationEngine(int windowStart, int windowEnd, String seriesId, String period) {
        if (windowStart > windowEnd) {
            throw new IllegalArgumentException("window start " + windowStart + " is after end " + windowEnd);
        }
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.seriesId = Objects.requireNonNull(seriesId, "seriesId");
        this.period = Objects.requireNonNull(period, "period");
    }

    public ReportSet run(List<TimeSeriesObservation> series, List<PopulationEstimate> population) {
        return new ReportSet(
                populationStats(population),
                bestYearPerSeries(series),
                joinReport(series, population),
                seriesId,
                period);
    }

    public PopulationStats populationStats(List<PopulationEstimate> population) {
        List<Double> values = new ArrayList<>();
        for (PopulationEstimate p : population) {
            if (p.year() == null || p.population() == null) continue;
            if (p.year() < windowStart || p.year() > windowEnd) continue;
            values.add(p.population());
        }
        if (values.isEmpty()) return new PopulationStats(windowStart, windowEnd, 0, null, null);
        double sum = 0;
        for (double v : values) sum += v;
        double mean = sum / values.size();
        double squares = 0;
        for (double v : values) squares += (v - mean) * (v - mean);
        double stddev = Math.sqrt(squares / values.size());
        return new PopulationStats(windowStart, windowEnd, values.size(), mean, stddev);
    }

    /**
     * One row per series id, ordered by id. Equal sums resolve to the later year.
     */
    public List<BestYearRow> bestYearPerSeries(List<TimeSeriesObservation> series) {
        Map<String, Map<Integer, Double>> sums = new TreeMap<>();
        for (TimeSeriesObservation o : series) {
            if (o.seriesId() == null || o.year() == null) continue;
            double v = o.value() == null ? 0.0 : o.value();
            sums.computeIfAbsent(o.seriesId(), k -> new TreeMap<>()).merge(o.year(), v, Double::sum);
        }
        List<BestYearRow> out = new ArrayList<>(sums.size());
        for (Map.Entry<String, Map<Integer, Double>> s : sums.entrySet()) {
            Map.Entry<Integer, Double> best = null;
            for (Map.Entry<Integer, Double> y : s.getValue().entrySet()) {
                if (best == null || y.getValue() >= best.getValue()) best = y; // years ascend, so >= keeps the later year on ties
            }
            out.add(new BestYearRow(s.getKey(), best.getKey(), best.getValue()));
        }
        return out;
    }

    /**
     * Time-series rows of the configured series and period, left-joined to population by year. A row whose
     * year matches several population rows appears once per match.
     */
    public List<JoinedReportRow> joinReport(List<TimeSeriesObservation> series, List<PopulationEstimate> population) {
        Map<Integer, List<Double>> byYear = new LinkedHashMap<>();
        for (PopulationEstimate p : population) {
            if (p.year() == null) continue;
            byYear.computeIfAbsent(p.year(), k -> new ArrayList<>()).add(p.population());
        }
        List<JoinedReportRow> out = new ArrayList<>();
        for (TimeSeriesObservation o : series) {
            if (!seriesId.equals(o.seriesId()) || !period.equals(o.period())) continue;
            List<Double> matches = o.year() == null ? null : byYear.get(o.year());
            if (matches == null) {
                out.add(new JoinedReportRow(o.seriesId(), o.year(), o.period(), o.value(), null));
                continue;
            }
            for (Double pop : matches) {
                out.add(new JoinedReportRow(o.seriesId(), o.year(), o.period(), o.value(), pop));
            }
        }
        return out;
    }

    public int windowStart() { return windowStart; }
    public int windowEnd() { return windowEnd; }
    public String seriesId() { return seriesId; }
    public String period() { return period; }
}
