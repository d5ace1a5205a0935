package io.dataquest.bls;

import io.dataquest.normalize.AliasTable;
import io.dataquest.normalize.SchemaProfile;
import io.dataquest.sniff.DelimitedTextStrategy;

/**
 * How the two published sources are read: the BLS productivity time series ({@code pr.data.0.Current}) and
 * the datausa population series ({@code us_population.json}).
 */
public final class SourceSchemas {
    public static final String SERIES_ID = "series_id";
    public static final String YEAR = "year";
    public static final String PERIOD = "period";
    public static final String VALUE = "value";
    public static final String POPULATION = "population";

    public static final AliasTable TIME_SERIES_ALIASES = AliasTable.builder()
            .put(SERIES_ID, "series_id", "seriesid", "series", "series id")
            .put(YEAR, "yr", "year")
            .put(PERIOD, "period", "periodid")
            .put(VALUE, "value", "val", "amount")
            .build();

    public static final AliasTable POPULATION_ALIASES = AliasTable.builder()
            .put(YEAR, "year", "yr")
            .put(POPULATION, "population", "pop", "population_count", "pop_count", "value")
            .build();

    /** The population CSV fallback needs this many commas on every sampled line. */
    static final int POPULATION_MIN_COMMAS = 3;

    private SourceSchemas() {}

    public static SchemaProfile timeSeries() {
        return SchemaProfile.builder("time-series")
                .aliases(TIME_SERIES_ALIASES)
                .targets(SERIES_ID, YEAR, PERIOD, VALUE)
                .numeric(VALUE)
                .year(YEAR)
                .build();
    }

    /** Population rows come wrapped in a {@code data} array and cover several nations in some releases. */
    public static SchemaProfile population() {
        return SchemaProfile.builder("population")
                .aliases(POPULATION_ALIASES)
                .targets(YEAR, POPULATION)
                .numeric(POPULATION)
                .year(YEAR)
                .filter("Nation", "united states")
                .filter("Nation ID", "01000US")
                .envelope("data")
                .build();
    }

    public static DelimitedTextStrategy timeSeriesDelimited() {
        return DelimitedTextStrategy.sniffing();
    }

    public static DelimitedTextStrategy populationDelimited() {
        return DelimitedTextStrategy.commaGuarded(POPULATION_MIN_COMMAS);
    }
}
