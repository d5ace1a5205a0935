package io.dataquest.bls;

import io.dataquest.normalize.Coercions;
import io.dataquest.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One quarterly observation of a series. Year and value are null when the source cell was unreadable.
 */
public record TimeSeriesObservation(String seriesId, Integer year, String period, Double value) {

    /** Reads a table normalized with {@link SourceSchemas#timeSeries()}. */
    public static List<TimeSeriesObservation> fromTable(Table t) {
        List<TimeSeriesObservation> out = new ArrayList<>(t.size());
        for (Map<String, Object> row : t.rows()) {
            out.add(new TimeSeriesObservation(
                    text(row.get(SourceSchemas.SERIES_ID)),
                    Coercions.toYear(row.get(SourceSchemas.YEAR)),
                    text(row.get(SourceSchemas.PERIOD)),
                    Coercions.toDouble(row.get(SourceSchemas.VALUE))));
        }
        return out;
    }

    static String text(Object cell) {
        return cell == null ? null : String.valueOf(cell);
    }
}
