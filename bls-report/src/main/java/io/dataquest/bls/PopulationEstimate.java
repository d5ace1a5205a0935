package io.dataquest.bls;

import io.dataquest.normalize.Coercions;
import io.dataquest.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A year's population estimate for the selected nation.
 */
public record PopulationEstimate(Integer year, Double population) {

    /** Reads a table normalized with {@link SourceSchemas#population()}. */
    public static List<PopulationEstimate> fromTable(Table t) {
        List<PopulationEstimate> out = new ArrayList<>(t.size());
        for (Map<String, Object> row : t.rows()) {
            out.add(new PopulationEstimate(
                    Coercions.toYear(row.get(SourceSchemas.YEAR)),
                    Coercions.toDouble(row.get(SourceSchemas.POPULATION))));
        }
        return out;
    }
}
