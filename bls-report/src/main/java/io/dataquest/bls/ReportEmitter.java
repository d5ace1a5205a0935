package io.dataquest.bls;

import io.dataquest.core.Record;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes a {@link ReportSet} into its three artifacts, in a fixed order: best years, population statistics,
 * joined report.
 */
public class ReportEmitter {
    public static final String BEST_YEAR_FILE = "best_year_per_series.csv";

    private static final CSVFormat CSV = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    public static String statsFileName(int start, int end) {
        return "population_stats_" + start + "_" + end + ".txt";
    }

    public static String joinedFileName(String seriesId, String period) {
        return seriesId + "_" + period + "_joined.csv";
    }

    public List<Record<byte[]>> emit(ReportSet reports) {
        PopulationStats stats = reports.populationStats();
        return List.of(
                new Record<>(0, BEST_YEAR_FILE, utf8(bestYearsCsv(reports.bestYears()))),
                new Record<>(1, statsFileName(stats.windowStart(), stats.windowEnd()), utf8(statsText(stats))),
                new Record<>(2, joinedFileName(reports.seriesId(), reports.period()), utf8(joinedCsv(reports.joined()))));
    }

    public String bestYearsCsv(List<BestYearRow> rows) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSV)) {
            printer.printRecord("series_id", "year", "value");
            for (BestYearRow r : rows) {
                printer.printRecord(r.seriesId(), Integer.toString(r.year()), ReportNumbers.decimal(r.totalValue()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public String statsText(PopulationStats stats) {
        String suffix = "_population_" + stats.windowStart() + "_" + stats.windowEnd();
        return "Mean" + suffix + "," + ReportNumbers.stat(stats.mean()) + "\n"
                + "StdDev" + suffix + "," + ReportNumbers.stat(stats.stddev()) + "\n";
    }

    public String joinedCsv(List<JoinedReportRow> rows) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSV)) {
            printer.printRecord("series_id", "year", "period", "value", "Population");
            for (JoinedReportRow r : rows) {
                printer.printRecord(
                        r.seriesId(),
                        ReportNumbers.cell(r.year()),
                        r.period(),
                        ReportNumbers.cell(r.value()),
                        ReportNumbers.cell(r.population()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
