package io.dataquest.bls;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.dataquest.error.IngestException;
import io.dataquest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI that runs the population / time-series report once against a filesystem object store.
 * Unset options fall back to {@link ReportConfig#fromEnv()}.
 */
@CommandLine.Command(name = "dataquest-report", mixinStandardHelpOptions = true,
        description = "Ingest the BLS time series and population data and write the three reports")
public final class ReportMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ReportMain.class);

    @CommandLine.Option(names = "--bucket", description = "Bucket holding the sources and receiving the results")
    String bucket;

    @CommandLine.Option(names = "--time-series-key", description = "Key of the time-series object")
    String timeSeriesKey;

    @CommandLine.Option(names = "--population-key", description = "Key of the population object")
    String populationKey;

    @CommandLine.Option(names = "--results-prefix", description = "Key prefix for uploaded artifacts")
    String resultsPrefix;

    @CommandLine.Option(names = "--store-root", description = "Directory backing the object store; buckets are subdirectories")
    Path storeRoot;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Local output directory")
    Path outDir;

    @CommandLine.Option(names = "--series", description = "Series id of the joined report")
    String seriesId;

    @CommandLine.Option(names = "--period", description = "Period of the joined report")
    String period;

    @CommandLine.Option(names = "--window-start", description = "First year of the population window")
    Integer windowStart;

    @CommandLine.Option(names = "--window-end", description = "Last year of the population window")
    Integer windowEnd;

    public static void main(String[] args) {
        int code = new CommandLine(new ReportMain()).execute(args);
        System.exit(code);
    }

    ReportConfig resolve(ReportConfig env) {
        return new ReportConfig(
                bucket != null ? bucket : env.bucket(),
                timeSeriesKey != null ? timeSeriesKey : env.timeSeriesKey(),
                populationKey != null ? populationKey : env.populationKey(),
                resultsPrefix != null ? resultsPrefix : env.resultsPrefix(),
                storeRoot != null ? storeRoot : env.storeRoot(),
                outDir != null ? outDir : env.outputDir(),
                seriesId != null ? seriesId : env.seriesId(),
                period != null ? period : env.period(),
                windowStart != null ? windowStart : env.windowStart(),
                windowEnd != null ? windowEnd : env.windowEnd());
    }

    @Override
    public Integer call() {
        ReportConfig config = resolve(ReportConfig.fromEnv());
        if (config.windowStart() > config.windowEnd()) {
            System.err.println("Window start must be on/before window end");
            return 2;
        }

        Injector injector = Guice.createInjector(new ReportModule(config));
        Metrics metrics = injector.getInstance(Metrics.class);
        ReportSummary summary;
        try {
            summary = injector.getInstance(ReportJob.class).run();
        } catch (IngestException e) {
            log.error("Report run failed: {}", e.getMessage());
            System.out.println("Metrics:");
            metrics.printSummary(System.out);
            return 1;
        }

        System.out.println("Wrote " + summary.artifacts() + " to " + config.outputDir());
        System.out.println("Uploaded " + summary.uploaded().size() + " of " + summary.artifacts().size()
                + " artifacts to " + config.bucket() + "/" + config.resultsPrefix());
        if (!summary.failedUploads().isEmpty()) {
            System.out.println("Failed uploads: " + summary.failedUploads() + " (see " + config.deadLetterFile() + ")");
        }
        System.out.println("Metrics:");
        metrics.printSummary(System.out);
        return 0;
    }
}
