package io.dataquest.bls;

import io.dataquest.core.Record;
import io.dataquest.core.Transform;
import io.dataquest.decode.ByteDecoder;
import io.dataquest.error.DeadLetterSink;
import io.dataquest.error.IngestException;
import io.dataquest.error.TransferException;
import io.dataquest.metrics.Metrics;
import io.dataquest.normalize.SchemaNormalizer;
import io.dataquest.sink.LocalFileSink;
import io.dataquest.sink.ObjectStoreSink;
import io.dataquest.sniff.FormatSniffer;
import io.dataquest.source.ObjectStoreSource;
import io.dataquest.store.ObjectStore;
import io.dataquest.table.Table;
import io.dataquest.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One end-to-end run: fetch both sources, ingest them, aggregate, write the artifacts locally and upload them.
 * <p>
 * Fetch, parse and normalization failures abort the run. Uploads are best effort; failures are recorded in the
 * dead-letter log and reported in the {@link ReportSummary}.
 */
public class ReportJob {
    private static final Logger log = LoggerFactory.getLogger(ReportJob.class);
    private static final int BEST_YEAR_LOG_LIMIT = 10;

    private final ObjectStore store;
    private final ReportConfig config;
    private final AggregationEngine engine;
    private final ReportEmitter emitter;
    private final DeadLetterSink<byte[]> deadLetters;
    private final Metrics metrics;

    public ReportJob(ObjectStore store, ReportConfig config, AggregationEngine engine, ReportEmitter emitter,
                     DeadLetterSink<byte[]> deadLetters, Metrics metrics) {
        this.store = store;
        this.config = config;
        this.engine = engine;
        this.emitter = emitter;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
    }

    public static TransformChain<byte[], Table> timeSeriesChain(Metrics metrics) {
        return TransformChain.<byte[]>start("time-series", metrics)
                .then("decode", new ByteDecoder(metrics))
                .then("sniff", FormatSniffer.standard(SourceSchemas.timeSeriesDelimited(), metrics))
                .then("normalize", new SchemaNormalizer(SourceSchemas.timeSeries(), metrics));
    }

    public static TransformChain<byte[], Table> populationChain(Metrics metrics) {
        return TransformChain.<byte[]>start("population", metrics)
                .then("decode", new ByteDecoder(metrics))
                .then("sniff", FormatSniffer.standard(SourceSchemas.populationDelimited(), metrics))
                .then("normalize", new SchemaNormalizer(SourceSchemas.population(), metrics));
    }

    public ReportSummary run() {
        logBucketContents();

        List<Record<byte[]>> blobs = fetchSources();
        Table seriesTable = ingest(timeSeriesChain(metrics), blobs.get(0));
        Table populationTable = ingest(populationChain(metrics), blobs.get(1));
        log.info("Time series rows: {}", seriesTable.size());
        log.info("Population rows: {}", populationTable.size());

        ReportSet reports = engine.run(
                TimeSeriesObservation.fromTable(seriesTable),
                PopulationEstimate.fromTable(populationTable));
        logResults(reports);

        List<Record<byte[]>> artifacts = emitter.emit(reports);
        List<String> written = writeLocally(artifacts);

        ObjectStoreSink uploader = new ObjectStoreSink(store, config.bucket(), config.resultsPrefix(), deadLetters, metrics);
        for (Record<byte[]> artifact : artifacts) {
            uploader.accept(artifact);
        }
        if (!uploader.failed().isEmpty()) {
            log.warn("{} of {} artifacts were not uploaded: {}", uploader.failed().size(), artifacts.size(), uploader.failed());
        }
        return new ReportSummary(reports, written, uploader.uploaded(), uploader.failed());
    }

    private void logBucketContents() {
        try {
            List<String> keys = store.list(config.bucket());
            log.info("Objects in bucket {}: {}", config.bucket(), keys);
        } catch (TransferException e) {
            log.warn("Could not list bucket {}: {}", config.bucket(), e.getMessage());
        }
    }

    private List<Record<byte[]>> fetchSources() {
        List<Record<byte[]>> blobs = new ArrayList<>(2);
        try (ObjectStoreSource source = new ObjectStoreSource(store, config.bucket(),
                List.of(config.timeSeriesKey(), config.populationKey()))) {
            while (!source.isFinished()) {
                source.poll().ifPresent(blobs::add);
            }
        }
        return blobs;
    }

    private static Table ingest(Transform<byte[], Table> chain, Record<byte[]> blob) {
        try {
            return chain.apply(blob).payload();
        } catch (IngestException e) {
            throw e;
        } catch (Exception e) {
            throw new IngestException("Failed to ingest " + blob.key() + ": " + e.getMessage(), e);
        }
    }

    private List<String> writeLocally(List<Record<byte[]>> artifacts) {
        List<String> written = new ArrayList<>(artifacts.size());
        try {
            LocalFileSink sink = new LocalFileSink(config.outputDir());
            for (Record<byte[]> artifact : artifacts) {
                sink.accept(artifact);
                written.add(artifact.key());
                log.info("Wrote {}", sink.outDir().resolve(artifact.key()));
            }
        } catch (IOException e) {
            throw new IngestException("Could not write report artifacts to " + config.outputDir() + ": " + e.getMessage(), e);
        }
        return written;
    }

    private static void logResults(ReportSet reports) {
        PopulationStats stats = reports.populationStats();
        log.info("Population {}-{}: n={} mean={} stddev={}", stats.windowStart(), stats.windowEnd(), stats.count(),
                ReportNumbers.stat(stats.mean()), ReportNumbers.stat(stats.stddev()));

        List<BestYearRow> best = reports.bestYears();
        log.info("Best year per series: {} series", best.size());
        for (BestYearRow row : best.subList(0, Math.min(BEST_YEAR_LOG_LIMIT, best.size()))) {
            log.info("  {} {} {}", row.seriesId(), row.year(), ReportNumbers.decimal(row.totalValue()));
        }

        if (reports.joined().isEmpty()) {
            log.info("No rows for {} {}", reports.seriesId(), reports.period());
        } else {
            for (JoinedReportRow row : reports.joined()) {
                log.info("  {} {} {} value={} population={}", row.seriesId(), row.year(), row.period(),
                        ReportNumbers.cell(row.value()), ReportNumbers.cell(row.population()));
            }
        }
    }
}
