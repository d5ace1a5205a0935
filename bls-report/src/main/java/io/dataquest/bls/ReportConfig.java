package io.dataquest.bls;

import java.nio.file.Path;

public record ReportConfig(
        String bucket,
        String timeSeriesKey,
        String populationKey,
        String resultsPrefix,
        Path storeRoot,
        Path outputDir,
        String seriesId,
        String period,
        int windowStart,
        int windowEnd
) {
    public static ReportConfig fromEnv() {
        String bucket = setting("dataquest.bucket", "BUCKET_NAME", "rearc-dataquest-quest");
        String ts = setting("dataquest.ts.key", "TS_KEY", "pr.data.0.Current");
        String pop = setting("dataquest.pop.key", "POP_KEY", "us_population.json");
        String prefix = setting("dataquest.results.prefix", "RESULTS_PREFIX", "results/");
        Path root = Path.of(setting("dataquest.store.root", "DATAQUEST_STORE_ROOT", "./store"));
        Path out = Path.of(setting("dataquest.out", "DATAQUEST_OUT", "./out"));
        String series = setting("dataquest.series", "DATAQUEST_SERIES", AggregationEngine.DEFAULT_SERIES_ID);
        String period = setting("dataquest.period", "DATAQUEST_PERIOD", AggregationEngine.DEFAULT_PERIOD);
        int start = Integer.parseInt(setting("dataquest.window.start", "DATAQUEST_WINDOW_START", String.valueOf(AggregationEngine.DEFAULT_WINDOW_START)));
        int end = Integer.parseInt(setting("dataquest.window.end", "DATAQUEST_WINDOW_END", String.valueOf(AggregationEngine.DEFAULT_WINDOW_END)));
        return new ReportConfig(bucket, ts, pop, prefix, root, out, series, period, start, end);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }

    public Path deadLetterFile() {
        return outputDir.resolve("upload_failures.jsonl");
    }
}
