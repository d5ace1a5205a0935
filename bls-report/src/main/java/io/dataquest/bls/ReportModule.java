package io.dataquest.bls;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.dataquest.error.DeadLetterSink;
import io.dataquest.error.FileDeadLetterSink;
import io.dataquest.metrics.Metrics;
import io.dataquest.store.FileSystemObjectStore;
import io.dataquest.store.ObjectStore;

import java.io.IOException;

public class ReportModule extends AbstractModule {
    private final ReportConfig config;

    public ReportModule(ReportConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(ReportConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectStore objectStore() { return new FileSystemObjectStore(config.storeRoot()); }

    @Provides @Singleton DeadLetterSink<byte[]> uploadFailures() throws IOException { return new FileDeadLetterSink<>(config.deadLetterFile()); }

    @Provides AggregationEngine engine() {
        return new AggregationEngine(config.windowStart(), config.windowEnd(), config.seriesId(), config.period());
    }

    @Provides ReportEmitter emitter() { return new ReportEmitter(); }

    @Provides ReportJob job(ObjectStore store, AggregationEngine engine, ReportEmitter emitter, DeadLetterSink<byte[]> deadLetters, Metrics metrics) {
        return new ReportJob(store, config, engine, emitter, deadLetters, metrics);
    }
}
