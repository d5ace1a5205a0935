package io.dataquest.transform;

import com.codahale.metrics.Timer;
import io.dataquest.core.Record;
import io.dataquest.core.Transform;
import io.dataquest.metrics.Metrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequentially applies named transforms. Each stage is timed as {@code stage.<chain>.<stage>.time}.
 * <pre>{@code
 * Transform<byte[], Table> ingest = TransformChain.start("population", metrics)
 *         .then("decode", decoder)
 *         .then("sniff", sniffer)
 *         .then("normalize", normalizer);
 * }</pre>
 */
public final class TransformChain<I, O> implements Transform<I, O> {
    private final String name;
    private final Metrics metrics;
    private final List<Stage> stages;

    private record Stage(String name, Transform<?, ?> transform) {}

    private TransformChain(String name, Metrics metrics, List<Stage> stages) {
        this.name = name;
        this.metrics = metrics;
        this.stages = List.copyOf(stages);
    }

    /** An empty chain; it passes records through until stages are added. */
    public static <T> TransformChain<T, T> start(String name, Metrics metrics) {
        return new TransformChain<>(name, metrics, List.of());
    }

    public <R> TransformChain<I, R> then(String stageName, Transform<O, R> next) {
        List<Stage> more = new ArrayList<>(stages);
        more.add(new Stage(stageName, next));
        return new TransformChain<>(name, metrics, more);
    }

    public List<String> stageNames() {
        return stages.stream().map(Stage::name).toList();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public Record<O> apply(Record<I> input) throws Exception {
        Record current = input;
        for (Stage stage : stages) {
            Timer timer = metrics.timer("stage." + name + "." + stage.name() + ".time");
            try (Timer.Context ignored = timer.time()) {
                current = ((Transform) stage.transform()).apply(current);
            }
        }
        return (Record<O>) current;
    }
}
