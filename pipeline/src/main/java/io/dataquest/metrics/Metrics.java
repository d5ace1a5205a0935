package io.dataquest.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;

import java.io.PrintStream;
import java.util.Map;

/**
 * Thin facade over a {@link MetricRegistry}. Names are dotted and lower case, e.g. {@code sniff.strategy.strict}
 * or {@code stage.population.normalize.time}.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    /** Registry that nothing reads from; for components constructed without wiring. */
    public static Metrics detached() { return new Metrics(new MetricRegistry()); }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public long count(String name) {
        Counter c = registry.getCounters().get(name);
        return c == null ? 0 : c.getCount();
    }

    /** One line per counter, then one line per timer with its call count and median. Sorted by name. */
    public void printSummary(PrintStream out) {
        for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
            out.println("  " + e.getKey() + "=" + e.getValue().getCount());
        }
        for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
            Snapshot s = e.getValue().getSnapshot();
            out.println("  " + e.getKey() + " count=" + e.getValue().getCount() + " p50(ms)=" + nsToMs(s.getMedian()));
        }
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
