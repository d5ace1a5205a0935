package io.dataquest.bls;

import io.dataquest.store.ObjectStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

final class Fixtures {
    static final String BUCKET = "quest";
    static final String TIME_SERIES_KEY = "pr.data.0.Current";
    static final String POPULATION_KEY = "us_population.json";

    private Fixtures() {}

    static byte[] bytes(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalStateException("missing fixture " + name);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void seed(ObjectStore store) {
        store.store(BUCKET, TIME_SERIES_KEY, bytes(TIME_SERIES_KEY));
        store.store(BUCKET, POPULATION_KEY, bytes(POPULATION_KEY));
    }
}
