package com.rdslens.directory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Time-bounded holder of one immutable value.
 *
 * The value and its fetch time are swapped in together, so readers observe either no snapshot or one
 * complete snapshot. A failed refresh leaves the previous snapshot in place.
 *
 * @param <T> snapshot type, expected to be immutable
 */
public class SnapshotCache<T> {

    /**
     * A value together with the instant it was fetched.
     */
    public record Snapshot<T>(T value, Instant fetchedAt) {
    }

    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<Snapshot<T>> current = new AtomicReference<>();
    private final Object refreshLock = new Object();

    public SnapshotCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Return the cached value while it is fresh, otherwise load, store and return a new one.
     *
     * Concurrent callers that find the snapshot expired refresh one at a time; a caller that waited
     * reuses the snapshot stored by the one before it.
     *
     * @param loader produces a fresh value; exceptions propagate and leave the cache untouched
     * @return fresh value
     */
    public T get(Supplier<T> loader) {
        Snapshot<T> snapshot = current.get();
        if (isFresh(snapshot)) {
            return snapshot.value();
        }
        synchronized (refreshLock) {
            snapshot = current.get();
            if (isFresh(snapshot)) {
                return snapshot.value();
            }
            T value = loader.get();
            current.set(new Snapshot<>(value, clock.instant()));
            return value;
        }
    }

    // Current snapshot regardless of age.
    Optional<Snapshot<T>> peek() {
        return Optional.ofNullable(current.get());
    }

    public boolean isFresh() {
        return isFresh(current.get());
    }

    private boolean isFresh(Snapshot<T> snapshot) {
        if (snapshot == null) {
            return false;
        }
        return Duration.between(snapshot.fetchedAt(), clock.instant()).compareTo(ttl) < 0;
    }
}
