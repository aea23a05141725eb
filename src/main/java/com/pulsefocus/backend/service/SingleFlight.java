package com.pulsefocus.backend.service;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Keyed registry of in-flight operations. The first caller for a key starts
 * the operation; callers arriving before it settles share its outcome. The
 * entry is released when the operation succeeds, fails, or is cancelled.
 */
public class SingleFlight<T> {

    private final Map<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

    public Mono<T> run(String key, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            CompletableFuture<T> created = new CompletableFuture<>();
            CompletableFuture<T> existing = inFlight.putIfAbsent(key, created);
            if (existing != null) {
                return Mono.fromFuture(existing, true);
            }
            Disposable upstream = start(operation, created);
            created.whenComplete((value, error) -> {
                inFlight.remove(key, created);
                if (created.isCancelled()) {
                    upstream.dispose();
                }
            });
            return Mono.fromFuture(created, true);
        });
    }

    /** Number of keys with an operation still running. */
    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    /** Cancels the operation for {@code key}; its waiters see a cancellation error. */
    public void cancel(String key) {
        CompletableFuture<T> f = inFlight.get(key);
        if (f != null) {
            f.cancel(false);
        }
    }

    private Disposable start(Supplier<Mono<T>> operation, CompletableFuture<T> target) {
        Mono<T> op;
        try {
            op = operation.get();
        } catch (RuntimeException e) {
            target.completeExceptionally(e);
            return () -> { };
        }
        return op.subscribe(
                target::complete,
                target::completeExceptionally,
                () -> target.complete(null));
    }
}
