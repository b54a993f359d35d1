package com.cbcluster.orchestrator.client;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Repeats a management call at a fixed interval until its result satisfies a condition.
 * Cancelling the returned {@link Mono} stops the loop between two calls.
 */
public final class Polling {

    private Polling() {
    }

    public static <T> Mono<T> until(Supplier<Mono<T>> call, Predicate<T> done, Duration interval) {
        return Mono.defer(call)
                .filter(done)
                .repeatWhenEmpty(attempts -> attempts.delayElements(interval));
    }
}
