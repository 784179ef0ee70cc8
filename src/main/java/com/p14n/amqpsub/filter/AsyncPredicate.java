package com.p14n.amqpsub.filter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * A predicate that may complete later, e.g. after a lookup.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface AsyncPredicate<T> {

    CompletionStage<Boolean> test(T payload);

    /**
     * Adapts a synchronous predicate.
     */
    static <T> AsyncPredicate<T> of(Predicate<? super T> predicate) {
        return payload -> CompletableFuture.completedFuture(predicate.test(payload));
    }
}
