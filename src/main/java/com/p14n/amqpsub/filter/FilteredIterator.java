package com.p14n.amqpsub.filter;

import com.p14n.amqpsub.AsyncEventIterator;
import com.p14n.amqpsub.errors.FilterEvaluationException;
import com.p14n.amqpsub.iterator.Next;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Skips payloads a predicate rejects. Chained after the source's pull, so the
 * source's ordering and cancellation behave the same with or without a filter.
 *
 * <p>
 * A predicate that throws or fails fails only the {@link #next()} call that
 * evaluated it, with a {@link FilterEvaluationException}; the source stays
 * open. Once the source is cancelled the predicate is never called again.
 * </p>
 *
 * @param <T> the payload type
 */
public class FilteredIterator<T> implements AutoCloseable {

    private final AsyncEventIterator<T> source;
    private final AsyncPredicate<? super T> predicate;

    public FilteredIterator(AsyncEventIterator<T> source, AsyncPredicate<? super T> predicate) {
        if (source == null || predicate == null) {
            throw new IllegalArgumentException("source and predicate are required");
        }
        this.source = source;
        this.predicate = predicate;
    }

    public static <T> FilteredIterator<T> withFilter(AsyncEventIterator<T> source,
            AsyncPredicate<? super T> predicate) {
        return new FilteredIterator<>(source, predicate);
    }

    /**
     * @return the next payload the predicate accepts, or {@link Next#end()}
     */
    public CompletableFuture<Next<T>> next() {
        return source.next().thenCompose(this::evaluate);
    }

    private CompletionStage<Next<T>> evaluate(Next<T> item) {
        if (item.done() || source.isCancelled()) {
            return CompletableFuture.completedFuture(Next.end());
        }
        CompletionStage<Boolean> verdict;
        try {
            verdict = predicate.test(item.value());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(failure(e));
        }
        return verdict.handle((accepted, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                throw new CompletionException(failure(cause));
            }
            return Boolean.TRUE.equals(accepted);
        }).thenCompose(accepted -> accepted
                ? CompletableFuture.completedFuture(item)
                : next());
    }

    private FilterEvaluationException failure(Throwable cause) {
        return new FilterEvaluationException("Filter failed on subscription " + source.subscriptionId(), cause);
    }

    public CompletableFuture<Next<T>> cancel() {
        return source.cancel();
    }

    @Override
    public void close() {
        source.close();
    }
}
