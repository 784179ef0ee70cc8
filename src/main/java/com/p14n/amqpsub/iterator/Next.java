package com.p14n.amqpsub.iterator;

/**
 * Result of a pull: either a value, or the terminal {@code done} signal.
 *
 * @param value the value, null when done
 * @param done  true once the sequence has ended
 * @param <T>   the value type
 */
public record Next<T>(T value, boolean done) {

    public static <T> Next<T> of(T value) {
        return new Next<>(value, false);
    }

    /**
     * @return the terminal result
     */
    public static <T> Next<T> end() {
        return new Next<>(null, true);
    }
}
