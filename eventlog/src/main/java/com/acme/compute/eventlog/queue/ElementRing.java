package com.acme.compute.eventlog.queue;

import java.util.function.Consumer;

/**
 * FIFO ring of owned element references.
 *
 * <p>An element belongs to the ring from a successful {@link #offer} until it is
 * returned by {@link #poll}; from then on the caller is responsible for it.</p>
 */
public interface ElementRing<E> extends AutoCloseable {
    int capacity();
    int size();
    OfferResult offer(E e);

    /** Removes the oldest element, or returns {@code null} when the ring is empty. */
    E poll();

    /** Returns the element at logical offset {@code index} from the oldest one. */
    E peek(int index);

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Tears the ring down, handing every undrained element to {@code releaser} in FIFO order. */
    void close(Consumer<? super E> releaser);

    @Override
    default void close() {
        close(e -> { });
    }
}
