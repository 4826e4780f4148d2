package com.acme.compute.eventlog.queue;

import com.acme.compute.eventlog.memory.AllocationDeniedException;
import com.acme.compute.eventlog.memory.HeapSlotAllocator;
import com.acme.compute.eventlog.memory.SlotAllocator;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Growable circular FIFO queue of owned element references.
 *
 * <p>Live elements occupy the physical slots {@code head .. head + size - 1}
 * modulo {@link #capacity()}. Slots outside that window are always {@code null};
 * a popped slot is cleared before the element is handed to the caller.</p>
 *
 * <p>A full queue grows to {@code max(floor(size * growthFactor), minSize)} slots
 * unless the policy is static or the growth would not add a slot, in which case
 * {@link #offer} returns {@link OfferResult.Full} and nothing changes. After a
 * pop, a queue holding at least {@code minSize} elements whose occupancy drops
 * below {@code shrinkFactor} is shrunk to exactly its size. Every resize
 * allocates the new store before touching the old one, so a denied allocation
 * leaves the queue as it was.</p>
 *
 * <p><b>Contract:</b> not thread-safe. One thread at a time per instance.</p>
 */
public final class RingQueue<E> implements ElementRing<E> {

    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private static final Object[] RELEASED = new Object[0];

    private final RingQueuePolicy policy;
    private final SlotAllocator allocator;

    private Object[] slots;
    private int head;
    private int size;
    private boolean closed;

    private long headSeq;
    private long tailSeq;
    private long growCount;
    private long shrinkCount;
    private long failedAllocations;

    public RingQueue(int capacity) {
        this(capacity, RingQueuePolicy.DEFAULT);
    }

    public RingQueue(int capacity, RingQueuePolicy policy) {
        this(capacity, policy, HeapSlotAllocator.INSTANCE);
    }

    /**
     * @throws IllegalArgumentException  if {@code capacity < 1}
     * @throws AllocationDeniedException if the initial store cannot be allocated
     */
    public RingQueue(int capacity, RingQueuePolicy policy, SlotAllocator allocator) {
        if (capacity < 1 || capacity > MAX_CAPACITY) {
            throw new IllegalArgumentException("capacity must be in [1, " + MAX_CAPACITY + "], got " + capacity);
        }
        this.policy = Objects.requireNonNull(policy, "policy");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.slots = allocate(capacity);
    }

    @Override
    public int capacity() {
        return slots.length;
    }

    @Override
    public int size() {
        return size;
    }

    public RingQueuePolicy policy() {
        return policy;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Appends {@code e} at the tail, growing the store first when the queue is full.
     */
    @Override
    public OfferResult offer(E e) {
        Objects.requireNonNull(e, "e");
        if (closed) {
            return new OfferResult.Closed();
        }
        if (size == slots.length) {
            FullReason refusal = grow();
            if (refusal != null) {
                return new OfferResult.Full(size, slots.length, refusal);
            }
        }
        slots[physical(size)] = e;
        size++;
        return new OfferResult.Ok(++tailSeq);
    }

    /**
     * Alias of {@link #offer(Object)} under the queue's own vocabulary.
     */
    public OfferResult push(E e) {
        return offer(e);
    }

    @Override
    @SuppressWarnings("unchecked")
    public E poll() {
        if (size == 0) {
            return null;
        }
        E value = (E) slots[head];
        slots[head] = null;
        head = (head + 1) % slots.length;
        size--;
        headSeq++;
        if (shouldShrink()) {
            try {
                resize(size);
                shrinkCount++;
            } catch (AllocationDeniedException e) {
                // the larger store stays valid; the next pop retries the shrink
                failedAllocations++;
            }
        }
        return value;
    }

    /**
     * Alias of {@link #poll()} under the queue's own vocabulary.
     */
    public E pop() {
        return poll();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= size()}
     */
    @Override
    @SuppressWarnings("unchecked")
    public E peek(int index) {
        Objects.checkIndex(index, size);
        return (E) slots[physical(index)];
    }

    public QueueSnapshot snapshot() {
        return new QueueSnapshot(
            size,
            slots.length,
            headSeq,
            tailSeq,
            growCount,
            shrinkCount,
            failedAllocations,
            System.nanoTime()
        );
    }

    @Override
    @SuppressWarnings("unchecked")
    public void close(Consumer<? super E> releaser) {
        Objects.requireNonNull(releaser, "releaser");
        if (closed) {
            return;
        }
        closed = true;
        try {
            while (size > 0) {
                E value = (E) slots[head];
                slots[head] = null;
                head = (head + 1) % slots.length;
                size--;
                headSeq++;
                releaser.accept(value);
            }
        } finally {
            slots = RELEASED;
            head = 0;
            size = 0;
        }
    }

    /**
     * Validates the window bookkeeping. Intended for tests and shutdown diagnostics.
     */
    public boolean validateInvariants() {
        if (size < 0 || size > slots.length) {
            return false;
        }
        if (slots.length == 0) {
            return closed && size == 0 && head == 0;
        }
        if (head < 0 || head >= slots.length) {
            return false;
        }
        if (tailSeq - headSeq != size) {
            return false;
        }
        for (int i = 0; i < slots.length; i++) {
            int offset = Math.floorMod(i - head, slots.length);
            boolean live = offset < size;
            if (live == (slots[i] == null)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return {@code null} when the store grew, otherwise the reason it did not
     */
    private FullReason grow() {
        if (!policy.growthEnabled()) {
            return FullReason.STATIC_CAPACITY;
        }
        double scaled = Math.floor(size * policy.growthFactor());
        if (scaled <= slots.length) {
            return FullReason.NO_EFFECTIVE_GROWTH;
        }
        int target = (int) Math.min(scaled, MAX_CAPACITY);
        target = Math.max(target, policy.minSize());
        if (target <= slots.length) {
            return FullReason.NO_EFFECTIVE_GROWTH;
        }
        try {
            resize(target);
        } catch (AllocationDeniedException e) {
            failedAllocations++;
            return FullReason.ALLOCATION_DENIED;
        }
        growCount++;
        return null;
    }

    private boolean shouldShrink() {
        if (!policy.shrinkEnabled() || size < policy.minSize()) {
            return false;
        }
        return (double) size / (double) slots.length < policy.shrinkFactor();
    }

    private void resize(int newCapacity) {
        Object[] next = allocate(newCapacity);
        int fromHead = slots.length - head;
        if (fromHead >= size) {
            System.arraycopy(slots, head, next, 0, size);
        } else {
            System.arraycopy(slots, head, next, 0, fromHead);
            System.arraycopy(slots, 0, next, fromHead, size - fromHead);
        }
        slots = next;
        head = 0;
    }

    private Object[] allocate(int capacity) {
        Object[] store = allocator.allocate(capacity);
        if (store == null || store.length != capacity) {
            throw new AllocationDeniedException(capacity);
        }
        return store;
    }

    private int physical(int offset) {
        int wrap = slots.length - head;
        return offset < wrap ? head + offset : offset - wrap;
    }
}
