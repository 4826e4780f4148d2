package com.acme.compute.eventlog.queue;

/**
 * Per-instance capacity policy of a {@link RingQueue}.
 *
 * <p>{@code growthFactor <= 1.0} puts the queue in static-capacity mode: a full
 * queue rejects pushes instead of reallocating. {@code shrinkFactor == 0.0}
 * disables shrinking, so capacity only ever grows.</p>
 *
 * <p>When both growth and shrinking are enabled, {@code shrinkFactor * growthFactor}
 * must stay below 1. Right after a growth from {@code n} to {@code n * growthFactor}
 * the occupancy is about {@code 1 / growthFactor}, so the first pops after a growth
 * can never trigger a shrink and a queue sitting at one occupancy cannot alternate
 * between growing and shrinking.</p>
 *
 * @param minSize      size below which the queue never shrinks, and the smallest
 *                     capacity a growth produces
 * @param growthFactor multiplier applied to the size of a full queue
 * @param shrinkFactor occupancy ratio below which the store is shrunk to fit
 */
public record RingQueuePolicy(int minSize, double growthFactor, double shrinkFactor) {

    public static final int DEFAULT_MIN_SIZE = 16;
    public static final double DEFAULT_GROWTH_FACTOR = 2.0d;
    public static final double DEFAULT_SHRINK_FACTOR = 0.0d;

    public static final RingQueuePolicy DEFAULT =
        new RingQueuePolicy(DEFAULT_MIN_SIZE, DEFAULT_GROWTH_FACTOR, DEFAULT_SHRINK_FACTOR);

    public RingQueuePolicy {
        if (minSize < 1) {
            throw new IllegalArgumentException("minSize must be >= 1, got " + minSize);
        }
        if (!Double.isFinite(growthFactor)) {
            throw new IllegalArgumentException("growthFactor must be finite, got " + growthFactor);
        }
        if (!Double.isFinite(shrinkFactor) || shrinkFactor < 0.0d || shrinkFactor >= 1.0d) {
            throw new IllegalArgumentException("shrinkFactor must be in [0, 1), got " + shrinkFactor);
        }
        if (shrinkFactor > 0.0d) {
            if (growthFactor <= 1.0d) {
                throw new IllegalArgumentException(
                    "shrinking requires growth; static-capacity queue cannot shrink (shrinkFactor="
                        + shrinkFactor + ")");
            }
            if (shrinkFactor * growthFactor >= 1.0d) {
                throw new IllegalArgumentException(
                    "shrinkFactor * growthFactor must be < 1 to avoid resize oscillation, got "
                        + shrinkFactor + " * " + growthFactor);
            }
        }
    }

    /** Fixed capacity: full queues reject, nothing is ever reallocated. */
    public static RingQueuePolicy staticCapacity() {
        return new RingQueuePolicy(DEFAULT_MIN_SIZE, 1.0d, 0.0d);
    }

    public RingQueuePolicy withMinSize(int minSize) {
        return new RingQueuePolicy(minSize, growthFactor, shrinkFactor);
    }

    public RingQueuePolicy withGrowthFactor(double growthFactor) {
        return new RingQueuePolicy(minSize, growthFactor, shrinkFactor);
    }

    public RingQueuePolicy withShrinkFactor(double shrinkFactor) {
        return new RingQueuePolicy(minSize, growthFactor, shrinkFactor);
    }

    public boolean growthEnabled() {
        return growthFactor > 1.0d;
    }

    public boolean shrinkEnabled() {
        return shrinkFactor > 0.0d;
    }
}
