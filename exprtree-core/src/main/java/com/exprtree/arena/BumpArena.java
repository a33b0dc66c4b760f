package com.exprtree.arena;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded bump-pointer arena with a fixed capacity.
 */
public final class BumpArena implements Arena {

    private static final Logger LOG = LoggerFactory.getLogger(BumpArena.class);

    /** 64 MiB, enough for any realistic single compilation unit. */
    public static final long DEFAULT_CAPACITY = 64L * 1024 * 1024;

    private final long capacity;
    private long top = 0;
    private long bytesAllocated = 0;
    private int blockCount = 0;
    private boolean tornDown = false;

    public BumpArena() {
        this(DEFAULT_CAPACITY);
    }

    public BumpArena(long capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Arena capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        LOG.debug("Created arena with capacity {} bytes", capacity);
    }

    @Override
    public ArenaBlock allocate(long size, int alignment) {
        if (tornDown) {
            throw new IllegalStateException("Allocation from an arena that has been torn down");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Negative allocation size: " + size);
        }
        if (Integer.bitCount(alignment) != 1) {
            throw new IllegalArgumentException("Alignment must be a power of two: " + alignment);
        }
        long start = NodeLayout.alignUp(top, alignment);
        if (start + size > capacity) {
            throw new ArenaExhaustedError(size, top, capacity);
        }
        top = start + size;
        bytesAllocated += size;
        blockCount++;
        return new ArenaBlock(start, size, alignment);
    }

    @Override
    public long bytesAllocated() {
        return bytesAllocated;
    }

    @Override
    public int blockCount() {
        return blockCount;
    }

    public long capacity() {
        return capacity;
    }

    @Override
    public boolean isTornDown() {
        return tornDown;
    }

    @Override
    public void tearDown() {
        if (tornDown) {
            return;
        }
        LOG.debug("Tearing down arena: {} blocks, {} bytes ({} with padding)",
            blockCount, bytesAllocated, top);
        tornDown = true;
    }
}
