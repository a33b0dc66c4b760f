package com.exprtree.arena;

/**
 * Bump allocator collaborator that owns the storage of every node in one tree.
 *
 * <p>Blocks are never freed individually. The whole arena is released by
 * {@link #tearDown()}, after which no node allocated from it may be used.
 * Implementations are not safe for concurrent allocation; parallel parsing
 * units each own their own arena.</p>
 */
public interface Arena {

    /**
     * Places a zero-initialized block of {@code size} bytes at the requested alignment.
     *
     * @param size number of bytes, at least zero
     * @param alignment power-of-two alignment of the block start
     * @return the placement of the new block
     * @throws ArenaExhaustedError if the arena cannot satisfy the request
     */
    ArenaBlock allocate(long size, int alignment);

    /**
     * Total bytes handed out so far, excluding alignment padding.
     */
    long bytesAllocated();

    /**
     * Number of blocks handed out so far.
     */
    int blockCount();

    boolean isTornDown();

    /**
     * Releases every block at once.
     */
    void tearDown();
}
