package com.exprtree.arena;

/**
 * One placement inside an arena.
 */
public record ArenaBlock(long offset, long size, int alignment) {
    public long end() {
        return offset + size;
    }
}
