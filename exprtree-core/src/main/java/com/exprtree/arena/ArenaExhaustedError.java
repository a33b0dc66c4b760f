package com.exprtree.arena;

/**
 * Thrown when an arena cannot satisfy an allocation.
 * Fatal to the compilation unit that owns the arena.
 */
public class ArenaExhaustedError extends Error {

    public ArenaExhaustedError(long requested, long used, long capacity) {
        super("Arena exhausted: requested " + requested + " bytes with "
            + used + " of " + capacity + " bytes in use");
    }
}
