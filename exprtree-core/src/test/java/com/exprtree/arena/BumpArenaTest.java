package com.exprtree.arena;

import com.exprtree.ast.AstContext;
import com.exprtree.ast.IntegerLiteralExpr;
import com.exprtree.ast.SourceLoc;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BumpArenaTest {

    @Test
    void testAlignment() {
        BumpArena arena = new BumpArena(1024);
        ArenaBlock a = arena.allocate(3, 1);
        ArenaBlock b = arena.allocate(8, 8);
        ArenaBlock c = arena.allocate(4, 16);
        assertEquals(0, a.offset());
        assertEquals(8, b.offset());
        assertEquals(16, c.offset());
        assertEquals(15, arena.bytesAllocated());
        assertEquals(3, arena.blockCount());
        assertThrows(IllegalArgumentException.class, () -> arena.allocate(8, 3));
    }

    @Test
    void testExhaustionIsFatal() {
        BumpArena arena = new BumpArena(64);
        arena.allocate(48, 8);
        ArenaExhaustedError error = assertThrows(ArenaExhaustedError.class, () -> arena.allocate(24, 8));
        System.out.println(error.getMessage());
        // Exact fit still succeeds
        assertEquals(48, arena.allocate(16, 8).offset());
    }

    @Test
    void testTearDown() {
        BumpArena arena = new BumpArena();
        assertEquals(BumpArena.DEFAULT_CAPACITY, arena.capacity());
        arena.allocate(16, 8);
        arena.tearDown();
        assertTrue(arena.isTornDown());
        assertThrows(IllegalStateException.class, () -> arena.allocate(16, 8));
        arena.tearDown();
    }

    @Test
    void testContextOwnsArena() {
        BumpArena arena = new BumpArena(4096);
        try (AstContext ctx = new AstContext(arena)) {
            IntegerLiteralExpr.create(ctx, "1", SourceLoc.at(0));
            assertEquals(1, arena.blockCount());
            assertEquals(NodeLayout.of(1, 1, 0).headerSize(), arena.bytesAllocated());
        }
        assertTrue(arena.isTornDown());
    }

    @Test
    void testLayoutArithmetic() {
        assertEquals(32, NodeLayout.of(1, 1, 0).headerSize());
        assertEquals(24, NodeLayout.of(0, 2, 0).headerSize());
        assertEquals(16, NodeLayout.of(0, 0, 0).headerSize());
        assertEquals(32 + 3 * 16, NodeLayout.of(1, 1, 0).sizeWithTrailing(3, 16));
        assertThrows(IllegalArgumentException.class, () -> NodeLayout.of(0, 0, 0).sizeWithTrailing(-1, 8));
    }
}
