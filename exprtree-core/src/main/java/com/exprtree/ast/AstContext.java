package com.exprtree.ast;

import com.exprtree.arena.Arena;
import com.exprtree.arena.ArenaBlock;
import com.exprtree.arena.BumpArena;
import com.exprtree.arena.NodeLayout;
import com.exprtree.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns the arena every node of one tree is placed in.
 *
 * <p>Each expression record exposes a {@code create(AstContext, ...)} factory
 * that reserves its storage here. Closing the context tears down the arena;
 * nodes built from it must not be used afterwards.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * try (AstContext ctx = new AstContext()) {
 *     Expr one = IntegerLiteralExpr.create(ctx, "1", SourceLoc.at(0));
 *     ...
 * }
 * }</pre>
 */
public final class AstContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AstContext.class);

    private final Arena arena;

    public AstContext() {
        this(new BumpArena());
    }

    public AstContext(Arena arena) {
        this.arena = arena;
    }

    public Arena arena() {
        return arena;
    }

    /**
     * Reserves a fixed-size node of the given kind with no type yet.
     */
    public ExprHeader allocate(ExprKind kind) {
        return allocate(kind, null);
    }

    /**
     * Reserves a fixed-size node whose type is known at construction.
     */
    public ExprHeader allocate(ExprKind kind, Type type) {
        NodeLayout layout = NodeLayouts.forKind(kind);
        ArenaBlock block = arena.allocate(layout.headerSize(), layout.alignment());
        return new ExprHeader(kind, block, type);
    }

    /**
     * Reserves one contiguous block for a node header followed by
     * {@code count} trailing elements of {@code elementSize} bytes each.
     */
    public ExprHeader allocateTrailing(ExprKind kind, int count, long elementSize) {
        NodeLayout layout = NodeLayouts.forKind(kind);
        ArenaBlock block = arena.allocate(layout.sizeWithTrailing(count, elementSize), layout.alignment());
        return new ExprHeader(kind, block, null);
    }

    /**
     * Copies a child list into arena-owned storage. Null entries are kept;
     * some variants use them for omitted children.
     */
    public <T> List<T> allocateCopy(List<? extends T> elements) {
        arena.allocate((long) elements.size() * NodeLayout.REFERENCE_SIZE, NodeLayout.NODE_ALIGNMENT);
        return Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public void close() {
        if (!arena.isTornDown()) {
            LOG.debug("Releasing AST arena holding {} blocks", arena.blockCount());
            arena.tearDown();
        }
    }
}
