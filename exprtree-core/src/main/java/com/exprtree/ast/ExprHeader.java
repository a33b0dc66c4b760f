package com.exprtree.ast;

import com.exprtree.arena.ArenaBlock;
import com.exprtree.types.Type;

/**
 * Fields shared by every expression node: its arena placement and the
 * type slot the type checker fills in exactly once.
 *
 * <p>Headers are only created by {@link AstContext}, for one node kind,
 * and belong to the first node built on them.</p>
 */
public final class ExprHeader {

    private final ExprKind kind;
    private final ArenaBlock block;
    private Type type;
    private boolean claimed;

    ExprHeader(ExprKind kind, ArenaBlock block, Type type) {
        this.kind = kind;
        this.block = block;
        this.type = type;
    }

    /**
     * Binds the header to the node being constructed on it.
     *
     * @throws IllegalArgumentException if it was allocated for another kind
     * @throws IllegalStateException if another node already owns it
     */
    void claim(ExprKind nodeKind) {
        if (nodeKind != kind) {
            throw new IllegalArgumentException(
                "Header allocated for " + kind.getKindName() + " used by " + nodeKind.getKindName());
        }
        if (claimed) {
            throw new IllegalStateException("Header already belongs to a " + kind.getKindName() + " node");
        }
        claimed = true;
    }

    public ArenaBlock block() {
        return block;
    }

    /**
     * Bytes reserved for the node, header plus any trailing elements.
     */
    public long allocatedSize() {
        return block.size();
    }

    public Type getType() {
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    void setType(Type type) {
        if (type == null) {
            throw new IllegalArgumentException("Cannot reset an expression type to null");
        }
        if (this.type != null) {
            throw new IllegalStateException(
                "Expression type already resolved to '" + this.type.getString() + "'");
        }
        this.type = type;
    }
}
