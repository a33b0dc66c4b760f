package com.exprtree.ast;

/**
 * Declaration storage owned outside the expression arena.
 */
public interface DeclTable {

    /**
     * @throws IllegalArgumentException if the handle does not belong to this table
     */
    ValueDecl lookup(DeclRef ref);

    default String nameOf(DeclRef ref) {
        return lookup(ref).name();
    }
}
