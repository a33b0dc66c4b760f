package com.exprtree.ast;

/**
 * Non-owning handle to a declaration held in a {@link DeclTable}.
 */
public record DeclRef(int index) {
    public DeclRef {
        if (index < 0) {
            throw new IllegalArgumentException("Negative declaration index: " + index);
        }
    }
}
