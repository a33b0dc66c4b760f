package com.exprtree.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only in-memory declaration table.
 */
public final class SimpleDeclTable implements DeclTable {

    private final List<ValueDecl> decls = new ArrayList<>();

    public DeclRef add(ValueDecl decl) {
        decls.add(decl);
        return new DeclRef(decls.size() - 1);
    }

    @Override
    public ValueDecl lookup(DeclRef ref) {
        if (ref.index() >= decls.size()) {
            throw new IllegalArgumentException("Unknown declaration #" + ref.index());
        }
        return decls.get(ref.index());
    }

    public int size() {
        return decls.size();
    }
}
