package com.exprtree.types;

/**
 * Placeholder assigned to nodes the type checker could not resolve yet.
 */
public enum UnresolvedType implements Type {
    INSTANCE;

    @Override
    public String getString() {
        return "<<unresolved type>>";
    }

    @Override
    public boolean isUnresolved() {
        return true;
    }
}
