package com.exprtree.types;

/**
 * A generic parameter as seen from inside its generic context.
 */
public record ArchetypeType(String fullName) implements Type {
    @Override
    public String getString() {
        return fullName;
    }
}
