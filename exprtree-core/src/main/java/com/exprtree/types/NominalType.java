package com.exprtree.types;

/**
 * A named struct, class, or protocol type.
 */
public record NominalType(String name) implements Type {
    @Override
    public String getString() {
        return name;
    }
}
