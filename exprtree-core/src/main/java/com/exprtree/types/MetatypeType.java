package com.exprtree.types;

/**
 * The type of a type, {@code T.metatype}.
 */
public record MetatypeType(Type instanceType) implements Type {
    @Override
    public String getString() {
        return instanceType.getString() + ".metatype";
    }
}
