package com.exprtree.types;

import java.util.List;
import java.util.stream.Collectors;

public record TupleType(List<Type> elements) implements Type {
    private static final TupleType EMPTY = new TupleType(List.of());

    public TupleType {
        elements = List.copyOf(elements);
    }

    /** The empty tuple, {@code ()}. */
    public static TupleType empty() {
        return EMPTY;
    }

    @Override
    public String getString() {
        return elements.stream()
            .map(Type::getString)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
