package com.exprtree.types;

public record FunctionType(Type input, Type result) implements Type {
    @Override
    public String getString() {
        return input.getString() + " -> " + result.getString();
    }
}
