package com.exprtree.types;

public record LValueType(Type objectType) implements Type {
    @Override
    public String getString() {
        return "@lvalue " + objectType.getString();
    }

    @Override
    public Type getRValueType() {
        return objectType;
    }
}
