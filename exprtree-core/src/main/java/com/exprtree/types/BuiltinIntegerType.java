package com.exprtree.types;

public record BuiltinIntegerType(int bitWidth) implements Type {
    public BuiltinIntegerType {
        if (bitWidth <= 0) {
            throw new IllegalArgumentException("Bit width must be positive: " + bitWidth);
        }
    }

    @Override
    public String getString() {
        return "Builtin.Int" + bitWidth;
    }
}
