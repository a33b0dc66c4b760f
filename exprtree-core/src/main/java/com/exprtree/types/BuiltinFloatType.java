package com.exprtree.types;

public record BuiltinFloatType(FloatFormat format) implements Type {
    @Override
    public String getString() {
        return switch (format) {
            case IEEE_HALF -> "Builtin.FPIEEE16";
            case IEEE_SINGLE -> "Builtin.FPIEEE32";
            case IEEE_DOUBLE -> "Builtin.FPIEEE64";
            case IEEE_QUAD -> "Builtin.FPIEEE128";
        };
    }
}
