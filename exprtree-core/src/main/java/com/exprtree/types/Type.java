package com.exprtree.types;

/**
 * A resolved type as seen by the expression layer.
 *
 * <p>Types are owned by the type checker. Expression nodes only store them,
 * ask for their display string, and (for literal decoding) their bit layout.</p>
 */
public sealed interface Type permits
    BuiltinIntegerType,
    BuiltinFloatType,
    NominalType,
    TupleType,
    FunctionType,
    MetatypeType,
    ArchetypeType,
    LValueType,
    ErrorType,
    UnresolvedType {

    /**
     * Stable display form, used by the printer and the JSON dump.
     */
    String getString();

    /**
     * The type of the value stored in an lvalue, or this type itself.
     */
    default Type getRValueType() {
        return this;
    }

    default boolean isUnresolved() {
        return false;
    }

    default boolean isError() {
        return false;
    }
}
