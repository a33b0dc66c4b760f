package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * A written type together with where it was written.
 */
public record TypeLoc(Type type, SourceRange range) {

    public static TypeLoc withoutLoc(Type type) {
        return new TypeLoc(type, SourceRange.INVALID);
    }

    public boolean hasLocation() {
        return range.isValid();
    }
}
