package com.exprtree.ast;

import com.exprtree.types.ArchetypeType;
import com.exprtree.types.Type;

/**
 * Binding of one archetype to a concrete type at a generic use site.
 */
public record Substitution(ArchetypeType archetype, Type replacement) {
}
