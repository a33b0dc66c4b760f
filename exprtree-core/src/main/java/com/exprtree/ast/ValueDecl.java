package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * The parts of a declaration the expression layer may look at.
 *
 * @param name declared name
 * @param typeOfReference type of an expression referring to the declaration
 * @param flavor what sort of declaration this is
 * @param isStatic whether a member is declared static
 */
public record ValueDecl(String name, Type typeOfReference, DeclFlavor flavor, boolean isStatic) {

    public static ValueDecl var(String name, Type type) {
        return new ValueDecl(name, type, DeclFlavor.VAR, false);
    }

    public static ValueDecl func(String name, Type type) {
        return new ValueDecl(name, type, DeclFlavor.FUNC, false);
    }

    public boolean isTypeDecl() {
        return flavor == DeclFlavor.TYPE;
    }
}
