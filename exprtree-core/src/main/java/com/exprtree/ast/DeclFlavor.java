package com.exprtree.ast;

public enum DeclFlavor {
    VAR,
    FUNC,
    CONSTRUCTOR,
    SUBSCRIPT,
    TYPE
}
