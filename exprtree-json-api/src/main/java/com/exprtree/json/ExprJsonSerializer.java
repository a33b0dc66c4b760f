package com.exprtree.json;

import com.exprtree.ast.Expr;

/**
 * Interface for serializing expression trees to JSON.
 */
public interface ExprJsonSerializer {

    /**
     * Serializes an expression and all of its children to a JSON string.
     *
     * @param expr the root of the tree to serialize
     * @return the JSON representation of the tree
     * @throws ExprJsonException if serialization fails
     */
    String serialize(Expr expr) throws ExprJsonException;

    /**
     * Serializes an expression to a pretty-printed JSON string.
     *
     * @param expr the root of the tree to serialize
     * @return the pretty-printed JSON representation of the tree
     * @throws ExprJsonException if serialization fails
     */
    String serializePretty(Expr expr) throws ExprJsonException;
}
