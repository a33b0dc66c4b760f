package com.exprtree.ast;

import com.exprtree.types.Type;

/**
 * Base interface for all expression nodes.
 *
 * <p>Every variant is a record allocated through an {@link AstContext}; its
 * first component is the {@link ExprHeader}. Nodes are immutable apart from
 * the type slot, which is written once by the type checker.</p>
 *
 * <p>{@link #sourceRange()} has no default: each variant states its own
 * range, so a new variant that forgets it does not compile. {@link #loc()}
 * does have one. Variants without a better anchor deliberately fall back
 * to the start of their range.</p>
 */
public sealed interface Expr permits
    LiteralExpr,
    OverloadSetRefExpr,
    ImplicitConversionExpr,
    CapturingExpr,
    ApplyExpr,
    ExplicitCastExpr,
    ErrorExpr,
    DeclRefExpr,
    SuperRefExpr,
    OtherConstructorDeclRefExpr,
    UnresolvedConstructorExpr,
    UnresolvedDeclRefExpr,
    UnresolvedIfExpr,
    UnresolvedElseExpr,
    UnresolvedSpecializeExpr,
    MemberRefExpr,
    ExistentialMemberRefExpr,
    ArchetypeMemberRefExpr,
    GenericMemberRefExpr,
    UnresolvedMemberExpr,
    ParenExpr,
    TupleExpr,
    ArrayExpr,
    DictionaryExpr,
    SubscriptExpr,
    ExistentialSubscriptExpr,
    ArchetypeSubscriptExpr,
    GenericSubscriptExpr,
    UnresolvedDotExpr,
    ModuleExpr,
    TupleElementExpr,
    AddressOfExpr,
    SequenceExpr,
    NewArrayExpr,
    MetatypeExpr,
    OpaqueValueExpr,
    ZeroValueExpr,
    DotSyntaxBaseIgnoredExpr,
    RebindThisInConstructorExpr,
    IfExpr,
    DefaultValueExpr {

    ExprHeader header();

    ExprKind kind();

    /**
     * Full extent of the node in the source.
     */
    SourceRange sourceRange();

    /**
     * The single location diagnostics point at.
     */
    default SourceLoc loc() {
        return sourceRange().start();
    }

    default SourceLoc startLoc() {
        return sourceRange().start();
    }

    default SourceLoc endLoc() {
        return sourceRange().end();
    }

    /**
     * The resolved type, or null before type checking.
     */
    default Type getType() {
        return header().getType();
    }

    default boolean hasType() {
        return header().hasType();
    }

    /**
     * Records the resolved type. May be called once per node.
     *
     * @throws IllegalStateException if the type was already set
     */
    default void setType(Type type) {
        header().setType(type);
    }

    <R> R accept(ExprVisitor<R> visitor);
}
