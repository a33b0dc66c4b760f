package com.exprtree.ast;

/**
 * One method per expression variant. Every record dispatches to exactly one
 * of these from {@link Expr#accept(ExprVisitor)}.
 *
 * @param <R> result of visiting a node
 */
public interface ExprVisitor<R> {

    default R visit(Expr expr) {
        return expr.accept(this);
    }

    R visitErrorExpr(ErrorExpr expr);

    R visitIntegerLiteralExpr(IntegerLiteralExpr expr);

    R visitFloatLiteralExpr(FloatLiteralExpr expr);

    R visitCharacterLiteralExpr(CharacterLiteralExpr expr);

    R visitStringLiteralExpr(StringLiteralExpr expr);

    R visitInterpolatedStringLiteralExpr(InterpolatedStringLiteralExpr expr);

    R visitDeclRefExpr(DeclRefExpr expr);

    R visitSuperRefExpr(SuperRefExpr expr);

    R visitOtherConstructorDeclRefExpr(OtherConstructorDeclRefExpr expr);

    R visitUnresolvedConstructorExpr(UnresolvedConstructorExpr expr);

    R visitOverloadedDeclRefExpr(OverloadedDeclRefExpr expr);

    R visitOverloadedMemberRefExpr(OverloadedMemberRefExpr expr);

    R visitUnresolvedDeclRefExpr(UnresolvedDeclRefExpr expr);

    R visitUnresolvedIfExpr(UnresolvedIfExpr expr);

    R visitUnresolvedElseExpr(UnresolvedElseExpr expr);

    R visitUnresolvedSpecializeExpr(UnresolvedSpecializeExpr expr);

    R visitMemberRefExpr(MemberRefExpr expr);

    R visitExistentialMemberRefExpr(ExistentialMemberRefExpr expr);

    R visitArchetypeMemberRefExpr(ArchetypeMemberRefExpr expr);

    R visitGenericMemberRefExpr(GenericMemberRefExpr expr);

    R visitUnresolvedMemberExpr(UnresolvedMemberExpr expr);

    R visitParenExpr(ParenExpr expr);

    R visitTupleExpr(TupleExpr expr);

    R visitArrayExpr(ArrayExpr expr);

    R visitDictionaryExpr(DictionaryExpr expr);

    R visitSubscriptExpr(SubscriptExpr expr);

    R visitExistentialSubscriptExpr(ExistentialSubscriptExpr expr);

    R visitArchetypeSubscriptExpr(ArchetypeSubscriptExpr expr);

    R visitGenericSubscriptExpr(GenericSubscriptExpr expr);

    R visitUnresolvedDotExpr(UnresolvedDotExpr expr);

    R visitModuleExpr(ModuleExpr expr);

    R visitTupleElementExpr(TupleElementExpr expr);

    R visitTupleShuffleExpr(TupleShuffleExpr expr);

    R visitFunctionConversionExpr(FunctionConversionExpr expr);

    R visitErasureExpr(ErasureExpr expr);

    R visitSpecializeExpr(SpecializeExpr expr);

    R visitLoadExpr(LoadExpr expr);

    R visitMaterializeExpr(MaterializeExpr expr);

    R visitRequalifyExpr(RequalifyExpr expr);

    R visitMetatypeConversionExpr(MetatypeConversionExpr expr);

    R visitDerivedToBaseExpr(DerivedToBaseExpr expr);

    R visitArchetypeToSuperExpr(ArchetypeToSuperExpr expr);

    R visitScalarToTupleExpr(ScalarToTupleExpr expr);

    R visitBridgeToBlockExpr(BridgeToBlockExpr expr);

    R visitAddressOfExpr(AddressOfExpr expr);

    R visitSequenceExpr(SequenceExpr expr);

    R visitFuncExpr(FuncExpr expr);

    R visitPipeClosureExpr(PipeClosureExpr expr);

    R visitImplicitClosureExpr(ImplicitClosureExpr expr);

    R visitNewArrayExpr(NewArrayExpr expr);

    R visitMetatypeExpr(MetatypeExpr expr);

    R visitOpaqueValueExpr(OpaqueValueExpr expr);

    R visitZeroValueExpr(ZeroValueExpr expr);

    R visitCallExpr(CallExpr expr);

    R visitPrefixUnaryExpr(PrefixUnaryExpr expr);

    R visitPostfixUnaryExpr(PostfixUnaryExpr expr);

    R visitBinaryExpr(BinaryExpr expr);

    R visitDotSyntaxCallExpr(DotSyntaxCallExpr expr);

    R visitConstructorRefCallExpr(ConstructorRefCallExpr expr);

    R visitDotSyntaxBaseIgnoredExpr(DotSyntaxBaseIgnoredExpr expr);

    R visitCoerceExpr(CoerceExpr expr);

    R visitUncheckedDowncastExpr(UncheckedDowncastExpr expr);

    R visitUncheckedSuperToArchetypeExpr(UncheckedSuperToArchetypeExpr expr);

    R visitIsSubtypeExpr(IsSubtypeExpr expr);

    R visitRebindThisInConstructorExpr(RebindThisInConstructorExpr expr);

    R visitIfExpr(IfExpr expr);

    R visitDefaultValueExpr(DefaultValueExpr expr);
}
