package com.exprtree;

import com.exprtree.ast.*;
import com.exprtree.types.Type;

import java.io.PrintStream;
import java.util.List;

/**
 * Renders an expression tree as an indented S-expression, one node per line.
 *
 * <pre>
 * (call_expr type='Int'
 *   (declref_expr type='Int -&gt; Int' decl=f)
 *   (paren_expr type='Int'
 *     (integer_literal_expr type='Int' value=1)))
 * </pre>
 *
 * <p>Output is deterministic: the same tree and declarations always print
 * the same text. Declaration names are resolved through the supplied
 * {@link DeclTable}.</p>
 */
public final class ExprPrinter implements ExprVisitor<Void> {

    private final StringBuilder out;
    private final DeclTable decls;
    private int indent;

    private ExprPrinter(StringBuilder out, DeclTable decls, int indent) {
        this.out = out;
        this.decls = decls;
        this.indent = indent;
    }

    public static String print(Expr expr, DeclTable decls) {
        return print(expr, decls, 0);
    }

    public static String print(Expr expr, DeclTable decls, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("Negative indent: " + indent);
        }
        StringBuilder sb = new StringBuilder();
        expr.accept(new ExprPrinter(sb, decls, indent));
        return sb.toString();
    }

    /**
     * Writes the tree followed by a newline.
     */
    public static void dump(Expr expr, DeclTable decls, PrintStream stream) {
        stream.println(print(expr, decls));
    }

    // Helpers

    private ExprPrinter indent(int n) {
        for (int i = 0; i < n; i++) {
            out.append(' ');
        }
        return this;
    }

    private StringBuilder printCommon(Expr expr, String name) {
        indent(indent);
        Type type = expr.getType();
        return out.append('(').append(name).append(" type='")
            .append(type == null ? "<null>" : type.getString()).append('\'');
    }

    private void printRec(Expr expr) {
        indent += 2;
        if (expr != null) {
            expr.accept(this);
        } else {
            indent(indent);
            out.append("(**NULL EXPRESSION**)");
        }
        indent -= 2;
    }

    private void printRec(Stmt stmt) {
        indent += 2;
        printStmt(stmt);
        indent -= 2;
    }

    private void printStmt(Stmt stmt) {
        indent(indent);
        if (stmt instanceof BraceStmt brace) {
            out.append("(brace_stmt");
            for (Stmt element : brace.elements()) {
                out.append('\n');
                printRec(element);
            }
        } else if (stmt instanceof ReturnStmt ret) {
            out.append("(return_stmt");
            if (ret.getResult() != null) {
                out.append('\n');
                printRec(ret.getResult());
            }
        } else if (stmt instanceof ExprStmt exprStmt) {
            out.append("(expr_stmt\n");
            printRec(exprStmt.expr());
        }
        out.append(')');
    }

    private void printSubstitutions(List<Substitution> substitutions) {
        for (Substitution s : substitutions) {
            indent(indent + 2);
            out.append("(with ").append(s.archetype().getString())
                .append(" = ").append(s.replacement().getString()).append(")\n");
        }
    }

    private void printOverloads(List<DeclRef> overloads) {
        for (DeclRef decl : overloads) {
            out.append('\n');
            indent(indent);
            out.append("  type=").append(decls.lookup(decl).typeOfReference().getString());
        }
    }

    private StringBuilder printCapturing(CapturingExpr expr, String name) {
        printCommon(expr, name);
        List<DeclRef> captures = expr.captures();
        if (!captures.isEmpty()) {
            out.append(" captures=(").append(decls.nameOf(captures.get(0)));
            for (DeclRef capture : captures.subList(1, captures.size())) {
                out.append(", ").append(decls.nameOf(capture));
            }
            out.append(')');
        }
        return out;
    }

    private Void printWrapper(ImplicitConversionExpr expr, String name) {
        printCommon(expr, name).append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    private Void printApply(ApplyExpr expr, String name) {
        printCommon(expr, name);
        if (expr.isSuper()) {
            out.append(" super");
        }
        out.append('\n');
        printRec(expr.fn());
        out.append('\n');
        printRec(expr.arg());
        out.append(')');
        return null;
    }

    private Void printCast(ExplicitCastExpr expr, String name) {
        printCommon(expr, name).append(' ').append(expr.castTypeLoc().type().getString()).append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    private Void printMemberRef(Expr expr, String name, DeclRef decl, Expr base) {
        printCommon(expr, name).append(" decl=").append(decls.nameOf(decl)).append('\n');
        printRec(base);
        out.append(')');
        return null;
    }

    private Void printSubscript(Expr expr, String name, Expr base, Expr index, List<Substitution> substitutions) {
        printCommon(expr, name).append('\n');
        printSubstitutions(substitutions);
        printRec(base);
        out.append('\n');
        printRec(index);
        out.append(')');
        return null;
    }

    // Literals

    @Override
    public Void visitErrorExpr(ErrorExpr expr) {
        printCommon(expr, "error_expr").append(')');
        return null;
    }

    @Override
    public Void visitIntegerLiteralExpr(IntegerLiteralExpr expr) {
        printCommon(expr, "integer_literal_expr").append(" value=");
        Type type = expr.getType();
        if (type == null || type.isUnresolved()) {
            out.append(expr.text());
        } else {
            out.append(expr.value());
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitFloatLiteralExpr(FloatLiteralExpr expr) {
        printCommon(expr, "float_literal_expr").append(" value=").append(expr.text()).append(')');
        return null;
    }

    @Override
    public Void visitCharacterLiteralExpr(CharacterLiteralExpr expr) {
        printCommon(expr, "character_literal_expr").append(" value=").append(expr.value()).append(')');
        return null;
    }

    @Override
    public Void visitStringLiteralExpr(StringLiteralExpr expr) {
        printCommon(expr, "string_literal_expr").append(" value=").append(expr.value()).append(')');
        return null;
    }

    @Override
    public Void visitInterpolatedStringLiteralExpr(InterpolatedStringLiteralExpr expr) {
        printCommon(expr, "interpolated_string_literal_expr");
        for (Expr segment : expr.segments()) {
            out.append('\n');
            printRec(segment);
        }
        out.append(')');
        return null;
    }

    // References

    @Override
    public Void visitDeclRefExpr(DeclRefExpr expr) {
        printCommon(expr, "declref_expr").append(" decl=").append(decls.nameOf(expr.decl())).append(')');
        return null;
    }

    @Override
    public Void visitSuperRefExpr(SuperRefExpr expr) {
        printCommon(expr, "super_ref_expr").append(')');
        return null;
    }

    @Override
    public Void visitOtherConstructorDeclRefExpr(OtherConstructorDeclRefExpr expr) {
        printCommon(expr, "other_constructor_ref_expr").append(')');
        return null;
    }

    @Override
    public Void visitUnresolvedConstructorExpr(UnresolvedConstructorExpr expr) {
        printCommon(expr, "unresolved_constructor").append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitOverloadedDeclRefExpr(OverloadedDeclRefExpr expr) {
        printCommon(expr, "overloaded_decl_ref_expr")
            .append(" name=").append(decls.nameOf(expr.decls().get(0)))
            .append(" #decls=").append(expr.decls().size());
        printOverloads(expr.decls());
        out.append(')');
        return null;
    }

    @Override
    public Void visitOverloadedMemberRefExpr(OverloadedMemberRefExpr expr) {
        printCommon(expr, "overloaded_member_ref_expr")
            .append(" name=").append(decls.nameOf(expr.decls().get(0)))
            .append(" #decls=").append(expr.decls().size()).append('\n');
        printRec(expr.base());
        printOverloads(expr.decls());
        out.append(')');
        return null;
    }

    @Override
    public Void visitUnresolvedDeclRefExpr(UnresolvedDeclRefExpr expr) {
        printCommon(expr, "unresolved_decl_ref_expr").append(" name=").append(expr.name()).append(')');
        return null;
    }

    @Override
    public Void visitUnresolvedIfExpr(UnresolvedIfExpr expr) {
        printCommon(expr, "unresolved_if_expr").append(')');
        return null;
    }

    @Override
    public Void visitUnresolvedElseExpr(UnresolvedElseExpr expr) {
        printCommon(expr, "unresolved_else_expr").append(')');
        return null;
    }

    @Override
    public Void visitUnresolvedSpecializeExpr(UnresolvedSpecializeExpr expr) {
        printCommon(expr, "unresolved_specialize_expr").append('\n');
        printRec(expr.subExpr());
        for (TypeLoc param : expr.unresolvedParams()) {
            out.append('\n');
            indent(indent + 2);
            out.append(param.type().getString());
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitMemberRefExpr(MemberRefExpr expr) {
        return printMemberRef(expr, "member_ref_expr", expr.decl(), expr.base());
    }

    @Override
    public Void visitExistentialMemberRefExpr(ExistentialMemberRefExpr expr) {
        return printMemberRef(expr, "existential_member_ref_expr", expr.decl(), expr.base());
    }

    @Override
    public Void visitArchetypeMemberRefExpr(ArchetypeMemberRefExpr expr) {
        return printMemberRef(expr, "archetype_member_ref_expr", expr.decl(), expr.base());
    }

    @Override
    public Void visitGenericMemberRefExpr(GenericMemberRefExpr expr) {
        printCommon(expr, "generic_member_ref_expr").append(" decl=").append(decls.nameOf(expr.decl())).append('\n');
        printSubstitutions(expr.substitutions());
        printRec(expr.base());
        out.append(')');
        return null;
    }

    @Override
    public Void visitUnresolvedMemberExpr(UnresolvedMemberExpr expr) {
        printCommon(expr, "unresolved_member_expr").append(" name='").append(expr.name()).append("')");
        return null;
    }

    // Aggregates

    @Override
    public Void visitParenExpr(ParenExpr expr) {
        printCommon(expr, "paren_expr");
        if (expr.hasTrailingClosure()) {
            out.append(" trailing-closure");
        }
        out.append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitTupleExpr(TupleExpr expr) {
        printCommon(expr, "tuple_expr");
        if (expr.hasTrailingClosure()) {
            out.append(" trailing-closure");
        }
        for (int i = 0, e = expr.numElements(); i != e; ++i) {
            out.append('\n');
            if (expr.element(i) != null) {
                printRec(expr.element(i));
            } else {
                indent(indent + 2);
                out.append("<<tuple element default value>>");
            }
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitArrayExpr(ArrayExpr expr) {
        printCommon(expr, "array_expr").append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitDictionaryExpr(DictionaryExpr expr) {
        printCommon(expr, "dictionary_expr").append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitSubscriptExpr(SubscriptExpr expr) {
        return printSubscript(expr, "subscript_expr", expr.base(), expr.index(), List.of());
    }

    @Override
    public Void visitExistentialSubscriptExpr(ExistentialSubscriptExpr expr) {
        return printSubscript(expr, "existential_subscript_expr", expr.base(), expr.index(), List.of());
    }

    @Override
    public Void visitArchetypeSubscriptExpr(ArchetypeSubscriptExpr expr) {
        return printSubscript(expr, "archetype_subscript_expr", expr.base(), expr.index(), List.of());
    }

    @Override
    public Void visitGenericSubscriptExpr(GenericSubscriptExpr expr) {
        return printSubscript(expr, "generic_subscript_expr", expr.base(), expr.index(), expr.substitutions());
    }

    @Override
    public Void visitUnresolvedDotExpr(UnresolvedDotExpr expr) {
        printCommon(expr, "unresolved_dot_expr").append(" field '").append(expr.name()).append('\'');
        if (expr.base() != null) {
            out.append('\n');
            printRec(expr.base());
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitModuleExpr(ModuleExpr expr) {
        printCommon(expr, "module_expr").append(')');
        return null;
    }

    @Override
    public Void visitTupleElementExpr(TupleElementExpr expr) {
        printCommon(expr, "tuple_element_expr").append(" field #").append(expr.fieldNumber()).append('\n');
        printRec(expr.base());
        out.append(')');
        return null;
    }

    // Implicit conversions

    @Override
    public Void visitTupleShuffleExpr(TupleShuffleExpr expr) {
        printCommon(expr, "tuple_shuffle_expr").append(" elements=[");
        List<Integer> mapping = expr.elementMapping();
        for (int i = 0, e = mapping.size(); i != e; ++i) {
            if (i != 0) {
                out.append(", ");
            }
            out.append(mapping.get(i));
        }
        out.append("]\n");
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitFunctionConversionExpr(FunctionConversionExpr expr) {
        return printWrapper(expr, "function_conversion_expr");
    }

    @Override
    public Void visitErasureExpr(ErasureExpr expr) {
        return printWrapper(expr, "erasure_expr");
    }

    @Override
    public Void visitSpecializeExpr(SpecializeExpr expr) {
        printCommon(expr, "specialize_expr").append('\n');
        printSubstitutions(expr.substitutions());
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitLoadExpr(LoadExpr expr) {
        return printWrapper(expr, "load_expr");
    }

    @Override
    public Void visitMaterializeExpr(MaterializeExpr expr) {
        return printWrapper(expr, "materialize_expr");
    }

    @Override
    public Void visitRequalifyExpr(RequalifyExpr expr) {
        return printWrapper(expr, "requalify_expr");
    }

    @Override
    public Void visitMetatypeConversionExpr(MetatypeConversionExpr expr) {
        return printWrapper(expr, "metatype_conversion_expr");
    }

    @Override
    public Void visitDerivedToBaseExpr(DerivedToBaseExpr expr) {
        return printWrapper(expr, "derived_to_base_expr");
    }

    @Override
    public Void visitArchetypeToSuperExpr(ArchetypeToSuperExpr expr) {
        return printWrapper(expr, "archetype_to_super_expr");
    }

    @Override
    public Void visitScalarToTupleExpr(ScalarToTupleExpr expr) {
        printCommon(expr, "scalar_to_tuple_expr").append(" field=").append(expr.scalarField()).append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitBridgeToBlockExpr(BridgeToBlockExpr expr) {
        return printWrapper(expr, "bridge_to_block");
    }

    // Everything else

    @Override
    public Void visitAddressOfExpr(AddressOfExpr expr) {
        printCommon(expr, "address_of_expr").append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitSequenceExpr(SequenceExpr expr) {
        printCommon(expr, "sequence_expr");
        for (Expr element : expr.elements()) {
            out.append('\n');
            printRec(element);
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitFuncExpr(FuncExpr expr) {
        printCapturing(expr, "func_expr");
        if (expr.body() != null) {
            out.append('\n');
            printRec(expr.body());
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitPipeClosureExpr(PipeClosureExpr expr) {
        printCapturing(expr, "closure_expr");
        if (expr.hasSingleExpressionBody()) {
            out.append(" single-expression\n");
            printRec(expr.singleExpressionBody());
        } else {
            out.append('\n');
            printRec(expr.body());
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitImplicitClosureExpr(ImplicitClosureExpr expr) {
        printCapturing(expr, "implicit_closure_expr").append('\n');
        printRec(expr.body());
        out.append(')');
        return null;
    }

    @Override
    public Void visitNewArrayExpr(NewArrayExpr expr) {
        printCommon(expr, "new_array_expr")
            .append(" elementType='").append(expr.elementTypeLoc().type().getString()).append('\'');
        if (expr.hasInjectionFunction()) {
            out.append('\n');
            printRec(expr.injectionFunction());
        }
        for (NewArrayExpr.Bound bound : expr.bounds()) {
            out.append('\n');
            if (bound.value() != null) {
                printRec(bound.value());
            } else {
                indent(indent + 2);
                out.append("(empty bound)");
            }
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitMetatypeExpr(MetatypeExpr expr) {
        printCommon(expr, "metatype_expr");
        if (expr.base() != null) {
            out.append('\n');
            printRec(expr.base());
        } else {
            out.append(" baseless");
        }
        out.append(')');
        return null;
    }

    @Override
    public Void visitOpaqueValueExpr(OpaqueValueExpr expr) {
        printCommon(expr, "opaque_value_expr").append(')');
        return null;
    }

    @Override
    public Void visitZeroValueExpr(ZeroValueExpr expr) {
        printCommon(expr, "zero_value_expr").append(')');
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr expr) {
        return printApply(expr, "call_expr");
    }

    @Override
    public Void visitPrefixUnaryExpr(PrefixUnaryExpr expr) {
        return printApply(expr, "prefix_unary_expr");
    }

    @Override
    public Void visitPostfixUnaryExpr(PostfixUnaryExpr expr) {
        return printApply(expr, "postfix_unary_expr");
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr expr) {
        return printApply(expr, "binary_expr");
    }

    @Override
    public Void visitDotSyntaxCallExpr(DotSyntaxCallExpr expr) {
        return printApply(expr, "dot_syntax_call_expr");
    }

    @Override
    public Void visitConstructorRefCallExpr(ConstructorRefCallExpr expr) {
        return printApply(expr, "constructor_ref_call_expr");
    }

    @Override
    public Void visitDotSyntaxBaseIgnoredExpr(DotSyntaxBaseIgnoredExpr expr) {
        printCommon(expr, "dot_syntax_base_ignored").append('\n');
        printRec(expr.lhs());
        out.append('\n');
        printRec(expr.rhs());
        out.append(')');
        return null;
    }

    @Override
    public Void visitCoerceExpr(CoerceExpr expr) {
        return printCast(expr, "coerce_expr");
    }

    @Override
    public Void visitUncheckedDowncastExpr(UncheckedDowncastExpr expr) {
        return printCast(expr, "unchecked_downcast_expr");
    }

    @Override
    public Void visitUncheckedSuperToArchetypeExpr(UncheckedSuperToArchetypeExpr expr) {
        return printCast(expr, "unchecked_super_to_archetype_expr");
    }

    @Override
    public Void visitIsSubtypeExpr(IsSubtypeExpr expr) {
        return printCast(expr, "is_subtype_expr");
    }

    @Override
    public Void visitRebindThisInConstructorExpr(RebindThisInConstructorExpr expr) {
        printCommon(expr, "rebind_this_in_constructor_expr").append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitIfExpr(IfExpr expr) {
        printCommon(expr, "if_expr").append('\n');
        printRec(expr.condExpr());
        out.append('\n');
        printRec(expr.thenExpr());
        out.append('\n');
        printRec(expr.elseExpr());
        out.append(')');
        return null;
    }

    @Override
    public Void visitDefaultValueExpr(DefaultValueExpr expr) {
        printCommon(expr, "default_value_expr").append('\n');
        printRec(expr.subExpr());
        out.append(')');
        return null;
    }
}
