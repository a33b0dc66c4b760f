package com.exprtree;

import com.exprtree.ast.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExprTraversalTest {

    @Test
    void testUnwrapsParensAndDefaults() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr leaf = f.lit();
            Expr inner = ParenExpr.create(ctx, f.next(), leaf, f.next(), false);
            Expr wrapped = ParenExpr.create(ctx, f.next(), DefaultValueExpr.create(ctx, inner), f.next(), false);

            assertSame(leaf, ExprTraversal.semanticsProvidingExpr(wrapped));
            assertSame(leaf, ExprTraversal.semanticsProvidingExpr(leaf));
            Expr once = ExprTraversal.semanticsProvidingExpr(wrapped);
            assertSame(once, ExprTraversal.semanticsProvidingExpr(once));
            assertSame(leaf, ExprTraversal.valueProvidingExpr(wrapped));

            // Conversions are not transparent
            Expr load = LoadExpr.create(ctx, leaf, ExprFixtures.INT);
            assertSame(load, ExprTraversal.semanticsProvidingExpr(load));
        }
    }

    @Test
    void testImplicitReferences() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr synthesized = DeclRefExpr.create(ctx, f.x, SourceLoc.INVALID);
            assertTrue(ExprTraversal.isImplicit(synthesized));
            assertFalse(ExprTraversal.isImplicit(f.ref()));

            assertTrue(ExprTraversal.isImplicit(LoadExpr.create(ctx, synthesized, ExprFixtures.INT)));
            assertFalse(ExprTraversal.isImplicit(LoadExpr.create(ctx, f.ref(), ExprFixtures.INT)));

            assertTrue(ExprTraversal.isImplicit(
                MemberRefExpr.create(ctx, f.ref(), SourceLoc.INVALID, f.y, SourceLoc.INVALID)));
            assertTrue(ExprTraversal.isImplicit(
                GenericMemberRefExpr.create(ctx, f.ref(), SourceLoc.INVALID, f.y, SourceLoc.INVALID, List.of())));
            assertTrue(ExprTraversal.isImplicit(
                ArchetypeMemberRefExpr.create(ctx, f.ref(), SourceLoc.INVALID, f.y, SourceLoc.INVALID)));
            assertFalse(ExprTraversal.isImplicit(
                ExistentialMemberRefExpr.create(ctx, f.ref(), SourceLoc.INVALID, f.y, SourceLoc.INVALID)));

            assertTrue(ExprTraversal.isImplicit(MetatypeExpr.create(ctx, null, SourceLoc.INVALID)));
            assertFalse(ExprTraversal.isImplicit(MetatypeExpr.create(ctx, null, f.next())));
        }
    }

    @Test
    void testImplicitApplications() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr implicitArg = TupleExpr.createImplicit(ctx, List.of(DeclRefExpr.create(ctx, f.x, SourceLoc.INVALID)));
            assertTrue(ExprTraversal.isImplicit(CallExpr.create(ctx, f.ref(), implicitArg)));
            assertFalse(ExprTraversal.isImplicit(CallExpr.create(ctx, f.ref(), f.lit())));
            assertFalse(ExprTraversal.isImplicit(CallExpr.create(ctx, f.ref(), null)));
        }
    }

    @Test
    void testImplicitTuples() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr synthesized = DeclRefExpr.create(ctx, f.x, SourceLoc.INVALID);
            assertTrue(ExprTraversal.isImplicit(TupleExpr.createImplicit(ctx, List.of())));
            assertTrue(ExprTraversal.isImplicit(TupleExpr.createImplicit(ctx, Arrays.asList(synthesized, null))));
            assertFalse(ExprTraversal.isImplicit(TupleExpr.createImplicit(ctx, List.of(synthesized, f.lit()))));
            assertFalse(ExprTraversal.isImplicit(
                TupleExpr.create(ctx, f.next(), List.of(synthesized), null, f.next(), false)));
        }
    }

    @Test
    void testOtherImplicitForms() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr synthesized = DeclRefExpr.create(ctx, f.x, SourceLoc.INVALID);
            TypeLoc target = TypeLoc.withoutLoc(ExprFixtures.INT);
            assertTrue(ExprTraversal.isImplicit(UncheckedDowncastExpr.create(ctx, synthesized, SourceLoc.INVALID, target)));
            assertFalse(ExprTraversal.isImplicit(UncheckedDowncastExpr.create(ctx, synthesized, f.next(), target)));
            assertFalse(ExprTraversal.isImplicit(CoerceExpr.create(ctx, synthesized, SourceLoc.INVALID, target)));

            assertTrue(ExprTraversal.isImplicit(ZeroValueExpr.create(ctx, f.next(), ExprFixtures.INT)));
            assertTrue(ExprTraversal.isImplicit(DefaultValueExpr.create(ctx, f.lit())));
            assertFalse(ExprTraversal.isImplicit(ParenExpr.create(ctx, f.next(), synthesized, f.next(), false)));
            assertFalse(ExprTraversal.isImplicit(f.lit()));
        }
    }

    @Test
    void testCalledValue() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr callee = ParenExpr.create(ctx, f.next(), DeclRefExpr.create(ctx, f.plus, f.next()), f.next(), false);
            assertEquals(f.plus, ExprTraversal.calledValue(CallExpr.create(ctx, callee, f.lit())));

            Expr defaulted = DefaultValueExpr.create(ctx,
                ParenExpr.create(ctx, f.next(), DeclRefExpr.create(ctx, f.y, f.next()), f.next(), false));
            assertEquals(f.y, ExprTraversal.calledValue(CallExpr.create(ctx, defaulted, f.lit())));

            // Only parentheses and default values are looked through
            DotSyntaxCallExpr method = DotSyntaxCallExpr.create(ctx, DeclRefExpr.create(ctx, f.y, f.next()), f.next(), f.ref());
            assertEquals(f.y, ExprTraversal.calledValue(method));
            assertNull(ExprTraversal.calledValue(CallExpr.create(ctx, method, f.lit())));

            Expr converted = FunctionConversionExpr.create(ctx, DeclRefExpr.create(ctx, f.plus, f.next()), ExprFixtures.INT);
            assertNull(ExprTraversal.calledValue(CallExpr.create(ctx, converted, f.lit())));

            ConstructorRefCallExpr constructorRef = ConstructorRefCallExpr.create(ctx,
                OtherConstructorDeclRefExpr.create(ctx, f.self, f.next()), f.ref());
            assertNull(ExprTraversal.calledValue(constructorRef));

            Expr overloads = OverloadedDeclRefExpr.create(ctx, List.of(f.x, f.y), f.next());
            assertNull(ExprTraversal.calledValue(CallExpr.create(ctx, overloads, f.lit())));
        }
    }

    @Test
    void testParamPatterns() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Pattern arg = new NamedPattern(f.x, "x", f.next());
            Pattern body = new NamedPattern(f.y, "y", f.next());
            FuncExpr func = FuncExpr.create(ctx, f.next(), List.of(arg), List.of(body),
                TypeLoc.withoutLoc(ExprFixtures.INT), null, List.of());
            assertEquals(List.of(arg), ExprTraversal.paramPatterns(func));

            PipeClosureExpr closure = PipeClosureExpr.create(ctx, List.of(body), f.returning(null), true, List.of());
            assertEquals(List.of(body), ExprTraversal.paramPatterns(closure));
        }
    }
}
