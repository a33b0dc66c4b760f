package com.exprtree.ast;

import com.exprtree.ExprFixtures;
import com.exprtree.arena.NodeLayout;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ExprKindTest {

    @Test
    void testKindNames() {
        assertEquals("IntegerLiteral", ExprKind.INTEGER_LITERAL.getKindName());
        assertEquals("DeclRef", ExprKind.DECL_REF.getKindName());
        assertEquals("RebindThisInConstructor", ExprKind.REBIND_THIS_IN_CONSTRUCTOR.getKindName());
        assertEquals("If", ExprKind.IF.getKindName());
        assertEquals(67, ExprKind.values().length);
    }

    @Test
    void testGroupChains() {
        assertTrue(ExprKind.PIPE_CLOSURE.isA(ExprGroup.CLOSURE));
        assertTrue(ExprKind.PIPE_CLOSURE.isA(ExprGroup.CAPTURING));
        assertTrue(ExprKind.PIPE_CLOSURE.isA(ExprGroup.EXPR));
        assertFalse(ExprKind.FUNC.isA(ExprGroup.CLOSURE));
        assertTrue(ExprKind.DOT_SYNTAX_CALL.isA(ExprGroup.APPLY));
        assertFalse(ExprKind.CALL.isA(ExprGroup.SELF_APPLY));
        for (ExprGroup group : ExprGroup.values()) {
            if (group != ExprGroup.EXPR) {
                assertNotNull(group.parent(), group + " should have a parent");
            }
        }
    }

    @Test
    void testInGroup() {
        assertEquals(List.of(ExprKind.PIPE_CLOSURE, ExprKind.IMPLICIT_CLOSURE), ExprKind.inGroup(ExprGroup.CLOSURE));
        assertEquals(List.of(ExprKind.FUNC, ExprKind.PIPE_CLOSURE, ExprKind.IMPLICIT_CLOSURE),
            ExprKind.inGroup(ExprGroup.CAPTURING));
        assertEquals(6, ExprKind.inGroup(ExprGroup.APPLY).size());
        assertEquals(12, ExprKind.inGroup(ExprGroup.IMPLICIT_CONVERSION).size());
        assertEquals(4, ExprKind.inGroup(ExprGroup.EXPLICIT_CAST).size());
        assertEquals(ExprKind.values().length, ExprKind.inGroup(ExprGroup.EXPR).size());
    }

    @Test
    void testJavaTypesMatchGroups() {
        try (AstContext ctx = new AstContext()) {
            List<Expr> nodes = new ExprFixtures(ctx, new SimpleDeclTable()).oneOfEachKind();
            Set<ExprKind> seen = EnumSet.noneOf(ExprKind.class);
            for (Expr e : nodes) {
                ExprKind kind = e.kind();
                seen.add(kind);
                assertEquals(kind.isA(ExprGroup.LITERAL), e instanceof LiteralExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.OVERLOAD_SET_REF), e instanceof OverloadSetRefExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.IMPLICIT_CONVERSION), e instanceof ImplicitConversionExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.CAPTURING), e instanceof CapturingExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.CLOSURE), e instanceof ClosureExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.APPLY), e instanceof ApplyExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.SELF_APPLY), e instanceof SelfApplyExpr, kind.name());
                assertEquals(kind.isA(ExprGroup.EXPLICIT_CAST), e instanceof ExplicitCastExpr, kind.name());
                assertEquals(kind.getKindName() + "Expr", e.getClass().getSimpleName());
            }
            assertEquals(EnumSet.allOf(ExprKind.class), seen);
        }
    }

    @Test
    void testEveryKindHasLayout() {
        for (ExprKind kind : ExprKind.values()) {
            NodeLayout layout = NodeLayouts.forKind(kind);
            assertNotNull(layout, kind.name());
            assertTrue(layout.headerSize() >= NodeLayout.BASE_SIZE, kind.name());
            assertEquals(0, layout.headerSize() % NodeLayout.NODE_ALIGNMENT, kind.name());
        }
    }

    @Test
    void testFixedNodeSizeComesFromLayout() {
        try (AstContext ctx = new AstContext()) {
            List<Expr> nodes = new ExprFixtures(ctx, new SimpleDeclTable()).oneOfEachKind();
            for (Expr e : nodes) {
                if (e instanceof SequenceExpr || e instanceof FuncExpr || e instanceof NewArrayExpr) {
                    continue;
                }
                assertEquals(NodeLayouts.forKind(e.kind()).headerSize(), e.header().allocatedSize(), e.kind().name());
            }
        }
    }
}
