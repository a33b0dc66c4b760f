package com.exprtree.ast;

import com.exprtree.ExprFixtures;
import com.exprtree.types.TupleType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeSlotTest {

    @Test
    void testTypeIsWrittenOnce() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr e = f.ref();
            assertNull(e.getType());
            assertFalse(e.hasType());
            e.setType(ExprFixtures.INT);
            assertSame(ExprFixtures.INT, e.getType());
            assertThrows(IllegalStateException.class, () -> e.setType(ExprFixtures.INT));
            assertThrows(IllegalArgumentException.class, () -> f.lit().setType(null));
        }
    }

    @Test
    void testTypeSuppliedAtConstruction() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            RebindThisInConstructorExpr rebind = RebindThisInConstructorExpr.create(ctx, f.ref(), f.self);
            assertEquals(TupleType.empty(), rebind.getType());
            assertThrows(IllegalStateException.class, () -> rebind.setType(ExprFixtures.INT));

            SubscriptExpr subscript = SubscriptExpr.create(ctx, f.ref(), f.lit(), f.y, ExprFixtures.INT);
            assertEquals(ExprFixtures.INT, subscript.getType());
        }
    }

    @Test
    void testNodesCompareByIdentity() {
        try (AstContext ctx = new AstContext()) {
            IntegerLiteralExpr a = IntegerLiteralExpr.create(ctx, "1", SourceLoc.at(0));
            IntegerLiteralExpr b = IntegerLiteralExpr.create(ctx, "1", SourceLoc.at(0));
            assertNotEquals(a, b);
        }
    }

    @Test
    void testHeaderBelongsToOneNode() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            ParenExpr paren = ParenExpr.create(ctx, f.next(), f.lit(), f.next(), false);

            assertThrows(IllegalStateException.class,
                () -> new ParenExpr(paren.header(), paren.lParenLoc(), f.ref(), paren.rParenLoc(), false));
            assertThrows(IllegalArgumentException.class,
                () -> new ParenExpr(ctx.allocate(ExprKind.TUPLE), f.next(), f.ref(), f.next(), false));
            assertThrows(IllegalArgumentException.class,
                () -> new SequenceExpr(paren.header(), TrailingArray.copyOf(List.of(f.lit()))));

            ParenExpr direct = new ParenExpr(ctx.allocate(ExprKind.PAREN), f.next(), f.ref(), f.next(), false);
            direct.setType(ExprFixtures.INT);
            assertNull(paren.getType());
        }
    }
}
