package com.exprtree.ast;

import com.exprtree.ExprFixtures;
import com.exprtree.types.ErrorType;
import com.exprtree.types.FunctionType;
import com.exprtree.types.NominalType;
import com.exprtree.types.TupleType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClosureTest {

    @Test
    void testSingleExpressionBody() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr result = f.lit();
            BraceStmt body = f.returning(result);
            Pattern param = new NamedPattern(f.x, "x", f.next());
            PipeClosureExpr closure = PipeClosureExpr.create(ctx, List.of(param), body, true, List.of(f.y));

            assertSame(result, closure.singleExpressionBody());
            assertEquals(body.sourceRange(), closure.sourceRange());
            assertEquals(body.startLoc(), closure.loc());
            assertEquals(List.of(param), closure.paramPatterns());

            Expr replacement = LoadExpr.create(ctx, result, ExprFixtures.INT);
            closure.setSingleExpressionBody(replacement);
            assertSame(replacement, closure.singleExpressionBody());
        }
    }

    @Test
    void testMultiStatementBody() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            BraceStmt body = new BraceStmt(f.next(), List.of(new ExprStmt(f.ref()), new ReturnStmt(f.next(), null)), f.next());
            PipeClosureExpr closure = PipeClosureExpr.create(ctx, List.of(), body, false, List.of());
            assertThrows(IllegalStateException.class, closure::singleExpressionBody);
            assertThrows(IllegalArgumentException.class,
                () -> PipeClosureExpr.create(ctx, List.of(), body, true, List.of()));
        }
    }

    @Test
    void testResultType() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            PipeClosureExpr closure = PipeClosureExpr.create(ctx, List.of(), f.returning(null), true, List.of());
            assertThrows(IllegalStateException.class, closure::resultType);
            closure.setType(new FunctionType(TupleType.empty(), new NominalType("Bool")));
            assertEquals(new NominalType("Bool"), closure.resultType());

            PipeClosureExpr broken = PipeClosureExpr.create(ctx, List.of(), f.returning(null), true, List.of());
            broken.setType(ErrorType.INSTANCE);
            assertSame(ErrorType.INSTANCE, broken.resultType());
        }
    }

    @Test
    void testImplicitClosureTakesBodyRange() {
        try (AstContext ctx = new AstContext()) {
            ExprFixtures f = new ExprFixtures(ctx, new SimpleDeclTable());
            Expr body = f.ref();
            ImplicitClosureExpr closure = ImplicitClosureExpr.create(ctx, body, List.of(), List.of(f.x),
                new FunctionType(TupleType.empty(), ExprFixtures.INT));
            assertEquals(body.sourceRange(), closure.sourceRange());
            assertEquals(List.of(f.x), closure.captures());
            assertTrue(closure.paramPatterns().isEmpty());
        }
    }
}
