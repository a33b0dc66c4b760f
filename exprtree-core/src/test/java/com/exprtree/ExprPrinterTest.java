package com.exprtree;

import com.exprtree.ast.*;
import com.exprtree.types.BuiltinIntegerType;
import com.exprtree.types.FunctionType;
import com.exprtree.types.NominalType;
import com.exprtree.types.Type;
import com.exprtree.types.UnresolvedType;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExprPrinterTest {

    private static final Type INT = new NominalType("Int");
    private static final Type INT64 = new BuiltinIntegerType(64);

    @Test
    void testCallSnapshot() {
        SimpleDeclTable decls = new SimpleDeclTable();
        DeclRef f = decls.add(ValueDecl.func("f", new FunctionType(INT64, INT)));
        try (AstContext ctx = new AstContext()) {
            DeclRefExpr fn = DeclRefExpr.create(ctx, f, SourceLoc.at(0));
            fn.setType(new FunctionType(INT64, INT));
            IntegerLiteralExpr one = IntegerLiteralExpr.create(ctx, "0x1", SourceLoc.at(2));
            one.setType(INT64);
            ParenExpr arg = ParenExpr.create(ctx, SourceLoc.at(1), one, SourceLoc.at(5), false);
            arg.setType(INT64);
            CallExpr call = CallExpr.create(ctx, fn, arg);
            call.setType(INT);

            String expected = String.join("\n",
                "(call_expr type='Int'",
                "  (declref_expr type='Builtin.Int64 -> Int' decl=f)",
                "  (paren_expr type='Builtin.Int64'",
                "    (integer_literal_expr type='Builtin.Int64' value=1)))");
            String printed = ExprPrinter.print(call, decls);
            System.out.println(printed);
            assertEquals(expected, printed);
            assertEquals(printed, ExprPrinter.print(call, decls));
        }
    }

    @Test
    void testIntegerLiteralPrintsTextUntilResolved() {
        try (AstContext ctx = new AstContext()) {
            SimpleDeclTable decls = new SimpleDeclTable();
            IntegerLiteralExpr untyped = IntegerLiteralExpr.create(ctx, "0xFF", SourceLoc.at(0));
            assertEquals("(integer_literal_expr type='<null>' value=0xFF)", ExprPrinter.print(untyped, decls));

            IntegerLiteralExpr unresolved = IntegerLiteralExpr.create(ctx, "0xFF", SourceLoc.at(0));
            unresolved.setType(UnresolvedType.INSTANCE);
            assertEquals("(integer_literal_expr type='<<unresolved type>>' value=0xFF)",
                ExprPrinter.print(unresolved, decls));

            IntegerLiteralExpr signed = IntegerLiteralExpr.create(ctx, "0xFF", SourceLoc.at(0));
            signed.setType(new BuiltinIntegerType(8));
            assertEquals("(integer_literal_expr type='Builtin.Int8' value=-1)", ExprPrinter.print(signed, decls));
        }
    }

    @Test
    void testPlaceholders() {
        try (AstContext ctx = new AstContext()) {
            SimpleDeclTable decls = new SimpleDeclTable();
            ExprFixtures f = new ExprFixtures(ctx, decls);

            TupleExpr tuple = TupleExpr.createImplicit(ctx, Arrays.asList(IntegerLiteralExpr.create(ctx, "1", f.next()), null));
            assertEquals(String.join("\n",
                "(tuple_expr type='<null>'",
                "  (integer_literal_expr type='<null>' value=1)",
                "  <<tuple element default value>>)"), ExprPrinter.print(tuple, decls));

            assertEquals("(metatype_expr type='<null>' baseless)",
                ExprPrinter.print(MetatypeExpr.create(ctx, null, f.next()), decls));

            CallExpr noArg = CallExpr.create(ctx, DeclRefExpr.create(ctx, f.x, f.next()), null);
            assertEquals(String.join("\n",
                "(call_expr type='<null>'",
                "  (declref_expr type='<null>' decl=x)",
                "  (**NULL EXPRESSION**))"), ExprPrinter.print(noArg, decls));

            NewArrayExpr array = NewArrayExpr.create(ctx, f.next(), TypeLoc.withoutLoc(INT),
                List.of(new NewArrayExpr.Bound(null, new SourceRange(f.next(), f.next()))), null);
            assertEquals(String.join("\n",
                "(new_array_expr type='<null>' elementType='Int'",
                "  (empty bound))"), ExprPrinter.print(array, decls));
        }
    }

    @Test
    void testClosuresAndStatements() {
        try (AstContext ctx = new AstContext()) {
            SimpleDeclTable decls = new SimpleDeclTable();
            ExprFixtures f = new ExprFixtures(ctx, decls);

            PipeClosureExpr closure = PipeClosureExpr.create(ctx, List.of(), f.returning(f.lit()), true, List.of(f.x, f.y));
            assertEquals(String.join("\n",
                "(closure_expr type='<null>' captures=(x, y) single-expression",
                "  (integer_literal_expr type='<null>' value=1))"), ExprPrinter.print(closure, decls));

            FuncExpr func = FuncExpr.create(ctx, f.next(), List.of(), List.of(), TypeLoc.withoutLoc(INT),
                f.returning(f.lit()), List.of());
            assertEquals(String.join("\n",
                "(func_expr type='<null>'",
                "  (brace_stmt",
                "    (return_stmt",
                "      (integer_literal_expr type='<null>' value=1))))"), ExprPrinter.print(func, decls));
        }
    }

    @Test
    void testSubstitutionsAndOverloads() {
        try (AstContext ctx = new AstContext()) {
            SimpleDeclTable decls = new SimpleDeclTable();
            ExprFixtures f = new ExprFixtures(ctx, decls);
            GenericMemberRefExpr member = GenericMemberRefExpr.create(ctx, f.ref(), f.next(), f.y, f.next(),
                List.of(new Substitution(ExprFixtures.T, ExprFixtures.INT)));
            assertEquals(String.join("\n",
                "(generic_member_ref_expr type='<null>' decl=y",
                "  (with T = Builtin.Int64)",
                "  (declref_expr type='<null>' decl=x))"), ExprPrinter.print(member, decls));

            OverloadedDeclRefExpr overloads = OverloadedDeclRefExpr.create(ctx, List.of(f.x, f.y), f.next());
            assertEquals(String.join("\n",
                "(overloaded_decl_ref_expr type='<null>' name=x #decls=2",
                "  type=Builtin.Int64",
                "  type=Builtin.Int64)"), ExprPrinter.print(overloads, decls));
        }
    }

    @Test
    void testIndentAndDump() {
        try (AstContext ctx = new AstContext()) {
            SimpleDeclTable decls = new SimpleDeclTable();
            ExprFixtures f = new ExprFixtures(ctx, decls);
            ArrayExpr array = ArrayExpr.create(ctx, f.next(), f.ref(), f.next());
            String indented = ExprPrinter.print(array, decls, 4);
            assertEquals(String.join("\n",
                "    (array_expr type='<null>'",
                "      (declref_expr type='<null>' decl=x))"), indented);
            assertThrows(IllegalArgumentException.class, () -> ExprPrinter.print(array, decls, -1));

            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            ExprPrinter.dump(array, decls, new PrintStream(bytes, true, StandardCharsets.UTF_8));
            assertEquals(ExprPrinter.print(array, decls) + System.lineSeparator(), bytes.toString(StandardCharsets.UTF_8));
        }
    }

    @Test
    void testEveryKindPrints() {
        try (AstContext ctx = new AstContext()) {
            SimpleDeclTable decls = new SimpleDeclTable();
            for (Expr e : new ExprFixtures(ctx, decls).oneOfEachKind()) {
                String printed = ExprPrinter.print(e, decls);
                assertTrue(printed.startsWith("("), printed);
                assertTrue(printed.endsWith(")"), printed);
                long open = printed.chars().filter(c -> c == '(').count();
                long close = printed.chars().filter(c -> c == ')').count();
                assertEquals(open, close, "Unbalanced output for " + e.kind().getKindName() + ":\n" + printed);
            }
        }
    }
}
