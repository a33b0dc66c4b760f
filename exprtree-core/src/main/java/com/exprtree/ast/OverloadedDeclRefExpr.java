package com.exprtree.ast;

import java.util.List;

/**
 * An unqualified name that resolved to more than one declaration.
 */
public record OverloadedDeclRefExpr(
    ExprHeader header,
    List<DeclRef> decls,
    SourceLoc loc
) implements OverloadSetRefExpr {

    public OverloadedDeclRefExpr {
        header.claim(ExprKind.OVERLOADED_DECL_REF);
    }

    public static OverloadedDeclRefExpr create(AstContext ctx, List<DeclRef> decls, SourceLoc loc) {
        if (decls.isEmpty()) {
            throw new IllegalArgumentException("Overload set must not be empty");
        }
        return new OverloadedDeclRefExpr(ctx.allocate(ExprKind.OVERLOADED_DECL_REF), ctx.allocateCopy(decls), loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OVERLOADED_DECL_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOverloadedDeclRefExpr(this);
    }
}
