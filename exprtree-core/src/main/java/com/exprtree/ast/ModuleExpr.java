package com.exprtree.ast;

/**
 * A reference to an imported module used as a qualifier.
 */
public record ModuleExpr(
    ExprHeader header,
    SourceLoc loc
) implements Expr {

    public ModuleExpr {
        header.claim(ExprKind.MODULE);
    }

    public static ModuleExpr create(AstContext ctx, SourceLoc loc) {
        return new ModuleExpr(ctx.allocate(ExprKind.MODULE), loc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.MODULE;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(loc);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitModuleExpr(this);
    }
}
