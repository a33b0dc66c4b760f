package com.exprtree.ast;

/**
 * Member access on a value of protocol (existential) type.
 */
public record ExistentialMemberRefExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    DeclRef decl,
    SourceLoc nameLoc
) implements Expr {

    public ExistentialMemberRefExpr {
        header.claim(ExprKind.EXISTENTIAL_MEMBER_REF);
    }

    public static ExistentialMemberRefExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, DeclRef decl,
                                                  SourceLoc nameLoc) {
        return new ExistentialMemberRefExpr(ctx.allocate(ExprKind.EXISTENTIAL_MEMBER_REF), base, dotLoc, decl, nameLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.EXISTENTIAL_MEMBER_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), new SourceRange(nameLoc));
    }

    @Override
    public SourceLoc loc() {
        return nameLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitExistentialMemberRefExpr(this);
    }
}
