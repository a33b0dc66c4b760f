package com.exprtree.ast;

/**
 * {@code base.field} referring to a stored or computed variable of a
 * concrete type. An invalid name location marks a synthesized access.
 */
public record MemberRefExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    DeclRef decl,
    SourceLoc nameLoc
) implements Expr {

    public MemberRefExpr {
        header.claim(ExprKind.MEMBER_REF);
    }

    public static MemberRefExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, DeclRef decl, SourceLoc nameLoc) {
        return new MemberRefExpr(ctx.allocate(ExprKind.MEMBER_REF), base, dotLoc, decl, nameLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.MEMBER_REF;
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
        return visitor.visitMemberRefExpr(this);
    }
}
