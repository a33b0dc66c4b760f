package com.exprtree.ast;

/**
 * {@code :name}, a member of a contextual type yet to be inferred.
 */
public record UnresolvedMemberExpr(
    ExprHeader header,
    SourceLoc colonLoc,
    String name,
    SourceLoc nameLoc
) implements Expr {

    public UnresolvedMemberExpr {
        header.claim(ExprKind.UNRESOLVED_MEMBER);
    }

    public static UnresolvedMemberExpr create(AstContext ctx, SourceLoc colonLoc, String name, SourceLoc nameLoc) {
        return new UnresolvedMemberExpr(ctx.allocate(ExprKind.UNRESOLVED_MEMBER), colonLoc, name, nameLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.UNRESOLVED_MEMBER;
    }

    @Override
    public SourceRange sourceRange() {
        return new SourceRange(colonLoc, nameLoc);
    }

    @Override
    public SourceLoc loc() {
        return nameLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnresolvedMemberExpr(this);
    }
}
