package com.exprtree.ast;

import java.util.List;

/**
 * {@code base.name} where {@code name} resolved to more than one member.
 */
public record OverloadedMemberRefExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    List<DeclRef> decls,
    SourceLoc memberLoc
) implements OverloadSetRefExpr {

    public OverloadedMemberRefExpr {
        header.claim(ExprKind.OVERLOADED_MEMBER_REF);
    }

    public static OverloadedMemberRefExpr create(AstContext ctx, Expr base, SourceLoc dotLoc,
                                                 List<DeclRef> decls, SourceLoc memberLoc) {
        if (decls.isEmpty()) {
            throw new IllegalArgumentException("Overload set must not be empty");
        }
        return new OverloadedMemberRefExpr(
            ctx.allocate(ExprKind.OVERLOADED_MEMBER_REF), base, dotLoc, ctx.allocateCopy(decls), memberLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.OVERLOADED_MEMBER_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), new SourceRange(memberLoc));
    }

    @Override
    public SourceLoc loc() {
        return memberLoc;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOverloadedMemberRefExpr(this);
    }
}
