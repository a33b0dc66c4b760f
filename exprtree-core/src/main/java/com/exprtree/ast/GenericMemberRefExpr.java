package com.exprtree.ast;

import com.exprtree.types.MetatypeType;
import com.exprtree.types.Type;

import java.util.List;

/**
 * Member access on a bound generic type, with the substitutions that
 * specialize the member.
 */
public record GenericMemberRefExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    DeclRef decl,
    SourceLoc nameLoc,
    List<Substitution> substitutions
) implements Expr {

    public GenericMemberRefExpr {
        header.claim(ExprKind.GENERIC_MEMBER_REF);
    }

    public static GenericMemberRefExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, DeclRef decl,
                                              SourceLoc nameLoc, List<Substitution> substitutions) {
        return new GenericMemberRefExpr(ctx.allocate(ExprKind.GENERIC_MEMBER_REF),
            base, dotLoc, decl, nameLoc, ctx.allocateCopy(substitutions));
    }

    @Override
    public ExprKind kind() {
        return ExprKind.GENERIC_MEMBER_REF;
    }

    @Override
    public SourceRange sourceRange() {
        return SourceRange.merge(base.sourceRange(), new SourceRange(nameLoc));
    }

    @Override
    public SourceLoc loc() {
        return nameLoc;
    }

    /**
     * Whether evaluating the base can be skipped: true when the base is a
     * metatype, the member is a type, or the member is a static function.
     */
    public boolean isBaseIgnored(DeclTable decls) {
        Type baseType = base.getType();
        if (baseType != null && baseType.getRValueType() instanceof MetatypeType) {
            return true;
        }
        ValueDecl member = decls.lookup(decl);
        if (member.isTypeDecl()) {
            return true;
        }
        return member.flavor() == DeclFlavor.FUNC && member.isStatic();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitGenericMemberRefExpr(this);
    }
}
