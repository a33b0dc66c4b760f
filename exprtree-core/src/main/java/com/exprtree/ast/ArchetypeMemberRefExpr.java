package com.exprtree.ast;

import com.exprtree.types.ArchetypeType;
import com.exprtree.types.MetatypeType;
import com.exprtree.types.Type;

/**
 * Member access on a value (or metatype) of archetype type.
 */
public record ArchetypeMemberRefExpr(
    ExprHeader header,
    Expr base,
    SourceLoc dotLoc,
    DeclRef decl,
    SourceLoc nameLoc
) implements Expr {

    public ArchetypeMemberRefExpr {
        header.claim(ExprKind.ARCHETYPE_MEMBER_REF);
    }

    public static ArchetypeMemberRefExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, DeclRef decl,
                                                SourceLoc nameLoc) {
        return new ArchetypeMemberRefExpr(ctx.allocate(ExprKind.ARCHETYPE_MEMBER_REF), base, dotLoc, decl, nameLoc);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ARCHETYPE_MEMBER_REF;
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
     * The archetype the member is looked up in, seen through a metatype base.
     *
     * @throws IllegalStateException if the base is untyped or not of archetype type
     */
    public ArchetypeType archetype() {
        Type baseType = base.getType();
        if (baseType == null) {
            throw new IllegalStateException("Base of archetype member reference has no type");
        }
        baseType = baseType.getRValueType();
        if (baseType instanceof MetatypeType metatype) {
            baseType = metatype.instanceType();
        }
        if (baseType instanceof ArchetypeType archetype) {
            return archetype;
        }
        throw new IllegalStateException("Base type '" + baseType.getString() + "' is not an archetype");
    }

    /**
     * Whether evaluating the base can be skipped: true for type members.
     */
    public boolean isBaseIgnored(DeclTable decls) {
        return decls.lookup(decl).isTypeDecl();
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitArchetypeMemberRefExpr(this);
    }
}
