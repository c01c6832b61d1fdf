package org.celshape.parser.ast.visitor;

import org.celshape.parser.ast.expr.CelExpr;

/**
 * A visitor that routes every node kind to {@link #defaultAction(CelExpr, Object)} unless overridden.
 */
public abstract class CelGenericVisitorWithDefaults<R, A> implements CelGenericVisitor<R, A> {

    /**
     * Called for all nodes the subclass does not override.
     */
    public abstract R defaultAction(CelExpr n, A arg);

    @Override
    public R visit(CelExpr.Ident n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CelExpr.Select n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CelExpr.Constant n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CelExpr.Call n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CelExpr.CreateList n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CelExpr.CreateMap n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CelExpr.CreateStruct n, A arg) {
        return defaultAction(n, arg);
    }
}
