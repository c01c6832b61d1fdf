package org.celshape.parser.ast.visitor;

import org.celshape.parser.ast.expr.CelExpr;

/**
 * A visitor that has a return value (R) and takes an argument (A).
 *
 * @param <R> the type of the return value
 * @param <A> the type of the argument passed to each visit
 */
public interface CelGenericVisitor<R, A> {

    R visit(CelExpr.Ident n, A arg);

    R visit(CelExpr.Select n, A arg);

    R visit(CelExpr.Constant n, A arg);

    R visit(CelExpr.Call n, A arg);

    R visit(CelExpr.CreateList n, A arg);

    R visit(CelExpr.CreateMap n, A arg);

    R visit(CelExpr.CreateStruct n, A arg);
}
