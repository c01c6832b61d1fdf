package org.celshape.constraint;

import java.util.List;

import org.celshape.parser.ast.expr.CelExpr;

/**
 * Disjunction handling for {@link ConstraintVisitor}.
 * <p>
 * Every operand is analyzed into its own empty scope. Non-empty scopes become {@link Branch}es, appended in
 * operand order to the union groups of the enclosing result. Union groups produced inside a branch scope are
 * dropped, so a disjunction nested directly under another one only contributes its plain field facts.
 */
final class BranchComposer {

    private final ConstraintVisitor visitor;

    BranchComposer(ConstraintVisitor visitor) {
        this.visitor = visitor;
    }

    void compose(List<CelExpr> operands, ConstraintResult into) {
        for (CelExpr operand : operands) {
            ConstraintResult scope = new ConstraintResult();
            visitor.collect(operand, scope);
            ResultNormalizer.normalize(scope);
            if (scope.hasFieldConstraints()) {
                into.addUnionGroup(scope.toBranch());
            }
            into.addErrors(scope.getErrors());
        }
    }
}
