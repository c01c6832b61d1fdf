package org.celshape.constraint;

import java.util.Optional;

import org.celshape.parser.ast.expr.CelExpr;
import org.celshape.parser.ast.visitor.CelGenericVisitorWithDefaults;
import org.celshape.util.NameUtils;

/**
 * Resolves {@code this.a.b} style selections to a {@link FieldPath}. Only selections rooted at the subject
 * identifier are paths; a bare identifier never is.
 */
public class FieldPathResolver extends CelGenericVisitorWithDefaults<FieldPath, Void> {

    private final String subject;

    public FieldPathResolver(String subject) {
        this.subject = subject;
    }

    public String getSubject() {
        return subject;
    }

    public Optional<FieldPath> resolve(CelExpr node) {
        return Optional.ofNullable(node.accept(this, null));
    }

    @Override
    public FieldPath defaultAction(CelExpr n, Void arg) {
        return null;
    }

    @Override
    public FieldPath visit(CelExpr.Select n, Void arg) {
        String field = NameUtils.snakeToCamel(n.field());
        if (n.operand() instanceof CelExpr.Ident ident) {
            return ident.name().equals(subject) ? FieldPath.of(field) : null;
        }
        FieldPath operand = n.operand().accept(this, arg);
        return operand == null ? null : operand.append(field);
    }
}
