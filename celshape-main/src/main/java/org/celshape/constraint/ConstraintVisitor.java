package org.celshape.constraint;

import java.util.List;
import java.util.Optional;

import org.celshape.parser.ast.expr.CelExpr;
import org.celshape.parser.ast.expr.Operator;
import org.celshape.parser.ast.visitor.CelGenericVisitorWithDefaults;

/**
 * Walks a CEL tree and records into the {@link ConstraintResult} passed along which fields are asserted unset,
 * which are pinned to a literal, and which alternatives a disjunction offers.
 * <p>
 * Recognized shapes:
 * <ul>
 *     <li>{@code !has(this.f)} and its optimized form {@code !this.f}: {@code f} is read-only</li>
 *     <li>{@code this.f == literal}, either way round: {@code f} equals the literal</li>
 *     <li>{@code a && b}: both sides recorded into the same scope</li>
 *     <li>{@code a || b}: one union branch per operand, see {@link BranchComposer}</li>
 * </ul>
 * Any other node contributes nothing and is not reported.
 */
public class ConstraintVisitor extends CelGenericVisitorWithDefaults<Void, ConstraintResult> {

    private final FieldPathResolver resolver;
    private final BranchComposer branchComposer;

    public ConstraintVisitor(FieldPathResolver resolver) {
        this.resolver = resolver;
        this.branchComposer = new BranchComposer(this);
    }

    /**
     * Records everything {@code node} asserts into {@code into}.
     */
    public void collect(CelExpr node, ConstraintResult into) {
        node.accept(this, into);
    }

    @Override
    public Void defaultAction(CelExpr n, ConstraintResult into) {
        return null;
    }

    @Override
    public Void visit(CelExpr.Call n, ConstraintResult into) {
        if (!n.isGlobal()) {
            return null;
        }
        Optional<Operator> operator = Operator.byFunction(n.function());
        if (operator.isEmpty()) {
            return null;
        }
        switch (operator.get()) {
            case LOGICAL_NOT -> visitNegation(n.args(), into);
            case EQUALS -> visitEquality(n.args(), into);
            case LOGICAL_AND -> n.args().forEach(arg -> arg.accept(this, into));
            case LOGICAL_OR -> branchComposer.compose(n.args(), into);
            default -> {
                // other operators carry no presence or literal information
            }
        }
        return null;
    }

    private void visitNegation(List<CelExpr> args, ConstraintResult into) {
        if (args.size() != 1) {
            return;
        }
        CelExpr negated = args.get(0);
        if (negated instanceof CelExpr.Call call) {
            if (call.isFunction(Operator.HAS, 1)) {
                resolver.resolve(call.args().get(0)).ifPresent(into::addReadOnly);
            }
        } else if (negated instanceof CelExpr.Select || negated instanceof CelExpr.Ident) {
            resolver.resolve(negated).ifPresent(into::addReadOnly);
        }
    }

    private void visitEquality(List<CelExpr> args, ConstraintResult into) {
        if (args.size() != 2) {
            return;
        }
        if (!recordLiteral(args.get(0), args.get(1), into)) {
            recordLiteral(args.get(1), args.get(0), into);
        }
    }

    private boolean recordLiteral(CelExpr fieldSide, CelExpr literalSide, ConstraintResult into) {
        Optional<LiteralValue> literal = toLiteral(literalSide);
        if (literal.isEmpty()) {
            return false;
        }
        Optional<FieldPath> path = resolver.resolve(fieldSide);
        if (path.isEmpty()) {
            return false;
        }
        into.addLiteral(path.get(), literal.get());
        return true;
    }

    static Optional<LiteralValue> toLiteral(CelExpr expr) {
        if (!(expr instanceof CelExpr.Constant constant)) {
            return Optional.empty();
        }
        Object value = constant.value();
        switch (constant.kind()) {
            case STRING:
                return Optional.of(LiteralValue.text((String) value));
            case INT64:
                return Optional.of(LiteralValue.number(((Long) value).doubleValue()));
            case UINT64:
                return Optional.of(LiteralValue.number(Double.parseDouble(Long.toUnsignedString((Long) value))));
            case DOUBLE:
                return Optional.of(LiteralValue.number((Double) value));
            case BOOL:
                return Optional.of(LiteralValue.bool((Boolean) value));
            default:
                // null and bytes have no literal form
                return Optional.empty();
        }
    }
}
