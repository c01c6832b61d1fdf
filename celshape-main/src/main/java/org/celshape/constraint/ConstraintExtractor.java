package org.celshape.constraint;

import java.util.ArrayList;
import java.util.List;

import org.celshape.ExpressionParseException;
import org.celshape.parser.antlr4.Antlr4CelParser;
import org.celshape.parser.ast.expr.CelExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts field constraints from message-level CEL rules.
 * <p>
 * Patterns understood:
 * <ul>
 *     <li>{@code this.field == ''}, {@code this.field == 0}: field pinned to a literal</li>
 *     <li>{@code !has(this.field)}: field unset, read-only for the generated shape</li>
 *     <li>{@code a && b}: all facts hold together</li>
 *     <li>{@code a || b}: one alternative shape per operand</li>
 * </ul>
 * A rule that fails to parse yields an empty result carrying one error; it never aborts generation.
 * Instances are stateless and may be shared between threads.
 */
public class ConstraintExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintExtractor.class);

    public static final String DEFAULT_SUBJECT = "this";

    private final ConstraintVisitor visitor;

    public ConstraintExtractor() {
        this(DEFAULT_SUBJECT);
    }

    public ConstraintExtractor(String subject) {
        this.visitor = new ConstraintVisitor(new FieldPathResolver(subject));
    }

    public ConstraintResult extract(String expression) {
        ConstraintResult result = new ConstraintResult();
        if (expression == null || expression.isBlank()) {
            return ResultNormalizer.normalize(result);
        }

        CelExpr tree;
        try {
            tree = Antlr4CelParser.parseExpression(expression);
        } catch (ExpressionParseException e) {
            LOG.debug("Could not parse CEL expression '{}'", expression, e);
            result.addError("Failed to parse CEL expression \"" + expression + "\": " + e.getMessage());
            return ResultNormalizer.normalize(result);
        }
        if (tree == null) {
            result.addError("No expression found in CEL: " + expression);
            return ResultNormalizer.normalize(result);
        }

        visitor.collect(tree, result);
        ResultNormalizer.normalize(result);
        LOG.debug("'{}' -> {}", expression, result);
        return result;
    }

    /**
     * Extracts every rule of one message and merges the results in rule order.
     */
    public ConstraintResult extractAll(List<String> expressions) {
        List<ConstraintResult> results = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            results.add(extract(expression));
        }
        return ConstraintResult.merge(results);
    }
}
