package org.celshape.parser.ast.expr;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CEL operators, keyed by the function name the parser gives their {@link CelExpr.Call}.
 */
public enum Operator {
    LOGICAL_NOT("!_", "!"),
    NEGATE("-_", "-"),
    EQUALS("_==_", "=="),
    NOT_EQUALS("_!=_", "!="),
    LESS("_<_", "<"),
    LESS_EQUALS("_<=_", "<="),
    GREATER("_>_", ">"),
    GREATER_EQUALS("_>=_", ">="),
    LOGICAL_AND("_&&_", "&&"),
    LOGICAL_OR("_||_", "||"),
    ADD("_+_", "+"),
    SUBTRACT("_-_", "-"),
    MULTIPLY("_*_", "*"),
    DIVIDE("_/_", "/"),
    MODULO("_%_", "%"),
    IN("@in", "in"),
    INDEX("_[_]", "[]"),
    CONDITIONAL("_?_:_", "?:");

    /** The presence test macro, {@code has(this.field)}. */
    public static final String HAS = "has";

    private static final Map<String, Operator> BY_FUNCTION = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::getFunction, Function.identity()));

    private final String function;
    private final String symbol;

    Operator(String function, String symbol) {
        this.function = function;
        this.symbol = symbol;
    }

    public String getFunction() {
        return function;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<Operator> byFunction(String function) {
        return Optional.ofNullable(BY_FUNCTION.get(function));
    }
}
