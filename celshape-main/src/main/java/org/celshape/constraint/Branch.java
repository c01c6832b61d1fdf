package org.celshape.constraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One alternative of a disjunction: the facts that hold when that operand is the one satisfied.
 */
public record Branch(List<String> readOnlyFields,
                     Map<String, LiteralValue> literalFields,
                     Map<String, List<String>> nestedConstraints) {

    public Branch {
        readOnlyFields = List.copyOf(readOnlyFields);
        literalFields = Collections.unmodifiableMap(new LinkedHashMap<>(literalFields));
        nestedConstraints = copyNested(nestedConstraints);
    }

    public boolean isEmpty() {
        return readOnlyFields.isEmpty() && literalFields.isEmpty() && nestedConstraints.isEmpty();
    }

    static Map<String, List<String>> copyNested(Map<String, List<String>> nested) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        nested.forEach((parent, children) -> copy.put(parent, List.copyOf(children)));
        return Collections.unmodifiableMap(copy);
    }
}
