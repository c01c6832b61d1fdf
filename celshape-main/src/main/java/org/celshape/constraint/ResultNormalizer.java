package org.celshape.constraint;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Final pass over a filled {@link ConstraintResult}: removes duplicate field names (keeping first occurrence
 * order), drops parents without children, and freezes the result.
 * <p>
 * Literal fields are already unique by key. Union groups are kept as they are, repeated branches included.
 */
public final class ResultNormalizer {

    private ResultNormalizer() {
    }

    public static ConstraintResult normalize(ConstraintResult result) {
        if (result.isFrozen()) {
            return result;
        }
        deduplicate(result.readOnlyFields());
        result.nestedConstraints().values().forEach(ResultNormalizer::deduplicate);
        result.nestedConstraints().values().removeIf(List::isEmpty);
        deduplicate(result.unsupportedFields());
        result.freeze();
        return result;
    }

    private static void deduplicate(List<String> names) {
        LinkedHashSet<String> unique = new LinkedHashSet<>(names);
        if (unique.size() != names.size()) {
            names.clear();
            names.addAll(unique);
        }
    }
}
