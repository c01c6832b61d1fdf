package org.celshape.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What one CEL rule (or the merged rules of a message) says about the fields of its subject.
 * <p>
 * A result is filled by {@link ConstraintVisitor} and frozen by {@link ResultNormalizer}; once frozen it
 * rejects every mutation. Within one result a field is either read-only or pinned to a literal, never both:
 * whichever assertion came last wins.
 */
public final class ConstraintResult {

    private final List<String> readOnlyFields = new ArrayList<>();
    private final Map<String, LiteralValue> literalFields = new LinkedHashMap<>();
    private final Map<String, List<String>> nestedConstraints = new LinkedHashMap<>();
    private final List<Branch> unionGroups = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    // never populated, kept in the output contract
    private final List<String> unsupportedFields = new ArrayList<>();

    private boolean frozen;

    public List<String> getReadOnlyFields() {
        return Collections.unmodifiableList(readOnlyFields);
    }

    public Map<String, LiteralValue> getLiteralFields() {
        return Collections.unmodifiableMap(literalFields);
    }

    public Map<String, List<String>> getNestedConstraints() {
        return Branch.copyNested(nestedConstraints);
    }

    public List<Branch> getUnionGroups() {
        return Collections.unmodifiableList(unionGroups);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getUnsupportedFields() {
        return Collections.unmodifiableList(unsupportedFields);
    }

    public boolean hasUnionGroups() {
        return !unionGroups.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Whether any read-only, literal or nested fact was recorded. Union groups and errors do not count.
     */
    public boolean hasFieldConstraints() {
        return !readOnlyFields.isEmpty() || !literalFields.isEmpty() || !nestedConstraints.isEmpty();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Records that the field at {@code path} is unset. Paths deeper than two segments are truncated.
     */
    void addReadOnly(FieldPath path) {
        if (path.isTopLevel()) {
            markReadOnly(path.head());
        } else {
            addNested(path.head(), path.child());
        }
    }

    /**
     * Records that the field at {@code path} equals {@code value}. For nested paths only the fact that the child
     * is constrained is kept.
     */
    void addLiteral(FieldPath path, LiteralValue value) {
        if (path.isTopLevel()) {
            putLiteral(path.head(), value);
        } else {
            addNested(path.head(), path.child());
        }
    }

    void addUnionGroup(Branch branch) {
        checkMutable();
        if (branch.isEmpty()) {
            throw new IllegalArgumentException("Empty branches are never added to a union group");
        }
        unionGroups.add(branch);
    }

    void addError(String error) {
        checkMutable();
        errors.add(error);
    }

    void addErrors(List<String> moreErrors) {
        checkMutable();
        errors.addAll(moreErrors);
    }

    Branch toBranch() {
        return new Branch(readOnlyFields, literalFields, nestedConstraints);
    }

    private void markReadOnly(String field) {
        checkMutable();
        literalFields.remove(field);
        readOnlyFields.add(field);
    }

    private void putLiteral(String field, LiteralValue value) {
        checkMutable();
        readOnlyFields.removeIf(field::equals);
        literalFields.put(field, value);
    }

    private void addNested(String parent, String child) {
        checkMutable();
        nestedConstraints.computeIfAbsent(parent, k -> new ArrayList<>()).add(child);
    }

    // raw access for ResultNormalizer

    List<String> readOnlyFields() {
        checkMutable();
        return readOnlyFields;
    }

    Map<String, List<String>> nestedConstraints() {
        checkMutable();
        return nestedConstraints;
    }

    List<String> unsupportedFields() {
        checkMutable();
        return unsupportedFields;
    }

    void freeze() {
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("ConstraintResult is frozen");
        }
    }

    /**
     * Merges the results of the rules attached to one message, in rule order. Field facts follow the same
     * last-write-wins rule as within a single rule, nested children and union groups are concatenated.
     *
     * @return a new, normalized result
     */
    public static ConstraintResult merge(List<ConstraintResult> results) {
        ConstraintResult merged = new ConstraintResult();
        for (ConstraintResult result : results) {
            result.readOnlyFields.forEach(merged::markReadOnly);
            result.literalFields.forEach(merged::putLiteral);
            result.nestedConstraints.forEach((parent, children) -> children.forEach(c -> merged.addNested(parent, c)));
            merged.unionGroups.addAll(result.unionGroups);
            merged.errors.addAll(result.errors);
            merged.unsupportedFields.addAll(result.unsupportedFields);
        }
        return ResultNormalizer.normalize(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstraintResult that = (ConstraintResult) o;
        return readOnlyFields.equals(that.readOnlyFields)
               && literalFields.equals(that.literalFields)
               && nestedConstraints.equals(that.nestedConstraints)
               && unionGroups.equals(that.unionGroups)
               && errors.equals(that.errors)
               && unsupportedFields.equals(that.unsupportedFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(readOnlyFields, literalFields, nestedConstraints, unionGroups, errors, unsupportedFields);
    }

    @Override
    public String toString() {
        return "ConstraintResult{" +
               "readOnlyFields=" + readOnlyFields +
               ", literalFields=" + literalFields +
               ", nestedConstraints=" + nestedConstraints +
               ", unionGroups=" + unionGroups +
               ", errors=" + errors +
               '}';
    }
}
