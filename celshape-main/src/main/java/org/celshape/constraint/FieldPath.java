package org.celshape.constraint;

import java.util.ArrayList;
import java.util.List;

/**
 * A field path rooted at the subject, e.g. {@code [parent, child]} for {@code this.parent.child}.
 * Segments are already camel cased.
 */
public record FieldPath(List<String> segments) {

    public FieldPath {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A field path needs at least one segment");
        }
        segments = List.copyOf(segments);
    }

    public static FieldPath of(String... segments) {
        return new FieldPath(List.of(segments));
    }

    public FieldPath append(String field) {
        List<String> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(field);
        return new FieldPath(extended);
    }

    public int depth() {
        return segments.size();
    }

    public boolean isTopLevel() {
        return segments.size() == 1;
    }

    /**
     * The top-level field name.
     */
    public String head() {
        return segments.get(0);
    }

    /**
     * The immediate child of {@link #head()}. Deeper segments are never tracked.
     */
    public String child() {
        if (isTopLevel()) {
            throw new IllegalStateException("Top-level path '" + this + "' has no child segment");
        }
        return segments.get(1);
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
