package org.celshape.shape;

import java.util.List;

/**
 * A structural type declaration: the union of its alternatives, or the single alternative when there is one.
 */
public record TypeShape(String name, String typeName, List<ShapeAlternative> alternatives) {

    public TypeShape {
        alternatives = List.copyOf(alternatives);
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("A type shape has at least one alternative");
        }
    }

    public boolean isUnion() {
        return alternatives.size() > 1;
    }
}
