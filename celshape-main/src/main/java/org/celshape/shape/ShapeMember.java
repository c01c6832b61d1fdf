package org.celshape.shape;

import java.util.List;

/**
 * A member kept in a shape alternative, with the child members its nested type must leave out.
 */
public record ShapeMember(Member member, List<String> excludedChildren) {

    public ShapeMember {
        excludedChildren = List.copyOf(excludedChildren);
    }

    public String localName() {
        return member.localName();
    }
}
