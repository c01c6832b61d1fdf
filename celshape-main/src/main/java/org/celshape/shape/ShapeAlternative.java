package org.celshape.shape;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public record ShapeAlternative(List<ShapeMember> members) {

    public ShapeAlternative {
        members = List.copyOf(members);
    }

    public List<String> memberNames() {
        return members.stream().map(ShapeMember::localName).collect(Collectors.toList());
    }

    public Optional<ShapeMember> member(String localName) {
        return members.stream().filter(m -> m.localName().equals(localName)).findFirst();
    }
}
