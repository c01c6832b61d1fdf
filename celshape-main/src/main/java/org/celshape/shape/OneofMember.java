package org.celshape.shape;

import java.util.List;
import java.util.Objects;

/**
 * A oneof group, rendered as a discriminated union over its fields.
 */
public record OneofMember(String localName, List<FieldMember> fields) implements Member {

    public OneofMember {
        Objects.requireNonNull(localName, "localName");
        fields = List.copyOf(fields);
    }
}
