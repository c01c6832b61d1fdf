package org.celshape.shape;

import java.util.Objects;

/**
 * A message field.
 *
 * @param localName camel cased member name
 * @param typing    the rendered type of the field, e.g. {@code string} or {@code Address}
 * @param optional  whether the member may be left out of a value of the shape
 */
public record FieldMember(String localName, String typing, boolean optional) implements Member {

    public FieldMember {
        Objects.requireNonNull(localName, "localName");
        Objects.requireNonNull(typing, "typing");
    }
}
