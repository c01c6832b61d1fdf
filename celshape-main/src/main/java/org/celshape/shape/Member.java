package org.celshape.shape;

/**
 * A member of a generated message shape: a plain field or a oneof group.
 */
public sealed interface Member permits FieldMember, OneofMember {

    /**
     * The camel cased name the member has in generated code.
     */
    String localName();
}
