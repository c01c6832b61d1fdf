package org.celshape.shape;

import java.util.List;
import java.util.Objects;

/**
 * The parts of a message descriptor shape generation needs.
 *
 * @param typeName              fully qualified protobuf type name, e.g. {@code acme.user.v1.User}
 * @param localName             name of the generated declaration
 * @param members               fields and oneof groups in declaration order
 * @param constraintExpressions the message-level CEL rules, in declaration order
 */
public record MessageSchema(String typeName,
                            String localName,
                            List<Member> members,
                            List<String> constraintExpressions) {

    public MessageSchema {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(localName, "localName");
        members = List.copyOf(members);
        constraintExpressions = List.copyOf(constraintExpressions);
    }
}
