/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.celshape.shape.printer;

import java.util.List;

import org.celshape.shape.FieldMember;
import org.celshape.shape.OneofMember;
import org.celshape.shape.ShapeAlternative;
import org.celshape.shape.ShapeMember;
import org.celshape.shape.TypeShape;

/**
 * Renders a {@link TypeShape} as a TypeScript type declaration:
 * <pre>
 * export type User = Message&lt;"acme.User"&gt; &amp; {
 *   name: string;
 *   address?: Omit&lt;Address, 'zip'&gt;;
 * } | Message&lt;"acme.User"&gt; &amp; {
 *   ...
 * };
 * </pre>
 */
public class ShapePrinter {

    private static final String INDENT = "  ";

    public String print(TypeShape shape) {
        StringBuilder printer = new StringBuilder();
        printer.append("export type ").append(shape.name()).append(" = ");
        List<ShapeAlternative> alternatives = shape.alternatives();
        for (int i = 0; i < alternatives.size(); i++) {
            if (i > 0) {
                printer.append(" | ");
            }
            printAlternative(printer, shape.typeName(), alternatives.get(i));
        }
        printer.append(";\n");
        return printer.toString();
    }

    private void printAlternative(StringBuilder printer, String typeName, ShapeAlternative alternative) {
        printer.append("Message<\"").append(typeName).append("\"> & {\n");
        for (ShapeMember member : alternative.members()) {
            if (member.member() instanceof FieldMember field) {
                printField(printer, field, member.excludedChildren());
            } else {
                printOneof(printer, (OneofMember) member.member());
            }
        }
        printer.append("}");
    }

    private void printField(StringBuilder printer, FieldMember field, List<String> excludedChildren) {
        printer.append(INDENT)
               .append(field.localName())
               .append(field.optional() ? "?: " : ": ")
               .append(typing(field.typing(), excludedChildren))
               .append(";\n");
    }

    private void printOneof(StringBuilder printer, OneofMember oneof) {
        printer.append(INDENT).append(oneof.localName()).append(": ");
        for (FieldMember field : oneof.fields()) {
            printer.append("{\n");
            printer.append(INDENT).append(INDENT).append("value: ").append(field.typing()).append(";\n");
            printer.append(INDENT).append(INDENT).append("case: \"").append(field.localName()).append("\";\n");
            printer.append(INDENT).append("} | ");
        }
        printer.append("{ case: undefined; value?: undefined };\n");
    }

    static String typing(String typing, List<String> excludedChildren) {
        if (excludedChildren.isEmpty()) {
            return typing;
        }
        return "Omit<" + typing + ", '" + String.join("' | '", excludedChildren) + "'>";
    }
}
