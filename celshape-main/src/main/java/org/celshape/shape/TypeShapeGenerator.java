package org.celshape.shape;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.celshape.config.ShapeOptions;
import org.celshape.constraint.Branch;
import org.celshape.constraint.ConstraintExtractor;
import org.celshape.constraint.ConstraintResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the structural type of a message from its CEL rules.
 * <p>
 * Without union groups the shape has one alternative: read-only fields are left out, and fields with nested
 * constraints exclude the listed children from their own type. With union groups there is one alternative per
 * branch, each leaving out the message-level read-only fields plus the branch's own, and excluding the
 * message-level nested children plus the branch's own. Alternatives need not be disjoint or exhaustive.
 * <p>
 * Only plain fields are ever omitted or narrowed; oneof groups are kept whole. Literal values do not affect
 * the shape.
 */
public class TypeShapeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TypeShapeGenerator.class);

    private final ShapeOptions options;
    private final ConstraintExtractor extractor;

    public TypeShapeGenerator(ShapeOptions options) {
        this.options = options;
        this.extractor = new ConstraintExtractor(options.getSubject());
    }

    public ShapeOptions getOptions() {
        return options;
    }

    public TypeShape generate(MessageSchema message) {
        if (!options.isCelValidation() || message.constraintExpressions().isEmpty()) {
            ShapeAlternative plain = alternative(message, Set.of(), Map.of());
            return new TypeShape(message.localName(), message.typeName(), List.of(plain));
        }
        ConstraintResult constraints = extractor.extractAll(message.constraintExpressions());
        for (String error : constraints.getErrors()) {
            LOG.warn("Ignoring CEL rule on {}: {}", message.typeName(), error);
        }
        return generate(message, constraints);
    }

    /**
     * Builds the shape of {@code message} from an already merged constraint result.
     */
    public TypeShape generate(MessageSchema message, ConstraintResult constraints) {
        List<ShapeAlternative> alternatives = new ArrayList<>();
        Map<String, List<String>> nested = constraints.getNestedConstraints();
        if (!constraints.hasUnionGroups()) {
            alternatives.add(alternative(message, new HashSet<>(constraints.getReadOnlyFields()), nested));
        } else {
            for (Branch branch : constraints.getUnionGroups()) {
                Set<String> omitted = new HashSet<>(constraints.getReadOnlyFields());
                omitted.addAll(branch.readOnlyFields());
                alternatives.add(alternative(message, omitted, mergeNested(nested, branch.nestedConstraints())));
            }
        }
        LOG.debug("{} has {} shape alternative(s)", message.typeName(), alternatives.size());
        return new TypeShape(message.localName(), message.typeName(), alternatives);
    }

    static Map<String, List<String>> mergeNested(Map<String, List<String>> base, Map<String, List<String>> extra) {
        Map<String, Set<String>> merged = new LinkedHashMap<>();
        base.forEach((parent, children) -> merged.computeIfAbsent(parent, k -> new LinkedHashSet<>()).addAll(children));
        extra.forEach((parent, children) -> merged.computeIfAbsent(parent, k -> new LinkedHashSet<>()).addAll(children));

        Map<String, List<String>> result = new LinkedHashMap<>();
        merged.forEach((parent, children) -> result.put(parent, List.copyOf(children)));
        return result;
    }

    private static ShapeAlternative alternative(MessageSchema message, Set<String> omitted,
                                                Map<String, List<String>> nested) {
        List<ShapeMember> members = new ArrayList<>(message.members().size());
        for (Member member : message.members()) {
            if (member instanceof FieldMember field) {
                if (omitted.contains(field.localName())) {
                    continue;
                }
                members.add(new ShapeMember(field, nested.getOrDefault(field.localName(), List.of())));
            } else {
                members.add(new ShapeMember(member, List.of()));
            }
        }
        return new ShapeAlternative(members);
    }
}
