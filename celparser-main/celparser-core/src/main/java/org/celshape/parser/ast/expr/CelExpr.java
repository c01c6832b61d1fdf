package org.celshape.parser.ast.expr;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.celshape.parser.ast.visitor.CelGenericVisitor;

/**
 * Immutable CEL expression tree, as produced by the parser.
 * <p>
 * The set of node kinds is closed. Analyses implement {@link CelGenericVisitor}, usually through
 * {@link org.celshape.parser.ast.visitor.CelGenericVisitorWithDefaults}, so anything they do not
 * handle falls into a single default action.
 */
public sealed interface CelExpr
        permits CelExpr.Ident,
                CelExpr.Select,
                CelExpr.Constant,
                CelExpr.Call,
                CelExpr.CreateList,
                CelExpr.CreateMap,
                CelExpr.CreateStruct {

    <R, A> R accept(CelGenericVisitor<R, A> v, A arg);

    /** Bare identifier, e.g. {@code this}. */
    record Ident(String name) implements CelExpr {

        public Ident {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }

    /** Field selection {@code operand.field}. */
    record Select(CelExpr operand, String field) implements CelExpr {

        public Select {
            Objects.requireNonNull(operand, "operand");
            Objects.requireNonNull(field, "field");
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }

    /**
     * Literal constant. The runtime type of {@code value} follows {@link ConstantKind}: {@code String},
     * {@code Long} (for both signed and unsigned 64-bit), {@code Double}, {@code Boolean}, {@code byte[]},
     * or {@code null}.
     */
    record Constant(ConstantKind kind, Object value) implements CelExpr {

        public Constant {
            Objects.requireNonNull(kind, "kind");
        }

        public static Constant ofString(String value) {
            return new Constant(ConstantKind.STRING, value);
        }

        public static Constant ofInt(long value) {
            return new Constant(ConstantKind.INT64, value);
        }

        public static Constant ofUint(long value) {
            return new Constant(ConstantKind.UINT64, value);
        }

        public static Constant ofDouble(double value) {
            return new Constant(ConstantKind.DOUBLE, value);
        }

        public static Constant ofBool(boolean value) {
            return new Constant(ConstantKind.BOOL, value);
        }

        public static Constant ofNull() {
            return new Constant(ConstantKind.NULL, null);
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }

    /**
     * Function or operator call. {@code target} is the receiver of a member call such as
     * {@code this.name.size()}, and {@code null} for global functions and operators.
     */
    record Call(CelExpr target, String function, List<CelExpr> args) implements CelExpr {

        public Call {
            Objects.requireNonNull(function, "function");
            args = List.copyOf(args);
        }

        public static Call global(String function, List<CelExpr> args) {
            return new Call(null, function, args);
        }

        public static Call of(Operator operator, CelExpr... args) {
            return new Call(null, operator.getFunction(), List.of(args));
        }

        public boolean isGlobal() {
            return target == null;
        }

        public boolean isFunction(String name, int arity) {
            return isGlobal() && function.equals(name) && args.size() == arity;
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }

    /** List literal {@code [a, b]}. */
    record CreateList(List<CelExpr> elements) implements CelExpr {

        public CreateList {
            elements = List.copyOf(elements);
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }

    /** Map literal {@code {k: v}}. Entry order is source order. */
    record CreateMap(List<Map.Entry<CelExpr, CelExpr>> entries) implements CelExpr {

        public CreateMap {
            entries = List.copyOf(entries);
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }

    /**
     * Message construction {@code google.protobuf.Timestamp{seconds: 0}}. {@code messageName} is the dotted type
     * name as written, with a leading dot when fully qualified. Field order is source order.
     */
    record CreateStruct(String messageName, List<Map.Entry<String, CelExpr>> fields) implements CelExpr {

        public CreateStruct {
            Objects.requireNonNull(messageName, "messageName");
            fields = List.copyOf(fields);
        }

        @Override
        public <R, A> R accept(CelGenericVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }
    }
}
