package org.celshape.constraint;

/**
 * A literal a field is asserted equal to. Every numeric CEL constant, signed, unsigned or floating point,
 * becomes a {@link Numeric}, so {@code 0}, {@code 0u}, {@code 0.0} and {@code -0.0} are the same value.
 */
public sealed interface LiteralValue permits LiteralValue.Text, LiteralValue.Numeric, LiteralValue.Bool {

    static LiteralValue text(String value) {
        return new Text(value);
    }

    static LiteralValue number(double value) {
        // folds -0.0 into 0.0
        return new Numeric(value == 0.0 ? 0.0 : value);
    }

    static LiteralValue bool(boolean value) {
        return new Bool(value);
    }

    record Text(String value) implements LiteralValue {
        @Override
        public String toString() {
            return "'" + value + "'";
        }
    }

    record Numeric(double value) implements LiteralValue {
        @Override
        public String toString() {
            return value == Math.floor(value) && Math.abs(value) < 1e15
                    ? Long.toString((long) value)
                    : Double.toString(value);
        }
    }

    record Bool(boolean value) implements LiteralValue {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }
}
