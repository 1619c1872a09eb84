package nadra.lexer;

import java.util.Objects;

/**
 * In-memory value of a literal token.
 */
public sealed interface LiteralValue
        permits LiteralValue.IntValue, LiteralValue.FloatValue, LiteralValue.StringValue {

    record IntValue(long value) implements LiteralValue {
        @Override
        public String toString() {
            return "Integer(" + value + ")";
        }
    }

    record FloatValue(double value) implements LiteralValue {
        @Override
        public String toString() {
            return "Float(" + value + ")";
        }
    }

    record StringValue(String value) implements LiteralValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }
}
