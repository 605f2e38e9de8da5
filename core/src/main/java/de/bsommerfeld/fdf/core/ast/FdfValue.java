package de.bsommerfeld.fdf.core.ast;

import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Typed value of an FDF property. A property carries either a single scalar
 * (string literal, number literal, bare identifier) or, when it was written
 * with two or more comma-separated values, an {@link ArrayValue} of scalars.
 *
 * <p>
 * The same variant is used for the AST and for the metadata bag that keeps
 * unmodeled properties of a resolved frame, so a property survives
 * import and re-export without losing its literal kind.
 */
public sealed interface FdfValue
        permits FdfValue.StringLiteral, FdfValue.NumberLiteral, FdfValue.Identifier, FdfValue.ArrayValue {

    /** Recorded value of a property written without any value (a flag). */
    Identifier FLAG = new Identifier("true");

    /**
     * Textual content of the value: the raw string of literals and identifiers,
     * the plain decimal form of numbers, and the comma-joined elements of arrays.
     */
    String text();

    /** The numeric value if this is a number literal. */
    default Optional<Double> number() {
        return Optional.empty();
    }

    /** This value's elements if it is an array, otherwise a single-element list of itself. */
    default List<FdfValue> elements() {
        return List.of(this);
    }

    record StringLiteral(String value) implements FdfValue {

        @Override
        public String text() {
            return value;
        }
    }

    record NumberLiteral(double value) implements FdfValue {

        @Override
        public String text() {
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }

        @Override
        public Optional<Double> number() {
            return Optional.of(value);
        }
    }

    record Identifier(String name) implements FdfValue {

        @Override
        public String text() {
            return name;
        }
    }

    record ArrayValue(List<FdfValue> values) implements FdfValue {

        public ArrayValue {
            values = ImmutableList.copyOf(values);
        }

        @Override
        public String text() {
            StringBuilder sb = new StringBuilder();
            for (FdfValue v : values) {
                if (sb.length() > 0)
                    sb.append(", ");
                sb.append(v.text());
            }
            return sb.toString();
        }

        @Override
        public List<FdfValue> elements() {
            return values;
        }
    }
}
