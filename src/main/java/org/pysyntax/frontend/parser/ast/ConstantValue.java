package org.pysyntax.frontend.parser.ast;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * The literal value held by a {@link Expression.Constant}.
 */
public sealed interface ConstantValue {

    ConstantValue NONE = new None();
    ConstantValue TRUE = new Bool(true);
    ConstantValue FALSE = new Bool(false);
    ConstantValue ELLIPSIS = new Ellipsis();

    /** The {@code None} singleton. */
    record None() implements ConstantValue {
    }

    /** {@code True} or {@code False}. */
    record Bool(boolean value) implements ConstantValue {
    }

    /**
     * An integer literal. Python integers are unbounded.
     * @param value The value.
     */
    record Int(BigInteger value) implements ConstantValue {
        public Int {
            Objects.requireNonNull(value, "value");
        }

        public static Int of(long value) {
            return new Int(BigInteger.valueOf(value));
        }
    }

    record Float(double value) implements ConstantValue {
    }

    /**
     * An imaginary or complex number. Literals written in source ({@code 2j}) always have a zero real part.
     * @param real The real part.
     * @param imag The imaginary part.
     */
    record Complex(double real, double imag) implements ConstantValue {
    }

    record Str(String value) implements ConstantValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A bytes literal. The array is copied on the way in and out.
     * @param value The raw bytes.
     */
    record Bytes(byte[] value) implements ConstantValue {
        public Bytes {
            value = value.clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bytes other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Bytes[" + Arrays.toString(value) + "]";
        }
    }

    /** The {@code ...} literal. */
    record Ellipsis() implements ConstantValue {
    }
}
