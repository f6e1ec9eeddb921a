package io.github.mathml.content;

import java.util.Objects;

/// Typed interpretation of a `<cn>` literal, one case per MathML 2.0 number `type`.
public sealed interface NumberValue {

    /// The value of the `type` attribute this case corresponds to.
    String typeName();

    record Real(double value) implements NumberValue {
        @Override
        public String typeName() {
            return "real";
        }
    }

    record IntegerValue(long value) implements NumberValue {
        @Override
        public String typeName() {
            return "integer";
        }
    }

    record Rational(long numerator, long denominator) implements NumberValue {
        public Rational {
            if (denominator == 0) {
                throw new IllegalArgumentException("denominator must not be zero");
            }
        }

        @Override
        public String typeName() {
            return "rational";
        }
    }

    record ComplexCartesian(double real, double imaginary) implements NumberValue {
        @Override
        public String typeName() {
            return "complex-cartesian";
        }
    }

    record ComplexPolar(double modulus, double argument) implements NumberValue {
        @Override
        public String typeName() {
            return "complex-polar";
        }
    }

    /// A named constant such as `π`, kept verbatim.
    record Constant(String name) implements NumberValue {
        public Constant {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String typeName() {
            return "constant";
        }
    }

    /// `mantissa` times ten to the power `exponent`.
    record ENotation(double mantissa, long exponent) implements NumberValue {
        @Override
        public String typeName() {
            return "e-notation";
        }
    }
}
