package io.github.mathml.content;

import java.util.Objects;

/// The operator held by an [ContentNode.Op] node: either one of the closed set of
/// [BuiltinOp] token elements, or a [Symbol] naming an operator MathML does not define.
public sealed interface Operator permits BuiltinOp, Operator.Symbol {

    /// The tag name this operator was read from.
    String tag();

    /// A user or vendor defined operator, e.g. an unrecognized childless element
    /// in the operator position of an `<apply>`.
    record Symbol(String name) implements Operator {
        public Symbol {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("name must not be empty");
            }
        }

        @Override
        public String tag() {
            return name;
        }
    }
}
