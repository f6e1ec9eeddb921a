package io.github.mathml.content;

import java.util.ArrayDeque;
import java.util.Deque;

/// XPath-like locator of an element in the input tree, e.g. `/math/apply[1]/ci[2]`.
/// The bracketed index is the 1-based position among the parent's child elements.
///
/// Each step links to its parent, so extending a path is constant time; the text is
/// only assembled by [#toString].
record ElementPath(ElementPath parent, String name, int index) {

    static ElementPath root(String name) {
        return new ElementPath(null, name, 0);
    }

    ElementPath child(String name, int index) {
        return new ElementPath(this, name, index);
    }

    @Override
    public String toString() {
        final Deque<ElementPath> steps = new ArrayDeque<>();
        for (ElementPath step = this; step != null; step = step.parent) {
            steps.push(step);
        }
        final var sb = new StringBuilder();
        for (final ElementPath step : steps) {
            sb.append('/').append(step.name);
            if (step.parent != null) {
                sb.append('[').append(step.index).append(']');
            }
        }
        return sb.toString();
    }
}
