package io.github.mathml.content;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltinOpTest extends MathMlTestBase {

    @Test
    void testLookupFindsArithmeticOperators() {
        assertThat(BuiltinOp.lookup("plus")).contains(BuiltinOp.PLUS);
        assertThat(BuiltinOp.lookup("minus")).contains(BuiltinOp.MINUS);
        assertThat(BuiltinOp.lookup("times")).contains(BuiltinOp.TIMES);
        assertThat(BuiltinOp.lookup("divide")).contains(BuiltinOp.DIVIDE);
        assertThat(BuiltinOp.lookup("power")).contains(BuiltinOp.POWER);
        assertThat(BuiltinOp.lookup("root")).contains(BuiltinOp.ROOT);
    }

    @Test
    void testLookupFindsLogicAndRelations() {
        assertThat(BuiltinOp.lookup("and")).contains(BuiltinOp.AND);
        assertThat(BuiltinOp.lookup("or")).contains(BuiltinOp.OR);
        assertThat(BuiltinOp.lookup("not")).contains(BuiltinOp.NOT);
        assertThat(BuiltinOp.lookup("eq")).contains(BuiltinOp.EQ);
        assertThat(BuiltinOp.lookup("neq")).contains(BuiltinOp.NEQ);
        assertThat(BuiltinOp.lookup("lt")).contains(BuiltinOp.LT);
        assertThat(BuiltinOp.lookup("gt")).contains(BuiltinOp.GT);
        assertThat(BuiltinOp.lookup("leq")).contains(BuiltinOp.LEQ);
        assertThat(BuiltinOp.lookup("geq")).contains(BuiltinOp.GEQ);
    }

    @Test
    void testLookupRejectsStructuralAndUnknownTags() {
        assertThat(BuiltinOp.lookup("apply")).isEmpty();
        assertThat(BuiltinOp.lookup("ci")).isEmpty();
        assertThat(BuiltinOp.lookup("cn")).isEmpty();
        assertThat(BuiltinOp.lookup("math")).isEmpty();
        assertThat(BuiltinOp.lookup("foo")).isEmpty();
        assertThat(BuiltinOp.lookup(null)).isEmpty();
    }

    @Test
    void testLookupIsCaseSensitive() {
        assertThat(BuiltinOp.lookup("Plus")).isEmpty();
        assertThat(BuiltinOp.lookup("PLUS")).isEmpty();
    }

    @Test
    void testEveryConstantRoundTripsThroughItsTag() {
        for (BuiltinOp op : BuiltinOp.values()) {
            assertThat(BuiltinOp.lookup(op.tag())).as(op.name()).contains(op);
            assertThat(op.toString()).isEqualTo(op.tag());
        }
    }

    @Test
    void testTagsAreUnique() {
        final var tags = new HashSet<String>();
        Arrays.stream(BuiltinOp.values()).forEach(op -> assertThat(tags.add(op.tag())).as(op.tag()).isTrue());
    }

    @Test
    void testCategories() {
        assertThat(BuiltinOp.SIN.category()).isEqualTo(BuiltinOp.Category.ELEMENTARY);
        assertThat(BuiltinOp.EQ.category()).isEqualTo(BuiltinOp.Category.RELATION);
        assertThat(BuiltinOp.PI.category()).isEqualTo(BuiltinOp.Category.CONSTANT);
        assertThat(BuiltinOp.PARTIALDIFF.category()).isEqualTo(BuiltinOp.Category.CALCULUS);
        assertThat(BuiltinOp.lookup("forall")).contains(BuiltinOp.FORALL);
        assertThat(BuiltinOp.lookup("bvar")).isEmpty();
    }
}
