package io.github.mathml.content;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The childless content token elements of MathML 2.0 Content Markup.
///
/// Each constant knows the tag it is written as and the group the MathML
/// recommendation lists it under. [#lookup] maps a tag name to its constant
/// through an immutable table built once at class initialization.
public enum BuiltinOp implements Operator {
    // Arithmetic and algebra
    QUOTIENT("quotient", Category.ARITHMETIC),
    FACTORIAL("factorial", Category.ARITHMETIC),
    DIVIDE("divide", Category.ARITHMETIC),
    MAX("max", Category.ARITHMETIC),
    MIN("min", Category.ARITHMETIC),
    MINUS("minus", Category.ARITHMETIC),
    PLUS("plus", Category.ARITHMETIC),
    POWER("power", Category.ARITHMETIC),
    REM("rem", Category.ARITHMETIC),
    TIMES("times", Category.ARITHMETIC),
    ROOT("root", Category.ARITHMETIC),
    GCD("gcd", Category.ARITHMETIC),
    LCM("lcm", Category.ARITHMETIC),
    ABS("abs", Category.ARITHMETIC),
    CONJUGATE("conjugate", Category.ARITHMETIC),
    ARG("arg", Category.ARITHMETIC),
    REAL("real", Category.ARITHMETIC),
    IMAGINARY("imaginary", Category.ARITHMETIC),
    FLOOR("floor", Category.ARITHMETIC),
    CEILING("ceiling", Category.ARITHMETIC),

    // Logic
    AND("and", Category.LOGIC),
    OR("or", Category.LOGIC),
    XOR("xor", Category.LOGIC),
    NOT("not", Category.LOGIC),
    IMPLIES("implies", Category.LOGIC),
    FORALL("forall", Category.LOGIC),
    EXISTS("exists", Category.LOGIC),

    // Relations
    EQ("eq", Category.RELATION),
    NEQ("neq", Category.RELATION),
    GT("gt", Category.RELATION),
    LT("lt", Category.RELATION),
    GEQ("geq", Category.RELATION),
    LEQ("leq", Category.RELATION),
    EQUIVALENT("equivalent", Category.RELATION),
    APPROX("approx", Category.RELATION),
    FACTOROF("factorof", Category.RELATION),

    // Calculus and vector calculus
    INT("int", Category.CALCULUS),
    DIFF("diff", Category.CALCULUS),
    PARTIALDIFF("partialdiff", Category.CALCULUS),
    DIVERGENCE("divergence", Category.CALCULUS),
    GRAD("grad", Category.CALCULUS),
    CURL("curl", Category.CALCULUS),
    LAPLACIAN("laplacian", Category.CALCULUS),

    // Set theory
    UNION("union", Category.SET),
    INTERSECT("intersect", Category.SET),
    IN("in", Category.SET),
    NOTIN("notin", Category.SET),
    SUBSET("subset", Category.SET),
    PRSUBSET("prsubset", Category.SET),
    NOTSUBSET("notsubset", Category.SET),
    NOTPRSUBSET("notprsubset", Category.SET),
    SETDIFF("setdiff", Category.SET),
    CARD("card", Category.SET),
    CARTESIANPRODUCT("cartesianproduct", Category.SET),

    // Sequences and series
    SUM("sum", Category.SEQUENCE),
    PRODUCT("product", Category.SEQUENCE),
    LIMIT("limit", Category.SEQUENCE),
    TENDSTO("tendsto", Category.SEQUENCE),

    // Elementary classical functions
    EXP("exp", Category.ELEMENTARY),
    LN("ln", Category.ELEMENTARY),
    LOG("log", Category.ELEMENTARY),
    SIN("sin", Category.ELEMENTARY),
    COS("cos", Category.ELEMENTARY),
    TAN("tan", Category.ELEMENTARY),
    SEC("sec", Category.ELEMENTARY),
    CSC("csc", Category.ELEMENTARY),
    COT("cot", Category.ELEMENTARY),
    SINH("sinh", Category.ELEMENTARY),
    COSH("cosh", Category.ELEMENTARY),
    TANH("tanh", Category.ELEMENTARY),
    SECH("sech", Category.ELEMENTARY),
    CSCH("csch", Category.ELEMENTARY),
    COTH("coth", Category.ELEMENTARY),
    ARCSIN("arcsin", Category.ELEMENTARY),
    ARCCOS("arccos", Category.ELEMENTARY),
    ARCTAN("arctan", Category.ELEMENTARY),
    ARCCOSH("arccosh", Category.ELEMENTARY),
    ARCCOT("arccot", Category.ELEMENTARY),
    ARCCOTH("arccoth", Category.ELEMENTARY),
    ARCCSC("arccsc", Category.ELEMENTARY),
    ARCCSCH("arccsch", Category.ELEMENTARY),
    ARCSEC("arcsec", Category.ELEMENTARY),
    ARCSECH("arcsech", Category.ELEMENTARY),
    ARCSINH("arcsinh", Category.ELEMENTARY),
    ARCTANH("arctanh", Category.ELEMENTARY),

    // Statistics
    MEAN("mean", Category.STATISTICS),
    SDEV("sdev", Category.STATISTICS),
    VARIANCE("variance", Category.STATISTICS),
    MEDIAN("median", Category.STATISTICS),
    MODE("mode", Category.STATISTICS),
    MOMENT("moment", Category.STATISTICS),

    // Linear algebra
    DETERMINANT("determinant", Category.LINEAR_ALGEBRA),
    TRANSPOSE("transpose", Category.LINEAR_ALGEBRA),
    SELECTOR("selector", Category.LINEAR_ALGEBRA),
    VECTORPRODUCT("vectorproduct", Category.LINEAR_ALGEBRA),
    SCALARPRODUCT("scalarproduct", Category.LINEAR_ALGEBRA),
    OUTERPRODUCT("outerproduct", Category.LINEAR_ALGEBRA),

    // Functions and inverses
    COMPOSE("compose", Category.FUNCTION),
    IDENT("ident", Category.FUNCTION),
    DOMAIN("domain", Category.FUNCTION),
    CODOMAIN("codomain", Category.FUNCTION),
    IMAGE("image", Category.FUNCTION),
    INVERSE("inverse", Category.FUNCTION),

    // Constants and symbols
    INTEGERS("integers", Category.CONSTANT),
    REALS("reals", Category.CONSTANT),
    RATIONALS("rationals", Category.CONSTANT),
    NATURALNUMBERS("naturalnumbers", Category.CONSTANT),
    COMPLEXES("complexes", Category.CONSTANT),
    PRIMES("primes", Category.CONSTANT),
    EXPONENTIALE("exponentiale", Category.CONSTANT),
    IMAGINARYI("imaginaryi", Category.CONSTANT),
    NOTANUMBER("notanumber", Category.CONSTANT),
    TRUE("true", Category.CONSTANT),
    FALSE("false", Category.CONSTANT),
    EMPTYSET("emptyset", Category.CONSTANT),
    PI("pi", Category.CONSTANT),
    EULERGAMMA("eulergamma", Category.CONSTANT),
    INFINITY("infinity", Category.CONSTANT);

    /// Grouping of the token elements as laid out in chapter 4 of MathML 2.0.
    public enum Category {
        ARITHMETIC,
        LOGIC,
        RELATION,
        CALCULUS,
        SET,
        SEQUENCE,
        ELEMENTARY,
        STATISTICS,
        LINEAR_ALGEBRA,
        FUNCTION,
        CONSTANT
    }

    private static final Map<String, BuiltinOp> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BuiltinOp::tag, Function.identity()));

    private final String tag;
    private final Category category;

    BuiltinOp(String tag, Category category) {
        this.tag = tag;
        this.category = category;
    }

    @Override
    public String tag() {
        return tag;
    }

    public Category category() {
        return category;
    }

    /// Finds the built-in operator written with the given tag name.
    /// Matching is exact and case-sensitive, as XML names are.
    /// @param tag the local tag name
    /// @return the operator, or empty if the tag is not a built-in token element
    public static Optional<BuiltinOp> lookup(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TAG.get(tag));
    }

    @Override
    public String toString() {
        return tag;
    }
}
