// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.convert;

import static com.mathbridge.convert.NativeRecipe.operator;
import static com.mathbridge.convert.NativeRecipe.relational;
import static com.mathbridge.convert.NativeRecipe.structural;

import com.mathbridge.convert.NativeRecipe.Structure;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Static lookup tables between native operator and constant spellings and
 * MathJSON tags.
 * <p>
 * The two operator tables are deliberately not inverses of each other.
 * Several native spellings collapse onto one tag (<code>log</code> and
 * <code>ln</code> both give <code>Ln</code>), some tags only exist in the
 * reverse direction (<code>Negate</code>, <code>Choose</code>), and the
 * reverse table maps to {@link NativeRecipe}s rather than plain names.
 */
public final class OperatorTables
{
    /** MathJSON tag of an exact fraction. */
    public static final String RATIONAL = "Rational";
    /** MathJSON tag of a complex number. */
    public static final String COMPLEX = "Complex";
    /** MathJSON tag of a list. */
    public static final String LIST = "List";
    /** MathJSON tag of a unary minus. */
    public static final String NEGATE = "Negate";
    /** MathJSON tag of a square root. */
    public static final String SQRT = "Sqrt";

    /** Canonical name of Euler's number. */
    public static final String EXPONENTIAL_E = "ExponentialE";
    /** Canonical name of the imaginary unit. */
    public static final String IMAGINARY_UNIT = "ImaginaryUnit";

    private static final Map<String, String> NATIVE_TO_TAG;
    private static final Map<String, NativeRecipe> TAG_TO_RECIPE;
    private static final Map<String, String> NATIVE_TO_CONSTANT;
    private static final Map<String, String> CONSTANT_TO_NATIVE;

    static
    {
        Map<String, String> t = new HashMap<String, String>();

        // Arithmetic operators
        t.put("+",   "Add");
        t.put("*",   "Multiply");
        t.put("-",   "Subtract");
        t.put("/",   "Divide");
        t.put("^",   "Power");
        t.put("mod", "Mod");

        // Arithmetic functions
        t.put("abs",       "Abs");
        t.put("sign",      "Sign");
        t.put("floor",     "Floor");
        t.put("ceil",      "Ceil");
        t.put("round",     "Round");
        t.put("trunc",     "Truncate");
        t.put("max",       "Max");
        t.put("min",       "Min");
        t.put("sqrt",      "Sqrt");
        t.put("exp",       "Exp");
        t.put("factorial", "Factorial");
        t.put("hypot",     "Hypot");

        // Logarithms
        t.put("ln",    "Ln");
        t.put("log",   "Ln");
        t.put("log10", "Log10");

        // Trigonometric and inverse trigonometric
        t.put("sin",  "Sin");
        t.put("cos",  "Cos");
        t.put("tan",  "Tan");
        t.put("cot",  "Cot");
        t.put("sec",  "Sec");
        t.put("csc",  "Csc");
        t.put("asin", "Arcsin");
        t.put("acos", "Arccos");
        t.put("atan", "Arctan");
        t.put("acot", "Arccot");

        // Hyperbolic and inverse hyperbolic
        t.put("sinh",  "Sinh");
        t.put("cosh",  "Cosh");
        t.put("tanh",  "Tanh");
        t.put("coth",  "Coth");
        t.put("asinh", "Arsinh");
        t.put("acosh", "Arcosh");
        t.put("atanh", "Artanh");

        // Complex numbers
        t.put("re",   "Real");
        t.put("im",   "Imaginary");
        t.put("conj", "Conjugate");
        t.put("arg",  "Argument");

        // Number theory
        t.put("gcd",       "GCD");
        t.put("lcm",       "LCM");
        t.put("isprime",   "IsPrime");
        t.put("binomial",  "Binomial");
        t.put("fibonacci", "Fibonacci");

        // Special functions
        t.put("Gamma",     "Gamma");
        t.put("beta",      "Beta");
        t.put("erf",       "Erf");
        t.put("erfc",      "Erfc");
        t.put("zeta",      "Zeta");
        t.put("Ai",        "AiryAi");
        t.put("Bi",        "AiryBi");
        t.put("BesselJ",   "BesselJ");
        t.put("BesselY",   "BesselY");
        t.put("BesselI",   "BesselI");
        t.put("BesselK",   "BesselK");
        t.put("digamma",   "Digamma");
        t.put("Heaviside", "Heaviside");

        // Linear algebra
        t.put("det",          "Determinant");
        t.put("inv",          "Inverse");
        t.put("trace",        "Trace");
        t.put("transpose",    "Transpose");
        t.put("tran",         "Transpose");
        t.put("rank",         "Rank");
        t.put("diag",         "Diagonal");
        t.put("eigenvalues",  "Eigenvalues");
        t.put("eigenvectors", "Eigenvectors");
        t.put("norm",         "Norm");
        t.put("kernel",       "Kernel");

        // Algebra
        t.put("factor",   "Factor");
        t.put("expand",   "Expand");
        t.put("simplify", "Simplify");
        t.put("normal",   "Together");

        // Calculus
        t.put("diff",      "D");
        t.put("integrate", "Integrate");
        t.put("limit",     "Limit");
        t.put("sum",       "Sum");
        t.put("product",   "Product");

        // Relations
        t.put("==", "Equal");
        t.put("=",  "Equal");
        t.put("!=", "NotEqual");
        t.put("<",  "Less");
        t.put("<=", "LessEqual");
        t.put(">",  "Greater");
        t.put(">=", "GreaterEqual");

        // Logic
        t.put("and", "And");
        t.put("or",  "Or");
        t.put("not", "Not");

        // Statistics
        t.put("mean",      "Mean");
        t.put("median",    "Median");
        t.put("variance",  "Variance");
        t.put("stddev",    "StandardDeviation");
        t.put("quartiles", "Quartiles");

        // Collections
        t.put("sort",    "Sort");
        t.put("reverse", "Reverse");

        NATIVE_TO_TAG = Collections.unmodifiableMap(t);


        Map<String, NativeRecipe> r = new HashMap<String, NativeRecipe>();

        // Structural nodes
        r.put(RATIONAL, structural(Structure.FRACTION));
        r.put(COMPLEX,  structural(Structure.COMPLEX));
        r.put(LIST,     structural(Structure.VECTOR));

        // Arithmetic operators
        r.put("Add",      operator("+"));
        r.put("Multiply", operator("*"));
        r.put("Subtract", operator("-"));
        r.put(NEGATE,     operator("-"));
        r.put("Divide",   operator("/"));
        r.put("Power",    operator("^"));
        r.put("Mod",      operator("mod"));

        // Arithmetic functions
        r.put("Abs",       operator("abs"));
        r.put("Sign",      operator("sign"));
        r.put("Floor",     operator("floor"));
        r.put("Ceil",      operator("ceil"));
        r.put("Round",     operator("round"));
        r.put("Truncate",  operator("trunc"));
        r.put("Max",       operator("max"));
        r.put("Min",       operator("min"));
        r.put(SQRT,        operator("sqrt"));
        r.put("Exp",       operator("exp"));
        r.put("Factorial", operator("factorial"));
        r.put("Hypot",     operator("hypot"));

        // Logarithms
        r.put("Ln",    operator("ln"));
        r.put("Log",   operator("ln"));
        r.put("Log10", operator("log10"));

        // Trigonometric and inverse trigonometric
        r.put("Sin",     operator("sin"));
        r.put("Cos",     operator("cos"));
        r.put("Tan",     operator("tan"));
        r.put("Cot",     operator("cot"));
        r.put("Sec",     operator("sec"));
        r.put("Csc",     operator("csc"));
        r.put("Arcsin",  operator("asin"));
        r.put("Arccos",  operator("acos"));
        r.put("Arctan",  operator("atan"));
        r.put("Arctan2", operator("atan2"));
        r.put("Arccot",  operator("acot"));

        // Hyperbolic and inverse hyperbolic
        r.put("Sinh",   operator("sinh"));
        r.put("Cosh",   operator("cosh"));
        r.put("Tanh",   operator("tanh"));
        r.put("Coth",   operator("coth"));
        r.put("Arsinh", operator("asinh"));
        r.put("Arcosh", operator("acosh"));
        r.put("Artanh", operator("atanh"));

        // Complex numbers
        r.put("Real",      operator("re"));
        r.put("Imaginary", operator("im"));
        r.put("Conjugate", operator("conj"));
        r.put("Argument",  operator("arg"));

        // Number theory
        r.put("GCD",         operator("gcd"));
        r.put("LCM",         operator("lcm"));
        r.put("IsPrime",     operator("isprime"));
        r.put("Binomial",    operator("binomial"));
        r.put("Choose",      operator("binomial"));
        r.put("Fibonacci",   operator("fibonacci"));
        r.put("Numerator",   operator("numerator"));
        r.put("Denominator", operator("denominator"));

        // Special functions
        r.put("Gamma",     operator("Gamma"));
        r.put("Beta",      operator("beta"));
        r.put("Erf",       operator("erf"));
        r.put("Erfc",      operator("erfc"));
        r.put("Zeta",      operator("zeta"));
        r.put("AiryAi",    operator("Ai"));
        r.put("AiryBi",    operator("Bi"));
        r.put("BesselJ",   operator("BesselJ"));
        r.put("BesselY",   operator("BesselY"));
        r.put("BesselI",   operator("BesselI"));
        r.put("BesselK",   operator("BesselK"));
        r.put("Digamma",   operator("digamma"));
        r.put("Heaviside", operator("Heaviside"));

        // Linear algebra
        r.put("Determinant",  operator("det"));
        r.put("Inverse",      operator("inv"));
        r.put("Trace",        operator("trace"));
        r.put("Transpose",    operator("transpose"));
        r.put("Rank",         operator("rank"));
        r.put("Diagonal",     operator("diag"));
        r.put("Eigenvalues",  operator("eigenvalues"));
        r.put("Eigenvectors", operator("eigenvectors"));
        r.put("Norm",         operator("norm"));
        r.put("Kernel",       operator("kernel"));

        // Algebra
        r.put("Factor",    operator("factor"));
        r.put("Expand",    operator("expand"));
        r.put("ExpandAll", operator("expand"));
        r.put("Simplify",  operator("simplify"));
        r.put("Together",  operator("normal"));
        r.put("Cancel",    operator("normal"));

        // Calculus
        r.put("D",          operator("diff"));
        r.put("Derivative", operator("diff"));
        r.put("Integrate",  operator("integrate"));
        r.put("Limit",      operator("limit"));
        r.put("Sum",        operator("sum"));
        r.put("Product",    operator("product"));

        // Relations
        r.put("Equal",        relational("="));
        r.put("NotEqual",     relational("!="));
        r.put("Less",         relational("<"));
        r.put("LessEqual",    relational("<="));
        r.put("Greater",      relational(">"));
        r.put("GreaterEqual", relational(">="));

        // Logic
        r.put("And", operator("and"));
        r.put("Or",  operator("or"));
        r.put("Not", operator("not"));

        // Statistics
        r.put("Mean",              operator("mean"));
        r.put("Median",            operator("median"));
        r.put("Variance",          operator("variance"));
        r.put("StandardDeviation", operator("stddev"));
        r.put("Quartiles",         operator("quartiles"));

        // Collections
        r.put("Sort",    operator("sort"));
        r.put("Reverse", operator("reverse"));

        // Evaluation
        r.put("N", operator("evalf"));

        TAG_TO_RECIPE = Collections.unmodifiableMap(r);


        Map<String, String> c = new HashMap<String, String>();
        c.put("pi", "Pi");
        c.put("π", "Pi");
        c.put("e", EXPONENTIAL_E);
        c.put("i", IMAGINARY_UNIT);
        NATIVE_TO_CONSTANT = Collections.unmodifiableMap(c);

        Map<String, String> n = new HashMap<String, String>();
        n.put("Pi", "pi");
        n.put(EXPONENTIAL_E, "e");
        n.put(IMAGINARY_UNIT, "i");
        n.put("True", "true");
        n.put("False", "false");
        CONSTANT_TO_NATIVE = Collections.unmodifiableMap(n);
    }

    /** You no touchy. */
    private OperatorTables() { }


    /**
     * Looks up the MathJSON tag of a native operator.
     *
     * @return null if the operator is unmapped.
     */
    public static String tagFor(String nativeOperator)
    {
        return NATIVE_TO_TAG.get(nativeOperator);
    }

    /**
     * Looks up how to rebuild a native node for a MathJSON tag.
     *
     * @return null if the tag is unmapped.
     */
    public static NativeRecipe recipeFor(String tag)
    {
        return TAG_TO_RECIPE.get(tag);
    }

    /**
     * Maps a native identifier to its canonical constant name.
     *
     * @return null if the identifier does not name a constant.
     */
    public static String constantFor(String nativeName)
    {
        return NATIVE_TO_CONSTANT.get(nativeName);
    }

    /**
     * Maps a canonical constant name to its native spelling.
     *
     * @return null if the name is not a known constant.
     */
    public static String nativeConstantFor(String canonicalName)
    {
        return CONSTANT_TO_NATIVE.get(canonicalName);
    }

    /**
     * @return an unmodifiable view of the native to MathJSON operator table.
     */
    public static Map<String, String> nativeToTag()
    {
        return NATIVE_TO_TAG;
    }

    /**
     * @return an unmodifiable view of the MathJSON to native recipe table.
     */
    public static Map<String, NativeRecipe> tagToRecipe()
    {
        return TAG_TO_RECIPE;
    }
}
