// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.convert;

import com.mathbridge.Rational;
import com.mathbridge.UnsupportedVariantException;
import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeApplication;
import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.TextEvaluator;
import com.mathbridge.kernel.lite.LiteKernel;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.mathjson.MathJsonFunction;
import com.mathbridge.mathjson.MathJsonNumber;
import com.mathbridge.mathjson.MathJsonString;
import com.mathbridge.mathjson.MathJsonSymbol;
import com.mathbridge.util.BigIntegerTranscoder;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BackwardConverterTest {

    /** Delegates to a {@link LiteKernel} and records what it was asked to read. */
    private static final class RecordingEvaluator implements TextEvaluator {
        final LiteKernel kernel = new LiteKernel();
        final List<String> evaluated = new ArrayList<>();

        public NativeNode evaluate(String text) {
            evaluated.add(text);
            return kernel.evaluate(text);
        }

        public String render(NativeNode node) {
            return kernel.render(node);
        }
    }

    private final LiteKernel kernel = new LiteKernel();
    private final RecordingEvaluator evaluator = new RecordingEvaluator();
    private final BackwardConverter backward = new BackwardConverter(kernel, evaluator);
    private final BackwardConverter structuralOnly = new BackwardConverter(kernel, null);

    private String convert(MathJsonExpr expr) {
        return kernel.render(backward.convert(expr));
    }

    private static MathJsonSymbol sym(String name) {
        return MathJsonSymbol.of(name);
    }

    private static MathJsonNumber num(long value) {
        return MathJsonNumber.of(value);
    }

    @Test
    public void machineIntegers() {
        assertEquals(kernel.newInt(5), backward.convert(num(5)));
        assertEquals(kernel.newInt(Integer.MIN_VALUE), backward.convert(num(Integer.MIN_VALUE)));

        NativeNode big = backward.convert(num(Long.MAX_VALUE));
        assertEquals(NativeType.BIGINT, big.getType());
        NativeBigInt b = (NativeBigInt) big;
        assertEquals(BigInteger.valueOf(Long.MAX_VALUE),
                     BigIntegerTranscoder.fromMagnitude(b.getMagnitude(), b.getSign()));
    }

    @Test
    public void bigIntegersAreTranscoded() {
        BigInteger value = new BigInteger("-1180591620717411303425");
        NativeNode node = structuralOnly.convert(MathJsonNumber.of(value));
        NativeBigInt b = (NativeBigInt) node;
        assertEquals(-1, b.getSign());
        assertEquals(value, BigIntegerTranscoder.fromMagnitude(b.getMagnitude(), b.getSign()));
        assertEquals(kernel.newInt(0), structuralOnly.convert(MathJsonNumber.of(BigInteger.ZERO)));
    }

    @Test
    public void bigIntegersCanBeReadAsText() {
        BackwardConverter textual = new BackwardConverter(kernel, evaluator, false);
        BigInteger value = BigInteger.ONE.shiftLeft(70);
        NativeNode node = textual.convert(MathJsonNumber.of(value));
        assertThat(evaluator.evaluated, contains("1180591620717411303424"));
        assertEquals(NativeType.BIGINT, node.getType());

        BackwardConverter noEvaluator = new BackwardConverter(kernel, null, false);
        assertThrows(UnsupportedVariantException.class,
                     () -> noEvaluator.convert(MathJsonNumber.of(value)));
    }

    @Test
    public void floatsAndRationals() {
        assertEquals(kernel.newDouble(0.25), backward.convert(MathJsonNumber.of(0.25)));
        assertEquals(kernel.newFraction(kernel.newInt(-1), kernel.newInt(3)),
                     backward.convert(MathJsonNumber.of(Rational.valueOf(-1, 3))));
        assertEquals(kernel.newFraction(kernel.newInt(1), kernel.newInt(2)),
                     backward.convert(MathJsonFunction.of("Rational", num(1), num(2))));
    }

    @Test
    public void bigDecimalsAreReadAsText() {
        NativeNode node = backward.convert(MathJsonNumber.of(new BigDecimal("0.1234567890123456789")));
        assertEquals(NativeType.DOUBLE, node.getType());
        assertThat(evaluator.evaluated, contains("0.1234567890123456789"));
        assertThrows(UnsupportedVariantException.class,
                     () -> structuralOnly.convert(MathJsonNumber.of(new BigDecimal("1.5"))));
    }

    @Test
    public void exponentialEIsRebuiltAsExpOfOne() {
        NativeNode node = structuralOnly.convert(sym("ExponentialE"));
        assertEquals(NativeType.APPLICATION, node.getType());
        assertEquals(kernel.newApplication("exp", kernel.newInt(1)), node);
        assertEquals("exp(1)", kernel.render(node));
    }

    @Test
    public void imaginaryUnitIsRebuiltAsComplex() {
        assertEquals(kernel.newComplex(kernel.newInt(0), kernel.newInt(1)),
                     structuralOnly.convert(sym("ImaginaryUnit")));
    }

    @Test
    public void otherSymbolsBecomeIdentifiers() {
        assertEquals(kernel.newIdentifier("pi"), structuralOnly.convert(sym("Pi")));
        assertEquals(kernel.newIdentifier("true"), structuralOnly.convert(sym("True")));
        assertEquals(kernel.newIdentifier("x"), structuralOnly.convert(sym("x")));
    }

    @Test
    public void stringsAreUnsupported() {
        UnsupportedVariantException e = assertThrows(UnsupportedVariantException.class,
                                                     () -> backward.convert(MathJsonString.of("hello")));
        assertEquals("String", e.getVariant());
        assertThrows(UnsupportedVariantException.class, () -> backward.convert(null));
    }

    @Test
    public void structuralFunctions() {
        assertEquals(kernel.newComplex(kernel.newInt(1), kernel.newInt(2)),
                     structuralOnly.convert(MathJsonFunction.of("Complex", num(1), num(2))));
        assertEquals(kernel.newVector(kernel.newInt(1), kernel.newIdentifier("x")),
                     structuralOnly.convert(MathJsonFunction.of("List", num(1), sym("x"))));
        assertEquals(kernel.newVector(), structuralOnly.convert(MathJsonFunction.of("List")));
        assertThat(evaluator.evaluated, empty());
    }

    @Test
    public void structuralTagWithWrongArityFallsBackToText() {
        assertEquals("rational(1)", convert(MathJsonFunction.of("Rational", num(1))));
        assertThat(evaluator.evaluated, contains("rational(1)"));
    }

    @Test
    public void operatorsBuildUnevaluatedApplications() {
        assertEquals("x+2*y", convert(MathJsonFunction.of("Add", sym("x"),
                                                          MathJsonFunction.of("Multiply", num(2), sym("y")))));
        assertEquals("-x", convert(MathJsonFunction.of("Negate", sym("x"))));
        assertEquals("ln(x)", convert(MathJsonFunction.of("Log", sym("x"))));
        assertEquals("binomial(5,2)", convert(MathJsonFunction.of("Choose", num(5), num(2))));
        assertEquals("sqrt(2)", convert(MathJsonFunction.of("Sqrt", num(2))));
        assertThat(evaluator.evaluated, empty());
    }

    @Test
    public void relationsAreReadAsText() {
        NativeNode node = backward.convert(MathJsonFunction.of("LessEqual", sym("x"),
                                                               MathJsonFunction.of("Add", num(1), sym("y"))));
        assertThat(evaluator.evaluated, contains("(x)<=(1+y)"));
        NativeApplication app = (NativeApplication) node;
        assertEquals("<=", app.getOperator());
        assertEquals("x<=1+y", kernel.render(node));
    }

    @Test
    public void relationWithUnusualArityIsAnApplication() {
        assertEquals(kernel.newApplication("=", kernel.newIdentifier("x")),
                     structuralOnly.convert(MathJsonFunction.of("Equal", sym("x"))));
    }

    @Test
    public void relationWithoutEvaluatorIsUnsupported() {
        UnsupportedVariantException e = assertThrows(UnsupportedVariantException.class,
            () -> structuralOnly.convert(MathJsonFunction.of("Equal", sym("x"), num(1))));
        assertEquals("Equal", e.getVariant());
    }

    @Test
    public void unmappedTagsAreLowercasedAndReadAsText() {
        assertEquals("foobar(1,x)", convert(MathJsonFunction.of("FooBar", num(1), sym("x"))));
        assertThat(evaluator.evaluated, contains("foobar(1,x)"));
        assertThrows(UnsupportedVariantException.class,
                     () -> structuralOnly.convert(MathJsonFunction.of("FooBar", num(1))));
    }

    @Test
    public void kernelRejectionIsUnsupported() {
        TextEvaluator rejecting = new TextEvaluator() {
            public NativeNode evaluate(String text) {
                throw new KernelException("unknown command");
            }

            public String render(NativeNode node) {
                return kernel.render(node);
            }
        };
        BackwardConverter converter = new BackwardConverter(kernel, rejecting);
        UnsupportedVariantException e = assertThrows(UnsupportedVariantException.class,
            () -> converter.convert(MathJsonFunction.of("Mystery", num(1))));
        assertNotNull(e.causeOfType(KernelException.class));
    }
}
