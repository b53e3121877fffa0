// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import com.mathbridge.SyntaxFallbackException;
import com.mathbridge.UnsupportedVariantException;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.lite.LiteKernel;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolicConverterTest {

    private final LiteKernel kernel = new LiteKernel();
    private final SymbolicConverter converter = new SymbolicConverter(new SyntaxFallbackParser(), kernel);

    private Term symbolic(String text) {
        return converter.toSymbolic(kernel.evaluate(text));
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
        "2^6*5^6        | 2^6*5^6",
        "1+2+x          | x+3",
        "x-(1+2)        | x-3",
        "6/4            | 3/2",
        "2*x/4          | 2*x/4",
        "-(x+y)         | -(x+y)",
        "sqrt(8)        | sqrt(8)",
        "ln(x)*exp(2)   | log(x)*exp(2)",
        "[1, x]         | [1,x]",
        "gcd(12,18)     | gcd(12,18)",
        "max(1,2)+x     | max(1,2)+x",
        "3+max(1,2)     | max(1,2)+3",
        "2+3*i          | 3*i+2",
    })
    public void convertsNativeTrees(String text, String expected) {
        assertEquals(expected, symbolic(text).toString());
    }

    @Test
    public void numbers() {
        assertEquals(NumberTerm.of(7), converter.toSymbolic(kernel.newInt(7)));
        assertEquals(NumberTerm.of(0.5), converter.toSymbolic(kernel.newDouble(0.5)));
        BigInteger big = new BigInteger("123456789012345678901234567890");
        assertEquals(NumberTerm.of(big), symbolic(big.toString()));
    }

    @Test
    public void complexNodes() {
        NativeNode z = kernel.newComplex(kernel.newInt(2), kernel.newInt(3));
        assertEquals("3*i+2", converter.toSymbolic(z).toString());
        assertSame(ConstantTerm.IMAGINARY_UNIT,
                   converter.toSymbolic(kernel.newComplex(kernel.newInt(0), kernel.newInt(1))));
    }

    @Test
    public void constantsAndVariables() {
        assertSame(ConstantTerm.PI, symbolic("pi"));
        assertSame(ConstantTerm.IMAGINARY_UNIT, symbolic("i"));
        OperationTerm product = (OperationTerm) symbolic("x*y*x");
        assertSame(product.getOperand(0), product.getOperand(2));
    }

    @Test
    public void preservedCalls() {
        CallTerm call = (CallTerm) symbolic("sin(x)");
        assertTrue(call.isPreserved());
        assertEquals("sin", call.getName());
    }

    @Test
    public void fallbackSharesVariables() {
        OperationTerm product = (OperationTerm) symbolic("x*gcd(x,2)");
        CallTerm call = (CallTerm) product.getOperand(1);
        assertFalse(call.isPreserved());
        assertSame(product.getOperand(0), call.getArguments().get(0));
    }

    @Test
    public void relationsCannotBeReadSymbolically() {
        assertThrows(SyntaxFallbackException.class, () -> symbolic("x=1"));
    }

    @Test
    public void fallbackNeedsEvaluator() {
        SymbolicConverter bare = new SymbolicConverter(new SyntaxFallbackParser(), null);
        assertEquals("x+1", bare.toSymbolic(kernel.evaluate("x+1")).toString());
        UnsupportedVariantException e = assertThrows(UnsupportedVariantException.class,
                                                     () -> bare.toSymbolic(kernel.evaluate("gcd(1,2)")));
        assertEquals("gcd", e.getVariant());
        assertThrows(UnsupportedVariantException.class, () -> bare.fromSymbolic(NumberTerm.ONE));
        assertThrows(UnsupportedVariantException.class, () -> converter.toSymbolic(null));
    }

    @Test
    public void fromSymbolicEvaluatesRendering() {
        Term t = converter.getParser().parse("x^2+1");
        NativeNode node = converter.fromSymbolic(t);
        assertEquals(kernel.evaluate("x^2+1"), node);
        assertEquals("x/(2*y)", kernel.render(converter.fromSymbolic(symbolic("x/(2*y)"))));
    }
}
