// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeApplication;
import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeDouble;
import com.mathbridge.kernel.NativeFraction;
import com.mathbridge.kernel.NativeInt;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.util.BigIntegerTranscoder;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LiteKernelTest {

    private final LiteKernel kernel = new LiteKernel();

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
        "x+2*y          | x+2*y",
        "(a+b)*c        | (a+b)*c",
        "a-(b-c)        | a-(b-c)",
        "a-b-c          | a-b-c",
        "(a+b)+c        | (a+b)+c",
        "a*(b*c)        | a*(b*c)",
        "-(a+b)         | -(a+b)",
        "-x             | -x",
        "f(x, y)        | f(x,y)",
        "sin(x)^2       | sin(x)^2",
        "x^(1/2)        | x^(1/2)",
        "2^-1           | 2^(-1)",
        "(2^3)^4        | (2^3)^4",
        "[1, 2, 3]      | [1,2,3]",
        "x = 1          | x=1",
        "x<=y and y<z   | x<=y and y<z",
        "x mod 3        | x mod 3",
        "3/6            | 1/2",
        "4/2            | 2",
        "-7             | -7",
        "1.5e3          | 1500.0",
    })
    public void rendersWithMinimalParentheses(String text, String expected) {
        NativeNode node = kernel.evaluate(text);
        assertEquals(expected, kernel.render(node));
        assertEquals(node, kernel.evaluate(kernel.render(node)));
    }

    @Test
    public void integerLiteralsBeyondIntRangeAreBig() {
        assertEquals(NativeType.INT, kernel.evaluate("2147483647").getType());
        assertEquals(NativeType.INT, kernel.evaluate("-2147483648").getType());

        NativeNode big = kernel.evaluate("123456789012345678901234567890");
        assertEquals(NativeType.BIGINT, big.getType());
        NativeBigInt b = (NativeBigInt) big;
        assertEquals(new BigInteger("123456789012345678901234567890"),
                     BigIntegerTranscoder.fromMagnitude(b.getMagnitude(), b.getSign()));
        assertEquals("123456789012345678901234567890", kernel.render(big));
    }

    @Test
    public void quotientOfIntegerLiteralsIsFraction() {
        NativeNode node = kernel.evaluate("-2/4");
        assertEquals(NativeType.FRACTION, node.getType());
        NativeFraction f = (NativeFraction) node;
        assertEquals(-1, ((NativeInt) f.getNumerator()).intValue());
        assertEquals(2, ((NativeInt) f.getDenominator()).intValue());
    }

    @Test
    public void singleArgumentCallHasBareFeuille() {
        NativeApplication app = (NativeApplication) kernel.evaluate("sqrt(2)");
        assertEquals("sqrt", app.getOperator());
        assertEquals(NativeType.INT, app.getFeuille().getType());
        assertEquals(1, app.getArguments().size());

        NativeApplication pair = (NativeApplication) kernel.evaluate("atan2(y,x)");
        assertEquals(NativeType.VECTOR, pair.getFeuille().getType());
        assertEquals(2, pair.getArguments().size());
    }

    @Test
    public void singleVectorArgumentStaysDistinctFromArgumentList() {
        NativeApplication app = kernel.newApplication("det", kernel.newVector(kernel.newInt(1), kernel.newInt(2)));
        assertEquals(1, app.getArguments().size());
        assertEquals(NativeType.VECTOR, app.getArguments().get(0).getType());
        assertEquals("det([1,2])", kernel.render(app));
        assertEquals(app, kernel.evaluate("det([1,2])"));
    }

    @Test
    public void sumsAndProductsAreFlattened() {
        NativeApplication sum = (NativeApplication) kernel.evaluate("a+b+c");
        assertEquals("+", sum.getOperator());
        assertEquals(3, sum.getArguments().size());
    }

    @Test
    public void specialDoubles() {
        assertEquals(Double.POSITIVE_INFINITY, ((NativeDouble) kernel.evaluate("inf")).doubleValue(), 0.0);
        assertTrue(Double.isNaN(((NativeDouble) kernel.evaluate("undef")).doubleValue()));
        assertEquals("-inf", kernel.render(kernel.newDouble(Double.NEGATIVE_INFINITY)));
    }

    @Test
    public void complexNumbers() {
        assertEquals("i", kernel.render(kernel.newComplex(kernel.newInt(0), kernel.newInt(1))));
        assertEquals("-i", kernel.render(kernel.newComplex(kernel.newInt(0), kernel.newInt(-1))));
        assertEquals("2*i", kernel.render(kernel.newComplex(kernel.newInt(0), kernel.newInt(2))));
        assertEquals("2+3*i", kernel.render(kernel.newComplex(kernel.newInt(2), kernel.newInt(3))));
        assertEquals("2-3*i", kernel.render(kernel.newComplex(kernel.newInt(2), kernel.newInt(-3))));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "1+", "(1", "f(x", "and", "3 $", "[1,2", "x y" })
    public void malformedTextIsRejected(String text) {
        assertThrows(KernelException.class, () -> kernel.evaluate(text));
    }

    @Test
    public void factoryRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> kernel.newIdentifier(""));
        assertThrows(NullPointerException.class, () -> kernel.newVector((NativeNode) null));
        assertThrows(IllegalArgumentException.class, () -> kernel.newBigInt(new byte[0], -1));
    }
}
