// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import com.mathbridge.Rational;
import com.mathbridge.symbolic.OperationTerm.Operator;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TermsTest {

    private final VariableTerm x = new VariableTerm("x");
    private final VariableTerm y = new VariableTerm("y");
    private final VariableTerm z = new VariableTerm("z");

    private static NumberTerm n(long value) {
        return NumberTerm.of(value);
    }

    @Test
    public void sumsFoldTheirConstant() {
        assertEquals("x+3", Terms.add(x, n(1), n(2)).toString());
        assertEquals("x+1", Terms.add(n(1), x).toString());
        assertSame(x, Terms.add(x, NumberTerm.ZERO));
        assertEquals(NumberTerm.ZERO, Terms.add(n(2), n(-2)));
        assertEquals(NumberTerm.ZERO, Terms.add());
    }

    @Test
    public void sumsFlatten() {
        OperationTerm sum = (OperationTerm) Terms.add(x, Terms.add(y, z));
        assertEquals(Operator.ADD, sum.getOperator());
        assertEquals(Arrays.asList(x, y, z), sum.getOperands());
    }

    @Test
    public void subtractionAndNegation() {
        assertEquals("x-y", Terms.subtract(x, y).toString());
        assertEquals("x-3", Terms.subtract(x, n(3)).toString());
        assertEquals("x-(y+z)", Terms.subtract(x, Terms.add(y, z)).toString());
        assertSame(x, Terms.negate(Terms.negate(x)));
        assertEquals(n(-3), Terms.negate(n(3)));
        assertEquals("-(x+y)", Terms.negate(Terms.add(x, y)).toString());
        assertEquals("-x^2", Terms.negate(Terms.power(x, n(2))).toString());
    }

    @Test
    public void productsFoldTheirConstant() {
        assertEquals("6*x", Terms.multiply(x, n(2), n(3)).toString());
        assertSame(NumberTerm.ZERO, Terms.multiply(x, NumberTerm.ZERO));
        assertSame(x, Terms.multiply(x, NumberTerm.ONE));
        assertEquals("-2*x", Terms.multiply(x, n(-2)).toString());
        assertEquals("x*(y+1)", Terms.multiply(x, Terms.add(y, n(1))).toString());
        assertEquals(NumberTerm.ONE, Terms.multiply());
    }

    @Test
    public void quotients() {
        assertEquals(NumberTerm.of(Rational.valueOf(3, 2)), Terms.divide(n(6), n(4)));
        assertSame(x, Terms.divide(x, NumberTerm.ONE));
        assertEquals("1/0", Terms.divide(n(1), NumberTerm.ZERO).toString());
        assertEquals("x/(2*y)", Terms.divide(x, Terms.product(Arrays.asList(n(2), y))).toString());
        assertEquals("(x+1)/y", Terms.divide(Terms.add(x, n(1)), y).toString());
        assertEquals("x/(-2)", Terms.divide(x, n(-2)).toString());
        assertEquals(0.5, ((NumberTerm) Terms.divide(NumberTerm.of(1.0), n(2))).doubleValue(), 0.0);
    }

    @Test
    public void powers() {
        assertEquals(n(1024), Terms.power(n(2), n(10)));
        assertEquals(NumberTerm.of(Rational.valueOf(1, 2)), Terms.power(n(2), n(-1)));
        assertEquals("0^(-1)", Terms.power(NumberTerm.ZERO, n(-1)).toString());
        assertEquals("2^2000", Terms.power(n(2), n(2000)).toString());
        assertSame(x, Terms.power(x, NumberTerm.ONE));
        assertEquals("(x+1)^2", Terms.power(Terms.add(x, n(1)), n(2)).toString());
        assertEquals("(1/2)^x", Terms.power(NumberTerm.of(Rational.ONE_HALF), x).toString());
        assertEquals("x^(1/2)", Terms.power(x, NumberTerm.of(Rational.ONE_HALF)).toString());
    }

    @Test
    public void factoredFormsSurvive() {
        Term t = Terms.product(Arrays.asList(Terms.powerOf(n(2), n(6)), Terms.powerOf(n(5), n(6))));
        assertEquals("2^6*5^6", t.toString());
        assertSame(x, Terms.product(Arrays.asList(x)));
        assertEquals(NumberTerm.ONE, Terms.product(Arrays.<Term>asList()));
        assertEquals("x*(-2)", Terms.product(Arrays.asList(x, n(-2))).toString());
        assertEquals("x^1", Terms.powerOf(x, NumberTerm.ONE).toString());
    }

    @Test
    public void operatorArityIsChecked() {
        assertThrows(IllegalArgumentException.class, () -> new OperationTerm(Operator.POWER, x));
        assertThrows(IllegalArgumentException.class, () -> new OperationTerm(Operator.NEGATE, x, y));
    }

    @Test
    public void specialDoubles() {
        assertEquals("inf", NumberTerm.of(Double.POSITIVE_INFINITY).toString());
        assertEquals("-inf", NumberTerm.of(Double.NEGATIVE_INFINITY).toString());
        assertEquals("undef", NumberTerm.of(Double.NaN).toString());
    }
}
