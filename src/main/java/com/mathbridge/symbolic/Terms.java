// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import com.mathbridge.Rational;
import com.mathbridge.symbolic.OperationTerm.Operator;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds arithmetic terms, folding exact numbers as it goes.
 * <p>
 * The reducing builders ({@link #add}, {@link #subtract}, {@link #multiply},
 * {@link #divide}, {@link #power}, {@link #negate}) flatten nested sums and
 * products and combine their numeric operands. {@link #product} and
 * {@link #powerOf} keep their operands exactly as given, so a factored form
 * such as <code>2^6*5^6</code> survives.
 */
public final class Terms
{
    /** Exponents beyond this are left symbolic rather than expanded. */
    private static final int MAX_FOLDED_EXPONENT = 1024;

    /** You no touchy. */
    private Terms() { }


    public static Term add(Term... terms)
    {
        return add(Arrays.asList(terms));
    }

    public static Term add(List<? extends Term> terms)
    {
        List<Term> out = new ArrayList<Term>();
        NumberTerm constant = NumberTerm.ZERO;
        for (Term t : flatten(Operator.ADD, terms))
        {
            if (t instanceof NumberTerm)
            {
                constant = constant.add((NumberTerm) t);
            }
            else
            {
                out.add(t);
            }
        }
        if (! constant.isZero() || ! constant.isExact())
        {
            out.add(constant);
        }
        return collapse(Operator.ADD, out, NumberTerm.ZERO);
    }

    public static Term subtract(Term left, Term right)
    {
        return add(left, negate(right));
    }

    public static Term negate(Term term)
    {
        if (term instanceof NumberTerm)
        {
            return ((NumberTerm) term).negate();
        }
        if (term instanceof OperationTerm
            && ((OperationTerm) term).getOperator() == Operator.NEGATE)
        {
            return ((OperationTerm) term).getOperand(0);
        }
        return new OperationTerm(Operator.NEGATE, term);
    }

    public static Term multiply(Term... terms)
    {
        return multiply(Arrays.asList(terms));
    }

    public static Term multiply(List<? extends Term> terms)
    {
        List<Term> out = new ArrayList<Term>();
        NumberTerm constant = NumberTerm.ONE;
        for (Term t : flatten(Operator.MULTIPLY, terms))
        {
            if (t instanceof NumberTerm)
            {
                constant = constant.multiply((NumberTerm) t);
            }
            else
            {
                out.add(t);
            }
        }
        if (constant.isZero() && constant.isExact())
        {
            return NumberTerm.ZERO;
        }
        if (! constant.isOne())
        {
            out.add(0, constant);
        }
        return collapse(Operator.MULTIPLY, out, NumberTerm.ONE);
    }

    public static Term divide(Term numerator, Term denominator)
    {
        if (numerator instanceof NumberTerm && denominator instanceof NumberTerm)
        {
            NumberTerm q = ((NumberTerm) numerator).divide((NumberTerm) denominator);
            if (q != null) return q;
        }
        else if (denominator instanceof NumberTerm
                 && ((NumberTerm) denominator).isOne())
        {
            return numerator;
        }
        return new OperationTerm(Operator.DIVIDE, numerator, denominator);
    }

    public static Term power(Term base, Term exponent)
    {
        if (base instanceof NumberTerm && exponent instanceof NumberTerm)
        {
            Rational b = ((NumberTerm) base).getExactValue();
            Rational e = ((NumberTerm) exponent).getExactValue();
            if (b != null && e != null && e.isInteger()
                && e.getNumerator().abs().compareTo(BigInteger.valueOf(MAX_FOLDED_EXPONENT)) <= 0
                && (b.signum() != 0 || e.signum() >= 0))
            {
                return NumberTerm.of(b.pow(e.getNumerator().intValue()));
            }
        }
        if (exponent instanceof NumberTerm && ((NumberTerm) exponent).isOne())
        {
            return base;
        }
        return new OperationTerm(Operator.POWER, base, exponent);
    }

    /**
     * Builds a product without folding or flattening its factors.
     */
    public static Term product(List<? extends Term> factors)
    {
        if (factors.isEmpty()) return NumberTerm.ONE;
        if (factors.size() == 1) return factors.get(0);
        return new OperationTerm(Operator.MULTIPLY, factors);
    }

    /**
     * Builds a power without folding.
     */
    public static Term powerOf(Term base, Term exponent)
    {
        return new OperationTerm(Operator.POWER, base, exponent);
    }


    private static List<Term> flatten(Operator op, List<? extends Term> terms)
    {
        List<Term> out = new ArrayList<Term>(terms.size());
        for (Term t : terms)
        {
            if (t instanceof OperationTerm && ((OperationTerm) t).getOperator() == op)
            {
                out.addAll(((OperationTerm) t).getOperands());
            }
            else
            {
                out.add(t);
            }
        }
        return out;
    }

    private static Term collapse(Operator op, List<Term> operands, Term identity)
    {
        if (operands.isEmpty()) return identity;
        if (operands.size() == 1) return operands.get(0);
        return new OperationTerm(op, operands);
    }
}
