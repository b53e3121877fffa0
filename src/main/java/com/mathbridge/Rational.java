// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * An exact rational number with arbitrary-precision numerator and
 * denominator.
 * <p>
 * Instances are always normalized: the numerator and denominator share no
 * common factor and the denominator is strictly positive. Zero is
 * represented as {@code 0/1}.
 * <p>
 * Instances of this class are immutable and safe for use by multiple threads.
 */
public final class Rational
    extends Number
    implements Comparable<Rational>
{
    private static final long serialVersionUID = 1L;

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE  = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational ONE_HALF =
        new Rational(BigInteger.ONE, BigInteger.valueOf(2));

    private final BigInteger myNumerator;
    private final BigInteger myDenominator;

    private Rational(BigInteger numerator, BigInteger denominator)
    {
        myNumerator = numerator;
        myDenominator = denominator;
    }

    /**
     * Returns a normalized rational with the given numerator and denominator.
     *
     * @throws ArithmeticException if {@code denominator} is zero.
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator)
    {
        if (numerator == null || denominator == null)
        {
            throw new NullPointerException("numerator and denominator must be non-null");
        }
        if (denominator.signum() == 0)
        {
            throw new ArithmeticException("zero denominator");
        }
        if (numerator.signum() == 0)
        {
            return ZERO;
        }
        if (denominator.signum() < 0)
        {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (! gcd.equals(BigInteger.ONE))
        {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return new Rational(numerator, denominator);
    }

    public static Rational valueOf(long numerator, long denominator)
    {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger integer)
    {
        return valueOf(integer, BigInteger.ONE);
    }

    public BigInteger getNumerator()
    {
        return myNumerator;
    }

    public BigInteger getDenominator()
    {
        return myDenominator;
    }

    /**
     * Indicates whether this value has a denominator of one.
     */
    public boolean isInteger()
    {
        return myDenominator.equals(BigInteger.ONE);
    }

    public int signum()
    {
        return myNumerator.signum();
    }

    public Rational negate()
    {
        return new Rational(myNumerator.negate(), myDenominator);
    }

    public Rational add(Rational that)
    {
        return valueOf(myNumerator.multiply(that.myDenominator)
                           .add(that.myNumerator.multiply(myDenominator)),
                       myDenominator.multiply(that.myDenominator));
    }

    public Rational subtract(Rational that)
    {
        return add(that.negate());
    }

    public Rational multiply(Rational that)
    {
        return valueOf(myNumerator.multiply(that.myNumerator),
                       myDenominator.multiply(that.myDenominator));
    }

    /**
     * @throws ArithmeticException if {@code that} is zero.
     */
    public Rational divide(Rational that)
    {
        return valueOf(myNumerator.multiply(that.myDenominator),
                       myDenominator.multiply(that.myNumerator));
    }

    /**
     * Raises this value to a non-negative or negative integer power.
     *
     * @throws ArithmeticException if this is zero and {@code exponent} is
     * negative.
     */
    public Rational pow(int exponent)
    {
        if (exponent >= 0)
        {
            return new Rational(myNumerator.pow(exponent),
                                myDenominator.pow(exponent));
        }
        return valueOf(myDenominator.pow(-exponent), myNumerator.pow(-exponent));
    }


    //=========================================================================
    // Number

    @Override
    public int intValue()
    {
        return (int) longValue();
    }

    @Override
    public long longValue()
    {
        return myNumerator.divide(myDenominator).longValue();
    }

    @Override
    public float floatValue()
    {
        return (float) doubleValue();
    }

    @Override
    public double doubleValue()
    {
        if (isInteger())
        {
            return myNumerator.doubleValue();
        }
        return new BigDecimal(myNumerator)
            .divide(new BigDecimal(myDenominator), MathContext.DECIMAL64)
            .doubleValue();
    }


    //=========================================================================

    public int compareTo(Rational that)
    {
        return myNumerator.multiply(that.myDenominator)
            .compareTo(that.myNumerator.multiply(myDenominator));
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (! (other instanceof Rational)) return false;
        Rational that = (Rational) other;
        return myNumerator.equals(that.myNumerator)
            && myDenominator.equals(that.myDenominator);
    }

    @Override
    public int hashCode()
    {
        return 31 * myNumerator.hashCode() + myDenominator.hashCode();
    }

    /**
     * Returns {@code n/d}, or just {@code n} when the denominator is one.
     */
    @Override
    public String toString()
    {
        if (isInteger())
        {
            return myNumerator.toString();
        }
        return myNumerator + "/" + myDenominator;
    }
}
