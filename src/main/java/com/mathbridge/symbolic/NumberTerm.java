// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import com.mathbridge.Rational;
import java.math.BigInteger;

/**
 * A numeric term: either an exact {@link Rational} or a double.
 */
public final class NumberTerm
    extends Term
{
    public static final NumberTerm ZERO = new NumberTerm(Rational.ZERO, 0);
    public static final NumberTerm ONE  = new NumberTerm(Rational.ONE, 0);

    /** Null when the value is inexact. */
    private final Rational myExact;
    private final double   myDouble;

    private NumberTerm(Rational exact, double d)
    {
        myExact = exact;
        myDouble = d;
    }

    public static NumberTerm of(long value)
    {
        return of(Rational.valueOf(BigInteger.valueOf(value)));
    }

    public static NumberTerm of(BigInteger value)
    {
        return of(Rational.valueOf(value));
    }

    public static NumberTerm of(Rational value)
    {
        if (value == null) throw new NullPointerException("value must not be null");
        return new NumberTerm(value, 0);
    }

    public static NumberTerm of(double value)
    {
        return new NumberTerm(null, value);
    }


    public boolean isExact()
    {
        return myExact != null;
    }

    /**
     * @return null if this number is inexact.
     */
    public Rational getExactValue()
    {
        return myExact;
    }

    public double doubleValue()
    {
        return myExact != null ? myExact.doubleValue() : myDouble;
    }

    public boolean isZero()
    {
        return myExact != null ? myExact.signum() == 0 : myDouble == 0;
    }

    public boolean isOne()
    {
        return myExact != null && myExact.equals(Rational.ONE);
    }

    boolean isNegative()
    {
        return myExact != null ? myExact.signum() < 0 : myDouble < 0;
    }


    NumberTerm negate()
    {
        return myExact != null ? of(myExact.negate()) : of(- myDouble);
    }

    NumberTerm add(NumberTerm that)
    {
        if (myExact != null && that.myExact != null)
        {
            return of(myExact.add(that.myExact));
        }
        return of(doubleValue() + that.doubleValue());
    }

    NumberTerm multiply(NumberTerm that)
    {
        if (myExact != null && that.myExact != null)
        {
            return of(myExact.multiply(that.myExact));
        }
        return of(doubleValue() * that.doubleValue());
    }

    /**
     * @return null when the quotient is not representable, which is only the
     * case for an exact division by zero.
     */
    NumberTerm divide(NumberTerm that)
    {
        if (myExact != null && that.myExact != null)
        {
            if (that.myExact.signum() == 0) return null;
            return of(myExact.divide(that.myExact));
        }
        return of(doubleValue() / that.doubleValue());
    }


    @Override
    int precedence()
    {
        if (isNegative()) return PREC_UNARY;
        if (myExact != null && ! myExact.isInteger()) return PREC_MULTIPLY;
        return PREC_ATOM;
    }

    @Override
    public String toString()
    {
        if (myExact != null) return myExact.toString();
        if (Double.isNaN(myDouble)) return "undef";
        if (myDouble == Double.POSITIVE_INFINITY) return "inf";
        if (myDouble == Double.NEGATIVE_INFINITY) return "-inf";
        return Double.toString(myDouble);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof NumberTerm)) return false;
        NumberTerm that = (NumberTerm) other;
        if (myExact != null) return myExact.equals(that.myExact);
        return that.myExact == null
            && Double.compare(myDouble, that.myDouble) == 0;
    }

    @Override
    public int hashCode()
    {
        return myExact != null ? myExact.hashCode() : Double.hashCode(myDouble);
    }
}
