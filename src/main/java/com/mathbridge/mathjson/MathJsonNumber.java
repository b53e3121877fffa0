// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

import com.mathbridge.Rational;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A MathJSON number. Each instance holds exactly one numeric representation,
 * identified by {@link #getKind()}; no conversion between kinds is ever
 * performed implicitly.
 */
public final class MathJsonNumber
    extends MathJsonExpr
{
    /**
     * The numeric representation held by a {@link MathJsonNumber}.
     */
    public enum Kind
    {
        /** A Java <code>long</code>. */
        INT64,
        /** A Java <code>double</code>, possibly non-finite. */
        FLOAT64,
        /** An arbitrary-precision integer. */
        BIG_INTEGER,
        /** An arbitrary-precision decimal. */
        BIG_DECIMAL,
        /** An exact {@link Rational}. */
        RATIONAL
    }

    private final Kind   myKind;
    private final long   myLong;
    private final double myDouble;
    private final Object myBigValue;

    private MathJsonNumber(Kind kind, long l, double d, Object big)
    {
        myKind = kind;
        myLong = l;
        myDouble = d;
        myBigValue = big;
    }

    public static MathJsonNumber of(long value)
    {
        return new MathJsonNumber(Kind.INT64, value, 0, null);
    }

    public static MathJsonNumber of(double value)
    {
        return new MathJsonNumber(Kind.FLOAT64, 0, value, null);
    }

    public static MathJsonNumber of(BigInteger value)
    {
        if (value == null) throw new NullPointerException("value must not be null");
        return new MathJsonNumber(Kind.BIG_INTEGER, 0, 0, value);
    }

    public static MathJsonNumber of(BigDecimal value)
    {
        if (value == null) throw new NullPointerException("value must not be null");
        return new MathJsonNumber(Kind.BIG_DECIMAL, 0, 0, value);
    }

    public static MathJsonNumber of(Rational value)
    {
        if (value == null) throw new NullPointerException("value must not be null");
        return new MathJsonNumber(Kind.RATIONAL, 0, 0, value);
    }


    public Kind getKind()
    {
        return myKind;
    }

    /**
     * @throws IllegalStateException unless the kind is {@link Kind#INT64}.
     */
    public long longValue()
    {
        checkKind(Kind.INT64);
        return myLong;
    }

    /**
     * @throws IllegalStateException unless the kind is {@link Kind#FLOAT64}.
     */
    public double doubleValue()
    {
        checkKind(Kind.FLOAT64);
        return myDouble;
    }

    /**
     * @throws IllegalStateException unless the kind is
     * {@link Kind#BIG_INTEGER}.
     */
    public BigInteger bigIntegerValue()
    {
        checkKind(Kind.BIG_INTEGER);
        return (BigInteger) myBigValue;
    }

    /**
     * @throws IllegalStateException unless the kind is
     * {@link Kind#BIG_DECIMAL}.
     */
    public BigDecimal bigDecimalValue()
    {
        checkKind(Kind.BIG_DECIMAL);
        return (BigDecimal) myBigValue;
    }

    /**
     * @throws IllegalStateException unless the kind is {@link Kind#RATIONAL}.
     */
    public Rational rationalValue()
    {
        checkKind(Kind.RATIONAL);
        return (Rational) myBigValue;
    }

    /**
     * Returns the exact integer value of an {@link Kind#INT64} or
     * {@link Kind#BIG_INTEGER} number.
     *
     * @return null for the other kinds.
     */
    public BigInteger toBigInteger()
    {
        switch (myKind)
        {
            case INT64:       return BigInteger.valueOf(myLong);
            case BIG_INTEGER: return (BigInteger) myBigValue;
            default:          return null;
        }
    }

    /**
     * Indicates whether this number is an integer kind equal to the given
     * value.
     */
    public boolean isInteger(long value)
    {
        BigInteger exact = toBigInteger();
        return exact != null && exact.equals(BigInteger.valueOf(value));
    }

    private void checkKind(Kind expected)
    {
        if (myKind != expected)
        {
            throw new IllegalStateException("number is " + myKind + ", not " + expected);
        }
    }


    @Override
    public MathJsonType getType()
    {
        return MathJsonType.NUMBER;
    }

    @Override
    public <R> R accept(MathJsonVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof MathJsonNumber)) return false;
        MathJsonNumber that = (MathJsonNumber) other;
        if (myKind != that.myKind) return false;
        switch (myKind)
        {
            case INT64:   return myLong == that.myLong;
            case FLOAT64: return Double.compare(myDouble, that.myDouble) == 0;
            default:      return myBigValue.equals(that.myBigValue);
        }
    }

    @Override
    public int hashCode()
    {
        switch (myKind)
        {
            case INT64:   return Long.hashCode(myLong);
            case FLOAT64: return Double.hashCode(myDouble);
            default:      return myBigValue.hashCode();
        }
    }
}
