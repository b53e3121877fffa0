// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.util;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Converts between {@link BigInteger} and the sign-magnitude form used by the
 * kernel's arbitrary-precision integers.
 * <p>
 * Only byte-level operations are used; no value passes through a fixed-width
 * integer type. Zero is always an empty magnitude with sign zero.
 */
public final class BigIntegerTranscoder
{
    private static final byte[] EMPTY_MAGNITUDE = new byte[0];

    /** You no touchy. */
    private BigIntegerTranscoder() { }


    /**
     * A big-endian magnitude paired with a separate sign.
     * Instances are immutable; accessors return copies.
     */
    public static final class SignedMagnitude
    {
        private final byte[] myMagnitude;
        private final int    mySign;

        SignedMagnitude(byte[] magnitude, int sign)
        {
            myMagnitude = magnitude;
            mySign = sign;
        }

        public byte[] getMagnitude()
        {
            return myMagnitude.clone();
        }

        public int getSign()
        {
            return mySign;
        }

        @Override
        public boolean equals(Object other)
        {
            if (this == other) return true;
            if (! (other instanceof SignedMagnitude)) return false;
            SignedMagnitude that = (SignedMagnitude) other;
            return mySign == that.mySign
                && Arrays.equals(myMagnitude, that.myMagnitude);
        }

        @Override
        public int hashCode()
        {
            return 31 * mySign + Arrays.hashCode(myMagnitude);
        }

        @Override
        public String toString()
        {
            return "SignedMagnitude(sign=" + mySign
                + ", bytes=" + myMagnitude.length + ")";
        }
    }


    /**
     * Splits a value into its magnitude bytes and sign.
     *
     * @param value must not be null.
     * @return zero yields an empty magnitude with sign zero.
     */
    public static SignedMagnitude toMagnitude(BigInteger value)
    {
        int signum = value.signum();
        if (signum == 0)
        {
            return new SignedMagnitude(EMPTY_MAGNITUDE, 0);
        }
        return new SignedMagnitude(stripLeadingZeros(value.abs().toByteArray()),
                                   signum);
    }

    /**
     * Rebuilds a value from big-endian magnitude bytes and a sign.
     * The magnitude is reconstructed first; negation is a separate step.
     *
     * @param magnitude must not be null; leading zero bytes are ignored.
     * @param sign -1, 0 or 1.
     *
     * @throws IllegalArgumentException if the sign is out of range, or if it
     * disagrees with the magnitude.
     */
    public static BigInteger fromMagnitude(byte[] magnitude, int sign)
    {
        checkConsistent(magnitude, sign);
        if (sign == 0)
        {
            return BigInteger.ZERO;
        }
        BigInteger value = new BigInteger(1, magnitude);
        if (sign < 0)
        {
            value = value.negate();
        }
        return value;
    }

    /**
     * Validates a sign-magnitude pair and returns its canonical magnitude,
     * without leading zero bytes.
     *
     * @throws IllegalArgumentException if the pair is inconsistent.
     */
    public static byte[] canonicalMagnitude(byte[] magnitude, int sign)
    {
        checkConsistent(magnitude, sign);
        return stripLeadingZeros(magnitude);
    }


    private static void checkConsistent(byte[] magnitude, int sign)
    {
        if (sign < -1 || sign > 1)
        {
            throw new IllegalArgumentException("sign must be -1, 0 or 1: " + sign);
        }
        boolean zeroMagnitude = isZero(magnitude);
        if (sign == 0 && ! zeroMagnitude)
        {
            throw new IllegalArgumentException("sign 0 requires an empty magnitude");
        }
        if (sign != 0 && zeroMagnitude)
        {
            throw new IllegalArgumentException("sign " + sign
                                               + " requires a non-zero magnitude");
        }
    }

    private static boolean isZero(byte[] magnitude)
    {
        for (byte b : magnitude)
        {
            if (b != 0) return false;
        }
        return true;
    }

    private static byte[] stripLeadingZeros(byte[] bits)
    {
        // BigInteger pads positive values with a zero byte when the top bit is set.
        int offset = 0;
        while (offset < bits.length && bits[offset] == 0)
        {
            offset++;
        }
        if (offset == 0)
        {
            return bits.clone();
        }
        return Arrays.copyOfRange(bits, offset, bits.length);
    }
}
