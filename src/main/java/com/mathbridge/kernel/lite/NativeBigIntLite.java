// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVisitor;
import com.mathbridge.util.BigIntegerTranscoder;
import java.util.Arrays;

final class NativeBigIntLite
    extends NativeNodeLite
    implements NativeBigInt
{
    private final byte[] myMagnitude;
    private final int    mySign;

    /**
     * @throws IllegalArgumentException if the pair is inconsistent.
     */
    NativeBigIntLite(byte[] magnitude, int sign)
    {
        myMagnitude = BigIntegerTranscoder.canonicalMagnitude(magnitude, sign);
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

    public NativeType getType()
    {
        return NativeType.BIGINT;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof NativeBigIntLite)) return false;
        NativeBigIntLite that = (NativeBigIntLite) other;
        return mySign == that.mySign && Arrays.equals(myMagnitude, that.myMagnitude);
    }

    @Override
    public int hashCode()
    {
        return 31 * mySign + Arrays.hashCode(myMagnitude);
    }
}
