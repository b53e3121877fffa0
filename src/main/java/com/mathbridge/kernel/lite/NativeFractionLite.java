// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeFraction;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVisitor;

final class NativeFractionLite
    extends NativeNodeLite
    implements NativeFraction
{
    private final NativeNode myNumerator;
    private final NativeNode myDenominator;

    NativeFractionLite(NativeNode numerator, NativeNode denominator)
    {
        myNumerator = numerator;
        myDenominator = denominator;
    }

    public NativeNode getNumerator()
    {
        return myNumerator;
    }

    public NativeNode getDenominator()
    {
        return myDenominator;
    }

    public NativeType getType()
    {
        return NativeType.FRACTION;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof NativeFractionLite)) return false;
        NativeFractionLite that = (NativeFractionLite) other;
        return myNumerator.equals(that.myNumerator)
            && myDenominator.equals(that.myDenominator);
    }

    @Override
    public int hashCode()
    {
        return 31 * myNumerator.hashCode() + myDenominator.hashCode();
    }
}
