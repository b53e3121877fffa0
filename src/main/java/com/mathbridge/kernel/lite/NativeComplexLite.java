// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeComplex;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVisitor;

final class NativeComplexLite
    extends NativeNodeLite
    implements NativeComplex
{
    private final NativeNode myReal;
    private final NativeNode myImaginary;

    NativeComplexLite(NativeNode real, NativeNode imaginary)
    {
        myReal = real;
        myImaginary = imaginary;
    }

    public NativeNode getReal()
    {
        return myReal;
    }

    public NativeNode getImaginary()
    {
        return myImaginary;
    }

    public NativeType getType()
    {
        return NativeType.COMPLEX;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof NativeComplexLite)) return false;
        NativeComplexLite that = (NativeComplexLite) other;
        return myReal.equals(that.myReal) && myImaginary.equals(that.myImaginary);
    }

    @Override
    public int hashCode()
    {
        return 37 * myReal.hashCode() + myImaginary.hashCode();
    }
}
