// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeDouble;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVisitor;

final class NativeDoubleLite
    extends NativeNodeLite
    implements NativeDouble
{
    private final double myValue;

    NativeDoubleLite(double value)
    {
        myValue = value;
    }

    public double doubleValue()
    {
        return myValue;
    }

    public NativeType getType()
    {
        return NativeType.DOUBLE;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof NativeDoubleLite
            && Double.compare(((NativeDoubleLite) other).myValue, myValue) == 0;
    }

    @Override
    public int hashCode()
    {
        return Double.hashCode(myValue);
    }
}
