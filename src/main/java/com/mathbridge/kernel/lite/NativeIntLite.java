// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeInt;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVisitor;

final class NativeIntLite
    extends NativeNodeLite
    implements NativeInt
{
    private final int myValue;

    NativeIntLite(int value)
    {
        myValue = value;
    }

    public int intValue()
    {
        return myValue;
    }

    public NativeType getType()
    {
        return NativeType.INT;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof NativeIntLite
            && ((NativeIntLite) other).myValue == myValue;
    }

    @Override
    public int hashCode()
    {
        return myValue;
    }
}
