// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeIdentifier;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVisitor;

final class NativeIdentifierLite
    extends NativeNodeLite
    implements NativeIdentifier
{
    private final String myName;

    NativeIdentifierLite(String name)
    {
        myName = name;
    }

    public String getName()
    {
        return myName;
    }

    public NativeType getType()
    {
        return NativeType.IDENTIFIER;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof NativeIdentifierLite
            && ((NativeIdentifierLite) other).myName.equals(myName);
    }

    @Override
    public int hashCode()
    {
        return myName.hashCode();
    }
}
