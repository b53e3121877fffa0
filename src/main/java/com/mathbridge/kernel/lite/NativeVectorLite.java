// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVector;
import com.mathbridge.kernel.NativeVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class NativeVectorLite
    extends NativeNodeLite
    implements NativeVector
{
    private final List<NativeNode> myElements;

    NativeVectorLite(List<? extends NativeNode> elements)
    {
        myElements = Collections.unmodifiableList(new ArrayList<NativeNode>(elements));
    }

    public List<NativeNode> getElements()
    {
        return myElements;
    }

    public int size()
    {
        return myElements.size();
    }

    public NativeNode get(int index)
    {
        return myElements.get(index);
    }

    public NativeType getType()
    {
        return NativeType.VECTOR;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof NativeVectorLite
            && ((NativeVectorLite) other).myElements.equals(myElements);
    }

    @Override
    public int hashCode()
    {
        return myElements.hashCode();
    }
}
