// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeApplication;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVector;
import com.mathbridge.kernel.NativeVisitor;
import java.util.Collections;
import java.util.List;

final class NativeApplicationLite
    extends NativeNodeLite
    implements NativeApplication
{
    private final String     myOperator;
    private final NativeNode myFeuille;

    NativeApplicationLite(String operator, NativeNode feuille)
    {
        myOperator = operator;
        myFeuille = feuille;
    }

    public String getOperator()
    {
        return myOperator;
    }

    public NativeNode getFeuille()
    {
        return myFeuille;
    }

    public List<NativeNode> getArguments()
    {
        if (myFeuille.getType() == NativeType.VECTOR)
        {
            return ((NativeVector) myFeuille).getElements();
        }
        return Collections.singletonList(myFeuille);
    }

    public NativeType getType()
    {
        return NativeType.APPLICATION;
    }

    public <R> R accept(NativeVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof NativeApplicationLite)) return false;
        NativeApplicationLite that = (NativeApplicationLite) other;
        return myOperator.equals(that.myOperator) && myFeuille.equals(that.myFeuille);
    }

    @Override
    public int hashCode()
    {
        return 31 * myOperator.hashCode() + myFeuille.hashCode();
    }
}
