// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

/**
 * A free variable.
 * <p>
 * Within one conversion every occurrence of a name resolves to the same
 * instance, so identity comparison is meaningful there; across conversions
 * variables compare by name.
 */
public final class VariableTerm
    extends Term
{
    private final String myName;

    public VariableTerm(String name)
    {
        if (name == null) throw new NullPointerException("name must not be null");
        if (name.isEmpty())
        {
            throw new IllegalArgumentException("name must not be empty");
        }
        myName = name;
    }

    public String getName()
    {
        return myName;
    }

    @Override
    int precedence()
    {
        return PREC_ATOM;
    }

    @Override
    public String toString()
    {
        return myName;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof VariableTerm
            && myName.equals(((VariableTerm) other).myName);
    }

    @Override
    public int hashCode()
    {
        return myName.hashCode();
    }
}
