// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

/**
 * A MathJSON symbol: a variable or a canonical constant such as
 * <code>Pi</code> or <code>ExponentialE</code>.
 */
public final class MathJsonSymbol
    extends MathJsonExpr
{
    private final String myName;

    private MathJsonSymbol(String name)
    {
        myName = name;
    }

    /**
     * @throws IllegalArgumentException if {@code name} is empty.
     */
    public static MathJsonSymbol of(String name)
    {
        if (name == null) throw new NullPointerException("name must not be null");
        if (name.isEmpty())
        {
            throw new IllegalArgumentException("symbol name must not be empty");
        }
        return new MathJsonSymbol(name);
    }

    public String getName()
    {
        return myName;
    }

    @Override
    public MathJsonType getType()
    {
        return MathJsonType.SYMBOL;
    }

    @Override
    public <R> R accept(MathJsonVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof MathJsonSymbol
            && ((MathJsonSymbol) other).myName.equals(myName);
    }

    @Override
    public int hashCode()
    {
        return myName.hashCode();
    }
}
