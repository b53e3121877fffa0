// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

/**
 * A MathJSON string literal. Written as a JSON string wrapped in single
 * quotes, for example <code>"'hello'"</code>.
 */
public final class MathJsonString
    extends MathJsonExpr
{
    private final String myValue;

    private MathJsonString(String value)
    {
        myValue = value;
    }

    public static MathJsonString of(String value)
    {
        if (value == null) throw new NullPointerException("value must not be null");
        return new MathJsonString(value);
    }

    public String stringValue()
    {
        return myValue;
    }

    @Override
    public MathJsonType getType()
    {
        return MathJsonType.STRING;
    }

    @Override
    public <R> R accept(MathJsonVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof MathJsonString
            && ((MathJsonString) other).myValue.equals(myValue);
    }

    @Override
    public int hashCode()
    {
        return ~myValue.hashCode();
    }
}
