// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A MathJSON function expression: an operator tag applied to an ordered list
 * of arguments, written as <code>["Add", "x", 1]</code>.
 */
public final class MathJsonFunction
    extends MathJsonExpr
{
    private final String             myOperator;
    private final List<MathJsonExpr> myArguments;

    private MathJsonFunction(String operator, List<MathJsonExpr> arguments)
    {
        myOperator = operator;
        myArguments = arguments;
    }

    /**
     * @throws IllegalArgumentException if {@code operator} is empty.
     */
    public static MathJsonFunction of(String operator,
                                      List<? extends MathJsonExpr> arguments)
    {
        if (operator == null) throw new NullPointerException("operator must not be null");
        if (operator.isEmpty())
        {
            throw new IllegalArgumentException("operator must not be empty");
        }
        List<MathJsonExpr> copy = new ArrayList<MathJsonExpr>(arguments);
        for (MathJsonExpr arg : copy)
        {
            if (arg == null) throw new NullPointerException("argument must not be null");
        }
        return new MathJsonFunction(operator, Collections.unmodifiableList(copy));
    }

    public static MathJsonFunction of(String operator, MathJsonExpr... arguments)
    {
        return of(operator, Arrays.asList(arguments));
    }

    public String getOperator()
    {
        return myOperator;
    }

    /**
     * @return an unmodifiable list; never null.
     */
    public List<MathJsonExpr> getArguments()
    {
        return myArguments;
    }

    public int size()
    {
        return myArguments.size();
    }

    public MathJsonExpr get(int index)
    {
        return myArguments.get(index);
    }

    /**
     * Indicates whether this expression has the given operator and number of
     * arguments.
     */
    public boolean is(String operator, int arity)
    {
        return myOperator.equals(operator) && myArguments.size() == arity;
    }

    @Override
    public MathJsonType getType()
    {
        return MathJsonType.FUNCTION;
    }

    @Override
    public <R> R accept(MathJsonVisitor<R> visitor)
    {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof MathJsonFunction)) return false;
        MathJsonFunction that = (MathJsonFunction) other;
        return myOperator.equals(that.myOperator)
            && myArguments.equals(that.myArguments);
    }

    @Override
    public int hashCode()
    {
        return 31 * myOperator.hashCode() + myArguments.hashCode();
    }
}
