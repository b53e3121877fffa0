// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.convert;

/**
 * How to rebuild a native node for a MathJSON operator tag.
 * <p>
 * A recipe is one of three shapes, named by {@link #getKind()}: a plain
 * operator application, a dedicated structural node, or a relational
 * operator, which the kernel can only build from text.
 */
public final class NativeRecipe
{
    /**
     * The shape of a {@link NativeRecipe}.
     */
    public enum Kind
    {
        /** Build an application of {@link NativeRecipe#getOperator()}. */
        OPERATOR,
        /** Build the node named by {@link NativeRecipe#getStructure()}. */
        STRUCTURAL,
        /** Re-evaluate <code>(lhs)op(rhs)</code> through the kernel. */
        RELATIONAL
    }

    /**
     * The native nodes that have dedicated constructors.
     */
    public enum Structure
    {
        /** Numerator and denominator; exactly two arguments. */
        FRACTION(2),
        /** Real and imaginary parts; exactly two arguments. */
        COMPLEX(2),
        /** Any number of elements. */
        VECTOR(-1);

        private final int myArity;

        private Structure(int arity)
        {
            myArity = arity;
        }

        /**
         * Indicates whether this structure can be built from the given number
         * of arguments.
         */
        public boolean accepts(int argumentCount)
        {
            return myArity < 0 || myArity == argumentCount;
        }
    }

    private final Kind      myKind;
    private final String    myOperator;
    private final Structure myStructure;

    private NativeRecipe(Kind kind, String operator, Structure structure)
    {
        myKind = kind;
        myOperator = operator;
        myStructure = structure;
    }

    public static NativeRecipe operator(String operator)
    {
        return new NativeRecipe(Kind.OPERATOR, operator, null);
    }

    public static NativeRecipe structural(Structure structure)
    {
        return new NativeRecipe(Kind.STRUCTURAL, null, structure);
    }

    public static NativeRecipe relational(String symbol)
    {
        return new NativeRecipe(Kind.RELATIONAL, symbol, null);
    }

    public Kind getKind()
    {
        return myKind;
    }

    /**
     * Gets the native operator spelling of an {@link Kind#OPERATOR} or
     * {@link Kind#RELATIONAL} recipe.
     *
     * @return null for a structural recipe.
     */
    public String getOperator()
    {
        return myOperator;
    }

    /**
     * @return null unless this is a {@link Kind#STRUCTURAL} recipe.
     */
    public Structure getStructure()
    {
        return myStructure;
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof NativeRecipe)) return false;
        NativeRecipe that = (NativeRecipe) other;
        return myKind == that.myKind
            && myStructure == that.myStructure
            && (myOperator == null ? that.myOperator == null
                                   : myOperator.equals(that.myOperator));
    }

    @Override
    public int hashCode()
    {
        int h = myKind.hashCode();
        if (myOperator != null) h = 31 * h + myOperator.hashCode();
        if (myStructure != null) h = 31 * h + myStructure.hashCode();
        return h;
    }

    @Override
    public String toString()
    {
        switch (myKind)
        {
            case STRUCTURAL: return "structural(" + myStructure + ")";
            case RELATIONAL: return "relational(" + myOperator + ")";
            default:         return "operator(" + myOperator + ")";
        }
    }
}
