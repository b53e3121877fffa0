// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

/**
 * A named mathematical constant. The only instances are {@link #PI} and
 * {@link #IMAGINARY_UNIT}.
 */
public final class ConstantTerm
    extends Term
{
    public static final ConstantTerm PI = new ConstantTerm("Pi", "pi");
    public static final ConstantTerm IMAGINARY_UNIT =
        new ConstantTerm("ImaginaryUnit", "i");

    private final String myName;
    private final String myNativeName;

    private ConstantTerm(String name, String nativeName)
    {
        myName = name;
        myNativeName = nativeName;
    }

    /**
     * Gets the canonical name of this constant, as used by MathJSON.
     */
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
        return myNativeName;
    }
}
