// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeApplication;
import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeComplex;
import com.mathbridge.kernel.NativeDouble;
import com.mathbridge.kernel.NativeFactory;
import com.mathbridge.kernel.NativeFraction;
import com.mathbridge.kernel.NativeIdentifier;
import com.mathbridge.kernel.NativeInt;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVector;
import java.util.Arrays;
import java.util.List;

/**
 * Creates in-memory native nodes. Instances hold no state and are safe for
 * use by multiple threads.
 */
public class LiteNativeFactory
    implements NativeFactory
{
    public NativeInt newInt(int value)
    {
        return new NativeIntLite(value);
    }

    public NativeDouble newDouble(double value)
    {
        return new NativeDoubleLite(value);
    }

    public NativeBigInt newBigInt(byte[] magnitude, int sign)
    {
        checkNotNull(magnitude, "magnitude");
        return new NativeBigIntLite(magnitude, sign);
    }

    public NativeFraction newFraction(NativeNode numerator, NativeNode denominator)
    {
        checkNotNull(numerator, "numerator");
        checkNotNull(denominator, "denominator");
        return new NativeFractionLite(numerator, denominator);
    }

    public NativeComplex newComplex(NativeNode real, NativeNode imaginary)
    {
        checkNotNull(real, "real");
        checkNotNull(imaginary, "imaginary");
        return new NativeComplexLite(real, imaginary);
    }

    public NativeIdentifier newIdentifier(String name)
    {
        checkNotNull(name, "name");
        if (name.isEmpty())
        {
            throw new IllegalArgumentException("identifier name must not be empty");
        }
        return new NativeIdentifierLite(name);
    }

    public NativeApplication newApplication(String operator,
                                            List<? extends NativeNode> arguments)
    {
        checkNotNull(operator, "operator");
        checkNotNull(arguments, "arguments");
        NativeNode feuille;
        if (arguments.size() == 1
            && arguments.get(0).getType() != NativeType.VECTOR)
        {
            feuille = arguments.get(0);
        }
        else
        {
            feuille = newVector(arguments);
        }
        return new NativeApplicationLite(operator, feuille);
    }

    public NativeApplication newApplication(String operator, NativeNode... arguments)
    {
        return newApplication(operator, Arrays.asList(arguments));
    }

    public NativeVector newVector(List<? extends NativeNode> elements)
    {
        checkNotNull(elements, "elements");
        for (NativeNode element : elements)
        {
            checkNotNull(element, "element");
        }
        return new NativeVectorLite(elements);
    }

    public NativeVector newVector(NativeNode... elements)
    {
        return newVector(Arrays.asList(elements));
    }


    private static void checkNotNull(Object value, String what)
    {
        if (value == null)
        {
            throw new NullPointerException(what + " must not be null");
        }
    }
}
