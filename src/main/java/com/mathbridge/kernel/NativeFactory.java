// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

import java.util.List;

/**
 * The factory for all native tree nodes.
 * <p>
 * Implementations must be safe for use by multiple threads.
 */
public interface NativeFactory
{
    public NativeInt newInt(int value);

    public NativeDouble newDouble(double value);

    /**
     * Constructs an arbitrary-precision integer from sign and magnitude.
     *
     * @param magnitude big-endian magnitude bytes; leading zero bytes are
     * ignored. Must be empty (or all zeros) when {@code sign} is zero.
     * @param sign -1, 0 or 1.
     *
     * @throws IllegalArgumentException if the sign is out of range or
     * disagrees with the magnitude.
     */
    public NativeBigInt newBigInt(byte[] magnitude, int sign);

    public NativeFraction newFraction(NativeNode numerator, NativeNode denominator);

    public NativeComplex newComplex(NativeNode real, NativeNode imaginary);

    public NativeIdentifier newIdentifier(String name);

    /**
     * Constructs an application without evaluating it.
     * A single argument that is not itself a vector becomes the feuille
     * directly; any other argument list is wrapped in a vector feuille.
     *
     * @param operator the operator name.
     * @param arguments the arguments, in order.
     */
    public NativeApplication newApplication(String operator,
                                            List<? extends NativeNode> arguments);

    public NativeApplication newApplication(String operator, NativeNode... arguments);

    public NativeVector newVector(List<? extends NativeNode> elements);

    public NativeVector newVector(NativeNode... elements);
}
