// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * An arbitrary-precision integer node, held in sign-magnitude form.
 * <p>
 * The magnitude is big-endian and carries no leading zero bytes. A sign of
 * zero always comes with an empty magnitude.
 */
public interface NativeBigInt
    extends NativeNode
{
    /**
     * Gets a copy of the big-endian magnitude bytes.
     *
     * @return the magnitude; empty when {@link #getSign()} is zero.
     */
    public byte[] getMagnitude();

    /**
     * Gets the sign of this integer.
     *
     * @return -1, 0 or 1.
     */
    public int getSign();
}
