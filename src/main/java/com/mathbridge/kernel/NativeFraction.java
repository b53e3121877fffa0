// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * A fraction node. Numerator and denominator are arbitrary nodes, not
 * necessarily integers.
 */
public interface NativeFraction
    extends NativeNode
{
    public NativeNode getNumerator();

    public NativeNode getDenominator();
}
