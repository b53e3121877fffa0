// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * Enumeration identifying the variants of the kernel's expression tree.
 *
 * @see NativeNode#getType()
 */
public enum NativeType
{
    /** Machine-width signed integer. */
    INT,
    /** IEEE-754 double. */
    DOUBLE,
    /** Arbitrary-precision integer held as sign and magnitude bytes. */
    BIGINT,
    /** Numerator and denominator pair. */
    FRACTION,
    /** Real and imaginary pair. */
    COMPLEX,
    /** Variable or named constant. */
    IDENTIFIER,
    /** Operator applied to its argument payload. */
    APPLICATION,
    /** Ordered sequence of nodes. */
    VECTOR
}
