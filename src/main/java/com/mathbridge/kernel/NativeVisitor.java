// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * A Visitor for the native expression tree.
 * There is exactly one method per {@link NativeType}.
 *
 * @param <R> the result type of each visit.
 */
public interface NativeVisitor<R>
{
    public R visit(NativeInt node);

    public R visit(NativeDouble node);

    public R visit(NativeBigInt node);

    public R visit(NativeFraction node);

    public R visit(NativeComplex node);

    public R visit(NativeIdentifier node);

    public R visit(NativeApplication node);

    public R visit(NativeVector node);
}
