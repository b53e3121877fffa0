// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

/**
 * A Visitor for the MathJSON expression hierarchy.
 *
 * @param <R> the result type of each visit.
 */
public interface MathJsonVisitor<R>
{
    public R visit(MathJsonNumber expr);

    public R visit(MathJsonSymbol expr);

    public R visit(MathJsonString expr);

    public R visit(MathJsonFunction expr);
}
