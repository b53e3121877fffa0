// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

/**
 * Base class of the MathJSON interchange tree.
 * <p>
 * Expressions are immutable once built and are safe for use by multiple
 * threads. Equality is structural. {@link #toString()} returns compact
 * MathJSON text.
 */
public abstract class MathJsonExpr
{
    MathJsonExpr() { }

    /**
     * Gets the variant of this expression.
     */
    public abstract MathJsonType getType();

    /**
     * Entry point for visitor pattern.
     *
     * @return the result of the visit method called on {@code visitor}.
     */
    public abstract <R> R accept(MathJsonVisitor<R> visitor);

    @Override
    public String toString()
    {
        return MathJsonCodec.toJson(this);
    }
}
