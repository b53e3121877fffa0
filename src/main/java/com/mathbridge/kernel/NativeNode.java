// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * Base type for all nodes of the kernel's native expression tree.
 * <p>
 * The tree is a closed tagged union: every node implements exactly one of the
 * variant interfaces named by {@link NativeType}. Code that needs to handle
 * every variant should do so through {@link #accept(NativeVisitor)} rather than
 * switching on {@link #getType()}, so that a new variant fails to compile
 * instead of falling through to a default.
 * <p>
 * Nodes are immutable once created by a {@link NativeFactory}. Converters read
 * and construct them but never mutate them in place.
 */
public interface NativeNode
{
    /**
     * Gets the variant tag of this node.
     *
     * @return the type; never null.
     */
    public NativeType getType();

    /**
     * Entry point for visitor pattern.  Implementations of this method by
     * concrete classes will simply call the appropriate <code>visit</code>
     * method on the <code>visitor</code>.
     *
     * @param visitor will have one of its <code>visit</code> methods called.
     * @return the value returned by the visit method.
     */
    public <R> R accept(NativeVisitor<R> visitor);
}
