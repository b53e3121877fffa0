// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * The kernel's textual entry points.
 * <p>
 * Converters only depend on this capability for their fallback paths, so it
 * can be omitted (or faked) where those paths are not needed.
 */
public interface TextEvaluator
{
    /**
     * Evaluates kernel expression text.
     *
     * @param text the expression, in the kernel's syntax.
     * @return the resulting tree; never null.
     *
     * @throws KernelException if the text is malformed.
     */
    public NativeNode evaluate(String text)
        throws KernelException;

    /**
     * Renders a tree in the kernel's textual syntax, such that
     * {@link #evaluate(String)} accepts the result.
     */
    public String render(NativeNode node);
}
