// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.Kernel;
import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeNode;

/**
 * A self-contained kernel that reads and writes the kernel's textual syntax
 * without simplifying anything.
 * <p>
 * {@link #evaluate(String)} parses the text into an unevaluated tree; the only
 * reductions applied are those the kernel's reader itself performs on
 * literals: integers outside 32-bit range become big integers, and a quotient
 * of two integer literals becomes a normalized fraction. Relational and
 * logical operators, function calls and list literals are kept as written.
 * <p>
 * Instances are stateless and safe for use by multiple threads.
 */
public class LiteKernel
    extends LiteNativeFactory
    implements Kernel
{
    public NativeNode evaluate(String text)
        throws KernelException
    {
        if (text == null)
        {
            throw new NullPointerException("text must not be null");
        }
        return new KernelTextParser(this, text).parse();
    }

    public String render(NativeNode node)
    {
        return KernelTextRenderer.render(node);
    }
}
