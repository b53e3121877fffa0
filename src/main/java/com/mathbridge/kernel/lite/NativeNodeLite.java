// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeNode;

/**
 * Base class of the in-memory node implementations.
 * Equality is structural; {@link #toString()} renders kernel text.
 */
abstract class NativeNodeLite
    implements NativeNode
{
    @Override
    public final String toString()
    {
        return KernelTextRenderer.render(this);
    }
}
