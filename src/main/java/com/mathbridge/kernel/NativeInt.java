// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * A machine-width integer node.
 */
public interface NativeInt
    extends NativeNode
{
    /**
     * Gets the content of this node as a Java <code>int</code>.
     */
    public int intValue();
}
