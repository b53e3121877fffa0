// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * A complex number node.
 */
public interface NativeComplex
    extends NativeNode
{
    public NativeNode getReal();

    public NativeNode getImaginary();
}
