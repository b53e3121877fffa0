// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * The complete collaborator surface of a computer-algebra kernel:
 * node construction plus textual evaluation and rendering.
 *
 * @see com.mathbridge.kernel.lite.LiteKernel
 */
public interface Kernel
    extends NativeFactory, TextEvaluator
{
}
