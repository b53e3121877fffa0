// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * An IEEE-754 floating point node.
 */
public interface NativeDouble
    extends NativeNode
{
    public double doubleValue();
}
