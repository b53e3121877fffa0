// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

/**
 * A named leaf. The kernel uses the same variant for variables and for named
 * constants such as <code>pi</code>; only the name tells them apart.
 */
public interface NativeIdentifier
    extends NativeNode
{
    public String getName();
}
