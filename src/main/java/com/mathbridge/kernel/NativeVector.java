// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

import java.util.List;

/**
 * An ordered sequence of nodes. Used both for argument lists inside an
 * application and for standalone list literals.
 */
public interface NativeVector
    extends NativeNode
{
    /**
     * @return an unmodifiable view of the elements; never null.
     */
    public List<NativeNode> getElements();

    public int size();

    public NativeNode get(int index);
}
