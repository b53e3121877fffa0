// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

import java.util.List;

/**
 * An operator applied to an argument payload (the <em>feuille</em>).
 * <p>
 * The arity is not stored. A multi-argument application carries a
 * {@link NativeVector} feuille whose elements are the arguments; a unary
 * application carries its single argument directly.
 */
public interface NativeApplication
    extends NativeNode
{
    /**
     * Gets the operator name, for example <code>+</code> or <code>sin</code>.
     */
    public String getOperator();

    /**
     * Gets the raw argument payload.
     */
    public NativeNode getFeuille();

    /**
     * Gets the arguments as derived from the shape of the feuille.
     *
     * @return the elements of a vector feuille, otherwise a singleton list
     * holding the feuille; never null.
     */
    public List<NativeNode> getArguments();
}
