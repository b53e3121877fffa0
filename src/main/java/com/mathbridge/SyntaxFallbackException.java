// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge;

/**
 * Signals that the symbolic text parser could not interpret a fragment of
 * kernel text.
 */
public class SyntaxFallbackException
    extends MathBridgeException
{
    private static final long serialVersionUID = 1L;

    private final String myFragment;

    public SyntaxFallbackException(String fragment, String message)
    {
        super(message + ": " + fragment);
        myFragment = fragment;
    }

    public SyntaxFallbackException(String fragment, String message,
                                   Throwable cause)
    {
        super(message + ": " + fragment, cause);
        myFragment = fragment;
    }

    /**
     * Gets the substring that could not be parsed.
     */
    public String getFragment()
    {
        return myFragment;
    }
}
