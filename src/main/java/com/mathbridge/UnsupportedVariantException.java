// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge;

/**
 * Signals that a tree node has no conversion rule and no fallback path.
 * The offending variant is available through {@link #getVariant()}.
 */
public class UnsupportedVariantException
    extends MathBridgeException
{
    private static final long serialVersionUID = 1L;

    private final String myVariant;

    public UnsupportedVariantException(String variant, String message)
    {
        super(message);
        myVariant = variant;
    }

    public UnsupportedVariantException(String variant, String message,
                                       Throwable cause)
    {
        super(message, cause);
        myVariant = variant;
    }

    /**
     * Gets the name of the variant (a native tag, an interchange type or an
     * operator tag) that could not be converted.
     */
    public String getVariant()
    {
        return myVariant;
    }
}
