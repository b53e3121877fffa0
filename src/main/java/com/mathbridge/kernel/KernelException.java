// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel;

import com.mathbridge.MathBridgeException;

/**
 * Signals a kernel-defined failure, typically malformed expression text.
 */
public class KernelException
    extends MathBridgeException
{
    private static final long serialVersionUID = 1L;

    public KernelException(String message)
    {
        super(message);
    }

    public KernelException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
