// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

/**
 * Enumeration identifying the variants of the MathJSON interchange tree.
 */
public enum MathJsonType
{
    NUMBER,
    SYMBOL,
    STRING,
    FUNCTION
}
