// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge;

import com.mathbridge.kernel.Kernel;
import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.symbolic.Term;

/**
 * Entry point for converting expressions between a computer-algebra kernel's
 * native trees, MathJSON interchange trees and symbolic terms.
 * <p>
 * Instances are built by {@link com.mathbridge.system.MathBridgeBuilder}:
 * <pre>
 *     MathBridge bridge = MathBridgeBuilder.standard().build();
 *     MathJsonExpr json = bridge.toMathJson(bridge.evaluate("x^(1/2)"));
 * </pre>
 * Implementations are safe for use by multiple threads, as long as the
 * configured {@link Kernel} is.
 */
public interface MathBridge
{
    /**
     * Gets the kernel that builds, evaluates and renders native trees.
     */
    public Kernel getKernel();

    /**
     * Converts a native tree into MathJSON.
     *
     * @throws UnsupportedVariantException if {@code node} is null.
     */
    public MathJsonExpr toMathJson(NativeNode node);

    /**
     * Converts MathJSON into a native tree.
     *
     * @throws UnsupportedVariantException if the expression contains a string,
     * or a textual fallback is rejected by the kernel.
     */
    public NativeNode toNative(MathJsonExpr expr);

    /**
     * Converts a native tree into a symbolic term, keeping calls to the
     * preservable functions unevaluated.
     *
     * @throws SyntaxFallbackException if a rendered fallback cannot be read.
     */
    public Term toSymbolic(NativeNode node);

    /**
     * Converts a symbolic term into a native tree through the kernel.
     */
    public NativeNode fromSymbolic(Term term);

    /**
     * Reads kernel text directly into a symbolic term.
     *
     * @throws SyntaxFallbackException if the text cannot be read.
     */
    public Term parseSymbolic(String text);

    /**
     * Evaluates kernel text.
     *
     * @throws KernelException if the kernel rejects the text.
     */
    public NativeNode evaluate(String text)
        throws KernelException;

    /**
     * Renders a native tree in the kernel's textual syntax.
     */
    public String render(NativeNode node);
}
