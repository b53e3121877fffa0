// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.impl;

import com.mathbridge.MathBridge;
import com.mathbridge.convert.BackwardConverter;
import com.mathbridge.convert.ForwardConverter;
import com.mathbridge.kernel.Kernel;
import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.symbolic.SymbolicConverter;
import com.mathbridge.symbolic.SyntaxFallbackParser;
import com.mathbridge.symbolic.Term;
import java.util.Set;

/**
 * NOT FOR APPLICATION USE!
 * <p>
 * Obtain instances through {@link com.mathbridge.system.MathBridgeBuilder}.
 */
public final class MathBridgeImpl
    implements MathBridge
{
    private final Kernel            myKernel;
    private final ForwardConverter  myForward;
    private final BackwardConverter myBackward;
    private final SymbolicConverter mySymbolic;

    public MathBridgeImpl(Kernel kernel, Set<String> preservableFunctions,
                          boolean transcodeBigIntegers)
    {
        if (kernel == null) throw new NullPointerException("kernel must not be null");
        myKernel = kernel;
        myForward = new ForwardConverter();
        myBackward = new BackwardConverter(kernel, kernel, transcodeBigIntegers);
        mySymbolic = new SymbolicConverter(new SyntaxFallbackParser(preservableFunctions),
                                           kernel);
    }

    public Kernel getKernel()
    {
        return myKernel;
    }

    public MathJsonExpr toMathJson(NativeNode node)
    {
        return myForward.convert(node);
    }

    public NativeNode toNative(MathJsonExpr expr)
    {
        return myBackward.convert(expr);
    }

    public Term toSymbolic(NativeNode node)
    {
        return mySymbolic.toSymbolic(node);
    }

    public NativeNode fromSymbolic(Term term)
    {
        return mySymbolic.fromSymbolic(term);
    }

    public Term parseSymbolic(String text)
    {
        return mySymbolic.getParser().parse(text);
    }

    public NativeNode evaluate(String text)
        throws KernelException
    {
        return myKernel.evaluate(text);
    }

    public String render(NativeNode node)
    {
        return myKernel.render(node);
    }
}
