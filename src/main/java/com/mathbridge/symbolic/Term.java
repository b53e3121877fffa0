// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

/**
 * An immutable node of a symbolic term graph.
 * <p>
 * Terms are built by {@link SyntaxFallbackParser}, {@link SymbolicConverter}
 * and the reductions in {@link Terms}. Calls to functions are never evaluated;
 * only arithmetic on exact numbers is folded.
 * <p>
 * {@link #toString()} writes a term in the kernel's textual syntax, with the
 * parentheses needed to read it back unchanged.
 */
public abstract class Term
{
    static final int PREC_ADD      = 4;
    static final int PREC_MULTIPLY = 5;
    static final int PREC_UNARY    = 6;
    static final int PREC_POWER    = 7;
    static final int PREC_ATOM     = 100;

    Term() { }

    /**
     * Gets how tightly the text of this term binds.
     */
    abstract int precedence();

    /**
     * Writes this term in the kernel's textual syntax.
     */
    @Override
    public abstract String toString();

    static String wrap(Term term, boolean parenthesize)
    {
        String text = term.toString();
        return parenthesize ? "(" + text + ")" : text;
    }
}
