// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An arithmetic operation over terms.
 * <p>
 * Instances are normally obtained from {@link Terms}, which folds exact
 * numbers; constructing one directly keeps the operands exactly as given.
 */
public final class OperationTerm
    extends Term
{
    /**
     * The arithmetic operators and their arity.
     */
    public enum Operator
    {
        ADD("+", PREC_ADD),
        MULTIPLY("*", PREC_MULTIPLY),
        DIVIDE("/", PREC_MULTIPLY),
        POWER("^", PREC_POWER),
        NEGATE("-", PREC_UNARY);

        private final String mySymbol;
        private final int    myPrecedence;

        private Operator(String symbol, int precedence)
        {
            mySymbol = symbol;
            myPrecedence = precedence;
        }

        public String getSymbol()
        {
            return mySymbol;
        }

        boolean accepts(int operandCount)
        {
            switch (this)
            {
                case NEGATE: return operandCount == 1;
                case DIVIDE:
                case POWER:  return operandCount == 2;
                default:     return operandCount >= 2;
            }
        }
    }

    private final Operator   myOperator;
    private final List<Term> myOperands;

    public OperationTerm(Operator operator, List<? extends Term> operands)
    {
        if (operator == null) throw new NullPointerException("operator must not be null");
        List<Term> copy = new ArrayList<Term>(operands);
        for (Term t : copy)
        {
            if (t == null) throw new NullPointerException("operand must not be null");
        }
        if (! operator.accepts(copy.size()))
        {
            throw new IllegalArgumentException(operator + " does not take "
                                               + copy.size() + " operand(s)");
        }
        myOperator = operator;
        myOperands = Collections.unmodifiableList(copy);
    }

    public OperationTerm(Operator operator, Term... operands)
    {
        this(operator, Arrays.asList(operands));
    }

    public Operator getOperator()
    {
        return myOperator;
    }

    public List<Term> getOperands()
    {
        return myOperands;
    }

    public Term getOperand(int index)
    {
        return myOperands.get(index);
    }

    @Override
    int precedence()
    {
        return myOperator.myPrecedence;
    }

    @Override
    public String toString()
    {
        switch (myOperator)
        {
            case NEGATE:
            {
                Term x = myOperands.get(0);
                return "-" + wrap(x, x.precedence() <= PREC_UNARY);
            }
            case ADD:
                return sum();
            case MULTIPLY:
            {
                StringBuilder buf = new StringBuilder();
                for (int i = 0; i < myOperands.size(); i++)
                {
                    Term x = myOperands.get(i);
                    int p = x.precedence();
                    if (i > 0) buf.append('*');
                    buf.append(wrap(x, p < PREC_MULTIPLY
                                       || (i > 0 && p <= PREC_UNARY)));
                }
                return buf.toString();
            }
            case DIVIDE:
            {
                Term n = myOperands.get(0);
                Term d = myOperands.get(1);
                return wrap(n, n.precedence() < PREC_MULTIPLY)
                    + "/"
                    + wrap(d, d.precedence() < PREC_POWER);
            }
            default:
            {
                Term b = myOperands.get(0);
                Term e = myOperands.get(1);
                return wrap(b, b.precedence() <= PREC_POWER)
                    + "^"
                    + wrap(e, e.precedence() < PREC_POWER);
            }
        }
    }

    private String sum()
    {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < myOperands.size(); i++)
        {
            Term x = myOperands.get(i);
            if (i == 0)
            {
                buf.append(wrap(x, x.precedence() < PREC_ADD));
                continue;
            }
            Term subtrahend = subtrahend(x);
            if (subtrahend != null)
            {
                int p = subtrahend.precedence();
                buf.append('-').append(wrap(subtrahend, p <= PREC_ADD || p == PREC_UNARY));
            }
            else
            {
                buf.append('+').append(wrap(x, x.precedence() <= PREC_ADD));
            }
        }
        return buf.toString();
    }

    /**
     * @return the positive part of a negated operand, or null.
     */
    private static Term subtrahend(Term x)
    {
        if (x instanceof NumberTerm && ((NumberTerm) x).isNegative())
        {
            return ((NumberTerm) x).negate();
        }
        if (x instanceof OperationTerm
            && ((OperationTerm) x).myOperator == Operator.NEGATE)
        {
            return ((OperationTerm) x).myOperands.get(0);
        }
        return null;
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof OperationTerm)) return false;
        OperationTerm that = (OperationTerm) other;
        return myOperator == that.myOperator && myOperands.equals(that.myOperands);
    }

    @Override
    public int hashCode()
    {
        return 31 * myOperator.hashCode() + myOperands.hashCode();
    }
}
