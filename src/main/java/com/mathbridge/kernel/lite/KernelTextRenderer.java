// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.NativeApplication;
import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeComplex;
import com.mathbridge.kernel.NativeDouble;
import com.mathbridge.kernel.NativeFraction;
import com.mathbridge.kernel.NativeIdentifier;
import com.mathbridge.kernel.NativeInt;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.kernel.NativeVector;
import com.mathbridge.kernel.NativeVisitor;
import com.mathbridge.util.BigIntegerTranscoder;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders native trees in the kernel's textual syntax, using as few
 * parentheses as {@link KernelTextParser} needs to rebuild the same tree.
 */
final class KernelTextRenderer
    implements NativeVisitor<String>
{
    static final int PREC_OR       = 1;
    static final int PREC_AND      = 2;
    static final int PREC_RELATION = 3;
    static final int PREC_ADD      = 4;
    static final int PREC_MULTIPLY = 5;
    static final int PREC_UNARY    = 6;
    static final int PREC_POWER    = 7;
    static final int PREC_ATOM     = 100;

    private static final Map<String, Integer> INFIX_PRECEDENCE =
        new HashMap<String, Integer>();
    static
    {
        INFIX_PRECEDENCE.put("or",  PREC_OR);
        INFIX_PRECEDENCE.put("and", PREC_AND);
        for (String op : new String[] { "=", "==", "!=", "<", "<=", ">", ">=" })
        {
            INFIX_PRECEDENCE.put(op, PREC_RELATION);
        }
        INFIX_PRECEDENCE.put("+",   PREC_ADD);
        INFIX_PRECEDENCE.put("-",   PREC_ADD);
        INFIX_PRECEDENCE.put("*",   PREC_MULTIPLY);
        INFIX_PRECEDENCE.put("/",   PREC_MULTIPLY);
        INFIX_PRECEDENCE.put("mod", PREC_MULTIPLY);
        INFIX_PRECEDENCE.put("^",   PREC_POWER);
    }

    private static final KernelTextRenderer INSTANCE = new KernelTextRenderer();
    private static final Precedence PRECEDENCE = new Precedence();

    private KernelTextRenderer() { }

    static String render(NativeNode node)
    {
        return node.accept(INSTANCE);
    }

    /**
     * Gets the binding strength of an infix operator.
     *
     * @return null if {@code operator} is not written infix.
     */
    static Integer infixPrecedence(String operator)
    {
        return INFIX_PRECEDENCE.get(operator);
    }

    static boolean isWordOperator(String operator)
    {
        return "or".equals(operator) || "and".equals(operator)
            || "mod".equals(operator);
    }


    //=========================================================================
    // Leaves

    public String visit(NativeInt node)
    {
        return Integer.toString(node.intValue());
    }

    public String visit(NativeDouble node)
    {
        double value = node.doubleValue();
        if (Double.isNaN(value)) return "undef";
        if (value == Double.POSITIVE_INFINITY) return "inf";
        if (value == Double.NEGATIVE_INFINITY) return "-inf";
        return Double.toString(value);
    }

    public String visit(NativeBigInt node)
    {
        return BigIntegerTranscoder.fromMagnitude(node.getMagnitude(),
                                                  node.getSign()).toString();
    }

    public String visit(NativeIdentifier node)
    {
        return node.getName();
    }


    //=========================================================================
    // Composites

    public String visit(NativeFraction node)
    {
        return operand(node.getNumerator(), "/", 0)
            + "/"
            + operand(node.getDenominator(), "/", 1);
    }

    public String visit(NativeComplex node)
    {
        NativeNode re = node.getReal();
        NativeNode im = node.getImaginary();
        if (isZero(re))
        {
            return imaginaryTerm(im);
        }
        String real = operand(re, "+", 0);
        Double negated = negatedValue(im);
        if (negated != null)
        {
            return real + "-" + imaginaryTerm(numberLike(im, negated));
        }
        return real + "+" + imaginaryTerm(im);
    }

    public String visit(NativeApplication node)
    {
        String op = node.getOperator();
        List<NativeNode> args = node.getArguments();
        Integer precedence = INFIX_PRECEDENCE.get(op);

        if (precedence != null && args.size() == 1
            && node.getFeuille().getType() != NativeType.VECTOR)
        {
            NativeNode arg = args.get(0);
            String text = arg.accept(this);
            if (arg.accept(PRECEDENCE) <= PREC_UNARY)
            {
                text = "(" + text + ")";
            }
            return op + text;
        }

        if (precedence != null && args.size() >= 2)
        {
            String separator = isWordOperator(op) ? " " + op + " " : op;
            StringBuilder buf = new StringBuilder();
            for (int i = 0; i < args.size(); i++)
            {
                if (i > 0) buf.append(separator);
                buf.append(operand(args.get(i), op, i));
            }
            return buf.toString();
        }

        return op + "(" + join(args) + ")";
    }

    public String visit(NativeVector node)
    {
        return "[" + join(node.getElements()) + "]";
    }


    //=========================================================================

    private String join(List<NativeNode> nodes)
    {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++)
        {
            if (i > 0) buf.append(',');
            buf.append(nodes.get(i).accept(this));
        }
        return buf.toString();
    }

    private String operand(NativeNode child, String parentOp, int index)
    {
        String text = child.accept(this);
        return needsParentheses(child, parentOp, index) ? "(" + text + ")" : text;
    }

    private static boolean needsParentheses(NativeNode child, String parentOp,
                                            int index)
    {
        int childPrec = child.accept(PRECEDENCE);
        int parentPrec = INFIX_PRECEDENCE.get(parentOp);
        if (childPrec == PREC_UNARY)
        {
            // Negations are kept apart from the operator on their left.
            return index > 0 || parentPrec >= PREC_POWER;
        }
        if (childPrec != parentPrec)
        {
            return childPrec < parentPrec;
        }
        if (parentPrec == PREC_POWER || index > 0)
        {
            return true;
        }
        // (a+b)+c must not flatten into a+b+c on the way back in.
        return child.getType() == NativeType.APPLICATION
            && ((NativeApplication) child).getOperator().equals(parentOp)
            && ("+".equals(parentOp) || "*".equals(parentOp));
    }

    private String imaginaryTerm(NativeNode im)
    {
        if (isOne(im)) return "i";
        Double negated = negatedValue(im);
        if (negated != null && negated.doubleValue() == 1.0
            && im.getType() == NativeType.INT)
        {
            return "-i";
        }
        return operand(im, "*", 0) + "*i";
    }

    private static boolean isZero(NativeNode node)
    {
        return node.getType() == NativeType.INT
            && ((NativeInt) node).intValue() == 0;
    }

    private static boolean isOne(NativeNode node)
    {
        return node.getType() == NativeType.INT
            && ((NativeInt) node).intValue() == 1;
    }

    /**
     * @return the negated value of a negative int or double, else null.
     */
    private static Double negatedValue(NativeNode node)
    {
        if (node.getType() == NativeType.INT)
        {
            int value = ((NativeInt) node).intValue();
            if (value < 0 && value != Integer.MIN_VALUE) return -(double) value;
        }
        else if (node.getType() == NativeType.DOUBLE)
        {
            double value = ((NativeDouble) node).doubleValue();
            if (value < 0) return -value;
        }
        return null;
    }

    private static NativeNode numberLike(NativeNode template, double value)
    {
        if (template.getType() == NativeType.INT)
        {
            return new NativeIntLite((int) value);
        }
        return new NativeDoubleLite(value);
    }


    /**
     * Computes how tightly the rendered text of a node binds.
     */
    private static final class Precedence
        implements NativeVisitor<Integer>
    {
        public Integer visit(NativeInt node)
        {
            return node.intValue() < 0 ? PREC_UNARY : PREC_ATOM;
        }

        public Integer visit(NativeDouble node)
        {
            double value = node.doubleValue();
            return (value < 0 || (value == 0 && 1 / value < 0))
                ? PREC_UNARY : PREC_ATOM;
        }

        public Integer visit(NativeBigInt node)
        {
            return node.getSign() < 0 ? PREC_UNARY : PREC_ATOM;
        }

        public Integer visit(NativeFraction node)
        {
            return PREC_MULTIPLY;
        }

        public Integer visit(NativeComplex node)
        {
            if (! isZero(node.getReal())) return PREC_ADD;
            NativeNode im = node.getImaginary();
            if (isOne(im)) return PREC_ATOM;
            if (negatedValue(im) != null) return PREC_UNARY;
            return PREC_MULTIPLY;
        }

        public Integer visit(NativeIdentifier node)
        {
            return PREC_ATOM;
        }

        public Integer visit(NativeApplication node)
        {
            Integer precedence = INFIX_PRECEDENCE.get(node.getOperator());
            if (precedence == null) return PREC_ATOM;
            List<NativeNode> args = node.getArguments();
            if (args.size() == 1 && node.getFeuille().getType() != NativeType.VECTOR)
            {
                return PREC_UNARY;
            }
            return args.size() >= 2 ? precedence : PREC_ATOM;
        }

        public Integer visit(NativeVector node)
        {
            return PREC_ATOM;
        }
    }
}
