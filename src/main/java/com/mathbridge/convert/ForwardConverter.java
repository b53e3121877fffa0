// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.convert;

import com.mathbridge.Rational;
import com.mathbridge.UnsupportedVariantException;
import com.mathbridge.kernel.NativeApplication;
import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeComplex;
import com.mathbridge.kernel.NativeDouble;
import com.mathbridge.kernel.NativeFraction;
import com.mathbridge.kernel.NativeIdentifier;
import com.mathbridge.kernel.NativeInt;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeVector;
import com.mathbridge.kernel.NativeVisitor;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.mathjson.MathJsonFunction;
import com.mathbridge.mathjson.MathJsonNumber;
import com.mathbridge.mathjson.MathJsonSymbol;
import com.mathbridge.mathjson.MathJsonType;
import com.mathbridge.util.BigIntegerTranscoder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts native trees into MathJSON trees.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
public final class ForwardConverter
    implements NativeVisitor<MathJsonExpr>
{
    private static final Logger log = LoggerFactory.getLogger(ForwardConverter.class);

    public ForwardConverter() { }

    /**
     * Converts a native tree.
     *
     * @throws UnsupportedVariantException if {@code node} is null.
     */
    public MathJsonExpr convert(NativeNode node)
    {
        if (node == null)
        {
            throw new UnsupportedVariantException("null",
                                                  "cannot convert a null native node");
        }
        return node.accept(this);
    }


    public MathJsonExpr visit(NativeInt node)
    {
        return MathJsonNumber.of((long) node.intValue());
    }

    public MathJsonExpr visit(NativeDouble node)
    {
        return MathJsonNumber.of(node.doubleValue());
    }

    public MathJsonExpr visit(NativeBigInt node)
    {
        return MathJsonNumber.of(BigIntegerTranscoder.fromMagnitude(node.getMagnitude(),
                                                                    node.getSign()));
    }

    public MathJsonExpr visit(NativeFraction node)
    {
        return MathJsonFunction.of(OperatorTables.RATIONAL,
                                   convert(node.getNumerator()),
                                   convert(node.getDenominator()));
    }

    public MathJsonExpr visit(NativeComplex node)
    {
        return MathJsonFunction.of(OperatorTables.COMPLEX,
                                   convert(node.getReal()),
                                   convert(node.getImaginary()));
    }

    public MathJsonExpr visit(NativeIdentifier node)
    {
        String name = node.getName();
        String constant = OperatorTables.constantFor(name);
        return MathJsonSymbol.of(constant != null ? constant : name);
    }

    public MathJsonExpr visit(NativeApplication node)
    {
        String op = node.getOperator();
        List<MathJsonExpr> args = convertAll(node.getArguments());

        if ("-".equals(op) && args.size() == 1)
        {
            return MathJsonFunction.of(OperatorTables.NEGATE, args);
        }
        if ("^".equals(op) && args.size() == 2 && isOneHalf(args.get(1)))
        {
            return MathJsonFunction.of(OperatorTables.SQRT, args.get(0));
        }

        String tag = OperatorTables.tagFor(op);
        if (tag == null)
        {
            tag = capitalize(op);
            log.debug("No MathJSON tag for native operator '{}', using '{}'", op, tag);
        }
        return MathJsonFunction.of(tag, args);
    }

    public MathJsonExpr visit(NativeVector node)
    {
        return MathJsonFunction.of(OperatorTables.LIST,
                                   convertAll(node.getElements()));
    }


    private List<MathJsonExpr> convertAll(List<NativeNode> nodes)
    {
        List<MathJsonExpr> out = new ArrayList<MathJsonExpr>(nodes.size());
        for (NativeNode n : nodes)
        {
            out.add(convert(n));
        }
        return out;
    }

    /**
     * Recognizes the converted form of the native fraction 1/2.
     */
    static boolean isOneHalf(MathJsonExpr expr)
    {
        if (expr.getType() == MathJsonType.NUMBER)
        {
            MathJsonNumber n = (MathJsonNumber) expr;
            return n.getKind() == MathJsonNumber.Kind.RATIONAL
                && n.rationalValue().equals(Rational.ONE_HALF);
        }
        if (expr.getType() == MathJsonType.FUNCTION)
        {
            MathJsonFunction f = (MathJsonFunction) expr;
            return f.is(OperatorTables.RATIONAL, 2)
                && isIntegerNumber(f.get(0), 1)
                && isIntegerNumber(f.get(1), 2);
        }
        return false;
    }

    private static boolean isIntegerNumber(MathJsonExpr expr, long value)
    {
        return expr.getType() == MathJsonType.NUMBER
            && ((MathJsonNumber) expr).isInteger(value);
    }

    static String capitalize(String name)
    {
        if (name.isEmpty()) return name;
        int first = name.codePointAt(0);
        return new StringBuilder(name.length())
            .appendCodePoint(Character.toUpperCase(first))
            .append(name, Character.charCount(first), name.length())
            .toString();
    }
}
