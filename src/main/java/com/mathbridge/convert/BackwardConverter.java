// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.convert;

import com.mathbridge.Rational;
import com.mathbridge.UnsupportedVariantException;
import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeFactory;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.TextEvaluator;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.mathjson.MathJsonFunction;
import com.mathbridge.mathjson.MathJsonNumber;
import com.mathbridge.mathjson.MathJsonString;
import com.mathbridge.mathjson.MathJsonSymbol;
import com.mathbridge.mathjson.MathJsonVisitor;
import com.mathbridge.util.BigIntegerTranscoder;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts MathJSON trees into native trees.
 * <p>
 * Structural conversion builds nodes through a {@link NativeFactory}. A few
 * shapes have no structural constructor in the kernel (relations, operator
 * tags missing from {@link OperatorTables}, arbitrary-precision decimals, and
 * big integers when transcoding is disabled); those are rendered to text and
 * re-read through the optional {@link TextEvaluator}. Without an evaluator
 * such shapes raise {@link UnsupportedVariantException}.
 * <p>
 * Instances are stateless and may be shared between threads, provided the
 * collaborators are.
 */
public final class BackwardConverter
    implements MathJsonVisitor<NativeNode>
{
    private static final Logger log = LoggerFactory.getLogger(BackwardConverter.class);

    private static final BigInteger MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);

    private final NativeFactory myFactory;
    private final TextEvaluator myEvaluator;
    private final boolean       myTranscodeBigIntegers;

    /**
     * @param factory builds the native nodes; must not be null.
     * @param evaluator reads textual fallbacks; may be null.
     * @param transcodeBigIntegers if false, big integers are rebuilt from
     * their decimal text instead of their magnitude bytes.
     */
    public BackwardConverter(NativeFactory factory, TextEvaluator evaluator,
                             boolean transcodeBigIntegers)
    {
        if (factory == null)
        {
            throw new NullPointerException("factory must not be null");
        }
        myFactory = factory;
        myEvaluator = evaluator;
        myTranscodeBigIntegers = transcodeBigIntegers;
    }

    public BackwardConverter(NativeFactory factory, TextEvaluator evaluator)
    {
        this(factory, evaluator, true);
    }

    /**
     * Converts a MathJSON tree.
     *
     * @throws UnsupportedVariantException if the tree contains a string, is
     * null, or needs a textual fallback that cannot be performed.
     */
    public NativeNode convert(MathJsonExpr expr)
    {
        if (expr == null)
        {
            throw new UnsupportedVariantException("null",
                                                  "cannot convert a null MathJSON expression");
        }
        return expr.accept(this);
    }


    //=========================================================================
    // Numbers

    public NativeNode visit(MathJsonNumber number)
    {
        switch (number.getKind())
        {
            case INT64:
            {
                long value = number.longValue();
                if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE)
                {
                    return myFactory.newInt((int) value);
                }
                return integer(BigInteger.valueOf(value));
            }
            case FLOAT64:
                return myFactory.newDouble(number.doubleValue());
            case BIG_INTEGER:
                return integer(number.bigIntegerValue());
            case RATIONAL:
            {
                Rational r = number.rationalValue();
                return myFactory.newFraction(integer(r.getNumerator()),
                                             integer(r.getDenominator()));
            }
            case BIG_DECIMAL:
                return evaluateText("Number", number.bigDecimalValue().toString());
            default:
                throw new UnsupportedVariantException(number.getKind().name(),
                                                      "unknown number kind");
        }
    }

    private NativeNode integer(BigInteger value)
    {
        if (value.compareTo(MIN_INT) >= 0 && value.compareTo(MAX_INT) <= 0)
        {
            return myFactory.newInt(value.intValue());
        }
        if (! myTranscodeBigIntegers)
        {
            return evaluateText("Number", value.toString());
        }
        BigIntegerTranscoder.SignedMagnitude sm = BigIntegerTranscoder.toMagnitude(value);
        return myFactory.newBigInt(sm.getMagnitude(), sm.getSign());
    }


    //=========================================================================
    // Symbols and strings

    public NativeNode visit(MathJsonSymbol symbol)
    {
        String name = symbol.getName();
        if (OperatorTables.EXPONENTIAL_E.equals(name))
        {
            return myFactory.newApplication("exp", myFactory.newInt(1));
        }
        if (OperatorTables.IMAGINARY_UNIT.equals(name))
        {
            return myFactory.newComplex(myFactory.newInt(0), myFactory.newInt(1));
        }
        String nativeName = OperatorTables.nativeConstantFor(name);
        return myFactory.newIdentifier(nativeName != null ? nativeName : name);
    }

    public NativeNode visit(MathJsonString string)
    {
        throw new UnsupportedVariantException("String",
                                              "MathJSON strings have no native form: '"
                                              + string.stringValue() + "'");
    }


    //=========================================================================
    // Functions

    public NativeNode visit(MathJsonFunction function)
    {
        String tag = function.getOperator();
        NativeRecipe recipe = OperatorTables.recipeFor(tag);
        if (recipe == null)
        {
            return unmapped(function);
        }

        switch (recipe.getKind())
        {
            case STRUCTURAL:
                return structural(function, recipe.getStructure());
            case RELATIONAL:
                return relational(function, recipe.getOperator());
            default:
                return myFactory.newApplication(recipe.getOperator(),
                                                convertAll(function.getArguments()));
        }
    }

    private NativeNode structural(MathJsonFunction function,
                                  NativeRecipe.Structure structure)
    {
        if (! structure.accepts(function.size()))
        {
            return unmapped(function);
        }
        switch (structure)
        {
            case FRACTION:
                return myFactory.newFraction(convert(function.get(0)),
                                             convert(function.get(1)));
            case COMPLEX:
                return myFactory.newComplex(convert(function.get(0)),
                                            convert(function.get(1)));
            default:
                return myFactory.newVector(convertAll(function.getArguments()));
        }
    }

    private NativeNode relational(MathJsonFunction function, String symbol)
    {
        List<NativeNode> args = convertAll(function.getArguments());
        if (args.size() != 2)
        {
            return myFactory.newApplication(symbol, args);
        }
        String text = "(" + render(function, args.get(0)) + ")"
            + symbol
            + "(" + render(function, args.get(1)) + ")";
        return evaluateText(function.getOperator(), text);
    }

    private NativeNode unmapped(MathJsonFunction function)
    {
        String tag = function.getOperator();
        log.warn("No native operator for MathJSON tag '{}' with {} argument(s),"
                 + " re-reading it as text", tag, function.size());

        StringBuilder text = new StringBuilder();
        text.append(tag.toLowerCase(Locale.ROOT)).append('(');
        List<NativeNode> args = convertAll(function.getArguments());
        for (int i = 0; i < args.size(); i++)
        {
            if (i > 0) text.append(',');
            text.append(render(function, args.get(i)));
        }
        text.append(')');
        return evaluateText(tag, text.toString());
    }


    //=========================================================================

    private List<NativeNode> convertAll(List<MathJsonExpr> exprs)
    {
        List<NativeNode> out = new ArrayList<NativeNode>(exprs.size());
        for (MathJsonExpr e : exprs)
        {
            out.add(convert(e));
        }
        return out;
    }

    private String render(MathJsonFunction owner, NativeNode node)
    {
        requireEvaluator(owner.getOperator());
        return myEvaluator.render(node);
    }

    private NativeNode evaluateText(String variant, String text)
    {
        requireEvaluator(variant);
        try
        {
            return myEvaluator.evaluate(text);
        }
        catch (KernelException e)
        {
            throw new UnsupportedVariantException(variant,
                                                  "kernel rejected textual form of "
                                                  + variant + ": " + text, e);
        }
    }

    private void requireEvaluator(String variant)
    {
        if (myEvaluator == null)
        {
            throw new UnsupportedVariantException(variant,
                                                  "converting " + variant
                                                  + " requires a text evaluator");
        }
    }
}
