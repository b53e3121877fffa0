// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

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
import com.mathbridge.kernel.TextEvaluator;
import com.mathbridge.util.BigIntegerTranscoder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts native trees to symbolic terms and back.
 * <p>
 * Products and powers keep their factored shape; sums, differences and
 * quotients are reduced. Calls to preservable functions become opaque
 * {@link CallTerm}s. Any other application is rendered by the kernel and
 * re-read by the {@link SyntaxFallbackParser}.
 */
public final class SymbolicConverter
{
    private static final Logger log = LoggerFactory.getLogger(SymbolicConverter.class);

    private final SyntaxFallbackParser myParser;
    private final TextEvaluator        myEvaluator;

    /**
     * @param parser reads rendered fallbacks; must not be null.
     * @param evaluator renders unknown applications and reads terms back;
     * may be null, in which case those paths fail.
     */
    public SymbolicConverter(SyntaxFallbackParser parser, TextEvaluator evaluator)
    {
        if (parser == null) throw new NullPointerException("parser must not be null");
        myParser = parser;
        myEvaluator = evaluator;
    }

    public SyntaxFallbackParser getParser()
    {
        return myParser;
    }

    /**
     * Converts a native tree to a symbolic term. Every occurrence of a name in
     * the tree maps to the same {@link VariableTerm}.
     *
     * @throws UnsupportedVariantException if {@code node} is null, or needs a
     * textual fallback and no evaluator is configured.
     * @throws com.mathbridge.SyntaxFallbackException if a fallback rendering
     * cannot be parsed.
     */
    public Term toSymbolic(NativeNode node)
    {
        return new ToTerm(new HashMap<String, VariableTerm>()).convert(node);
    }

    /**
     * Converts a symbolic term back into a native tree by evaluating its
     * textual form in the kernel.
     *
     * @throws UnsupportedVariantException if no evaluator is configured.
     */
    public NativeNode fromSymbolic(Term term)
    {
        if (term == null) throw new NullPointerException("term must not be null");
        requireEvaluator("Term");
        return myEvaluator.evaluate(term.toString());
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


    /**
     * One conversion; owns the variable cache.
     */
    private final class ToTerm
        implements NativeVisitor<Term>
    {
        private final Map<String, VariableTerm> myVariables;

        ToTerm(Map<String, VariableTerm> variables)
        {
            myVariables = variables;
        }

        Term convert(NativeNode node)
        {
            if (node == null)
            {
                throw new UnsupportedVariantException("null",
                                                      "cannot convert a null native node");
            }
            return node.accept(this);
        }

        private List<Term> convertAll(List<NativeNode> nodes)
        {
            List<Term> out = new ArrayList<Term>(nodes.size());
            for (NativeNode n : nodes)
            {
                out.add(convert(n));
            }
            return out;
        }

        public Term visit(NativeInt node)
        {
            return NumberTerm.of(node.intValue());
        }

        public Term visit(NativeDouble node)
        {
            return NumberTerm.of(node.doubleValue());
        }

        public Term visit(NativeBigInt node)
        {
            return NumberTerm.of(BigIntegerTranscoder.fromMagnitude(node.getMagnitude(),
                                                                    node.getSign()));
        }

        public Term visit(NativeFraction node)
        {
            return Terms.divide(convert(node.getNumerator()),
                                convert(node.getDenominator()));
        }

        public Term visit(NativeComplex node)
        {
            return Terms.add(convert(node.getReal()),
                             Terms.multiply(convert(node.getImaginary()),
                                            ConstantTerm.IMAGINARY_UNIT));
        }

        public Term visit(NativeIdentifier node)
        {
            String name = node.getName();
            if ("pi".equals(name) || "π".equals(name))
            {
                return ConstantTerm.PI;
            }
            if ("i".equals(name))
            {
                return ConstantTerm.IMAGINARY_UNIT;
            }
            VariableTerm v = myVariables.get(name);
            if (v == null)
            {
                v = new VariableTerm(name);
                myVariables.put(name, v);
            }
            return v;
        }

        public Term visit(NativeApplication node)
        {
            String op = node.getOperator();
            List<NativeNode> args = node.getArguments();

            if ("*".equals(op))
            {
                return Terms.product(convertAll(args));
            }
            if ("^".equals(op) && args.size() == 2)
            {
                return Terms.powerOf(convert(args.get(0)), convert(args.get(1)));
            }
            if ("+".equals(op))
            {
                return Terms.add(convertAll(args));
            }
            if ("-".equals(op) && args.size() == 1)
            {
                return Terms.negate(convert(args.get(0)));
            }
            if ("-".equals(op) && args.size() == 2)
            {
                return Terms.subtract(convert(args.get(0)), convert(args.get(1)));
            }
            if ("/".equals(op) && args.size() == 2)
            {
                return Terms.divide(convert(args.get(0)), convert(args.get(1)));
            }
            if (myParser.isPreservable(op))
            {
                return new CallTerm(SyntaxFallbackParser.normalizeFunctionName(op),
                                    convertAll(args), true);
            }

            requireEvaluator(op);
            String text = myEvaluator.render(node);
            log.debug("Reading application of '{}' through its text: {}", op, text);
            return myParser.parse(text, myVariables);
        }

        public Term visit(NativeVector node)
        {
            return new ListTerm(convertAll(node.getElements()));
        }
    }
}
