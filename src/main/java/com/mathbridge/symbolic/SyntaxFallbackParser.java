// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import com.mathbridge.SyntaxFallbackException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the kernel's textual rendering of an expression into a symbolic
 * {@link Term}, keeping calls to <em>preservable</em> functions such as
 * <code>sqrt</code> as opaque {@link CallTerm}s instead of evaluating them.
 * <p>
 * Arithmetic on exact numbers is folded through {@link Terms}. The name
 * <code>ln</code> is read as <code>log</code>.
 * <p>
 * Instances are immutable and may be shared between threads. The variable
 * cache that makes repeated names resolve to one {@link VariableTerm} is
 * created per call to {@link #parse(String)}, or supplied by the caller.
 */
public final class SyntaxFallbackParser
{
    /**
     * The functions kept symbolic by default.
     */
    public static final Set<String> DEFAULT_PRESERVABLE_FUNCTIONS =
        Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(
            "sqrt", "exp", "log", "ln", "log10",
            "sin", "cos", "tan", "cot", "sec", "csc",
            "asin", "acos", "atan",
            "sinh", "cosh", "tanh", "coth",
            "asinh", "acosh", "atanh",
            "abs")));

    private static final Pattern CALL_HEAD =
        Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*)\\(");
    private static final Pattern NUMBER =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)");
    private static final Pattern IDENTIFIER =
        Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final Set<String> myPreservable;

    public SyntaxFallbackParser()
    {
        this(DEFAULT_PRESERVABLE_FUNCTIONS);
    }

    /**
     * @param preservable the names of the functions to keep symbolic.
     */
    public SyntaxFallbackParser(Set<String> preservable)
    {
        if (preservable == null)
        {
            throw new NullPointerException("preservable must not be null");
        }
        myPreservable =
            Collections.unmodifiableSet(new LinkedHashSet<String>(preservable));
    }

    /**
     * @return an unmodifiable set; never null.
     */
    public Set<String> getPreservableFunctions()
    {
        return myPreservable;
    }

    /**
     * Indicates whether calls to the named function are kept symbolic.
     * <code>ln</code> is preservable whenever <code>log</code> is.
     */
    public boolean isPreservable(String name)
    {
        return myPreservable.contains(name)
            || myPreservable.contains(normalizeFunctionName(name));
    }

    /**
     * Gets the name under which a call to {@code name} is kept.
     */
    public static String normalizeFunctionName(String name)
    {
        return "ln".equals(name) ? "log" : name;
    }


    /**
     * Parses text with a fresh variable cache.
     *
     * @throws SyntaxFallbackException if the text cannot be interpreted.
     */
    public Term parse(String text)
    {
        return parse(text, new HashMap<String, VariableTerm>());
    }

    /**
     * Parses text, resolving names through the given variable cache and
     * adding any new variables to it.
     *
     * @throws SyntaxFallbackException if the text cannot be interpreted.
     */
    public Term parse(String text, Map<String, VariableTerm> variables)
    {
        if (text == null) throw new NullPointerException("text must not be null");
        String s = text.trim();
        if (s.isEmpty())
        {
            return NumberTerm.ZERO;
        }

        Matcher head = CALL_HEAD.matcher(s);
        if (head.lookingAt() && closingParenthesis(s, head.end() - 1) == s.length() - 1)
        {
            String name = head.group(1);
            if (isPreservable(name))
            {
                String argText = s.substring(head.end(), s.length() - 1);
                List<Term> args = new ArrayList<Term>();
                for (String arg : splitArguments(argText))
                {
                    args.add(parse(arg, variables));
                }
                return new CallTerm(normalizeFunctionName(name), args, true);
            }
        }
        else
        {
            if (NUMBER.matcher(s).matches())
            {
                return number(s);
            }
            if (IDENTIFIER.matcher(s).matches() || "π".equals(s))
            {
                return name(s, variables);
            }
        }
        return new ExpressionReader(s, variables).read();
    }

    /**
     * Splits an argument list on its top-level commas. Commas nested inside
     * <code>()</code>, <code>[]</code> or <code>{}</code> do not split.
     *
     * @return the trimmed arguments; empty for blank text.
     *
     * @throws SyntaxFallbackException if the brackets are unbalanced.
     */
    public static List<String> splitArguments(String text)
    {
        List<String> out = new ArrayList<String>();
        if (text.trim().isEmpty())
        {
            return out;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++)
        {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{')
            {
                depth++;
            }
            else if (c == ')' || c == ']' || c == '}')
            {
                depth--;
                if (depth < 0)
                {
                    throw new SyntaxFallbackException(text, "unbalanced brackets");
                }
            }
            else if (c == ',' && depth == 0)
            {
                out.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        if (depth != 0)
        {
            throw new SyntaxFallbackException(text, "unbalanced brackets");
        }
        out.add(text.substring(start).trim());
        return out;
    }


    //=========================================================================

    /**
     * @return the index of the parenthesis closing the one at {@code open},
     * or -1.
     */
    private static int closingParenthesis(String s, int open)
    {
        int depth = 0;
        for (int i = open; i < s.length(); i++)
        {
            char c = s.charAt(i);
            if (c == '(')
            {
                depth++;
            }
            else if (c == ')')
            {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Reads a numeral. Integral values, including ones written with a
     * fraction or exponent such as <code>2.0</code>, are exact.
     */
    static NumberTerm number(String text)
    {
        BigDecimal value;
        try
        {
            value = new BigDecimal(text);
        }
        catch (NumberFormatException e)
        {
            throw new SyntaxFallbackException(text, "malformed number", e);
        }
        if (value.signum() == 0)
        {
            return NumberTerm.ZERO;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0)
        {
            return NumberTerm.of(stripped.toBigIntegerExact());
        }
        return NumberTerm.of(value.doubleValue());
    }

    private static Term name(String name, Map<String, VariableTerm> variables)
    {
        if ("pi".equals(name) || "π".equals(name))
        {
            return ConstantTerm.PI;
        }
        if ("i".equals(name))
        {
            return ConstantTerm.IMAGINARY_UNIT;
        }
        if ("inf".equals(name))
        {
            return NumberTerm.of(Double.POSITIVE_INFINITY);
        }
        if ("undef".equals(name))
        {
            return NumberTerm.of(Double.NaN);
        }
        VariableTerm v = variables.get(name);
        if (v == null)
        {
            v = new VariableTerm(name);
            variables.put(name, v);
        }
        return v;
    }


    /**
     * Precedence-climbing reader for general arithmetic. Each instance reads
     * one string.
     */
    private final class ExpressionReader
    {
        private final String                    myText;
        private final Map<String, VariableTerm> myVariables;
        private int                             myPos;

        ExpressionReader(String text, Map<String, VariableTerm> variables)
        {
            myText = text;
            myVariables = variables;
        }

        Term read()
        {
            Term t = readSum();
            skipWhitespace();
            if (myPos < myText.length())
            {
                throw new SyntaxFallbackException(myText.substring(myPos),
                                                  "unexpected input");
            }
            return t;
        }

        private Term readSum()
        {
            Term left = readProduct();
            while (true)
            {
                if (accept('+'))
                {
                    left = Terms.add(left, readProduct());
                }
                else if (accept('-'))
                {
                    left = Terms.subtract(left, readProduct());
                }
                else
                {
                    return left;
                }
            }
        }

        private Term readProduct()
        {
            Term left = readUnary();
            while (true)
            {
                if (accept('*'))
                {
                    left = Terms.multiply(left, readUnary());
                }
                else if (accept('/'))
                {
                    left = Terms.divide(left, readUnary());
                }
                else
                {
                    return left;
                }
            }
        }

        private Term readUnary()
        {
            if (accept('-'))
            {
                return Terms.negate(readUnary());
            }
            if (accept('+'))
            {
                return readUnary();
            }
            return readPower();
        }

        private Term readPower()
        {
            Term base = readPrimary();
            if (accept('^'))
            {
                // Right associative; the exponent may carry a sign.
                return Terms.power(base, readUnary());
            }
            return base;
        }

        private Term readPrimary()
        {
            skipWhitespace();
            if (myPos >= myText.length())
            {
                throw new SyntaxFallbackException(myText, "unexpected end of expression");
            }
            char c = myText.charAt(myPos);
            if (c == '(')
            {
                myPos++;
                Term inner = readSum();
                expect(')');
                return inner;
            }
            if (c == '[')
            {
                int close = matching(myPos, '[', ']');
                String body = myText.substring(myPos + 1, close);
                myPos = close + 1;
                List<Term> elements = new ArrayList<Term>();
                for (String element : splitArguments(body))
                {
                    elements.add(parse(element, myVariables));
                }
                return new ListTerm(elements);
            }
            if (Character.isDigit(c) || c == '.')
            {
                return readNumber();
            }
            if (Character.isLetter(c) || c == '_')
            {
                return readName();
            }
            throw new SyntaxFallbackException(myText.substring(myPos),
                                              "unexpected character '" + c + "'");
        }

        private Term readName()
        {
            int start = myPos;
            while (myPos < myText.length()
                   && (Character.isLetterOrDigit(myText.charAt(myPos))
                       || myText.charAt(myPos) == '_'))
            {
                myPos++;
            }
            String name = myText.substring(start, myPos);
            skipWhitespace();
            if (myPos < myText.length() && myText.charAt(myPos) == '(')
            {
                int close = matching(myPos, '(', ')');
                String body = myText.substring(myPos + 1, close);
                myPos = close + 1;
                List<Term> args = new ArrayList<Term>();
                for (String arg : splitArguments(body))
                {
                    args.add(parse(arg, myVariables));
                }
                boolean preserved = isPreservable(name);
                return new CallTerm(preserved ? normalizeFunctionName(name) : name,
                                    args, preserved);
            }
            return name(name, myVariables);
        }

        private Term readNumber()
        {
            int start = myPos;
            while (myPos < myText.length() && Character.isDigit(myText.charAt(myPos))) myPos++;
            if (myPos < myText.length() && myText.charAt(myPos) == '.')
            {
                myPos++;
                while (myPos < myText.length() && Character.isDigit(myText.charAt(myPos))) myPos++;
            }
            if (myPos < myText.length()
                && (myText.charAt(myPos) == 'e' || myText.charAt(myPos) == 'E'))
            {
                int mark = myPos++;
                if (myPos < myText.length()
                    && (myText.charAt(myPos) == '+' || myText.charAt(myPos) == '-'))
                {
                    myPos++;
                }
                if (myPos < myText.length() && Character.isDigit(myText.charAt(myPos)))
                {
                    while (myPos < myText.length() && Character.isDigit(myText.charAt(myPos))) myPos++;
                }
                else
                {
                    myPos = mark;
                }
            }
            return number(myText.substring(start, myPos));
        }

        private int matching(int open, char opener, char closer)
        {
            int depth = 0;
            for (int i = open; i < myText.length(); i++)
            {
                char c = myText.charAt(i);
                if (c == opener)
                {
                    depth++;
                }
                else if (c == closer)
                {
                    depth--;
                    if (depth == 0) return i;
                }
            }
            throw new SyntaxFallbackException(myText.substring(open),
                                              "missing '" + closer + "'");
        }

        private void skipWhitespace()
        {
            while (myPos < myText.length() && Character.isWhitespace(myText.charAt(myPos)))
            {
                myPos++;
            }
        }

        private boolean accept(char c)
        {
            skipWhitespace();
            if (myPos < myText.length() && myText.charAt(myPos) == c)
            {
                myPos++;
                return true;
            }
            return false;
        }

        private void expect(char c)
        {
            if (! accept(c))
            {
                throw new SyntaxFallbackException(myPos < myText.length()
                                                  ? myText.substring(myPos) : myText,
                                                  "expected '" + c + "'");
            }
        }
    }
}
