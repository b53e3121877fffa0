// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.kernel.lite;

import com.mathbridge.kernel.KernelException;
import com.mathbridge.kernel.NativeBigInt;
import com.mathbridge.kernel.NativeDouble;
import com.mathbridge.kernel.NativeFactory;
import com.mathbridge.kernel.NativeInt;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.NativeType;
import com.mathbridge.util.BigIntegerTranscoder;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent reader for the kernel's expression syntax.
 * Each instance reads a single string and is not reusable.
 * <p>
 * Precedence, loosest first: {@code or}, {@code and}, relations,
 * {@code + -}, {@code * / mod}, unary minus, {@code ^} (right associative).
 */
final class KernelTextParser
{
    private static final BigInteger MIN_INT = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger MAX_INT = BigInteger.valueOf(Integer.MAX_VALUE);

    private final NativeFactory myFactory;
    private final String        myText;
    private int                 myPos;

    KernelTextParser(NativeFactory factory, String text)
    {
        myFactory = factory;
        myText = text;
    }

    NativeNode parse()
        throws KernelException
    {
        skipWhitespace();
        if (atEnd())
        {
            throw error("empty expression");
        }
        NativeNode node = parseOr();
        skipWhitespace();
        if (! atEnd())
        {
            throw error("unexpected input");
        }
        return node;
    }


    //=========================================================================
    // Binary levels

    private NativeNode parseOr()
    {
        NativeNode left = parseAnd();
        while (acceptWord("or"))
        {
            left = myFactory.newApplication("or", left, parseAnd());
        }
        return left;
    }

    private NativeNode parseAnd()
    {
        NativeNode left = parseRelation();
        while (acceptWord("and"))
        {
            left = myFactory.newApplication("and", left, parseRelation());
        }
        return left;
    }

    private NativeNode parseRelation()
    {
        NativeNode left = parseAdditive();
        String op;
        while ((op = acceptRelation()) != null)
        {
            left = myFactory.newApplication(op, left, parseAdditive());
        }
        return left;
    }

    private NativeNode parseAdditive()
    {
        List<NativeNode> terms = new ArrayList<NativeNode>();
        terms.add(parseMultiplicative());
        while (true)
        {
            if (accept('+'))
            {
                terms.add(parseMultiplicative());
            }
            else if (accept('-'))
            {
                NativeNode left = collapse("+", terms);
                terms.clear();
                terms.add(myFactory.newApplication("-", left, parseMultiplicative()));
            }
            else
            {
                return collapse("+", terms);
            }
        }
    }

    private NativeNode parseMultiplicative()
    {
        List<NativeNode> factors = new ArrayList<NativeNode>();
        factors.add(parseUnary());
        while (true)
        {
            if (accept('*'))
            {
                factors.add(parseUnary());
            }
            else if (accept('/'))
            {
                NativeNode left = collapse("*", factors);
                factors.clear();
                factors.add(divide(left, parseUnary()));
            }
            else if (acceptWord("mod"))
            {
                NativeNode left = collapse("*", factors);
                factors.clear();
                factors.add(myFactory.newApplication("mod", left, parseUnary()));
            }
            else
            {
                return collapse("*", factors);
            }
        }
    }

    private NativeNode parseUnary()
    {
        if (accept('-'))
        {
            return negate(parseUnary());
        }
        if (accept('+'))
        {
            return parseUnary();
        }
        return parsePower();
    }

    private NativeNode parsePower()
    {
        NativeNode base = parsePrimary();
        if (accept('^'))
        {
            return myFactory.newApplication("^", base, parsePowerOperand());
        }
        return base;
    }

    /**
     * Reads the right side of {@code ^}, which may carry its own sign.
     */
    private NativeNode parsePowerOperand()
    {
        if (accept('-'))
        {
            return negate(parsePowerOperand());
        }
        return parsePower();
    }


    //=========================================================================
    // Primaries

    private NativeNode parsePrimary()
    {
        skipWhitespace();
        if (atEnd())
        {
            throw error("unexpected end of expression");
        }
        char c = myText.charAt(myPos);
        if (c == '(')
        {
            myPos++;
            NativeNode inner = parseOr();
            expect(')');
            return inner;
        }
        if (c == '[')
        {
            myPos++;
            return myFactory.newVector(parseList(']'));
        }
        if (Character.isDigit(c) || c == '.')
        {
            return parseNumber();
        }
        if (isIdentifierStart(c))
        {
            return parseName();
        }
        throw error("unexpected character '" + c + "'");
    }

    private NativeNode parseName()
    {
        int start = myPos;
        while (! atEnd() && isIdentifierPart(myText.charAt(myPos)))
        {
            myPos++;
        }
        String name = myText.substring(start, myPos);
        if (isReservedWord(name))
        {
            myPos = start;
            throw error("misplaced operator '" + name + "'");
        }
        if (accept('('))
        {
            return myFactory.newApplication(name, parseList(')'));
        }
        if ("inf".equals(name))
        {
            return myFactory.newDouble(Double.POSITIVE_INFINITY);
        }
        if ("undef".equals(name))
        {
            return myFactory.newDouble(Double.NaN);
        }
        return myFactory.newIdentifier(name);
    }

    /**
     * Reads comma separated expressions up to and including the closer.
     */
    private List<NativeNode> parseList(char closer)
    {
        List<NativeNode> items = new ArrayList<NativeNode>();
        if (accept(closer))
        {
            return items;
        }
        do
        {
            items.add(parseOr());
        }
        while (accept(','));
        expect(closer);
        return items;
    }

    private NativeNode parseNumber()
    {
        int start = myPos;
        boolean integral = true;
        while (! atEnd() && Character.isDigit(myText.charAt(myPos))) myPos++;
        if (! atEnd() && myText.charAt(myPos) == '.')
        {
            integral = false;
            myPos++;
            while (! atEnd() && Character.isDigit(myText.charAt(myPos))) myPos++;
        }
        if (! atEnd() && (myText.charAt(myPos) == 'e' || myText.charAt(myPos) == 'E'))
        {
            int mark = myPos;
            myPos++;
            if (! atEnd() && (myText.charAt(myPos) == '+' || myText.charAt(myPos) == '-'))
            {
                myPos++;
            }
            if (! atEnd() && Character.isDigit(myText.charAt(myPos)))
            {
                integral = false;
                while (! atEnd() && Character.isDigit(myText.charAt(myPos))) myPos++;
            }
            else
            {
                // Not an exponent after all, e.g. "2e" is 2 times e.
                myPos = mark;
            }
        }
        String digits = myText.substring(start, myPos);
        if (".".equals(digits))
        {
            myPos = start;
            throw error("malformed number");
        }
        if (integral)
        {
            return integer(new BigInteger(digits));
        }
        return myFactory.newDouble(Double.parseDouble(digits));
    }


    //=========================================================================
    // Literal folding

    private NativeNode integer(BigInteger value)
    {
        if (value.compareTo(MIN_INT) >= 0 && value.compareTo(MAX_INT) <= 0)
        {
            return myFactory.newInt(value.intValue());
        }
        BigIntegerTranscoder.SignedMagnitude sm = BigIntegerTranscoder.toMagnitude(value);
        return myFactory.newBigInt(sm.getMagnitude(), sm.getSign());
    }

    private static BigInteger integerValue(NativeNode node)
    {
        if (node.getType() == NativeType.INT)
        {
            return BigInteger.valueOf(((NativeInt) node).intValue());
        }
        if (node.getType() == NativeType.BIGINT)
        {
            NativeBigInt big = (NativeBigInt) node;
            return BigIntegerTranscoder.fromMagnitude(big.getMagnitude(), big.getSign());
        }
        return null;
    }

    private NativeNode negate(NativeNode node)
    {
        BigInteger value = integerValue(node);
        if (value != null)
        {
            return integer(value.negate());
        }
        if (node.getType() == NativeType.DOUBLE)
        {
            return myFactory.newDouble(- ((NativeDouble) node).doubleValue());
        }
        return myFactory.newApplication("-", node);
    }

    private NativeNode divide(NativeNode left, NativeNode right)
    {
        BigInteger num = integerValue(left);
        BigInteger den = integerValue(right);
        if (num == null || den == null || den.signum() == 0)
        {
            return myFactory.newApplication("/", left, right);
        }
        if (den.signum() < 0)
        {
            num = num.negate();
            den = den.negate();
        }
        BigInteger gcd = num.gcd(den);
        if (gcd.signum() != 0 && ! gcd.equals(BigInteger.ONE))
        {
            num = num.divide(gcd);
            den = den.divide(gcd);
        }
        if (den.equals(BigInteger.ONE))
        {
            return integer(num);
        }
        return myFactory.newFraction(integer(num), integer(den));
    }

    private NativeNode collapse(String operator, List<NativeNode> operands)
    {
        if (operands.size() == 1)
        {
            return operands.get(0);
        }
        return myFactory.newApplication(operator, new ArrayList<NativeNode>(operands));
    }


    //=========================================================================
    // Scanning

    private boolean atEnd()
    {
        return myPos >= myText.length();
    }

    private void skipWhitespace()
    {
        while (! atEnd() && Character.isWhitespace(myText.charAt(myPos)))
        {
            myPos++;
        }
    }

    private boolean accept(char c)
    {
        skipWhitespace();
        if (! atEnd() && myText.charAt(myPos) == c)
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
            throw error("expected '" + c + "'");
        }
    }

    private boolean acceptWord(String word)
    {
        skipWhitespace();
        int end = myPos + word.length();
        if (myText.startsWith(word, myPos)
            && (end >= myText.length() || ! isIdentifierPart(myText.charAt(end))))
        {
            myPos = end;
            return true;
        }
        return false;
    }

    private String acceptRelation()
    {
        skipWhitespace();
        for (String op : new String[] { "==", "!=", "<=", ">=", "=", "<", ">" })
        {
            if (myText.startsWith(op, myPos))
            {
                myPos += op.length();
                return op;
            }
        }
        return null;
    }

    private static boolean isIdentifierStart(char c)
    {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c)
    {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isReservedWord(String name)
    {
        return "and".equals(name) || "or".equals(name) || "mod".equals(name);
    }

    private KernelException error(String message)
    {
        return new KernelException(message + " at position " + myPos
                                   + " in \"" + myText + "\"");
    }
}
