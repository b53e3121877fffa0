// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

import com.amazon.ion.IntegerSize;
import com.amazon.ion.IonException;
import com.amazon.ion.IonReader;
import com.amazon.ion.IonType;
import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonReaderBuilder;
import com.amazon.ion.system.IonTextWriterBuilder;
import com.mathbridge.MathBridgeException;
import com.mathbridge.Rational;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads and writes MathJSON text.
 * <p>
 * Since Ion text is a superset of JSON, both directions go through Ion
 * readers and writers; {@link IonTextWriterBuilder#json()} keeps the output
 * within JSON. The encoding is:
 * <ul>
 *   <li>numbers are JSON numbers, except non-finite floats and arbitrary
 *       precision decimals, which use <code>{"num": "..."}</code>;</li>
 *   <li>rationals are written <code>["Rational", n, d]</code>;</li>
 *   <li>symbols are JSON strings;</li>
 *   <li>strings are JSON strings wrapped in single quotes;</li>
 *   <li>functions are arrays whose head is the operator tag.</li>
 * </ul>
 * The reader also accepts the object forms <code>{"sym": ...}</code>,
 * <code>{"str": ...}</code> and <code>{"fn": [...]}</code>, and reads JSON
 * booleans as the symbols <code>True</code> and <code>False</code>.
 */
public final class MathJsonCodec
{
    /**
     * Decimals with up to this many significant digits survive a trip through
     * a double and are read as {@link MathJsonNumber.Kind#FLOAT64}.
     */
    static final int MAX_DOUBLE_DIGITS = 15;

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private static final String NUM = "num";
    private static final String SYM = "sym";
    private static final String STR = "str";
    private static final String FN  = "fn";

    /** You no touchy. */
    private MathJsonCodec() { }


    //=========================================================================
    // Writing

    /**
     * Renders an expression as compact MathJSON text.
     */
    public static String toJson(MathJsonExpr expr)
    {
        return toJson(expr, false);
    }

    /**
     * Renders an expression as MathJSON text.
     *
     * @param pretty whether to indent the output.
     */
    public static String toJson(MathJsonExpr expr, boolean pretty)
    {
        StringBuilder out = new StringBuilder();
        IonTextWriterBuilder builder = IonTextWriterBuilder.json();
        if (pretty)
        {
            builder = builder.withPrettyPrinting();
        }
        try (IonWriter writer = builder.build(out))
        {
            write(expr, writer);
        }
        catch (IOException e)
        {
            throw new MathBridgeException(e);
        }
        return out.toString().trim();
    }

    /**
     * Writes an expression as a single value to an Ion writer.
     */
    public static void write(MathJsonExpr expr, final IonWriter writer)
        throws IOException
    {
        try
        {
            expr.accept(new MathJsonVisitor<Void>()
            {
                public Void visit(MathJsonNumber number)
                {
                    writeNumber(number, writer);
                    return null;
                }

                public Void visit(MathJsonSymbol symbol)
                {
                    writeString(symbol.getName(), writer);
                    return null;
                }

                public Void visit(MathJsonString string)
                {
                    writeString("'" + string.stringValue() + "'", writer);
                    return null;
                }

                public Void visit(MathJsonFunction function)
                {
                    try
                    {
                        writer.stepIn(IonType.LIST);
                        writer.writeString(function.getOperator());
                        for (MathJsonExpr arg : function.getArguments())
                        {
                            arg.accept(this);
                        }
                        writer.stepOut();
                    }
                    catch (IOException e)
                    {
                        throw new WrappedIOException(e);
                    }
                    return null;
                }
            });
        }
        catch (WrappedIOException e)
        {
            throw e.getCause();
        }
    }

    private static void writeNumber(MathJsonNumber number, IonWriter writer)
    {
        try
        {
            switch (number.getKind())
            {
                case INT64:
                    writer.writeInt(number.longValue());
                    break;
                case FLOAT64:
                    double d = number.doubleValue();
                    if (Double.isNaN(d))
                    {
                        writeNumberObject("NaN", writer);
                    }
                    else if (Double.isInfinite(d))
                    {
                        writeNumberObject(d > 0 ? "+Infinity" : "-Infinity", writer);
                    }
                    else
                    {
                        writer.writeFloat(d);
                    }
                    break;
                case BIG_INTEGER:
                    writer.writeInt(number.bigIntegerValue());
                    break;
                case BIG_DECIMAL:
                    writeNumberObject(number.bigDecimalValue().toString(), writer);
                    break;
                case RATIONAL:
                    Rational r = number.rationalValue();
                    writer.stepIn(IonType.LIST);
                    writer.writeString("Rational");
                    writer.writeInt(r.getNumerator());
                    writer.writeInt(r.getDenominator());
                    writer.stepOut();
                    break;
                default:
                    throw new IllegalStateException("unknown number kind " + number.getKind());
            }
        }
        catch (IOException e)
        {
            throw new WrappedIOException(e);
        }
    }

    private static void writeNumberObject(String text, IonWriter writer)
        throws IOException
    {
        writer.stepIn(IonType.STRUCT);
        writer.setFieldName(NUM);
        writer.writeString(text);
        writer.stepOut();
    }

    private static void writeString(String text, IonWriter writer)
    {
        try
        {
            writer.writeString(text);
        }
        catch (IOException e)
        {
            throw new WrappedIOException(e);
        }
    }

    /** Carries an IOException out of a visitor. */
    private static final class WrappedIOException
        extends RuntimeException
    {
        private static final long serialVersionUID = 1L;

        WrappedIOException(IOException cause)
        {
            super(cause);
        }

        @Override
        public synchronized IOException getCause()
        {
            return (IOException) super.getCause();
        }
    }


    //=========================================================================
    // Reading

    /**
     * Parses a single MathJSON value.
     *
     * @throws MathBridgeException if the text is not exactly one well-formed
     * MathJSON value.
     */
    public static MathJsonExpr fromJson(String json)
    {
        List<MathJsonExpr> values = readAll(json);
        if (values.size() != 1)
        {
            throw new MathBridgeException("expected one MathJSON value, found "
                                          + values.size());
        }
        return values.get(0);
    }

    /**
     * Parses every top-level MathJSON value in the text.
     */
    public static List<MathJsonExpr> readAll(String json)
    {
        try (IonReader reader = IonReaderBuilder.standard().build(json))
        {
            return readAll(reader);
        }
        catch (IOException e)
        {
            throw new MathBridgeException(e);
        }
    }

    /**
     * Reads every remaining value at the reader's current depth.
     *
     * @throws MathBridgeException if a value is not well-formed MathJSON.
     */
    public static List<MathJsonExpr> readAll(IonReader reader)
    {
        List<MathJsonExpr> values = new ArrayList<MathJsonExpr>();
        try
        {
            while (reader.next() != null)
            {
                values.add(read(reader));
            }
        }
        catch (IonException e)
        {
            throw new MathBridgeException("malformed MathJSON: " + e.getMessage(), e);
        }
        return values;
    }

    /**
     * Reads the value the reader is positioned on.
     *
     * @throws MathBridgeException if the value is not well-formed MathJSON.
     */
    public static MathJsonExpr read(IonReader reader)
    {
        IonType type = reader.getType();
        if (type == null)
        {
            throw new MathBridgeException("reader is not positioned on a value");
        }
        if (reader.isNullValue())
        {
            throw new MathBridgeException("null is not a MathJSON expression");
        }
        switch (type)
        {
            case BOOL:
                return MathJsonSymbol.of(reader.booleanValue() ? "True" : "False");
            case INT:
                return readInt(reader);
            case FLOAT:
                return MathJsonNumber.of(reader.doubleValue());
            case DECIMAL:
                return readDecimal(reader.bigDecimalValue());
            case STRING:
            case SYMBOL:
                return readString(reader.stringValue());
            case LIST:
            case SEXP:
                return readFunction(reader);
            case STRUCT:
                return readObject(reader);
            default:
                throw new MathBridgeException("unsupported JSON value of type " + type);
        }
    }

    private static MathJsonNumber readInt(IonReader reader)
    {
        if (reader.getIntegerSize() == IntegerSize.BIG_INTEGER)
        {
            return MathJsonNumber.of(reader.bigIntegerValue());
        }
        return MathJsonNumber.of(reader.longValue());
    }

    private static MathJsonNumber readDecimal(BigDecimal value)
    {
        if (value.precision() <= MAX_DOUBLE_DIGITS)
        {
            return MathJsonNumber.of(value.doubleValue());
        }
        return MathJsonNumber.of(value);
    }

    private static MathJsonExpr readString(String text)
    {
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'"))
        {
            return MathJsonString.of(text.substring(1, text.length() - 1));
        }
        if (text.isEmpty())
        {
            throw new MathBridgeException("empty symbol name");
        }
        return MathJsonSymbol.of(text);
    }

    private static MathJsonExpr readFunction(IonReader reader)
    {
        reader.stepIn();
        IonType headType = reader.next();
        if (headType == null)
        {
            throw new MathBridgeException("empty array is not a MathJSON function");
        }
        if (headType != IonType.STRING && headType != IonType.SYMBOL)
        {
            throw new MathBridgeException("MathJSON function head must be a string, not "
                                          + headType);
        }
        String operator = reader.stringValue();
        if (operator == null || operator.isEmpty())
        {
            throw new MathBridgeException("MathJSON function head must not be empty");
        }
        List<MathJsonExpr> args = readAll(reader);
        reader.stepOut();
        return MathJsonFunction.of(operator, args);
    }

    private static MathJsonExpr readObject(IonReader reader)
    {
        MathJsonExpr result = null;
        reader.stepIn();
        while (reader.next() != null)
        {
            String field = reader.getFieldName();
            if (NUM.equals(field))
            {
                result = readNumberField(reader);
            }
            else if (SYM.equals(field))
            {
                result = MathJsonSymbol.of(requireText(reader, field));
            }
            else if (STR.equals(field))
            {
                result = MathJsonString.of(requireText(reader, field));
            }
            else if (FN.equals(field))
            {
                IonType type = reader.getType();
                if (type != IonType.LIST && type != IonType.SEXP)
                {
                    throw new MathBridgeException("\"fn\" must hold an array");
                }
                result = readFunction(reader);
            }
            // Other fields carry metadata that has no counterpart in the tree.
        }
        reader.stepOut();
        if (result == null)
        {
            throw new MathBridgeException("object has none of num, sym, str or fn");
        }
        return result;
    }

    private static MathJsonExpr readNumberField(IonReader reader)
    {
        IonType type = reader.getType();
        if (type == IonType.STRING || type == IonType.SYMBOL)
        {
            return parseNumber(reader.stringValue());
        }
        if (type == IonType.INT || type == IonType.FLOAT || type == IonType.DECIMAL)
        {
            return read(reader);
        }
        throw new MathBridgeException("\"num\" must hold a string or a number");
    }

    private static String requireText(IonReader reader, String field)
    {
        IonType type = reader.getType();
        if ((type != IonType.STRING && type != IonType.SYMBOL) || reader.isNullValue())
        {
            throw new MathBridgeException("\"" + field + "\" must hold a string");
        }
        return reader.stringValue();
    }

    /**
     * Parses the text form of a number used in <code>{"num": ...}</code>.
     * Integers keep full precision; other decimals are read exactly.
     */
    static MathJsonNumber parseNumber(String text)
    {
        String s = text.trim();
        if ("NaN".equals(s)) return MathJsonNumber.of(Double.NaN);
        if ("+Infinity".equals(s) || "Infinity".equals(s))
        {
            return MathJsonNumber.of(Double.POSITIVE_INFINITY);
        }
        if ("-Infinity".equals(s)) return MathJsonNumber.of(Double.NEGATIVE_INFINITY);
        try
        {
            if (INTEGER.matcher(s).matches())
            {
                BigInteger value = new BigInteger(s);
                if (value.bitLength() < 64)
                {
                    return MathJsonNumber.of(value.longValue());
                }
                return MathJsonNumber.of(value);
            }
            return MathJsonNumber.of(new BigDecimal(s));
        }
        catch (NumberFormatException e)
        {
            throw new MathBridgeException("malformed number \"" + text + "\"", e);
        }
    }
}
