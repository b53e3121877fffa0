// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.mathjson;

import com.mathbridge.MathBridgeException;
import com.mathbridge.Rational;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MathJsonCodecTest {

    @Test
    public void writesFunctionsAsArrays() {
        MathJsonExpr expr = MathJsonFunction.of("Add", MathJsonSymbol.of("x"), MathJsonNumber.of(1L));
        assertEquals("[\"Add\",\"x\",1]", MathJsonCodec.toJson(expr));
    }

    @Test
    public void writesRationalNumbersAsRationalFunctions() {
        assertEquals("[\"Rational\",1,2]", MathJsonCodec.toJson(MathJsonNumber.of(Rational.ONE_HALF)));
    }

    @Test
    public void writesStringsQuoted() {
        assertEquals("\"'hi'\"", MathJsonCodec.toJson(MathJsonString.of("hi")));
    }

    @Test
    public void writesNonFiniteFloatsAsNumberObjects() {
        assertEquals("{\"num\":\"NaN\"}", MathJsonCodec.toJson(MathJsonNumber.of(Double.NaN)));
        assertEquals("{\"num\":\"-Infinity\"}",
                     MathJsonCodec.toJson(MathJsonNumber.of(Double.NEGATIVE_INFINITY)));
    }

    @Test
    public void bigIntegersKeepEveryDigit() {
        BigInteger big = new BigInteger("-123456789012345678901234567890");
        String json = MathJsonCodec.toJson(MathJsonNumber.of(big));
        assertEquals("-123456789012345678901234567890", json);

        MathJsonNumber back = (MathJsonNumber) MathJsonCodec.fromJson(json);
        assertEquals(MathJsonNumber.Kind.BIG_INTEGER, back.getKind());
        assertEquals(big, back.bigIntegerValue());
    }

    @Test
    public void smallIntegersReadAsInt64() {
        MathJsonNumber n = (MathJsonNumber) MathJsonCodec.fromJson("42");
        assertEquals(MathJsonNumber.Kind.INT64, n.getKind());
        assertEquals(42L, n.longValue());
    }

    @Test
    public void decimalsReadByPrecision() {
        MathJsonNumber shortDecimal = (MathJsonNumber) MathJsonCodec.fromJson("1.5");
        assertEquals(MathJsonNumber.Kind.FLOAT64, shortDecimal.getKind());
        assertEquals(1.5, shortDecimal.doubleValue(), 0.0);

        MathJsonNumber longDecimal = (MathJsonNumber) MathJsonCodec.fromJson("0.1234567890123456789");
        assertEquals(MathJsonNumber.Kind.BIG_DECIMAL, longDecimal.getKind());
        assertEquals(new BigDecimal("0.1234567890123456789"), longDecimal.bigDecimalValue());
    }

    @Test
    public void floatsSurviveWriting() {
        MathJsonNumber n = (MathJsonNumber) MathJsonCodec.fromJson(MathJsonCodec.toJson(MathJsonNumber.of(2.25)));
        assertEquals(MathJsonNumber.Kind.FLOAT64, n.getKind());
        assertEquals(2.25, n.doubleValue(), 0.0);
    }

    @Test
    public void readsObjectForms() {
        assertEquals(MathJsonSymbol.of("Pi"), MathJsonCodec.fromJson("{\"sym\": \"Pi\", \"wikidata\": \"Q167\"}"));
        assertEquals(MathJsonString.of("text"), MathJsonCodec.fromJson("{\"str\": \"text\"}"));
        assertEquals(MathJsonFunction.of("Add", MathJsonNumber.of(1L), MathJsonNumber.of(2L)),
                     MathJsonCodec.fromJson("{\"fn\": [\"Add\", 1, 2]}"));
        assertEquals(MathJsonNumber.of(new BigInteger("99999999999999999999")),
                     MathJsonCodec.fromJson("{\"num\": \"99999999999999999999\"}"));

        MathJsonNumber inf = (MathJsonNumber) MathJsonCodec.fromJson("{\"num\": \"+Infinity\"}");
        assertEquals(Double.POSITIVE_INFINITY, inf.doubleValue(), 0.0);
    }

    @Test
    public void readsBooleansAsSymbols() {
        assertEquals(MathJsonSymbol.of("True"), MathJsonCodec.fromJson("true"));
        assertEquals(MathJsonSymbol.of("False"), MathJsonCodec.fromJson("false"));
    }

    @Test
    public void readsNestedFunctions() {
        MathJsonExpr expr = MathJsonCodec.fromJson("[\"Multiply\", 2, [\"Sqrt\", \"x\"], \"'label'\"]");
        MathJsonFunction f = (MathJsonFunction) expr;
        assertEquals("Multiply", f.getOperator());
        assertEquals(3, f.size());
        assertThat(f.get(1), instanceOf(MathJsonFunction.class));
        assertEquals(MathJsonString.of("label"), f.get(2));
    }

    @Test
    public void readAllReadsEveryValue() {
        List<MathJsonExpr> values = MathJsonCodec.readAll("1 \"x\" [\"Negate\", \"y\"]");
        assertEquals(3, values.size());
    }

    @ParameterizedTest
    @ValueSource(strings = { "null", "[]", "[1, 2]", "{\"other\": 1}", "\"\"", "1 2", "", "[\"Add\", 1" })
    public void malformedInputIsRejected(String json) {
        assertThrows(MathBridgeException.class, () -> MathJsonCodec.fromJson(json));
    }

    @Test
    public void prettyPrintingIndents() {
        MathJsonExpr expr = MathJsonFunction.of("List", MathJsonNumber.of(1L), MathJsonNumber.of(2L));
        String pretty = MathJsonCodec.toJson(expr, true);
        assertThat(pretty, containsString("\n"));
        assertEquals(expr, MathJsonCodec.fromJson(pretty));
    }

    @Test
    public void numbersKeepTheirKind() {
        MathJsonNumber n = MathJsonNumber.of(3L);
        assertTrue(n.isInteger(3));
        assertThrows(IllegalStateException.class, n::doubleValue);
        assertEquals(BigInteger.valueOf(3), n.toBigInteger());
        assertEquals(null, MathJsonNumber.of(0.5).toBigInteger());
        assertThrows(IllegalArgumentException.class, () -> MathJsonSymbol.of(""));
    }
}
