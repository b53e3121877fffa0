// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.system;

import com.mathbridge.MathBridge;
import com.mathbridge.kernel.Kernel;
import com.mathbridge.kernel.NativeNode;
import com.mathbridge.kernel.lite.LiteKernel;
import com.mathbridge.mathjson.MathJsonExpr;
import com.mathbridge.mathjson.MathJsonFunction;
import com.mathbridge.mathjson.MathJsonNumber;
import com.mathbridge.mathjson.MathJsonSymbol;
import com.mathbridge.symbolic.CallTerm;
import com.mathbridge.symbolic.SyntaxFallbackParser;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MathBridgeBuilderTest {

    /** Counts the texts a kernel is asked to evaluate. */
    private static final class CountingKernel extends LiteKernel {
        final List<String> evaluated = new ArrayList<>();

        @Override
        public NativeNode evaluate(String text) {
            evaluated.add(text);
            return super.evaluate(text);
        }
    }

    @Test
    public void standardIsImmutable() {
        MathBridgeBuilder standard = MathBridgeBuilder.standard();
        assertSame(standard, MathBridgeBuilder.standard());
        assertSame(standard, standard.immutable());
        assertThrows(UnsupportedOperationException.class, () -> standard.setKernel(new LiteKernel()));
        assertThrows(UnsupportedOperationException.class, () -> standard.setBigIntegerTranscoding(false));
        assertThrows(UnsupportedOperationException.class,
                     () -> standard.setPreservableFunctions(Collections.<String>emptySet()));
    }

    @Test
    public void standardDefaults() {
        MathBridgeBuilder standard = MathBridgeBuilder.standard();
        assertNull(standard.getKernel());
        assertEquals(SyntaxFallbackParser.DEFAULT_PRESERVABLE_FUNCTIONS, standard.getPreservableFunctions());
        assertEquals(! Boolean.getBoolean(MathBridgeBuilder.DISABLE_TRANSCODING_PROPERTY),
                     standard.isBigIntegerTranscoding());
    }

    @Test
    public void withMethodsReturnMutableCopies() {
        MathBridgeBuilder standard = MathBridgeBuilder.standard();
        MathBridgeBuilder b = standard.withBigIntegerTranscoding(false);
        assertNotSame(standard, b);
        assertFalse(b.isBigIntegerTranscoding());
        assertSame(b, b.mutable());
        assertSame(b, b.withKernel(null));

        b.setBigIntegerTranscoding(true);
        assertTrue(b.isBigIntegerTranscoding());
    }

    @Test
    public void copiesAreIndependent() {
        MathBridgeBuilder original = MathBridgeBuilder.standard().copy();
        original.setBigIntegerTranscoding(false);
        MathBridgeBuilder copy = original.copy();
        copy.setBigIntegerTranscoding(true);
        assertFalse(original.isBigIntegerTranscoding());

        MathBridgeBuilder frozen = copy.immutable();
        assertNotSame(copy, frozen);
        assertTrue(frozen.isBigIntegerTranscoding());
        assertThrows(UnsupportedOperationException.class, () -> frozen.setKernel(null));
        assertNotSame(frozen, frozen.mutable());
    }

    @Test
    public void preservableFunctionsAreCopied() {
        Set<String> names = new HashSet<>(Collections.singleton("sqrt"));
        MathBridgeBuilder b = MathBridgeBuilder.standard().withPreservableFunctions(names);
        names.add("sin");
        assertEquals(Collections.singleton("sqrt"), b.getPreservableFunctions());
        assertThrows(UnsupportedOperationException.class, () -> b.getPreservableFunctions().add("cos"));
        assertThrows(NullPointerException.class, () -> b.setPreservableFunctions(null));
    }

    @Test
    public void buildUsesDefaultKernel() {
        MathBridge first = MathBridgeBuilder.standard().build();
        MathBridge second = MathBridgeBuilder.standard().build();
        assertThat(first.getKernel(), instanceOf(LiteKernel.class));
        assertNotSame(first.getKernel(), second.getKernel());

        NativeNode node = first.evaluate("x+2*y");
        MathJsonExpr json = first.toMathJson(node);
        assertEquals(MathJsonFunction.of("Add", MathJsonSymbol.of("x"),
                                         MathJsonFunction.of("Multiply", MathJsonNumber.of(2L),
                                                             MathJsonSymbol.of("y"))),
                     json);
        assertEquals("x+2*y", first.render(first.toNative(json)));
    }

    @Test
    public void buildUsesConfiguredKernel() {
        Kernel kernel = new LiteKernel();
        MathBridge bridge = MathBridgeBuilder.standard().withKernel(kernel).build();
        assertSame(kernel, bridge.getKernel());
    }

    @Test
    public void buildHonorsPreservableFunctions() {
        MathBridge bridge = MathBridgeBuilder.standard()
                                             .withPreservableFunctions(Collections.singleton("sin"))
                                             .build();
        assertTrue(((CallTerm) bridge.parseSymbolic("sin(x)")).isPreserved());
        assertFalse(((CallTerm) bridge.parseSymbolic("sqrt(x)")).isPreserved());
        assertFalse(((CallTerm) bridge.toSymbolic(bridge.evaluate("sqrt(2)"))).isPreserved());
        assertEquals("sin(x)+1", bridge.render(bridge.fromSymbolic(bridge.parseSymbolic("1+sin(x)"))));
    }

    @Test
    public void buildHonorsTranscodingSwitch() {
        BigInteger big = BigInteger.ONE.shiftLeft(80);
        CountingKernel counting = new CountingKernel();
        MathBridge textual = MathBridgeBuilder.standard()
                                              .withKernel(counting)
                                              .withBigIntegerTranscoding(false)
                                              .build();
        NativeNode viaText = textual.toNative(MathJsonNumber.of(big));
        assertEquals(Collections.singletonList(big.toString()), counting.evaluated);

        CountingKernel counting2 = new CountingKernel();
        MathBridge transcoding = MathBridgeBuilder.standard()
                                                  .withKernel(counting2)
                                                  .withBigIntegerTranscoding(true)
                                                  .build();
        assertEquals(viaText, transcoding.toNative(MathJsonNumber.of(big)));
        assertTrue(counting2.evaluated.isEmpty());
    }
}
