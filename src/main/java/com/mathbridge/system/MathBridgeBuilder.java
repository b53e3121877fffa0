// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.system;

import com.mathbridge.MathBridge;
import com.mathbridge.impl.MathBridgeImpl;
import com.mathbridge.kernel.Kernel;
import com.mathbridge.kernel.lite.LiteKernel;
import com.mathbridge.symbolic.SyntaxFallbackParser;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The bootstrap builder for creating a {@link MathBridge}.
 * Most applications will only have one or two bridges, so this builder is
 * rarely used after startup.
 * <p>
 * Instances of this class are not safe for use by multiple threads unless
 * they are {@linkplain #immutable() immutable}.
 * <p>
 * The easiest way to get going is to use the {@link #standard()} builder:
 * <pre>
 *     MathBridge bridge = MathBridgeBuilder.standard().build();
 * </pre>
 * Configuration properties follow the standard JavaBeans idiom in order to
 * be friendly to dependency injection systems. They also provide alternative
 * {@code with...} mutation methods that enable a more fluid style:
 * <pre>
 *     MathBridge bridge = MathBridgeBuilder.standard()
 *                                          .withKernel(kernel)
 *                                          .withBigIntegerTranscoding(false)
 *                                          .build();
 * </pre>
 *
 * <h2>Configuration Properties</h2>
 * <ul>
 *   <li>{@link #setKernel(Kernel) Kernel}; default: a new {@link LiteKernel}
 *       per built bridge.</li>
 *   <li>{@link #setPreservableFunctions(Set) PreservableFunctions}; default:
 *       {@link SyntaxFallbackParser#DEFAULT_PRESERVABLE_FUNCTIONS}.</li>
 *   <li>{@link #setBigIntegerTranscoding(boolean) BigIntegerTranscoding};
 *       default: true, unless the system property
 *       {@value #DISABLE_TRANSCODING_PROPERTY} is {@code true}.</li>
 * </ul>
 */
public class MathBridgeBuilder
{
    /**
     * System property that switches big integers from byte transcoding to
     * textual re-evaluation by default.
     */
    public static final String DISABLE_TRANSCODING_PROPERTY =
        "com.mathbridge.system.MathBridgeBuilder.disableBigIntegerTranscoding";

    private static final MathBridgeBuilder STANDARD = new MathBridgeBuilder();

    /**
     * The standard builder of {@link MathBridge}s.
     * See the class documentation for the standard configuration.
     * <p>
     * The returned instance is immutable.
     */
    public static MathBridgeBuilder standard()
    {
        return STANDARD;
    }


    //=========================================================================

    Kernel      myKernel;
    Set<String> myPreservableFunctions = SyntaxFallbackParser.DEFAULT_PRESERVABLE_FUNCTIONS;
    boolean     myBigIntegerTranscoding = true;


    /** You no touchy. */
    private MathBridgeBuilder()
    {
        try
        {
            myBigIntegerTranscoding = ! Boolean.getBoolean(DISABLE_TRANSCODING_PROPERTY);
        }
        catch (final SecurityException e)
        {
            // System properties are not accessible; keep the default.
        }
    }

    private MathBridgeBuilder(MathBridgeBuilder that)
    {
        this.myKernel                = that.myKernel;
        this.myPreservableFunctions  = that.myPreservableFunctions;
        this.myBigIntegerTranscoding = that.myBigIntegerTranscoding;
    }


    //=========================================================================

    /**
     * Creates a mutable copy of this builder.
     */
    public final MathBridgeBuilder copy()
    {
        return new Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this instance, if immutable;
     * otherwise an immutable copy of this instance.
     */
    public MathBridgeBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public MathBridgeBuilder mutable()
    {
        return copy();
    }

    void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================
    // Properties

    /**
     * Gets the kernel used by built bridges.
     *
     * @return may be null, meaning each bridge gets a new {@link LiteKernel}.
     */
    public final Kernel getKernel()
    {
        return myKernel;
    }

    /**
     * @throws UnsupportedOperationException if this is immutable.
     */
    public final void setKernel(Kernel kernel)
    {
        mutationCheck();
        myKernel = kernel;
    }

    public final MathBridgeBuilder withKernel(Kernel kernel)
    {
        MathBridgeBuilder b = mutable();
        b.setKernel(kernel);
        return b;
    }


    //=========================================================================

    /**
     * @return an unmodifiable set; never null.
     */
    public final Set<String> getPreservableFunctions()
    {
        return myPreservableFunctions;
    }

    /**
     * Declares the functions kept symbolic by the symbolic conversions.
     * The set is copied.
     *
     * @throws UnsupportedOperationException if this is immutable.
     */
    public final void setPreservableFunctions(Set<String> names)
    {
        mutationCheck();
        if (names == null) throw new NullPointerException("names must not be null");
        myPreservableFunctions =
            Collections.unmodifiableSet(new LinkedHashSet<String>(names));
    }

    public final MathBridgeBuilder withPreservableFunctions(Set<String> names)
    {
        MathBridgeBuilder b = mutable();
        b.setPreservableFunctions(names);
        return b;
    }


    //=========================================================================

    /**
     * Indicates whether big integers are rebuilt from their magnitude bytes.
     * When false they are rebuilt by evaluating their decimal text.
     */
    public final boolean isBigIntegerTranscoding()
    {
        return myBigIntegerTranscoding;
    }

    /**
     * @throws UnsupportedOperationException if this is immutable.
     */
    public final void setBigIntegerTranscoding(boolean transcoding)
    {
        mutationCheck();
        myBigIntegerTranscoding = transcoding;
    }

    public final MathBridgeBuilder withBigIntegerTranscoding(boolean transcoding)
    {
        MathBridgeBuilder b = mutable();
        b.setBigIntegerTranscoding(transcoding);
        return b;
    }


    //=========================================================================

    /**
     * Builds a new bridge based on this builder's configuration properties.
     */
    public final MathBridge build()
    {
        Kernel kernel = (myKernel != null ? myKernel : new LiteKernel());
        return new MathBridgeImpl(kernel, myPreservableFunctions,
                                  myBigIntegerTranscoding);
    }


    //=========================================================================

    private static final class Mutable
        extends MathBridgeBuilder
    {
        private Mutable(MathBridgeBuilder that)
        {
            super(that);
        }

        @Override
        public MathBridgeBuilder immutable()
        {
            return new MathBridgeBuilder(this);
        }

        @Override
        public MathBridgeBuilder mutable()
        {
            return this;
        }

        @Override
        void mutationCheck()
        {
        }
    }
}
