// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An application of a named function that is kept symbolic.
 * <p>
 * A <em>preserved</em> call names one of the preservable functions, such as
 * <code>sqrt(2)</code>. Other calls are uninterpreted: the function is simply
 * unknown to the term graph.
 */
public final class CallTerm
    extends Term
{
    private final String     myName;
    private final List<Term> myArguments;
    private final boolean    myPreserved;

    public CallTerm(String name, List<? extends Term> arguments, boolean preserved)
    {
        if (name == null) throw new NullPointerException("name must not be null");
        List<Term> copy = new ArrayList<Term>(arguments);
        for (Term t : copy)
        {
            if (t == null) throw new NullPointerException("argument must not be null");
        }
        myName = name;
        myArguments = Collections.unmodifiableList(copy);
        myPreserved = preserved;
    }

    public String getName()
    {
        return myName;
    }

    public List<Term> getArguments()
    {
        return myArguments;
    }

    public boolean isPreserved()
    {
        return myPreserved;
    }

    @Override
    int precedence()
    {
        return PREC_ATOM;
    }

    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder(myName).append('(');
        for (int i = 0; i < myArguments.size(); i++)
        {
            if (i > 0) buf.append(',');
            buf.append(myArguments.get(i));
        }
        return buf.append(')').toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (! (other instanceof CallTerm)) return false;
        CallTerm that = (CallTerm) other;
        return myPreserved == that.myPreserved
            && myName.equals(that.myName)
            && myArguments.equals(that.myArguments);
    }

    @Override
    public int hashCode()
    {
        return 31 * myName.hashCode() + myArguments.hashCode();
    }
}
