// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.mathbridge.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of terms.
 */
public final class ListTerm
    extends Term
{
    private final List<Term> myElements;

    public ListTerm(List<? extends Term> elements)
    {
        List<Term> copy = new ArrayList<Term>(elements);
        for (Term t : copy)
        {
            if (t == null) throw new NullPointerException("element must not be null");
        }
        myElements = Collections.unmodifiableList(copy);
    }

    public List<Term> getElements()
    {
        return myElements;
    }

    @Override
    int precedence()
    {
        return PREC_ATOM;
    }

    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder("[");
        for (int i = 0; i < myElements.size(); i++)
        {
            if (i > 0) buf.append(',');
            buf.append(myElements.get(i));
        }
        return buf.append(']').toString();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof ListTerm
            && myElements.equals(((ListTerm) other).myElements);
    }

    @Override
    public int hashCode()
    {
        return myElements.hashCode();
    }
}
