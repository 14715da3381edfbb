/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import java.util.Arrays;
import java.util.List;

/**
    An ordered list of expressions. Also serves as the row type inside a matrix.
**/
public class Sequence extends Operator
{
    public final Operator[] elements;  // never modified after construction
    protected int hash;

    public Sequence (Operator... elements)
    {
        this.elements = elements.clone ();
    }

    public Sequence (List<? extends Operator> elements)
    {
        this.elements = elements.toArray (new Operator[elements.size ()]);
    }

    public String head ()
    {
        return LIST;
    }

    public int size ()
    {
        return elements.length;
    }

    public Operator get (int i)
    {
        return elements[i];
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator e : elements) e.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;

        Operator[] next = null;
        for (int i = 0; i < elements.length; i++)
        {
            Operator e = elements[i].transform (transformer);
            if (e == elements[i]) continue;
            if (next == null) next = elements.clone ();
            next[i] = e;
        }
        if (next == null) return this;
        return new Sequence (next);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append ("[");
        for (int i = 0; i < elements.length; i++)
        {
            if (i > 0) renderer.result.append (", ");
            elements[i].render (renderer);
        }
        renderer.result.append ("]");
    }

    public boolean equals (Object that)
    {
        if (that == this) return true;
        if (! (that instanceof Sequence)) return false;
        Sequence s = (Sequence) that;
        if (hashCode () != s.hashCode ()) return false;
        return Arrays.equals (elements, s.elements);
    }

    public int hashCode ()
    {
        if (hash == 0) hash = 31 * Arrays.hashCode (elements) + 7;
        return hash;
    }
}
