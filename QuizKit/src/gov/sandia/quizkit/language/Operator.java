/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import gov.sandia.quizkit.language.type.Rational;
import gov.sandia.quizkit.language.type.Scalar;
import gov.sandia.quizkit.language.type.Text;

/**
    Base class of the expression tree. An expression is one of:
    <ul>
    <li>Constant -- a number (exact or floating-point) or a text label
    <li>Sequence -- an ordered list of expressions
    <li>Function -- a head tag plus an ordered list of operands
    </ul>
    Every node is immutable. Rewriting produces new nodes, and trees freely share subtrees.
    Equality is structural.
**/
public abstract class Operator
{
    public static final String NUMBER = "number";
    public static final String STRING = "string";
    public static final String LIST   = "list";

    /**
        @return The head tag of a compound node, or one of NUMBER, STRING or LIST for the leaf and list kinds.
    **/
    public abstract String head ();

    public static String head (Operator e)
    {
        return e.head ();
    }

    public boolean isNumber ()
    {
        return false;
    }

    public boolean isZero ()
    {
        return false;
    }

    public boolean isOne ()
    {
        return false;
    }

    /**
        @return true if this is a compound node with the given head.
    **/
    public boolean is (String head)
    {
        return false;
    }

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        return this;
    }

    public abstract void render (Renderer renderer);

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public String toString ()
    {
        return render ();
    }

    public abstract boolean equals (Object that);
    public abstract int     hashCode ();

    // Static constructors ---------------------------------------------------

    public static Constant number (long value)
    {
        return new Constant (new Rational (value));
    }

    public static Constant number (long numerator, long denominator)
    {
        return new Constant (new Rational (numerator, denominator));
    }

    public static Constant number (double value)
    {
        return new Constant (new Scalar (value));
    }

    public static Constant text (String value)
    {
        return new Constant (new Text (value));
    }

    public static Function var (String name)
    {
        return new Function (Function.VAR, text (name));
    }

    public static Function constant (String name)
    {
        return new Function (Function.CONST, text (name));
    }

    public static Sequence list (Operator... elements)
    {
        return new Sequence (elements);
    }

    /// Euler's number.
    public static final Function E = constant ("e");
    /// Imaginary unit.
    public static final Function I = constant ("i");
}
