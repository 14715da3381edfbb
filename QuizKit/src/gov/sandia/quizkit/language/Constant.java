/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import gov.sandia.quizkit.language.type.Rational;
import gov.sandia.quizkit.language.type.Scalar;
import gov.sandia.quizkit.language.type.Text;

public class Constant extends Operator
{
    public final Type value;

    public static final Constant ZERO      = new Constant (Rational.ZERO);
    public static final Constant ONE       = new Constant (Rational.ONE);
    public static final Constant MINUS_ONE = new Constant (Rational.MINUS_ONE);
    public static final Constant HALF      = new Constant (Rational.HALF);

    public Constant (Type value)
    {
        if (value == null) throw new IllegalArgumentException ("Constant value must not be null");
        this.value = value;
    }

    public String head ()
    {
        if (value instanceof Text) return STRING;
        return NUMBER;
    }

    public boolean isNumber ()
    {
        return value.isNumber ();
    }

    public boolean isZero ()
    {
        return value.isZero ();
    }

    public boolean isOne ()
    {
        return value.isOne ();
    }

    /**
        @return true if this holds an exact integer.
    **/
    public boolean isInteger ()
    {
        return value instanceof Rational  &&  ((Rational) value).isInteger ();
    }

    public static boolean isInteger (Operator e)
    {
        return e instanceof Constant  &&  ((Constant) e).isInteger ();
    }

    public static boolean isRational (Operator e)
    {
        return e instanceof Constant  &&  ((Constant) e).value instanceof Rational;
    }

    /**
        @return The exact value held by e, or null if e is not an exact number.
    **/
    public static Rational rational (Operator e)
    {
        if (isRational (e)) return (Rational) ((Constant) e).value;
        return null;
    }

    /**
        @return The sign of a numeric leaf, or 0 for anything else.
    **/
    public static int signum (Operator e)
    {
        if (e instanceof Constant) return ((Constant) e).value.signum ();
        return 0;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        if (value instanceof Text) renderer.result.append ("\"" + value + "\"");
        else                       renderer.result.append (value);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        return value.equals (((Constant) that).value);
    }

    public int hashCode ()
    {
        return value.hashCode ();
    }

    /**
        Convenience for building numeric leaves from whatever arithmetic produced.
    **/
    public static Constant of (Type value)
    {
        if (value.isZero ()  &&  value instanceof Rational) return ZERO;
        if (value.isOne ()   &&  value instanceof Rational) return ONE;
        return new Constant (value);
    }

    public static Constant of (double value)
    {
        return new Constant (new Scalar (value));
    }
}
