/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.type;

import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Type;

/**
    Floating-point type. Only produced by explicit numeric conversion or by arithmetic
    that already involves a floating-point operand.
**/
public class Scalar extends Type
{
    public final double value;

    public Scalar (double value)
    {
        this.value = value;
    }

    public boolean isNumber ()
    {
        return true;
    }

    public boolean isZero ()
    {
        return value == 0;
    }

    public boolean isOne ()
    {
        return value == 1;
    }

    public boolean isInteger ()
    {
        return value == Math.rint (value)  &&  ! Double.isInfinite (value);
    }

    public int signum ()
    {
        if (value > 0) return 1;
        if (value < 0) return -1;
        return 0;
    }

    public double getDouble ()
    {
        return value;
    }

    public Type add (Type that) throws EvaluationException
    {
        if (that.isNumber ()) return new Scalar (value + that.getDouble ());
        throw new EvaluationException ("type mismatch");
    }

    public Type multiply (Type that) throws EvaluationException
    {
        if (that.isNumber ()) return new Scalar (value * that.getDouble ());
        throw new EvaluationException ("type mismatch");
    }

    public Type divide (Type that) throws EvaluationException
    {
        if (that.isNumber ())
        {
            double d = that.getDouble ();
            if (d == 0) throw new EvaluationException ("Division by zero");
            return new Scalar (value / d);
        }
        throw new EvaluationException ("type mismatch");
    }

    public Type power (Type that) throws EvaluationException
    {
        if (that.isNumber ())
        {
            double result = Math.pow (value, that.getDouble ());
            if (Double.isNaN (result)) throw new EvaluationException ("Power is not a real number: " + this + "^" + that);
            return new Scalar (result);
        }
        throw new EvaluationException ("type mismatch");
    }

    public Type negate ()
    {
        return new Scalar (-value);
    }

    public Type abs ()
    {
        return new Scalar (Math.abs (value));
    }

    public int compareTo (Type that)
    {
        if (! that.isNumber ()) return -1;
        double b = that.getDouble ();
        if (value < b) return -1;
        if (value > b) return 1;
        return 0;
    }

    public int hashCode ()
    {
        return hashDouble (value);
    }

    public String toString ()
    {
        return String.valueOf (value);
    }
}
