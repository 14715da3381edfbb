/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    Holds the value of a numeric or text leaf, and knows how to combine it with other values.
    Encodes the rule for promotion: any operation that involves a floating-point value
    produces a floating-point value. Exact values stay exact.
**/
public abstract class Type implements Comparable<Type>
{
    public Type add (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type subtract (Type that) throws EvaluationException
    {
        return add (that.negate ());
    }

    public Type multiply (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type divide (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type power (Type that) throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type negate () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
    }

    public Type abs () throws EvaluationException
    {
        throw new EvaluationException ("Operation not supported on this type.");
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
        @return -1, 0 or 1 according to the sign of the value. Text has no sign and returns 0.
    **/
    public int signum ()
    {
        return 0;
    }

    public double getDouble ()
    {
        throw new EvaluationException ("Value has no numeric interpretation.");
    }

    /**
        Numeric values compare by magnitude regardless of representation, so the exact 2
        equals the floating-point 2.0. Text sorts after every number.
    **/
    public abstract int compareTo (Type that);

    public boolean equals (Object that)
    {
        if (! (that instanceof Type)) return false;
        Type t = (Type) that;
        if (isNumber () != t.isNumber ()) return false;
        return compareTo (t) == 0;
    }

    /**
        Must agree with equals() across representations, so numeric types hash their double value.
    **/
    public abstract int hashCode ();

    /**
        Hash of a double that agrees with numeric comparison, in particular for -0.0 and 0.0.
    **/
    public static int hashDouble (double value)
    {
        if (value == 0) return 0;
        return Double.hashCode (value);
    }
}
