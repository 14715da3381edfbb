/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Type;

/**
    Exact rational number. Always held in lowest terms with a positive denominator,
    so the sign lives on the numerator. An integer is simply a Rational with denominator 1.
**/
public class Rational extends Type
{
    public final BigInteger numerator;
    public final BigInteger denominator;

    public static final Rational ZERO      = new Rational (0);
    public static final Rational ONE       = new Rational (1);
    public static final Rational MINUS_ONE = new Rational (-1);
    public static final Rational HALF      = new Rational (1, 2);

    public Rational (long value)
    {
        numerator   = BigInteger.valueOf (value);
        denominator = BigInteger.ONE;
    }

    public Rational (long numerator, long denominator)
    {
        this (BigInteger.valueOf (numerator), BigInteger.valueOf (denominator));
    }

    public Rational (BigInteger value)
    {
        numerator   = value;
        denominator = BigInteger.ONE;
    }

    public Rational (BigInteger numerator, BigInteger denominator)
    {
        if (denominator.signum () == 0) throw new EvaluationException ("Division by zero");
        if (denominator.signum () < 0)
        {
            numerator   = numerator.negate ();
            denominator = denominator.negate ();
        }
        BigInteger g = numerator.gcd (denominator);
        if (! g.equals (BigInteger.ONE))
        {
            numerator   = numerator  .divide (g);
            denominator = denominator.divide (g);
        }
        this.numerator   = numerator;
        this.denominator = denominator;
    }

    public boolean isInteger ()
    {
        return denominator.equals (BigInteger.ONE);
    }

    /**
        @return The value as an int, or throws if it is not an integer that fits.
    **/
    public int intValue () throws EvaluationException
    {
        if (! isInteger ()  ||  numerator.bitLength () > 31) throw new EvaluationException ("Expected a small integer, got " + this);
        return numerator.intValue ();
    }

    public boolean isNumber ()
    {
        return true;
    }

    public boolean isZero ()
    {
        return numerator.signum () == 0;
    }

    public boolean isOne ()
    {
        return numerator.equals (BigInteger.ONE)  &&  isInteger ();
    }

    public int signum ()
    {
        return numerator.signum ();
    }

    public double getDouble ()
    {
        if (isInteger ()) return numerator.doubleValue ();
        double result = numerator.doubleValue () / denominator.doubleValue ();
        if (Double.isFinite (result)) return result;
        return new BigDecimal (numerator).divide (new BigDecimal (denominator), MathContext.DECIMAL64).doubleValue ();
    }

    public Type add (Type that) throws EvaluationException
    {
        if (that instanceof Rational)
        {
            Rational r = (Rational) that;
            return new Rational (numerator.multiply (r.denominator).add (r.numerator.multiply (denominator)), denominator.multiply (r.denominator));
        }
        if (that instanceof Scalar) return new Scalar (getDouble () + ((Scalar) that).value);
        throw new EvaluationException ("type mismatch");
    }

    public Type multiply (Type that) throws EvaluationException
    {
        if (that instanceof Rational)
        {
            Rational r = (Rational) that;
            return new Rational (numerator.multiply (r.numerator), denominator.multiply (r.denominator));
        }
        if (that instanceof Scalar) return new Scalar (getDouble () * ((Scalar) that).value);
        throw new EvaluationException ("type mismatch");
    }

    public Type divide (Type that) throws EvaluationException
    {
        if (that instanceof Rational)
        {
            Rational r = (Rational) that;
            return new Rational (numerator.multiply (r.denominator), denominator.multiply (r.numerator));
        }
        if (that instanceof Scalar)
        {
            double d = ((Scalar) that).value;
            if (d == 0) throw new EvaluationException ("Division by zero");
            return new Scalar (getDouble () / d);
        }
        throw new EvaluationException ("type mismatch");
    }

    /**
        Exact when the exponent is an integer. A fractional exponent falls back to floating-point,
        so callers that want exact radicals must handle that case before reaching here.
    **/
    public Type power (Type that) throws EvaluationException
    {
        if (that instanceof Rational)
        {
            Rational r = (Rational) that;
            if (r.isInteger ())
            {
                if (r.numerator.bitLength () > 31) throw new EvaluationException ("Exponent too large: " + r);
                return power (r.numerator.intValue ());
            }
        }
        if (that.isNumber ())
        {
            double result = Math.pow (getDouble (), that.getDouble ());
            if (Double.isNaN (result)) throw new EvaluationException ("Power is not a real number: " + this + "^" + that);
            return new Scalar (result);
        }
        throw new EvaluationException ("type mismatch");
    }

    public Rational power (int n) throws EvaluationException
    {
        if (n >= 0) return new Rational (numerator.pow (n), denominator.pow (n));
        if (isZero ()) throw new EvaluationException ("Division by zero");
        return new Rational (denominator.pow (-n), numerator.pow (-n));
    }

    public Type negate ()
    {
        return new Rational (numerator.negate (), denominator);
    }

    public Type abs ()
    {
        if (numerator.signum () >= 0) return this;
        return negate ();
    }

    public Rational reciprocal () throws EvaluationException
    {
        return new Rational (denominator, numerator);
    }

    /**
        Largest integer not greater than this value.
    **/
    public BigInteger floor ()
    {
        BigInteger[] qr = numerator.divideAndRemainder (denominator);
        if (qr[1].signum () < 0) return qr[0].subtract (BigInteger.ONE);
        return qr[0];
    }

    public int compareTo (Type that)
    {
        if (that instanceof Rational)
        {
            Rational r = (Rational) that;
            return numerator.multiply (r.denominator).compareTo (r.numerator.multiply (denominator));
        }
        if (that instanceof Scalar)
        {
            double a = getDouble ();
            double b = ((Scalar) that).value;
            if (a < b) return -1;
            if (a > b) return 1;
            return 0;
        }
        return -1;  // numbers before text
    }

    public int hashCode ()
    {
        return hashDouble (getDouble ());
    }

    public String toString ()
    {
        if (isInteger ()) return numerator.toString ();
        return numerator + "/" + denominator;
    }
}
