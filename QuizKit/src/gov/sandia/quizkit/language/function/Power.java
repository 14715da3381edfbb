/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Type;
import gov.sandia.quizkit.language.type.Rational;
import gov.sandia.quizkit.language.type.Scalar;

/**
    Powers, including the exact treatment of rational bases and exponents.
**/
public class Power implements RuleTable.Extension
{
    public static final String NAME = "Pow";

    /// Radicands with more bits than this are not factored. They are kept whole under the radical.
    public static final int FACTOR_BITS = 40;

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 2, 2);
        table.register (NAME, "constants",    2, Power::constants);
        table.register (NAME, "powerOfPower", 2, Power::powerOfPower);
        table.register (NAME, "product",      2, Power::product);
        table.register (NAME, "expLog",       2, Power::expLog);
        table.register (NAME, "negativeBase", 2, Power::negativeBase);
        table.register (NAME, "imaginary",    2, Power::imaginary);
    }

    public static boolean isIntegral (Type value)
    {
        if (value instanceof Rational) return ((Rational) value).isInteger ();
        if (value instanceof Scalar)   return ((Scalar)   value).isInteger ();
        return false;
    }

    /**
        x^0 = 1, x^1 = x, 1^x = 1, and arithmetic on numeric operands. Integer powers of exact
        numbers stay exact. Rational powers of positive rationals are split into an exact leading
        factor and a residual radical.
    **/
    public static Operator constants (Function f, Evaluator evaluator)
    {
        Operator a = f.operands[0];
        Operator b = f.operands[1];
        if (b.isZero ()) return Constant.ONE;
        if (b.isOne ()) return a;
        if (a.isOne ()) return Constant.ONE;
        if (! a.isNumber ()  ||  ! b.isNumber ()) return null;

        Type x = ((Constant) a).value;
        Type y = ((Constant) b).value;
        if (x.isZero ())
        {
            if (y.signum () > 0) return a;
            throw new EvaluationException ("Division by zero: 0 raised to a negative power");
        }
        if (isIntegral (y)) return Constant.of (x.power (y));
        if (x.signum () < 0) return null;  // See negativeBase()
        if (x instanceof Rational  &&  y instanceof Rational) return radical ((Rational) x, (Rational) y);
        return Constant.of (x.power (y));
    }

    /**
        Computes x^y exactly for positive rational x and non-integer rational y.
        Each prime p in x contributes p^(e*y). The integer part of each exponent moves into the
        leading factor, and the fractional remainders combine into a single radical R^(1/g),
        where g is the least common denominator of the remainders.
    **/
    public static Operator radical (Rational x, Rational y)
    {
        Map<BigInteger,Rational> exponents = new TreeMap<BigInteger,Rational> ();
        factor (x.numerator,   y,                     exponents);
        factor (x.denominator, (Rational) y.negate (), exponents);

        Rational   leading = Rational.ONE;
        BigInteger g       = BigInteger.ONE;
        Map<BigInteger,Rational> remainders = new TreeMap<BigInteger,Rational> ();
        for (Map.Entry<BigInteger,Rational> e : exponents.entrySet ())
        {
            Rational   exponent = e.getValue ();
            BigInteger whole    = exponent.floor ();
            if (whole.bitLength () > 31) throw new EvaluationException ("Exponent too large: " + exponent);
            leading = (Rational) leading.multiply (new Rational (e.getKey ()).power (whole.intValue ()));
            Rational rest = (Rational) exponent.subtract (new Rational (whole));
            if (rest.isZero ()) continue;
            remainders.put (e.getKey (), rest);
            g = lcm (g, rest.denominator);
        }

        BigInteger radicand = BigInteger.ONE;
        for (Map.Entry<BigInteger,Rational> e : remainders.entrySet ())
        {
            Rational k = (Rational) e.getValue ().multiply (new Rational (g));
            radicand = radicand.multiply (e.getKey ().pow (k.intValue ()));
        }

        if (radicand.equals (BigInteger.ONE)) return Constant.of (leading);
        Operator root = new Function (NAME, new Constant (new Rational (radicand)), new Constant (new Rational (BigInteger.ONE, g)));
        if (leading.isOne ()) return root;
        return new Function (Times.NAME, Constant.of (leading), root);
    }

    protected static void factor (BigInteger n, Rational exponent, Map<BigInteger,Rational> exponents)
    {
        if (n.equals (BigInteger.ONE)) return;
        if (n.bitLength () > FACTOR_BITS)
        {
            accumulate (n, exponent, exponents);
            return;
        }
        long m = n.longValue ();
        for (long p = 2; p * p <= m; p++)
        {
            int count = 0;
            while (m % p == 0)
            {
                m /= p;
                count++;
            }
            if (count > 0) accumulate (BigInteger.valueOf (p), (Rational) exponent.multiply (new Rational (count)), exponents);
        }
        if (m > 1) accumulate (BigInteger.valueOf (m), exponent, exponents);
    }

    protected static void accumulate (BigInteger p, Rational exponent, Map<BigInteger,Rational> exponents)
    {
        Rational current = exponents.get (p);
        if (current == null) exponents.put (p, exponent);
        else                 exponents.put (p, (Rational) current.add (exponent));
    }

    protected static BigInteger lcm (BigInteger a, BigInteger b)
    {
        return a.divide (a.gcd (b)).multiply (b);
    }

    /**
        (a^b)^c = a^(b*c)
    **/
    public static Operator powerOfPower (Function f, Evaluator evaluator)
    {
        Operator a = f.operands[0];
        if (! Function.is (a, NAME, 2)) return null;
        Function inner = (Function) a;
        return new Function (NAME, inner.operands[0], new Function (Times.NAME, inner.operands[1], f.operands[1]));
    }

    /**
        (a*b)^n = a^n * b^n for integer n.
    **/
    public static Operator product (Function f, Evaluator evaluator)
    {
        Operator a = f.operands[0];
        if (! a.is (Times.NAME)  ||  ! Constant.isInteger (f.operands[1])) return null;
        Operator[] factors = ((Function) a).operands;
        Operator[] result = new Operator[factors.length];
        for (int i = 0; i < factors.length; i++) result[i] = new Function (NAME, factors[i], f.operands[1]);
        return new Function (Times.NAME, result);
    }

    /**
        E^ln(x) = x
    **/
    public static Operator expLog (Function f, Evaluator evaluator)
    {
        if (! f.operands[0].equals (Operator.E)) return null;
        Operator b = f.operands[1];
        if (! Function.is (b, Log.NAME, 1)) return null;
        return ((Function) b).operands[0];
    }

    /**
        (-x)^y = (-1)^y * x^y for a negative number -x and fractional y.
    **/
    public static Operator negativeBase (Function f, Evaluator evaluator)
    {
        Operator a = f.operands[0];
        Operator b = f.operands[1];
        if (! a.isNumber ()  ||  ! b.isNumber ()) return null;
        Type x = ((Constant) a).value;
        if (x.signum () >= 0  ||  x.equals (Rational.MINUS_ONE)) return null;
        if (isIntegral (((Constant) b).value)) return null;
        return new Function
        (
            Times.NAME,
            new Function (NAME, Constant.MINUS_ONE, b),
            new Function (NAME, Constant.of (x.abs ()), b)
        );
    }

    /**
        (-1)^(p/2) = I^p, and integer powers of I reduce by the cycle I, -1, -I, 1.
    **/
    public static Operator imaginary (Function f, Evaluator evaluator)
    {
        Operator a = f.operands[0];
        Rational b = Constant.rational (f.operands[1]);
        if (b == null) return null;

        if (a.equals (Constant.MINUS_ONE)  &&  b.denominator.equals (BigInteger.TWO))
        {
            return new Function (NAME, Operator.I, new Constant (new Rational (b.numerator)));
        }
        if (a.equals (Operator.I)  &&  b.isInteger ())
        {
            switch (b.numerator.mod (BigInteger.valueOf (4)).intValue ())
            {
                case 0:  return Constant.ONE;
                case 1:  return Operator.I;
                case 2:  return Constant.MINUS_ONE;
                default: return new Function (Times.NAME, Constant.MINUS_ONE, Operator.I);
            }
        }
        return null;
    }
}
