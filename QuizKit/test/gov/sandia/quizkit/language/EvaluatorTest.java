/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import gov.sandia.quizkit.language.function.AbsoluteValue;
import gov.sandia.quizkit.language.function.Exp;
import gov.sandia.quizkit.language.function.Log;
import gov.sandia.quizkit.language.function.Numeric;
import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Sine;
import gov.sandia.quizkit.language.function.SquareRoot;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.language.type.Scalar;
import gov.sandia.quizkit.linear.Matrices;

import org.junit.Test;

public class EvaluatorTest
{
    Evaluator ev = Evaluator.standard ();
    Operator  x  = var ("x");
    Operator  y  = var ("y");

    @Test
    public void testExactArithmetic ()
    {
        assertEquals (number (5),    ev.plus (number (2), number (3)));
        assertEquals (number (5, 6), ev.plus (number (1, 2), number (1, 3)));
        assertEquals (number (3, 2), ev.frac (6, 4));
        assertEquals (number (-1, 3), ev.frac (1, -3));
        assertEquals (number (6),    ev.times (number (2), number (3)));
        assertTrue (Constant.isRational (ev.frac (2, 6)));
    }

    @Test
    public void testCollection ()
    {
        assertEquals (new Function (Times.NAME, number (2), x), ev.plus (x, x));
        assertEquals (new Function (Power.NAME, x, number (2)), ev.times (x, x));
        assertEquals (Constant.ZERO, ev.subtract (x, x));
        assertEquals (Constant.ONE,  ev.times (x, ev.power (x, Constant.MINUS_ONE)));

        Operator expected = new Function (Plus.NAME, new Function (Times.NAME, number (2), x), number (1));
        assertEquals (expected, ev.plus (x, number (1), x));
    }

    @Test
    public void testFlattening ()
    {
        Operator nested = new Function (Plus.NAME, x, new Function (Plus.NAME, y, new Function (Plus.NAME, x, number (1))));
        Operator r = ev.evaluate (nested);
        assertTrue (r.is (Plus.NAME));
        for (Operator a : ((Function) r).operands) assertTrue (! a.is (Plus.NAME));
        assertEquals (3, ((Function) r).size ());
    }

    @Test
    public void testFactorOrder ()
    {
        Operator s = new Function (Sine.NAME, x);
        Operator r = ev.times (s, number (2), y);
        assertEquals (new Function (Times.NAME, number (2), y, s), r);
    }

    @Test
    public void testIdempotence ()
    {
        Operator[] samples =
        {
            new Function (Plus.NAME, x, number (1), x),
            new Function (Times.NAME, number (2), new Function (Power.NAME, x, number (3)), x),
            new Function (Power.NAME, new Function (Times.NAME, number (2), x), number (2)),
            new Function (Power.NAME, number (12), Constant.HALF),
            new Function (Exp.NAME, new Function (Log.NAME, y)),
            new Function (Plus.NAME, Matrices.vector (1, 2), Matrices.vector (x, y)),
            Matrices.matrix (new Operator[][] {{x, new Function (Plus.NAME, x, x)}, {number (1, 2), number (4, 2)}})
        };
        for (Operator e : samples)
        {
            Operator once = ev.evaluate (e);
            assertEquals (once, ev.evaluate (once));
        }
    }

    @Test
    public void testLogAndExp ()
    {
        assertEquals (Constant.ZERO, ev.apply (Log.NAME, Constant.ONE));
        assertEquals (Constant.ONE,  ev.apply (Log.NAME, Operator.E));
        assertEquals (x,             ev.apply (Log.NAME, ev.power (Operator.E, x)));
        assertEquals (x,             Exp.exp (ev, new Function (Log.NAME, x)));
        try
        {
            ev.apply (Log.NAME, Constant.ZERO);
            fail ("ln(0) should be an error");
        }
        catch (EvaluationException e)
        {
        }
    }

    @Test
    public void testSquareRootAndAbs ()
    {
        assertEquals (x, ev.power (ev.apply (SquareRoot.NAME, x), number (2)));
        assertEquals (number (3), ev.apply (AbsoluteValue.NAME, number (-3)));
        assertEquals (Operator.E, ev.apply (AbsoluteValue.NAME, Operator.E));
        assertEquals (new Function (AbsoluteValue.NAME, x), ev.apply (AbsoluteValue.NAME, x));
    }

    @Test
    public void testNumeric ()
    {
        Operator r = Numeric.N (ev, ev.frac (1, 4));
        assertTrue (((Constant) r).value instanceof Scalar);
        assertEquals (0.25, ((Constant) r).value.getDouble (), 0);

        r = Numeric.N (ev, ev.apply (SquareRoot.NAME, number (2)));
        assertEquals (Math.sqrt (2), ((Constant) r).value.getDouble (), 1e-12);

        // Indices stay exact, so the entry can still be addressed.
        Operator p = new Function (Matrices.PART, var ("a"), number (1), number (2));
        assertEquals (p, Numeric.N (ev, p));
    }

    @Test
    public void testMatrixPlusScalarStaysSymbolic ()
    {
        Operator r = ev.plus (Matrices.vector (1, 2), x);
        assertTrue (r.is (Plus.NAME));
    }

    @Test
    public void testHead ()
    {
        assertEquals (Operator.NUMBER, Operator.head (number (3)));
        assertEquals (Operator.STRING, Operator.head (Operator.text ("hi")));
        assertEquals (Operator.LIST,   Operator.head (Operator.list (x)));
        assertEquals (Function.VAR,    Operator.head (x));
        assertEquals (Plus.NAME,       Operator.head (ev.plus (x, y)));
    }
}
