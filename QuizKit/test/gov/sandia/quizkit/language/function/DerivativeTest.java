/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.list;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import java.util.Arrays;
import java.util.Collections;

import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Manipulation;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.linear.Matrices;

import org.junit.Test;

public class DerivativeTest
{
    Evaluator ev = Evaluator.standard ();
    Operator  x  = var ("x");
    Operator  y  = var ("y");
    Operator  t  = var ("t");

    protected double at (Operator e, Operator v, long value)
    {
        Operator r = Numeric.N (ev, Manipulation.replace (ev, e, v, number (value)));
        return ((Constant) r).value.getDouble ();
    }

    @Test
    public void testPolynomial ()
    {
        assertEquals (new Function (Times.NAME, number (3), new Function (Power.NAME, x, number (2))), Derivative.D (ev, ev.power (x, number (3)), x));
        assertEquals (Constant.ONE,  Derivative.D (ev, x, x));
        assertEquals (Constant.ZERO, Derivative.D (ev, number (5), x));
        assertEquals (Constant.ZERO, Derivative.D (ev, Operator.E, x));
        assertEquals (number (6),    Derivative.D (ev, ev.power (x, number (3)), list (x, number (3))));
        assertEquals (Constant.ZERO, Derivative.D (ev, x, list (x, number (2))));
    }

    @Test
    public void testTrig ()
    {
        assertEquals (new Function (Cosine.NAME, x), Derivative.D (ev, new Function (Sine.NAME, x), x));
        assertEquals (new Function (Times.NAME, Constant.MINUS_ONE, new Function (Sine.NAME, x)), Derivative.D (ev, new Function (Cosine.NAME, x), x));
        assertEquals (new Function (Power.NAME, x, Constant.MINUS_ONE), Derivative.D (ev, new Function (Log.NAME, x), x));
    }

    @Test
    public void testProductAndChainRule ()
    {
        Operator e = ev.times (ev.power (x, number (2)), new Function (Sine.NAME, x));
        Operator d = Derivative.D (ev, e, x);
        double expected = 2 * 2 * Math.sin (2) + 4 * Math.cos (2);
        assertEquals (expected, at (d, x, 2), 1e-12);

        Operator chain = new Function (Sine.NAME, ev.power (x, number (2)));
        d = Derivative.D (ev, chain, x);
        assertEquals (2 * 3 * Math.cos (9), at (d, x, 3), 1e-12);

        Operator exponential = Exp.exp (ev, ev.times (number (3), x));
        d = Derivative.D (ev, exponential, x);
        assertEquals (3 * Math.exp (3), at (d, x, 1), 1e-9);
    }

    @Test
    public void testDependentVariableStaysSymbolic ()
    {
        Operator d = Derivative.D (ev, y, t);
        assertTrue (d.is (Derivative.NAME));
        assertEquals (y, ((Function) d).operands[0]);

        // Declaring y constant makes its derivative vanish.
        Operator zero = Derivative.D (ev, y, Arrays.asList (t), Arrays.asList (y));
        assertEquals (Constant.ZERO, zero);

        // Independent variables listed with order 0 don't depend on the others.
        assertEquals (Constant.ZERO, Derivative.D (ev, x, list (x, Constant.ZERO), t));
    }

    @Test
    public void testNumericKeepsOrdersExact ()
    {
        Operator d = Derivative.D (ev, y, t);
        assertEquals (d, Numeric.N (ev, d));

        Operator scaled = ev.times (number (3, 2), d);
        assertEquals (ev.times (number (1.5), d), Numeric.N (ev, scaled));
    }

    @Test
    public void testRepeatedVariablesMerge ()
    {
        Operator d = Derivative.D (ev, y, t, t);
        Function f = (Function) d;
        assertEquals (list (list (t, number (2))), f.operands[1]);

        // Differentiating an unevaluated derivative again joins the requests.
        Operator again = Derivative.D (ev, d, t);
        assertEquals (list (list (t, number (3))), ((Function) again).operands[1]);
    }

    @Test
    public void testSumIsLinear ()
    {
        Operator e = ev.plus (ev.power (x, number (2)), ev.times (number (5), x), number (7));
        Operator d = Derivative.D (ev, e, x);
        assertEquals (new Function (Plus.NAME, new Function (Times.NAME, number (2), x), number (5)), d);
    }

    @Test
    public void testPartPassesThrough ()
    {
        Operator v = Matrices.vector (ev.power (x, number (2)), ev.times (number (3), x));
        Operator d = Derivative.D (ev, new Function (Matrices.PART, v, number (2)), x);
        assertEquals (number (3), d);
    }

    @Test
    public void testBadSpecs ()
    {
        try
        {
            Derivative.D (ev, x, list (x, number (1, 2)));
            fail ("fractional order");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            Derivative.D (ev, x, list (x, number (-1)));
            fail ("negative order");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            Derivative.D (ev, x, number (3));
            fail ("not a variable");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            Derivative.D (ev, x, Collections.<Operator>singletonList (x), Collections.<Operator>singletonList (number (1)));
            fail ("constants must be variables");
        }
        catch (ConstructionException e)
        {
        }
    }
}
