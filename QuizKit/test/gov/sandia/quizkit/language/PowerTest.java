/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Times;

import org.junit.Test;

public class PowerTest
{
    Evaluator ev = Evaluator.standard ();

    @Test
    public void testIdentities ()
    {
        Operator x = var ("x");
        assertEquals (Constant.ONE, ev.power (x, Constant.ZERO));
        assertEquals (x,            ev.power (x, Constant.ONE));
        assertEquals (Constant.ONE, ev.power (Constant.ONE, x));
        assertEquals (new Function (Power.NAME, x, number (6)), ev.power (ev.power (x, number (2)), number (3)));
    }

    @Test
    public void testExactRoots ()
    {
        assertEquals (number (2),    ev.power (number (8), number (1, 3)));
        assertEquals (number (2, 3), ev.power (number (4, 9), Constant.HALF));
        assertEquals (number (1, 8), ev.power (number (2), number (-3)));

        Operator radical = new Function (Power.NAME, number (2), Constant.HALF);
        assertEquals (new Function (Times.NAME, number (2), radical), ev.power (number (8), Constant.HALF));
        assertEquals (radical, ev.power (number (2), Constant.HALF));
    }

    @Test
    public void testImaginaryUnit ()
    {
        Operator I = Operator.I;
        assertEquals (Constant.MINUS_ONE, ev.power (I, number (2)));
        assertEquals (new Function (Times.NAME, Constant.MINUS_ONE, I), ev.power (I, number (3)));
        assertEquals (Constant.ONE, ev.power (I, number (4)));
        assertEquals (I, ev.power (I, number (5)));
        assertEquals (I, ev.power (Constant.MINUS_ONE, Constant.HALF));
        assertEquals (Constant.MINUS_ONE, ev.times (I, I));
    }

    @Test
    public void testDivisionByZero ()
    {
        assertEquals (Constant.ZERO, ev.power (Constant.ZERO, number (3)));
        try
        {
            ev.frac (1, 0);
            fail ("1/0 should be an error");
        }
        catch (EvaluationException e)
        {
        }
    }

    @Test
    public void testProductPower ()
    {
        Operator x = var ("x");
        Operator y = var ("y");
        Operator r = ev.power (ev.times (number (2), x, y), number (2));
        assertEquals (new Function (Times.NAME, number (4), new Function (Power.NAME, x, number (2)), new Function (Power.NAME, y, number (2))), r);
    }
}
