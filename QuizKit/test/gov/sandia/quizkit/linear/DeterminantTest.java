/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Manipulation;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Times;

import org.junit.Test;

public class DeterminantTest
{
    Evaluator ev = Evaluator.standard ();

    @Test
    public void testDeterminant ()
    {
        assertEquals (Constant.ONE, ev.apply (Determinant.DET, Matrices.identity (3)));
        assertEquals (number (-2),  ev.apply (Determinant.DET, Matrices.matrix (new long[][] {{1, 2}, {3, 4}})));
        assertEquals (number (6),   ev.apply (Determinant.DET, Matrices.matrix (new long[][] {{2, 0, 1}, {1, 3, 2}, {1, 1, 2}})));
        assertEquals (number (5),   ev.apply (Determinant.DET, Matrices.matrix (new long[][] {{5}})));

        // Stays symbolic until it has a matrix to work on.
        Operator A = var ("A");
        assertEquals (new Function (Determinant.DET, A), ev.apply (Determinant.DET, A));

        try
        {
            ev.apply (Determinant.DET, Matrices.matrix (new long[][] {{1, 2, 3}, {4, 5, 6}}));
            fail ("non-square");
        }
        catch (EvaluationException e)
        {
        }
    }

    @Test
    public void testSymbolicDeterminant ()
    {
        Operator A = Matrices.matrixOf ("a", 2, 2);
        Operator d = ev.apply (Determinant.DET, A);
        Operator numeric = Manipulation.replace (ev, d, var ("a"), Matrices.matrix (new long[][] {{1, 2}, {3, 4}}));
        assertEquals (number (-2), numeric);
    }

    @Test
    public void testTrace ()
    {
        assertEquals (number (5), ev.apply (Determinant.TRACE, Matrices.matrix (new long[][] {{1, 2}, {3, 4}})));
    }

    @Test
    public void testCharacteristicPolynomial ()
    {
        Operator A = Matrices.matrix (new long[][] {{2, 0}, {0, 3}});
        Operator t = var ("t");
        Operator expected = new Function
        (
            Plus.NAME,
            new Function (Power.NAME, t, number (2)),
            new Function (Times.NAME, number (-5), t),
            number (6)
        );
        assertEquals (expected, ev.apply (Determinant.CHARPOLY, A));
        assertEquals (expected, ev.apply (Determinant.CHARPOLY, A, t));

        Operator B = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        assertEquals (ev.apply (Determinant.DET, B), ev.apply (Determinant.CHARPOLY, B, Constant.ZERO));
    }

    @Test
    public void testMinorsAndAdjugate ()
    {
        Operator A = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        assertEquals (Matrices.matrix (new long[][] {{4, 3}, {2, 1}}),   ev.apply (Determinant.MINORS, A));
        assertEquals (Matrices.matrix (new long[][] {{4, -2}, {-3, 1}}), ev.apply (Determinant.ADJ,    A));

        Operator single = Matrices.matrix (new long[][] {{7}});
        assertEquals (Matrices.matrix (new long[][] {{1}}), ev.apply (Determinant.MINORS, single));

        // A adj(A) = det(A) I
        Operator product = ev.matTimes (A, ev.apply (Determinant.ADJ, A));
        assertEquals (ev.times (number (-2), Matrices.identity (2)), product);
    }
}
