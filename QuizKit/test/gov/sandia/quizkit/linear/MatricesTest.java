/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.Sequence;

import org.junit.Test;

public class MatricesTest
{
    Evaluator ev = Evaluator.standard ();

    @Test
    public void testShapeChecks ()
    {
        try
        {
            Matrices.matrix (new long[][] {{1, 2}, {3}});
            fail ("ragged rows");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            Matrices.matrix (new Operator[][] {});
            fail ("no rows");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            ev.evaluate (new Function (Matrices.MATRIX, Operator.list (number (1)), Operator.list (number (1), number (2))));
            fail ("ragged rows built by hand");
        }
        catch (ConstructionException e)
        {
        }
    }

    @Test
    public void testIndexing ()
    {
        Operator v = Matrices.vector (10, 20, 30);
        Operator A = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        assertEquals (number (20), ev.part (v, 2));
        assertEquals (number (3),  ev.part (A, 2, 1));
        try
        {
            ev.part (v, 4);
            fail ("out of range");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            ev.part (A, 1);
            fail ("a matrix needs two indices");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            ev.apply (Matrices.PART, v, number (1, 2));
            fail ("index must be an integer");
        }
        catch (ConstructionException e)
        {
        }

        // A symbolic index leaves the access unevaluated.
        Operator i = var ("i");
        assertTrue (ev.apply (Matrices.PART, v, i).is (Matrices.PART));
    }

    @Test
    public void testSymbolicEntries ()
    {
        Operator A = Matrices.matrixOf ("a", 2, 3);
        assertEquals ("2x3", Matrices.shape (A));
        assertEquals (new Function (Matrices.PART, var ("a"), number (2), number (3)), Matrices.entry (A, 1, 2));
        Operator v = Matrices.vectorOf ("v", 2);
        assertTrue (Matrices.isVector (v));
        assertEquals (new Function (Matrices.PART, var ("v"), number (1)), ev.part (v, 1));
    }

    @Test
    public void testSet ()
    {
        Function A = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        Function B = Matrices.set (A, number (9), 1, 2);
        assertEquals (Matrices.matrix (new long[][] {{1, 9}, {3, 4}}), B);
        assertEquals (number (2), Matrices.entry (A, 0, 1));  // original untouched
        assertSame    (A.operands[1], B.operands[1]);
        assertNotSame (A.operands[0], B.operands[0]);

        Function v = Matrices.set (Matrices.vector (1, 2, 3), number (0), 3);
        assertEquals (Matrices.vector (1, 2, 0), v);
    }

    @Test
    public void testTransposeAndColumns ()
    {
        Operator A = Matrices.matrix (new long[][] {{1, 2, 3}, {4, 5, 6}});
        Operator T = Matrices.transpose (ev, A);
        assertEquals (Matrices.matrix (new long[][] {{1, 4}, {2, 5}, {3, 6}}), T);
        assertEquals (A, Matrices.transpose (ev, T));

        Operator X = var ("X");
        assertEquals (X, ev.apply (Matrices.TRANSPOSE, ev.apply (Matrices.TRANSPOSE, X)));

        Sequence columns = Matrices.columnVectors (A);
        assertEquals (3, columns.size ());
        assertEquals (Matrices.vector (2, 5), columns.get (1));
    }

    @Test
    public void testArithmetic ()
    {
        Operator A = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        Operator B = Matrices.matrix (new long[][] {{0, 1}, {1, 0}});
        assertEquals (Matrices.matrix (new long[][] {{1, 3}, {4, 4}}),   ev.plus (A, B));
        assertEquals (Matrices.matrix (new long[][] {{2, 4}, {6, 8}}),   ev.times (number (2), A));
        assertEquals (Matrices.matrix (new long[][] {{2, 1}, {4, 3}}),   ev.matTimes (A, B));
        assertEquals (Matrices.matrix (new long[][] {{7, 10}, {15, 22}}), ev.power (A, number (2)));
        assertEquals (Matrices.identity (2), ev.power (B, number (4)));

        try
        {
            ev.plus (A, Matrices.vector (1, 2));
            fail ("shape mismatch");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            ev.matTimes (Matrices.vector (1, 2), Matrices.vector (1, 2));
            fail ("inner dimensions differ");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            ev.times (A, B);
            fail ("scalar product of two matrices");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            ev.power (Matrices.vector (1, 2), number (2));
            fail ("power of a non-square matrix");
        }
        catch (EvaluationException e)
        {
        }
    }

    @Test
    public void testInverse ()
    {
        Operator A = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        Operator inverse = ev.power (A, Constant.MINUS_ONE);
        Operator expected = Matrices.matrix (new Operator[][]
        {
            {number (-2),   number (1)},
            {number (3, 2), number (-1, 2)}
        });
        assertEquals (expected, inverse);
        assertEquals (Matrices.identity (2), ev.matTimes (A, inverse));
        assertEquals (Matrices.identity (2), ev.matTimes (inverse, A));

        try
        {
            Matrices.inverse (ev, Matrices.matrix (new long[][] {{1, 2}, {2, 4}}));
            fail ("singular");
        }
        catch (SingularMatrixException e)
        {
        }
    }
}
