/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.var;

import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Manipulation;
import gov.sandia.quizkit.language.Operator;

import org.junit.Test;

public class BlockMatrixTest
{
    Evaluator ev = Evaluator.standard ();

    @Test
    public void testFlatten ()
    {
        Operator A = Matrices.matrix (new long[][] {{1, 2}, {3, 4}});
        Operator v = Matrices.vector (5, 6);
        assertEquals (Matrices.matrix (new long[][] {{1, 2, 5}, {3, 4, 6}}), BlockMatrix.withColumns (ev, A, v));
        assertEquals (Matrices.matrix (new long[][] {{1, 2}, {3, 4}, {7, 8}}), BlockMatrix.withRows (ev, A, Matrices.matrix (new long[][] {{7, 8}})));

        Operator B = ev.evaluate (BlockMatrix.blockMatrix
        (
            new Operator[] {A, v},
            new Operator[] {Matrices.matrix (new long[][] {{7, 8}}), Matrices.vector (9)}
        ));
        assertEquals (Matrices.matrix (new long[][] {{1, 2, 5}, {3, 4, 6}, {7, 8, 9}}), B);
    }

    @Test
    public void testSymbolicBlockWaits ()
    {
        Operator X = var ("X");
        Operator v = Matrices.vector (5, 6);
        Operator B = BlockMatrix.withColumns (ev, X, v);
        assertTrue (B.is (BlockMatrix.NAME));

        Operator filled = Manipulation.replace (ev, B, X, Matrices.identity (2));
        assertEquals (Matrices.matrix (new long[][] {{1, 0, 5}, {0, 1, 6}}), filled);
    }

    @Test
    public void testMismatchedBlocks ()
    {
        try
        {
            BlockMatrix.withColumns (ev, Matrices.identity (2), Matrices.vector (1, 2, 3));
            fail ("heights differ");
        }
        catch (ConstructionException e)
        {
        }
        try
        {
            BlockMatrix.blockMatrix (new Operator[] {var ("X")}, new Operator[] {var ("Y"), var ("Z")});
            fail ("block rows of different lengths");
        }
        catch (ConstructionException e)
        {
        }
    }
}
