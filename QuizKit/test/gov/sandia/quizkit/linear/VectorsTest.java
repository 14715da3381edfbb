/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Operator;

import org.junit.Test;

public class VectorsTest
{
    Evaluator ev = Evaluator.standard ();
    Operator  u  = Matrices.vector (1, 2, 3);
    Operator  v  = Matrices.vector (4, 5, 6);
    Operator  w  = Matrices.vector (7, 8, 10);

    @Test
    public void testDotAndNorm ()
    {
        assertEquals (number (32), ev.apply (Vectors.DOT, u, v));
        assertEquals (number (5),  ev.apply (Vectors.NORM, Matrices.vector (3, 4)));
        assertEquals (Matrices.vector (new Operator[] {number (3, 5), number (4, 5)}), ev.apply (Vectors.NORMALIZE, Matrices.vector (3, 4)));
        try
        {
            Vectors.dot (ev, u, Matrices.vector (1, 2));
            fail ("lengths differ");
        }
        catch (ConstructionException e)
        {
        }
    }

    @Test
    public void testCross ()
    {
        assertEquals (Matrices.vector (0, 0, 1), ev.apply (Vectors.CROSS, Matrices.vector (1, 0, 0), Matrices.vector (0, 1, 0)));
        Operator c = ev.apply (Vectors.CROSS, u, v);
        assertEquals (Constant.ZERO, Vectors.dot (ev, c, u));
        assertEquals (Constant.ZERO, Vectors.dot (ev, c, v));
        try
        {
            ev.apply (Vectors.CROSS, Matrices.vector (1, 2), Matrices.vector (3, 4));
            fail ("cross needs 3-vectors");
        }
        catch (ConstructionException e)
        {
        }
    }

    @Test
    public void testTripleProduct ()
    {
        Operator M = BlockMatrix.withColumns (ev, u, v, w);
        Operator det = ev.apply (Determinant.DET, M);
        assertEquals (number (-3), det);
        assertEquals (det, Vectors.dot (ev, u, Vectors.cross (ev, v, w)));
    }
}
