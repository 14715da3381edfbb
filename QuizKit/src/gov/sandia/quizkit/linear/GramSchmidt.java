/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Operator;

/**
    Orthogonalizes the columns of A, producing A = Q R with R upper-triangular.
    Without normalization, the columns of Q are orthogonal and R has a unit diagonal.
    With normalization, the columns of Q are orthonormal, and each row of R absorbs the
    norm its column of Q gave up.
**/
public class GramSchmidt
{
    public Operator Q;
    public Operator R;

    public GramSchmidt (Evaluator evaluator, Operator A, boolean normalize)
    {
        int h = Matrices.rows (A);
        int w = Matrices.columns (A);
        Operator[][] q = new Operator[h][w];
        Operator[][] r = new Operator[w][w];
        for (Operator[] row : r) for (int j = 0; j < w; j++) row[j] = Constant.ZERO;

        List<Operator> accepted = new ArrayList<Operator> ();  // orthogonal vectors so far
        List<Operator> lengths2 = new ArrayList<Operator> ();  // their squared lengths
        for (int k = 0; k < w; k++)
        {
            Operator a = Matrices.columnVectors (A).get (k);
            Operator v = a;
            for (int j = 0; j < accepted.size (); j++)
            {
                Operator coefficient = evaluator.frac (Vectors.dot (evaluator, accepted.get (j), a), lengths2.get (j));
                r[j][k] = coefficient;
                v = evaluator.subtract (v, evaluator.times (coefficient, accepted.get (j)));
            }
            boolean zero = true;
            for (int i = 0; i < h; i++) if (! Matrices.entry (v, i, 0).isZero ()) zero = false;
            if (zero) throw new EvaluationException ("Gram-Schmidt needs linearly independent columns, but column " + (k + 1) + " depends on the previous ones");

            r[k][k] = Constant.ONE;
            accepted.add (v);
            lengths2.add (Vectors.dot (evaluator, v, v));
            for (int i = 0; i < h; i++) q[i][k] = Matrices.entry (v, i, 0);
        }

        if (normalize)
        {
            for (int k = 0; k < w; k++)
            {
                Operator n = Vectors.norm (evaluator, accepted.get (k));
                for (int i = 0; i < h; i++) q[i][k] = evaluator.frac (q[i][k], n);
                for (int j = 0; j < w; j++) r[k][j] = evaluator.times (r[k][j], n);
            }
        }

        Q = Matrices.matrix (q);
        R = Matrices.matrix (r);
    }

    public GramSchmidt (Evaluator evaluator, Operator A)
    {
        this (evaluator, A, false);
    }
}
