/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.function.AbsoluteValue;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.SquareRoot;
import gov.sandia.quizkit.language.function.Times;

public class Vectors implements RuleTable.Extension
{
    public static final String DOT       = "dot";
    public static final String NORM      = "norm";
    public static final String NORMALIZE = "normalize";
    public static final String CROSS     = "cross";

    public void register (RuleTable table)
    {
        table.declareArity (DOT,       2, 2);
        table.declareArity (NORM,      1, 1);
        table.declareArity (NORMALIZE, 1, 1);
        table.declareArity (CROSS,     2, 2);
        table.register (DOT,       "vector", 2, (f, evaluator) -> bothMatrices (f) ? dot   (evaluator, f.operands[0], f.operands[1]) : null);
        table.register (CROSS,     "vector", 2, (f, evaluator) -> bothMatrices (f) ? cross (evaluator, f.operands[0], f.operands[1]) : null);
        table.register (NORM,      "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? norm      (evaluator, f.operands[0]) : null);
        table.register (NORMALIZE, "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? normalize (evaluator, f.operands[0]) : null);
    }

    protected static boolean bothMatrices (Function f)
    {
        return Matrices.isMatrix (f.operands[0])  &&  Matrices.isMatrix (f.operands[1]);
    }

    protected static void requireVector (Operator v)
    {
        if (! Matrices.isVector (v)) throw new ConstructionException ("Expecting a vector, got a " + Matrices.shape (v) + " matrix");
    }

    /**
        Sum of the products of corresponding entries.
    **/
    public static Operator dot (Evaluator evaluator, Operator u, Operator v)
    {
        requireVector (u);
        requireVector (v);
        int n = Matrices.rows (u);
        if (Matrices.rows (v) != n) throw new ConstructionException ("Dot product of vectors with different lengths (" + n + " and " + Matrices.rows (v) + ")");
        Operator[] terms = new Operator[n];
        for (int i = 0; i < n; i++) terms[i] = new Function (Times.NAME, Matrices.entry (u, i, 0), Matrices.entry (v, i, 0));
        return evaluator.plus (terms);
    }

    /**
        Frobenius norm: square root of the sum of squared absolute values of all entries.
    **/
    public static Operator norm (Evaluator evaluator, Operator A)
    {
        int h = Matrices.rows (A);
        int w = Matrices.columns (A);
        Operator[] terms = new Operator[h * w];
        for (int r = 0; r < h; r++)
        {
            for (int c = 0; c < w; c++)
            {
                terms[r * w + c] = new Function (Power.NAME, new Function (AbsoluteValue.NAME, Matrices.entry (A, r, c)), Operator.number (2));
            }
        }
        return evaluator.apply (SquareRoot.NAME, evaluator.plus (terms));
    }

    /**
        Divides each column by its own norm.
    **/
    public static Operator normalize (Evaluator evaluator, Operator A)
    {
        Operator[][] result = Matrices.toArray (A);
        int w = result[0].length;
        for (int c = 0; c < w; c++)
        {
            Operator n = norm (evaluator, Matrices.columnVectors (A).get (c));
            for (Operator[] row : result) row[c] = evaluator.frac (row[c], n);
        }
        return Matrices.matrix (result);
    }

    public static Operator cross (Evaluator evaluator, Operator u, Operator v)
    {
        if (! Matrices.isVector (u)  ||  Matrices.rows (u) != 3  ||  ! Matrices.isVector (v)  ||  Matrices.rows (v) != 3)
        {
            throw new ConstructionException ("Cross product needs two 3-vectors");
        }
        Operator[] a = new Operator[3];
        Operator[] b = new Operator[3];
        for (int i = 0; i < 3; i++)
        {
            a[i] = Matrices.entry (u, i, 0);
            b[i] = Matrices.entry (v, i, 0);
        }
        Operator[] result = new Operator[3];
        for (int i = 0; i < 3; i++)
        {
            int j = (i + 1) % 3;
            int k = (i + 2) % 3;
            result[i] = evaluator.plus
            (
                new Function (Times.NAME, a[j], b[k]),
                new Function (Times.NAME, Constant.MINUS_ONE, a[k], b[j])
            );
        }
        return Matrices.vector (result);
    }
}
