/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Sequence;

/**
    Gaussian elimination to row-echelon form, or reduced row-echelon form, and the quantities
    read off from it: rank, nullity, pivot positions, and bases for the column and null spaces.
**/
public class RowReduction implements RuleTable.Extension
{
    public static final String RANK    = "rank";
    public static final String NULLITY = "nullity";

    public void register (RuleTable table)
    {
        table.declareArity (RANK,    1, 1);
        table.declareArity (NULLITY, 1, 1);
        table.register (RANK,    "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? Operator.number (rank    (evaluator, f.operands[0])) : null);
        table.register (NULLITY, "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? Operator.number (nullity (evaluator, f.operands[0])) : null);
    }

    protected Evaluator          evaluator;
    protected Operator[][]       mat;
    protected int                rows;
    protected int                columns;
    protected List<RowOperation> steps;  // may be null

    protected RowReduction (Evaluator evaluator, Operator A, List<RowOperation> steps)
    {
        this.evaluator = evaluator;
        this.steps     = steps;
        mat     = Matrices.toArray (A);
        rows    = mat.length;
        columns = mat[0].length;
    }

    /// Required by RuleTable.Extension. Reduction itself goes through the static methods.
    public RowReduction ()
    {
    }

    public static Function rowReduce (Evaluator evaluator, Operator A)
    {
        return rowReduce (evaluator, A, true, null, 0);
    }

    public static Function rowReduce (Evaluator evaluator, Operator A, boolean rref)
    {
        return rowReduce (evaluator, A, rref, null, 0);
    }

    /**
        @param rref Continue to reduced row-echelon form. Otherwise stop at row-echelon form.
        @param steps If not null, receives each elementary row operation as it is applied.
        @param columnBound Only columns before this (1-based count) are used for pivots.
        Zero, or anything past the last column, means all columns.
    **/
    public static Function rowReduce (Evaluator evaluator, Operator A, boolean rref, List<RowOperation> steps, int columnBound)
    {
        RowReduction r = new RowReduction (evaluator, A, steps);
        int bound = columnBound <= 0 ? r.columns : Math.min (columnBound, r.columns);
        r.reduce (rref, bound);
        return Matrices.matrix (r.mat);
    }

    protected void swap (int i, int j)
    {
        Operator[] t = mat[i];
        mat[i] = mat[j];
        mat[j] = t;
        if (steps != null) steps.add (new RowOperation (RowOperation.Kind.SWAP, i + 1, j + 1, null));
    }

    protected void scale (int i, Operator c)
    {
        for (int k = 0; k < columns; k++) mat[i][k] = evaluator.times (mat[i][k], c);
        if (steps != null) steps.add (new RowOperation (RowOperation.Kind.SCALE, i + 1, 0, c));
    }

    /**
        R_i + c R_j -> R_i
    **/
    protected void replace (int i, int j, Operator c)
    {
        for (int k = 0; k < columns; k++) mat[i][k] = evaluator.plus (mat[i][k], evaluator.times (c, mat[j][k]));
        if (steps != null) steps.add (new RowOperation (RowOperation.Kind.REPLACE, i + 1, j + 1, c));
    }

    protected boolean isZeroRow (int i)
    {
        for (Operator e : mat[i]) if (! e.isZero ()) return false;
        return true;
    }

    /**
        Rows below lastNonzero are known to be zero. A zero row met during elimination is swapped
        down to that boundary, and the boundary moves up.
    **/
    protected void reduce (boolean rref, int bound)
    {
        int lastNonzero = rows - 1;
        while (lastNonzero >= 0  &&  isZeroRow (lastNonzero)) lastNonzero--;

        int i = 0;
        int j = 0;
        while (i < rows  &&  j < bound)
        {
            if (isZeroRow (i))
            {
                if (i >= lastNonzero) break;
                swap (i, lastNonzero);
                lastNonzero--;
            }
            if (mat[i][j].isZero ())
            {
                for (int k = i + 1; k <= lastNonzero; k++)
                {
                    if (! mat[k][j].isZero ())
                    {
                        swap (i, k);
                        break;
                    }
                }
            }
            if (mat[i][j].isZero ())
            {
                j++;
                continue;
            }
            if (! mat[i][j].isOne ()) scale (i, evaluator.frac (Constant.ONE, mat[i][j]));
            for (int k = i + 1; k <= lastNonzero; k++)
            {
                if (! mat[k][j].isZero ()) replace (k, i, evaluator.negate (mat[k][j]));
            }
            i++;
            j++;
        }

        if (! rref) return;
        for (i = lastNonzero; i >= 0; i--)
        {
            for (j = 0; j < bound; j++)
            {
                if (mat[i][j].isZero ()) continue;
                // This entry is the leading 1 of row i.
                for (int k = i - 1; k >= 0; k--)
                {
                    if (! mat[k][j].isZero ()) replace (k, i, evaluator.negate (mat[k][j]));
                }
                break;
            }
        }
    }

    public static int rank (Evaluator evaluator, Operator A)
    {
        Operator R = rowReduce (evaluator, A, false);
        int result = 0;
        for (Operator row : ((Function) R).operands)
        {
            for (Operator e : ((Sequence) row).elements)
            {
                if (! e.isZero ())
                {
                    result++;
                    break;
                }
            }
        }
        return result;
    }

    public static int nullity (Evaluator evaluator, Operator A)
    {
        return Matrices.columns (A) - rank (evaluator, A);
    }

    /**
        Zero-based pivot positions of a matrix already in row-echelon form: for each nonzero row,
        the column of its leading entry.
    **/
    protected static List<int[]> leadingEntries (Operator R)
    {
        List<int[]> result = new ArrayList<int[]> ();
        int h = Matrices.rows (R);
        int w = Matrices.columns (R);
        for (int r = 0; r < h; r++)
        {
            for (int c = 0; c < w; c++)
            {
                if (Matrices.entry (R, r, c).isZero ()) continue;
                result.add (new int[] {r, c});
                break;
            }
        }
        return result;
    }

    /**
        @return A list of [row, column] pairs, 1-based.
    **/
    public static Sequence pivots (Evaluator evaluator, Operator A)
    {
        List<Operator> result = new ArrayList<Operator> ();
        for (int[] p : leadingEntries (rowReduce (evaluator, A)))
        {
            result.add (new Sequence (Operator.number (p[0] + 1), Operator.number (p[1] + 1)));
        }
        return new Sequence (result);
    }

    /**
        The pivot columns of A itself.
    **/
    public static Sequence columnBasis (Evaluator evaluator, Operator A)
    {
        Sequence columns = Matrices.columnVectors (A);
        List<Operator> result = new ArrayList<Operator> ();
        for (int[] p : leadingEntries (rowReduce (evaluator, A))) result.add (columns.get (p[1]));
        return new Sequence (result);
    }

    /**
        One vector per free column f: coordinate 1 at f, the negated entry of the reduced form
        at each pivot, 0 elsewhere.
    **/
    public static Sequence nullBasis (Evaluator evaluator, Operator A)
    {
        Operator R = rowReduce (evaluator, A);
        int w = Matrices.columns (R);
        List<int[]> pivots = leadingEntries (R);
        boolean[] isPivot = new boolean[w];
        for (int[] p : pivots) isPivot[p[1]] = true;

        List<Operator> result = new ArrayList<Operator> ();
        for (int f = 0; f < w; f++)
        {
            if (isPivot[f]) continue;
            Operator[] x = new Operator[w];
            for (int c = 0; c < w; c++) x[c] = Constant.ZERO;
            x[f] = Constant.ONE;
            for (int[] p : pivots) x[p[1]] = evaluator.negate (Matrices.entry (R, p[0], f));
            result.add (Matrices.vector (x));
        }
        return new Sequence (result);
    }
}
