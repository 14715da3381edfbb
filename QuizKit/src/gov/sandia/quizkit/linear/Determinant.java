/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.Polynomial;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.function.Times;

/**
    Determinant and the quantities built from cofactors: trace, characteristic polynomial,
    matrix of minors, adjugate. Determinants use cofactor expansion along the first column.
    That is exponential in the size of the matrix, which is fine for the small matrices of a quiz.
**/
public class Determinant implements RuleTable.Extension
{
    public static final String DET      = "det";
    public static final String TRACE    = "tr";
    public static final String CHARPOLY = "charpoly";
    public static final String MINORS   = "minors";
    public static final String ADJ      = "adj";

    public void register (RuleTable table)
    {
        table.declareArity (DET,      1, 1);
        table.declareArity (TRACE,    1, 1);
        table.declareArity (CHARPOLY, 1, 2);
        table.declareArity (MINORS,   1, 1);
        table.declareArity (ADJ,      1, 1);

        table.register (DET,      "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? determinant (evaluator, f.operands[0]) : null);
        table.register (TRACE,    "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? trace       (evaluator, f.operands[0]) : null);
        table.register (MINORS,   "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? minors      (evaluator, f.operands[0]) : null);
        table.register (ADJ,      "matrix", 1, (f, evaluator) -> Matrices.isMatrix (f.operands[0]) ? adjugate    (evaluator, f.operands[0]) : null);
        table.register (CHARPOLY, "matrix", 1, 2, (f, evaluator) ->
        {
            if (! Matrices.isMatrix (f.operands[0])) return null;
            Operator x = f.operands.length > 1 ? f.operands[1] : Operator.var ("t");
            return characteristic (evaluator, f.operands[0], x);
        });
    }

    protected static void requireSquare (Operator A, String what)
    {
        if (Matrices.rows (A) != Matrices.columns (A)) throw new EvaluationException (what + " of a non-square matrix (" + Matrices.shape (A) + ")");
    }

    public static Operator determinant (Evaluator evaluator, Operator A)
    {
        requireSquare (A, "Determinant");
        return expand (evaluator, Matrices.toArray (A));
    }

    protected static Operator expand (Evaluator evaluator, Operator[][] rows)
    {
        int n = rows.length;
        if (n == 1) return rows[0][0];
        Operator[] terms = new Operator[n];
        for (int i = 0; i < n; i++)
        {
            Operator[][] sub = new Operator[n-1][];
            for (int r = 0, s = 0; r < n; r++)
            {
                if (r == i) continue;
                Operator[] row = new Operator[n-1];
                System.arraycopy (rows[r], 1, row, 0, n - 1);
                sub[s++] = row;
            }
            Operator sign = i % 2 == 0 ? Constant.ONE : Constant.MINUS_ONE;
            terms[i] = evaluator.times (sign, rows[i][0], expand (evaluator, sub));
        }
        return evaluator.plus (terms);
    }

    /**
        Determinant of A with row i and column j removed. Zero-based.
    **/
    public static Operator minor (Evaluator evaluator, Operator A, int i, int j)
    {
        Operator[][] rows = Matrices.toArray (A);
        int n = rows.length;
        Operator[][] sub = new Operator[n-1][n-1];
        for (int r = 0, s = 0; r < n; r++)
        {
            if (r == i) continue;
            for (int c = 0, t = 0; c < n; c++)
            {
                if (c == j) continue;
                sub[s][t++] = rows[r][c];
            }
            s++;
        }
        return expand (evaluator, sub);
    }

    public static Operator trace (Evaluator evaluator, Operator A)
    {
        requireSquare (A, "Trace");
        int n = Matrices.rows (A);
        Operator[] diagonal = new Operator[n];
        for (int i = 0; i < n; i++) diagonal[i] = Matrices.entry (A, i, i);
        return evaluator.plus (diagonal);
    }

    /**
        Matrix whose (i,j) entry is the minor of A at (i,j). A 1x1 matrix has the single minor 1,
        the determinant of the empty matrix.
    **/
    public static Function minors (Evaluator evaluator, Operator A)
    {
        requireSquare (A, "Minors");
        int n = Matrices.rows (A);
        if (n == 1) return Matrices.matrix (new Operator[][] {{Constant.ONE}});
        Operator[][] result = new Operator[n][n];
        for (int i = 0; i < n; i++)
        {
            for (int j = 0; j < n; j++) result[i][j] = minor (evaluator, A, i, j);
        }
        return Matrices.matrix (result);
    }

    /**
        Transposed cofactor matrix: entry (i,j) is (-1)^(i+j) times the (j,i) minor.
    **/
    public static Function adjugate (Evaluator evaluator, Operator A)
    {
        requireSquare (A, "Adjugate");
        int n = Matrices.rows (A);
        if (n == 1) return Matrices.matrix (new Operator[][] {{Constant.ONE}});
        Operator[][] result = new Operator[n][n];
        for (int i = 0; i < n; i++)
        {
            for (int j = 0; j < n; j++)
            {
                Operator m = minor (evaluator, A, j, i);
                result[i][j] = (i + j) % 2 == 0 ? m : evaluator.negate (m);
            }
        }
        return Matrices.matrix (result);
    }

    /**
        det(A - x I). When x is a variable, the result is collected into a polynomial in x.
    **/
    public static Operator characteristic (Evaluator evaluator, Operator A, Operator x)
    {
        requireSquare (A, "Characteristic polynomial");
        Operator[][] rows = Matrices.toArray (A);
        for (int i = 0; i < rows.length; i++)
        {
            rows[i][i] = evaluator.plus (rows[i][i], new Function (Times.NAME, Constant.MINUS_ONE, x));
        }
        Operator d = expand (evaluator, rows);
        if (x.is (Function.VAR)) d = Polynomial.collect (evaluator, d, x);
        return d;
    }
}
