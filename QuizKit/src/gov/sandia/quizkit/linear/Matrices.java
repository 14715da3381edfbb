/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Sequence;
import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.language.type.Rational;

/**
    Dense symbolic matrices. A matrix is an ordinary node, matrix(row, row, ...), where each row
    is a list of entries. All rows have the same length, and there is at least one row and one
    column. A vector is a matrix with one column. Indices visible to callers are 1-based.
**/
public class Matrices implements RuleTable.Extension
{
    public static final String MATRIX    = "matrix";
    public static final String PART      = "Part";
    public static final String MATTIMES  = "MatTimes";
    public static final String TRANSPOSE = "transpose";

    public void register (RuleTable table)
    {
        table.declareArity (PART,      2, 3);
        table.declareArity (MATTIMES,  2, 2);
        table.declareArity (TRANSPOSE, 1, 1);

        table.register (MATRIX,     "shape",     0, RuleTable.UNBOUNDED, (f, evaluator) -> {checkShape (f.operands); return null;});
        table.register (PART,       "vector",    2, Matrices::partVector);
        table.register (PART,       "matrix",    3, Matrices::partMatrix);
        table.register (TRANSPOSE,  "transpose", 1, Matrices::transpose);
        table.register (Plus.NAME,  "matrix",    0, RuleTable.UNBOUNDED, Matrices::sum);
        table.register (Times.NAME, "matrix",    0, RuleTable.UNBOUNDED, Matrices::scale);
        table.register (MATTIMES,   "product",   2, Matrices::product);
        table.register (Power.NAME, "matrix",    2, Matrices::power);
    }

    // Construction ----------------------------------------------------------

    public static Function matrix (Operator[]... rows)
    {
        Operator[] operands = new Operator[rows.length];
        for (int r = 0; r < rows.length; r++) operands[r] = new Sequence (rows[r]);
        checkShape (operands);
        return new Function (MATRIX, operands);
    }

    public static Function matrix (List<? extends List<? extends Operator>> rows)
    {
        Operator[] operands = new Operator[rows.size ()];
        for (int r = 0; r < operands.length; r++) operands[r] = new Sequence (rows.get (r));
        checkShape (operands);
        return new Function (MATRIX, operands);
    }

    public static Function vector (Operator... elements)
    {
        if (elements.length == 0) throw new ConstructionException ("A vector needs at least one row.");
        Operator[][] rows = new Operator[elements.length][];
        for (int i = 0; i < elements.length; i++) rows[i] = new Operator[] {elements[i]};
        return matrix (rows);
    }

    public static Function vector (long... elements)
    {
        Operator[] e = new Operator[elements.length];
        for (int i = 0; i < e.length; i++) e[i] = Operator.number (elements[i]);
        return vector (e);
    }

    public static Function matrix (long[]... rows)
    {
        Operator[][] e = new Operator[rows.length][];
        for (int r = 0; r < rows.length; r++)
        {
            e[r] = new Operator[rows[r].length];
            for (int c = 0; c < e[r].length; c++) e[r][c] = Operator.number (rows[r][c]);
        }
        return matrix (e);
    }

    public static Function identity (int n)
    {
        if (n <= 0) throw new ConstructionException ("A matrix needs at least one row and one column.");
        Operator[][] rows = new Operator[n][n];
        for (int r = 0; r < n; r++)
        {
            for (int c = 0; c < n; c++) rows[r][c] = r == c ? Constant.ONE : Constant.ZERO;
        }
        return matrix (rows);
    }

    public static Function diagonal (Operator... entries)
    {
        int n = entries.length;
        if (n == 0) throw new ConstructionException ("A matrix needs at least one row and one column.");
        Operator[][] rows = new Operator[n][n];
        for (int r = 0; r < n; r++)
        {
            for (int c = 0; c < n; c++) rows[r][c] = r == c ? entries[r] : Constant.ZERO;
        }
        return matrix (rows);
    }

    /**
        Matrix whose entries are the indexed symbols name_{i,j}.
    **/
    public static Function matrixOf (String name, int rows, int columns)
    {
        if (rows <= 0  ||  columns <= 0) throw new ConstructionException ("A matrix needs at least one row and one column.");
        Operator v = Operator.var (name);
        Operator[][] entries = new Operator[rows][columns];
        for (int r = 0; r < rows; r++)
        {
            for (int c = 0; c < columns; c++) entries[r][c] = new Function (PART, v, Operator.number (r + 1), Operator.number (c + 1));
        }
        return matrix (entries);
    }

    public static Function vectorOf (String name, int n)
    {
        if (n <= 0) throw new ConstructionException ("A vector needs at least one row.");
        Operator v = Operator.var (name);
        Operator[] entries = new Operator[n];
        for (int i = 0; i < n; i++) entries[i] = new Function (PART, v, Operator.number (i + 1));
        return vector (entries);
    }

    public static Function fromArray (Operator[][] entries)
    {
        return matrix (entries);
    }

    /**
        Verifies that operands form a well-shaped matrix: at least one row, every row a list,
        all rows the same nonzero length.
    **/
    public static void checkShape (Operator[] rows)
    {
        if (rows.length == 0) throw new ConstructionException ("A matrix needs at least one row and one column.");
        int width = -1;
        for (Operator row : rows)
        {
            if (! (row instanceof Sequence)) throw new ConstructionException ("Each row of a matrix must be a list, got " + row);
            int w = ((Sequence) row).size ();
            if (width < 0) width = w;
            else if (w != width) throw new ConstructionException ("Not all rows in the matrix have the same length.");
        }
        if (width == 0) throw new ConstructionException ("A matrix needs at least one row and one column.");
    }

    // Inspection ------------------------------------------------------------

    public static boolean isMatrix (Operator e)
    {
        return e.is (MATRIX);
    }

    public static boolean isVector (Operator e)
    {
        return isMatrix (e)  &&  columns (e) == 1;
    }

    protected static Function require (Operator e)
    {
        if (! isMatrix (e)) throw new ConstructionException ("Expecting a matrix, got " + e);
        return (Function) e;
    }

    public static int rows (Operator e)
    {
        return require (e).operands.length;
    }

    public static int columns (Operator e)
    {
        return ((Sequence) require (e).operands[0]).size ();
    }

    /**
        Zero-based access, for use inside this library.
    **/
    public static Operator entry (Operator A, int r, int c)
    {
        return ((Sequence) require (A).operands[r]).elements[c];
    }

    /**
        @return A fresh array holding the entries, which the caller may modify.
    **/
    public static Operator[][] toArray (Operator A)
    {
        Function m = require (A);
        Operator[][] result = new Operator[m.operands.length][];
        for (int r = 0; r < result.length; r++) result[r] = ((Sequence) m.operands[r]).elements.clone ();
        return result;
    }

    public static Sequence columnVectors (Operator A)
    {
        int h = rows (A);
        int w = columns (A);
        Operator[] result = new Operator[w];
        for (int c = 0; c < w; c++)
        {
            Operator[] column = new Operator[h];
            for (int r = 0; r < h; r++) column[r] = entry (A, r, c);
            result[c] = vector (column);
        }
        return new Sequence (result);
    }

    public static String shape (Operator A)
    {
        return rows (A) + "x" + columns (A);
    }

    /**
        Entry assignment. Returns a new matrix that shares every row except the one touched.
        One index addresses a vector, two address a matrix. Indices are 1-based.
    **/
    public static Function set (Operator A, Operator value, int... indices)
    {
        Function m = require (A);
        int r;
        int c;
        if (indices.length == 1)
        {
            if (columns (m) != 1) throw new ConstructionException ("Expecting vector, not matrix");
            r = indices[0];
            c = 1;
            if (r < 1  ||  r > rows (m)) throw new ConstructionException ("Index " + r + " is out of range");
        }
        else if (indices.length == 2)
        {
            r = indices[0];
            c = indices[1];
            if (r < 1  ||  r > rows (m))    throw new ConstructionException ("First index " + r + " is out of range");
            if (c < 1  ||  c > columns (m)) throw new ConstructionException ("Second index " + c + " is out of range");
        }
        else
        {
            throw new ConstructionException ("Expecting either 1 or 2 indices");
        }

        Operator[] operands = m.operands.clone ();
        Operator[] row = ((Sequence) operands[r-1]).elements.clone ();
        row[c-1] = value;
        operands[r-1] = new Sequence (row);
        return new Function (MATRIX, operands);
    }

    // Rules -----------------------------------------------------------------

    protected static int index (Operator idx, String which)
    {
        if (! Constant.isInteger (idx)) throw new ConstructionException ("Expecting integer for " + which + "index, not " + idx);
        Rational r = Constant.rational (idx);
        if (r.numerator.bitLength () > 31) throw new ConstructionException ("Index " + idx + " is out of range");
        return r.numerator.intValue ();
    }

    public static Operator partVector (Function f, Evaluator evaluator)
    {
        Operator e   = f.operands[0];
        Operator idx = f.operands[1];
        if (! isMatrix (e)  ||  idx instanceof Function) return null;
        int i = index (idx, "");
        if (columns (e) != 1) throw new ConstructionException ("Need two indices to index a matrix, not one.");
        if (i < 1  ||  i > rows (e)) throw new ConstructionException ("Index " + i + " is out of bounds for vector of length " + rows (e) + ".");
        return entry (e, i - 1, 0);
    }

    public static Operator partMatrix (Function f, Evaluator evaluator)
    {
        Operator e = f.operands[0];
        if (! isMatrix (e)  ||  f.operands[1] instanceof Function  ||  f.operands[2] instanceof Function) return null;
        int r = index (f.operands[1], "first ");
        int c = index (f.operands[2], "second ");
        if (r < 1  ||  r > rows (e))    throw new ConstructionException ("First index " + r + " is out of bounds for matrix with " + rows (e) + " rows.");
        if (c < 1  ||  c > columns (e)) throw new ConstructionException ("Second index " + c + " is out of bounds for matrix with " + columns (e) + " columns.");
        return entry (e, r - 1, c - 1);
    }

    public static Operator transpose (Function f, Evaluator evaluator)
    {
        Operator A = f.operands[0];
        if (A.is (TRANSPOSE)) return ((Function) A).operands[0];
        if (! isMatrix (A)) return null;
        int h = rows (A);
        int w = columns (A);
        Operator[][] result = new Operator[w][h];
        for (int r = 0; r < h; r++)
        {
            for (int c = 0; c < w; c++) result[c][r] = entry (A, r, c);
        }
        return matrix (result);
    }

    public static Operator transpose (Evaluator evaluator, Operator A)
    {
        return evaluator.apply (TRANSPOSE, A);
    }

    /**
        Adds together all the matrix operands of a sum. Scalar operands stay beside the result,
        since a scalar plus a matrix has no meaning here.
    **/
    public static Operator sum (Function f, Evaluator evaluator)
    {
        Operator[][] total = null;
        int count = 0;
        int position = 0;
        List<Operator> rest = new ArrayList<Operator> ();
        for (Operator op : f.operands)
        {
            if (! isMatrix (op))
            {
                rest.add (op);
                continue;
            }
            count++;
            if (total == null)
            {
                total = toArray (op);
                position = rest.size ();
                continue;
            }
            if (rows (op) != total.length  ||  columns (op) != total[0].length)
            {
                throw new ConstructionException ("Cannot add matrices of shapes " + total.length + "x" + total[0].length + " and " + shape (op));
            }
            for (int r = 0; r < total.length; r++)
            {
                for (int c = 0; c < total[r].length; c++) total[r][c] = evaluator.plus (total[r][c], entry (op, r, c));
            }
        }
        if (count < 2) return null;
        Function result = matrix (total);
        if (rest.isEmpty ()) return result;
        rest.add (position, result);
        return new Function (Plus.NAME, rest);
    }

    /**
        Scalar multiple of a matrix. Two matrices in one product are an error, because the
        matrix product is MatTimes.
    **/
    public static Operator scale (Function f, Evaluator evaluator)
    {
        Operator matrix = null;
        List<Operator> scalars = new ArrayList<Operator> ();
        for (Operator op : f.operands)
        {
            if (isMatrix (op))
            {
                if (matrix != null) throw new ConstructionException ("Use MatTimes for the product of two matrices");
                matrix = op;
            }
            else
            {
                scalars.add (op);
            }
        }
        if (matrix == null) return null;
        if (scalars.isEmpty ()) return matrix;

        Operator c = evaluator.times (scalars.toArray (new Operator[scalars.size ()]));
        Operator[][] result = toArray (matrix);
        for (Operator[] row : result)
        {
            for (int j = 0; j < row.length; j++) row[j] = evaluator.times (c, row[j]);
        }
        return matrix (result);
    }

    public static Operator product (Function f, Evaluator evaluator)
    {
        Operator A = f.operands[0];
        Operator B = f.operands[1];
        if (! isMatrix (A)  ||  ! isMatrix (B)) return null;
        return multiply (evaluator, A, B);
    }

    public static Function multiply (Evaluator evaluator, Operator A, Operator B)
    {
        int n = columns (A);
        if (n != rows (B)) throw new ConstructionException ("Number of columns of first argument does not equal number of rows of second argument (" + shape (A) + " times " + shape (B) + ")");
        int h = rows (A);
        int w = columns (B);
        Operator[][] result = new Operator[h][w];
        for (int r = 0; r < h; r++)
        {
            for (int c = 0; c < w; c++)
            {
                Operator[] terms = new Operator[n];
                for (int k = 0; k < n; k++) terms[k] = new Function (Times.NAME, entry (A, r, k), entry (B, k, c));
                result[r][c] = evaluator.plus (terms);
            }
        }
        return matrix (result);
    }

    /**
        Integer power by repeated squaring. A negative power inverts the positive power.
    **/
    public static Operator power (Function f, Evaluator evaluator)
    {
        Operator A = f.operands[0];
        if (! isMatrix (A)  ||  ! Constant.isInteger (f.operands[1])) return null;
        Rational n = Constant.rational (f.operands[1]);
        if (n.isOne ()) return A;
        if (rows (A) != columns (A)) throw new EvaluationException ("Power of a non-square matrix (" + shape (A) + ")");
        if (n.numerator.bitLength () > 31) throw new EvaluationException ("Matrix exponent too large: " + n);

        int k = n.numerator.intValue ();
        Operator result = identity (rows (A));
        Operator base = A;
        for (int e = Math.abs (k); e > 0; e >>= 1)
        {
            if ((e & 1) != 0) result = multiply (evaluator, result, base);
            if (e > 1) base = multiply (evaluator, base, base);
        }
        if (k < 0) result = inverse (evaluator, result);
        return result;
    }

    /**
        adj(A) / det(A)
    **/
    public static Operator inverse (Evaluator evaluator, Operator A)
    {
        if (rows (A) != columns (A)) throw new EvaluationException ("Taking the inverse of a non-square matrix (" + shape (A) + ")");
        Operator d = Determinant.determinant (evaluator, A);
        if (d.isZero ()) throw new SingularMatrixException ("Taking the inverse of a singular matrix");
        Operator[][] result = toArray (Determinant.adjugate (evaluator, A));
        for (Operator[] row : result)
        {
            for (int j = 0; j < row.length; j++) row[j] = evaluator.frac (row[j], d);
        }
        return matrix (result);
    }
}
