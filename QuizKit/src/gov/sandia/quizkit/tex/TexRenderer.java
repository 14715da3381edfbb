/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/


package gov.sandia.quizkit.tex;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.Renderer;
import gov.sandia.quizkit.language.Sequence;
import gov.sandia.quizkit.language.function.AbsoluteValue;
import gov.sandia.quizkit.language.function.Cosine;
import gov.sandia.quizkit.language.function.Derivative;
import gov.sandia.quizkit.language.function.Log;
import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Sine;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.language.type.Rational;
import gov.sandia.quizkit.language.type.Text;
import gov.sandia.quizkit.linear.BlockMatrix;
import gov.sandia.quizkit.linear.Matrices;

/**
    Renders an expression as TeX math markup.

    Each rendering routine receives the precedence of the enclosing context and adds
    parentheses only when that precedence exceeds the precedence of what it produces.
    The "small" flag marks compact contexts (exponents, subscripts, matrix cells), where
    fractions are written inline with a slash.
**/
public class TexRenderer extends Renderer
{
    public static final int SUM       = 20;
    public static final int PRODUCT   = 30;
    public static final int SLASH     = 35;
    public static final int FRACTION  = 40;
    public static final int POWER     = 49;  ///< of the result of raising to a power
    public static final int BASE      = 50;  ///< required of the base of a power
    public static final int SUBSCRIPT = 60;
    public static final int TIGHT     = 1000;

    public RenderPolicy policy;
    public Evaluator    evaluator;  ///< for summing symbolic derivative orders

    public TexRenderer ()
    {
        this (RenderPolicy.shared ());
    }

    public TexRenderer (RenderPolicy policy)
    {
        this.policy = policy;
        evaluator   = Evaluator.standard ();
    }

    public TexRenderer (RenderPolicy policy, StringBuilder result)
    {
        super (result);
        this.policy = policy;
        evaluator   = Evaluator.standard ();
    }

    public boolean render (Operator op)
    {
        result.append (tex (op));
        return true;
    }

    public String tex (Operator e)
    {
        return tex (0, e, false);
    }

    public static String parens (int outer, int inner, String text)
    {
        if (outer > inner) return "\\left(" + text + "\\right)";
        return text;
    }

    public String tex (int prec, Operator e, boolean small)
    {
        if (e instanceof Constant) return constant (prec, (Constant) e, small);
        if (e instanceof Sequence)
        {
            return "\\left[" + join (",", ((Sequence) e).elements, 0, small) + "\\right]";
        }

        Function f = (Function) e;
        switch (f.name)
        {
            case Function.VAR:
            case Function.CONST:
                return "{" + Function.symbolName (f) + "}";
            case Plus.NAME:
                return sum (prec, f, small);
            case Times.NAME:
                return product (prec, f, small);
            case Power.NAME:
                return power (prec, f, small);
            case Matrices.MATTIMES:
                return parens (prec, PRODUCT, join ("", f.operands, PRODUCT, small));
            case Matrices.PART:
            {
                String indices = join (",", f.operands, 1, f.operands.length, 0, true);
                return parens (prec, SUBSCRIPT, tex (SUBSCRIPT, f.operands[0], small) + "_{" + indices + "}");
            }
            case Matrices.TRANSPOSE:
                return parens (prec, POWER, tex (BASE, f.operands[0], small) + "^{T}");
            case Matrices.MATRIX:
                return matrix (f);
            case BlockMatrix.NAME:
                return blockMatrix (f);
            case Derivative.NAME:
                return derivative (prec, f, small);
            case AbsoluteValue.NAME:
                if (f.operands.length != 1) break;
                return "\\left|" + tex (0, f.operands[0], small) + "\\right|";
            case Log.NAME:
            case Sine.NAME:
            case Cosine.NAME:
                if (f.operands.length != 1) break;
                return "\\" + f.name + "\\left(" + tex (0, f.operands[0], small) + "\\right)";
        }
        return "\\operatorname{" + f.name + "}(" + join (", ", f.operands, 0, small) + ")";
    }

    protected String join (String separator, Operator[] items, int prec, boolean small)
    {
        return join (separator, items, 0, items.length, prec, small);
    }

    protected String join (String separator, Operator[] items, int begin, int end, int prec, boolean small)
    {
        StringBuilder b = new StringBuilder ();
        for (int i = begin; i < end; i++)
        {
            if (i > begin) b.append (separator);
            b.append (tex (prec, items[i], small));
        }
        return b.toString ();
    }

    // Leaves ----------------------------------------------------------------

    public String constant (int prec, Constant c, boolean small)
    {
        if (c.value instanceof Text) return "\\text{" + c.value + "}";
        if (c.value.signum () < 0)
        {
            // Negative numbers bind like a unary minus.
            return parens (prec, SUM, "-" + constant (0, Constant.of (c.value.negate ()), small));
        }
        if (c.value instanceof Rational)
        {
            Rational r = (Rational) c.value;
            if (r.isInteger ()) return r.numerator.toString ();
            if (small) return parens (prec, SLASH, r.numerator + "/" + r.denominator);
            return parens (prec, FRACTION, "\\tfrac{" + r.numerator + "}{" + r.denominator + "}");
        }
        return c.value.toString ();
    }

    // Arithmetic ------------------------------------------------------------

    public String sum (int prec, Function f, boolean small)
    {
        StringBuilder text = new StringBuilder ();
        for (int i = 0; i < f.operands.length; i++)
        {
            Operator a = f.operands[i];
            Operator coefficient;
            Operator rest;
            if (a.is (Times.NAME)  &&  ((Function) a).operands.length >= 2  &&  ((Function) a).operands[0].isNumber ())
            {
                Function t = (Function) a;
                coefficient = t.operands[0];
                if (t.operands.length == 2)
                {
                    rest = t.operands[1];
                }
                else
                {
                    Operator[] factors = new Operator[t.operands.length - 1];
                    System.arraycopy (t.operands, 1, factors, 0, factors.length);
                    rest = new Function (Times.NAME, factors);
                }
            }
            else if (a.isNumber ())
            {
                coefficient = a;
                rest        = null;
            }
            else
            {
                coefficient = Constant.ONE;
                rest        = a;
            }

            String op = i == 0 ? "" : " + ";
            if (Constant.signum (coefficient) < 0)
            {
                op = i == 0 ? "-" : " - ";
                coefficient = Constant.of (((Constant) coefficient).value.negate ());
            }

            text.append (op);
            if      (rest == null)            text.append (tex (SUM,     coefficient, small));
            else if (coefficient.isOne ())    text.append (tex (SUM,     rest,        small));
            else                              text.append (tex (PRODUCT, coefficient, small)).append (tex (PRODUCT, rest, small));
        }
        if (text.length () == 0) return "0";
        return parens (prec, SUM, text.toString ());
    }

    public String product (int prec, Function f, boolean small)
    {
        List<Operator[]> numerator   = new ArrayList<Operator[]> ();
        List<Operator[]> denominator = new ArrayList<Operator[]> ();
        boolean negative = false;
        for (Operator a : f.operands)
        {
            Operator base     = a;
            Operator exponent = Constant.ONE;
            if (a.is (Power.NAME))
            {
                base     = ((Function) a).operands[0];
                exponent = ((Function) a).operands[1];
            }
            if (exponent.isNumber ()  &&  Constant.signum (exponent) < 0)
            {
                denominator.add (new Operator[] {base, Constant.of (((Constant) exponent).value.negate ())});
            }
            else if (exponent.isOne ()  &&  base.isNumber ()  &&  Constant.signum (base) < 0)
            {
                negative = true;
                Constant magnitude = Constant.of (((Constant) base).value.negate ());
                if (! magnitude.isOne ()) numerator.add (new Operator[] {magnitude, exponent});
            }
            else
            {
                numerator.add (new Operator[] {base, exponent});
            }
        }

        if (denominator.isEmpty ())
        {
            String top = numerator.isEmpty () ? "1" : factors (numerator, numerator.size () > 1 ? PRODUCT : (negative ? PRODUCT : prec), small);
            if (negative) return parens (prec, SUM, "-" + top);
            return top;
        }

        String text;
        if (small)
        {
            String top    = numerator.isEmpty () ? "1" : factors (numerator, numerator.size () > 1 ? PRODUCT : SLASH, small);
            String bottom = factors (denominator, denominator.size () > 1 ? PRODUCT : SLASH + 1, small);
            if (denominator.size () > 1) bottom = "\\left(" + bottom + "\\right)";
            text = top + "/" + bottom;
            if (negative) return parens (prec, SUM, "-" + text);
            return parens (prec, SLASH, text);
        }

        String top    = numerator.isEmpty () ? "1" : factors (numerator, numerator.size () > 1 ? PRODUCT : 0, small);
        String bottom = factors (denominator, denominator.size () > 1 ? PRODUCT : 0, small);
        text = "\\frac{" + top + "}{" + bottom + "}";
        if (negative) return parens (prec, SUM, "-" + text);
        return parens (prec, FRACTION, text);
    }

    /**
        Juxtaposes base^exponent pairs. A bare number after the first factor is parenthesized,
        so that adjacent digits can't run together. A raised number already has its own delimiters.
    **/
    protected String factors (List<Operator[]> list, int prec, boolean small)
    {
        StringBuilder b = new StringBuilder ();
        for (int i = 0; i < list.size (); i++)
        {
            Operator base     = list.get (i)[0];
            Operator exponent = list.get (i)[1];
            int p = prec;
            if (i > 0  &&  base.isNumber ()  &&  exponent.isOne ()) p = TIGHT;
            if (exponent.isOne ()) b.append (tex (p, base, small));
            else                   b.append (tex (p, new Function (Power.NAME, base, exponent), small));
        }
        return b.toString ();
    }

    public String power (int prec, Function f, boolean small)
    {
        Operator base     = f.operands[0];
        Operator exponent = f.operands[1];
        if (exponent.equals (Constant.HALF)) return "\\sqrt{" + tex (0, base, small) + "}";
        return parens (prec, POWER, tex (BASE, base, small) + "^{" + tex (0, exponent, true) + "}");
    }

    // Matrices --------------------------------------------------------------

    public String matrix (Function f)
    {
        if (policy.vectorAsTuple ()  &&  Matrices.isVector (f))
        {
            Operator[] entries = new Operator[f.operands.length];
            for (int r = 0; r < entries.length; r++) entries[r] = Matrices.entry (f, r, 0);
            return "\\left(" + join (",", entries, 0, false) + "\\right)";
        }

        StringBuilder b = new StringBuilder ("\\begin{bmatrix}");
        for (int r = 0; r < f.operands.length; r++)
        {
            if (r > 0) b.append ("\\\\");
            b.append (join ("&", ((Sequence) f.operands[r]).elements, 0, true));
        }
        b.append ("\\end{bmatrix}");
        return b.toString ();
    }

    /**
        Lays out all blocks in one array, with rules between block rows and block columns.
        The span of each block row (column) comes from any concrete matrix in it. A row or
        column holding only symbolic blocks spans 1. A symbolic block sits at the center of
        its span, and the rest of its cells stay blank.
    **/
    public String blockMatrix (Function f)
    {
        BlockMatrix.checkGrid (f.operands);
        int blockRows    = f.operands.length;
        int blockColumns = ((Sequence) f.operands[0]).size ();

        int[] heights = new int[blockRows];
        int[] widths  = new int[blockColumns];
        for (int i = 0; i < blockRows; i++)
        {
            heights[i] = 1;
            for (int j = 0; j < blockColumns; j++)
            {
                Operator B = BlockMatrix.block (f, i, j);
                if (Matrices.isMatrix (B))
                {
                    heights[i] = Matrices.rows (B);
                    break;
                }
            }
        }
        for (int j = 0; j < blockColumns; j++)
        {
            widths[j] = 1;
            for (int i = 0; i < blockRows; i++)
            {
                Operator B = BlockMatrix.block (f, i, j);
                if (Matrices.isMatrix (B))
                {
                    widths[j] = Matrices.columns (B);
                    break;
                }
            }
        }

        StringBuilder b = new StringBuilder ("\\left[\\begin{array}{");
        for (int j = 0; j < blockColumns; j++)
        {
            if (j > 0) b.append ("|");
            for (int c = 0; c < widths[j]; c++) b.append ("c");
        }
        b.append ("}");

        for (int i = 0; i < blockRows; i++)
        {
            if (i > 0) b.append ("\\\\\\hline ");
            for (int r = 0; r < heights[i]; r++)
            {
                if (r > 0) b.append ("\\\\");
                boolean first = true;
                for (int j = 0; j < blockColumns; j++)
                {
                    Operator B = BlockMatrix.block (f, i, j);
                    boolean concrete = Matrices.isMatrix (B)  &&  Matrices.rows (B) == heights[i]  &&  Matrices.columns (B) == widths[j];
                    for (int c = 0; c < widths[j]; c++)
                    {
                        if (! first) b.append ("&");
                        first = false;
                        if (concrete)                                                b.append (tex (0, Matrices.entry (B, r, c), true));
                        else if (r == (heights[i] - 1) / 2  &&  c == (widths[j] - 1) / 2) b.append (tex (0, B, true));
                    }
                }
            }
        }
        b.append ("\\end{array}\\right]");
        return b.toString ();
    }

    // Calculus --------------------------------------------------------------

    public String derivative (int prec, Function f, boolean small)
    {
        Operator         target = f.operands[0];
        List<Operator[]> spec   = Derivative.parse (f.operands[1]);

        if (policy.derivativePrimes ()  &&  spec.size () == 1  &&  spec.get (0)[0].equals (policy.derivativeVariable ()))
        {
            Operator n = spec.get (0)[1];
            String exponent;
            int limit = policy.derivativeLimit ();
            Rational r = Constant.rational (n);
            if (r != null  &&  r.isInteger ()  &&  r.signum () > 0  &&  r.compareTo (new Rational (limit)) <= 0)
            {
                StringBuilder primes = new StringBuilder ();
                for (int i = r.intValue (); i > 0; i--) primes.append ("\\prime");
                exponent = primes.toString ();
            }
            else
            {
                exponent = "(" + tex (0, n, true) + ")";
            }
            return parens (prec, POWER, tex (BASE, target, small) + "^{" + exponent + "}");
        }

        String d = spec.size () == 1 ? "d" : "\\partial";
        List<String>   bottom = new ArrayList<String> ();
        List<Operator> orders = new ArrayList<Operator> ();
        for (Operator[] p : spec)
        {
            Operator v = p[0];
            Operator n = p[1];
            if (n.isZero ()) continue;
            orders.add (n);
            if (n.isOne ()) bottom.add (d + " " + tex (PRODUCT, v, small));
            else            bottom.add (d + " " + tex (PRODUCT, v, small) + "^{" + tex (0, n, true) + "}");
        }
        Operator total = orders.size () == 1 ? orders.get (0) : evaluator.plus (orders.toArray (new Operator[orders.size ()]));
        String order = total.isOne () ? "" : "^{" + tex (0, total, true) + "}";
        String top = d + order + " " + tex (PRODUCT, target, small);
        return parens (prec, FRACTION, "\\frac{" + top + "}{" + String.join ("\\,", bottom) + "}");
    }
}
