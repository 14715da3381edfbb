/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.linear.Matrices;

/**
    Sparse polynomial over a fixed list of variables. Each monomial is keyed by its tuple of
    exponents, one per variable. Exponents are usually integers, but a variable raised to a
    symbolic power keeps that power as its exponent. Anything free of the variables, or not
    polynomial in them, goes into the coefficients.
**/
public class Polynomial
{
    public final List<Operator>                 variables;
    public final Map<List<Operator>,Operator>   terms = new LinkedHashMap<List<Operator>,Operator> ();

    public Polynomial (List<Operator> variables)
    {
        this.variables = variables;
    }

    // Collection ------------------------------------------------------------

    public static Operator collect (Evaluator evaluator, Operator e, Operator... variables)
    {
        return collect (evaluator, e, Arrays.asList (variables), null);
    }

    /**
        Rewrites e as a sum of monomials in the given variables, merging like monomials.
        With no variables given, collects in every free variable of e (including indexed
        entries such as a_{1,2}). The optional simplifier is applied to each coefficient.
        Matrices and lists are collected entry by entry.
    **/
    public static Operator collect (Evaluator evaluator, Operator e, List<Operator> variables, UnaryOperator<Operator> simplifier)
    {
        if (variables.isEmpty ()) variables = findVariables (e);

        if (Matrices.isMatrix (e))
        {
            Operator[][] entries = Matrices.toArray (e);
            for (Operator[] row : entries)
            {
                for (int c = 0; c < row.length; c++) row[c] = collect (evaluator, row[c], variables, simplifier);
            }
            return Matrices.matrix (entries);
        }
        if (e instanceof Sequence)
        {
            Operator[] elements = ((Sequence) e).elements;
            Operator[] result = new Operator[elements.length];
            for (int i = 0; i < result.length; i++) result[i] = collect (evaluator, elements[i], variables, simplifier);
            return new Sequence (result);
        }

        Polynomial p = from (evaluator, e, variables);
        return p.toOperator (evaluator, simplifier);
    }

    /**
        Every var and every indexed var (Part of a var) in e, in order of first appearance.
    **/
    public static List<Operator> findVariables (Operator e)
    {
        List<Operator> result = new ArrayList<Operator> ();
        e.visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                boolean indexed = op.is (Matrices.PART)  &&  ((Function) op).operands[0].is (Function.VAR);
                if (indexed  ||  op.is (Function.VAR))
                {
                    if (! result.contains (op)) result.add (op);
                    return false;
                }
                return true;
            }
        });
        return result;
    }

    public static boolean contains (Operator e, List<Operator> variables)
    {
        boolean[] found = new boolean[1];
        e.visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (found[0]) return false;
                if (variables.contains (op)) found[0] = true;
                return ! found[0];
            }
        });
        return found[0];
    }

    // Construction ----------------------------------------------------------

    protected List<Operator> zeroExponents ()
    {
        return new ArrayList<Operator> (Collections.nCopies (variables.size (), (Operator) Constant.ZERO));
    }

    public static Polynomial constant (List<Operator> variables, Operator c)
    {
        Polynomial result = new Polynomial (variables);
        if (! c.isZero ()) result.terms.put (result.zeroExponents (), c);
        return result;
    }

    public static Polynomial from (Evaluator evaluator, Operator e, List<Operator> variables)
    {
        int index = variables.indexOf (e);
        if (index >= 0)
        {
            Polynomial result = new Polynomial (variables);
            List<Operator> exponents = result.zeroExponents ();
            exponents.set (index, Constant.ONE);
            result.terms.put (exponents, Constant.ONE);
            return result;
        }

        if (! contains (e, variables)) return constant (variables, e);

        if (e.is (Plus.NAME))
        {
            Polynomial result = new Polynomial (variables);
            for (Operator a : ((Function) e).operands) result.add (evaluator, from (evaluator, a, variables));
            return result;
        }

        if (e.is (Times.NAME))
        {
            Polynomial result = constant (variables, Constant.ONE);
            for (Operator a : ((Function) e).operands) result = result.multiply (evaluator, from (evaluator, a, variables));
            return result;
        }

        if (Function.is (e, Power.NAME, 2))
        {
            Operator base     = ((Function) e).operands[0];
            Operator exponent = ((Function) e).operands[1];
            index = variables.indexOf (base);
            if (index >= 0  &&  ! contains (exponent, variables))
            {
                // Variable to any power free of the variables, including negative and symbolic ones.
                Polynomial result = new Polynomial (variables);
                List<Operator> exponents = result.zeroExponents ();
                exponents.set (index, exponent);
                result.terms.put (exponents, Constant.ONE);
                return result;
            }
            if (Constant.isInteger (exponent)  &&  Constant.signum (exponent) > 0)
            {
                int n = Constant.rational (exponent).intValue ();
                Polynomial b = from (evaluator, base, variables);
                Polynomial result = constant (variables, Constant.ONE);
                for (int i = 0; i < n; i++) result = result.multiply (evaluator, b);
                return result;
            }
        }

        // Not polynomial in the variables, so the whole thing is treated as a coefficient.
        return constant (variables, e);
    }

    // Arithmetic ------------------------------------------------------------

    public void add (Evaluator evaluator, List<Operator> exponents, Operator coefficient)
    {
        Operator current = terms.get (exponents);
        Operator sum = current == null ? coefficient : evaluator.plus (current, coefficient);
        if (sum.isZero ()) terms.remove (exponents);
        else               terms.put (exponents, sum);
    }

    public void add (Evaluator evaluator, Polynomial that)
    {
        for (Map.Entry<List<Operator>,Operator> t : that.terms.entrySet ()) add (evaluator, t.getKey (), t.getValue ());
    }

    public Polynomial multiply (Evaluator evaluator, Polynomial that)
    {
        Polynomial result = new Polynomial (variables);
        for (Map.Entry<List<Operator>,Operator> a : terms.entrySet ())
        {
            for (Map.Entry<List<Operator>,Operator> b : that.terms.entrySet ())
            {
                List<Operator> exponents = new ArrayList<Operator> (variables.size ());
                for (int i = 0; i < variables.size (); i++) exponents.add (evaluator.plus (a.getKey ().get (i), b.getKey ().get (i)));
                result.add (evaluator, exponents, evaluator.times (a.getValue (), b.getValue ()));
            }
        }
        return result;
    }

    /**
        Sum of numeric exponents. Symbolic exponents count as zero.
    **/
    public static int degree (List<Operator> exponents)
    {
        int result = 0;
        for (Operator e : exponents)
        {
            if (Constant.isInteger (e)) result += Constant.rational (e).intValue ();
        }
        return result;
    }

    /**
        Reassembles the polynomial, highest total degree first.
    **/
    public Operator toOperator (Evaluator evaluator, UnaryOperator<Operator> simplifier)
    {
        List<Map.Entry<List<Operator>,Operator>> sorted = new ArrayList<Map.Entry<List<Operator>,Operator>> (terms.entrySet ());
        sorted.sort ((a, b) -> Integer.compare (degree (b.getKey ()), degree (a.getKey ())));  // stable

        List<Operator> summands = new ArrayList<Operator> ();
        for (Map.Entry<List<Operator>,Operator> t : sorted)
        {
            Operator c = t.getValue ();
            if (simplifier != null) c = simplifier.apply (c);
            List<Operator> factors = new ArrayList<Operator> ();
            factors.add (c);
            List<Operator> exponents = t.getKey ();
            for (int i = 0; i < variables.size (); i++)
            {
                Operator n = exponents.get (i);
                if (n.isZero ()) continue;
                factors.add (new Function (Power.NAME, variables.get (i), n));
            }
            Operator term = evaluator.evaluate (new Function (Times.NAME, factors));
            if (! term.isZero ()) summands.add (term);
        }
        return evaluator.evaluate (new Function (Plus.NAME, summands));
    }
}
