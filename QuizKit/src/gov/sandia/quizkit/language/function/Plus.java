/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Type;
import gov.sandia.quizkit.language.type.Rational;

/**
    Sums. There is no subtraction: a - b is Plus(a, Times(-1, b)).
**/
public class Plus implements RuleTable.Extension
{
    public static final String NAME = "Plus";

    public void register (RuleTable table)
    {
        table.setFlat (NAME);
        table.register (NAME, "collect", 0, RuleTable.UNBOUNDED, Plus::collect);
    }

    /**
        A summand split into numeric coefficient and remaining factor.
    **/
    public static class Term
    {
        public Type     coefficient;
        public Operator factor;

        public Term (Type coefficient, Operator factor)
        {
            this.coefficient = coefficient;
            this.factor      = factor;
        }
    }

    /**
        Splits an evaluated summand. A leading number in a product is the coefficient.
        A bare number has factor 1. Anything else has coefficient 1.
    **/
    public static Term split (Operator a)
    {
        if (a.is (Times.NAME))
        {
            Operator[] operands = ((Function) a).operands;
            if (operands.length >= 2  &&  operands[0].isNumber ())
            {
                Type c = ((Constant) operands[0]).value;
                if (operands.length == 2) return new Term (c, operands[1]);
                return new Term (c, new Function (Times.NAME, Arrays.copyOfRange (operands, 1, operands.length)));
            }
        }
        if (a.isNumber ()) return new Term (((Constant) a).value, Constant.ONE);
        return new Term (Rational.ONE, a);
    }

    /**
        Merges summands whose factors are structurally equal, and drops the ones that cancel.
    **/
    public static Operator collect (Function f, Evaluator evaluator)
    {
        List<Term> terms = new ArrayList<Term> ();
        for (Operator a : f.operands)
        {
            Term s = split (a);
            Term match = null;
            for (Term t : terms)
            {
                if (t.factor.equals (s.factor))
                {
                    match = t;
                    break;
                }
            }
            if (match == null) terms.add (s);
            else               match.coefficient = match.coefficient.add (s.coefficient);
        }

        List<Operator> result = new ArrayList<Operator> ();
        for (Term t : terms)
        {
            Operator product = evaluator.times (Constant.of (t.coefficient), t.factor);
            if (! product.isZero ()) result.add (product);
        }
        if (result.isEmpty ()) return Constant.ZERO;
        if (result.size () == 1) return result.get (0);
        return new Function (NAME, result);
    }
}
