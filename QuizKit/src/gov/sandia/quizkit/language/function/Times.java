/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Type;
import gov.sandia.quizkit.language.type.Rational;

/**
    Products of scalars. There is no division: a / b is Times(a, Pow(b, -1)).
    Matrix products use MatTimes instead.
**/
public class Times implements RuleTable.Extension
{
    public static final String NAME = "Times";

    public void register (RuleTable table)
    {
        table.setFlat (NAME);
        table.register (NAME, "collect", 0, RuleTable.UNBOUNDED, Times::collect);
    }

    /**
        A factor split into base and exponent.
    **/
    public static class Factor
    {
        public Operator base;
        public Operator exponent;

        public Factor (Operator base, Operator exponent)
        {
            this.base     = base;
            this.exponent = exponent;
        }
    }

    public static Factor split (Operator a)
    {
        if (Function.is (a, Power.NAME, 2))
        {
            Function p = (Function) a;
            return new Factor (p.operands[0], p.operands[1]);
        }
        return new Factor (a, Constant.ONE);
    }

    /**
        Multiplies numeric factors together and sums the exponents of equal bases.
    **/
    public static Operator collect (Function f, Evaluator evaluator)
    {
        Type coefficient = Rational.ONE;
        List<Factor> factors = new ArrayList<Factor> ();
        for (Operator a : f.operands)
        {
            Factor s = split (a);
            if (s.exponent.isOne ()  &&  s.base.isNumber ())
            {
                coefficient = coefficient.multiply (((Constant) s.base).value);
                continue;
            }
            Factor match = null;
            for (Factor t : factors)
            {
                if (t.base.equals (s.base))
                {
                    match = t;
                    break;
                }
            }
            if (match == null) factors.add (s);
            else               match.exponent = evaluator.plus (match.exponent, s.exponent);
        }
        if (coefficient.isZero ()) return Constant.ZERO;

        List<Operator> result = new ArrayList<Operator> ();
        if (! coefficient.isOne ()) result.add (Constant.of (coefficient));
        for (Factor t : factors)
        {
            Operator v = evaluator.power (t.base, t.exponent);
            if (! v.isOne ()) result.add (v);
        }
        if (result.isEmpty ()) return Constant.ONE;
        if (result.size () == 1) return result.get (0);
        return new Function (NAME, order (result));
    }

    /**
        Keeps numbers, symbols, sums, products and powers in front, with other function
        applications after them. Stable within each group.
    **/
    public static List<Operator> order (List<Operator> factors)
    {
        List<Operator> result    = new ArrayList<Operator> (factors.size ());
        List<Operator> functions = new ArrayList<Operator> ();
        for (Operator a : factors)
        {
            switch (a.head ())
            {
                case Operator.NUMBER:
                case Function.VAR:
                case Function.CONST:
                case Plus.NAME:
                case NAME:
                case Power.NAME:
                    result.add (a);
                    break;
                default:
                    functions.add (a);
            }
        }
        result.addAll (functions);
        return result;
    }
}
