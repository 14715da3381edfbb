/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;

/**
    abs(x) for numbers, and for products and powers of positive numbers (such as the
    radicals that show up in normalized vectors), whose sign is known.
**/
public class AbsoluteValue implements RuleTable.Extension
{
    public static final String NAME = "abs";

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 1, 1);
        table.register (NAME, "value", 1, AbsoluteValue::value);
    }

    public static Operator value (Function f, Evaluator evaluator)
    {
        Operator x = f.operands[0];
        if (x.isNumber ()) return Constant.of (((Constant) x).value.abs ());
        int s = sign (x);
        if (s > 0) return x;
        if (s < 0) return evaluator.negate (x);
        return null;
    }

    /**
        @return The sign of e if it is a real constant with evident sign, otherwise 0.
    **/
    public static int sign (Operator e)
    {
        if (e.isNumber ()) return Constant.signum (e);
        if (e.equals (Operator.E)) return 1;
        if (Function.is (e, Power.NAME, 2))
        {
            Function p = (Function) e;
            if (sign (p.operands[0]) > 0  &&  p.operands[1].isNumber ()) return 1;
            return 0;
        }
        if (e.is (Times.NAME))
        {
            int result = 1;
            for (Operator a : ((Function) e).operands)
            {
                int s = sign (a);
                if (s == 0) return 0;
                result *= s;
            }
            return result;
        }
        return 0;
    }
}
