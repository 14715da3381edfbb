/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.EvaluationException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.type.Scalar;

/**
    Natural logarithm. The base is E.
**/
public class Log implements RuleTable.Extension
{
    public static final String NAME = "ln";

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 1, 1);
        table.register (NAME, "value", 1, Log::value);
    }

    public static Operator value (Function f, Evaluator evaluator)
    {
        Operator x = f.operands[0];
        if (x.isZero ()) throw new EvaluationException ("ln(0) is undefined");
        if (x.isOne ()) return Constant.ZERO;
        if (x.equals (Operator.E)) return Constant.ONE;
        if (Function.is (x, Power.NAME, 2)  &&  ((Function) x).operands[0].equals (Operator.E)) return ((Function) x).operands[1];
        if (x instanceof Constant  &&  ((Constant) x).value instanceof Scalar)
        {
            double v = ((Scalar) ((Constant) x).value).value;
            if (v < 0) throw new EvaluationException ("ln of a negative number: " + v);
            return Constant.of (Math.log (v));
        }
        return null;
    }
}
