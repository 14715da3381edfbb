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
import gov.sandia.quizkit.language.type.Scalar;

public class Cosine implements RuleTable.Extension
{
    public static final String NAME = "cos";

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 1, 1);
        table.register (NAME, "value", 1, Cosine::value);
    }

    public static Operator value (Function f, Evaluator evaluator)
    {
        Operator x = f.operands[0];
        if (x.isZero ()) return Constant.ONE;
        if (x instanceof Constant  &&  ((Constant) x).value instanceof Scalar) return Constant.of (Math.cos (((Scalar) ((Constant) x).value).value));
        return null;
    }
}
