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
import gov.sandia.quizkit.language.Transformer;
import gov.sandia.quizkit.language.type.Rational;
import gov.sandia.quizkit.linear.Matrices;

/**
    N(e) replaces every exact number in e, and the constant e, with its floating-point approximation, then lets
    evaluation continue on the result. This is the only place inexact values get introduced.
    Indices of Part and the orders in a derivative request are left exact, since they count
    rather than measure. Only the target of such a node is converted.
**/
public class Numeric implements RuleTable.Extension
{
    public static final String NAME = "N";

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 1, 1);
        table.register (NAME, "convert", 1, (f, evaluator) -> convert (f.operands[0]));
    }

    public static Operator N (Evaluator evaluator, Operator e)
    {
        return evaluator.apply (NAME, e);
    }

    public static Operator convert (Operator e)
    {
        return e.transform (new Transformer ()
        {
            public Operator transform (Operator op)
            {
                if (op instanceof Constant)
                {
                    Constant c = (Constant) op;
                    if (c.value instanceof Rational) return Constant.of (c.value.getDouble ());
                    return op;
                }
                if (op.equals (Operator.E)) return Constant.of (Math.E);
                if (op.is (Matrices.PART)  ||  op.is (Derivative.NAME))
                {
                    // Indices and derivative orders stay exact.
                    Function p = (Function) op;
                    Operator[] operands = p.operands.clone ();
                    operands[0] = operands[0].transform (this);
                    return new Function (p.name, operands);
                }
                return null;
            }
        });
    }
}
