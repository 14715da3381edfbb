/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.RuleTable;

public class SquareRoot implements RuleTable.Extension
{
    public static final String NAME = "sqrt";

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 1, 1);
        table.register (NAME, "power", 1, (f, evaluator) -> new Function (Power.NAME, f.operands[0], Constant.HALF));
    }
}
