/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.linear.Matrices;

import org.junit.Test;

public class RuleTableTest
{
    @Test
    public void testDefaultTableIsLocked ()
    {
        RuleTable table = RuleTable.createDefault ();
        assertTrue (table.isLocked ());
        try
        {
            table.register (Plus.NAME, "extra", 0, RuleTable.UNBOUNDED, (f, evaluator) -> null);
            fail ("registration on a locked table should be refused");
        }
        catch (IllegalStateException e)
        {
        }
    }

    @Test
    public void testLatestRuleWins ()
    {
        RuleTable table = new RuleTable ();
        table.register ("h", "first",  1, (f, evaluator) -> number (1));
        table.register ("h", "second", 1, (f, evaluator) -> number (2));
        Evaluator ev = new Evaluator (table);
        assertEquals (number (2), ev.apply ("h", var ("x")));

        // A rule whose arity range excludes the node is skipped.
        assertEquals (new Function ("h", var ("x"), var ("y")), ev.apply ("h", var ("x"), var ("y")));
    }

    @Test
    public void testUnchangedResultMeansNotApplicable ()
    {
        RuleTable table = new RuleTable ();
        table.register ("h", "fallback", 1, (f, evaluator) -> number (7));
        table.register ("h", "identity", 1, (f, evaluator) -> new Function (f.name, f.operands));
        Evaluator ev = new Evaluator (table);
        assertEquals (number (7), ev.apply ("h", var ("x")));
    }

    @Test
    public void testHardArity ()
    {
        RuleTable table = new RuleTable ();
        table.declareArity ("h", 1, 1);
        Evaluator ev = new Evaluator (table);
        try
        {
            ev.apply ("h", var ("x"), var ("y"));
            fail ("wrong number of operands should be a construction error");
        }
        catch (ConstructionException e)
        {
        }

        try
        {
            Evaluator.standard ().apply (Matrices.PART, Matrices.vector (1, 2));
            fail ("Part needs an index");
        }
        catch (ConstructionException e)
        {
        }
    }

    @Test
    public void testRewriteBudget ()
    {
        RuleTable table = new RuleTable ();
        table.register ("flip", "toggle", 1, (f, evaluator) -> new Function ("flip", f.operands[0].isZero () ? Constant.ONE : Constant.ZERO));
        table.lock ();
        Evaluator ev = new Evaluator (table, 50, Evaluator.DEFAULT_DEPTH);
        try
        {
            ev.apply ("flip", Constant.ZERO);
            fail ("a rule set that never settles should exhaust the budget");
        }
        catch (EvaluationException e)
        {
        }
    }

    @Test
    public void testDepthGuard ()
    {
        Evaluator ev = new Evaluator (new RuleTable (), Evaluator.DEFAULT_BUDGET, 10);

        Operator shallow = var ("x");
        for (int i = 0; i < 3; i++) shallow = new Function ("g", shallow);
        assertEquals (shallow, ev.evaluate (shallow));

        Operator deep = var ("x");
        for (int i = 0; i < 20; i++) deep = new Function ("g", deep);
        try
        {
            ev.evaluate (deep);
            fail ("nesting past the limit should be refused");
        }
        catch (EvaluationException e)
        {
        }

        // The depth counter unwinds after a failure.
        assertEquals (shallow, ev.evaluate (shallow));
    }

    @Test
    public void testRuleErrorsPropagate ()
    {
        RuleTable table = new RuleTable ();
        table.register ("bad", "throws", 0, RuleTable.UNBOUNDED, (f, evaluator) -> {throw new EvaluationException ("no good");});
        Evaluator ev = new Evaluator (table);
        try
        {
            ev.apply ("bad");
            fail ();
        }
        catch (EvaluationException e)
        {
            assertEquals ("no good", e.getMessage ());
        }
    }
}
