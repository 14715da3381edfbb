/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.linear.Matrices;

/**
    Reduces expressions to canonical form by applying the rules of a RuleTable until nothing changes.

    <p>Evaluation is post-order. The operands of a compound node are evaluated first, then
    spliced into the parent if the head is Flat. Then the rules for the head are tried from
    the most recently registered backward. The first rule that produces something structurally
    different wins, and evaluation restarts on that result, since it may have a different head
    or need flattening again. When no rule fires, the node is final. The result of evaluate()
    is a fixed point, so evaluate (evaluate (e)) equals evaluate (e).

    <p>Two guards keep bad rule sets from hanging the process: a budget of restarts per node,
    and a limit on nesting depth. Either one tripping raises EvaluationException.
**/
public class Evaluator
{
    private static Logger logger = Logger.getLogger (Evaluator.class);

    public static final int DEFAULT_BUDGET = 10000;
    public static final int DEFAULT_DEPTH  = 2000;

    public final RuleTable table;
    public final int       budget;
    public final int       maxDepth;

    protected ThreadLocal<int[]> depth = ThreadLocal.withInitial (() -> new int[1]);

    protected static Evaluator standard;

    /**
        @return A shared evaluator over the default (locked) rule table.
    **/
    public static synchronized Evaluator standard ()
    {
        if (standard == null) standard = new Evaluator (RuleTable.createDefault ());
        return standard;
    }

    public Evaluator (RuleTable table)
    {
        this (table, DEFAULT_BUDGET, DEFAULT_DEPTH);
    }

    public Evaluator (RuleTable table, int budget, int maxDepth)
    {
        if (budget < 1  ||  maxDepth < 1) throw new IllegalArgumentException ("Evaluator limits must be positive");
        this.table    = table;
        this.budget   = budget;
        this.maxDepth = maxDepth;
    }

    public Operator evaluate (Operator e)
    {
        int[] d = depth.get ();
        if (d[0] >= maxDepth)
        {
            logger.warn ("depth limit " + maxDepth + " reached while evaluating " + e.head ());
            throw new EvaluationException ("Expression nesting exceeds the depth limit of " + maxDepth);
        }
        d[0]++;
        try
        {
            return reduce (e);
        }
        finally
        {
            d[0]--;
        }
    }

    protected Operator reduce (Operator e)
    {
        int restarts = 0;
        while (true)
        {
            if (e instanceof Constant) return e;
            if (e instanceof Sequence) return evaluateElements ((Sequence) e);

            Function f = evaluateOperands ((Function) e);
            table.checkArity (f);
            Operator next = applyRules (f);
            if (next == null) return f;

            if (++restarts > budget)
            {
                logger.warn ("rewrite budget " + budget + " exhausted on " + f.name);
                throw new EvaluationException ("Rewrite budget exhausted while evaluating " + f.name);
            }
            e = next;
        }
    }

    protected Sequence evaluateElements (Sequence s)
    {
        Operator[] next = null;
        for (int i = 0; i < s.elements.length; i++)
        {
            Operator e = evaluate (s.elements[i]);
            if (e == s.elements[i]) continue;
            if (next == null) next = s.elements.clone ();
            next[i] = e;
        }
        if (next == null) return s;
        return new Sequence (next);
    }

    protected Function evaluateOperands (Function f)
    {
        boolean isFlat = table.isFlat (f.name);
        boolean changed = false;
        List<Operator> operands = new ArrayList<Operator> (f.operands.length);
        for (Operator op : f.operands)
        {
            Operator e = evaluate (op);
            if (isFlat  &&  e.is (f.name))
            {
                // Evaluated operands are already flat, so one level of splicing suffices.
                for (Operator o : ((Function) e).operands) operands.add (o);
                changed = true;
            }
            else
            {
                operands.add (e);
                if (e != op) changed = true;
            }
        }
        if (! changed) return f;
        return new Function (f.name, operands);
    }

    /**
        @return The first result that differs from f, or null if no rule applies.
    **/
    protected Operator applyRules (Function f)
    {
        List<RuleTable.Entry> entries = table.rules (f.name);
        int count = f.operands.length;
        for (int i = entries.size () - 1; i >= 0; i--)
        {
            RuleTable.Entry entry = entries.get (i);
            if (! entry.accepts (count)) continue;

            Operator result;
            try
            {
                result = entry.rule.apply (f, this);
            }
            catch (RuntimeException e)
            {
                if (logger.isDebugEnabled ()) logger.debug ("rule " + f.name + "/" + entry.name + " failed on " + f + ": " + e.getMessage ());
                throw e;
            }
            if (result != null  &&  ! result.equals (f)) return result;
        }
        return null;
    }

    // Convenience constructors ----------------------------------------------
    // Each builds a node and returns its canonical form.

    public Operator apply (String head, Operator... operands)
    {
        return evaluate (new Function (head, operands));
    }

    public Operator plus (Operator... terms)
    {
        return apply (Plus.NAME, terms);
    }

    public Operator subtract (Operator a, Operator b)
    {
        return apply (Plus.NAME, a, new Function (Times.NAME, Constant.MINUS_ONE, b));
    }

    public Operator negate (Operator a)
    {
        return apply (Times.NAME, Constant.MINUS_ONE, a);
    }

    public Operator times (Operator... factors)
    {
        return apply (Times.NAME, factors);
    }

    public Operator power (Operator base, Operator exponent)
    {
        return apply (Power.NAME, base, exponent);
    }

    /**
        Exact quotient a * b^-1. The quotient of two integers is a rational, never a float.
    **/
    public Operator frac (Operator a, Operator b)
    {
        return apply (Times.NAME, a, new Function (Power.NAME, b, Constant.MINUS_ONE));
    }

    public Operator frac (long a, long b)
    {
        return frac (Operator.number (a), Operator.number (b));
    }

    /**
        Matrix product. Distinct from times(), which is scalar multiplication.
    **/
    public Operator matTimes (Operator A, Operator B)
    {
        return apply (Matrices.MATTIMES, A, B);
    }

    /**
        One-based indexing. One index for a vector, two for a matrix.
    **/
    public Operator part (Operator container, int... indices)
    {
        Operator[] operands = new Operator[indices.length + 1];
        operands[0] = container;
        for (int i = 0; i < indices.length; i++) operands[i+1] = Operator.number (indices[i]);
        return apply (Matrices.PART, operands);
    }
}
