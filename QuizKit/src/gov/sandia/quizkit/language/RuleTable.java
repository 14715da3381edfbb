/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.quizkit.language.function.AbsoluteValue;
import gov.sandia.quizkit.language.function.Cosine;
import gov.sandia.quizkit.language.function.Derivative;
import gov.sandia.quizkit.language.function.Exp;
import gov.sandia.quizkit.language.function.Log;
import gov.sandia.quizkit.language.function.Numeric;
import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Sine;
import gov.sandia.quizkit.language.function.SquareRoot;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.linear.BlockMatrix;
import gov.sandia.quizkit.linear.Determinant;
import gov.sandia.quizkit.linear.Matrices;
import gov.sandia.quizkit.linear.RowReduction;
import gov.sandia.quizkit.linear.Vectors;

/**
    Associates each head with an ordered list of rules. Rules for the same head
    coexist, and the evaluator tries them most-recently-registered first. So a family
    installed later (matrix rules on Plus, say) gets the first look at a node and can
    decline in favor of the more general rules installed before it.
**/
public class RuleTable
{
    private static Logger logger = Logger.getLogger (RuleTable.class);

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
        A family of rules that knows how to install itself.
    **/
    public interface Extension
    {
        public void register (RuleTable table);
    }

    public static class Entry
    {
        public final String name;
        public final int    lo;
        public final int    hi;
        public final Rule   rule;

        public Entry (String name, int lo, int hi, Rule rule)
        {
            this.name = name;
            this.lo   = lo;
            this.hi   = hi;
            this.rule = rule;
        }

        public boolean accepts (int arity)
        {
            return arity >= lo  &&  arity <= hi;
        }
    }

    protected Map<String,List<Entry>> rules  = new HashMap<String,List<Entry>> ();
    protected Map<String,int[]>       arity  = new HashMap<String,int[]> ();
    protected Set<String>             flat   = new HashSet<String> ();
    protected boolean                 locked;

    /**
        Builds the table with every rule family shipped in this library, then locks it.
        Order matters: arithmetic first, then matrix rules, then differentiation.
    **/
    public static RuleTable createDefault ()
    {
        RuleTable result = new RuleTable ();
        result.install
        (
            new Plus (),
            new Times (),
            new Power (),
            new Log (),
            new Exp (),
            new SquareRoot (),
            new Sine (),
            new Cosine (),
            new AbsoluteValue (),
            new Numeric (),
            new Matrices (),
            new BlockMatrix (),
            new Determinant (),
            new RowReduction (),
            new Vectors (),
            new Derivative ()
        );
        result.lock ();
        return result;
    }

    public void install (Extension... extensions)
    {
        for (Extension e : extensions) e.register (this);
    }

    public void register (String head, String name, int arity, Rule rule)
    {
        register (head, name, arity, arity, rule);
    }

    /**
        Adds a rule to the end of the list for the given head. A node whose operand count
        falls outside [lo, hi] simply skips this rule.
    **/
    public void register (String head, String name, int lo, int hi, Rule rule)
    {
        checkUnlocked ();
        if (lo < 0  ||  hi < lo) throw new IllegalArgumentException ("Bad arity range [" + lo + ", " + hi + "] for " + head + "/" + name);
        rules.computeIfAbsent (head, k -> new ArrayList<Entry> ()).add (new Entry (name, lo, hi, rule));
        if (logger.isDebugEnabled ()) logger.debug ("registered rule " + head + "/" + name + " arity [" + lo + ", " + (hi == UNBOUNDED ? "inf" : hi) + "]");
    }

    /**
        @return Rules for the given head, in registration order. Never null.
    **/
    public List<Entry> rules (String head)
    {
        List<Entry> result = rules.get (head);
        if (result == null) return Collections.emptyList ();
        return Collections.unmodifiableList (result);
    }

    /**
        Marks a head as associative, so nested nodes with the same head are spliced into the parent.
    **/
    public void setFlat (String head)
    {
        checkUnlocked ();
        flat.add (head);
    }

    public boolean isFlat (String head)
    {
        return flat.contains (head);
    }

    /**
        Declares a hard constraint on the number of operands. Unlike the arity range of
        an individual rule, violating this is a construction error.
    **/
    public void declareArity (String head, int lo, int hi)
    {
        checkUnlocked ();
        arity.put (head, new int[] {lo, hi});
    }

    public void checkArity (Function f) throws ConstructionException
    {
        int[] range = arity.get (f.name);
        if (range == null) return;
        int count = f.operands.length;
        if (count >= range[0]  &&  count <= range[1]) return;
        if (range[1] == UNBOUNDED) throw new ConstructionException (f.name + " expects at least " + range[0] + " arguments, got " + count);
        if (range[0] == range[1])  throw new ConstructionException (f.name + " expects " + range[0] + " arguments, got " + count);
        throw new ConstructionException (f.name + " expects between " + range[0] + " and " + range[1] + " arguments, got " + count);
    }

    public void lock ()
    {
        locked = true;
    }

    public boolean isLocked ()
    {
        return locked;
    }

    protected void checkUnlocked ()
    {
        if (locked) throw new IllegalStateException ("Rule table is locked");
    }
}
