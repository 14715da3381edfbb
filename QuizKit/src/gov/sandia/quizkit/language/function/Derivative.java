/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gov.sandia.quizkit.language.Constant;
import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Sequence;
import gov.sandia.quizkit.linear.Matrices;

/**
    Total derivative. A request is the node Deriv(target, spec, constants) where spec is a
    list of [variable, order] pairs and constants is a list of variables that do not depend
    on anything. Every other var is assumed to depend on all the variables in the spec, and
    every const is constant. A [v, 0] entry marks v as independent of the other spec variables
    without differentiating by it.

    <p>A request that no rule can resolve stays in the tree. That is normal, for example the
    derivative of an unknown function x with respect to t.
**/
public class Derivative implements RuleTable.Extension
{
    public static final String NAME = "Deriv";

    /**
        Partial derivative of a function with respect to its i-th argument, evaluated at a.
    **/
    public interface Jacobian
    {
        public Operator entry (Operator[] a, int i);
    }

    /// Keyed by head + "/" + arity.
    public static final Map<String,Jacobian> jacobians;
    static
    {
        Map<String,Jacobian> j = new HashMap<String,Jacobian> ();
        j.put (Power.NAME + "/2", (a, i) ->
        {
            if (i == 0) return new Function (Times.NAME, a[1], new Function (Power.NAME, a[0], new Function (Plus.NAME, a[1], Constant.MINUS_ONE)));
            return new Function (Times.NAME, new Function (Power.NAME, a[0], a[1]), new Function (Log.NAME, a[0]));
        });
        j.put (Log   .NAME + "/1", (a, i) -> new Function (Power.NAME, a[0], Constant.MINUS_ONE));
        j.put (Sine  .NAME + "/1", (a, i) -> new Function (Cosine.NAME, a[0]));
        j.put (Cosine.NAME + "/1", (a, i) -> new Function (Times.NAME, Constant.MINUS_ONE, new Function (Sine.NAME, a[0])));
        jacobians = Collections.unmodifiableMap (j);
    }

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 3, 3);
        table.register (NAME, "basic", 3, Derivative::basic);
    }

    // Construction ----------------------------------------------------------

    /**
        Builds and evaluates a derivative request. Each item of spec is either a variable
        (meaning order 1) or a two-element list [variable, order].
    **/
    public static Operator D (Evaluator evaluator, Operator e, Operator... spec)
    {
        List<Operator> s = new ArrayList<Operator> (spec.length);
        Collections.addAll (s, spec);
        return D (evaluator, e, s, Collections.<Operator>emptyList ());
    }

    public static Operator D (Evaluator evaluator, Operator e, List<Operator> spec, List<Operator> constants)
    {
        return evaluator.evaluate (request (e, spec, constants));
    }

    public static Function request (Operator e, List<Operator> spec, List<Operator> constants)
    {
        for (Operator c : constants)
        {
            if (! c.is (Function.VAR)) throw new ConstructionException ("Constants of a derivative must be variables, got " + c);
        }
        List<Operator> pairs = new ArrayList<Operator> (spec.size ());
        for (Operator s : spec)
        {
            Operator v;
            Operator n;
            if (s.is (Function.VAR))
            {
                v = s;
                n = Constant.ONE;
            }
            else if (s instanceof Sequence)
            {
                Sequence p = (Sequence) s;
                if (p.size () != 2) throw new ConstructionException ("A derivative spec entry should have length 2: " + s);
                v = p.get (0);
                n = p.get (1);
            }
            else
            {
                throw new ConstructionException ("Unexpected item in derivative spec: " + s);
            }
            if (! v.is (Function.VAR)) throw new ConstructionException ("Can only take derivatives with respect to variables, got " + v);
            pairs.add (new Sequence (v, n));
        }
        return new Function (NAME, e, new Sequence (pairs), new Sequence (constants));
    }

    protected static Function request (Operator e, List<Operator[]> spec, Sequence constants)
    {
        return new Function (NAME, e, toSequence (spec), constants);
    }

    // Spec manipulation -----------------------------------------------------

    public static List<Operator[]> parse (Operator spec)
    {
        if (! (spec instanceof Sequence)) throw new ConstructionException ("Derivative spec must be a list, got " + spec);
        List<Operator[]> result = new ArrayList<Operator[]> ();
        for (Operator p : ((Sequence) spec).elements)
        {
            if (! (p instanceof Sequence)  ||  ((Sequence) p).size () != 2) throw new ConstructionException ("A derivative spec entry should have length 2: " + p);
            Sequence s = (Sequence) p;
            result.add (new Operator[] {s.get (0), s.get (1)});
        }
        return result;
    }

    public static Sequence toSequence (List<Operator[]> spec)
    {
        List<Operator> pairs = new ArrayList<Operator> (spec.size ());
        for (Operator[] p : spec) pairs.add (new Sequence (p[0], p[1]));
        return new Sequence (pairs);
    }

    /**
        Merges repeated variables by summing their orders. Zero orders are kept, since they
        mark a variable as independent. Numeric orders must be non-negative integers.
    **/
    public static List<Operator[]> normalize (Evaluator evaluator, List<Operator[]> spec)
    {
        List<Operator[]> result = new ArrayList<Operator[]> ();
        for (Operator[] p : spec)
        {
            Operator v = p[0];
            Operator n = p[1];
            if (! v.is (Function.VAR)) throw new ConstructionException ("Can only take derivatives with respect to variables, got " + v);
            if (n.isNumber ())
            {
                if (! Constant.isInteger (n))      throw new ConstructionException ("The derivative spec (" + v + ", " + n + ") is fractional.");
                if (Constant.signum (n) < 0)       throw new ConstructionException ("The derivative spec (" + v + ", " + n + ") is negative.");
            }
            Operator[] match = null;
            for (Operator[] q : result)
            {
                if (q[0].equals (v))
                {
                    match = q;
                    break;
                }
            }
            if (match == null) result.add (new Operator[] {v, n});
            else               match[1] = evaluator.plus (match[1], n);
        }
        return result;
    }

    /**
        Finds the last entry with a positive integer order and takes one off it.
        @return The variable that was peeled off, or null if every order is zero or symbolic.
        On success, spec is modified in place.
    **/
    public static Operator split (List<Operator[]> spec)
    {
        for (int i = spec.size () - 1; i >= 0; i--)
        {
            Operator[] p = spec.get (i);
            if (Constant.isInteger (p[1])  &&  Constant.signum (p[1]) > 0)
            {
                int n = Constant.rational (p[1]).intValue ();
                spec.set (i, new Operator[] {p[0], Operator.number (n - 1)});
                return p[0];
            }
        }
        return null;
    }

    public static List<Operator[]> zeroed (List<Operator[]> spec)
    {
        List<Operator[]> result = new ArrayList<Operator[]> (spec.size ());
        for (Operator[] p : spec) result.add (new Operator[] {p[0], Constant.ZERO});
        return result;
    }

    /**
        The order requested for one variable, with that variable zeroed in the remaining spec.
    **/
    public static class VariableOrder
    {
        public List<Operator[]> rest;
        public Operator         order   = Constant.ZERO;
        public boolean          present;
    }

    public static VariableOrder forVariable (List<Operator[]> spec, Operator v)
    {
        VariableOrder result = new VariableOrder ();
        result.rest = new ArrayList<Operator[]> (spec);
        for (int i = 0; i < spec.size (); i++)
        {
            Operator[] p = spec.get (i);
            if (! p[0].equals (v)) continue;
            result.rest.set (i, new Operator[] {v, Constant.ZERO});
            result.order   = p[1];
            result.present = true;
            break;
        }
        return result;
    }

    /**
        Request to differentiate once more with respect to v, on top of the independence
        information carried by spec.
    **/
    protected static List<Operator[]> once (List<Operator[]> spec, Operator v)
    {
        List<Operator[]> result = zeroed (spec);
        result.add (new Operator[] {v, Constant.ONE});
        return result;
    }

    // Rule ------------------------------------------------------------------

    public static Operator basic (Function f, Evaluator evaluator)
    {
        Operator e = f.operands[0];
        if (! (f.operands[2] instanceof Sequence)) throw new ConstructionException ("Derivative constants must be a list, got " + f.operands[2]);
        Sequence constants = (Sequence) f.operands[2];
        List<Operator[]> original = parse (f.operands[1]);

        List<Operator[]> spec = normalize (evaluator, original);
        Sequence normalized = toSequence (spec);
        if (! normalized.equals (f.operands[1])) return new Function (NAME, e, normalized, constants);

        Operator[] orders = new Operator[spec.size ()];
        for (int i = 0; i < orders.length; i++) orders[i] = spec.get (i)[1];
        if (evaluator.plus (orders).isZero ()) return e;

        String head = e.head ();
        if (e.isNumber ()  ||  head.equals (Function.CONST)  ||  (head.equals (Matrices.PART)  &&  ((Function) e).operands[0].is (Function.CONST)))
        {
            if (split (new ArrayList<Operator[]> (spec)) == null) return null;  // still symbolic
            return Constant.ZERO;
        }

        if (head.equals (Function.VAR))
        {
            for (Operator c : constants.elements) if (c.equals (e)) return Constant.ZERO;
            VariableOrder vo = forVariable (spec, e);
            if (! Constant.isInteger (vo.order)) return null;
            int n = Constant.rational (vo.order).intValue ();
            if (n == 0  &&  vo.present) return Constant.ZERO;  // independent variable
            if (n > 1) return Constant.ZERO;
            if (n == 1) return request (Constant.ONE, vo.rest, constants);
            return null;
        }

        if (head.equals (NAME)  &&  ((Function) e).operands[2].equals (constants))
        {
            Function inner = (Function) e;
            List<Operator[]> joined = new ArrayList<Operator[]> (spec);
            joined.addAll (parse (inner.operands[1]));
            return request (inner.operands[0], joined, constants);
        }

        if (head.equals (Plus.NAME))
        {
            Operator[] terms = ((Function) e).operands;
            Operator[] result = new Operator[terms.length];
            for (int i = 0; i < terms.length; i++) result[i] = request (terms[i], spec, constants);
            return new Function (Plus.NAME, result);
        }

        if (head.equals (Times.NAME))
        {
            List<Operator[]> rest = new ArrayList<Operator[]> (spec);
            Operator v = split (rest);
            if (v == null) return null;
            List<Operator[]> d = once (spec, v);
            Operator[] factors = ((Function) e).operands;
            Operator[] terms = new Operator[factors.length];
            for (int i = 0; i < factors.length; i++)
            {
                Operator[] product = factors.clone ();
                product[i] = request (factors[i], d, constants);
                terms[i] = new Function (Times.NAME, product);
            }
            return request (new Function (Plus.NAME, terms), rest, constants);
        }

        if (head.equals (Matrices.PART))
        {
            Operator[] operands = ((Function) e).operands.clone ();
            operands[0] = request (operands[0], spec, constants);
            return new Function (Matrices.PART, operands);
        }

        if (e instanceof Function)
        {
            Function g = (Function) e;
            Jacobian jacobian = jacobians.get (g.name + "/" + g.operands.length);
            if (jacobian == null) return null;
            List<Operator[]> rest = new ArrayList<Operator[]> (spec);
            Operator v = split (rest);
            if (v == null) return null;
            List<Operator[]> d = once (spec, v);

            // Chain rule. Arguments that don't vary contribute nothing, so their partials are never built.
            List<Operator> terms = new ArrayList<Operator> ();
            for (int i = 0; i < g.operands.length; i++)
            {
                Operator da = evaluator.evaluate (request (g.operands[i], d, constants));
                if (da.isZero ()) continue;
                terms.add (new Function (Times.NAME, jacobian.entry (g.operands, i), da));
            }
            if (terms.isEmpty ()) return Constant.ZERO;
            return request (new Function (Plus.NAME, terms), rest, constants);
        }

        return null;
    }
}
