/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.tex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import org.apache.log4j.Logger;

import gov.sandia.quizkit.db.MNode;
import gov.sandia.quizkit.db.MVolatile;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;

/**
    Dynamically scoped rendering configuration. Values live in a stack of MVolatile layers.
    Lookup searches from the innermost layer outward, then falls back to the hard defaults.
    The bottom layer is always present, so a setter called outside of any scope changes
    the process-wide value.

    <pre>
    try (RenderPolicy.Scope scope = RenderPolicy.shared ().enter ())
    {
        RenderPolicy.shared ().setVectorAsTuple (true);
        ...
    }  // previous value restored here, even if the body threw
    </pre>
**/
public class RenderPolicy
{
    public static final String VECTOR_TUPLE        = "tuple";
    public static final String DERIVATIVE_PRIMES   = "primes";
    public static final String DERIVATIVE_VARIABLE = "variable";
    public static final String DERIVATIVE_LIMIT    = "limit";

    protected static final Logger logger = Logger.getLogger (RenderPolicy.class);

    protected static RenderPolicy shared;

    protected MNode            defaults;
    protected Deque<MVolatile> layers = new ArrayDeque<MVolatile> ();

    public RenderPolicy ()
    {
        MVolatile d = new MVolatile ();
        d.set (false, "vector",     VECTOR_TUPLE);
        d.set (true,  "derivative", DERIVATIVE_PRIMES);
        d.set (3,     "derivative", DERIVATIVE_LIMIT);
        d.setObject (Operator.var ("t"), "derivative", DERIVATIVE_VARIABLE);
        defaults = d;
        layers.push (new MVolatile ());
    }

    /**
        The policy consulted by renderers that are not given one explicitly.
    **/
    public static synchronized RenderPolicy shared ()
    {
        if (shared == null) shared = new RenderPolicy ();
        return shared;
    }

    /**
        A guard for one override layer. Closing it pops exactly that layer.
    **/
    public class Scope implements AutoCloseable
    {
        protected MVolatile layer;
        protected boolean   closed;

        protected Scope (MVolatile layer)
        {
            this.layer = layer;
        }

        public void close ()
        {
            synchronized (RenderPolicy.this)
            {
                if (closed) return;
                if (layers.peek () != layer) throw new IllegalStateException ("Rendering policy scopes must be closed in the reverse order they were entered.");
                layers.pop ();
                closed = true;
            }
        }
    }

    public synchronized Scope enter ()
    {
        MVolatile layer = new MVolatile ();
        layers.push (layer);
        if (logger.isDebugEnabled ()) logger.debug ("entered rendering scope, depth " + depth ());
        return new Scope (layer);
    }

    /**
        @return Number of scopes currently entered. 0 means only the process-wide layer is active.
    **/
    public synchronized int depth ()
    {
        return layers.size () - 1;
    }

    /**
        @return The innermost layer that defines the given key, or the defaults.
    **/
    protected synchronized MNode lookup (String... keys)
    {
        Iterator<MVolatile> it = layers.iterator ();  // ArrayDeque used as a stack iterates from the top
        while (it.hasNext ())
        {
            MVolatile layer = it.next ();
            if (layer.data (keys)) return layer;
        }
        return defaults;
    }

    protected synchronized MVolatile top ()
    {
        return layers.peek ();
    }

    public boolean vectorAsTuple ()
    {
        return lookup ("vector", VECTOR_TUPLE).getFlag ("vector", VECTOR_TUPLE);
    }

    /**
        When set, single-column matrices render as a parenthesized tuple instead of a column.
    **/
    public void setVectorAsTuple (boolean value)
    {
        top ().set (value, "vector", VECTOR_TUPLE);
    }

    public boolean derivativePrimes ()
    {
        return lookup ("derivative", DERIVATIVE_PRIMES).getFlag ("derivative", DERIVATIVE_PRIMES);
    }

    /**
        When set, a derivative in the single reference variable renders with primes
        rather than as a Leibniz fraction.
    **/
    public void setDerivativePrimes (boolean value)
    {
        top ().set (value, "derivative", DERIVATIVE_PRIMES);
    }

    public Operator derivativeVariable ()
    {
        MNode layer = lookup ("derivative", DERIVATIVE_VARIABLE);
        return (Operator) ((MVolatile) layer).getObject ("derivative", DERIVATIVE_VARIABLE);
    }

    public void setDerivativeVariable (Operator v)
    {
        if (v == null  ||  ! v.is (Function.VAR)) throw new IllegalArgumentException ("The reference variable for derivatives must be a variable, got " + v);
        top ().setObject (v, "derivative", DERIVATIVE_VARIABLE);
    }

    public int derivativeLimit ()
    {
        return lookup ("derivative", DERIVATIVE_LIMIT).getOrDefault (3, "derivative", DERIVATIVE_LIMIT);
    }

    /**
        Highest order still written with primes. Beyond it the order appears in parentheses.
    **/
    public void setDerivativeLimit (int n)
    {
        if (n < 0) throw new IllegalArgumentException ("The prime limit for derivatives must be non-negative, got " + n);
        top ().set (n, "derivative", DERIVATIVE_LIMIT);
    }
}
