/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.db;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import gov.sandia.quizkit.language.Operator;

import org.junit.Test;

public class MVolatileTest
{
    @Test
    public void testTypedSettings ()
    {
        MVolatile layer = new MVolatile ();
        layer.set (true,  "derivative", "primes");
        layer.set (false, "vector",     "tuple");
        layer.set (5,     "derivative", "limit");

        assertTrue  (layer.getFlag ("derivative", "primes"));
        assertFalse (layer.getFlag ("vector", "tuple"));
        assertEquals ("0", layer.get ("vector", "tuple"));
        assertEquals (5, layer.getOrDefault (3, "derivative", "limit"));
        assertEquals (3, layer.getOrDefault (3, "derivative", "missing"));
        assertTrue (layer.getOrDefault (true, "vector", "missing"));

        layer.set ("lots", "derivative", "limit");
        assertEquals (3, layer.getOrDefault (3, "derivative", "limit"));
    }

    @Test
    public void testDefinedOnlyWhereSet ()
    {
        MVolatile layer = new MVolatile ();
        assertFalse (layer.data ("derivative", "limit"));
        layer.set (2, "derivative", "limit");
        assertTrue  (layer.data ("derivative", "limit"));
        assertFalse (layer.data ("derivative"));  // interior node has no value of its own
        assertEquals ("derivative", layer.child ("derivative").key ());

        layer.set (null, "derivative", "limit");
        assertFalse (layer.data ("derivative", "limit"));
        assertEquals ("", layer.get ("derivative", "limit"));
    }

    @Test
    public void testObjects ()
    {
        MVolatile layer = new MVolatile ();
        Operator t = Operator.var ("t");
        layer.setObject (t, "derivative", "variable");
        assertSame (t, layer.getObject ("derivative", "variable"));
        assertTrue (layer.data ("derivative", "variable"));
        assertNull (layer.getObject ("derivative", "other"));
    }
}
