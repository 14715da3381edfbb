/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.tex;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static gov.sandia.quizkit.language.Operator.number;
import static gov.sandia.quizkit.language.Operator.var;

import org.junit.Test;

public class RenderPolicyTest
{
    @Test
    public void testDefaults ()
    {
        RenderPolicy p = new RenderPolicy ();
        assertFalse (p.vectorAsTuple ());
        assertTrue  (p.derivativePrimes ());
        assertEquals (3, p.derivativeLimit ());
        assertEquals (var ("t"), p.derivativeVariable ());
        assertEquals (0, p.depth ());
    }

    @Test
    public void testScopesNestAndRevert ()
    {
        RenderPolicy p = new RenderPolicy ();
        try (RenderPolicy.Scope outer = p.enter ())
        {
            p.setDerivativeLimit (5);
            try (RenderPolicy.Scope inner = p.enter ())
            {
                p.setDerivativeVariable (var ("x"));
                assertEquals (2, p.depth ());
                assertEquals (5, p.derivativeLimit ());  // inherited from the outer scope
                assertEquals (var ("x"), p.derivativeVariable ());
            }
            assertEquals (var ("t"), p.derivativeVariable ());
            assertEquals (5, p.derivativeLimit ());
        }
        assertEquals (3, p.derivativeLimit ());
        assertEquals (0, p.depth ());
    }

    @Test
    public void testRevertOnException ()
    {
        RenderPolicy p = new RenderPolicy ();
        try (RenderPolicy.Scope s = p.enter ())
        {
            p.setVectorAsTuple (true);
            throw new RuntimeException ("boom");
        }
        catch (RuntimeException e)
        {
            assertEquals ("boom", e.getMessage ());
        }
        assertFalse (p.vectorAsTuple ());
        assertEquals (0, p.depth ());
    }

    @Test
    public void testOutOfOrderClose ()
    {
        RenderPolicy p = new RenderPolicy ();
        RenderPolicy.Scope a = p.enter ();
        RenderPolicy.Scope b = p.enter ();
        try
        {
            a.close ();
            fail ("closed an outer scope first");
        }
        catch (IllegalStateException e)
        {
        }
        b.close ();
        b.close ();  // second close does nothing
        a.close ();
        assertEquals (0, p.depth ());
    }

    @Test
    public void testValidation ()
    {
        RenderPolicy p = new RenderPolicy ();
        try
        {
            p.setDerivativeLimit (-1);
            fail ("negative limit");
        }
        catch (IllegalArgumentException e)
        {
        }
        try
        {
            p.setDerivativeVariable (number (2));
            fail ("not a variable");
        }
        catch (IllegalArgumentException e)
        {
        }
    }

    @Test
    public void testProcessWideSetting ()
    {
        RenderPolicy p = new RenderPolicy ();
        p.setDerivativePrimes (false);  // no scope entered, so this persists
        try (RenderPolicy.Scope s = p.enter ())
        {
            assertFalse (p.derivativePrimes ());
        }
        assertFalse (p.derivativePrimes ());
    }
}
