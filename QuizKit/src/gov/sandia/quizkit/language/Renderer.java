/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    A visitor for Operator which collects a string. The default rendering built into
    each Operator is the internal head-and-arguments form, useful for debugging.
    Subclass this to produce other notations.
**/
public class Renderer
{
    public StringBuilder result;

    public Renderer ()
    {
        result = new StringBuilder ();
    }

    public Renderer (StringBuilder result)
    {
        this.result = result;
    }

    /**
        @return true if this function rendered the operator. false if the operator should render itself (using its default method).
    **/
    public boolean render (Operator op)
    {
        return false;
    }
}
