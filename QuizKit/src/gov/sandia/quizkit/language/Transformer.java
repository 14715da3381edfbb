/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    A visitor for Operator which builds a rewritten tree.
    Nodes are never modified in place, so the result shares every subtree the transformer leaves alone.
**/
public class Transformer
{
    /**
        @return The replacement Operator, or null if no action was taken. When null is
        returned, the Operator performs its own default action, which is to recurse
        down the tree and rebuild itself only if some child changed.
    **/
    public Operator transform (Operator op)
    {
        return null;
    }
}
