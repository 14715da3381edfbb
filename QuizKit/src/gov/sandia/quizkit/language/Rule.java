/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    One rewrite rule for a particular head. Rules receive a node whose operands have
    already been evaluated (and flattened, where the head is Flat).
**/
public interface Rule
{
    /**
        @return The replacement expression, or null if this rule does not apply.
        Returning a node structurally equal to f also counts as "does not apply".
    **/
    public Operator apply (Function f, Evaluator evaluator);
}
