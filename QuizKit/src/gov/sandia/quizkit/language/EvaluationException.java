/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    A mathematically undefined operation, detected while evaluating.
**/
public class EvaluationException extends LanguageException
{
    public EvaluationException (String msg)
    {
        super (msg);
    }
}
