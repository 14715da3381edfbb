/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    Malformed input to a constructor: ragged or empty matrix, bad index,
    wrong number of arguments for a head with fixed arity, incompatible shapes.
**/
public class ConstructionException extends LanguageException
{
    public ConstructionException (String msg)
    {
        super (msg);
    }
}
