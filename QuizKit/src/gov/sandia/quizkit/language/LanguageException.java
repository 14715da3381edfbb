/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

/**
    Root of all failures reported by the expression engine.
    These are hard stops. There is no partial result attached.
**/
public class LanguageException extends RuntimeException
{
    public LanguageException (String msg)
    {
        super (msg);
    }

    public LanguageException (String msg, Throwable cause)
    {
        super (msg, cause);
    }
}
