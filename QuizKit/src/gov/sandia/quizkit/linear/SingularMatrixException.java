/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import gov.sandia.quizkit.language.EvaluationException;

/**
    Inverse (or negative power) requested for a matrix whose determinant is zero.
**/
public class SingularMatrixException extends EvaluationException
{
    public SingularMatrixException (String msg)
    {
        super (msg);
    }
}
