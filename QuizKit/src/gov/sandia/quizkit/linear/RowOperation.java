/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Times;
import gov.sandia.quizkit.tex.TexRenderer;

/**
    One elementary row operation, as recorded by the step log of row reduction.
    Rows are numbered from 1.
**/
public class RowOperation
{
    public enum Kind
    {
        SWAP,    ///< R_row <-> R_other
        SCALE,   ///< c R_row -> R_row
        REPLACE  ///< R_row + c R_other -> R_row
    }

    public final Kind     kind;
    public final int      row;
    public final int      other;        ///< 0 for SCALE
    public final Operator coefficient;  ///< null for SWAP

    public RowOperation (Kind kind, int row, int other, Operator coefficient)
    {
        this.kind        = kind;
        this.row         = row;
        this.other       = other;
        this.coefficient = coefficient;
    }

    public static Operator rowSymbol (int i)
    {
        return Operator.var ("R_{" + i + "}");
    }

    public String toTex ()
    {
        Operator Ri = rowSymbol (row);
        TexRenderer renderer = new TexRenderer ();
        switch (kind)
        {
            case SWAP:
                return renderer.tex (Ri) + " \\leftrightarrow " + renderer.tex (rowSymbol (other));
            case SCALE:
                return renderer.tex (new Function (Times.NAME, coefficient, Ri)) + " \\rightarrow " + renderer.tex (Ri);
            default:
                Operator sum = new Function (Plus.NAME, Ri, new Function (Times.NAME, coefficient, rowSymbol (other)));
                return renderer.tex (sum) + " \\rightarrow " + renderer.tex (Ri);
        }
    }

    public String toString ()
    {
        return toTex ();
    }
}
