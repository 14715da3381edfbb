/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language.type;

import gov.sandia.quizkit.language.Type;

/**
    Opaque label. Used for symbol names and for literal markup fragments.
**/
public class Text extends Type
{
    public final String value;

    public Text (String value)
    {
        if (value == null) throw new IllegalArgumentException ("Text value must not be null");
        this.value = value;
    }

    public int compareTo (Type that)
    {
        if (that instanceof Text) return value.compareTo (((Text) that).value);
        return 1;  // text after numbers
    }

    public int hashCode ()
    {
        return value.hashCode ();
    }

    public String toString ()
    {
        return value;
    }
}
