/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.db;

import java.util.TreeMap;

/**
    In-memory MNode. A value may also be stored as an arbitrary object via setObject(),
    for settings such as a reference variable that have no faithful string form.
**/
public class MVolatile extends MNode
{
    protected String                name;
    protected Object                value;
    protected TreeMap<String,MNode> children;

    public MVolatile ()
    {
    }

    public MVolatile (String value, String name)
    {
        this.name  = name;
        this.value = value;
    }

    public String key ()
    {
        if (name == null) return "";
        return name;
    }

    protected synchronized MNode getChild (String key)
    {
        if (children == null) return null;
        return children.get (key);
    }

    public synchronized boolean data ()
    {
        return value != null;
    }

    public synchronized String getOrDefault (String defaultValue)
    {
        if (value == null) return defaultValue;
        String result = value.toString ();
        if (result.isEmpty ()) return defaultValue;
        return result;
    }

    /**
        @return The object stored at the given path, or null if there is none.
    **/
    public synchronized Object getObject (String... keys)
    {
        MNode c = child (keys);
        if (! (c instanceof MVolatile)) return null;
        return ((MVolatile) c).value;
    }

    public synchronized void set (String value)
    {
        this.value = value;
    }

    public synchronized MNode set (String value, String key)
    {
        if (children == null) children = new TreeMap<String,MNode> ();
        MNode result = children.get (key);
        if (result == null)
        {
            result = new MVolatile (value, key);
            children.put (key, result);
            return result;
        }
        result.set (value);
        return result;
    }

    public synchronized MNode setObject (Object value, String... keys)
    {
        MVolatile result = (MVolatile) childOrCreate (keys);
        result.value = value;
        return result;
    }
}
