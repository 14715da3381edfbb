/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.db;

/**
    A tree of settings addressed by key paths, such as "derivative"/"limit".
    A node can be "undefined". For reads this behaves like a value of "".
    Subclasses decide where values actually live.
**/
public class MNode
{
    public String key ()
    {
        return "";
    }

    /**
        Returns the child indicated by the given key, or null if it doesn't exist.
    **/
    protected MNode getChild (String key)
    {
        return null;
    }

    /**
        Returns a node from arbitrary depth, or null if any part of the path doesn't exist.
    **/
    public synchronized MNode child (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) return null;
            result = c;
        }
        return result;
    }

    public synchronized MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) c = result.set (null, key);
            result = c;
        }
        return result;
    }

    /**
        Indicates whether this node holds a value. Only a node explicitly set counts,
        so a layer can tell its own settings from ones it should inherit.
    **/
    public boolean data ()
    {
        return false;
    }

    public boolean data (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return false;
        return c.data ();
    }

    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.getOrDefault ("");
    }

    /**
        Returns this node's value, or the given default if it is undefined or set to "".
    **/
    public String getOrDefault (String defaultValue)
    {
        return defaultValue;
    }

    public boolean getOrDefault (boolean defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        if (value.equals ("1")) return true;
        return Boolean.parseBoolean (value);
    }

    public int getOrDefault (int defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Integer.parseInt (value);
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    public boolean getFlag (String... keys)
    {
        return getOrDefault (false, keys);
    }

    /**
        Sets this node's own value. Passing null makes the node undefined.
    **/
    public void set (String value)
    {
    }

    /**
        Sets the value of a direct child, creating it if needed.
        @return The child node on which the value was set.
    **/
    public MNode set (String value, String key)
    {
        throw new UnsupportedOperationException ("This node can't hold children");
    }

    /**
        Creates all nodes along the path, then stores the value. Booleans are stored as "1" or "0".
    **/
    public synchronized MNode set (Object value, String... keys)
    {
        MNode result = childOrCreate (keys);
        String stringValue = null;
        if (value instanceof Boolean) stringValue = (Boolean) value ? "1" : "0";
        else if (value != null)       stringValue = value.toString ();
        result.set (stringValue);
        return result;
    }
}
