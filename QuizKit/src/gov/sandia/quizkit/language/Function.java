/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import java.util.Arrays;
import java.util.List;

import gov.sandia.quizkit.language.type.Text;

/**
    A compound node: head tag plus ordered operands.
    The meaning of a head comes entirely from the rules registered for it in a RuleTable.
    A head with no rules is simply an uninterpreted symbol, which is how var and const work.
**/
public class Function extends Operator
{
    public static final String VAR   = "var";
    public static final String CONST = "const";

    public final String     name;
    public final Operator[] operands;  // never modified after construction
    protected int hash;

    public Function (String name, Operator... operands)
    {
        if (name == null) throw new IllegalArgumentException ("Function head must not be null");
        this.name     = name;
        this.operands = operands.clone ();
    }

    public Function (String name, List<? extends Operator> operands)
    {
        if (name == null) throw new IllegalArgumentException ("Function head must not be null");
        this.name     = name;
        this.operands = operands.toArray (new Operator[operands.size ()]);
    }

    public String head ()
    {
        return name;
    }

    public boolean is (String head)
    {
        return name.equals (head);
    }

    public static boolean is (Operator e, String head, int arity)
    {
        return e instanceof Function  &&  ((Function) e).name.equals (head)  &&  ((Function) e).operands.length == arity;
    }

    public int size ()
    {
        return operands.length;
    }

    public Operator get (int i)
    {
        return operands[i];
    }

    /**
        @return A node with the same head and the given operands.
    **/
    public Function with (Operator... operands)
    {
        return new Function (name, operands);
    }

    /**
        @return true if e is var(name) or const(name).
    **/
    public static boolean isSymbol (Operator e)
    {
        if (! (e instanceof Function)) return false;
        Function f = (Function) e;
        return (f.name.equals (VAR)  ||  f.name.equals (CONST))  &&  f.operands.length == 1;
    }

    /**
        @return The label of var(name) or const(name), or null if e is neither.
    **/
    public static String symbolName (Operator e)
    {
        if (! isSymbol (e)) return null;
        Operator n = ((Function) e).operands[0];
        if (n instanceof Constant  &&  ((Constant) n).value instanceof Text) return ((Text) ((Constant) n).value).value;
        return n.toString ();
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator op : operands) op.visit (visitor);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;

        Operator[] next = null;
        for (int i = 0; i < operands.length; i++)
        {
            Operator op = operands[i].transform (transformer);
            if (op == operands[i]) continue;
            if (next == null) next = operands.clone ();
            next[i] = op;
        }
        if (next == null) return this;
        return new Function (name, next);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (name + "(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) renderer.result.append (", ");
            operands[i].render (renderer);
        }
        renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (that == this) return true;
        if (! (that instanceof Function)) return false;
        Function f = (Function) that;
        if (hashCode () != f.hashCode ()) return false;
        return name.equals (f.name)  &&  Arrays.equals (operands, f.operands);
    }

    public int hashCode ()
    {
        if (hash == 0) hash = 31 * name.hashCode () + Arrays.hashCode (operands);
        return hash;
    }
}
