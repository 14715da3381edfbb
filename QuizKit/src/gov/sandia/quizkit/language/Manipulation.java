/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.language;

import java.util.Collections;
import java.util.Map;

import gov.sandia.quizkit.language.function.Plus;
import gov.sandia.quizkit.language.function.Power;
import gov.sandia.quizkit.language.function.Times;

/**
    Tree-level rewriting that is not part of canonical evaluation: substitution and expansion.
**/
public class Manipulation
{
    public static Operator replace (Evaluator evaluator, Operator e, Operator pattern, Operator value)
    {
        return replace (evaluator, e, Collections.singletonMap (pattern, value));
    }

    /**
        Replaces every subtree structurally equal to a key with the associated value, top-down.
        A replaced subtree is not searched further. Everything rebuilt along the way is re-evaluated.
    **/
    public static Operator replace (Evaluator evaluator, Operator e, Map<Operator,Operator> substitutions)
    {
        Operator value = substitutions.get (e);
        if (value != null) return value;
        if (e instanceof Function)
        {
            Function f = (Function) e;
            Operator[] operands = new Operator[f.operands.length];
            for (int i = 0; i < operands.length; i++) operands[i] = replace (evaluator, f.operands[i], substitutions);
            return evaluator.evaluate (new Function (f.name, operands));
        }
        if (e instanceof Sequence)
        {
            Operator[] elements = ((Sequence) e).elements;
            Operator[] result = new Operator[elements.length];
            for (int i = 0; i < result.length; i++) result[i] = replace (evaluator, elements[i], substitutions);
            return new Sequence (result);
        }
        return e;
    }

    /**
        Distributes products over sums everywhere in e. A product containing a sum distributes
        the remaining factors over the terms of that sum. A positive integer power of a sum peels
        off one factor of the sum and distributes it over the rest. A negative integer power
        (other than -1) becomes the reciprocal of the expanded positive power. Each piece is
        expanded again as it is produced.
    **/
    public static Operator expand (Evaluator evaluator, Operator e)
    {
        if (e instanceof Constant) return e;
        if (e instanceof Sequence)
        {
            Operator[] elements = ((Sequence) e).elements;
            Operator[] result = new Operator[elements.length];
            for (int i = 0; i < result.length; i++) result[i] = expand (evaluator, elements[i]);
            return new Sequence (result);
        }

        Function f = (Function) e;
        Operator[] operands = new Operator[f.operands.length];
        for (int i = 0; i < operands.length; i++) operands[i] = expand (evaluator, f.operands[i]);

        if (f.name.equals (Times.NAME))
        {
            for (int i = 0; i < operands.length; i++)
            {
                if (! operands[i].is (Plus.NAME)) continue;
                Operator[] others = new Operator[operands.length - 1];
                for (int j = 0, k = 0; j < operands.length; j++) if (j != i) others[k++] = operands[j];
                Operator rest = expand (evaluator, evaluator.times (others));
                return distribute (evaluator, (Function) operands[i], rest);
            }
        }

        if (f.name.equals (Power.NAME)  &&  f.operands.length == 2  &&  f.operands[0].is (Plus.NAME))
        {
            Operator n = f.operands[1];
            if (Constant.isInteger (n)  &&  Constant.signum (n) > 0)
            {
                Operator rest = expand (evaluator, evaluator.power (f.operands[0], evaluator.plus (n, Constant.MINUS_ONE)));
                return distribute (evaluator, (Function) f.operands[0], rest);
            }
            if (Constant.isInteger (n)  &&  Constant.signum (n) < 0  &&  ! n.equals (Constant.MINUS_ONE))
            {
                Operator positive = expand (evaluator, new Function (Power.NAME, f.operands[0], evaluator.negate (n)));
                return evaluator.power (positive, Constant.MINUS_ONE);
            }
        }

        return evaluator.evaluate (new Function (f.name, operands));
    }

    protected static Operator distribute (Evaluator evaluator, Function sum, Operator rest)
    {
        Operator result = Constant.ZERO;
        for (Operator term : sum.operands)
        {
            result = evaluator.plus (result, expand (evaluator, evaluator.times (term, rest)));
        }
        return result;
    }
}
