/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.quizkit.linear;

import gov.sandia.quizkit.language.ConstructionException;
import gov.sandia.quizkit.language.Evaluator;
import gov.sandia.quizkit.language.Function;
import gov.sandia.quizkit.language.Operator;
import gov.sandia.quizkit.language.RuleTable;
import gov.sandia.quizkit.language.Sequence;

/**
    A matrix assembled from a grid of blocks: block_matrix(blockRow, blockRow, ...), where each
    block row is a list of blocks. Once every block is a concrete matrix, the grid flattens into
    a single matrix. While any block is still symbolic, the node stays as it is, which is how
    partitioned matrices get displayed.
**/
public class BlockMatrix implements RuleTable.Extension
{
    public static final String NAME = "block_matrix";

    public void register (RuleTable table)
    {
        table.declareArity (NAME, 1, RuleTable.UNBOUNDED);
        table.register (NAME, "flatten", 1, RuleTable.UNBOUNDED, BlockMatrix::flatten);
    }

    public static Function blockMatrix (Operator[]... blockRows)
    {
        Operator[] operands = new Operator[blockRows.length];
        for (int i = 0; i < blockRows.length; i++) operands[i] = new Sequence (blockRows[i]);
        checkGrid (operands);
        return new Function (NAME, operands);
    }

    /**
        Places the given blocks side by side.
    **/
    public static Operator withColumns (Evaluator evaluator, Operator... blocks)
    {
        return evaluator.evaluate (blockMatrix (new Operator[][] {blocks}));
    }

    /**
        Stacks the given blocks top to bottom.
    **/
    public static Operator withRows (Evaluator evaluator, Operator... blocks)
    {
        Operator[][] grid = new Operator[blocks.length][];
        for (int i = 0; i < blocks.length; i++) grid[i] = new Operator[] {blocks[i]};
        return evaluator.evaluate (blockMatrix (grid));
    }

    public static void checkGrid (Operator[] blockRows)
    {
        if (blockRows.length == 0) throw new ConstructionException ("A block matrix needs at least one block.");
        int width = -1;
        for (Operator row : blockRows)
        {
            if (! (row instanceof Sequence)) throw new ConstructionException ("Each row of a block matrix must be a list of blocks, got " + row);
            int w = ((Sequence) row).size ();
            if (width < 0) width = w;
            else if (w != width) throw new ConstructionException ("Not all block rows have the same number of blocks.");
        }
        if (width == 0) throw new ConstructionException ("A block matrix needs at least one block.");
    }

    public static Operator block (Function f, int i, int j)
    {
        return ((Sequence) f.operands[i]).elements[j];
    }

    public static Operator flatten (Function f, Evaluator evaluator)
    {
        checkGrid (f.operands);
        int blockRows    = f.operands.length;
        int blockColumns = ((Sequence) f.operands[0]).size ();
        for (int i = 0; i < blockRows; i++)
        {
            for (int j = 0; j < blockColumns; j++) if (! Matrices.isMatrix (block (f, i, j))) return null;
        }

        int[] heights = new int[blockRows];
        int[] widths  = new int[blockColumns];
        for (int i = 0; i < blockRows; i++)
        {
            heights[i] = Matrices.rows (block (f, i, 0));
            for (int j = 0; j < blockColumns; j++)
            {
                if (Matrices.rows (block (f, i, j)) != heights[i]) throw new ConstructionException ("Blocks in block row " + (i + 1) + " have different numbers of rows.");
            }
        }
        for (int j = 0; j < blockColumns; j++)
        {
            widths[j] = Matrices.columns (block (f, 0, j));
            for (int i = 0; i < blockRows; i++)
            {
                if (Matrices.columns (block (f, i, j)) != widths[j]) throw new ConstructionException ("Blocks in block column " + (j + 1) + " have different numbers of columns.");
            }
        }

        int h = 0;
        int w = 0;
        for (int n : heights) h += n;
        for (int n : widths)  w += n;
        Operator[][] result = new Operator[h][w];
        for (int i = 0, r0 = 0; i < blockRows; r0 += heights[i++])
        {
            for (int j = 0, c0 = 0; j < blockColumns; c0 += widths[j++])
            {
                Operator B = block (f, i, j);
                for (int r = 0; r < heights[i]; r++)
                {
                    for (int c = 0; c < widths[j]; c++) result[r0 + r][c0 + c] = Matrices.entry (B, r, c);
                }
            }
        }
        return Matrices.matrix (result);
    }
}
