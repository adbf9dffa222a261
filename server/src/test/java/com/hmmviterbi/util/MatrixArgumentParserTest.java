package com.hmmviterbi.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MatrixArgumentParserTest {

    @Test
    public void testParseMatrix() {
        double[][] m = MatrixArgumentParser.parseMatrix("[ [1.2, 0.] , [3.66666, 2]   ]");
        Assertions.assertEquals(2, m.length);
        Assertions.assertArrayEquals(new double[] { 1.2, 0.0 }, m[0], 0.0);
        Assertions.assertArrayEquals(new double[] { 3.66666, 2.0 }, m[1], 0.0);

        double[][] column = MatrixArgumentParser.parseMatrix("[ [ 1.2] , [ 3.66666], [4 ]  ]");
        Assertions.assertEquals(3, column.length);
        Assertions.assertEquals(4.0, column[2][0], 0.0);

        double[][] negative = MatrixArgumentParser.parseMatrix("[[-0.3,0.],[4.2,-0.003]]");
        Assertions.assertEquals(-0.003, negative[1][1], 0.0);
    }

    @Test
    public void testRejectMalformedMatrices() {
        String[] bad = {
                "[ [1.2, 0.] , [3.66666]   ]",
                "[ [1.2, 0.] , [3.66666, 4.5]",
                "[ [1.2 23] [12, 72.]]",
                "[]",
                "[[1.2, 3.5], []]",
                "[[1.2, 3.5], [1.0]]",
                "[[.2, 0.5]]",
                "[1.0, 2.0]",
        };
        for (String text : bad) {
            Assertions.assertThrows(ArgumentParseException.class, () -> MatrixArgumentParser.parseMatrix(text),
                    text);
        }
        Assertions.assertThrows(ArgumentParseException.class, () -> MatrixArgumentParser.parseMatrix(null));
    }

    @Test
    public void testParseIntList() {
        Assertions.assertArrayEquals(new int[] { 0, 0, 1, 0 }, MatrixArgumentParser.parseIntList("[0, 0, 1, 0]"));
        Assertions.assertArrayEquals(new int[] { -1 }, MatrixArgumentParser.parseIntList("[-1]"));
        Assertions.assertArrayEquals(new int[0], MatrixArgumentParser.parseIntList("[ ]"));
    }

    @Test
    public void testRejectMalformedIntLists() {
        String[] bad = { "0,1", "[0,1", "[0.5]", "[0,,1]", "[a]", "[99999999999]" };
        for (String text : bad) {
            Assertions.assertThrows(ArgumentParseException.class, () -> MatrixArgumentParser.parseIntList(text),
                    text);
        }
    }
}
