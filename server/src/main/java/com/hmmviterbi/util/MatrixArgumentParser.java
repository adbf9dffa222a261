package com.hmmviterbi.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses list-literal text from the command line into numeric arrays.
 *
 * Matrices look like {@code [[0.9, 0.1], [0.1, 0.9]]}: non-empty, every row
 * non-empty and of equal length. Numbers need a leading digit ({@code 0.2},
 * not {@code .2}); a trailing point ({@code 1.}) is accepted. Integer lists
 * look like {@code [0, 0, 1]} and may be empty. Whitespace is ignored.
 */
public class MatrixArgumentParser {

    static final String NUMBER = "-?\\d+(?:\\.\\d*)?";
    static final String INTEGER = "-?\\d+";
    static final String ROW = "\\[(?:" + NUMBER + ",)*" + NUMBER + "]";

    private static final Pattern NUMBER_PATTERN = Pattern.compile(NUMBER);
    private static final Pattern INTEGER_PATTERN = Pattern.compile(INTEGER);
    private static final Pattern ROW_PATTERN = Pattern.compile(ROW);
    private static final Pattern MATRIX_PATTERN = Pattern.compile("\\[(?:" + ROW + ",)*" + ROW + "]");
    private static final Pattern INT_LIST_PATTERN = Pattern.compile("\\[(?:(?:" + INTEGER + ",)*" + INTEGER + ")?]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static double[][] parseMatrix(String text) {
        if (text == null) {
            throw new ArgumentParseException("No matrix provided");
        }
        String clean = WHITESPACE.matcher(text).replaceAll("");
        if (!MATRIX_PATTERN.matcher(clean).matches()) {
            throw new ArgumentParseException("Provided string does not represent a 2D-array: " + text);
        }

        List<double[]> rows = new ArrayList<>();
        Matcher rowMatcher = ROW_PATTERN.matcher(clean);
        while (rowMatcher.find()) {
            List<Double> values = new ArrayList<>();
            Matcher numberMatcher = NUMBER_PATTERN.matcher(rowMatcher.group());
            while (numberMatcher.find()) {
                values.add(Double.parseDouble(numberMatcher.group()));
            }
            double[] row = new double[values.size()];
            for (int i = 0; i < row.length; i++) {
                row[i] = values.get(i);
            }
            rows.add(row);
        }

        int width = rows.get(0).length;
        for (int i = 1; i < rows.size(); i++) {
            if (rows.get(i).length != width) {
                throw new ArgumentParseException("Row " + i + " has " + rows.get(i).length
                        + " entries but row 0 has " + width);
            }
        }
        return rows.toArray(new double[0][]);
    }

    public static int[] parseIntList(String text) {
        if (text == null) {
            throw new ArgumentParseException("No integer list provided");
        }
        String clean = WHITESPACE.matcher(text).replaceAll("");
        if (!INT_LIST_PATTERN.matcher(clean).matches()) {
            throw new ArgumentParseException("Provided string does not represent a list of integers: " + text);
        }

        List<Integer> values = new ArrayList<>();
        Matcher m = INTEGER_PATTERN.matcher(clean);
        while (m.find()) {
            try {
                values.add(Integer.parseInt(m.group()));
            } catch (NumberFormatException e) {
                throw new ArgumentParseException("Integer out of range: " + m.group(), e);
            }
        }
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
