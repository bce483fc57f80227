package com.gaussjordan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a matrix from plain text: one row per line, entries separated by runs
 * of whitespace.  Blank lines are ignored.  The first row fixes the column
 * count; nothing is padded or truncated.
 */
public final class MatrixParser {
    private static final Logger log = LoggerFactory.getLogger(MatrixParser.class);

    private MatrixParser() {}

    public static Matrix parse(String text) throws MatrixFormatException {
        if (text == null) throw new MatrixFormatException("No rows found.");
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException(e);
        }
    }

    public static Matrix parse(Reader in) throws IOException, MatrixFormatException {
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(in)) {
            String line;
            while ((line = br.readLine()) != null) {
                String t = line.trim();
                if (t.isEmpty()) continue;
                rows.add(t.split("\\s+"));
            }
        }
        if (rows.isEmpty()) throw new MatrixFormatException("No rows found.");

        int m = rows.size();
        int n = rows.get(0).length;
        double[] values = new double[m * n];
        for (int i = 0; i < m; i++) {
            String[] tokens = rows.get(i);
            if (tokens.length != n) {
                log.warn("Rejected input: row {} has {} columns, expected {}", i + 1, tokens.length, n);
                throw new MatrixFormatException("Row " + (i + 1) + " has " + tokens.length
                        + " columns, but expected " + n + ".", i + 1, 0, null);
            }
            for (int j = 0; j < n; j++) {
                values[i * n + j] = parseEntry(tokens[j], i + 1, j + 1);
            }
        }
        log.debug("Parsed {}x{} matrix", m, n);
        return Matrix.create(m, n, values);
    }

    private static double parseEntry(String token, int row, int col) throws MatrixFormatException {
        double v;
        try {
            v = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            v = Double.NaN;
        }
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            log.warn("Rejected input: token '{}' at row {}, column {}", token, row, col);
            throw new MatrixFormatException("Invalid number '" + token + "' at Row " + row
                    + ", Column " + col + ".", row, col, token);
        }
        return v;
    }
}
