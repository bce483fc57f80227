package com.gaussjordan;

import java.util.Locale;

/**
 * Text rendering of a {@link StepFrame}.  Values are shown with a fixed number
 * of decimals after near-zero cleanup; the constant column is set off by a bar.
 * Markers: {@code [x]} pivot, {@code <x>} pivot row or column,
 * {@code *x*} a one in a coefficient column once the run is finished.
 */
public final class MatrixRenderer {
    public static final int DEFAULT_DECIMALS = 2;

    private final int decimals;

    public MatrixRenderer() { this(DEFAULT_DECIMALS); }

    public MatrixRenderer(int decimals) {
        if (decimals < 0 || decimals > 10) {
            throw new IllegalArgumentException("decimals must be in [0, 10], got " + decimals);
        }
        this.decimals = decimals;
    }

    /** Formats one value; entries within epsilon of zero print as zero. */
    public String format(double v) {
        double clean = Tolerance.clean(v);
        if (clean == 0.0) clean = 0.0;   // drop the sign of -0.0
        return String.format(Locale.ROOT, "%." + decimals + "f", clean);
    }

    public static CellRole roleOf(StepFrame f, int r, int c) {
        if (f.runActive()) {
            PivotCursor p = f.cursor();
            if (r == p.row() && c == p.col()) return CellRole.PIVOT;
            if (r == p.row()) return CellRole.PIVOT_ROW;
            if (c == p.col()) return CellRole.PIVOT_COLUMN;
            return CellRole.PLAIN;
        }
        int n = f.cols();
        if (n > 1 && c == n - 1) return CellRole.CONSTANT;
        if (c < n - 1 && Tolerance.isOne(Tolerance.clean(f.get(r, c)))) return CellRole.PIVOT_ONE;
        return CellRole.PLAIN;
    }

    public String render(StepFrame f) {
        int m = f.rows(), n = f.cols();
        String[][] cells = new String[m][n];
        int width = 0;
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                cells[i][j] = decorate(format(f.get(i, j)), roleOf(f, i, j));
                width = Math.max(width, cells[i][j].length());
            }
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                if (j > 0) sb.append(n > 1 && j == n - 1 ? " | " : "  ");
                sb.append(pad(cells[i][j], width));
            }
            sb.append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static String decorate(String text, CellRole role) {
        switch (role) {
            case PIVOT:        return "[" + text + "]";
            case PIVOT_ROW:
            case PIVOT_COLUMN: return "<" + text + ">";
            case PIVOT_ONE:    return "*" + text + "*";
            default:           return " " + text + " ";
        }
    }

    private static String pad(String s, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int k = s.length(); k < width; k++) sb.append(' ');
        return sb.append(s).toString();
    }
}
