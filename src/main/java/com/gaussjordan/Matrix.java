package com.gaussjordan;

import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Objects;

/**
 * A dense, mutable matrix of finite {@code double} values.  Rows and columns
 * are indexed from zero.  Besides element access it offers exactly the three
 * elementary row operations; it knows nothing about how they are sequenced.
 */
public final class Matrix {
    private final int rows;
    private final int cols;
    private final double[][] data;

    private Matrix(int rows, int cols, double[][] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * Creates a {@code rows × cols} matrix from row-major {@code values}.
     *
     * @throws IllegalArgumentException if either extent is below one, if
     *         {@code values} does not hold exactly {@code rows * cols} entries,
     *         or if any entry is NaN or infinite
     */
    public static Matrix create(int rows, int cols, double... values) {
        Objects.requireNonNull(values, "values");
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Matrix must be at least 1x1, got " + rows + "x" + cols);
        }
        if (values.length != (long) rows * cols) {
            throw new IllegalArgumentException("Expected " + ((long) rows * cols) + " values for a "
                    + rows + "x" + cols + " matrix, got " + values.length);
        }
        double[][] data = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double v = values[i * cols + j];
                requireFinite(v, i, j);
                data[i][j] = v;
            }
        }
        return new Matrix(rows, cols, data);
    }

    /** Creates a matrix from a rectangular array; the array is copied. */
    public static Matrix of(double[][] rowsData) {
        Objects.requireNonNull(rowsData, "rows");
        if (rowsData.length == 0) {
            throw new IllegalArgumentException("Matrix must have at least one row");
        }
        int n = rowsData[0].length;
        double[] flat = new double[rowsData.length * n];
        for (int i = 0; i < rowsData.length; i++) {
            if (rowsData[i].length != n) {
                throw new IllegalArgumentException("Row " + i + " has " + rowsData[i].length
                        + " entries, expected " + n);
            }
            System.arraycopy(rowsData[i], 0, flat, i * n, n);
        }
        return create(rowsData.length, n, flat);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    /** Returns the entry at row {@code r}, column {@code c}. */
    public double get(int r, int c) {
        checkCell(r, c);
        return data[r][c];
    }

    /** Sets the entry at row {@code r}, column {@code c}. */
    public void set(int r, int c, double value) {
        checkCell(r, c);
        requireFinite(value, r, c);
        data[r][c] = value;
    }

    /** Exchanges rows {@code r1} and {@code r2}; a no-op when they are equal. */
    public void swapRows(int r1, int r2) {
        checkRow(r1);
        checkRow(r2);
        if (r1 == r2) return;
        double[] tmp = data[r1];
        data[r1] = data[r2];
        data[r2] = tmp;
    }

    /**
     * Multiplies every entry of row {@code r} by {@code factor}.  A zero factor
     * is accepted; avoiding it is the caller's business.
     *
     * @throws ArithmeticException if a product overflows; the row is left unchanged
     */
    public void scaleRow(int r, double factor) {
        checkRow(r);
        double[] row = data[r];
        double[] next = new double[cols];
        for (int j = 0; j < cols; j++) next[j] = row[j] * factor;
        data[r] = checkedRow(next, r, "scaling");
    }

    /**
     * {@code target += factor * source}, column by column.
     *
     * @throws ArithmeticException if a result overflows; the row is left unchanged
     */
    public void addScaledRow(int target, int source, double factor) {
        checkRow(target);
        checkRow(source);
        double[] t = data[target];
        double[] s = data[source];
        double[] next = new double[cols];
        for (int j = 0; j < cols; j++) next[j] = t[j] + factor * s[j];
        data[target] = checkedRow(next, target, "row addition");
    }

    private static double[] checkedRow(double[] row, int r, String op) {
        for (int j = 0; j < row.length; j++) {
            if (Double.isNaN(row[j]) || Double.isInfinite(row[j])) {
                throw new ArithmeticException("Overflow in " + op + " at (" + r + ", " + j + ")");
            }
        }
        return row;
    }

    /** Copy of row {@code r}. */
    public double[] row(int r) {
        checkRow(r);
        return Arrays.copyOf(data[r], cols);
    }

    public double[][] toArray() {
        double[][] a = new double[rows][];
        for (int i = 0; i < rows; i++) a[i] = Arrays.copyOf(data[i], cols);
        return a;
    }

    public Matrix copy() {
        return new Matrix(rows, cols, toArray());
    }

    /**
     * Writes the raw stored values, one row per line, so a finished run can be
     * fed back to {@link MatrixParser} unchanged.
     */
    public void write(Writer out) throws IOException {
        String nl = System.lineSeparator();
        for (double[] row : data) {
            for (int j = 0; j < cols; j++) {
                out.write(j == 0 ? "" : " ");
                out.write(Double.toString(row[j]));
            }
            out.write(nl);
        }
        out.flush();
    }

    // bitwise element equality (Double.doubleToLongBits), so -0.0 != 0.0
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix o = (Matrix) obj;
        return rows == o.rows && cols == o.cols && Arrays.deepEquals(data, o.data);
    }

    @Override public int hashCode() { return Arrays.deepHashCode(data); }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder("Matrix ").append(rows).append('x').append(cols);
        for (double[] row : data) sb.append(' ').append(Arrays.toString(row));
        return sb.toString();
    }

    private void checkRow(int r) {
        if (r < 0 || r >= rows) {
            throw new IndexOutOfBoundsException("Row " + r + " out of range [0, " + rows + ")");
        }
    }

    private void checkCell(int r, int c) {
        checkRow(r);
        if (c < 0 || c >= cols) {
            throw new IndexOutOfBoundsException("Column " + c + " out of range [0, " + cols + ")");
        }
    }

    private static void requireFinite(double v, int r, int c) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new IllegalArgumentException("Non-finite value " + v + " at (" + r + ", " + c + ")");
        }
    }
}
