package com.gaussjordan;

/**
 * Thrown when text handed to {@link MatrixParser} does not describe a
 * rectangular grid of finite numbers.  Row and column are 1-based as shown to
 * the user; either is 0 when the error is not tied to a position.
 */
public class MatrixFormatException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int row;
    private final int column;
    private final String token;

    public MatrixFormatException(String message) {
        this(message, 0, 0, null);
    }

    public MatrixFormatException(String message, int row, int column, String token) {
        super(message);
        this.row = row;
        this.column = column;
        this.token = token;
    }

    public int row() { return row; }
    public int column() { return column; }

    /** The offending token, or {@code null} for shape errors. */
    public String token() { return token; }
}
