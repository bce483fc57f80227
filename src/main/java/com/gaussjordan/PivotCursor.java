package com.gaussjordan;

/** Next unprocessed pivot position, zero-based.  Immutable. */
public final class PivotCursor {
    private static final PivotCursor ORIGIN = new PivotCursor(0, 0);

    private final int row;
    private final int col;

    private PivotCursor(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static PivotCursor origin() { return ORIGIN; }

    public static PivotCursor of(int row, int col) {
        if (row < 0 || col < 0) throw new IllegalArgumentException("Negative cursor (" + row + ", " + col + ")");
        return new PivotCursor(row, col);
    }

    public int row() { return row; }
    public int col() { return col; }

    /** Same row, next column: the column had no pivot. */
    public PivotCursor nextColumn() { return new PivotCursor(row, col + 1); }

    /** Diagonal step after a completed pivot column. */
    public PivotCursor nextPivot() { return new PivotCursor(row + 1, col + 1); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PivotCursor)) return false;
        PivotCursor o = (PivotCursor) obj;
        return row == o.row && col == o.col;
    }

    @Override public int hashCode() { return row * 31 + col; }

    @Override public String toString() { return "(" + row + ", " + col + ")"; }
}
