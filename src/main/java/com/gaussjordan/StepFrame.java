package com.gaussjordan;

import java.util.Objects;

/**
 * What a renderer needs after each step: the matrix as it now stands, the
 * pivot cursor, the latest description and whether the run is still active.
 * The matrix is a private copy; {@link #matrix()} hands out further copies.
 */
public final class StepFrame {
    private final Matrix matrix;
    private final PivotCursor cursor;
    private final String description;
    private final boolean runActive;

    public StepFrame(Matrix matrix, PivotCursor cursor, String description, boolean runActive) {
        this.matrix = Objects.requireNonNull(matrix, "matrix").copy();
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.description = Objects.requireNonNull(description, "description");
        this.runActive = runActive;
    }

    static StepFrame of(StepEngine engine, String description) {
        return new StepFrame(engine.snapshot(), engine.cursor(), description, engine.isRunActive());
    }

    public Matrix matrix() { return matrix.copy(); }
    public int rows() { return matrix.rows(); }
    public int cols() { return matrix.cols(); }
    public double get(int r, int c) { return matrix.get(r, c); }

    /** Only meaningful while {@link #runActive()}. */
    public PivotCursor cursor() { return cursor; }

    public String description() { return description; }
    public boolean runActive() { return runActive; }
}
