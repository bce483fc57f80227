package com.gaussjordan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gauss-Jordan elimination to reduced row-echelon form, driven one micro-step
 * per {@link #advance()} call, followed by classification of the augmented
 * system {@code [A | b]} held in the last column.
 *
 * <p>The procedure is kept as an explicit state machine: a {@link Phase} tag
 * naming the next pause point, the {@link PivotCursor}, the row reached by the
 * elimination loop, and the pivot row / factor announced but not yet applied.
 * Every mutating action is reported twice, once announced and once performed,
 * so a caller re-rendering after each step sees the matrix before and after.
 *
 * <p>The engine owns a private copy of its matrix; callers only ever get
 * copies back.  Instances are not thread-safe.
 */
public final class StepEngine {
    private static final Logger log = LoggerFactory.getLogger(StepEngine.class);

    /** Resumption points of the elimination/classification procedure. */
    private enum Phase {
        LOOP_HEAD,          // test loop bounds, announce search or completion
        PIVOT_SCAN,         // scan the column, report what was found
        SWAP,               // perform the announced swap
        NORMALIZE,          // inspect the pivot value
        SCALE,              // perform the announced scaling
        ELIMINATION_START,
        ELIMINATION_SCAN,   // find the next row to clear, or finish the column
        ELIMINATION_APPLY,  // perform the announced row update
        NEXT_COLUMN,        // no pivot: move right, then loop head
        NEXT_PIVOT,         // column done: move diagonally, then loop head
        CLASSIFY,
        REPORT_NO_SOLUTION,
        REPORT_VERDICT,
        REPORT_DONE,
        DONE
    }

    private Matrix matrix;
    private int rows, cols;

    private PivotCursor cursor;
    private Phase phase;
    private RunState state;

    private int pendingRow;         // pivot row to swap in, or row being eliminated
    private double pendingFactor;   // scale factor or elimination factor
    private int eliminationRow;     // next candidate of the elimination loop

    private Step lastStep;
    private SolutionAnalysis analysis;

    public StepEngine(Matrix initial) {
        reset(initial);
    }

    /**
     * Discards the current matrix, cursor and resumption point and starts over
     * on a copy of {@code initial}.  Never fails for a non-null matrix.
     */
    public void reset(Matrix initial) {
        Objects.requireNonNull(initial, "matrix");
        this.matrix = initial.copy();
        this.rows = matrix.rows();
        this.cols = matrix.cols();
        this.cursor = PivotCursor.origin();
        this.phase = Phase.LOOP_HEAD;
        this.state = RunState.NOT_STARTED;
        this.pendingRow = -1;
        this.pendingFactor = 0.0;
        this.eliminationRow = 0;
        this.lastStep = null;
        this.analysis = null;
    }

    // --- Accessors

    public RunState state() { return state; }

    public boolean hasMoreSteps() { return phase != Phase.DONE; }

    /** True until the final step has been emitted. */
    public boolean isRunActive() { return state != RunState.FINISHED; }

    /** Current pivot position; only meaningful during forward elimination. */
    public PivotCursor cursor() { return cursor; }

    /** Copy of the matrix as it stands after the latest step. */
    public Matrix snapshot() { return matrix.copy(); }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public Optional<Step> lastStep() { return Optional.ofNullable(lastStep); }

    /** Classification result, present once the run has finished. */
    public Optional<SolutionAnalysis> analysis() { return Optional.ofNullable(analysis); }

    // --- Stepping

    /**
     * Executes up to the next pause point and returns its description.  Once
     * the run has finished every further call returns an empty optional.
     *
     * @throws ArithmeticException if a row operation would overflow the double
     *         range; the matrix and the resumption point are left as they were
     */
    public Optional<Step> advance() {
        if (phase == Phase.DONE) return Optional.empty();
        if (state == RunState.NOT_STARTED) state = RunState.IN_PROGRESS;
        Step step = dispatch();
        lastStep = step;
        log.debug("{} cursor={} -> {}", step.kind(), cursor, phase);
        return Optional.of(step);
    }

    /** Advances until exhausted and returns every step emitted on the way. */
    public List<Step> runToCompletion() {
        List<Step> out = new ArrayList<>();
        Optional<Step> s;
        while ((s = advance()).isPresent()) out.add(s.get());
        return out;
    }

    private Step dispatch() {
        switch (phase) {
            case LOOP_HEAD:          return loopHead();
            case PIVOT_SCAN:         return pivotScan();
            case SWAP:               return swap();
            case NORMALIZE:          return normalize();
            case SCALE:              return scale();
            case ELIMINATION_START:  return eliminationStart();
            case ELIMINATION_SCAN:   return eliminationScan();
            case ELIMINATION_APPLY:  return eliminationApply();
            case NEXT_COLUMN:
                cursor = cursor.nextColumn();
                return loopHead();
            case NEXT_PIVOT:
                cursor = cursor.nextPivot();
                return loopHead();
            case CLASSIFY:           return classify();
            case REPORT_NO_SOLUTION: return reportNoSolution();
            case REPORT_VERDICT:     return reportVerdict();
            case REPORT_DONE:        return reportDone();
            default:
                throw new IllegalStateException("No step in phase " + phase);
        }
    }

    // --- Phase A: forward elimination

    private Step loopHead() {
        if (cursor.row() < rows && cursor.col() < cols) {
            phase = Phase.PIVOT_SCAN;
            return step(StepKind.PIVOT_SEARCH, "Finding pivot in Column %d, at or below Row %d.",
                    cursor.col() + 1, cursor.row() + 1);
        }
        phase = Phase.CLASSIFY;
        return step(StepKind.COMPLETE, "RREF calculation complete. Analyzing system solution...");
    }

    private Step pivotScan() {
        int r0 = cursor.row(), c = cursor.col();
        int p = findPivotRow(r0, c);
        if (p < 0) {
            phase = Phase.NEXT_COLUMN;
            return step(StepKind.NO_PIVOT_IN_COLUMN, "Column %d has no pivot. Moving to next column.", c + 1);
        }
        if (p != r0) {
            pendingRow = p;
            phase = Phase.SWAP;
            return step(StepKind.PIVOT_FOUND, "Pivot found at (%d, %d). Swapping R%d and R%d.",
                    p + 1, c + 1, r0 + 1, p + 1);
        }
        phase = Phase.NORMALIZE;
        return step(StepKind.PIVOT_FOUND, "Pivot found at (%d, %d). No swap needed.", r0 + 1, c + 1);
    }

    /** First row at or below {@code from} with a non-zero entry in column {@code c}, or -1. */
    private int findPivotRow(int from, int c) {
        for (int r = from; r < rows; r++) {
            if (!Tolerance.isZero(matrix.get(r, c))) return r;
        }
        return -1;
    }

    private Step swap() {
        matrix.swapRows(cursor.row(), pendingRow);
        phase = Phase.NORMALIZE;
        return step(StepKind.SWAP_PERFORMED, "R%d and R%d swapped.", cursor.row() + 1, pendingRow + 1);
    }

    private Step normalize() {
        double v = matrix.get(cursor.row(), cursor.col());
        if (!Tolerance.isOne(v)) {
            pendingFactor = 1.0 / v;
            phase = Phase.SCALE;
            return step(StepKind.SCALE_NEEDED, "Scaling R%d by 1 / %.2f to make pivot = 1.", cursor.row() + 1, v);
        }
        phase = Phase.ELIMINATION_START;
        return step(StepKind.PIVOT_ALREADY_ONE, "Pivot is already 1. No scaling needed.");
    }

    private Step scale() {
        matrix.scaleRow(cursor.row(), pendingFactor);
        phase = Phase.ELIMINATION_START;
        return step(StepKind.SCALE_PERFORMED, "R%d scaled.", cursor.row() + 1);
    }

    private Step eliminationStart() {
        eliminationRow = 0;
        phase = Phase.ELIMINATION_SCAN;
        return step(StepKind.ELIMINATION_START, "Eliminating other entries in Column %d.", cursor.col() + 1);
    }

    private Step eliminationScan() {
        int pr = cursor.row(), c = cursor.col();
        // rows already zero in this column are skipped without a step
        for (int r = eliminationRow; r < rows; r++) {
            if (r == pr) continue;
            double factor = matrix.get(r, c);
            if (!Tolerance.isZero(factor)) {
                pendingRow = r;
                pendingFactor = factor;
                eliminationRow = r + 1;
                phase = Phase.ELIMINATION_APPLY;
                return step(StepKind.ELIMINATION_ROW, "Eliminating in R%d:  R%d = R%d - (%.2f) * R%d.",
                        r + 1, r + 1, r + 1, factor, pr + 1);
            }
        }
        eliminationRow = rows;
        phase = Phase.NEXT_PIVOT;
        return step(StepKind.COLUMN_COMPLETE, "Column %d is complete.", c + 1);
    }

    private Step eliminationApply() {
        matrix.addScaledRow(pendingRow, cursor.row(), -pendingFactor);
        phase = Phase.ELIMINATION_SCAN;
        return step(StepKind.ELIMINATION_ROW_DONE, "R%d updated.", pendingRow + 1);
    }

    // --- Phase B: classification

    private Step classify() {
        if (cols <= 1) {
            analysis = SolutionAnalysis.notApplicable();
            finish();
            return step(StepKind.NOT_APPLICABLE, "Matrix has only one column. Solution analysis is not applicable.");
        }
        int variables = cols - 1;
        int pivots = cursor.row();

        int bad = findContradictionRow(variables);
        if (bad >= 0) {
            analysis = SolutionAnalysis.noSolution(pivots, variables, bad);
            phase = Phase.REPORT_NO_SOLUTION;
            return step(StepKind.CONTRADICTION_FOUND, "Inconsistency found in R%d: [ 0 ... 0 | %.2f ].",
                    bad + 1, matrix.get(bad, cols - 1));
        }
        // a sub-epsilon coefficient scaled up by a constant-column pivot can leave
        // pivots > variables without a contradiction row; that counts as unique
        analysis = SolutionAnalysis.consistent(pivots, variables);
        phase = Phase.REPORT_VERDICT;
        return step(StepKind.PIVOT_SUMMARY, "Analysis found %d pivot(s) for %d variable(s).", pivots, variables);
    }

    /** First row reading {@code [0 ... 0 | b]} with {@code b != 0}, or -1. All rows are checked. */
    private int findContradictionRow(int variables) {
        for (int r = 0; r < rows; r++) {
            boolean zeroCoefficients = true;
            for (int c = 0; c < variables; c++) {
                if (!Tolerance.isZero(matrix.get(r, c))) {
                    zeroCoefficients = false;
                    break;
                }
            }
            if (zeroCoefficients && !Tolerance.isZero(matrix.get(r, cols - 1))) return r;
        }
        return -1;
    }

    private Step reportNoSolution() {
        finish();
        return step(StepKind.NO_SOLUTION, "This means 0 equals a non-zero number. The system has NO SOLUTION.");
    }

    private Step reportVerdict() {
        phase = Phase.REPORT_DONE;
        if (analysis.type() == SolutionType.INFINITE) {
            return step(StepKind.INFINITE_SOLUTIONS,
                    "There are %d free variable(s). The system has an INFINITE number of solutions.",
                    analysis.freeVariables());
        }
        return step(StepKind.UNIQUE_SOLUTION, "There are no free variables. The system has a UNIQUE SOLUTION.");
    }

    private Step reportDone() {
        finish();
        return step(StepKind.ANALYSIS_COMPLETE, "Analysis complete.");
    }

    private void finish() {
        phase = Phase.DONE;
        state = RunState.FINISHED;
        log.debug("Run finished: {}", analysis);
    }

    private static Step step(StepKind kind, String format, Object... args) {
        return new Step(kind, String.format(Locale.ROOT, format, args));
    }
}
