package com.gaussjordan;

/**
 * Verdict of the classification phase for an augmented system
 * {@code [A | b]}.  Counts are meaningless for {@link SolutionType#NOT_APPLICABLE}.
 */
public final class SolutionAnalysis {
    private final SolutionType type;
    private final int pivots;
    private final int variables;
    private final int contradictionRow;   // -1 unless NO_SOLUTION

    private SolutionAnalysis(SolutionType type, int pivots, int variables, int contradictionRow) {
        this.type = type;
        this.pivots = pivots;
        this.variables = variables;
        this.contradictionRow = contradictionRow;
    }

    static SolutionAnalysis notApplicable() {
        return new SolutionAnalysis(SolutionType.NOT_APPLICABLE, 0, 0, -1);
    }

    static SolutionAnalysis noSolution(int pivots, int variables, int row) {
        return new SolutionAnalysis(SolutionType.NO_SOLUTION, pivots, variables, row);
    }

    /** Fewer pivots than variables is INFINITE, anything else UNIQUE. */
    static SolutionAnalysis consistent(int pivots, int variables) {
        SolutionType t = pivots < variables ? SolutionType.INFINITE : SolutionType.UNIQUE;
        return new SolutionAnalysis(t, pivots, variables, -1);
    }

    public SolutionType type() { return type; }
    public int pivots() { return pivots; }
    public int variables() { return variables; }

    /** Number of variables without a pivot column; zero unless {@link SolutionType#INFINITE}. */
    public int freeVariables() { return type == SolutionType.INFINITE ? variables - pivots : 0; }

    /** Zero-based index of the first inconsistent row, or -1. */
    public int contradictionRow() { return contradictionRow; }

    @Override public String toString() {
        return type + " pivots=" + pivots + " variables=" + variables
                + (type == SolutionType.INFINITE ? " free=" + freeVariables() : "")
                + (contradictionRow >= 0 ? " row=" + contradictionRow : "");
    }
}
