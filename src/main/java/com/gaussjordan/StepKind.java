package com.gaussjordan;

/** What a single {@link Step} reported. */
public enum StepKind {
    PIVOT_SEARCH,
    NO_PIVOT_IN_COLUMN,
    PIVOT_FOUND,
    SWAP_PERFORMED(true),
    SCALE_NEEDED,
    SCALE_PERFORMED(true),
    PIVOT_ALREADY_ONE,
    ELIMINATION_START,
    ELIMINATION_ROW,
    ELIMINATION_ROW_DONE(true),
    COLUMN_COMPLETE,
    COMPLETE,
    // classification phase
    NOT_APPLICABLE,
    CONTRADICTION_FOUND,
    NO_SOLUTION,
    PIVOT_SUMMARY,
    UNIQUE_SOLUTION,
    INFINITE_SOLUTIONS,
    ANALYSIS_COMPLETE;

    private final boolean mutates;

    StepKind() { this(false); }
    StepKind(boolean mutates) { this.mutates = mutates; }

    /** True for the steps that changed the matrix just before being reported. */
    public boolean mutates() { return mutates; }

    public boolean isAnalysis() { return compareTo(NOT_APPLICABLE) >= 0; }
}
