package com.gaussjordan;

/** Highlighting category of a rendered cell. */
public enum CellRole {
    PLAIN,
    // while the run is active
    PIVOT,
    PIVOT_ROW,
    PIVOT_COLUMN,
    // after completion
    PIVOT_ONE,
    CONSTANT
}
