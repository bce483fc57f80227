package com.gaussjordan;

import java.util.Objects;

/** One emitted micro-step: its kind and the text shown to the user. */
public final class Step {
    private final StepKind kind;
    private final String description;

    public Step(StepKind kind, String description) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.description = Objects.requireNonNull(description, "description");
    }

    public StepKind kind() { return kind; }
    public String description() { return description; }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Step)) return false;
        Step o = (Step) obj;
        return kind == o.kind && description.equals(o.description);
    }

    @Override public int hashCode() { return kind.hashCode() * 31 + description.hashCode(); }

    @Override public String toString() { return kind + ": " + description; }
}
