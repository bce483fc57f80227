package com.gaussjordan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start / next / reset controls around a {@link StepEngine}, keeping the step
 * log a front end shows next to the matrix.  One session drives one run at a
 * time; starting again replaces the previous engine.
 */
public final class SteppingSession {
    private static final Logger log = LoggerFactory.getLogger(SteppingSession.class);

    static final String LOADED = "Matrix loaded. Advance to find the first pivot.";

    private StepEngine engine;
    private StepFrame current;
    private final List<String> history = new ArrayList<>();

    /**
     * Parses {@code text} and begins a new run.  On a parse error the session
     * keeps whatever state it had.
     */
    public StepFrame start(String text) throws MatrixFormatException {
        Matrix m = MatrixParser.parse(text);
        return start(m);
    }

    public StepFrame start(Matrix m) {
        engine = new StepEngine(m);
        history.clear();
        current = StepFrame.of(engine, LOADED);
        log.info("Started {}x{} run", m.rows(), m.cols());
        return current;
    }

    /** Next frame, or empty when there is no run or it is exhausted. */
    public Optional<StepFrame> next() {
        if (engine == null) return Optional.empty();
        Optional<Step> step = engine.advance();
        if (!step.isPresent()) return Optional.empty();
        String d = step.get().description();
        history.add(d);
        current = StepFrame.of(engine, d);
        return Optional.of(current);
    }

    /** Drops the run and its log.  Safe to call at any time. */
    public void reset() {
        if (engine != null) log.info("Run reset after {} step(s)", history.size());
        engine = null;
        current = null;
        history.clear();
    }

    public boolean isStarted() { return engine != null; }

    public boolean hasMoreSteps() { return engine != null && engine.hasMoreSteps(); }

    public Optional<StepFrame> current() { return Optional.ofNullable(current); }

    public Optional<SolutionAnalysis> analysis() {
        return engine == null ? Optional.empty() : engine.analysis();
    }

    /** Descriptions emitted so far, oldest first. */
    public List<String> history() { return Collections.unmodifiableList(new ArrayList<>(history)); }
}
