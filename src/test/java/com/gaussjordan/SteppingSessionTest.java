package com.gaussjordan;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class SteppingSessionTest {

    private static final String SYSTEM = "1 1 2 9\n2 4 -3 1\n3 6 -5 0\n";

    @Test
    public void startShowsLoadedMatrix() throws MatrixFormatException {
        SteppingSession s = new SteppingSession();
        StepFrame f = s.start(SYSTEM);
        assertEquals(SteppingSession.LOADED, f.description());
        assertTrue(f.runActive());
        assertEquals(PivotCursor.origin(), f.cursor());
        assertEquals(2.0, f.get(1, 0));
        assertTrue(s.history().isEmpty());
        assertTrue(s.hasMoreSteps());
    }

    @Test
    public void nextRecordsHistoryUntilExhausted() throws MatrixFormatException {
        SteppingSession s = new SteppingSession();
        s.start(SYSTEM);
        int n = 0;
        Optional<StepFrame> f;
        StepFrame last = null;
        while ((f = s.next()).isPresent()) {
            last = f.get();
            n++;
        }
        List<String> log = s.history();
        assertEquals(n, log.size());
        assertEquals("Finding pivot in Column 1, at or below Row 1.", log.get(0));
        assertEquals("Analysis complete.", log.get(n - 1));
        assertFalse(last.runActive());
        assertEquals(SolutionType.UNIQUE, s.analysis().orElseThrow().type());
        assertThrows(UnsupportedOperationException.class, () -> log.add("x"));
    }

    @Test
    public void parseErrorKeepsPreviousRun() throws MatrixFormatException {
        SteppingSession s = new SteppingSession();
        s.start(SYSTEM);
        s.next();
        MatrixFormatException e = assertThrows(MatrixFormatException.class, () -> s.start("1 2\n3\n"));
        assertEquals(2, e.row());
        assertEquals(1, s.history().size());
        assertTrue(s.isStarted());
    }

    @Test
    public void resetNeverFails() throws MatrixFormatException {
        SteppingSession s = new SteppingSession();
        s.reset();
        assertFalse(s.next().isPresent());
        assertFalse(s.current().isPresent());

        s.start(SYSTEM);
        s.next();
        s.next();
        s.reset();
        assertFalse(s.isStarted());
        assertFalse(s.hasMoreSteps());
        assertTrue(s.history().isEmpty());
        assertFalse(s.analysis().isPresent());
        s.reset();
    }

    @Test
    public void restartReplaysSameSequence() throws MatrixFormatException {
        SteppingSession s = new SteppingSession();
        s.start("0 2 4\n1 1 1\n");
        while (s.next().isPresent()) { }
        List<String> first = s.history();
        s.reset();
        s.start("0 2 4\n1 1 1\n");
        while (s.next().isPresent()) { }
        assertEquals(first, s.history());
    }
}
