package com.gaussjordan;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

/**
 * Drives {@link Main#run} the way the console does, with in-memory input and
 * output.
 */
public class MainEndToEndTest {

    private static String run(String[] args, String text, String commands) throws IOException {
        StepperOptions o = OptionsParser.parse(args);
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        BufferedReader in = commands == null ? null : new BufferedReader(new StringReader(commands));
        assertEquals(0, Main.run(o, text, in, pw));
        return sw.toString();
    }

    @Test
    public void runAllPrintsEveryStepAndVerdict() throws IOException {
        String out = run(new String[]{ "-all", "-log" }, "1 1 2 9\n2 4 -3 1\n3 6 -5 0\n", null);
        assertTrue(out.startsWith(SteppingSession.LOADED));
        assertFalse(out.contains("Swapping"));
        assertTrue(out.contains("The system has a UNIQUE SOLUTION."));
        assertTrue(out.contains("Result: UNIQUE pivots=3 variables=3"));
        assertTrue(out.contains("Step log:"));
        assertTrue(out.contains("*1.00*"));
    }

    @Test
    public void logOptionPrintsRawFinalMatrix() throws IOException {
        String nl = System.lineSeparator();
        String out = run(new String[]{ "-all", "-log" }, "2 4 6\n1 3 5\n", null);
        assertTrue(out.endsWith("Final matrix:" + nl + "1.0 0.0 -1.0" + nl + "0.0 1.0 2.0" + nl), out);

        String quiet = run(new String[]{ "-all" }, "2 4 6\n1 3 5\n", null);
        assertFalse(quiet.contains("Final matrix:"));
    }

    @Test
    public void interactiveQuitStopsEarly() throws IOException {
        String out = run(new String[0], "1 2 5\n0 0 3\n", "n\n\nq\n");
        assertTrue(out.contains("Finding pivot in Column 1, at or below Row 1."));
        assertTrue(out.contains("Pivot found at (1, 1). No swap needed."));
        assertFalse(out.contains("Pivot is already 1."));
        assertFalse(out.contains("Result:"));
    }

    @Test
    public void interactiveRestartBeginsAgain() throws IOException {
        String out = run(new String[0], "2 4\n", "n\nr\nq\n");
        int first = out.indexOf(SteppingSession.LOADED);
        assertTrue(first >= 0);
        assertTrue(out.indexOf(SteppingSession.LOADED, first + 1) > first);
    }

    @Test
    public void rejectedMatrixExitsWithOne() throws IOException {
        StringWriter sw = new StringWriter();
        int code = Main.run(OptionsParser.parse(new String[]{ "-all" }), "1 2\n3 abc\n", null, new PrintWriter(sw));
        assertEquals(1, code);
        assertTrue(sw.toString().contains("Error parsing matrix: Invalid number 'abc' at Row 2, Column 2."));
    }
}
