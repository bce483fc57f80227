package com.gaussjordan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static void usage() {
        System.err.println(
                "Usage: gauss-jordan [options] [<input-file> | -]\n" +
                        "Reads an augmented matrix, one row per line, and reduces it step by step.\n" +
                        "Options:\n" +
                        "  -all          run to completion without prompting\n" +
                        "  -decimals N   digits shown after the decimal point (0..10, default 2)\n" +
                        "  -log          print the step log and the unrounded final matrix at the end\n" +
                        "Interactive commands: <Enter>/n next step, r restart, q quit\n"
        );
    }

    public static void main(String[] args) {
        StepperOptions opts;
        try {
            opts = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage();
            System.err.println("Argument error: " + e.getMessage());
            System.exit(2);
            return;
        }

        String text;
        try {
            text = opts.readsStdin()
                    ? readAll(new InputStreamReader(System.in, StandardCharsets.UTF_8))
                    : new String(Files.readAllBytes(Paths.get(opts.inputPath)), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            System.err.println("File not found: " + opts.inputPath);
            System.exit(1);
            return;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            System.exit(1);
            return;
        }

        PrintWriter out = new PrintWriter(System.out, true);
        // commands cannot come from stdin once the matrix did
        BufferedReader commands = opts.readsStdin() || opts.runAll
                ? null
                : new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            System.exit(run(opts, text, commands, out));
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Drives one session over {@code text}.  With {@code commands == null}
     * every step is printed without prompting.
     *
     * @return process exit code: 0 on success, 1 when the matrix is rejected
     */
    static int run(StepperOptions opts, String text, BufferedReader commands, PrintWriter out) throws IOException {
        MatrixRenderer renderer = new MatrixRenderer(opts.decimals);
        SteppingSession session = new SteppingSession();
        try {
            show(out, renderer, session.start(text));
        } catch (MatrixFormatException e) {
            out.println("Error parsing matrix: " + e.getMessage());
            out.flush();
            return 1;
        }

        while (session.hasMoreSteps()) {
            if (commands != null) {
                out.print("> ");
                out.flush();
                String cmd = commands.readLine();
                if (cmd == null || cmd.trim().equalsIgnoreCase("q")) break;
                if (cmd.trim().equalsIgnoreCase("r")) {
                    log.debug("Restarting on user request");
                    session.reset();
                    try {
                        show(out, renderer, session.start(text));
                    } catch (MatrixFormatException e) {
                        // parsed fine a moment ago
                        throw new IllegalStateException(e);
                    }
                    continue;
                }
            }
            Optional<StepFrame> f = session.next();
            if (!f.isPresent()) break;
            show(out, renderer, f.get());
        }

        session.analysis().ifPresent(a -> out.println("Result: " + a));
        if (opts.printLog) {
            out.println("Step log:");
            int k = 1;
            for (String d : session.history()) out.printf("%4d  %s%n", k++, d);
            StepFrame last = session.current().orElseThrow();
            out.println("Final matrix:");
            last.matrix().write(out);
        }
        out.flush();
        return 0;
    }

    private static void show(PrintWriter out, MatrixRenderer renderer, StepFrame f) {
        out.println(f.description());
        out.print(renderer.render(f));
        out.println();
        out.flush();
    }

    private static String readAll(Reader in) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[4096];
        int n;
        while ((n = in.read(buf)) != -1) sb.append(buf, 0, n);
        return sb.toString();
    }
}
