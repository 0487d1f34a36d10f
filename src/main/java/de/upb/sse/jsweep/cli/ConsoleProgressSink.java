package de.upb.sse.jsweep.cli;

import de.upb.sse.jsweep.cleanup.ProgressSink;

import java.io.PrintStream;

/** Prints progress as {@code [JSweep] message} lines. Status text only shows when verbose. */
public class ConsoleProgressSink implements ProgressSink {
    private final PrintStream out;
    private final boolean verbose;

    public ConsoleProgressSink(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    @Override
    public void text(String message) {
        if (verbose) out.println("[JSweep] " + message);
    }

    @Override
    public void log(String message) {
        out.println("[JSweep] " + message);
    }
}
