package de.upb.sse.jsweep.cli;

import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.cleanup.ConfirmationPort;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;

/** Shows the analysis summary and asks on the console. Anything but {@code y}/{@code yes} declines. */
public class ConsoleConfirmation implements ConfirmationPort {
    static final String QUESTION = "Do you want to remove these unused elements? [y/N] ";

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmation(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public boolean confirm(CleanupAnalysis analysis) {
        out.println(analysis.describe());
        out.println();
        out.print(QUESTION);
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) return false;
            answer = answer.trim().toLowerCase(Locale.ROOT);
            return answer.equals("y") || answer.equals("yes");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read confirmation", e);
        }
    }
}
