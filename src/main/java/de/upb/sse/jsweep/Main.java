package de.upb.sse.jsweep;

import de.upb.sse.jsweep.cli.Cli;

public class Main {
    public static void main(String[] args) {
        Cli cli = new Cli(System.out, System.err, System.in);
        int status = cli.run(args);
        System.exit(status);
    }
}
