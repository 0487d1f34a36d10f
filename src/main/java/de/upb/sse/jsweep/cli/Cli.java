package de.upb.sse.jsweep.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import de.upb.sse.jsweep.JSweep;
import de.upb.sse.jsweep.analysis.CleanupAnalysis;
import de.upb.sse.jsweep.cleanup.ConfirmationPort;
import de.upb.sse.jsweep.cleanup.Report;
import de.upb.sse.jsweep.configuration.JSweepConfiguration;
import de.upb.sse.jsweep.exceptions.ModelReadException;
import de.upb.sse.jsweep.model.CleanupScope;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Cli {

    static final String usage = String.join(System.lineSeparator(),
            "Usage: jsweep [--analyze|--remove-deprecated|--clean-marked|--mark|--unmark|--list-marked] [--yes] [--config file] [--field-mode M] [--class-mode M] [--verbosity N] [--help] projectDir [files...]",
            "",
            "  --analyze            report what both cleanups would remove, change nothing (default)",
            "  --remove-deprecated  remove unreferenced deprecated controller methods and what only they call",
            "  --clean-marked       remove unused imports, fields and empty classes from marked files",
            "  --mark               put the cleanup marker on the given files",
            "  --unmark             remove the cleanup marker from the given files",
            "  --list-marked        print the marked files of the project",
            "  --yes|-y             do not ask for confirmation",
            "  --config file        read jsweep.* settings from a properties file",
            "  --field-mode M       FINAL_PRIVATE_ONLY (default) or NON_PUBLIC_NON_STATIC",
            "  --class-mode M       EMPTY_ONLY (default) or NO_METHODS",
            "  --verbosity|-v N     0 warnings only, 1 progress, 2 debug",
            "  --help               display this help and exit",
            "",
            "  Exit status: 0 on success, nothing to do or declined; 1 on invalid arguments; 2 on failed or busy runs.");

    static final int OK = 0;
    static final int INVALID_ARGUMENTS = 1;
    static final int FAILED = 2;

    // kept to stop the configured level from being collected with the logger
    private static final Logger rootLogger = Logger.getLogger("de.upb.sse.jsweep");

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;

    public Cli(OutputStream out, OutputStream err, InputStream in) {
        this.out = new PrintStream(out, true);
        this.err = new PrintStream(err, true);
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public int run(String... args) {
        Parameters params = Parameters.parse(args);
        if (!params.valid()) {
            err.println("Called as: " + String.join(" ", args));
            err.println(usage);
            return INVALID_ARGUMENTS;
        }
        if (params.help) {
            out.println(usage);
            return OK;
        }
        configureLogging(params.verbosity);

        Path projectDir = Paths.get(params.projectDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(projectDir)) {
            err.println("error: project directory '" + projectDir + "' doesn't exist");
            return INVALID_ARGUMENTS;
        }

        JSweepConfiguration config;
        try {
            config = configure(params);
        } catch (IOException e) {
            err.println("error: could not read configuration '" + params.config + "': " + e.getMessage());
            return INVALID_ARGUMENTS;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return INVALID_ARGUMENTS;
        }

        JSweep jSweep = new JSweep(config, new ConsoleProgressSink(out, params.verbosity > 0));
        ConfirmationPort confirmation = params.yes ? ConfirmationPort.always() : new ConsoleConfirmation(in, out);
        List<Path> files = params.files(projectDir);

        try {
            if (params.removeDeprecated) {
                return exitCode(jSweep.runDeprecatedControllerCleanup(jSweep.scopeOf(projectDir), confirmation));
            } else if (params.cleanMarked) {
                return exitCode(jSweep.runMarkedFileCleanup(jSweep.scopeOf(projectDir), confirmation));
            } else if (params.mark) {
                List<Path> marked = jSweep.markFiles(files);
                out.println("Marked " + marked.size() + " of " + files.size() + " file(s)");
                return OK;
            } else if (params.unmark) {
                List<Path> unmarked = jSweep.unmarkFiles(files);
                out.println("Unmarked " + unmarked.size() + " of " + files.size() + " file(s)");
                return OK;
            } else if (params.listMarked) {
                for (Path file : jSweep.listMarkedFiles(jSweep.scopeOf(projectDir))) {
                    out.println(projectDir.relativize(file));
                }
                return OK;
            } else {
                analyze(jSweep, jSweep.scopeOf(projectDir));
                return OK;
            }
        } catch (ModelReadException e) {
            err.println("error: " + e.getMessage());
            return FAILED;
        } catch (UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return FAILED;
        }
    }

    private void analyze(JSweep jSweep, CleanupScope scope) {
        CleanupAnalysis deprecated = jSweep.analyzeDeprecatedControllers(scope);
        out.println(deprecated.describe());
        out.println();
        CleanupAnalysis marked = jSweep.analyzeMarkedFiles(scope);
        out.println(marked.describe());
    }

    private JSweepConfiguration configure(Parameters params) throws IOException {
        JSweepConfiguration config = params.config == null
                ? new JSweepConfiguration()
                : JSweepConfiguration.load(Paths.get(params.config));
        config.applySystemOverrides();
        if (params.fieldMode != null) {
            config.setFieldMode(parseEnum(JSweepConfiguration.FieldMode.class, params.fieldMode));
        }
        if (params.classMode != null) {
            config.setClassMode(parseEnum(JSweepConfiguration.ClassMode.class, params.classMode));
        }
        return config;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }

    private static int exitCode(Report report) {
        return report.isSuccess() || report.status == Report.Status.CANCELLED ? OK : FAILED;
    }

    private void configureLogging(int verbosity) {
        try (InputStream config = Cli.class.getResourceAsStream("/jsweep-logging.properties")) {
            if (config != null) LogManager.getLogManager().readConfiguration(config);
        } catch (IOException e) {
            err.println("warning: could not load logging configuration: " + e.getMessage());
        }
        Level level;
        if (verbosity <= 0) level = Level.WARNING;
        else if (verbosity == 1) level = Level.INFO;
        else level = Level.FINE;
        rootLogger.setLevel(level);
    }

    private static class Parameters {
        private Parameters() {}

        @Parameter(names = "--analyze")
        boolean analyze;

        @Parameter(names = "--remove-deprecated")
        boolean removeDeprecated;

        @Parameter(names = "--clean-marked")
        boolean cleanMarked;

        @Parameter(names = "--mark")
        boolean mark;

        @Parameter(names = "--unmark")
        boolean unmark;

        @Parameter(names = "--list-marked")
        boolean listMarked;

        @Parameter(names = {"--yes", "-y"})
        boolean yes;

        @Parameter(names = "--config")
        String config;

        @Parameter(names = "--field-mode")
        String fieldMode;

        @Parameter(names = "--class-mode")
        String classMode;

        @Parameter(names = {"--verbosity", "-v"})
        Integer verbosity = 0;

        @Parameter(names = "--help")
        boolean help;

        @Parameter
        private List<String> mainParameters = new ArrayList<>();

        /** The project directory, possibly relative to the current working directory */
        String projectDir;

        // set to true, if parsing arguments failed
        private boolean invalid;

        boolean valid() {
            if (invalid) return false;
            if (help) return true;
            int modes = count(analyze, removeDeprecated, cleanMarked, mark, unmark, listMarked);
            if (modes > 1 || projectDir == null) return false;
            // only --mark and --unmark take files
            boolean takesFiles = mark || unmark;
            int fileCount = mainParameters.size() - 1;
            return takesFiles ? fileCount > 0 : fileCount == 0;
        }

        List<Path> files(Path projectDir) {
            List<Path> files = new ArrayList<>();
            for (String file : mainParameters.subList(1, mainParameters.size())) {
                Path path = Paths.get(file);
                files.add((path.isAbsolute() ? path : projectDir.resolve(path)).normalize());
            }
            return files;
        }

        private static int count(boolean... flags) {
            int count = 0;
            for (boolean flag : flags) if (flag) count++;
            return count;
        }

        static Parameters parse(String... args) {
            Parameters params = new Parameters();
            try {
                new JCommander(params, args);
                if (!params.mainParameters.isEmpty()) params.projectDir = params.mainParameters.get(0);
            } catch (ParameterException e) {
                params.invalid = true;
            }
            return params;
        }
    }
}
