package org.jfmtcheck.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import org.jfmtcheck.arglist.ConstraintListPrinter;
import org.jfmtcheck.format.FormatStringParser;
import org.jfmtcheck.format.FormatStringParsers;
import org.jfmtcheck.format.ParseResult;
import org.jfmtcheck.obs.CheckJournal;
import org.jfmtcheck.obs.DiagnosticSnapshotDumper;
import org.jfmtcheck.obs.LogLevel;
import org.jfmtcheck.obs.StructuredJsonLinesLogger;
import org.jfmtcheck.testkit.CheckCorpus;
import org.jfmtcheck.testkit.CheckCorpusLoader;
import org.jfmtcheck.testkit.CheckCorpusRunner;
import org.jfmtcheck.testkit.CorpusReport;

/**
 * Command-line entry point.
 *
 * <p>{@code --mode=corpus --corpus=<file>} checks every message pair of a corpus file and prints the report
 * JSON to stdout; log events go to stderr. {@code --mode=dump} reads one format string per stdin line and
 * prints its argument constraint list, or {@code INVALID} followed by the reason. {@code --format} selects the
 * dump parser; a corpus file names its own format.
 *
 * <p>Exit status: 0 on success, 1 if a corpus case did not meet its expectation, 2 on a usage or I/O error.
 */
public final class FormatCheckLauncher {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_CASES = 1;
    static final int EXIT_USAGE = 2;

    private static final String FAILURE_PREFIX = "JFMTCHECK_FAILURE=";
    private static final String DEFAULT_FORMAT = "d";

    private FormatCheckLauncher() {}

    public static void main(final String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(final String[] args, final InputStream in, final PrintStream out, final PrintStream err) {
        Objects.requireNonNull(args, "args");
        final LaunchConfig config;
        try {
            config = LaunchConfig.parse(args);
        } catch (final IllegalArgumentException exception) {
            err.println(FAILURE_PREFIX + exception.getMessage());
            return EXIT_USAGE;
        }

        try {
            if (config.mode() == Mode.DUMP) {
                dump(FormatStringParsers.forName(config.format()), in, out);
                return EXIT_OK;
            }
            return runCorpus(config, out, err);
        } catch (final IOException | IllegalArgumentException exception) {
            err.println(FAILURE_PREFIX + exception.getMessage());
            return EXIT_USAGE;
        }
    }

    private static int runCorpus(final LaunchConfig config, final PrintStream out, final PrintStream err)
            throws IOException {
        final CheckCorpus corpus = CheckCorpusLoader.load(config.corpus());
        final CheckJournal journal = new CheckJournal(config.journalCapacity());
        // Not closed: it writes to the caller's stderr.
        final StructuredJsonLinesLogger logger =
                new StructuredJsonLinesLogger(err, Clock.systemUTC(), config.logLevel());
        final CorpusReport report = new CheckCorpusRunner(logger, journal).run(corpus);

        out.println(report.toJson());
        out.flush();
        if (config.snapshot() != null) {
            Files.writeString(
                    config.snapshot(), new DiagnosticSnapshotDumper().dumpJson(journal), StandardCharsets.UTF_8);
        }
        return report.allPassed() ? EXIT_OK : EXIT_FAILED_CASES;
    }

    private static void dump(final FormatStringParser parser, final InputStream in, final PrintStream out)
            throws IOException {
        final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            final ParseResult result = parser.parse(line, false);
            if (result instanceof ParseResult.Valid valid) {
                out.println(ConstraintListPrinter.print(valid.value().constraints()));
            } else {
                out.println("INVALID");
                out.println(((ParseResult.Invalid) result).reason());
            }
        }
        out.flush();
    }

    enum Mode {
        CORPUS,
        DUMP;

        static Mode parse(final String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException exception) {
                throw new IllegalArgumentException("unsupported mode: " + value + " (expected: corpus|dump)");
            }
        }
    }

    private record LaunchConfig(
            Mode mode,
            Path corpus,
            String format,
            int journalCapacity,
            Path snapshot,
            LogLevel logLevel) {
        private static LaunchConfig parse(final String[] args) {
            Mode mode = Mode.CORPUS;
            Path corpus = null;
            String format = null;
            int journalCapacity = CheckJournal.DEFAULT_CAPACITY;
            Path snapshot = null;
            LogLevel logLevel = LogLevel.INFO;

            for (final String arg : args) {
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if (arg.startsWith("--mode=")) {
                    mode = Mode.parse(requireValue(arg, "--mode="));
                    continue;
                }
                if (arg.startsWith("--corpus=")) {
                    corpus = Path.of(requireValue(arg, "--corpus="));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = FormatStringParsers.forName(requireValue(arg, "--format=")).name();
                    continue;
                }
                if (arg.startsWith("--journal-capacity=")) {
                    journalCapacity = parseCapacity(requireValue(arg, "--journal-capacity="));
                    continue;
                }
                if (arg.startsWith("--snapshot=")) {
                    snapshot = Path.of(requireValue(arg, "--snapshot="));
                    continue;
                }
                if (arg.startsWith("--log-level=")) {
                    logLevel = LogLevel.parse(requireValue(arg, "--log-level="));
                    continue;
                }
                throw new IllegalArgumentException("unsupported argument: " + arg);
            }

            if (mode == Mode.CORPUS && corpus == null) {
                throw new IllegalArgumentException("--corpus is required in corpus mode");
            }
            if (mode == Mode.CORPUS && format != null) {
                throw new IllegalArgumentException("--format is not supported in corpus mode; the corpus file sets it");
            }
            if (format == null) {
                format = DEFAULT_FORMAT;
            }
            return new LaunchConfig(mode, corpus, format, journalCapacity, snapshot, logLevel);
        }

        private static String requireValue(final String arg, final String prefix) {
            final String value = Objects.requireNonNull(arg, "arg").substring(prefix.length()).trim();
            if (value.isEmpty()) {
                throw new IllegalArgumentException("argument value is empty for " + prefix);
            }
            return value;
        }

        private static int parseCapacity(final String value) {
            try {
                final int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new IllegalArgumentException("journal capacity must be greater than zero: " + parsed);
                }
                return parsed;
            } catch (final NumberFormatException numberFormatException) {
                throw new IllegalArgumentException("invalid journal capacity: " + value, numberFormatException);
            }
        }
    }
}
