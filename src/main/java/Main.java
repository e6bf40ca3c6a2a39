import datagenerators.Generator;
import tree.ukkonen.RepeatTieBreak;
import tree.ukkonen.SuffixTree;
import tree.ukkonen.SuffixTreeConfiguration;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Simple driver that builds a suffix tree and runs the standard queries on it. The text comes
 * from --text, --file or a seeded random generator (--random); command-line switches allow
 * overriding patterns and configuration without editing the source.
 */
public final class Main {

    private static final String DEFAULT_TEXT = "banana";
    private static final List<String> DEFAULT_PATTERNS = List.of("ana", "nan", "ban", "xyz");
    private static final int DEFAULT_ALPHABET = 4;
    private static final long DEFAULT_SEED = 42L;

    private Main() {
    }

    public static void main(String[] args) throws IOException {
        CliOptions options = CliOptions.parse(args);
        SuffixTreeConfiguration configuration = options.configuration();
        configuration.applyLogging();
        run(options, configuration, System.out);
    }

    static void run(CliOptions options, SuffixTreeConfiguration configuration, PrintStream out) throws IOException {
        String text = options.loadText();
        SuffixTreeLogger.info("Building suffix tree for text of length " + text.length());

        long startNanos = System.nanoTime();
        SuffixTree tree = SuffixTree.build(text, configuration);
        double buildMs = (System.nanoTime() - startNanos) / 1e6;

        out.printf(Locale.ROOT, "Text length: %d  Alphabet: %d  Build: %.3f ms%n",
                text.length(), tree.alphabetSize(), buildMs);
        out.println("Tree size: " + tree.size() + " nodes");
        out.println("Tree is valid: " + tree.validate());

        for (String pattern : options.patterns) {
            out.println("Pattern '" + pattern + "': " + (tree.search(pattern) ? "found" : "not found"));
        }

        if (!options.patterns.isEmpty()) {
            String first = options.patterns.get(0);
            out.println("Occurrences of '" + first + "': " + tree.findAllOccurrences(first));
            out.println("Count of '" + first + "': " + tree.substringCount(first));
        }

        RepeatTieBreak tieBreak = options.tieBreak != null ? options.tieBreak : configuration.tieBreak();
        out.println("Longest repeated substring: '" + tree.longestRepeatedSubstring(tieBreak) + "'");

        if (options.memory) {
            MemoryUsageReport memory = tree.jolMemoryReportWithTotal(false);
            out.println(memory.report());
            out.println("Tree memory: " + memory.summary());
        }
    }

    static final class CliOptions {
        final String text;
        final Path file;
        final int randomLength;
        final int alphabet;
        final long seed;
        final double zipfExponent;
        final List<String> patterns;
        final Path configFile;
        final RepeatTieBreak tieBreak;
        final boolean memory;

        private CliOptions(String text,
                           Path file,
                           int randomLength,
                           int alphabet,
                           long seed,
                           double zipfExponent,
                           List<String> patterns,
                           Path configFile,
                           RepeatTieBreak tieBreak,
                           boolean memory) {
            this.text = text;
            this.file = file;
            this.randomLength = randomLength;
            this.alphabet = alphabet;
            this.seed = seed;
            this.zipfExponent = zipfExponent;
            this.patterns = patterns;
            this.configFile = configFile;
            this.tieBreak = tieBreak;
            this.memory = memory;
        }

        static CliOptions parse(String[] args) {
            String text = null;
            Path file = null;
            int randomLength = -1;
            int alphabet = DEFAULT_ALPHABET;
            long seed = DEFAULT_SEED;
            double zipf = 0.0;
            List<String> patterns = new ArrayList<>();
            Path config = null;
            RepeatTieBreak tieBreak = null;
            boolean memory = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    continue;
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else if (arg.equals("--memory")) {
                    memory = true;
                    continue;
                } else {
                    key = arg.substring(2);
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "text" -> text = value;
                    case "file" -> file = Path.of(value);
                    case "random" -> randomLength = Integer.parseInt(value);
                    case "alphabet" -> alphabet = Integer.parseInt(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "zipf" -> zipf = Double.parseDouble(value);
                    case "pattern" -> patterns.add(value);
                    case "config" -> config = Path.of(value);
                    case "tie-break" -> tieBreak = RepeatTieBreak.valueOf(
                            value.toUpperCase(Locale.ROOT).replace('-', '_'));
                    case "memory" -> memory = Boolean.parseBoolean(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            int sources = (text != null ? 1 : 0) + (file != null ? 1 : 0) + (randomLength >= 0 ? 1 : 0);
            if (sources > 1) {
                throw new IllegalArgumentException("Use only one of --text, --file and --random");
            }
            if (patterns.isEmpty()) {
                patterns.addAll(DEFAULT_PATTERNS);
            }
            return new CliOptions(text, file, randomLength, alphabet, seed, zipf,
                    List.copyOf(patterns), config, tieBreak, memory);
        }

        SuffixTreeConfiguration configuration() {
            return configFile != null
                    ? SuffixTreeConfiguration.load(configFile)
                    : SuffixTreeConfiguration.loadDefaults();
        }

        String loadText() throws IOException {
            if (file != null) {
                return Files.readString(file, StandardCharsets.UTF_8);
            }
            if (randomLength >= 0) {
                return zipfExponent > 0.0
                        ? Generator.generateZipf(randomLength, alphabet, zipfExponent, seed)
                        : Generator.generateUniform(randomLength, alphabet, seed);
            }
            return text != null ? text : DEFAULT_TEXT;
        }
    }
}
