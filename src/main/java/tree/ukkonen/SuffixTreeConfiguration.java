package tree.ukkonen;

import utilities.SuffixTreeLogger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;

// Immutable configuration for building and querying suffix trees.
public final class SuffixTreeConfiguration {

    public static final String DEFAULT_RESOURCE = "suffixtree.properties";

    public static final String KEY_TIE_BREAK = "suffixtree.tieBreak";
    public static final String KEY_VALIDATE_AFTER_BUILD = "suffixtree.validateAfterBuild";
    public static final String KEY_LOG_QUERIES = "suffixtree.logQueries";
    public static final String KEY_LOG_FILE = "suffixtree.log.file";
    public static final String KEY_LOG_LEVEL = "suffixtree.log.level";
    public static final String KEY_LOG_LIMIT_BYTES = "suffixtree.log.limitBytes";
    public static final String KEY_LOG_COUNT = "suffixtree.log.count";

    private static final int DEFAULT_LOG_LIMIT_BYTES = 10 * 1024 * 1024;
    private static final int DEFAULT_LOG_COUNT = 5;

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final RepeatTieBreak tieBreak;
    private final boolean validateAfterBuild;
    private final boolean logQueries;
    private final Path logFile;
    private final Level logLevel;
    private final int logFileLimitBytes;
    private final int logFileCount;

    private SuffixTreeConfiguration(Builder builder) {
        this.tieBreak = Objects.requireNonNull(builder.tieBreak, "tieBreak");
        this.validateAfterBuild = builder.validateAfterBuild;
        this.logQueries = builder.logQueries;
        this.logFile = builder.logFile;
        this.logLevel = Objects.requireNonNull(builder.logLevel, "logLevel");
        this.logFileLimitBytes = builder.logFileLimitBytes;
        this.logFileCount = builder.logFileCount;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (logFileLimitBytes < 0) {
            throw new IllegalArgumentException("logFileLimitBytes must be non-negative");
        }
        if (logFileCount <= 0) {
            throw new IllegalArgumentException("logFileCount must be positive");
        }
    }

    public RepeatTieBreak tieBreak() { return tieBreak; }
    public boolean validateAfterBuild() { return validateAfterBuild; }
    public boolean logQueries() { return logQueries; }
    public Path logFile() { return logFile; }
    public Level logLevel() { return logLevel; }
    public int logFileLimitBytes() { return logFileLimitBytes; }
    public int logFileCount() { return logFileCount; }

    /**
     * Apply the logging section of this configuration to {@link SuffixTreeLogger}.
     */
    public void applyLogging() throws IOException {
        SuffixTreeLogger.setLevel(logLevel);
        if (logFile != null) {
            SuffixTreeLogger.enableFileLogging(logFile, logFileLimitBytes, logFileCount);
        }
    }

    /**
     * Read a properties file. A missing file is not an error: a warning is logged and
     * the defaults are returned.
     */
    public static SuffixTreeConfiguration load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            SuffixTreeLogger.warning("Configuration file not found: " + path);
            return defaults();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration " + path, e);
        }
        SuffixTreeLogger.info("Configuration loaded from " + path);
        return fromProperties(properties);
    }

    // Defaults bundled on the classpath; falls back to built-in values when the resource is absent.
    public static SuffixTreeConfiguration loadDefaults() {
        try (InputStream in = SuffixTreeConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read classpath resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static SuffixTreeConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String value = trimmed(properties, KEY_TIE_BREAK);
        if (value != null) {
            try {
                builder.tieBreak(RepeatTieBreak.valueOf(value.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown " + KEY_TIE_BREAK + ": " + value, e);
            }
        }
        value = trimmed(properties, KEY_VALIDATE_AFTER_BUILD);
        if (value != null) {
            builder.validateAfterBuild(parseBoolean(KEY_VALIDATE_AFTER_BUILD, value));
        }
        value = trimmed(properties, KEY_LOG_QUERIES);
        if (value != null) {
            builder.logQueries(parseBoolean(KEY_LOG_QUERIES, value));
        }
        value = trimmed(properties, KEY_LOG_FILE);
        if (value != null && !value.isEmpty()) {
            builder.logFile(Path.of(value));
        }
        value = trimmed(properties, KEY_LOG_LEVEL);
        if (value != null) {
            try {
                builder.logLevel(Level.parse(value.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown " + KEY_LOG_LEVEL + ": " + value, e);
            }
        }
        value = trimmed(properties, KEY_LOG_LIMIT_BYTES);
        if (value != null) {
            builder.logFileLimitBytes(parseInt(KEY_LOG_LIMIT_BYTES, value));
        }
        value = trimmed(properties, KEY_LOG_COUNT);
        if (value != null) {
            builder.logFileCount(parseInt(KEY_LOG_COUNT, value));
        }
        return builder.build();
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null ? null : value.trim();
    }

    private static boolean parseBoolean(String key, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false, got: " + value);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + value, e);
        }
    }

    public static final class Builder {
        private RepeatTieBreak tieBreak = RepeatTieBreak.LEXICOGRAPHIC;
        private boolean validateAfterBuild;
        private boolean logQueries;
        private Path logFile;
        private Level logLevel = Level.INFO;
        private int logFileLimitBytes = DEFAULT_LOG_LIMIT_BYTES;
        private int logFileCount = DEFAULT_LOG_COUNT;

        private Builder() {
        }

        public Builder tieBreak(RepeatTieBreak tieBreak) {
            this.tieBreak = tieBreak;
            return this;
        }

        public Builder validateAfterBuild(boolean validateAfterBuild) {
            this.validateAfterBuild = validateAfterBuild;
            return this;
        }

        public Builder logQueries(boolean logQueries) {
            this.logQueries = logQueries;
            return this;
        }

        public Builder logFile(Path logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder logFileLimitBytes(int logFileLimitBytes) {
            this.logFileLimitBytes = logFileLimitBytes;
            return this;
        }

        public Builder logFileCount(int logFileCount) {
            this.logFileCount = logFileCount;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
