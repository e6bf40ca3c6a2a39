package utilities;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class SuffixTreeLogger {
    private static final Logger logger;
    private static FileHandler fileHandler;

    static {
        // Create or get the logger
        logger = Logger.getLogger(SuffixTreeLogger.class.getName());
        logger.setUseParentHandlers(false); // Disable default console handler

        // Console handler
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);

        logger.setLevel(Level.INFO);
    }

    private SuffixTreeLogger() {
    }

    /**
     * Add a size-rotated log file. Replaces the file handler installed by a previous call.
     *
     * @param logFile    file to write, rotated generations get a numeric suffix
     * @param limitBytes approximate maximum bytes per generation
     * @param count      number of generations to keep
     */
    public static synchronized void enableFileLogging(Path logFile, int limitBytes, int count) throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            parent.toFile().mkdirs();
        }
        FileHandler handler = new FileHandler(logFile.toString(), limitBytes, count, true); // true = append mode
        handler.setLevel(Level.ALL);
        handler.setFormatter(new SimpleFormatter());
        disableFileLogging();
        logger.addHandler(handler);
        fileHandler = handler;
    }

    public static synchronized void disableFileLogging() {
        if (fileHandler != null) {
            logger.removeHandler(fileHandler);
            fileHandler.close();
            fileHandler = null;
        }
    }

    public static void setLevel(Level level) {
        logger.setLevel(level);
        for (Handler handler : logger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static boolean isTraceEnabled() {
        return logger.isLoggable(Level.FINEST);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

}
