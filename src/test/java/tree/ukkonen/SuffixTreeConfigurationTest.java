package tree.ukkonen;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import utilities.SuffixTreeLogger;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Level;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SuffixTreeConfigurationTest {

    @Rule
    public TemporaryFolder tempDir = new TemporaryFolder();

    @After
    public void tearDown() {
        SuffixTreeLogger.disableFileLogging();
        SuffixTreeLogger.setLevel(Level.INFO);
    }

    @Test
    public void testDefaults() {
        final SuffixTreeConfiguration configuration = SuffixTreeConfiguration.defaults();
        assertEquals(RepeatTieBreak.LEXICOGRAPHIC, configuration.tieBreak());
        assertFalse(configuration.validateAfterBuild());
        assertFalse(configuration.logQueries());
        assertNull(configuration.logFile());
        assertEquals(Level.INFO, configuration.logLevel());
        assertEquals(10 * 1024 * 1024, configuration.logFileLimitBytes());
        assertEquals(5, configuration.logFileCount());
    }

    @Test
    public void testClasspathDefaults() {
        final SuffixTreeConfiguration configuration = SuffixTreeConfiguration.loadDefaults();
        assertEquals(RepeatTieBreak.LEXICOGRAPHIC, configuration.tieBreak());
        assertNull(configuration.logFile());
        assertEquals(5, configuration.logFileCount());
    }

    @Test
    public void testFromProperties() {
        final Properties properties = new Properties();
        properties.setProperty(SuffixTreeConfiguration.KEY_TIE_BREAK, "earliest_occurrence");
        properties.setProperty(SuffixTreeConfiguration.KEY_VALIDATE_AFTER_BUILD, "true");
        properties.setProperty(SuffixTreeConfiguration.KEY_LOG_QUERIES, " TRUE ");
        properties.setProperty(SuffixTreeConfiguration.KEY_LOG_LEVEL, "fine");
        properties.setProperty(SuffixTreeConfiguration.KEY_LOG_FILE, "logs/suffix_tree.log");
        properties.setProperty(SuffixTreeConfiguration.KEY_LOG_LIMIT_BYTES, "1024");
        properties.setProperty(SuffixTreeConfiguration.KEY_LOG_COUNT, "2");

        final SuffixTreeConfiguration configuration = SuffixTreeConfiguration.fromProperties(properties);
        assertEquals(RepeatTieBreak.EARLIEST_OCCURRENCE, configuration.tieBreak());
        assertTrue(configuration.validateAfterBuild());
        assertTrue(configuration.logQueries());
        assertEquals(Level.FINE, configuration.logLevel());
        assertEquals(Path.of("logs/suffix_tree.log"), configuration.logFile());
        assertEquals(1024, configuration.logFileLimitBytes());
        assertEquals(2, configuration.logFileCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedBoolean() {
        final Properties properties = new Properties();
        properties.setProperty(SuffixTreeConfiguration.KEY_VALIDATE_AFTER_BUILD, "yes");
        SuffixTreeConfiguration.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownTieBreak() {
        final Properties properties = new Properties();
        properties.setProperty(SuffixTreeConfiguration.KEY_TIE_BREAK, "random");
        SuffixTreeConfiguration.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveLogCount() {
        SuffixTreeConfiguration.builder().logFileCount(0).build();
    }

    @Test
    public void testMissingFileYieldsDefaults() {
        final Path missing = tempDir.getRoot().toPath().resolve("missing.properties");
        assertSame(SuffixTreeConfiguration.defaults(), SuffixTreeConfiguration.load(missing));
    }

    @Test
    public void testLoadFile() throws Exception {
        final Path file = tempDir.newFile("suffixtree.properties").toPath();
        Files.write(file, ("suffixtree.tieBreak=EARLIEST_OCCURRENCE\n"
                + "suffixtree.logQueries=true\n").getBytes(StandardCharsets.UTF_8));
        final SuffixTreeConfiguration configuration = SuffixTreeConfiguration.load(file);
        assertEquals(RepeatTieBreak.EARLIEST_OCCURRENCE, configuration.tieBreak());
        assertTrue(configuration.logQueries());
        assertFalse(configuration.validateAfterBuild());
    }

    @Test
    public void testApplyLoggingWritesFile() throws Exception {
        final File logDir = tempDir.newFolder("logs");
        final SuffixTreeConfiguration configuration = SuffixTreeConfiguration.builder()
                .logFile(logDir.toPath().resolve("suffix_tree.log"))
                .logFileLimitBytes(4096)
                .logFileCount(2)
                .build();
        configuration.applyLogging();
        SuffixTreeLogger.info("hello");
        SuffixTreeLogger.disableFileLogging();

        final String[] names = logDir.list();
        assertNotNull(names);
        boolean found = false;
        for (String name : names) {
            if (name.startsWith("suffix_tree.log") && !name.endsWith(".lck")) {
                found = true;
            }
        }
        assertTrue(found);
    }
}
