package utilities;

import java.util.Locale;

/** JOL report text of a suffix tree together with its total retained size. */
public record MemoryUsageReport(String report, long totalBytes) {

    public double totalMiB() {
        return totalBytes / (1024.0 * 1024.0);
    }

    public String summary() {
        return String.format(Locale.ROOT, "%d B (%.3f MiB)", totalBytes, totalMiB());
    }
}
