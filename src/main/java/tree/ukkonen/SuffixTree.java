package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Suffix tree of a single string, built online with Ukkonen's algorithm.
 *
 * Build pipeline:
 *   1. Map every character to a dense symbol id and append a unique sentinel (id 0).
 *   2. Run one Ukkonen phase per symbol over a node arena ({@link NodeStore}).
 *   3. Freeze all open leaf edges at the last text index.
 *
 * The finished tree is immutable; every query below only reads it, so one instance can be
 * shared across threads without locking. Queries are total: unknown characters, patterns
 * longer than the text and null patterns produce empty results.
 */
public final class SuffixTree {

    private final TextBuffer text;
    private final NodeStore store;
    private final SuffixTreeConfiguration configuration;

    private SuffixTree(TextBuffer text, NodeStore store, SuffixTreeConfiguration configuration) {
        this.text = text;
        this.store = store;
        this.configuration = configuration;
    }

    public static SuffixTree build(String text) {
        return build(text, SuffixTreeConfiguration.defaults());
    }

    /**
     * Build the suffix tree of {@code text}.
     *
     * @throws EmptyTextException if text is empty
     * @throws IllegalStateException if validation is enabled and the built tree is malformed
     */
    public static SuffixTree build(String text, SuffixTreeConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        TextBuffer buffer = TextBuffer.of(text);
        NodeStore store = new UkkonenBuilder(buffer).build();
        SuffixTree tree = new SuffixTree(buffer, store, configuration);
        if (configuration.validateAfterBuild() && !tree.validate()) {
            throw new IllegalStateException("suffix tree failed validation");
        }
        return tree;
    }

    // Original text, without the sentinel.
    public String getText() {
        return text.text();
    }

    public int getOriginalLength() {
        return text.originalLength();
    }

    public int alphabetSize() {
        return text.alphabetSize();
    }

    public SuffixTreeConfiguration configuration() {
        return configuration;
    }

    TextBuffer textBuffer() {
        return text;
    }

    NodeStore nodeStore() {
        return store;
    }

    // =================
    // === Queries ===
    // =================

    public boolean search(String pattern) {
        if (pattern == null) {
            return false;
        }
        boolean found = pattern.isEmpty() || locate(pattern) != NodeStore.NONE;
        if (configuration.logQueries()) {
            SuffixTreeLogger.info("Pattern '" + pattern + "' " + (found ? "found" : "not found"));
        }
        return found;
    }

    /**
     * All start offsets of {@code pattern} in the text, ascending. The empty pattern occurs at
     * every offset 0..n-1.
     */
    public List<Integer> findAllOccurrences(String pattern) {
        if (pattern == null) {
            return Collections.emptyList();
        }
        int n = text.originalLength();
        if (pattern.isEmpty()) {
            IntArrayList all = new IntArrayList(n);
            for (int i = 0; i < n; i++) {
                all.add(i);
            }
            return all;
        }

        int node = locate(pattern);
        if (node == NodeStore.NONE) {
            if (configuration.logQueries()) {
                SuffixTreeLogger.info("Found 0 occurrences of pattern '" + pattern + "'");
            }
            return Collections.emptyList();
        }

        IntArrayList starts = new IntArrayList();
        IntArrayList stack = new IntArrayList();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            if (store.isLeaf(current)) {
                int index = store.suffixIndex(current);
                // Filter out suffixes that would run into the sentinel.
                if (index >= 0 && index + pattern.length() <= n) {
                    starts.add(index);
                }
                continue;
            }
            for (int symbol : store.childSymbols(current)) {
                stack.push(store.child(current, symbol));
            }
        }

        int[] sorted = starts.toIntArray();
        Arrays.sort(sorted);
        if (configuration.logQueries()) {
            SuffixTreeLogger.info("Found " + sorted.length + " occurrences of pattern '" + pattern + "'");
        }
        return IntArrayList.wrap(sorted);
    }

    public int substringCount(String pattern) {
        return findAllOccurrences(pattern).size();
    }

    public boolean isSuffix(String pattern) {
        if (pattern == null) {
            return false;
        }
        return text.text().endsWith(pattern);
    }

    public String longestRepeatedSubstring() {
        return longestRepeatedSubstring(configuration.tieBreak());
    }

    /**
     * Longest substring that occurs at least twice (occurrences may overlap). Ties between
     * candidates of equal length are settled by {@code tieBreak}. Returns "" if no character
     * repeats.
     */
    public String longestRepeatedSubstring(RepeatTieBreak tieBreak) {
        Objects.requireNonNull(tieBreak, "tieBreak");

        // Internal nodes are exactly the branching points, so every one is a repeat.
        int bestDepth = 0;
        IntArrayList candidates = new IntArrayList();

        IntArrayList stack = new IntArrayList();
        IntArrayList depths = new IntArrayList();
        stack.push(NodeStore.ROOT);
        depths.push(0);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            int depth = depths.popInt();
            if (node != NodeStore.ROOT && store.childCount(node) >= 2) {
                if (depth > bestDepth) {
                    bestDepth = depth;
                    candidates.clear();
                    candidates.add(node);
                } else if (depth == bestDepth) {
                    candidates.add(node);
                }
            }
            for (int symbol : store.childSymbols(node)) {
                int child = store.child(node, symbol);
                if (!store.isLeaf(child)) {
                    stack.push(child);
                    depths.push(depth + store.edgeLength(child));
                }
            }
        }

        if (bestDepth == 0) {
            return "";
        }

        String best = null;
        int bestStart = Integer.MAX_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            int node = candidates.getInt(i);
            if (tieBreak == RepeatTieBreak.EARLIEST_OCCURRENCE) {
                int start = firstOccurrence(node);
                if (start < bestStart) {
                    bestStart = start;
                    best = text.slice(start, start + bestDepth);
                }
            } else {
                String label = pathLabel(node, bestDepth);
                if (best == null || label.compareTo(best) < 0) {
                    best = label;
                }
            }
        }
        return best;
    }

    /**
     * Every non-empty suffix of the text, ascending by {@link String#compareTo}.
     */
    public List<String> allSuffixes() {
        List<String> suffixes = new ArrayList<>(text.originalLength());
        IntArrayList stack = new IntArrayList();
        IntArrayList depths = new IntArrayList();
        stack.push(NodeStore.ROOT);
        depths.push(0);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            int depth = depths.popInt();
            if (node != NodeStore.ROOT && store.isLeaf(node)) {
                // Path label minus the sentinel; the sentinel-only leaf spells "".
                String suffix = pathLabel(node, depth);
                if (!suffix.isEmpty()) {
                    suffixes.add(suffix);
                }
                continue;
            }
            for (int symbol : store.childSymbols(node)) {
                int child = store.child(node, symbol);
                stack.push(child);
                depths.push(depth + store.edgeLength(child));
            }
        }
        Collections.sort(suffixes);
        return suffixes;
    }

    // Node count, root and the sentinel-only leaf included.
    public int size() {
        return store.size();
    }

    public int leafCount() {
        int leaves = 0;
        for (int id = 1; id < store.size(); id++) {
            if (store.isLeaf(id)) {
                leaves++;
            }
        }
        return leaves;
    }

    public int internalNodeCount() {
        return store.size() - 1 - leafCount();
    }

    /**
     * Structural check of the finished tree. Every problem found is logged; returns false if
     * there is at least one.
     */
    public boolean validate() {
        boolean valid = true;
        int leaves = 0;

        IntArrayList stack = new IntArrayList();
        IntArrayList depths = new IntArrayList();
        stack.push(NodeStore.ROOT);
        depths.push(0);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            int depth = depths.popInt();

            if (node != NodeStore.ROOT && store.isLeaf(node)) {
                leaves++;
                int expected = text.length() - depth;
                if (store.suffixIndex(node) != expected) {
                    SuffixTreeLogger.error("Leaf " + node + " has suffix index " + store.suffixIndex(node)
                            + " but its path spells the suffix at " + expected);
                    valid = false;
                }
                continue;
            }

            if (node != NodeStore.ROOT) {
                if (store.childCount(node) < 2) {
                    SuffixTreeLogger.error("Internal node " + node + " has " + store.childCount(node) + " children");
                    valid = false;
                }
                if (store.suffixLink(node) == NodeStore.NO_LINK) {
                    SuffixTreeLogger.error("Internal node " + node + " has no suffix link");
                    valid = false;
                }
            }

            for (int symbol : store.childSymbols(node)) {
                int child = store.child(node, symbol);
                int start = store.edgeStart(child);
                int length = store.edgeLength(child);
                if (length <= 0) {
                    SuffixTreeLogger.error("Invalid edge: node=" + child + " start=" + start + " end=" + store.edgeEnd(child));
                    valid = false;
                    continue;
                }
                if (text.symbolAt(start) != symbol) {
                    SuffixTreeLogger.error("Edge into node " + child + " starts with symbol " + text.symbolAt(start)
                            + " but is keyed under " + symbol);
                    valid = false;
                }
                stack.push(child);
                depths.push(depth + length);
            }
        }

        if (leaves != text.length()) {
            SuffixTreeLogger.error("Expected " + text.length() + " leaves, found " + leaves);
            valid = false;
        }
        return valid;
    }

    /**
     * Walk down from the root along {@code pattern}. Returns the node at or below the point
     * where the pattern ends (so the pattern's occurrences are exactly the leaves under it),
     * or NONE if the pattern does not occur. Ending exactly on an edge boundary and ending
     * mid-edge both yield the child the last symbol was read on.
     */
    private int locate(String pattern) {
        int[] symbols = text.mapPattern(pattern);
        if (symbols == null || symbols.length > text.originalLength()) {
            return NodeStore.NONE;
        }

        int current = NodeStore.ROOT;
        int patternIndex = 0;
        while (patternIndex < symbols.length) {
            int next = store.child(current, symbols[patternIndex]);
            if (next == NodeStore.NONE) {
                return NodeStore.NONE;
            }
            int edgeStart = store.edgeStart(next);
            int edgeLength = store.edgeLength(next);
            int consumed = 0;
            while (consumed < edgeLength && patternIndex < symbols.length) {
                if (text.symbolAt(edgeStart + consumed) != symbols[patternIndex]) {
                    return NodeStore.NONE;
                }
                consumed++;
                patternIndex++;
            }
            current = next;
        }
        return current;
    }

    // Path string of a node whose string depth is depth, with the sentinel dropped.
    private String pathLabel(int node, int depth) {
        int endExclusive = store.edgeEnd(node) + 1;
        return text.slice(endExclusive - depth, endExclusive);
    }

    private int firstOccurrence(int node) {
        int first = Integer.MAX_VALUE;
        IntArrayList stack = new IntArrayList();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            if (store.isLeaf(current)) {
                first = Math.min(first, store.suffixIndex(current));
                continue;
            }
            for (int symbol : store.childSymbols(current)) {
                stack.push(store.child(current, symbol));
            }
        }
        return first;
    }

    // =========================
    // === JOL memory reports ==
    // =========================

    /**
     * Produce a memory footprint report for this tree using JOL.
     *
     * @param includeFootprintTable when true, append the full class histogram for the tree root.
     * @return human-readable report string in mebibytes
     */
    public String jolMemoryReport(boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout totalLayout = GraphLayout.parseInstance(this);
        sb.append("\n=== SuffixTree total (tree as root) ===\n");
        appendLayout(sb, "Total", totalLayout.totalSize());

        GraphLayout nodesLayout = GraphLayout.parseInstance(store);
        long textBytes = GraphLayout.parseInstance(text).totalSize();
        // The store references the text buffer; report the arena on its own.
        long nodeBytes = Math.max(0, nodesLayout.totalSize() - textBytes);
        appendLayout(sb, "Node arena", nodeBytes);
        appendLayout(sb, "Text buffer", textBytes);

        long remainder = totalLayout.totalSize() - nodeBytes - textBytes;
        if (remainder < 0) {
            remainder = 0;
        }
        appendLayout(sb, "Other fields", remainder);

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint (SuffixTree root) ---\n");
            sb.append(totalLayout.toFootprint()).append('\n');
        }

        return sb.toString();
    }

    /** Same report as {@link #jolMemoryReport(boolean)} plus the numeric total. */
    public MemoryUsageReport jolMemoryReportWithTotal(boolean includeFootprintTable) {
        String txt = jolMemoryReport(includeFootprintTable);
        long totalBytes = GraphLayout.parseInstance(this).totalSize();
        return new MemoryUsageReport(txt, totalBytes);
    }

    private static void appendLayout(StringBuilder sb, String label, long bytes) {
        sb.append(String.format(Locale.ROOT,
                "%s: %d B (%.3f MiB)%n",
                label,
                bytes,
                bytes / (1024.0 * 1024.0)));
    }
}
