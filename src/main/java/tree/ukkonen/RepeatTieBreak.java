package tree.ukkonen;

/**
 * Rule used by {@link SuffixTree#longestRepeatedSubstring(RepeatTieBreak)} when several
 * repeated substrings share the maximal length.
 */
public enum RepeatTieBreak {
    // Smallest candidate by String.compareTo.
    LEXICOGRAPHIC,
    // Candidate whose first occurrence starts earliest in the text.
    EARLIEST_OCCURRENCE
}
