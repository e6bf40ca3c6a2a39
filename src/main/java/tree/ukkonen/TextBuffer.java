package tree.ukkonen;

import utilities.AlphabetMapper;

/**
 * Immutable text of a suffix tree: the caller's characters mapped to dense symbol ids,
 * followed by one sentinel symbol that occurs nowhere else.
 */
public final class TextBuffer {

    // Original characters, without the sentinel.
    private final String original;

    // Symbol ids including the sentinel at the end.
    private final int[] symbols;

    private final AlphabetMapper alphabet;

    private TextBuffer(String original, int[] symbols, AlphabetMapper alphabet) {
        this.original = original;
        this.symbols = symbols;
        this.alphabet = alphabet;
    }

    public static TextBuffer of(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (text.isEmpty()) {
            throw new EmptyTextException();
        }
        AlphabetMapper alphabet = new AlphabetMapper(Math.min(text.length(), 1 << 10));
        int[] symbols = new int[text.length() + 1];
        for (int i = 0; i < text.length(); i++) {
            symbols[i] = alphabet.insert(text.charAt(i));
        }
        symbols[text.length()] = AlphabetMapper.SENTINEL;
        return new TextBuffer(text, symbols, alphabet);
    }

    // Length including the sentinel.
    public int length() {
        return symbols.length;
    }

    // Length of the caller's text.
    public int originalLength() {
        return original.length();
    }

    public int symbolAt(int index) {
        return symbols[index];
    }

    public boolean isSentinel(int index) {
        return index == symbols.length - 1;
    }

    /**
     * Characters in [start, endExclusive). The sentinel position, when covered, renders as nothing.
     */
    public String slice(int start, int endExclusive) {
        if (start < 0 || endExclusive < start || endExclusive > symbols.length) {
            throw new IndexOutOfBoundsException("slice [" + start + ", " + endExclusive + ") of " + symbols.length);
        }
        int end = Math.min(endExclusive, original.length());
        if (start >= end) {
            return "";
        }
        return original.substring(start, end);
    }

    public String text() {
        return original;
    }

    // Number of distinct characters in the text.
    public int alphabetSize() {
        return alphabet.getSize();
    }

    // Pattern symbols, or null when a pattern character never occurs in the text.
    int[] mapPattern(CharSequence pattern) {
        return alphabet.mapPattern(pattern);
    }

    // Sorting key of a symbol: the sentinel orders before every character.
    int sortKey(int symbol) {
        return symbol == AlphabetMapper.SENTINEL ? -1 : alphabet.charOf(symbol);
    }
}
