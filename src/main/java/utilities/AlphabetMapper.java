package utilities;

import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;

public class AlphabetMapper {
    // 0 is reserved as the sentinel id of the suffix tree
    public static final int SENTINEL = 0;
    // Returned by lookups for characters that were never inserted.
    public static final int ABSENT = -1;

    private int nextId = 1;
    private final float loadFactor = 0.75f;

    // Primitive map to avoid boxing every character of the text
    private final Char2IntOpenHashMap charToId;
    private char[] idToChar;

    public AlphabetMapper(int capacity) {
        int expected = Math.max(1, capacity);

        // Pre-size to the expected alphabet size to avoid rehashing.
        this.charToId = new Char2IntOpenHashMap(expected, loadFactor);
        // Use -1 as the default return to distinguish from valid ids (>=1) and the sentinel 0.
        this.charToId.defaultReturnValue(ABSENT);
        this.idToChar = new char[expected + 1];
    }

    // Number of distinct characters seen so far (sentinel excluded).
    public int getSize() {
        return charToId.size();
    }

    // Insert-on-miss mapping, used while reading the text.
    public int insert(char c) {
        int id = charToId.get(c);
        if (id == ABSENT) {
            id = nextId;
            nextId++;
            charToId.put(c, id);
            if (id >= idToChar.length) {
                char[] grown = new char[Math.max(idToChar.length * 2, id + 1)];
                System.arraycopy(idToChar, 0, grown, 0, idToChar.length);
                idToChar = grown;
            }
            idToChar[id] = c;
        }
        return id;
    }

    // Lookup-only mapping, used for patterns. Returns ABSENT for unseen characters.
    public int getId(char c) {
        return charToId.get(c);
    }

    public char charOf(int id) {
        if (id <= SENTINEL || id >= nextId) {
            throw new IllegalArgumentException("no character for id " + id);
        }
        return idToChar[id];
    }

    /**
     * Translate a pattern into symbol ids. Returns null as soon as a character
     * is not part of the alphabet, since such a pattern cannot occur.
     */
    public int[] mapPattern(CharSequence pattern) {
        int[] ids = new int[pattern.length()];
        for (int i = 0; i < ids.length; i++) {
            int id = charToId.get(pattern.charAt(i));
            if (id == ABSENT) {
                return null;
            }
            ids[i] = id;
        }
        return ids;
    }
}
