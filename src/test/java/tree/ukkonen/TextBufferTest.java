package tree.ukkonen;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TextBufferTest {

    @Test
    public void testLengthsAndSentinel() {
        final TextBuffer text = TextBuffer.of("banana");
        assertEquals(7, text.length());
        assertEquals(6, text.originalLength());
        assertEquals(0, text.symbolAt(6));
        assertTrue(text.isSentinel(6));
        assertFalse(text.isSentinel(5));
        assertEquals(3, text.alphabetSize());
        assertEquals("banana", text.text());
    }

    @Test
    public void testSymbolsAreDenseInOrderOfFirstAppearance() {
        final TextBuffer text = TextBuffer.of("banana");
        assertEquals(1, text.symbolAt(0));
        assertEquals(2, text.symbolAt(1));
        assertEquals(3, text.symbolAt(2));
        assertEquals(2, text.symbolAt(3));
    }

    @Test
    public void testSlice() {
        final TextBuffer text = TextBuffer.of("banana");
        assertEquals("ban", text.slice(0, 3));
        assertEquals("", text.slice(2, 2));
        // the sentinel renders as nothing
        assertEquals("na", text.slice(4, 7));
        assertEquals("", text.slice(6, 7));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testSliceOutOfRange() {
        TextBuffer.of("banana").slice(0, 8);
    }

    @Test
    public void testMapPattern() {
        final TextBuffer text = TextBuffer.of("banana");
        assertArrayEquals(new int[]{2, 3, 2}, text.mapPattern("ana"));
        assertArrayEquals(new int[0], text.mapPattern(""));
        assertNull(text.mapPattern("bat"));
    }

    @Test(expected = EmptyTextException.class)
    public void testEmpty() {
        TextBuffer.of("");
    }
}
