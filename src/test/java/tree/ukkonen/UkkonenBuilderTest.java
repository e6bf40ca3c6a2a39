package tree.ukkonen;

import datagenerators.Generator;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class UkkonenBuilderTest {

    private static final List<String> TEXTS = Arrays.asList(
            "a", "aa", "ab", "banana", "mississippi", "abcabxabcd", "xabxac", "aaaaaaaa",
            "abababab", "dedododeeodo", "cdddcdc", "abcdefghij", "abab$ab");

    @Test
    public void testStoreIsClosedAfterBuild() {
        final NodeStore store = new UkkonenBuilder(TextBuffer.of("banana")).build();
        assertTrue(store.isClosed());
        for (int id = 1; id < store.size(); id++) {
            assertFalse(store.hasOpenEnd(id));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testBuilderIsSingleUse() {
        final UkkonenBuilder builder = new UkkonenBuilder(TextBuffer.of("banana"));
        builder.build();
        builder.build();
    }

    @Test
    public void testSuffixLinksPointToPathWithoutFirstSymbol() {
        for (String s : TEXTS) {
            checkSuffixLinks(s);
        }
        for (int seed = 0; seed < 50; seed++) {
            checkSuffixLinks(Generator.generateUniform(64, 1 + seed % 4, seed));
        }
    }

    @Test
    public void testLeafSuffixIndices() {
        for (String s : TEXTS) {
            final TextBuffer text = TextBuffer.of(s);
            final NodeStore store = new UkkonenBuilder(text).build();
            final int[] depth = depths(store);
            final boolean[] seen = new boolean[text.length()];
            for (int id = 1; id < store.size(); id++) {
                if (store.isLeaf(id)) {
                    final int index = store.suffixIndex(id);
                    assertEquals(s, text.length() - depth[id], index);
                    assertFalse(s + " duplicate leaf for suffix " + index, seen[index]);
                    seen[index] = true;
                }
            }
        }
    }

    @Test
    public void testNodeCountIsLinear() {
        final String s = Generator.generateUniform(5_000, 4, 99L);
        final NodeStore store = new UkkonenBuilder(TextBuffer.of(s)).build();
        assertTrue(store.size() <= 2 * (s.length() + 1));
    }

    private static void checkSuffixLinks(String s) {
        final TextBuffer text = TextBuffer.of(s);
        final NodeStore store = new UkkonenBuilder(text).build();
        final int[] depth = depths(store);
        for (int id = 1; id < store.size(); id++) {
            if (store.isLeaf(id)) {
                continue;
            }
            final int link = store.suffixLink(id);
            assertNotEquals(s + " node " + id, NodeStore.NO_LINK, link);
            assertEquals(s + " node " + id, depth[id] - 1, depth[link]);
            assertEquals(s + " node " + id, path(text, store, id, depth[id]).substring(1),
                    path(text, store, link, depth[link]));
        }
    }

    private static String path(TextBuffer text, NodeStore store, int node, int depth) {
        if (node == NodeStore.ROOT) {
            return "";
        }
        final int endExclusive = store.edgeEnd(node) + 1;
        return text.slice(endExclusive - depth, endExclusive);
    }

    // String depth of every node, filled top-down.
    private static int[] depths(NodeStore store) {
        final int[] depth = new int[store.size()];
        final int[] stack = new int[store.size()];
        int top = 0;
        stack[top++] = NodeStore.ROOT;
        while (top > 0) {
            final int node = stack[--top];
            for (int symbol : store.childSymbols(node)) {
                final int child = store.child(node, symbol);
                depth[child] = depth[node] + store.edgeLength(child);
                stack[top++] = child;
            }
        }
        return depth;
    }
}
