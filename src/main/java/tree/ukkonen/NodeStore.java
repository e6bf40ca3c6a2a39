package tree.ukkonen;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Arena of suffix tree nodes addressed by int id. Each node is a slot in a set of parallel
 * primitive lists, so children and suffix links are plain indices and the node graph holds
 * no object references.
 *
 * Edge labels are inclusive index ranges into the {@link TextBuffer}. Leaves created during
 * construction carry {@link #OPEN_END} and resolve their end against the builder's leaf-end
 * counter; {@link #closeOpenEdges(int)} freezes them once the last phase is done.
 *
 * Memory notes:
 *  - Lazy children: a node's child map stays null until the first child is inserted
 *  - Root is always id 0 and has no incoming edge
 */
final class NodeStore {

    static final int ROOT = 0;
    static final int NONE = -1;
    static final int OPEN_END = -1;
    static final int NO_LINK = -1;

    private static final int INITIAL_CHILD_CAPACITY = 4;

    private final TextBuffer text;

    private final IntArrayList edgeStart;
    private final IntArrayList edgeEnd;
    private final IntArrayList suffixLink;
    // Start position of the suffix spelled by a leaf; -1 for internal nodes.
    private final IntArrayList suffixIndex;
    private final ObjectArrayList<Int2IntOpenHashMap> children;

    private boolean closed;

    NodeStore(TextBuffer text) {
        this.text = text;
        // A tree over n+1 symbols has at most 2(n+1) nodes.
        int expectedNodes = Math.min(2 * text.length(), 1 << 20);
        this.edgeStart = new IntArrayList(expectedNodes);
        this.edgeEnd = new IntArrayList(expectedNodes);
        this.suffixLink = new IntArrayList(expectedNodes);
        this.suffixIndex = new IntArrayList(expectedNodes);
        this.children = new ObjectArrayList<>(expectedNodes);

        int root = allocate(NONE, NONE, NONE);
        if (root != ROOT) {
            throw new IllegalStateException("root must be node " + ROOT);
        }
    }

    private int allocate(int start, int end, int leafSuffixIndex) {
        int id = edgeStart.size();
        edgeStart.add(start);
        edgeEnd.add(end);
        suffixLink.add(NO_LINK);
        suffixIndex.add(leafSuffixIndex);
        children.add(null);
        return id;
    }

    // Internal node with a fixed edge end.
    int newNode(int start, int end) {
        ensureMutable();
        return allocate(start, end, NONE);
    }

    // Leaf whose edge tracks the global leaf end.
    int newLeaf(int start, int leafSuffixIndex) {
        ensureMutable();
        return allocate(start, OPEN_END, leafSuffixIndex);
    }

    int size() {
        return edgeStart.size();
    }

    int child(int id, int symbol) {
        Int2IntOpenHashMap map = children.get(id);
        return map == null ? NONE : map.get(symbol);
    }

    void setChild(int id, int symbol, int childId) {
        ensureMutable();
        Int2IntOpenHashMap map = children.get(id);
        if (map == null) {
            map = new Int2IntOpenHashMap(INITIAL_CHILD_CAPACITY);
            map.defaultReturnValue(NONE);
            children.set(id, map);
        }
        map.put(symbol, childId);
    }

    int childCount(int id) {
        Int2IntOpenHashMap map = children.get(id);
        return map == null ? 0 : map.size();
    }

    boolean isLeaf(int id) {
        return childCount(id) == 0;
    }

    // First symbols of the outgoing edges, ordered by their character (sentinel first).
    int[] childSymbols(int id) {
        Int2IntOpenHashMap map = children.get(id);
        if (map == null) {
            return IntArrays.EMPTY_ARRAY;
        }
        int[] symbols = map.keySet().toIntArray();
        IntArrays.quickSort(symbols, (a, b) -> Integer.compare(text.sortKey(a), text.sortKey(b)));
        return symbols;
    }

    int edgeStart(int id) {
        return edgeStart.getInt(id);
    }

    // Inclusive end of the incoming edge, resolving an open end against leafEnd.
    int edgeEnd(int id, int leafEnd) {
        int end = edgeEnd.getInt(id);
        return end == OPEN_END ? leafEnd : end;
    }

    int edgeLength(int id, int leafEnd) {
        if (id == ROOT) {
            return 0;
        }
        return edgeEnd(id, leafEnd) - edgeStart.getInt(id) + 1;
    }

    // Edge end once construction is over and no open ends remain.
    int edgeEnd(int id) {
        if (!closed) {
            throw new IllegalStateException("open edge ends are only resolvable during construction");
        }
        return edgeEnd.getInt(id);
    }

    int edgeLength(int id) {
        return id == ROOT ? 0 : edgeEnd(id) - edgeStart.getInt(id) + 1;
    }

    boolean hasOpenEnd(int id) {
        return id != ROOT && edgeEnd.getInt(id) == OPEN_END;
    }

    int suffixLink(int id) {
        return suffixLink.getInt(id);
    }

    void setSuffixLink(int id, int target) {
        ensureMutable();
        suffixLink.set(id, target);
    }

    int suffixIndex(int id) {
        return suffixIndex.getInt(id);
    }

    /**
     * Split the incoming edge of {@code id} after {@code offset} symbols. The new internal
     * node takes over the first {@code offset} symbols and gets {@code id} as its only child;
     * the caller re-attaches the new node under the old parent.
     */
    int splitEdge(int id, int offset) {
        ensureMutable();
        int start = edgeStart.getInt(id);
        if (id == ROOT || offset <= 0) {
            throw new IllegalArgumentException("cannot split node " + id + " at offset " + offset);
        }
        int split = allocate(start, start + offset - 1, NONE);
        int remainderStart = start + offset;
        edgeStart.set(id, remainderStart);
        setChild(split, text.symbolAt(remainderStart), id);
        return split;
    }

    /**
     * Freeze every open leaf end at finalEnd and trim the arena. The store is read-only
     * afterwards.
     */
    void closeOpenEdges(int finalEnd) {
        ensureMutable();
        for (int id = 1; id < edgeEnd.size(); id++) {
            if (edgeEnd.getInt(id) == OPEN_END) {
                edgeEnd.set(id, finalEnd);
            }
        }
        edgeStart.trim();
        edgeEnd.trim();
        suffixLink.trim();
        suffixIndex.trim();
        children.trim();
        for (Int2IntOpenHashMap map : children) {
            if (map != null) {
                map.trim();
            }
        }
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    private void ensureMutable() {
        if (closed) {
            throw new IllegalStateException("node store is read-only after construction");
        }
    }
}
