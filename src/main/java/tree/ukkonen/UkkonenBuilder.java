package tree.ukkonen;

import utilities.SuffixTreeLogger;

import java.util.Locale;

/**
 * Runs Ukkonen's algorithm over a {@link TextBuffer}, filling a {@link NodeStore}.
 * One phase per symbol, sentinel included; overall O(n) for a fixed alphabet.
 *
 * A builder is single-use: {@link #build()} consumes it and leaves a closed store behind.
 */
final class UkkonenBuilder {

    private final TextBuffer text;
    private final NodeStore store;
    private final ActivePoint active;

    // Global end shared by all open leaf edges; only meaningful while building.
    private int leafEnd = -1;

    // Suffixes of the current prefix that are not yet explicit.
    private int remainingSuffixCount;

    // Internal node created in this phase that still waits for its suffix link.
    private int lastNewInternalNode = NodeStore.NONE;

    private boolean built;

    UkkonenBuilder(TextBuffer text) {
        this.text = text;
        this.store = new NodeStore(text);
        this.active = new ActivePoint(NodeStore.ROOT);
    }

    NodeStore build() {
        if (built) {
            throw new IllegalStateException("builder already used");
        }
        built = true;
        long startNanos = System.nanoTime();
        for (int pos = 0; pos < text.length(); pos++) {
            extend(pos);
        }
        // Every suffix ends at the sentinel, so all of them are explicit leaves now.
        if (remainingSuffixCount != 0) {
            throw new IllegalStateException("construction ended with " + remainingSuffixCount + " implicit suffixes");
        }
        store.closeOpenEdges(text.length() - 1);
        leafEnd = -1;
        if (SuffixTreeLogger.isDebugEnabled()) {
            SuffixTreeLogger.debug(String.format(Locale.ROOT,
                    "Suffix tree built: length=%d nodes=%d in %.3f ms",
                    text.originalLength(), store.size(), (System.nanoTime() - startNanos) / 1e6));
        }
        return store;
    }

    /**
     * One phase: add text[pos] to every suffix of text[0..pos].
     *
     *   1. Advance the shared leaf end (extends every open leaf, rule 1)
     *   2. Make pending suffixes explicit until one is already present (rule 3)
     *   3. Wire suffix links of internal nodes created along the way
     */
    private void extend(int pos) {
        leafEnd = pos;
        remainingSuffixCount++;
        lastNewInternalNode = NodeStore.NONE;

        int current = text.symbolAt(pos);

        while (remainingSuffixCount > 0) {
            if (active.atNode()) {
                active.edgeIndex = pos;
            }

            int edgeSymbol = text.symbolAt(active.edgeIndex);
            int next = store.child(active.node, edgeSymbol);

            if (next == NodeStore.NONE) {
                // Rule 2: new leaf straight off the active node
                int leaf = store.newLeaf(pos, pos - remainingSuffixCount + 1);
                store.setChild(active.node, edgeSymbol, leaf);
                linkPendingTo(active.node);
            } else {
                if (active.walkDown(next, store.edgeLength(next, leafEnd))) {
                    continue;
                }

                if (text.symbolAt(store.edgeStart(next) + active.length) == current) {
                    // Rule 3: already present, the rest of the phase is implicit
                    linkPendingTo(active.node);
                    active.length++;
                    break;
                }

                // Rule 2: split the edge and hang a new leaf off the split point
                int split = store.splitEdge(next, active.length);
                store.setChild(active.node, edgeSymbol, split);
                int leaf = store.newLeaf(pos, pos - remainingSuffixCount + 1);
                store.setChild(split, current, leaf);

                if (lastNewInternalNode != NodeStore.NONE) {
                    store.setSuffixLink(lastNewInternalNode, split);
                }
                lastNewInternalNode = split;
            }

            remainingSuffixCount--;

            if (active.node == NodeStore.ROOT && active.length > 0) {
                active.length--;
                active.edgeIndex = pos - remainingSuffixCount + 1;
            } else if (active.node != NodeStore.ROOT) {
                int link = store.suffixLink(active.node);
                active.node = (link != NodeStore.NO_LINK) ? link : NodeStore.ROOT;
            }
        }

        if (lastNewInternalNode != NodeStore.NONE) {
            throw new IllegalStateException("internal node " + lastNewInternalNode
                    + " has no suffix link at the end of phase " + pos);
        }
        if (SuffixTreeLogger.isTraceEnabled()) {
            SuffixTreeLogger.trace("phase " + pos + " done: " + active + " remaining=" + remainingSuffixCount);
        }
    }

    private void linkPendingTo(int target) {
        if (lastNewInternalNode != NodeStore.NONE) {
            store.setSuffixLink(lastNewInternalNode, target);
            lastNewInternalNode = NodeStore.NONE;
        }
    }
}
