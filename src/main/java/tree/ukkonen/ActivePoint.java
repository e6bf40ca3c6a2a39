package tree.ukkonen;

/**
 * Cursor shared by all suffixes that are not yet explicit: {@code length} symbols down the
 * edge leaving {@code node} whose first symbol is at text index {@code edgeIndex}.
 * A length of zero means the cursor sits exactly on {@code node}.
 */
final class ActivePoint {

    int node;
    int edgeIndex;
    int length;

    ActivePoint(int root) {
        this.node = root;
        this.edgeIndex = -1;
        this.length = 0;
    }

    boolean atNode() {
        return length == 0;
    }

    /**
     * Move past a whole edge of edgeLength symbols if the cursor reaches beyond it.
     * Return true if the cursor moved to child.
     */
    boolean walkDown(int child, int edgeLength) {
        if (length >= edgeLength) {
            edgeIndex += edgeLength;
            length -= edgeLength;
            node = child;
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "ActivePoint(node=" + node + ", edgeIndex=" + edgeIndex + ", length=" + length + ")";
    }
}
