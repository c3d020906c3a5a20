package im.arun.treereader.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Columns of the nodes on the way from the root to the most recently read
 * node, nearest first. Turns each new column into a signed depth change.
 */
public class AncestorThread {

    private final Deque<Integer> columns = new ArrayDeque<>();

    /**
     * Places a node starting at {@code column} and returns how far the path must
     * climb before descending onto it.
     * <p>
     * Every ancestor deeper than {@code column} is popped and counts one level up.
     * If an ancestor at exactly {@code column} remains, the new node is its
     * sibling and the result is the number of pops. Otherwise the column is
     * pushed, the new node opens one level below what remains, and one is
     * subtracted. A node read directly below the previous one thus yields -1,
     * the very first node included.
     *
     * @return the number of levels to climb, or -1 to descend one level
     */
    public int computeDelta(int column) {
        int delta = 0;
        while (!columns.isEmpty() && columns.peek() > column) {
            columns.pop();
            delta++;
        }
        if (!columns.isEmpty() && columns.peek() == column) {
            return delta;
        }
        columns.push(column);
        return delta - 1;
    }

    /**
     * Number of open ancestors, including the most recent node.
     */
    public int depth() {
        return columns.size();
    }

    /**
     * Snapshot of the recorded columns, nearest first.
     */
    public List<Integer> columns() {
        return new ArrayList<>(columns);
    }
}
