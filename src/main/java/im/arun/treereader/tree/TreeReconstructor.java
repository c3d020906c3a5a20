package im.arun.treereader.tree;

import im.arun.treereader.error.MalformedPathException;
import im.arun.treereader.model.LatticePath;
import im.arun.treereader.model.Tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds a tree from a Dyck path given in reversed preorder.
 * <p>
 * Read from the head, a fall opens a node whose children follow and the
 * matching rise closes it with its payload. Children therefore arrive last
 * first and are prepended to their frame. The frames are kept on an explicit
 * stack so the depth of a tree is not bounded by the call stack.
 */
public class TreeReconstructor {

    /**
     * @throws MalformedPathException unless the path decomposes into exactly one tree
     */
    public Tree.Node reconstruct(LatticePath path) {
        if (path.isEmpty()) {
            throw new MalformedPathException("Empty path: the listing contains no node");
        }

        Deque<Deque<Tree.Node>> frames = new ArrayDeque<>();
        int position = 0;
        for (LatticePath cell : path) {
            if (cell.isFall()) {
                frames.push(new ArrayDeque<>());
            } else {
                if (frames.isEmpty()) {
                    throw new MalformedPathException(
                        "Rise at step " + position + " has no matching fall");
                }
                Tree.Node node = Tree.node(cell.getPayload(), List.copyOf(frames.pop()));
                if (frames.isEmpty()) {
                    LatticePath remainder = cell.getRest();
                    if (!remainder.isEmpty()) {
                        throw new MalformedPathException(remainder.length()
                            + " steps left over after the top-level tree " + node.getName());
                    }
                    return node;
                }
                frames.peek().addFirst(node);
            }
            position++;
        }
        throw new MalformedPathException(frames.size() + " falls have no matching rise");
    }
}
