package im.arun.treereader.tree;

import im.arun.treereader.model.LatticePath;
import im.arun.treereader.scan.NodeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Translates the scanner's node events into a lattice path in reversed preorder.
 * <p>
 * Each node first climbs out of the levels the previous node left open, then
 * rises onto itself. {@link #finish()} closes whatever is still open.
 */
public class PathBuilder implements Consumer<NodeEvent> {
    private static final Logger logger = LoggerFactory.getLogger(PathBuilder.class);

    private final AncestorThread thread = new AncestorThread();
    private LatticePath path = LatticePath.empty();
    private int nodeCount;
    private boolean finished;

    @Override
    public void accept(NodeEvent event) {
        if (finished) {
            throw new IllegalStateException("Path already finished, cannot add " + event);
        }
        int delta = thread.computeDelta(event.getColumn());
        path = path.padFalls(delta + 1).rise(event.getPayload());
        nodeCount++;
        logger.trace("Line {}: column {} -> delta {}, depth {}",
            event.getLine(), event.getColumn(), delta, thread.depth());
    }

    /**
     * Closes every level still open and returns the completed path.
     */
    public LatticePath finish() {
        if (finished) {
            throw new IllegalStateException("Path already finished");
        }
        finished = true;
        path = path.padFalls(thread.depth());
        logger.debug("Built path of {} steps for {} nodes", path.length(), nodeCount);
        return path;
    }

    public int getNodeCount() {
        return nodeCount;
    }
}
