package im.arun.treereader.error;

/**
 * A lattice path could not be decomposed into exactly one tree.
 * Raised for unmatched steps, a leftover remainder or an empty path.
 */
public class MalformedPathException extends TreeReaderException {

    public MalformedPathException(String message) {
        super(message);
    }
}
