package im.arun.treereader.error;

/**
 * Base class for the fatal conditions raised while reading a listing.
 */
public class TreeReaderException extends RuntimeException {

    public TreeReaderException(String message) {
        super(message);
    }
}
