package im.arun.treereader.config;

/**
 * What the command line does with a tree once it is rebuilt.
 */
public enum OutputFormat {
    /** Build the tree and discard it. */
    NONE,
    JSON,
    OUTLINE
}
