package im.arun.treereader.service;

import im.arun.treereader.config.TreeReaderConfig;
import im.arun.treereader.model.LatticePath;
import im.arun.treereader.model.Tree;
import im.arun.treereader.scan.ListingScanner;
import im.arun.treereader.tree.PathBuilder;
import im.arun.treereader.tree.TreeReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads a node listing into a tree: scan, build the lattice path, rebuild the tree.
 * Each call scans its input exactly once.
 */
public class TreeReaderService {
    private static final Logger logger = LoggerFactory.getLogger(TreeReaderService.class);

    private final TreeReaderConfig config;
    private final TreeReconstructor reconstructor;

    public TreeReaderService() {
        this(new TreeReaderConfig());
    }

    public TreeReaderService(TreeReaderConfig config) {
        this.config = config;
        this.reconstructor = new TreeReconstructor();
    }

    /**
     * Read the listing stored in {@code listing}.
     *
     * @throws NoSuchFileException if the file does not exist
     */
    public Tree.Node readTree(Path listing) throws IOException {
        if (!Files.exists(listing)) {
            throw new NoSuchFileException(listing.toString());
        }
        logger.info("Reading listing {}", listing);
        try (BufferedReader reader = Files.newBufferedReader(listing, Charset.forName(config.getCharset()))) {
            return readTree(reader);
        }
    }

    public Tree.Node readTree(String listing) {
        try (Reader reader = new StringReader(listing)) {
            return readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Read a listing from an open reader. The caller keeps ownership of the reader.
     */
    public Tree.Node readTree(Reader reader) throws IOException {
        LatticePath path = buildPath(reader);
        Tree.Node tree = reconstructor.reconstruct(path);
        logger.info("Rebuilt tree of {} nodes from a path of {} steps", path.riseCount(), path.length());
        return tree;
    }

    /**
     * Scan a listing into its completed lattice path without rebuilding the tree.
     */
    public LatticePath buildPath(Reader reader) throws IOException {
        PathBuilder builder = new PathBuilder();
        new ListingScanner(reader, config).scan(builder);
        return builder.finish();
    }
}
