package im.arun.treereader.scan;

import im.arun.treereader.config.TreeReaderConfig;
import im.arun.treereader.error.InvalidCharacterException;
import im.arun.treereader.model.Payload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.function.Consumer;

/**
 * Single-pass scanner for indentation-based node listings such as
 * {@code clang -Xclang -ast-dump} output.
 * <p>
 * Only the column at which a node token starts matters downstream. Markup is
 * consumed for its width alone: blanks and {@code |} advance the column by one,
 * a branch glyph such as {@code |-} or {@code `-} advances it by two and is
 * consumed as a unit. A node token is an identifier or the absent-node
 * sentinel; the rest of its line is copied verbatim as the attribute.
 */
public class ListingScanner {
    private static final Logger logger = LoggerFactory.getLogger(ListingScanner.class);
    private static final int EOF = -1;

    private final Reader reader;
    private final String nullToken;
    private final List<String> branchGlyphs;

    private int lookahead;
    private int line = 1;
    private int column;

    public ListingScanner(Reader reader, TreeReaderConfig config) {
        this.reader = reader;
        this.nullToken = config.getNullToken();
        this.branchGlyphs = List.copyOf(config.getBranchGlyphs());
        validate();
    }

    private void validate() {
        if (nullToken == null || nullToken.isEmpty()) {
            throw new IllegalArgumentException("The null token must not be empty");
        }
        for (String glyph : branchGlyphs) {
            if (glyph == null || glyph.length() != 2) {
                throw new IllegalArgumentException("Branch glyphs must be two characters long: " + glyph);
            }
        }
        // the sentinel is only tried once no other rule claims its first character
        char first = nullToken.charAt(0);
        boolean shadowed = isIdentifierStart(first) || first == ' ' || first == '\t' || first == '|'
            || first == '\n' || first == '\r'
            || branchGlyphs.stream().anyMatch(glyph -> glyph.charAt(0) == first);
        if (shadowed) {
            throw new IllegalArgumentException("The null token cannot start with '" + first
                + "', that character is already markup or part of a name: " + nullToken);
        }
    }

    /**
     * Scans the whole input, handing each recognized node to {@code sink} as soon
     * as its line is read.
     *
     * @return the number of nodes recognized
     * @throws InvalidCharacterException on the first character no rule accepts
     */
    public int scan(Consumer<NodeEvent> sink) throws IOException {
        int count = 0;
        lookahead = reader.read();
        while (lookahead != EOF) {
            int c = advance();
            if (c == '\n' || c == '\r') {
                newline(c);
            } else if (isBranchGlyph(c)) {
                advance();
                column += 2;
            } else if (c == ' ' || c == '\t' || c == '|') {
                column++;
            } else if (isIdentifierStart(c)) {
                sink.accept(readNode(identifier(c)));
                count++;
            } else if (c == nullToken.charAt(0)) {
                sink.accept(readNode(sentinel()));
                count++;
            } else {
                throw new InvalidCharacterException(line, column, c);
            }
        }
        return count;
    }

    private int advance() throws IOException {
        int c = lookahead;
        lookahead = reader.read();
        return c;
    }

    private void newline(int c) throws IOException {
        if (c == '\r' && lookahead == '\n') {
            advance();
        }
        line++;
        column = 0;
    }

    private boolean isBranchGlyph(int c) {
        for (String glyph : branchGlyphs) {
            if (glyph.charAt(0) == c && glyph.charAt(1) == lookahead) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIdentifierStart(int c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(int c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private String identifier(int first) throws IOException {
        StringBuilder name = new StringBuilder();
        name.appendCodePoint(first);
        while (lookahead != EOF && isIdentifierPart(lookahead)) {
            name.append((char) advance());
        }
        return name.toString();
    }

    // first character already consumed by the caller
    private String sentinel() throws IOException {
        for (int i = 1; i < nullToken.length(); i++) {
            if (lookahead != nullToken.charAt(i)) {
                throw new InvalidCharacterException(line, column + i, lookahead);
            }
            advance();
        }
        return nullToken;
    }

    /**
     * Copies the rest of the line into the attribute and moves to the next line.
     */
    private NodeEvent readNode(String name) throws IOException {
        StringBuilder attribute = new StringBuilder();
        while (lookahead != EOF && lookahead != '\n' && lookahead != '\r') {
            attribute.append((char) advance());
        }
        NodeEvent event = new NodeEvent(line, column, new Payload(name, attribute.toString()));
        logger.debug("Node {} at line {}, column {}", name, line, column);
        if (lookahead != EOF) {
            newline(advance());
        }
        return event;
    }
}
