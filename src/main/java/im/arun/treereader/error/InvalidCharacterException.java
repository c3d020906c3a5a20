package im.arun.treereader.error;

import lombok.Getter;

/**
 * The scanner met a character that is neither markup nor the start of a node token.
 */
@Getter
public class InvalidCharacterException extends TreeReaderException {

    /** 1-based. */
    private final int line;

    /** 0-based, counted the same way node columns are. */
    private final int column;

    /** The offending UTF-16 unit, or -1 when the input ended mid-token. */
    private final int character;

    public InvalidCharacterException(int line, int column, int character) {
        super(String.format("Unexpected %s at line %d, column %d",
            describe(character), line, column));
        this.line = line;
        this.column = column;
        this.character = character;
    }

    private static String describe(int character) {
        if (character < 0) {
            return "end of input";
        }
        if (Character.isISOControl(character) || Character.isWhitespace(character)) {
            return String.format("character U+%04X", character);
        }
        return String.format("character '%s' (U+%04X)", new String(Character.toChars(character)), character);
    }
}
