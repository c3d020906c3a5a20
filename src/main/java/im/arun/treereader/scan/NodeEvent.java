package im.arun.treereader.scan;

import im.arun.treereader.model.Payload;
import lombok.Value;

/**
 * One recognized node: where its name token starts and what it carries.
 */
@Value
public class NodeEvent {
    /** 1-based source line. */
    int line;
    /** 0-based column of the first character of the name. */
    int column;
    Payload payload;
}
