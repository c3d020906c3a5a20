package im.arun.treereader.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * The data carried by one node of a listing: the node-name token and the
 * verbatim remainder of its line.
 */
@Value
public class Payload {

    @JsonProperty("name")
    String name;

    @JsonProperty("attribute")
    String attribute;

    public static Payload of(String name) {
        return new Payload(name, "");
    }
}
