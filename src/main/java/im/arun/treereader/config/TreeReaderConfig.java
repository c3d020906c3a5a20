package im.arun.treereader.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TreeReaderConfig {

    /** Token a dumper prints in place of an absent child. */
    @JsonProperty("null_token")
    private String nullToken = "<<<NULL>>>";

    /** Two-character glyphs that each advance the column by two. */
    @JsonProperty("branch_glyphs")
    private List<String> branchGlyphs = new ArrayList<>(List.of("|-", "`-"));

    @JsonProperty("output_format")
    private OutputFormat outputFormat = OutputFormat.NONE;

    @JsonProperty("charset")
    private String charset = "UTF-8";
}
