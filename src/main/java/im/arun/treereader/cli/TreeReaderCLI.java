package im.arun.treereader.cli;

import im.arun.treereader.config.ConfigLoader;
import im.arun.treereader.config.OutputFormat;
import im.arun.treereader.config.TreeReaderConfig;
import im.arun.treereader.error.TreeReaderException;
import im.arun.treereader.model.Tree;
import im.arun.treereader.service.TreeReaderService;
import im.arun.treereader.util.TreeUtils;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for TreeReader using Picocli.
 */
@Command(
    name = "tree-reader",
    description = "Rebuild the tree described by an indentation-based node listing (e.g. a Clang AST dump)",
    mixinStandardHelpOptions = true,
    version = "TreeReader 1.0"
)
public class TreeReaderCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "1", paramLabel = "<listing>", description = "Node listing to read")
    private String listingPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--format"}, description = "What to print once the tree is built: ${COMPLETION-CANDIDATES}")
    private OutputFormat format;

    @Option(names = {"--output"}, description = "Write the rendering to this file instead of stdout")
    private String outputPath;

    @Option(names = {"--null-token"}, description = "Token printed for an absent node")
    private String nullToken;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path listing = Paths.get(listingPath);
        if (!Files.exists(listing)) {
            err.println("File " + listingPath + " does not exist.");
            err.print(spec.commandLine().getUsageMessage());
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (format != null) {
            overrides.put("output_format", format);
        }
        if (nullToken != null) {
            overrides.put("null_token", nullToken);
        }
        TreeReaderConfig config = new ConfigLoader(configPath).load(overrides);

        try {
            Tree.Node tree = new TreeReaderService(config).readTree(listing);
            write(render(tree, config.getOutputFormat()), out);
        } catch (TreeReaderException | IOException | IllegalArgumentException e) {
            // IllegalArgumentException covers unknown charsets and rejected scanner settings
            err.println("Error: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private static String render(Tree.Node tree, OutputFormat format) throws IOException {
        switch (format) {
            case JSON:
                return TreeUtils.toJson(tree);
            case OUTLINE:
                return TreeUtils.toOutline(tree);
            default:
                return null;
        }
    }

    private void write(String rendering, PrintWriter out) throws IOException {
        if (rendering == null) {
            return;
        }
        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), rendering, StandardCharsets.UTF_8);
        } else {
            out.print(rendering);
            if (!rendering.endsWith("\n")) {
                out.println();
            }
            out.flush();
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreeReaderCLI()).execute(args);
        System.exit(exitCode);
    }
}
