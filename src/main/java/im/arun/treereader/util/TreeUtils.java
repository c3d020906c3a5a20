package im.arun.treereader.util;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import im.arun.treereader.model.Tree;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renderings of rebuilt trees.
 */
public class TreeUtils {

    // one tree level takes two nesting levels (object and children array)
    private static final JsonFactory jsonFactory = JsonFactory.builder()
        .streamWriteConstraints(StreamWriteConstraints.builder()
            .maxNestingDepth(Integer.MAX_VALUE)
            .build())
        .build();

    private TreeUtils() {
    }

    /**
     * Render a tree as a node listing in the layout Clang's AST dumper uses:
     * {@code |-} before every child but the last, {@code `-} before the last one,
     * two columns per level. Reading the result back yields the same tree.
     */
    public static String toOutline(Tree tree) {
        if (tree.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        Deque<Line> pending = new ArrayDeque<>();
        pending.push(new Line((Tree.Node) tree, "", "", ""));

        while (!pending.isEmpty()) {
            Line line = pending.pop();
            Tree.Node node = line.node;
            out.append(line.prefix)
                .append(line.glyph)
                .append(node.getPayload().getName())
                .append(node.getPayload().getAttribute())
                .append('\n');

            List<Tree.Node> children = node.getChildren();
            // pushed in reverse so the first child is rendered first
            for (int i = children.size() - 1; i >= 0; i--) {
                boolean last = i == children.size() - 1;
                pending.push(new Line(children.get(i),
                    line.childPrefix,
                    last ? "`-" : "|-",
                    line.childPrefix + (last ? "  " : "| ")));
            }
        }
        return out.toString();
    }

    /**
     * Pretty-printed JSON with {@code name}, {@code attribute} and {@code children}
     * per node; children lists that are empty are left out. Written with a
     * streaming generator so the depth of the tree is not bounded by the call stack.
     */
    public static String toJson(Tree tree) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = jsonFactory.createGenerator(out)) {
            generator.useDefaultPrettyPrinter();
            if (tree.isEmpty()) {
                generator.writeNull();
            } else {
                writeTree(generator, (Tree.Node) tree);
            }
        }
        return out.toString();
    }

    private static void writeTree(JsonGenerator generator, Tree.Node root) throws IOException {
        Deque<Frame> open = new ArrayDeque<>();
        open.push(startNode(generator, root));
        while (!open.isEmpty()) {
            Frame frame = open.peek();
            List<Tree.Node> children = frame.node.getChildren();
            if (frame.next < children.size()) {
                open.push(startNode(generator, children.get(frame.next++)));
            } else {
                open.pop();
                if (!children.isEmpty()) {
                    generator.writeEndArray();
                }
                generator.writeEndObject();
            }
        }
    }

    private static Frame startNode(JsonGenerator generator, Tree.Node node) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("name", node.getPayload().getName());
        generator.writeStringField("attribute", node.getPayload().getAttribute());
        if (!node.getChildren().isEmpty()) {
            generator.writeArrayFieldStart("children");
        }
        return new Frame(node);
    }

    private static final class Frame {
        private final Tree.Node node;
        private int next;

        private Frame(Tree.Node node) {
            this.node = node;
        }
    }

    private static final class Line {
        private final Tree.Node node;
        private final String prefix;
        private final String glyph;
        private final String childPrefix;

        private Line(Tree.Node node, String prefix, String glyph, String childPrefix) {
            this.node = node;
            this.prefix = prefix;
            this.glyph = glyph;
            this.childPrefix = childPrefix;
        }
    }
}
