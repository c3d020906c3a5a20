package im.arun.treereader.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An unranked, ordered tree rebuilt from a node listing.
 * <p>
 * {@link Empty} only marks "no further sibling" while a tree is being rebuilt;
 * it never appears among the children of a {@link Node}.
 * <p>
 * {@link #size()} and {@link #height()} walk the tree without recursion. The
 * structural {@code equals}, {@code hashCode} and {@code toString} of a
 * {@link Node} do recurse, so they are only safe on trees a few thousand levels
 * deep; compare very deep trees by walking them instead.
 */
public abstract class Tree {

    Tree() {
    }

    public static Tree empty() {
        return Empty.INSTANCE;
    }

    public static Node node(Payload payload, List<Node> children) {
        return new Node(payload, List.copyOf(children));
    }

    public static Node node(Payload payload, Node... children) {
        return node(payload, Arrays.asList(children));
    }

    public static Node leaf(String name) {
        return new Node(Payload.of(name), List.of());
    }

    @JsonIgnore
    public abstract boolean isEmpty();

    /**
     * Number of nodes in this tree.
     */
    public int size() {
        if (isEmpty()) {
            return 0;
        }
        int count = 0;
        Deque<Node> pending = new ArrayDeque<>();
        pending.push((Node) this);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            count++;
            node.getChildren().forEach(pending::push);
        }
        return count;
    }

    /**
     * Number of levels; a single leaf has height 1, the empty tree 0.
     */
    public int height() {
        if (isEmpty()) {
            return 0;
        }
        int height = 0;
        List<Node> level = List.of((Node) this);
        while (!level.isEmpty()) {
            height++;
            level = level.stream()
                .flatMap(node -> node.getChildren().stream())
                .collect(Collectors.toList());
        }
        return height;
    }

    public static final class Empty extends Tree {
        private static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    @Value
    @AllArgsConstructor(access = AccessLevel.PACKAGE)
    @EqualsAndHashCode(callSuper = false)
    @JsonPropertyOrder({"name", "attribute", "children"})
    public static class Node extends Tree {

        @JsonUnwrapped
        Payload payload;

        @JsonProperty("children")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<Node> children;

        @JsonIgnore
        public String getName() {
            return payload.getName();
        }

        @Override
        @JsonIgnore
        public boolean isEmpty() {
            return false;
        }
    }
}
