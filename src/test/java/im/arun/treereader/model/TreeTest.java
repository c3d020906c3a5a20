package im.arun.treereader.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.treereader.util.TreeUtils;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeTest {

    @Test
    void emptyTree() {
        Tree empty = Tree.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertEquals(0, empty.height());
    }

    @Test
    void sizeAndHeight() {
        Tree.Node tree = Tree.node(Payload.of("a"),
            Tree.leaf("b"),
            Tree.node(Payload.of("c"), Tree.node(Payload.of("d"), Tree.leaf("e"))));

        assertFalse(tree.isEmpty());
        assertEquals(5, tree.size());
        assertEquals(4, tree.height());
        assertEquals(1, Tree.leaf("x").height());
    }

    @Test
    void childrenAreCopiedAndImmutable() {
        List<Tree.Node> children = new ArrayList<>();
        children.add(Tree.leaf("b"));
        Tree.Node tree = Tree.node(Payload.of("a"), children);
        children.add(Tree.leaf("c"));

        assertEquals(1, tree.getChildren().size());
        assertThrows(UnsupportedOperationException.class, () -> tree.getChildren().add(Tree.leaf("d")));
    }

    @Test
    void structuralEquality() {
        Tree.Node left = Tree.node(new Payload("a", " x"), Tree.leaf("b"));
        Tree.Node right = Tree.node(new Payload("a", " x"), Tree.leaf("b"));
        Tree.Node other = Tree.node(new Payload("a", " y"), Tree.leaf("b"));

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertFalse(left.equals(other));
    }

    @Test
    void databindShapeMatchesStreamedJson() throws IOException {
        Tree.Node tree = Tree.node(new Payload("a", " x"),
            Tree.leaf("b"),
            Tree.node(Payload.of("c"), Tree.leaf("d")));
        ObjectMapper mapper = new ObjectMapper();

        assertEquals(mapper.readTree(TreeUtils.toJson(tree)),
            mapper.readTree(mapper.writeValueAsString(tree)));
    }
}
