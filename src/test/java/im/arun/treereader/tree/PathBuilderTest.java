package im.arun.treereader.tree;

import im.arun.treereader.model.LatticePath;
import im.arun.treereader.model.Payload;
import im.arun.treereader.scan.NodeEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathBuilderTest {

    private static void feed(PathBuilder builder, String names, int... columns) {
        for (int i = 0; i < columns.length; i++) {
            builder.accept(new NodeEvent(i + 1, columns[i], Payload.of(names.substring(i, i + 1))));
        }
    }

    @Test
    void pathOfBranchListing() {
        PathBuilder builder = new PathBuilder();
        feed(builder, "abcdefg", 0, 3, 3, 3, 6, 9, 6);
        LatticePath path = builder.finish();

        assertEquals("UUDUDUUUDDUDDD", path.toForwardString());
        assertEquals(14, path.length());
        assertEquals(7, builder.getNodeCount());
        assertTrue(path.isDyck());
    }

    @Test
    void firstDiscoveredRiseIsAtTheTail() {
        PathBuilder builder = new PathBuilder();
        feed(builder, "ab", 0, 2);
        LatticePath path = builder.finish();

        LatticePath last = path;
        while (!last.getRest().isEmpty()) {
            last = last.getRest();
        }
        assertEquals("a", last.getPayload().getName());
        assertTrue(path.isFall());
    }

    @Test
    void singleNode() {
        PathBuilder builder = new PathBuilder();
        feed(builder, "a", 0);
        assertEquals("UD", builder.finish().toForwardString());
    }

    @Test
    void noEventsGiveEmptyPath() {
        assertTrue(new PathBuilder().finish().isEmpty());
    }

    @Test
    void finishIsFinal() {
        PathBuilder builder = new PathBuilder();
        feed(builder, "a", 0);
        builder.finish();

        assertThrows(IllegalStateException.class, builder::finish);
        assertThrows(IllegalStateException.class,
            () -> builder.accept(new NodeEvent(2, 0, Payload.of("b"))));
    }
}
