package im.arun.treereader.model;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LatticePathTest {

    private static final Payload A = Payload.of("a");
    private static final Payload B = Payload.of("b");

    @Test
    void emptyPath() {
        LatticePath empty = LatticePath.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.length());
        assertEquals("", empty.toForwardString());
        assertTrue(empty.isDyck());
        assertThrows(NoSuchElementException.class, empty::getRest);
    }

    @Test
    void stepsArePrependedAndShared() {
        LatticePath base = LatticePath.empty().rise(A);
        LatticePath extended = base.fall();

        assertTrue(extended.isFall());
        assertNull(extended.getPayload());
        assertSame(base, extended.getRest());
        assertEquals(A, base.getPayload());
        assertEquals(1, base.length());
        assertEquals(2, extended.length());
    }

    @Test
    void forwardReadingIsTailToHead() {
        LatticePath path = LatticePath.empty().rise(A).rise(B).fall().fall();
        assertEquals("UUDD", path.toForwardString());
        assertEquals(2, path.riseCount());
        assertEquals(2, path.fallCount());
    }

    @Test
    void padFalls() {
        LatticePath path = LatticePath.empty().rise(A).padFalls(3);
        assertEquals("UDDD", path.toForwardString());
        assertSame(path, path.padFalls(0));
        assertThrows(IllegalArgumentException.class, () -> path.padFalls(-1));
    }

    @Test
    void dyckProperty() {
        assertTrue(LatticePath.empty().rise(A).fall().isDyck());
        assertTrue(LatticePath.empty().rise(A).fall().rise(B).fall().isDyck());
        assertFalse(LatticePath.empty().rise(A).isDyck());
        assertFalse(LatticePath.empty().fall().rise(A).isDyck());
        assertFalse(LatticePath.empty().rise(A).fall().fall().isDyck());
    }

    @Test
    void riseNeedsPayload() {
        assertThrows(IllegalArgumentException.class, () -> LatticePath.empty().rise(null));
    }

    @Test
    void iteratesHeadFirst() {
        LatticePath path = LatticePath.empty().rise(A).rise(B).fall();
        StringBuilder steps = new StringBuilder();
        for (LatticePath cell : path) {
            steps.append(cell.getStep()).append(' ');
        }
        assertEquals("FALL RISE RISE ", steps.toString());
    }
}
