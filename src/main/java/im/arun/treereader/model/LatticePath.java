package im.arun.treereader.model;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A persistent lattice path of rises and falls, grown by prepending.
 * <p>
 * Paths produced while reading a listing are in reversed preorder: the step
 * discovered first sits at the tail. Reading such a path forward therefore
 * means reading it tail to head.
 */
public final class LatticePath implements Iterable<LatticePath> {

    public enum Step {
        RISE, FALL
    }

    private static final LatticePath EMPTY = new LatticePath(null, null, null);

    private final Step step;
    private final Payload payload;
    private final LatticePath rest;
    private final int length;
    private final int riseCount;

    private LatticePath(Step step, Payload payload, LatticePath rest) {
        this.step = step;
        this.payload = payload;
        this.rest = rest;
        this.length = rest == null ? 0 : rest.length + 1;
        this.riseCount = rest == null ? 0 : rest.riseCount + (step == Step.RISE ? 1 : 0);
    }

    public static LatticePath empty() {
        return EMPTY;
    }

    public LatticePath rise(Payload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("A rise must carry a payload");
        }
        return new LatticePath(Step.RISE, payload, this);
    }

    public LatticePath fall() {
        return new LatticePath(Step.FALL, null, this);
    }

    /**
     * Prepends {@code count} falls onto this path.
     */
    public LatticePath padFalls(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Cannot pad a negative number of falls: " + count);
        }
        LatticePath path = this;
        for (int i = 0; i < count; i++) {
            path = path.fall();
        }
        return path;
    }

    public boolean isEmpty() {
        return step == null;
    }

    public boolean isRise() {
        return step == Step.RISE;
    }

    public boolean isFall() {
        return step == Step.FALL;
    }

    public Step getStep() {
        return step;
    }

    /**
     * Payload of a rise, {@code null} for a fall or the empty path.
     */
    public Payload getPayload() {
        return payload;
    }

    public LatticePath getRest() {
        if (isEmpty()) {
            throw new NoSuchElementException("The empty path has no rest");
        }
        return rest;
    }

    public int length() {
        return length;
    }

    public int riseCount() {
        return riseCount;
    }

    public int fallCount() {
        return length - riseCount;
    }

    /**
     * Whether the forward reading of this path never drops below its start
     * level and ends on it. Checked on the reversed form: walking from the head,
     * falls must always be at least as many as rises.
     */
    public boolean isDyck() {
        int level = 0;
        for (LatticePath cell : this) {
            level += cell.isFall() ? 1 : -1;
            if (level < 0) {
                return false;
            }
        }
        return level == 0;
    }

    /**
     * Forward reading as a word over {@code U} (rise) and {@code D} (fall).
     */
    public String toForwardString() {
        StringBuilder word = new StringBuilder(length);
        for (LatticePath cell : this) {
            word.append(cell.isRise() ? 'U' : 'D');
        }
        return word.reverse().toString();
    }

    /**
     * Iterates over the non-empty cells of this path, head first.
     */
    @Override
    public Iterator<LatticePath> iterator() {
        return new Iterator<>() {
            private LatticePath cursor = LatticePath.this;

            @Override
            public boolean hasNext() {
                return !cursor.isEmpty();
            }

            @Override
            public LatticePath next() {
                if (cursor.isEmpty()) {
                    throw new NoSuchElementException();
                }
                LatticePath current = cursor;
                cursor = cursor.rest;
                return current;
            }
        };
    }

    @Override
    public String toString() {
        return "LatticePath[" + toForwardString() + "]";
    }
}
