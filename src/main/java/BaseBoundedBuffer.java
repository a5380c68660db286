import net.jcip.annotations.NotThreadSafe;

import java.util.Arrays;

/**
 * Ring buffer with finite capacity: storage, head, tail and count bookkeeping only.
 * Blocking and signalling are left to subclasses, which must also serialize all calls -
 * nothing here is synchronized.
 */
@NotThreadSafe
public abstract class BaseBoundedBuffer<V> {
    private final V[] buf;
    private int head;
    private int tail;
    private int count;

    protected BaseBoundedBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        buf = (V[]) new Object[capacity];
    }

    /**
     * INVARIANT: buffer must be not full
     */
    protected void doPut(V v) {
        buf[tail++] = v;
        if (tail == buf.length) {
            tail = 0;
        }
        count++;
    }

    /**
     * INVARIANT: buffer must be not empty
     */
    protected V doTake() {
        final V v = buf[head];
        buf[head++] = null;
        if (head == buf.length) {
            head = 0;
        }
        count--;
        return v;
    }

    protected void clear() {
        Arrays.fill(buf, null);
        head = 0;
        tail = 0;
        count = 0;
    }

    public int capacity() {
        return buf.length;
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public boolean isFull() {
        return count == buf.length;
    }
}
