/**
 * Producing side of a bounded queue.
 */
public interface WriteChannel<V> {
    /**
     * puts an element to back of the queue or blocks caller while the queue is full.
     */
    void put(V v) throws InterruptedException;

    boolean isFull();

    /**
     * empties the queue. Only valid while no put or take is in flight and nobody is blocked on the queue.
     */
    void reset();
}
