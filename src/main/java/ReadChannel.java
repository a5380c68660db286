/**
 * Consuming side of a bounded queue.
 */
public interface ReadChannel<V> extends OccupancyView {
    /**
     * takes an element from the head of the queue or blocks caller while the queue is empty.
     */
    V take() throws InterruptedException;
}
