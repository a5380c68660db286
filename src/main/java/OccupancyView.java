/**
 * Read-only view of a queue's occupancy. Neither method blocks or changes anything.
 */
public interface OccupancyView {
    boolean isEmpty();

    int size();
}
