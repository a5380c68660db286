import net.jcip.annotations.Immutable;

/**
 * Occupancy and transfer statistics of a {@link BoundedQueue}, captured once the run is over.
 * Averages over zero transfers are reported as 0.
 */
@Immutable
public final class QueueStats {
    private final int capacity;
    private final long totalTransferred;
    private final long occupancySum;
    private final int maxFillDepth;
    private final long totalElapsedNanos;

    public QueueStats(int capacity, long totalTransferred, long occupancySum, int maxFillDepth,
                      long totalElapsedNanos) {
        this.capacity = capacity;
        this.totalTransferred = totalTransferred;
        this.occupancySum = occupancySum;
        this.maxFillDepth = maxFillDepth;
        this.totalElapsedNanos = totalElapsedNanos;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * mean of the occupancies seen by each take just before it removed its element.
     */
    public double getAverageFillDepth() {
        if (totalTransferred == 0) {
            return 0.0;
        }
        return (double) occupancySum / totalTransferred;
    }

    public int getMaxFillDepth() {
        return maxFillDepth;
    }

    public long getTotalTransferred() {
        return totalTransferred;
    }

    /**
     * simulated time of the last take.
     */
    public long getTotalElapsedNanos() {
        return totalElapsedNanos;
    }

    public double getAverageElapsedPerItemNanos() {
        if (totalTransferred == 0) {
            return 0.0;
        }
        return (double) totalElapsedNanos / totalTransferred;
    }

    @Override
    public String toString() {
        return String.format(
                "QueueStats[capacity=%d, avgFill=%.3f, maxFill=%d, transferred=%d, elapsed=%s, perItem=%s]",
                capacity, getAverageFillDepth(), maxFillDepth, totalTransferred,
                SimTime.format(totalElapsedNanos), SimTime.format(getAverageElapsedPerItemNanos()));
    }
}
