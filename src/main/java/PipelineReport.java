import net.jcip.annotations.Immutable;

import java.util.OptionalLong;

/**
 * Outcome of a {@link Pipeline} run.
 */
@Immutable
public final class PipelineReport {
    private final QueueStats stats;
    private final OptionalLong drainTime;
    private final int produced;
    private final long consumed;
    private final long endTime;

    public PipelineReport(QueueStats stats, OptionalLong drainTime, int produced, long consumed, long endTime) {
        this.stats = stats;
        this.drainTime = drainTime;
        this.produced = produced;
        this.consumed = consumed;
        this.endTime = endTime;
    }

    public QueueStats getStats() {
        return stats;
    }

    /**
     * empty if the monitor never confirmed drain.
     */
    public OptionalLong getDrainTime() {
        return drainTime;
    }

    public int getProduced() {
        return produced;
    }

    public long getConsumed() {
        return consumed;
    }

    /**
     * simulated time at which the simulation ended.
     */
    public long getEndTime() {
        return endTime;
    }
}
