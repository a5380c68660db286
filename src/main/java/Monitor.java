import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * Detects drain: first waits for the producer's completion flag, then polls the queue until it is seen
 * empty and reports the simulated time of that observation once.
 * <p>
 * Emptiness is polled, not awaited, so a queue that refills and empties again between two polls goes
 * unnoticed. Drain is only ever reported at a poll instant where the queue really was empty.
 */
public class Monitor implements SimProcess {
    private static final Logger log = LoggerFactory.getLogger(Monitor.class);

    public enum Phase {
        WAIT_PRODUCER,
        WAIT_DRAIN,
        DONE
    }

    private final CompletionFlag producerDone;
    private final OccupancyView queue;
    private final long pollIntervalNanos;
    private final boolean stopOnDrain;

    private volatile Phase phase = Phase.WAIT_PRODUCER;
    private volatile long drainTime = -1;

    /**
     * @param stopOnDrain whether to stop the whole simulation once drain is confirmed
     */
    public Monitor(CompletionFlag producerDone, OccupancyView queue, long pollIntervalNanos, boolean stopOnDrain) {
        if (pollIntervalNanos <= 0) {
            throw new IllegalArgumentException("poll interval must be positive: " + pollIntervalNanos);
        }
        this.producerDone = producerDone;
        this.queue = queue;
        this.pollIntervalNanos = pollIntervalNanos;
        this.stopOnDrain = stopOnDrain;
    }

    @Override
    public void run(Simulation sim) throws InterruptedException {
        while (!producerDone.isSet()) {
            producerDone.changed().await();
        }
        phase = Phase.WAIT_DRAIN;
        while (!queue.isEmpty()) {
            sim.delay(pollIntervalNanos);
        }
        drainTime = sim.now();
        phase = Phase.DONE;
        log.info("Monitor: producer done and queue empty at {}", SimTime.format(drainTime));
        if (stopOnDrain) {
            sim.stop();
        }
    }

    public Phase phase() {
        return phase;
    }

    /**
     * simulated time drain was confirmed at, empty until the monitor is {@link Phase#DONE}.
     */
    public OptionalLong drainTime() {
        final long t = drainTime;
        return t < 0 ? OptionalLong.empty() : OptionalLong.of(t);
    }
}
