import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Puts a fixed quota of values in bursts. Each burst has a length drawn uniformly from
 * {@code [1, burstRangeMax]} (capped at what is left of the quota) and carries the values 1, 2, 3...
 * - the counter restarts with every burst. Bursts are separated by a fixed pacing delay.
 * Once the quota is exhausted the completion flag is set and the process ends.
 */
public class Producer implements SimProcess {
    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final WriteChannel<Integer> out;
    private final CompletionFlag done;
    private final Random random;
    private final int totalQuota;
    private final int burstRangeMax;
    private final long pacingDelayNanos;

    private int remainingQuota;
    private int produced;

    public Producer(WriteChannel<Integer> out, CompletionFlag done, Random random,
                    int totalQuota, int burstRangeMax, long pacingDelayNanos) {
        if (totalQuota <= 0) {
            throw new IllegalArgumentException("quota must be positive: " + totalQuota);
        }
        if (burstRangeMax <= 0) {
            throw new IllegalArgumentException("burst range must be positive: " + burstRangeMax);
        }
        if (pacingDelayNanos < 0) {
            throw new IllegalArgumentException("pacing delay must not be negative: " + pacingDelayNanos);
        }
        this.out = out;
        this.done = done;
        this.random = random;
        this.totalQuota = totalQuota;
        this.burstRangeMax = burstRangeMax;
        this.pacingDelayNanos = pacingDelayNanos;
        this.remainingQuota = totalQuota;
    }

    @Override
    public void run(Simulation sim) throws InterruptedException {
        while (true) {
            final int burst = Math.min(1 + random.nextInt(burstRangeMax), remainingQuota);
            log.debug("Burst of {} at {} ns", burst, sim.now());
            int value = 0;
            for (int i = 0; i < burst; i++) {
                out.put(++value);
                produced++;
                remainingQuota--;
            }
            if (remainingQuota <= 0) {
                log.debug("Quota of {} produced at {} ns", totalQuota, sim.now());
                done.set();
                return;
            }
            sim.delay(pacingDelayNanos);
        }
    }

    public int remainingQuota() {
        return remainingQuota;
    }

    public int produced() {
        return produced;
    }

    public boolean isDone() {
        return done.isSet();
    }
}
