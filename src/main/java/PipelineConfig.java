import net.jcip.annotations.Immutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Properties;

/**
 * Parameters of one pipeline run. The queue capacity comes from the command line, everything else may be
 * overridden through {@code pipeline.*} properties. Bad input never fails the run: the capacity is clamped
 * or defaulted, bad overrides are ignored.
 */
@Immutable
public final class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final int DEFAULT_CAPACITY = 10;
    public static final int MIN_CAPACITY = 1;
    public static final int MAX_CAPACITY = 100_000;
    /**
     * upper bound for each of the delays, 1000 s of simulated time. Keeps a full run far from clock overflow.
     */
    public static final long MAX_DELAY_NANOS = 1_000_000_000_000L;

    private final int capacity;
    private final int quota;
    private final int burstRangeMax;
    private final long pacingDelayNanos;
    private final long serviceDelayNanos;
    private final long pollIntervalNanos;
    private final long seed;
    private final boolean stopOnDrain;

    private PipelineConfig(Builder b) {
        this.capacity = b.capacity;
        this.quota = b.quota;
        this.burstRangeMax = b.burstRangeMax;
        this.pacingDelayNanos = b.pacingDelayNanos;
        this.serviceDelayNanos = b.serviceDelayNanos;
        this.pollIntervalNanos = b.pollIntervalNanos;
        this.seed = b.seed;
        this.stopOnDrain = b.stopOnDrain;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param args  command line, the optional first argument is the queue capacity
     * @param props overrides, e.g. {@link System#getProperties()}
     */
    public static PipelineConfig fromArgs(String[] args, Properties props) {
        final Builder b = builder();
        if (args != null && args.length > 0) {
            b.capacity(clampCapacity(args[0]));
        }
        b.quota(intProperty(props, "pipeline.quota", b.quota));
        b.burstRangeMax(intProperty(props, "pipeline.burstMax", b.burstRangeMax));
        b.pacingDelayNanos(longProperty(props, "pipeline.pacingNs", b.pacingDelayNanos, 0, MAX_DELAY_NANOS));
        b.serviceDelayNanos(longProperty(props, "pipeline.serviceNs", b.serviceDelayNanos, 0, MAX_DELAY_NANOS));
        b.pollIntervalNanos(longProperty(props, "pipeline.pollNs", b.pollIntervalNanos, 1, MAX_DELAY_NANOS));
        b.seed(longProperty(props, "pipeline.seed", b.seed, Long.MIN_VALUE, Long.MAX_VALUE));
        final String stop = props.getProperty("pipeline.stopOnDrain");
        if (stop != null) {
            b.stopOnDrain(Boolean.parseBoolean(stop.trim()));
        }
        return b.build();
    }

    /**
     * decimal capacity clamped to [{@value #MIN_CAPACITY}, {@value #MAX_CAPACITY}];
     * missing or non-numeric input gives {@value #DEFAULT_CAPACITY}.
     */
    public static int clampCapacity(String arg) {
        if (arg == null) {
            return DEFAULT_CAPACITY;
        }
        final BigInteger value;
        try {
            value = new BigInteger(arg.trim());
        } catch (NumberFormatException e) {
            log.debug("Capacity '{}' is not a number, using {}", arg, DEFAULT_CAPACITY);
            return DEFAULT_CAPACITY;
        }
        if (value.compareTo(BigInteger.valueOf(MIN_CAPACITY)) < 0) {
            return MIN_CAPACITY;
        }
        if (value.compareTo(BigInteger.valueOf(MAX_CAPACITY)) > 0) {
            return MAX_CAPACITY;
        }
        return value.intValue();
    }

    private static int intProperty(Properties props, String key, int def) {
        return (int) longProperty(props, key, def, 1, Integer.MAX_VALUE);
    }

    private static long longProperty(Properties props, String key, long def, long min, long max) {
        final String raw = props.getProperty(key);
        if (raw == null) {
            return def;
        }
        try {
            final long v = Long.parseLong(raw.trim());
            if (v < min || v > max) {
                log.warn("Ignoring {}={}: outside [{}, {}], keeping {}", key, raw, min, max, def);
                return def;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number, keeping {}", key, raw, def);
            return def;
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int getQuota() {
        return quota;
    }

    public int getBurstRangeMax() {
        return burstRangeMax;
    }

    public long getPacingDelayNanos() {
        return pacingDelayNanos;
    }

    public long getServiceDelayNanos() {
        return serviceDelayNanos;
    }

    public long getPollIntervalNanos() {
        return pollIntervalNanos;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isStopOnDrain() {
        return stopOnDrain;
    }

    @Override
    public String toString() {
        return "PipelineConfig[capacity=" + capacity + ", quota=" + quota + ", burstRangeMax=" + burstRangeMax
                + ", pacing=" + pacingDelayNanos + "ns, service=" + serviceDelayNanos + "ns, poll="
                + pollIntervalNanos + "ns, seed=" + seed + ", stopOnDrain=" + stopOnDrain + "]";
    }

    public static final class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private int quota = 10_000;
        private int burstRangeMax = 19;
        private long pacingDelayNanos = 1_000;
        private long serviceDelayNanos = 100;
        private long pollIntervalNanos = 100;
        private long seed = 0;
        private boolean stopOnDrain = false;

        private Builder() {
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder quota(int quota) {
            this.quota = quota;
            return this;
        }

        public Builder burstRangeMax(int burstRangeMax) {
            this.burstRangeMax = burstRangeMax;
            return this;
        }

        public Builder pacingDelayNanos(long pacingDelayNanos) {
            this.pacingDelayNanos = pacingDelayNanos;
            return this;
        }

        public Builder serviceDelayNanos(long serviceDelayNanos) {
            this.serviceDelayNanos = serviceDelayNanos;
            return this;
        }

        public Builder pollIntervalNanos(long pollIntervalNanos) {
            this.pollIntervalNanos = pollIntervalNanos;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder stopOnDrain(boolean stopOnDrain) {
            this.stopOnDrain = stopOnDrain;
            return this;
        }

        public PipelineConfig build() {
            if (capacity < MIN_CAPACITY || capacity > MAX_CAPACITY) {
                throw new IllegalArgumentException("capacity outside [" + MIN_CAPACITY + ", " + MAX_CAPACITY
                        + "]: " + capacity);
            }
            if (quota <= 0) {
                throw new IllegalArgumentException("quota must be positive: " + quota);
            }
            if (burstRangeMax <= 0) {
                throw new IllegalArgumentException("burst range must be positive: " + burstRangeMax);
            }
            checkDelay("pacing delay", pacingDelayNanos, 0);
            checkDelay("service delay", serviceDelayNanos, 0);
            checkDelay("poll interval", pollIntervalNanos, 1);
            return new PipelineConfig(this);
        }

        private static void checkDelay(String what, long nanos, long min) {
            if (nanos < min || nanos > MAX_DELAY_NANOS) {
                throw new IllegalArgumentException(what + " outside [" + min + ", " + MAX_DELAY_NANOS + "] ns: "
                        + nanos);
            }
        }
    }
}
