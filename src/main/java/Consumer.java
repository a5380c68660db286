/**
 * Takes one value, then pauses for the service delay, forever. It never stops on its own: the simulation
 * interrupts it at teardown while it is blocked or pausing.
 */
public class Consumer<V> implements SimProcess {
    private final ReadChannel<V> in;
    private final long serviceDelayNanos;
    private final java.util.function.Consumer<? super V> observer;

    private long consumed;

    public Consumer(ReadChannel<V> in, long serviceDelayNanos) {
        this(in, serviceDelayNanos, v -> { });
    }

    /**
     * @param observer sees every taken value, in take order
     */
    public Consumer(ReadChannel<V> in, long serviceDelayNanos, java.util.function.Consumer<? super V> observer) {
        if (serviceDelayNanos < 0) {
            throw new IllegalArgumentException("service delay must not be negative: " + serviceDelayNanos);
        }
        this.in = in;
        this.serviceDelayNanos = serviceDelayNanos;
        this.observer = observer;
    }

    @Override
    public void run(Simulation sim) throws InterruptedException {
        while (true) {
            final V v = in.take();
            consumed++;
            observer.accept(v);
            sim.delay(serviceDelayNanos);
        }
    }

    public long consumed() {
        return consumed;
    }
}
