/**
 * Bounded FIFO queue for simulation processes. Producer and consumer block on two separate kernel events
 * so that a put only wakes takers and a take only wakes putters.
 * <p>
 * Not synchronized on its own: all mutation happens inside simulation processes, which the
 * {@link Simulation} runs one at a time under its lock. {@link #finalizeStats()} is meant to be called
 * after {@link Simulation#run()} has returned.
 * <p>
 * Every take records the occupancy it observed <em>before</em> removing its element, so the average fill
 * depth is the depth seen by the consumer, not the depth left behind.
 */
public class BoundedQueue<V> extends BaseBoundedBuffer<V> implements WriteChannel<V>, ReadChannel<V> {
    private final Simulation sim;
    private final SimEvent notFull;
    private final SimEvent notEmpty;

    private long takesCompleted;
    private long occupancySum;
    private int maxOccupancySeen;
    private long elapsedAtLastTake;

    public BoundedQueue(Simulation sim, String name, int capacity) {
        super(capacity);
        this.sim = sim;
        this.notFull = sim.newEvent(name + ".notFull");
        this.notEmpty = sim.newEvent(name + ".notEmpty");
    }

    @Override
    public void put(V v) throws InterruptedException {
        //re-check after every wakeup: the event may have been notified for a state that no longer holds
        while (isFull()) {
            notFull.await();
        }
        doPut(v);
        notEmpty.notifyWaiters();
    }

    @Override
    public V take() throws InterruptedException {
        while (isEmpty()) {
            notEmpty.await();
        }
        recordOccupancy();
        final V v = doTake();
        notFull.notifyWaiters();
        return v;
    }

    /**
     * Precondition: no put or take in flight and no process blocked on this queue. Not checked.
     */
    @Override
    public void reset() {
        clear();
    }

    public QueueStats finalizeStats() {
        return new QueueStats(capacity(), takesCompleted, occupancySum, maxOccupancySeen, elapsedAtLastTake);
    }

    private void recordOccupancy() {
        final int count = size();
        occupancySum += count;
        if (count > maxOccupancySeen) {
            maxOccupancySeen = count;
        }
        takesCompleted++;
        elapsedAtLastTake = sim.now();
    }
}
