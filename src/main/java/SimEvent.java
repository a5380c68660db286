import java.util.ArrayList;
import java.util.List;

/**
 * Condition of the simulation kernel. A process awaiting it is suspended until another process
 * notifies it. Events carry no memory: a notification nobody waits for is lost, so callers
 * re-check their state in a loop around {@link #await()}, same as with a condition variable.
 */
public final class SimEvent {
    private final Simulation sim;
    private final String name;
    //guarded by the simulation lock
    final List<Simulation.Proc> waiters = new ArrayList<>();

    SimEvent(Simulation sim, String name) {
        this.sim = sim;
        this.name = name;
    }

    /**
     * suspends the calling process until the next {@link #notifyWaiters()}.
     */
    public void await() throws InterruptedException {
        sim.await(this);
    }

    /**
     * makes every process currently awaiting this event runnable at the current time. They run
     * after the notifying process reaches its next suspension point.
     */
    public void notifyWaiters() {
        sim.notifyWaiters(this);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "SimEvent[" + name + "]";
    }
}
