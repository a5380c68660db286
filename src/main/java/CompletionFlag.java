import net.jcip.annotations.ThreadSafe;

/**
 * One-shot flag with a single writer. Readers either poll {@link #isSet()} or await {@link #changed()},
 * which is notified once, on the false to true transition.
 */
@ThreadSafe
public class CompletionFlag {
    private final SimEvent changed;
    private volatile boolean set;

    public CompletionFlag(Simulation sim, String name) {
        this.changed = sim.newEvent(name + ".changed");
    }

    /**
     * flips the flag. Later calls do nothing.
     */
    public void set() {
        if (set) {
            return;
        }
        set = true;
        changed.notifyWaiters();
    }

    public boolean isSet() {
        return set;
    }

    public SimEvent changed() {
        return changed;
    }
}
