/**
 * Body of a simulation process. It runs on its own thread but only while the {@link Simulation}
 * has scheduled it, and gives control back at every suspension point.
 */
@FunctionalInterface
public interface SimProcess {
    /**
     * @throws InterruptedException when the simulation tears the process down while it is suspended
     */
    void run(Simulation sim) throws InterruptedException;
}
