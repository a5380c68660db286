/**
 * Thrown from {@link Simulation#run()} when a process failed with anything but interruption.
 */
public class SimulationException extends RuntimeException {
    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
