import java.util.Locale;

/**
 * Formatting of simulated time values, which are plain nanosecond counts.
 */
public final class SimTime {
    private SimTime() {
    }

    public static String format(long nanos) {
        return nanos + " ns";
    }

    public static String format(double nanos) {
        return String.format(Locale.ROOT, "%.3f ns", nanos);
    }
}
