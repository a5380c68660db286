import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Usage: {@code Main [queueCapacity]}, further parameters via {@code -Dpipeline.*} properties.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws InterruptedException {
        final PipelineConfig config = PipelineConfig.fromArgs(args, System.getProperties());
        log.info("queue capacity: {}", config.getCapacity());

        final PipelineReport report = new Pipeline(config).run();

        final QueueStats stats = report.getStats();
        log.info("");
        log.info("queue capacity is: {}", stats.getCapacity());
        log.info("Average queue fill depth: {}", stats.getAverageFillDepth());
        log.info("Average transfer time per item: {}", SimTime.format(stats.getAverageElapsedPerItemNanos()));
        log.info("Total items transferred: {}", stats.getTotalTransferred());
        log.info("Total time: {}", SimTime.format(stats.getTotalElapsedNanos()));
    }
}
