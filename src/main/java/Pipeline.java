import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Wires producer, queue, consumer and monitor into a fresh simulation and runs it to the end.
 * Statistics are finalized only after every process has stopped.
 */
public class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineConfig config;

    public Pipeline(PipelineConfig config) {
        this.config = config;
    }

    public PipelineReport run() throws InterruptedException {
        log.debug("Running {}", config);
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> queue = new BoundedQueue<>(sim, "queue", config.getCapacity());
        final CompletionFlag producerDone = new CompletionFlag(sim, "producerDone");
        final Producer producer = new Producer(queue, producerDone, new Random(config.getSeed()),
                config.getQuota(), config.getBurstRangeMax(), config.getPacingDelayNanos());
        final Consumer<Integer> consumer = new Consumer<>(queue, config.getServiceDelayNanos());
        final Monitor monitor = new Monitor(producerDone, queue, config.getPollIntervalNanos(),
                config.isStopOnDrain());

        sim.spawn("producer", producer);
        sim.spawn("consumer", consumer);
        sim.spawn("monitor", monitor);
        sim.run();

        return new PipelineReport(queue.finalizeStats(), monitor.drainTime(), producer.produced(),
                consumer.consumed(), sim.now());
    }
}
