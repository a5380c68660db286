import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedQueueTest {
    private static final Logger log = LoggerFactory.getLogger(BoundedQueueTest.class);

    @Test
    public void testSumsFromProducerAndConsumerMatch() throws InterruptedException {
        final int elemsToProduce = 10_000;
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 100);
        final AtomicLong sumFromProducer = new AtomicLong();
        final AtomicLong sumFromConsumer = new AtomicLong();
        sim.spawn("producer", s -> {
            final Random rnd = new Random(0);
            for (int i = 0; i < elemsToProduce; i++) {
                final int r = rnd.nextInt();
                subj.put(r);
                sumFromProducer.addAndGet(r);
                if (i % 7 == 0) {
                    s.delay(3);
                }
            }
        });
        sim.spawn("consumer", s -> {
            for (int i = 0; i < elemsToProduce; i++) {
                sumFromConsumer.addAndGet(subj.take());
                s.delay(1);
            }
        });
        sim.run();
        log.info("Transferred {} elements, {}", elemsToProduce, subj.finalizeStats());
        assertThat(sumFromProducer.get()).isEqualTo(sumFromConsumer.get());
        assertThat(subj.finalizeStats().getTotalTransferred()).isEqualTo(elemsToProduce);
    }

    @Test
    public void testCountStaysWithinBoundsAndOrderIsFifo() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 5);
        final Deque<Integer> model = new ArrayDeque<>();
        final List<Integer> sizes = new ArrayList<>();
        sim.spawn("driver", s -> {
            final Random rnd = new Random(42);
            int next = 0;
            for (int op = 0; op < 5_000; op++) {
                //only non-blocking operations: a single process has no counterpart to wake it
                final boolean put = subj.isEmpty() || (!subj.isFull() && rnd.nextBoolean());
                if (put) {
                    subj.put(next);
                    model.addLast(next);
                    next++;
                } else {
                    assertThat(subj.take()).isEqualTo(model.removeFirst());
                }
                sizes.add(subj.size());
                assertThat(subj.isEmpty()).isEqualTo(model.isEmpty());
                assertThat(subj.isFull()).isEqualTo(model.size() == 5);
            }
        });
        sim.run();
        assertThat(sizes).allSatisfy(size -> assertThat(size).isBetween(0, 5));
        assertThat(sizes).contains(0, 5);
    }

    @Test
    public void testFifoAcrossProcesses() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 7);
        final List<Integer> taken = new ArrayList<>();
        sim.spawn("producer", s -> {
            final Random rnd = new Random(1);
            for (int i = 0; i < 1_000; i++) {
                subj.put(i);
                s.delay(rnd.nextInt(5));
            }
        });
        sim.spawn("consumer", s -> {
            final Random rnd = new Random(2);
            for (int i = 0; i < 1_000; i++) {
                taken.add(subj.take());
                s.delay(rnd.nextInt(5));
            }
        });
        sim.run();
        final List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            expected.add(i);
        }
        assertThat(taken).isEqualTo(expected);
    }

    @Test
    public void testPutOnFullQueueWaitsForTake() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 5);
        final List<Long> putTimes = new ArrayList<>();
        final AtomicLong takeTime = new AtomicLong(-1);
        sim.spawn("producer", s -> {
            for (int i = 1; i <= 6; i++) {
                subj.put(i);
                putTimes.add(s.now());
            }
        });
        sim.spawn("consumer", s -> {
            s.delay(500);
            assertThat(subj.take()).isEqualTo(1);
            takeTime.set(s.now());
        });
        sim.run();
        assertThat(putTimes).containsExactly(0L, 0L, 0L, 0L, 0L, 500L);
        assertThat(takeTime.get()).isEqualTo(500);
        assertThat(subj.isFull()).isTrue();
    }

    @Test
    public void testTakeOnEmptyQueueWaitsForPut() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 3);
        final AtomicLong takeTime = new AtomicLong(-1);
        final List<Integer> taken = new ArrayList<>();
        sim.spawn("consumer", s -> {
            taken.add(subj.take());
            takeTime.set(s.now());
        });
        sim.spawn("producer", s -> {
            s.delay(300);
            subj.put(42);
        });
        sim.run();
        assertThat(taken).containsExactly(42);
        assertThat(takeTime.get()).isEqualTo(300);
        assertThat(subj.isEmpty()).isTrue();
    }

    @Test
    public void testSixthPutBlocksWithoutConsumer() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 5);
        final CompletionFlag done = new CompletionFlag(sim, "done");
        final Producer producer = new Producer(subj, done, FixedBursts.longest(), 19, 19, 1_000);
        sim.spawn("producer", producer);
        sim.run();
        assertThat(producer.produced()).isEqualTo(5);
        assertThat(producer.remainingQuota()).isEqualTo(14);
        assertThat(subj.size()).isEqualTo(5);
        assertThat(subj.isFull()).isTrue();
        assertThat(done.isSet()).isFalse();
    }

    @Test
    public void testCapacityOneDeliversInOrder() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 1);
        final CompletionFlag done = new CompletionFlag(sim, "done");
        final List<Integer> taken = new ArrayList<>();
        sim.spawn("producer", new Producer(subj, done, FixedBursts.longest(), 3, 3, 1_000));
        sim.spawn("consumer", new Consumer<>(subj, 100, taken::add));
        sim.run();
        assertThat(taken).containsExactly(1, 2, 3);
        assertThat(done.isSet()).isTrue();
        assertThat(subj.finalizeStats().getMaxFillDepth()).isEqualTo(1);
    }

    @Test
    public void testStatisticsUsePreRemovalOccupancy() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 4);
        sim.spawn("driver", s -> {
            subj.put(1);
            subj.put(2);
            subj.put(3);
            subj.take(); //sees 3
            subj.put(4);
            subj.take(); //sees 3
            subj.take(); //sees 2
            s.delay(10);
            subj.take(); //sees 1
        });
        sim.run();
        final QueueStats stats = subj.finalizeStats();
        assertThat(stats.getCapacity()).isEqualTo(4);
        assertThat(stats.getTotalTransferred()).isEqualTo(4);
        assertThat(stats.getAverageFillDepth()).isEqualTo(2.25);
        assertThat(stats.getMaxFillDepth()).isEqualTo(3);
        assertThat(stats.getTotalElapsedNanos()).isEqualTo(10);
        assertThat(stats.getAverageElapsedPerItemNanos()).isEqualTo(2.5);
    }

    @Test
    public void testStatisticsWithoutAnyTakeAreZero() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 8);
        sim.spawn("producer", s -> {
            subj.put(1);
            subj.put(2);
            s.delay(40);
            subj.put(3);
        });
        sim.run();
        final QueueStats stats = subj.finalizeStats();
        assertThat(stats.getTotalTransferred()).isZero();
        assertThat(stats.getAverageFillDepth()).isZero();
        assertThat(stats.getAverageElapsedPerItemNanos()).isZero();
        assertThat(stats.getMaxFillDepth()).isZero();
        assertThat(stats.getTotalElapsedNanos()).isZero();
        assertThat(stats.toString()).contains("transferred=0");
    }

    @Test
    public void testResetEmptiesQueue() throws InterruptedException {
        final Simulation sim = new Simulation();
        final BoundedQueue<Integer> subj = new BoundedQueue<>(sim, "q", 3);
        final List<Integer> taken = new ArrayList<>();
        sim.spawn("driver", s -> {
            subj.put(1);
            subj.put(2);
            subj.take();
            subj.put(3);
            subj.reset();
            assertThat(subj.size()).isZero();
            assertThat(subj.isEmpty()).isTrue();
            subj.put(9);
            subj.put(10);
            subj.put(11);
            assertThat(subj.isFull()).isTrue();
            taken.add(subj.take());
            taken.add(subj.take());
            taken.add(subj.take());
        });
        sim.run();
        assertThat(taken).containsExactly(9, 10, 11);
    }

    @Test
    public void testCapacityMustBePositive() {
        final Simulation sim = new Simulation();
        assertThatThrownBy(() -> new BoundedQueue<Integer>(sim, "q", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BoundedQueue<Integer>(sim, "q", -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
