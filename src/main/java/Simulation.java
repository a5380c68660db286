import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Discrete-event kernel with a logical clock counted in nanoseconds.
 * <p>
 * Every process gets its own thread, but a process only runs while it owns the kernel lock: it is handed
 * the lock when scheduled and keeps it until it reaches a suspension point ({@link #delay(long)},
 * {@link SimEvent#await()} or the end of its body). So exactly one process runs at any instant and state
 * shared between processes is mutated only under this lock. Hand-off uses one condition per process plus
 * one for the kernel loop - nobody spins.
 * <p>
 * Scheduling: runnable processes run in FIFO order. When none is runnable the clock jumps to the earliest
 * pending wakeup and all processes due at that instant become runnable in the order they asked for it.
 * The run ends when nothing is runnable and nothing is pending, when {@link #stop()} was requested or
 * when a process failed.
 */
@ThreadSafe
public class Simulation {
    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private final ReentrantLock lock = new ReentrantLock();
    //signalled when the running process gives control back to the kernel loop
    private final Condition kernelTurn = lock.newCondition();
    @GuardedBy("lock")
    private final Deque<Proc> runnable = new ArrayDeque<>();
    @GuardedBy("lock")
    private final PriorityQueue<Wakeup> wakeups = new PriorityQueue<>();
    @GuardedBy("lock")
    private final List<Proc> procs = new ArrayList<>();
    @GuardedBy("lock")
    private Proc current;
    @GuardedBy("lock")
    private long now;
    @GuardedBy("lock")
    private long wakeupSeq;
    @GuardedBy("lock")
    private boolean started;
    @GuardedBy("lock")
    private boolean finished;
    @GuardedBy("lock")
    private boolean stopRequested;
    @GuardedBy("lock")
    private Throwable failure;

    /**
     * registers a process. Processes spawned before {@link #run()} start at time 0 in spawn order,
     * processes spawned by a running process start at the current time.
     */
    public void spawn(String name, SimProcess body) {
        lock.lock();
        try {
            if (finished) {
                throw new IllegalStateException("simulation already finished, cannot spawn " + name);
            }
            final Proc p = new Proc(name, body);
            procs.add(p);
            runnable.add(p);
            p.thread.start();
        } finally {
            lock.unlock();
        }
    }

    /**
     * runs the simulation until all activity is exhausted, {@link #stop()} is requested or a process fails.
     * Processes still alive afterwards (e.g. ones blocked forever) are interrupted and joined, also when the
     * calling thread is interrupted.
     *
     * @throws SimulationException  if a process failed
     * @throws InterruptedException if the calling thread was interrupted, after the processes were torn down
     */
    public void run() throws InterruptedException {
        InterruptedException interrupted = null;
        lock.lock();
        try {
            if (started) {
                throw new IllegalStateException("simulation already started");
            }
            started = true;
            log.debug("Simulation started with {} processes", procs.size());
            while (!stopRequested && failure == null) {
                final Proc next = nextRunnable();
                if (next == null) {
                    log.debug("No activity left at {} ns", now);
                    break;
                }
                current = next;
                next.turn.signal();
                while (current != null) {
                    kernelTurn.await();
                }
            }
        } catch (InterruptedException e) {
            log.debug("Simulation interrupted at {} ns", now);
            //a process scheduled but not yet started must not run once the kernel is gone
            current = null;
            interrupted = e;
        } finally {
            finished = true;
            lock.unlock();
        }
        try {
            tearDown();
        } catch (SimulationException e) {
            if (interrupted != null) {
                Thread.currentThread().interrupt();
            }
            throw e;
        }
        if (interrupted != null) {
            throw interrupted;
        }
    }

    /**
     * asks the kernel loop to end once the running process suspends.
     */
    public void stop() {
        lock.lock();
        try {
            log.debug("Stop requested at {} ns", now);
            stopRequested = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * current simulated time in nanoseconds.
     */
    public long now() {
        lock.lock();
        try {
            return now;
        } finally {
            lock.unlock();
        }
    }

    /**
     * suspends the calling process for {@code nanos} of simulated time.
     */
    public void delay(long nanos) throws InterruptedException {
        if (nanos < 0) {
            throw new IllegalArgumentException("delay must not be negative: " + nanos);
        }
        lock.lock();
        try {
            final Proc p = requireRunning();
            final long wakeAt;
            try {
                wakeAt = Math.addExact(now, nanos);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException(
                        "delay of " + nanos + " ns at " + now + " ns overflows the clock", e);
            }
            wakeups.add(new Wakeup(wakeAt, wakeupSeq++, p));
            suspend(p);
        } finally {
            lock.unlock();
        }
    }

    public SimEvent newEvent(String name) {
        return new SimEvent(this, name);
    }

    void await(SimEvent event) throws InterruptedException {
        lock.lock();
        try {
            final Proc p = requireRunning();
            event.waiters.add(p);
            suspend(p);
        } finally {
            lock.unlock();
        }
    }

    void notifyWaiters(SimEvent event) {
        lock.lock();
        try {
            runnable.addAll(event.waiters);
            event.waiters.clear();
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private Proc requireRunning() {
        if (current == null || current.thread != Thread.currentThread()) {
            throw new IllegalStateException("not called from the running simulation process");
        }
        return current;
    }

    /**
     * gives control back to the kernel loop and waits until it schedules {@code p} again.
     * INVARIANT: {@code p} is the running process and is already queued somewhere to be woken up.
     */
    @GuardedBy("lock")
    private void suspend(Proc p) throws InterruptedException {
        current = null;
        kernelTurn.signal();
        //await() releases the lock completely, even though the body holds it reentrantly
        while (current != p) {
            p.turn.await();
        }
    }

    @GuardedBy("lock")
    private Proc nextRunnable() {
        while (true) {
            final Proc p = runnable.poll();
            if (p != null) {
                if (!p.terminated) {
                    return p;
                }
                continue;
            }
            final Wakeup w = wakeups.poll();
            if (w == null) {
                return null;
            }
            now = w.time;
            runnable.add(w.proc);
            while (!wakeups.isEmpty() && wakeups.peek().time == now) {
                runnable.add(wakeups.poll().proc);
            }
        }
    }

    private void tearDown() throws InterruptedException {
        final List<Proc> alive = new ArrayList<>();
        final Throwable failed;
        lock.lock();
        try {
            for (Proc p : procs) {
                if (!p.terminated) {
                    alive.add(p);
                }
            }
            failed = failure;
        } finally {
            lock.unlock();
        }
        for (Proc p : alive) {
            p.thread.interrupt();
        }
        for (Proc p : alive) {
            p.thread.join();
        }
        log.debug("Simulation finished, {} processes torn down", alive.size());
        if (failed != null) {
            throw new SimulationException("simulation process failed", failed);
        }
    }

    private void runProcess(Proc p) {
        lock.lock();
        try {
            while (current != p) {
                p.turn.await();
            }
            log.debug("Process {} started at {} ns", p.name, now);
            p.body.run(this);
            log.debug("Process {} finished at {} ns", p.name, now);
        } catch (InterruptedException e) {
            log.debug("Process {} torn down at {} ns", p.name, now);
        } catch (RuntimeException | Error e) {
            log.error("Process {} failed at {} ns", p.name, now, e);
            if (failure == null) {
                failure = e;
            }
        } finally {
            p.terminated = true;
            if (current == p) {
                current = null;
                kernelTurn.signal();
            }
            lock.unlock();
        }
    }

    final class Proc {
        private final String name;
        private final SimProcess body;
        private final Condition turn = lock.newCondition();
        private final Thread thread;
        @GuardedBy("lock")
        private boolean terminated;

        Proc(String name, SimProcess body) {
            this.name = name;
            this.body = body;
            this.thread = new Thread(() -> runProcess(this), "sim-" + name);
            this.thread.setDaemon(true);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class Wakeup implements Comparable<Wakeup> {
        private final long time;
        private final long seq;
        private final Proc proc;

        Wakeup(long time, long seq, Proc proc) {
            this.time = time;
            this.seq = seq;
            this.proc = proc;
        }

        @Override
        public int compareTo(Wakeup o) {
            final int byTime = Long.compare(time, o.time);
            return byTime != 0 ? byTime : Long.compare(seq, o.seq);
        }
    }
}
