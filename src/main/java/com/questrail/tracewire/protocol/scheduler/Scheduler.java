package com.questrail.tracewire.protocol.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scheduler
 * =============================================================================
 * Single-worker executor that decouples producers from transport I/O for one
 * asynchronous protocol.
 *
 * <h2>Threading Model</h2>
 * Producers call {@link #schedule(SchedulerCommand)}, which only mutates the
 * queue under a short-held lock and returns. One worker thread dequeues up to
 * {@value #BATCH_SIZE} commands at a time and runs them outside the lock, in
 * strict enqueue order.
 *
 * <h2>Queue budget</h2>
 * Write-packet commands are charged against {@code threshold} bytes. When a
 * new write does not fit:
 * <ul>
 *   <li>without throttling (or while the target is failed) the oldest queued
 *       writes are trimmed; if trimming cannot make room the new write is
 *       rejected and {@link #schedule} returns false</li>
 *   <li>with throttling the producer waits until the worker has drained
 *       enough</li>
 * </ul>
 * Connect, disconnect and dispatch commands are always accepted while the
 * scheduler runs.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   scheduler.start()          → starts the worker thread
 *   scheduler.schedule(...)    → enqueues a command
 *   scheduler.stop()           → worker drains the queue, then exits; blocks until it has
 * </pre>
 * If the target is failed once stopping has begun, the remaining commands are
 * abandoned.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final int BATCH_SIZE = 16;

    private final SchedulerTarget target;
    private final String threadName;
    private final long threshold;
    private final boolean throttle;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final SchedulerQueue queue = new SchedulerQueue();

    private boolean started;
    private volatile boolean stopped;
    private Thread worker;

    /**
     * @param target primitives the worker runs
     * @param threadName name of the worker thread
     * @param threshold queue budget in bytes
     * @param throttle block producers instead of trimming
     */
    public Scheduler(SchedulerTarget target, String threadName, long threshold, boolean throttle) {
        this.target = Objects.requireNonNull(target, "target");
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.threshold = threshold;
        this.throttle = throttle;
    }

    public long threshold() {
        return threshold;
    }

    public boolean throttle() {
        return throttle;
    }

    /**
     * Starts the worker thread. Idempotent.
     */
    public void start() {
        lock.lock();
        try {
            if (started) {
                return;
            }
            worker = new Thread(this::runWorker, threadName);
            worker.setDaemon(true);
            worker.start();
            started = true;
        } finally {
            lock.unlock();
        }
        log.debug("Scheduler {} started (threshold={} bytes, throttle={})", threadName, threshold, throttle);
    }

    /**
     * Stops accepting commands and blocks until the worker has run (or, if
     * the target failed, abandoned) everything still queued.
     */
    public void stop() {
        Thread toJoin;
        lock.lock();
        try {
            if (!started || stopped) {
                return;
            }
            stopped = true;
            changed.signalAll();
            toJoin = worker;
        } finally {
            lock.unlock();
        }

        if (toJoin != null && toJoin != Thread.currentThread()) {
            try {
                toJoin.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Scheduler {} stopped", threadName);
    }

    /**
     * Enqueues a command.
     *
     * @return false if the scheduler is not running or the command was
     *         rejected because the queue budget could not accommodate it
     */
    public boolean schedule(SchedulerCommand command) {
        Objects.requireNonNull(command, "command");
        boolean write = command.action() == SchedulerAction.WRITE_PACKET;
        long charge = SchedulerQueue.charge(command);

        lock.lock();
        try {
            if (!started || stopped) {
                return false;
            }
            if (write) {
                if (charge > threshold) {
                    return false;
                }
                if (!throttle || target.isFailed()) {
                    long excess = queue.size() + charge - threshold;
                    if (excess > 0 && !queue.trim(excess)) {
                        return false;
                    }
                } else {
                    while (queue.size() + charge > threshold) {
                        if (stopped) {
                            return false;
                        }
                        changed.await();
                    }
                }
            }
            queue.enqueue(command);
            changed.signalAll();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards every queued command.
     */
    public void clear() {
        lock.lock();
        try {
            queue.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.count();
        } finally {
            lock.unlock();
        }
    }

    public long queuedSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void runWorker() {
        List<SchedulerCommand> batch = new ArrayList<>(BATCH_SIZE);
        while (true) {
            dequeue(batch);
            if (batch.isEmpty()) {
                break;
            }
            if (!runCommands(batch)) {
                break;
            }
        }
        log.debug("Scheduler {} worker exiting", threadName);
    }

    private void dequeue(List<SchedulerCommand> batch) {
        batch.clear();
        lock.lock();
        try {
            while (queue.count() == 0 && !stopped) {
                changed.await();
            }
            SchedulerCommand command;
            while (batch.size() < BATCH_SIZE && (command = queue.dequeue()) != null) {
                batch.add(command);
            }
            changed.signalAll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    private boolean runCommands(List<SchedulerCommand> batch) {
        for (SchedulerCommand command : batch) {
            boolean wasStopped = stopped;
            run(command);
            if (wasStopped && target.isFailed()) {
                clear();
                return false;
            }
        }
        return true;
    }

    private void run(SchedulerCommand command) {
        try {
            switch (command.action()) {
                case CONNECT -> target.runConnect();
                case WRITE_PACKET -> target.runWritePacket(command.packet());
                case DISCONNECT -> target.runDisconnect();
                case DISPATCH -> target.runDispatch(command.protocolCommand());
            }
        } catch (RuntimeException e) {
            log.warn("Scheduler {} command {} failed", threadName, command.action(), e);
        }
    }
}
