package com.questrail.tracewire.protocol.scheduler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * SchedulerQueue
 * -----------------------------------------------------------------------------
 * FIFO of {@link SchedulerCommand}s with byte accounting.
 *
 * <h2>Accounting</h2>
 * {@code count} is the number of queued commands and {@code size} the sum of
 * {@code command.size() + OVERHEAD} over them; both are exact after every
 * operation.
 *
 * <h2>Trim</h2>
 * {@link #trim(long)} frees space by discarding the oldest
 * {@link SchedulerAction#WRITE_PACKET} commands. Connect, disconnect and
 * dispatch commands are never discarded. Trimming is all-or-nothing.
 *
 * <p>Not thread safe; {@link Scheduler} guards it with its lock.</p>
 */
public final class SchedulerQueue {

    public static final int OVERHEAD = 24;

    private final Deque<SchedulerCommand> commands = new ArrayDeque<>();
    private long size;

    public void enqueue(SchedulerCommand command) {
        commands.addLast(command);
        size += charge(command);
    }

    /**
     * @return the oldest command, or {@code null} if empty
     */
    public SchedulerCommand dequeue() {
        SchedulerCommand command = commands.pollFirst();
        if (command != null) {
            size -= charge(command);
        }
        return command;
    }

    public void clear() {
        commands.clear();
        size = 0;
    }

    /**
     * Discards the oldest write-packet commands until at least
     * {@code requiredBytes} are freed.
     *
     * @return true if enough space was freed (or none was required); false if
     *         all eligible commands together cannot free it, in which case
     *         the queue is left unchanged
     */
    public boolean trim(long requiredBytes) {
        if (requiredBytes <= 0) {
            return true;
        }

        long available = 0;
        for (SchedulerCommand command : commands) {
            if (command.action() == SchedulerAction.WRITE_PACKET) {
                available += charge(command);
            }
        }
        if (available < requiredBytes) {
            return false;
        }

        long removed = 0;
        Iterator<SchedulerCommand> it = commands.iterator();
        while (it.hasNext() && removed < requiredBytes) {
            SchedulerCommand command = it.next();
            if (command.action() == SchedulerAction.WRITE_PACKET) {
                long charge = charge(command);
                it.remove();
                size -= charge;
                removed += charge;
            }
        }
        return true;
    }

    public int count() {
        return commands.size();
    }

    public long size() {
        return size;
    }

    static long charge(SchedulerCommand command) {
        return command.size() + (long) OVERHEAD;
    }
}
