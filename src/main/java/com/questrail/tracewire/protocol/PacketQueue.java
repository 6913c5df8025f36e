package com.questrail.tracewire.protocol;

import com.questrail.tracewire.packet.Packet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO of packets bounded by a byte budget ({@code backlog}).
 *
 * <p>Every packet is charged {@code packet.size() + OVERHEAD}. When a push
 * exceeds the budget the oldest packets are discarded until it fits again,
 * so a single packet larger than the budget is discarded right away.</p>
 *
 * <p>Thread safe: the asynchronous worker pushes and pops while other threads
 * read {@link #snapshot()} and {@link #count()}.</p>
 */
public final class PacketQueue {

    public static final int OVERHEAD = 24;

    private final Deque<Packet> packets = new ArrayDeque<>();
    private long backlog;
    private long size;

    public PacketQueue(long backlog) {
        this.backlog = backlog;
    }

    public synchronized long backlog() {
        return backlog;
    }

    public synchronized void setBacklog(long backlog) {
        this.backlog = backlog;
        resize();
    }

    public synchronized void push(Packet packet) {
        packets.addLast(packet);
        size += packet.size() + OVERHEAD;
        resize();
    }

    /**
     * @return the oldest packet, or {@code null} if empty
     */
    public synchronized Packet pop() {
        Packet packet = packets.pollFirst();
        if (packet != null) {
            size -= packet.size() + OVERHEAD;
        }
        return packet;
    }

    /** Oldest first, without removing. */
    public synchronized List<Packet> snapshot() {
        return new ArrayList<>(packets);
    }

    public synchronized void clear() {
        packets.clear();
        size = 0;
    }

    public synchronized int count() {
        return packets.size();
    }

    public synchronized long size() {
        return size;
    }

    private void resize() {
        while (size > backlog && !packets.isEmpty()) {
            pop();
        }
    }
}
