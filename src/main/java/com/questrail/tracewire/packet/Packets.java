package com.questrail.tracewire.packet;

/**
 * Helpers shared by packet construction code.
 */
public final class Packets {

    /** Default background color of a log entry (white, alpha 0). */
    public static final int DEFAULT_COLOR = 0x00FFFFFF;

    private static final int PROCESS_ID = (int) ProcessHandle.current().pid();

    private Packets() {
    }

    public static int currentProcessId() {
        return PROCESS_ID;
    }

    public static int currentThreadId() {
        return (int) Thread.currentThread().getId();
    }

    static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    static byte[] copyOf(byte[] data) {
        return data == null ? new byte[0] : data.clone();
    }
}
