package com.questrail.tracewire.codec;

import java.nio.charset.StandardCharsets;

/**
 * Eye-catchers written once at the start of a fresh stream.
 */
public final class StreamHeaders {

    /** Plain binary log stream. */
    private static final byte[] SILF = "SILF".getBytes(StandardCharsets.US_ASCII);

    /** Encrypted binary log stream; followed by a 16 byte IV. */
    private static final byte[] SILE = "SILE".getBytes(StandardCharsets.US_ASCII);

    /** UTF-8 byte order mark that starts text logs. */
    private static final byte[] UTF8_BOM = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };

    private StreamHeaders() {
    }

    public static byte[] silf() {
        return SILF.clone();
    }

    public static byte[] sile() {
        return SILE.clone();
    }

    public static byte[] utf8Bom() {
        return UTF8_BOM.clone();
    }
}
