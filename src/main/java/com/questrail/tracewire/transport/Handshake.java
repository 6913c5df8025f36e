package com.questrail.tracewire.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Console handshake lines shared by the socket-like transports.
 */
public final class Handshake {

    public static final String LIBRARY_VERSION = "1.0.0";

    private Handshake() {
    }

    /**
     * Line the client sends after receiving the server banner.
     */
    public static byte[] clientBanner(String protocolName) {
        return ("Tracewire Java Library v" + LIBRARY_VERSION + " (" + protocolName + ")\r\n")
            .getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Reads bytes up to and including {@code '\n'}.
     *
     * @return the line without its line terminator
     * @throws IOException if the stream ends first
     */
    public static String readLine(StreamEndpoint endpoint) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        byte[] one = new byte[1];
        while (true) {
            int n = endpoint.read(one, 0, 1);
            if (n < 0) {
                throw new IOException("Could not read server banner correctly: connection has been closed unexpectedly");
            }
            if (n == 0) {
                continue;
            }
            if (one[0] == '\n') {
                break;
            }
            bytes.write(one[0]);
        }
        String line = bytes.toString(StandardCharsets.UTF_8);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws IOException if the stream ends first
     */
    public static byte[] readExactly(StreamEndpoint endpoint, int length) throws IOException {
        byte[] buffer = new byte[length];
        int read = 0;
        while (read < length) {
            int n = endpoint.read(buffer, read, length - read);
            if (n < 0) {
                throw new IOException("Could not read server answer correctly: connection has been closed unexpectedly");
            }
            read += n;
        }
        return buffer;
    }
}
