package com.questrail.tracewire.transport.pipe;

import com.questrail.tracewire.transport.StreamEndpoint;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.Locale;

/**
 * {@link StreamEndpoint} over a Windows named pipe ({@code \\.\pipe\<name>}),
 * opened as a read/write file.
 */
public final class NamedPipeStreamEndpoint implements StreamEndpoint {

    private final RandomAccessFile pipe;
    private volatile boolean open = true;

    private NamedPipeStreamEndpoint(RandomAccessFile pipe) {
        this.pipe = pipe;
    }

    /**
     * @throws IOException if the platform is not Windows or the pipe cannot
     *         be opened (no console listening)
     */
    public static NamedPipeStreamEndpoint open(String pipeName) throws IOException {
        String os = System.getProperty("os.name", "");
        if (!os.toLowerCase(Locale.ROOT).startsWith("windows")) {
            throw new IOException("The pipe protocol is only available on Windows; use tcp on " + os);
        }
        return new NamedPipeStreamEndpoint(new RandomAccessFile(pipePath(pipeName), "rw"));
    }

    static String pipePath(String pipeName) {
        return "\\\\.\\pipe\\" + pipeName;
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        pipe.write(bytes, offset, length);
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        return pipe.read(buffer, offset, length);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        open = false;
        pipe.close();
    }
}
