package com.questrail.tracewire.transport.file;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * AesCbcOutputStream
 * -----------------------------------------------------------------------------
 * Encrypts everything written to it with AES-128 in CBC mode.
 *
 * <p>Plaintext is collected in a 16 byte block buffer; each full block is
 * encrypted and passed on immediately. {@link #close()} PKCS#7-pads the
 * final block (a whole padding block when the data is block aligned),
 * encrypts it and closes the underlying stream. {@link #flush()} flushes
 * only the complete blocks already passed on.</p>
 */
public final class AesCbcOutputStream extends FilterOutputStream
{
    public static final int BLOCK_SIZE = 16;
    public static final int KEY_SIZE = 16;

    private final Cipher cipher;
    private final byte[] block = new byte[BLOCK_SIZE];
    private int blockPos;
    private boolean closed;

    public AesCbcOutputStream(OutputStream out, byte[] key, byte[] iv) throws GeneralSecurityException
    {
        super(Objects.requireNonNull(out, "out"));
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(iv, "iv");
        if (key.length != KEY_SIZE) {
            throw new IllegalArgumentException("AES-128 key must be " + KEY_SIZE + " bytes");
        }
        if (iv.length != BLOCK_SIZE) {
            throw new IllegalArgumentException("IV must be " + BLOCK_SIZE + " bytes");
        }
        this.cipher = Cipher.getInstance("AES/CBC/NoPadding");
        this.cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
    }

    @Override
    public void write(int b) throws IOException
    {
        ensureOpen();
        block[blockPos++] = (byte) b;
        if (blockPos == BLOCK_SIZE) {
            encryptBlock();
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException
    {
        Objects.checkFromIndexSize(off, len, b.length);
        ensureOpen();
        while (len > 0) {
            int n = Math.min(len, BLOCK_SIZE - blockPos);
            System.arraycopy(b, off, block, blockPos, n);
            blockPos += n;
            off += n;
            len -= n;
            if (blockPos == BLOCK_SIZE) {
                encryptBlock();
            }
        }
    }

    @Override
    public void close() throws IOException
    {
        if (closed) {
            return;
        }
        closed = true;
        try {
            byte pad = (byte) (BLOCK_SIZE - blockPos);
            while (blockPos < BLOCK_SIZE) {
                block[blockPos++] = pad;
            }
            encryptBlock();
            out.flush();
        } finally {
            out.close();
        }
    }

    private void encryptBlock() throws IOException
    {
        byte[] encrypted = cipher.update(block, 0, BLOCK_SIZE);
        if (encrypted != null) {
            out.write(encrypted);
        }
        blockPos = 0;
    }

    private void ensureOpen() throws IOException
    {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }
}
