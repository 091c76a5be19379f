package io.avalonrest.server.spi;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Utility for enforcing maximum request body size while the body streams in.
 *
 * <p>The limit is enforced on the bytes actually read, so a missing or under-reported
 * {@code Content-Length} cannot be used to push more data than allowed.
 */
public final class BodySizeLimiter {

    private static final int BUFFER_SIZE = 8192;

    private BodySizeLimiter() {}

    /**
     * Wraps an input stream to enforce a maximum byte limit.
     *
     * @param delegate the underlying input stream
     * @param maxBytes maximum number of bytes allowed
     * @return a wrapped stream that throws {@link PayloadTooLargeException} if limit is exceeded
     */
    public static InputStream limit(InputStream delegate, long maxBytes) {
        if (delegate == null) return null;
        if (maxBytes <= 0) return delegate;
        if (maxBytes == Long.MAX_VALUE) return delegate;
        return new LimitedInputStream(delegate, maxBytes);
    }

    /**
     * Reads a whole body into memory, failing as soon as more than {@code maxBytes} arrived.
     *
     * @param body the body stream, may be null
     * @param maxBytes maximum number of bytes allowed; non-positive means unlimited
     * @return the body bytes, empty if {@code body} is null
     * @throws PayloadTooLargeException if the body is larger than {@code maxBytes}
     */
    public static byte[] readAll(InputStream body, long maxBytes) throws IOException {
        if (body == null) return new byte[0];
        InputStream in = limit(body, maxBytes);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[BUFFER_SIZE];
        int r;
        while ((r = in.read(buf)) >= 0) {
            out.write(buf, 0, r);
        }
        return out.toByteArray();
    }

    /**
     * Exception thrown when payload size exceeds the configured limit.
     */
    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;
        private final long bytesRead;

        public PayloadTooLargeException(long maxBytes, long bytesRead) {
            super("Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
            this.bytesRead = bytesRead;
        }

        public long maxBytes() {
            return maxBytes;
        }

        /**
         * Bytes read when the limit tripped (at least {@code maxBytes + 1}).
         */
        public long bytesRead() {
            return bytesRead;
        }
    }

    private static final class LimitedInputStream extends FilterInputStream {
        private final long maxBytes;
        private long bytesRead = 0;

        LimitedInputStream(InputStream in, long maxBytes) {
            super(in);
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            checkLimit();
            int b = super.read();
            if (b >= 0) {
                bytesRead++;
                checkLimit();
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            checkLimit();
            long remaining = maxBytes - bytesRead;
            int toRead = (int) Math.min(len, remaining + 1);
            int n = super.read(b, off, toRead);
            if (n > 0) {
                bytesRead += n;
                checkLimit();
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long remaining = maxBytes - bytesRead;
            long toSkip = Math.min(n, remaining + 1);
            long skipped = super.skip(toSkip);
            bytesRead += skipped;
            checkLimit();
            return skipped;
        }

        private void checkLimit() throws PayloadTooLargeException {
            if (bytesRead > maxBytes) {
                throw new PayloadTooLargeException(maxBytes, bytesRead);
            }
        }
    }
}
