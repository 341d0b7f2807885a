package com.z254.secretsync.core.vault;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a response body into memory up to a hard ceiling.
 */
final class BoundedBodyReader {

    static final int MAX_RESPONSE_BYTES = 10 * 1024 * 1024;

    private BoundedBodyReader() {
    }

    /**
     * @throws SecretProtocolException as soon as more than {@code maxBytes} are seen
     */
    static byte[] read(InputStream body, int maxBytes) throws IOException {
        if (body == null) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxBytes, 8192));
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                throw new SecretProtocolException("response body exceeds maximum size of " + maxBytes + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
}
