package io.avalonrest.server.core.multipart;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * An uploaded file, held in memory.
 */
public interface FormFile {

    /** Form field name. */
    String name();

    /** Client-supplied file name. */
    String fileName();

    /** Declared content type, {@code application/octet-stream} when the part had none. */
    String contentType();

    /** File content; never null. */
    byte[] bytes();

    default long size() {
        return bytes().length;
    }

    default InputStream openStream() {
        return new ByteArrayInputStream(bytes());
    }

    default void transferTo(OutputStream target) throws IOException {
        target.write(bytes());
    }

    /**
     * Lowercased extension of {@link #fileName()} including the dot, or empty.
     */
    default String extension() {
        String fn = fileName();
        if (fn == null) return "";
        int slash = Math.max(fn.lastIndexOf('/'), fn.lastIndexOf('\\'));
        int dot = fn.lastIndexOf('.');
        if (dot <= slash) return "";
        return fn.substring(dot).toLowerCase(java.util.Locale.ROOT);
    }
}
