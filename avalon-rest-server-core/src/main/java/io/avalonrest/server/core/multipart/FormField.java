package io.avalonrest.server.core.multipart;

/**
 * A decoded form part. A part is a file exactly when it carried a non-empty file name.
 *
 * @param name field name
 * @param value UTF-8 text of a non-file part; empty for files
 * @param fileName client file name, or null
 * @param contentType the part's {@code Content-Type}, or null
 * @param data raw bytes of a file part; empty for text parts
 */
public record FormField(String name, String value, String fileName, String contentType, byte[] data) implements FormFile {

    private static final byte[] NO_DATA = new byte[0];

    public FormField {
        value = value == null ? "" : value;
        data = data == null ? NO_DATA : data;
    }

    public static FormField text(String name, String value) {
        return new FormField(name, value, null, null, null);
    }

    public static FormField file(String name, String fileName, String contentType, byte[] data) {
        return new FormField(name, "", fileName, contentType, data);
    }

    public boolean isFile() {
        return fileName != null && !fileName.isEmpty();
    }

    @Override
    public String contentType() {
        if (contentType == null && isFile()) return "application/octet-stream";
        return contentType;
    }

    @Override
    public byte[] bytes() {
        return data;
    }
}
