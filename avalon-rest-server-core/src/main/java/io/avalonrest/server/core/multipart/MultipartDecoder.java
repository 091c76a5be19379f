package io.avalonrest.server.core.multipart;

import io.avalonrest.core.AvalonRestException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Binary-safe {@code multipart/form-data} decoder.
 *
 * <p>The body is scanned as bytes for boundary delimiters; file payloads are never decoded
 * as text. Field names are looked up case-insensitively and a repeated name keeps the last part.
 */
public final class MultipartDecoder {

    private static final byte[] CRLF_CRLF = {'\r', '\n', '\r', '\n'};
    private static final byte[] LF_LF = {'\n', '\n'};

    private MultipartDecoder() {}

    /**
     * Decodes a multipart body.
     *
     * @param body raw request body
     * @param contentType the request {@code Content-Type}, carrying the boundary parameter
     * @return fields by name
     * @throws AvalonRestException.BadInput if the boundary is missing or never appears in the body
     */
    public static Map<String, FormField> parse(byte[] body, String contentType) {
        String boundary = boundary(contentType);
        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        Map<String, FormField> fields = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (body == null || body.length == 0) return Map.of();

        int start = indexOf(body, delimiter, 0);
        if (start < 0) {
            throw new AvalonRestException.BadInput("Multipart body does not contain the declared boundary");
        }
        int pos = start + delimiter.length;
        while (pos < body.length) {
            if (startsWith(body, pos, (byte) '-', (byte) '-')) break; // terminal delimiter
            pos = skipLineEnd(body, pos);

            int next = indexOf(body, delimiter, pos);
            int end = next < 0 ? body.length : next;
            FormField field = parsePart(body, pos, trimLineEnd(body, pos, end));
            if (field != null) {
                fields.put(field.name(), field);
            }
            if (next < 0) break;
            pos = next + delimiter.length;
        }
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Extracts the boundary parameter, quoted or bare.
     *
     * @throws AvalonRestException.BadInput if there is none
     */
    public static String boundary(String contentType) {
        if (contentType != null) {
            int idx = contentType.toLowerCase(Locale.ROOT).indexOf("boundary=");
            if (idx >= 0) {
                String rest = contentType.substring(idx + "boundary=".length()).trim();
                String value;
                if (rest.startsWith("\"")) {
                    int close = rest.indexOf('"', 1);
                    value = close < 0 ? rest.substring(1) : rest.substring(1, close);
                } else {
                    int stop = rest.length();
                    for (int i = 0; i < rest.length(); i++) {
                        char c = rest.charAt(i);
                        if (c == ';' || c == ',' || Character.isWhitespace(c)) {
                            stop = i;
                            break;
                        }
                    }
                    value = rest.substring(0, stop);
                }
                if (!value.isEmpty()) return value;
            }
        }
        throw new AvalonRestException.BadInput("Multipart request is missing the boundary parameter");
    }

    private static FormField parsePart(byte[] body, int from, int to) {
        int headerEnd = indexOf(body, CRLF_CRLF, from, to);
        int separatorLength = CRLF_CRLF.length;
        int lfEnd = indexOf(body, LF_LF, from, to);
        if (lfEnd >= 0 && (headerEnd < 0 || lfEnd < headerEnd)) {
            headerEnd = lfEnd;
            separatorLength = LF_LF.length;
        }
        int dataStart;
        if (headerEnd < 0) {
            headerEnd = to;
            dataStart = to;
        } else {
            dataStart = headerEnd + separatorLength;
        }

        String headerBlock = new String(body, from, headerEnd - from, StandardCharsets.UTF_8);
        String name = null;
        String fileName = null;
        String partType = null;
        for (String line : headerBlock.split("\r?\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String header = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if (header.equalsIgnoreCase("Content-Disposition")) {
                name = dispositionParam(value, "name");
                fileName = dispositionParam(value, "filename");
            } else if (header.equalsIgnoreCase("Content-Type")) {
                partType = value;
            }
        }
        if (name == null || name.isEmpty()) return null;

        if (fileName != null && !fileName.isEmpty()) {
            return FormField.file(name, fileName, partType, Arrays.copyOfRange(body, dataStart, to));
        }
        return new FormField(name, new String(body, dataStart, to - dataStart, StandardCharsets.UTF_8), null, partType, null);
    }

    static String dispositionParam(String disposition, String param) {
        for (String piece : disposition.split(";")) {
            String p = piece.trim();
            int eq = p.indexOf('=');
            if (eq < 0) continue;
            if (!p.substring(0, eq).trim().equalsIgnoreCase(param)) continue;
            String v = p.substring(eq + 1).trim();
            if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
                v = v.substring(1, v.length() - 1);
            }
            return v;
        }
        return null;
    }

    private static int skipLineEnd(byte[] b, int pos) {
        while (pos < b.length && (b[pos] == ' ' || b[pos] == '\t')) pos++;
        if (startsWith(b, pos, (byte) '\r', (byte) '\n')) return pos + 2;
        if (pos < b.length && b[pos] == '\n') return pos + 1;
        return pos;
    }

    private static int trimLineEnd(byte[] b, int from, int end) {
        if (end - from >= 2 && b[end - 2] == '\r' && b[end - 1] == '\n') return end - 2;
        if (end - from >= 1 && b[end - 1] == '\n') return end - 1;
        return end;
    }

    private static boolean startsWith(byte[] b, int pos, byte first, byte second) {
        return pos + 1 < b.length && b[pos] == first && b[pos + 1] == second;
    }

    static int indexOf(byte[] haystack, byte[] needle, int from) {
        return indexOf(haystack, needle, from, haystack.length);
    }

    static int indexOf(byte[] haystack, byte[] needle, int from, int to) {
        outer:
        for (int i = Math.max(from, 0); i <= to - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
