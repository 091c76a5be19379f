package io.avalonrest.server.core;

import java.io.InputStream;

/**
 * Host-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Stream {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * Body copied from {@code input} by the host, which closes it afterwards.
     *
     * @param length exact length, or {@code -1} when unknown (chunked)
     */
    record Stream(InputStream input, long length) implements ResponseBody {}
}
