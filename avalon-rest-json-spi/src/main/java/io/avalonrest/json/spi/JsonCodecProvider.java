package io.avalonrest.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    /**
     * Returns a ready-to-use codec.
     */
    JsonCodec codec();

    /**
     * Priority when several providers are on the class path; higher wins.
     */
    default int priority() {
        return 0;
    }
}
