package io.avalonrest.json.spi;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    /**
     * Loads the highest-priority codec visible to the context class loader.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        JsonCodecProvider best = null;
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            if (best == null || p.priority() > best.priority()) {
                best = p;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No " + JsonCodecProvider.class.getName() + " registered");
        }
        return best.codec();
    }
}
