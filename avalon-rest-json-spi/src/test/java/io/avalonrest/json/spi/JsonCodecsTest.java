package io.avalonrest.json.spi;

import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecsTest {

    @Test
    void loadPicksHighestPriorityProvider() {
        JsonCodec codec = JsonCodecs.load(JsonCodecsTest.class.getClassLoader());
        assertThat(codec).isSameAs(StubProviders.High.CODEC);
    }

    @Test
    void loadFailsWithoutProvider() {
        ClassLoader empty = new URLClassLoader(new URL[0], null);
        assertThatThrownBy(() -> JsonCodecs.load(empty))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("JsonCodecProvider");
    }
}
