package io.avalonrest.server.core.binding;

import io.avalonrest.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueConverterTest {

    enum Color { RED, GREEN }

    record Point(int x, int y) {}

    record Sku(String prefix, int number) {
        public static Sku parse(String s) {
            int dash = s.indexOf('-');
            return new Sku(s.substring(0, dash).toUpperCase(), Integer.parseInt(s.substring(dash + 1)));
        }
    }

    @SuppressWarnings("unused")
    private Optional<Integer> optionalInt;
    @SuppressWarnings("unused")
    private List<Integer> intList;

    private final ValueConverter converter = new ValueConverter(new JacksonJsonCodec());

    @Test
    void convertsScalars() {
        assertThat(converter.convert("42", int.class, int.class)).isEqualTo(42);
        assertThat(converter.convert(" 7 ", Long.class, Long.class)).isEqualTo(7L);
        assertThat(converter.convert("1", boolean.class, boolean.class)).isEqualTo(true);
        assertThat(converter.convert("FALSE", Boolean.class, Boolean.class)).isEqualTo(false);
        assertThat(converter.convert("12.50", BigDecimal.class, BigDecimal.class)).isEqualTo(new BigDecimal("12.50"));
        assertThat(converter.convert("green", Color.class, Color.class)).isEqualTo(Color.GREEN);
        assertThat(converter.convert("2024-02-29", LocalDate.class, LocalDate.class)).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(converter.convert("PT5M", Duration.class, Duration.class)).isEqualTo(Duration.ofMinutes(5));
        UUID id = UUID.randomUUID();
        assertThat(converter.convert(id.toString(), UUID.class, UUID.class)).isEqualTo(id);
    }

    @Test
    void blankIsNullForReferencesAndZeroForPrimitivesIsRejected() {
        assertThat(converter.convert("  ", Integer.class, Integer.class)).isNull();
        assertThatThrownBy(() -> converter.convert("  ", int.class, int.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void optionalWrapsInnerType() throws Exception {
        Type generic = getClass().getDeclaredField("optionalInt").getGenericType();
        assertThat(converter.convert("5", Optional.class, generic)).isEqualTo(Optional.of(5));
        assertThat(converter.convert("", Optional.class, generic)).isEqualTo(Optional.empty());
    }

    @Test
    void jsonLookingValuesBindAsStructures() throws Exception {
        assertThat(converter.convert("{\"x\":1,\"y\":2}", Point.class, Point.class)).isEqualTo(new Point(1, 2));
        Type listType = getClass().getDeclaredField("intList").getGenericType();
        assertThat(listType).isInstanceOf(ParameterizedType.class);
        assertThat(converter.convert("[1,2,3]", List.class, listType)).isEqualTo(List.of(1, 2, 3));
    }

    @Test
    void fallsBackToStaticFactory() {
        assertThat(converter.convert("ab-12", Sku.class, Sku.class)).isEqualTo(new Sku("AB", 12));
    }

    @Test
    void failuresAreIllegalArgument() {
        assertThatThrownBy(() -> converter.convert("abc", int.class, int.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert("purple", Color.class, Color.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> converter.convert("{broken}", Point.class, Point.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroValues() {
        assertThat(ValueConverter.zeroValue(int.class)).isEqualTo(0);
        assertThat(ValueConverter.zeroValue(boolean.class)).isEqualTo(false);
        assertThat(ValueConverter.zeroValue(String.class)).isNull();
        assertThat(ValueConverter.zeroValue(Optional.class)).isEqualTo(Optional.empty());
    }
}
