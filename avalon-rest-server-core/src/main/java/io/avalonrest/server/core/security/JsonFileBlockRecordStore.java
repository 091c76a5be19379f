package io.avalonrest.server.core.security;

import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonException;
import io.avalonrest.server.spi.BlockRecordStore;
import io.avalonrest.server.spi.BlockedIpRecord;

import java.io.IOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link BlockRecordStore} persisting a JSON array of records to a file.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so readers never see
 * a half-written file.
 */
public final class JsonFileBlockRecordStore implements BlockRecordStore {

    private static final Type RECORD_LIST = new ParameterizedType() {
        @Override
        public Type[] getActualTypeArguments() {
            return new Type[]{BlockedIpRecord.class};
        }

        @Override
        public Type getRawType() {
            return List.class;
        }

        @Override
        public Type getOwnerType() {
            return null;
        }
    };

    private final Path file;
    private final JsonCodec codec;

    public JsonFileBlockRecordStore(Path file, JsonCodec codec) {
        this.file = Objects.requireNonNull(file, "file");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Path file() {
        return file;
    }

    @Override
    public List<BlockedIpRecord> load() throws IOException {
        if (!Files.exists(file)) return List.of();
        byte[] data = Files.readAllBytes(file);
        if (data.length == 0) return List.of();
        try {
            List<BlockedIpRecord> records = codec.readValue(data, RECORD_LIST);
            return records == null ? List.of() : records;
        } catch (JsonException e) {
            throw new IOException("Cannot read block records from " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void save(Collection<BlockedIpRecord> records) throws IOException {
        byte[] data;
        try {
            data = codec.writeBytes(new ArrayList<>(records));
        } catch (JsonException e) {
            throw new IOException("Cannot serialize block records", e);
        }
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
