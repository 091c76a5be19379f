package io.avalonrest.example;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Flat directory of uploaded files. Names are reduced to a safe lowercase form before use.
 */
final class FileStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileStore.class);

    private final Path root;

    FileStore(Path root) throws IOException {
        this.root = Files.createDirectories(root).toAbsolutePath().normalize();
    }

    static String safeName(String fileName) {
        if (fileName == null) return "";
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        return base.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "_").replaceAll("^\\.+", "");
    }

    Path save(String fileName, InputStream content) throws IOException {
        Path target = resolve(fileName).orElseThrow(() -> new IOException("Invalid file name: " + fileName));
        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Stored {} ({} bytes)", target.getFileName(), Files.size(target));
        return target;
    }

    Optional<Path> find(String fileName) {
        return resolve(fileName).filter(Files::isRegularFile);
    }

    List<String> list() throws IOException {
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(root)) {
            files.filter(Files::isRegularFile).forEach(p -> names.add(p.getFileName().toString()));
        }
        names.sort(String::compareTo);
        return names;
    }

    private Optional<Path> resolve(String fileName) {
        String safe = safeName(fileName);
        if (safe.isEmpty()) return Optional.empty();
        Path p = root.resolve(safe).normalize();
        return p.startsWith(root) ? Optional.of(p) : Optional.empty();
    }
}
