package io.avalonrest.server.core.binding;

import io.avalonrest.server.core.multipart.FormFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Checks an upload against {@link FileValidationOptions}.
 *
 * <p>Content checks look at the first 512 bytes: Windows PE and ELF executables are errors,
 * while a signature that does not fit the declared extension (pdf, jpg, png, gif) is only a warning.
 */
public final class FileValidator {

    private static final int SNIFF_LENGTH = 512;

    private final FileValidationOptions options;

    public FileValidator(FileValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public Result validate(FormFile file) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (file.size() > options.maxFileSize()) {
            errors.add(String.format(Locale.ROOT, "File size (%.2fMB) exceeds maximum allowed size (%.2fMB)",
                    file.size() / 1024.0 / 1024.0, options.maxFileSize() / 1024.0 / 1024.0));
        }

        String extension = file.extension();
        if (options.prohibitedExtensions().contains(extension)) {
            errors.add("File extension '" + extension + "' is not allowed for security reasons");
        }
        if (!options.allowedExtensions().isEmpty() && !options.allowedExtensions().contains(extension)) {
            errors.add("File extension '" + extension + "' is not allowed. Allowed extensions: "
                    + String.join(", ", options.allowedExtensions()));
        }
        if (!options.allowedMimeTypes().isEmpty() && !options.allowedMimeTypes().contains(file.contentType())) {
            errors.add("File type '" + file.contentType() + "' is not allowed. Allowed types: "
                    + String.join(", ", options.allowedMimeTypes()));
        }

        if (options.validateContent()) {
            byte[] bytes = file.bytes();
            byte[] head = bytes.length > SNIFF_LENGTH ? java.util.Arrays.copyOf(bytes, SNIFF_LENGTH) : bytes;
            if (isExecutable(head)) {
                errors.add("File appears to be an executable and is not allowed");
            }
            if (!signatureMatches(extension, head)) {
                warnings.add("File content may not match the declared file type");
            }
        }
        return new Result(errors, warnings);
    }

    static boolean isExecutable(byte[] b) {
        if (b.length < 4) return false;
        if (b[0] == 0x4D && b[1] == 0x5A) return true; // MZ
        return b[0] == 0x7F && b[1] == 0x45 && b[2] == 0x4C && b[3] == 0x46; // \x7FELF
    }

    static boolean signatureMatches(String extension, byte[] b) {
        switch (extension) {
            case ".pdf":
                return b.length >= 4 && b[0] == 0x25 && b[1] == 0x50 && b[2] == 0x44 && b[3] == 0x46;
            case ".jpg":
            case ".jpeg":
                return b.length >= 2 && (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xD8;
            case ".png":
                return b.length >= 8 && (b[0] & 0xFF) == 0x89 && b[1] == 0x50 && b[2] == 0x4E && b[3] == 0x47;
            case ".gif":
                return b.length >= 6 && b[0] == 0x47 && b[1] == 0x49 && b[2] == 0x46;
            default:
                return true;
        }
    }

    /**
     * Outcome of a validation; valid when there are no errors.
     */
    public record Result(List<String> errors, List<String> warnings) {
        public Result {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }
}
