package io.avalonrest.example;

import io.avalonrest.core.HttpMethod;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ControllerBase;
import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.FileValidation;
import io.avalonrest.server.core.annotation.FromFile;
import io.avalonrest.server.core.annotation.FromForm;
import io.avalonrest.server.core.annotation.Route;
import io.avalonrest.server.core.multipart.FormFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Controller
public class UploadController extends ControllerBase {

    private final FileStore files;

    UploadController(FileStore files) {
        this.files = files;
    }

    @Route(method = HttpMethod.POST)
    public ActionResult upload(
            @FromFile @FileValidation(maxFileSize = 5L * 1024 * 1024,
                    allowedExtensions = {".txt", ".csv", ".json", ".png", ".jpg", ".jpeg", ".pdf"}) FormFile file,
            @FromForm Optional<String> description) throws IOException {
        Path stored;
        try (InputStream in = file.openStream()) {
            stored = files.save(file.fileName(), in);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("fileName", stored.getFileName().toString());
        out.put("size", file.size());
        out.put("contentType", file.contentType());
        out.put("description", description.orElse(""));
        return created(out);
    }
}
