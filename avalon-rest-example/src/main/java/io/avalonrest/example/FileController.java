package io.avalonrest.example;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ControllerBase;
import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.DefaultValue;
import io.avalonrest.server.core.annotation.FromQuery;
import io.avalonrest.server.core.annotation.Route;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Controller
public class FileController extends ControllerBase {

    private final FileStore files;

    FileController(FileStore files) {
        this.files = files;
    }

    @Route
    public List<String> list() throws IOException {
        return files.list();
    }

    @Route(path = "{name}")
    public ActionResult download(String name, @FromQuery @DefaultValue("false") boolean inline) throws IOException {
        Path path = files.find(name).orElseThrow(() -> new AvalonRestException.NotFound("File not found: " + name));
        String contentType = Files.probeContentType(path);
        if (contentType == null) contentType = "application/octet-stream";
        return stream(Files.newInputStream(path), contentType, path.getFileName().toString(), !inline);
    }
}
