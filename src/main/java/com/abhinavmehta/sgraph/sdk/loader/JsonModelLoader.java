package com.abhinavmehta.sgraph.sdk.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads a model document in JSON form:
 * <pre>
 * {
 *   "root": {"name": "P", "type": "repository", "attributes": {...},
 *            "children": [{"name": "a", "type": "file", "children": [...]}]},
 *   "associations": [{"from": "/P/a/Foo", "to": "/P/b/Bar", "type": "call", "attributes": {...}}]
 * }
 * </pre>
 * Plain {@code .json}, gzip-compressed {@code .gz}, and {@code .zip} archives (first {@code .json}
 * entry) are supported.
 */
public class JsonModelLoader implements ModelLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonModelLoader.class);

    private final ObjectMapper objectMapper;

    public JsonModelLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ModelDefinition load(String sourceRef) throws IOException {
        Path path = Paths.get(sourceRef);
        if (!Files.exists(path)) {
            throw new NoSuchFileException(sourceRef, null, "Model file does not exist");
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new IOException("Model file is not a readable file: " + sourceRef);
        }
        long fileSize = Files.size(path);
        log.info("Reading model file {} ({} MB)", sourceRef, String.format(Locale.ROOT, "%.1f", fileSize / (1024.0 * 1024.0)));

        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            if (fileName.endsWith(".zip")) {
                return readFromZip(in, sourceRef);
            }
            if (fileName.endsWith(".gz")) {
                try (InputStream gz = new GZIPInputStream(in)) {
                    return objectMapper.readValue(gz, ModelDefinition.class);
                }
            }
            return objectMapper.readValue(in, ModelDefinition.class);
        }
    }

    private ModelDefinition readFromZip(InputStream in, String sourceRef) throws IOException {
        ZipInputStream zip = new ZipInputStream(in);
        ZipEntry entry;
        while ((entry = zip.getNextEntry()) != null) {
            if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".json")) {
                log.debug("Reading model entry {} from archive {}", entry.getName(), sourceRef);
                return objectMapper.readValue(zip, ModelDefinition.class);
            }
        }
        throw new FileNotFoundException("No .json model entry in archive: " + sourceRef);
    }
}
